package com.shop.stockkeeper.dto;

/**
 * {@code shopId == null} clears the selection.
 */
public record ShopSelectionRequest(Long shopId) {
}
