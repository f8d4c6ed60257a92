package com.shop.stockkeeper.dto;

import com.shop.stockkeeper.model.UserRole;

/**
 * The caller's session as seen over HTTP. {@code shopId} is null until a shop
 * is selected.
 */
public record SessionView(Long userId, String username, UserRole role, Long shopId) {
}
