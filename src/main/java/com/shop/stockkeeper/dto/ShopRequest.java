package com.shop.stockkeeper.dto;

public record ShopRequest(String name) {
}
