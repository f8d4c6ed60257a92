package com.shop.stockkeeper.dto;

public record LoginRequest(String username, String password) {
}
