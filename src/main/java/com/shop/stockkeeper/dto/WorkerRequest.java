package com.shop.stockkeeper.dto;

public record WorkerRequest(String username, String password) {
}
