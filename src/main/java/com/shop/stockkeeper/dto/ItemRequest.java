package com.shop.stockkeeper.dto;

import java.math.BigDecimal;

public record ItemRequest(String name, BigDecimal price, Integer quantity) {
}
