package com.shop.stockkeeper.dto;

import com.shop.stockkeeper.model.Item;

import java.math.BigDecimal;

public record ItemView(Long id, Long shopId, String name, BigDecimal price, Integer quantity) {

    public static ItemView of(Item item) {
        return new ItemView(item.getId(), item.getShop().getId(), item.getName(), item.getPrice(),
                item.getQuantity());
    }
}
