package com.shop.stockkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record SalesReportRow(
        Long saleId,
        String itemName,
        String username,
        Integer quantity,
        BigDecimal total,
        LocalDateTime createdAt) {
}
