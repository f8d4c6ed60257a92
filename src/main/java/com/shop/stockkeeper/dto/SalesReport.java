package com.shop.stockkeeper.dto;

import java.math.BigDecimal;
import java.util.List;

public record SalesReport(
        Long shopId,
        List<SalesReportRow> rows,
        long saleCount,
        BigDecimal revenue) {

    public static SalesReport empty() {
        return new SalesReport(null, List.of(), 0, BigDecimal.ZERO);
    }
}
