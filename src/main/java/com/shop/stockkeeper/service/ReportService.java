package com.shop.stockkeeper.service;

import com.shop.stockkeeper.dto.SalesReport;
import com.shop.stockkeeper.dto.SalesReportRow;
import com.shop.stockkeeper.repository.SaleRepository;
import com.shop.stockkeeper.security.SessionContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
public class ReportService {

    private final SaleRepository saleRepository;

    public ReportService(SaleRepository saleRepository) {
        this.saleRepository = saleRepository;
    }

    /**
     * Sales of the selected shop, newest first, with item and seller names.
     */
    @Transactional(readOnly = true)
    public SalesReport salesReport(SessionContext context) {
        if (!context.hasShop()) {
            return SalesReport.empty();
        }
        List<SalesReportRow> rows = saleRepository.findReportRowsByShopId(context.shopId());
        BigDecimal revenue = rows.stream()
                .map(SalesReportRow::total)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new SalesReport(context.shopId(), rows, rows.size(), revenue);
    }
}
