package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.dto.SalesReport;
import com.shop.stockkeeper.security.SessionContext;
import com.shop.stockkeeper.service.ReportService;
import com.shop.stockkeeper.service.SaleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sales")
public class SaleController {

    private final SaleService saleService;
    private final ReportService reportService;

    public SaleController(SaleService saleService, ReportService reportService) {
        this.saleService = saleService;
        this.reportService = reportService;
    }

    // Parameters stay text so malformed input is refused with a message, not a 400.
    @PostMapping
    public ResponseEntity<OperationResult> sell(@RequestParam(required = false) String itemId,
            @RequestParam(required = false) String quantity, SessionContext context) {
        return ApiResponses.created(saleService.sell(context, itemId, quantity));
    }

    @GetMapping("/report")
    public SalesReport report(SessionContext context) {
        return reportService.salesReport(context);
    }
}
