package com.shop.stockkeeper.service;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.dto.SalesReport;
import com.shop.stockkeeper.model.Item;
import com.shop.stockkeeper.model.Shop;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.repository.ItemRepository;
import com.shop.stockkeeper.repository.SaleRepository;
import com.shop.stockkeeper.repository.ShopRepository;
import com.shop.stockkeeper.repository.UserRepository;
import com.shop.stockkeeper.security.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sales against the real store, committed the way production commits them.
 */
@SpringBootTest
class SaleFlowTest {

    @Autowired
    private SaleService saleService;
    @Autowired
    private ReportService reportService;
    @Autowired
    private InventoryService inventoryService;
    @Autowired
    private ShopRepository shopRepository;
    @Autowired
    private ItemRepository itemRepository;
    @Autowired
    private SaleRepository saleRepository;
    @Autowired
    private UserRepository userRepository;

    private Shop shop;
    private SessionContext context;

    @BeforeEach
    void setUp() {
        shop = shopRepository.save(new Shop("Flow " + UUID.randomUUID()));
        User admin = userRepository.findByUsername("admin").orElseThrow();
        context = new SessionContext(admin.getId(), shop.getId());
    }

    private Item stock(String name, String price, int quantity) {
        Item item = new Item();
        item.setShop(shop);
        item.setName(name);
        item.setPrice(new BigDecimal(price));
        item.setQuantity(quantity);
        return itemRepository.save(item);
    }

    private int quantityOf(Item item) {
        return itemRepository.findById(item.getId()).orElseThrow().getQuantity();
    }

    @Test
    void widgetSale_ShouldDecrementStockAndReport() {
        Item widget = stock("Widget", "9.99", 10);

        OperationResult sold = saleService.sell(context, widget.getId(), 3);

        assertTrue(sold.ok());
        assertEquals(7, quantityOf(widget));
        SalesReport report = reportService.salesReport(context);
        assertEquals(1, report.saleCount());
        assertEquals("Widget", report.rows().get(0).itemName());
        assertEquals("admin", report.rows().get(0).username());
        assertEquals(0, new BigDecimal("29.97").compareTo(report.rows().get(0).total()));
        assertEquals(0, new BigDecimal("29.97").compareTo(report.revenue()));

        OperationResult refused = saleService.sell(context, widget.getId(), 20);

        assertFalse(refused.ok());
        assertEquals(SaleService.NOT_ENOUGH_STOCK, refused.message());
        assertEquals(7, quantityOf(widget));
        assertEquals(1, saleRepository.countByShopId(shop.getId()));
    }

    @Test
    void sale_ShouldNotReachItemOfAnotherShop() {
        Item widget = stock("Widget", "1.00", 5);
        Shop other = shopRepository.save(new Shop("Other " + UUID.randomUUID()));

        OperationResult result = saleService.sell(context.withShop(other.getId()), widget.getId(), 1);

        assertFalse(result.ok());
        assertEquals(SaleService.ITEM_NOT_FOUND, result.message());
        assertEquals(5, quantityOf(widget));
    }

    @Test
    void concurrentSales_ShouldNeverOversell() throws Exception {
        Item widget = stock("Widget", "2.00", 10);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<OperationResult>> results = List.of(
                    pool.submit(() -> {
                        start.await();
                        return saleService.sell(context, widget.getId(), 6);
                    }),
                    pool.submit(() -> {
                        start.await();
                        return saleService.sell(context, widget.getId(), 6);
                    }));
            start.countDown();

            long succeeded = 0;
            for (Future<OperationResult> result : results) {
                if (result.get(30, TimeUnit.SECONDS).ok()) {
                    succeeded++;
                }
            }
            assertEquals(1, succeeded);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(4, quantityOf(widget));
        assertEquals(1, saleRepository.countByItemId(widget.getId()));
    }

    @Test
    void sale_ShouldStoreTotalOfLargestPrice() {
        Item safe = stock("Safe", "9999999999.99", 1000);

        OperationResult result = saleService.sell(context, safe.getId(), 500);

        assertTrue(result.ok());
        assertEquals(500, quantityOf(safe));
        assertEquals(0, new BigDecimal("4999999999995.00").compareTo(reportService.salesReport(context).revenue()));
    }

    @Test
    void deleteItem_ShouldBeRefusedOnceSold() {
        Item widget = stock("Widget", "3.00", 5);
        assertTrue(saleService.sell(context, widget.getId(), 1).ok());

        OperationResult result = inventoryService.deleteItem(context, widget.getId());

        assertFalse(result.ok());
        assertEquals("Cannot delete item. It is referenced by 1 sales.", result.message());
        assertTrue(itemRepository.findById(widget.getId()).isPresent());
    }
}
