package com.shop.stockkeeper.service;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.model.Item;
import com.shop.stockkeeper.model.Sale;
import com.shop.stockkeeper.repository.ItemRepository;
import com.shop.stockkeeper.repository.SaleRepository;
import com.shop.stockkeeper.repository.ShopRepository;
import com.shop.stockkeeper.repository.UserRepository;
import com.shop.stockkeeper.security.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Records sales. A sale checks and decrements stock and writes the sale row in
 * one transaction; refusals come back as {@link OperationResult}s and leave
 * the store untouched.
 */
@Service
public class SaleService {

    public static final String INVALID_INPUT = "Please select a valid item and quantity.";
    public static final String NO_SHOP = "Please select a shop first.";
    public static final String QUANTITY_TOO_LOW = "Quantity must be at least 1.";
    public static final String ITEM_NOT_FOUND = "Selected item not found.";
    public static final String NOT_ENOUGH_STOCK = "Not enough stock to complete the sale.";
    public static final String SALE_RECORDED = "Sale recorded successfully.";

    private static final Logger log = LoggerFactory.getLogger(SaleService.class);

    private final ItemRepository itemRepository;
    private final SaleRepository saleRepository;
    private final ShopRepository shopRepository;
    private final UserRepository userRepository;

    public SaleService(ItemRepository itemRepository, SaleRepository saleRepository, ShopRepository shopRepository,
            UserRepository userRepository) {
        this.itemRepository = itemRepository;
        this.saleRepository = saleRepository;
        this.shopRepository = shopRepository;
        this.userRepository = userRepository;
    }

    /**
     * Entry point for caller-typed input, e.g. form fields.
     */
    @Transactional
    public OperationResult sell(SessionContext context, String itemIdText, String quantityText) {
        if (itemIdText == null || quantityText == null) {
            return OperationResult.failure(INVALID_INPUT);
        }
        long itemId;
        int quantity;
        try {
            itemId = Long.parseLong(itemIdText.trim());
            quantity = Integer.parseInt(quantityText.trim());
        } catch (NumberFormatException e) {
            log.debug("Rejected sale input item='{}' quantity='{}'", itemIdText, quantityText);
            return OperationResult.failure(INVALID_INPUT);
        }
        return sell(context, itemId, quantity);
    }

    @Transactional
    public OperationResult sell(SessionContext context, Long itemId, int quantity) {
        if (!context.hasShop()) {
            return OperationResult.failure(NO_SHOP);
        }
        if (quantity < 1) {
            return OperationResult.failure(QUANTITY_TOO_LOW);
        }

        // Row lock: a concurrent sale of the same item waits here until we commit.
        Optional<Item> found = itemRepository.findByIdAndShopIdForUpdate(itemId, context.shopId());
        if (found.isEmpty()) {
            return OperationResult.failure(ITEM_NOT_FOUND);
        }
        Item item = found.get();
        if (quantity > item.getQuantity()) {
            return OperationResult.failure(NOT_ENOUGH_STOCK);
        }

        // Refuses to go below zero even if the row changed since it was read.
        if (itemRepository.decrementStock(item.getId(), context.shopId(), quantity) == 0) {
            log.warn("Stock of item {} changed during sale of {}, refusing", item.getId(), quantity);
            return OperationResult.failure(NOT_ENOUGH_STOCK);
        }

        Sale sale = new Sale();
        sale.setShop(shopRepository.getReferenceById(context.shopId()));
        sale.setItem(itemRepository.getReferenceById(item.getId()));
        sale.setUser(userRepository.getReferenceById(context.userId()));
        sale.setQuantity(quantity);
        sale.setTotal(item.getPrice().multiply(BigDecimal.valueOf(quantity)));
        saleRepository.save(sale);

        log.info("Sale of {} x item {} in shop {} by user {}, total {}", quantity, item.getId(), context.shopId(),
                context.userId(), sale.getTotal());
        return OperationResult.success(SALE_RECORDED);
    }
}
