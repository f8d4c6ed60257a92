package com.shop.stockkeeper.service;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.model.Item;
import com.shop.stockkeeper.model.Shop;
import com.shop.stockkeeper.repository.ItemRepository;
import com.shop.stockkeeper.repository.SaleRepository;
import com.shop.stockkeeper.repository.ShopRepository;
import com.shop.stockkeeper.security.SessionContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Item CRUD. Every lookup and mutation is scoped by the caller's selected
 * shop, so an id belonging to another shop behaves as if it did not exist.
 */
@Service
public class InventoryService {

    public static final String NO_SHOP = "Please select a shop first.";
    public static final String ITEM_NOT_FOUND = "Selected item not found.";
    public static final String NAME_REQUIRED = "Item name is required.";
    public static final String PRICE_INVALID = "Price cannot be negative.";
    public static final String PRICE_TOO_LARGE = "Price is too large.";
    public static final String PRICE_PRECISION = "Price cannot have more than 2 decimal places.";
    public static final String QUANTITY_INVALID = "Quantity cannot be negative.";
    public static final String ITEM_CREATED = "Item created.";
    public static final String ITEM_UPDATED = "Item updated.";
    public static final String ITEM_DELETED = "Item deleted.";

    /** Largest price the items.price DECIMAL(12, 2) column holds. */
    static final BigDecimal MAX_PRICE = new BigDecimal("9999999999.99");

    private final ItemRepository itemRepository;
    private final ShopRepository shopRepository;
    private final SaleRepository saleRepository;
    private final AuditService auditService;

    public InventoryService(ItemRepository itemRepository, ShopRepository shopRepository,
            SaleRepository saleRepository, AuditService auditService) {
        this.itemRepository = itemRepository;
        this.shopRepository = shopRepository;
        this.saleRepository = saleRepository;
        this.auditService = auditService;
    }

    /**
     * Newest first. Without a selected shop there is nothing to list.
     */
    @Transactional(readOnly = true)
    public List<Item> listItems(SessionContext context) {
        if (!context.hasShop()) {
            return List.of();
        }
        return itemRepository.findByShopIdOrderByIdDesc(context.shopId());
    }

    @Transactional(readOnly = true)
    public Optional<Item> getItem(SessionContext context, Long itemId) {
        if (!context.hasShop() || itemId == null) {
            return Optional.empty();
        }
        return itemRepository.findByIdAndShopId(itemId, context.shopId());
    }

    @Transactional
    public OperationResult createItem(SessionContext context, String name, BigDecimal price, Integer quantity) {
        if (!context.hasShop()) {
            return OperationResult.failure(NO_SHOP);
        }
        Optional<Shop> shop = shopRepository.findById(context.shopId());
        if (shop.isEmpty()) {
            return OperationResult.failure(NO_SHOP);
        }
        String error = validate(name, price, quantity);
        if (error != null) {
            return OperationResult.failure(error);
        }

        Item item = new Item();
        item.setShop(shop.get());
        item.setName(name.trim());
        item.setPrice(price);
        item.setQuantity(quantity);
        itemRepository.save(item);

        auditService.log("CREATE_ITEM", "Shop: " + context.shopId() + ", Item: " + item.getId() + " (" + item.getName() + ")");
        return OperationResult.success(ITEM_CREATED);
    }

    /**
     * Replaces name, price and quantity. The owning shop is left untouched.
     */
    @Transactional
    public OperationResult updateItem(SessionContext context, Long itemId, String name, BigDecimal price,
            Integer quantity) {
        Optional<Item> found = getItem(context, itemId);
        if (found.isEmpty()) {
            return OperationResult.failure(context.hasShop() ? ITEM_NOT_FOUND : NO_SHOP);
        }
        String error = validate(name, price, quantity);
        if (error != null) {
            return OperationResult.failure(error);
        }

        Item item = found.get();
        item.setName(name.trim());
        item.setPrice(price);
        item.setQuantity(quantity);
        itemRepository.save(item);

        auditService.log("UPDATE_ITEM", "Shop: " + context.shopId() + ", Item: " + itemId + ", Price: " + price
                + ", Quantity: " + quantity);
        return OperationResult.success(ITEM_UPDATED);
    }

    @Transactional
    public OperationResult deleteItem(SessionContext context, Long itemId) {
        Optional<Item> found = getItem(context, itemId);
        if (found.isEmpty()) {
            return OperationResult.failure(context.hasShop() ? ITEM_NOT_FOUND : NO_SHOP);
        }
        long salesCount = saleRepository.countByItemId(itemId);
        if (salesCount > 0) {
            return OperationResult.failure("Cannot delete item. It is referenced by " + salesCount + " sales.");
        }

        itemRepository.delete(found.get());
        auditService.log("DELETE_ITEM", "Shop: " + context.shopId() + ", Item: " + itemId);
        return OperationResult.success(ITEM_DELETED);
    }

    private String validate(String name, BigDecimal price, Integer quantity) {
        if (name == null || name.trim().isEmpty()) {
            return NAME_REQUIRED;
        }
        if (price == null || price.compareTo(BigDecimal.ZERO) < 0) {
            return PRICE_INVALID;
        }
        if (price.compareTo(MAX_PRICE) > 0) {
            return PRICE_TOO_LARGE;
        }
        if (price.stripTrailingZeros().scale() > 2) {
            return PRICE_PRECISION;
        }
        if (quantity == null || quantity < 0) {
            return QUANTITY_INVALID;
        }
        return null;
    }
}
