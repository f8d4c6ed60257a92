package com.shop.stockkeeper.service;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.model.Shop;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.repository.ShopRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ShopService {

    public static final String ADMIN_REQUIRED = "Only an admin can create shops.";
    public static final String NAME_REQUIRED = "Shop name is required.";
    public static final String NAME_TAKEN = "Shop already exists.";
    public static final String SHOP_CREATED = "Shop created.";
    public static final String SHOP_NOT_FOUND = "Selected shop not found.";
    public static final String SHOP_SELECTED = "Shop selected.";
    public static final String SELECTION_CLEARED = "Shop selection cleared.";

    private final ShopRepository shopRepository;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;

    public ShopService(ShopRepository shopRepository, AccessPolicy accessPolicy, AuditService auditService) {
        this.shopRepository = shopRepository;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
    }

    @Transactional(readOnly = true)
    public List<Shop> listShops() {
        return shopRepository.findAllByOrderByNameAsc();
    }

    @Transactional
    public OperationResult createShop(User actingUser, String name) {
        if (!accessPolicy.isAdmin(actingUser)) {
            return OperationResult.failure(ADMIN_REQUIRED);
        }
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            return OperationResult.failure(NAME_REQUIRED);
        }
        if (shopRepository.existsByName(trimmed)) {
            return OperationResult.failure(NAME_TAKEN);
        }
        Shop shop = shopRepository.save(new Shop(trimmed));
        auditService.log(actingUser.getUsername(), "CREATE_SHOP", "Shop: " + shop.getId() + " (" + trimmed + ")");
        return OperationResult.success(SHOP_CREATED);
    }

    /**
     * Checks a requested selection. {@code null} means "no shop" and is always
     * accepted; any other id must name an existing shop.
     */
    @Transactional(readOnly = true)
    public OperationResult selectShop(Long shopId) {
        if (shopId == null) {
            return OperationResult.success(SELECTION_CLEARED);
        }
        return shopRepository.existsById(shopId)
                ? OperationResult.success(SHOP_SELECTED)
                : OperationResult.failure(SHOP_NOT_FOUND);
    }
}
