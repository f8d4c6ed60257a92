package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.dto.ShopRequest;
import com.shop.stockkeeper.dto.ShopSelectionRequest;
import com.shop.stockkeeper.model.Shop;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.security.SessionContext;
import com.shop.stockkeeper.security.SessionContextArgumentResolver;
import com.shop.stockkeeper.service.AccessPolicy;
import com.shop.stockkeeper.service.AccountService;
import com.shop.stockkeeper.service.ShopService;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/shops")
public class ShopController {

    private final ShopService shopService;
    private final AccountService accountService;
    private final AccessPolicy accessPolicy;

    public ShopController(ShopService shopService, AccountService accountService, AccessPolicy accessPolicy) {
        this.shopService = shopService;
        this.accountService = accountService;
        this.accessPolicy = accessPolicy;
    }

    @GetMapping
    public List<Shop> list() {
        return shopService.listShops();
    }

    @PostMapping
    public ResponseEntity<OperationResult> create(@RequestBody ShopRequest request, SessionContext context) {
        User user = accountService.currentUser(context).orElse(null);
        if (!accessPolicy.isAdmin(user)) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        return ApiResponses.created(shopService.createShop(user, request.name()));
    }

    @PutMapping("/selection")
    public ResponseEntity<OperationResult> select(@RequestBody ShopSelectionRequest request, HttpSession session) {
        OperationResult result = shopService.selectShop(request.shopId());
        if (result.ok()) {
            if (request.shopId() == null) {
                session.removeAttribute(SessionContextArgumentResolver.SHOP_ATTRIBUTE);
            } else {
                session.setAttribute(SessionContextArgumentResolver.SHOP_ATTRIBUTE, request.shopId());
            }
        }
        return ApiResponses.of(result);
    }
}
