package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.dto.ItemRequest;
import com.shop.stockkeeper.dto.ItemView;
import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.security.SessionContext;
import com.shop.stockkeeper.service.AccessPolicy;
import com.shop.stockkeeper.service.AccountService;
import com.shop.stockkeeper.service.InventoryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Items of the selected shop. Callers without a selected shop never get here,
 * see {@code ShopSelectionInterceptor}.
 */
@RestController
@RequestMapping("/api/items")
public class ItemController {

    private final InventoryService inventoryService;
    private final AccountService accountService;
    private final AccessPolicy accessPolicy;

    public ItemController(InventoryService inventoryService, AccountService accountService,
            AccessPolicy accessPolicy) {
        this.inventoryService = inventoryService;
        this.accountService = accountService;
        this.accessPolicy = accessPolicy;
    }

    @GetMapping
    public List<ItemView> list(SessionContext context) {
        return inventoryService.listItems(context).stream()
                .map(ItemView::of)
                .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable Long id, SessionContext context) {
        return inventoryService.getItem(context, id)
                .<ResponseEntity<?>>map(item -> ResponseEntity.ok(ItemView.of(item)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(OperationResult.failure(InventoryService.ITEM_NOT_FOUND)));
    }

    @PostMapping
    public ResponseEntity<OperationResult> create(@RequestBody ItemRequest request, SessionContext context) {
        if (!mayMutate(context)) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        return ApiResponses.created(
                inventoryService.createItem(context, request.name(), request.price(), request.quantity()));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OperationResult> update(@PathVariable Long id, @RequestBody ItemRequest request,
            SessionContext context) {
        if (!mayMutate(context)) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        return ApiResponses.of(
                inventoryService.updateItem(context, id, request.name(), request.price(), request.quantity()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult> delete(@PathVariable Long id, SessionContext context) {
        if (!mayMutate(context)) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        return ApiResponses.of(inventoryService.deleteItem(context, id));
    }

    private boolean mayMutate(SessionContext context) {
        return accessPolicy.canMutateItems(accountService.currentUser(context).orElse(null));
    }
}
