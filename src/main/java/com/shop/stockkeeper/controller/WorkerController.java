package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.dto.UserSummary;
import com.shop.stockkeeper.dto.WorkerRequest;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.security.SessionContext;
import com.shop.stockkeeper.service.AccessPolicy;
import com.shop.stockkeeper.service.AccountService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/workers")
public class WorkerController {

    private final AccountService accountService;
    private final AccessPolicy accessPolicy;

    public WorkerController(AccountService accountService, AccessPolicy accessPolicy) {
        this.accountService = accountService;
        this.accessPolicy = accessPolicy;
    }

    @GetMapping
    public ResponseEntity<List<UserSummary>> list(SessionContext context) {
        if (!accessPolicy.isAdmin(accountService.currentUser(context).orElse(null))) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        return ResponseEntity.ok(accountService.listUsers());
    }

    @PostMapping
    public ResponseEntity<OperationResult> create(@RequestBody WorkerRequest request, SessionContext context) {
        User user = accountService.currentUser(context).orElse(null);
        if (!accessPolicy.isAdmin(user)) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        return ApiResponses.created(accountService.createWorker(user, request.username(), request.password()));
    }
}
