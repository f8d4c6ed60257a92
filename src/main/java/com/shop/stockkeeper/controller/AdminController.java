package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.model.AuditLog;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.security.SessionContext;
import com.shop.stockkeeper.service.AccessPolicy;
import com.shop.stockkeeper.service.AccountService;
import com.shop.stockkeeper.service.AuditService;
import com.shop.stockkeeper.service.DeploymentTrigger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final AccountService accountService;
    private final AccessPolicy accessPolicy;
    private final DeploymentTrigger deploymentTrigger;
    private final AuditService auditService;

    public AdminController(AccountService accountService, AccessPolicy accessPolicy,
            DeploymentTrigger deploymentTrigger, AuditService auditService) {
        this.accountService = accountService;
        this.accessPolicy = accessPolicy;
        this.deploymentTrigger = deploymentTrigger;
        this.auditService = auditService;
    }

    /**
     * Runs the update command synchronously; the response arrives when it is done.
     */
    @PostMapping("/update")
    public ResponseEntity<OperationResult> update(SessionContext context) {
        User user = accountService.currentUser(context).orElse(null);
        if (!accessPolicy.isAdmin(user)) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        OperationResult result = deploymentTrigger.triggerUpdate();
        auditService.log(user.getUsername(), "SELF_UPDATE", result.message());
        return ApiResponses.of(result);
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditLog>> audit(SessionContext context) {
        if (!accessPolicy.isAdmin(accountService.currentUser(context).orElse(null))) {
            return ApiResponses.seeOther(ApiResponses.NEUTRAL_PATH);
        }
        return ResponseEntity.ok(auditService.recentEntries());
    }
}
