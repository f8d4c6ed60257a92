package com.shop.stockkeeper.service;

import com.shop.stockkeeper.model.AuditLog;
import com.shop.stockkeeper.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate auditTransaction;

    public AuditService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.auditTransaction = new TransactionTemplate(transactionManager);
        // Own transaction: a failed audit write must not roll back the audited work.
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void log(String action, String details) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        log(auth != null ? auth.getName() : "SYSTEM", action, details);
    }

    public void log(String username, String action, String details) {
        AuditLog entry = new AuditLog();
        entry.setUsername(username);
        entry.setAction(action);
        entry.setDetails(details);
        try {
            auditTransaction.executeWithoutResult(status -> auditLogRepository.save(entry));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit log {} for {}: {}", action, username, e.getMessage());
        }
    }

    public List<AuditLog> recentEntries() {
        return auditLogRepository.findTop50ByOrderByLoggedAtDescIdDesc();
    }
}
