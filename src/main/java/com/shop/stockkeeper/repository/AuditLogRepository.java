package com.shop.stockkeeper.repository;

import com.shop.stockkeeper.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findTop50ByOrderByLoggedAtDescIdDesc();

    List<AuditLog> findByAction(String action);
}
