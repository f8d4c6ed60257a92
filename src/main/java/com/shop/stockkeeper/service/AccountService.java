package com.shop.stockkeeper.service;

import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.dto.UserSummary;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.model.UserRole;
import com.shop.stockkeeper.repository.UserRepository;
import com.shop.stockkeeper.security.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class AccountService {

    public static final String ADMIN_REQUIRED = "Only an admin can manage workers.";
    public static final String CREDENTIALS_REQUIRED = "Username and password are required.";
    public static final String USERNAME_TAKEN = "Username already exists.";
    public static final String WORKER_CREATED = "Worker created.";

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final UserRepository userRepository;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;

    public AccountService(UserRepository userRepository, AccessPolicy accessPolicy, AuditService auditService) {
        this.userRepository = userRepository;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
    }

    /**
     * Exact username and password match. Passwords are stored in plaintext.
     */
    @Transactional(readOnly = true)
    public Optional<User> authenticate(String username, String password) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        return userRepository.findByUsernameAndPassword(username, password);
    }

    @Transactional(readOnly = true)
    public Optional<User> currentUser(SessionContext context) {
        if (context == null || context.userId() == null) {
            return Optional.empty();
        }
        return userRepository.findById(context.userId());
    }

    @Transactional(readOnly = true)
    public List<UserSummary> listUsers() {
        return userRepository.findAllByOrderByUsernameAsc().stream()
                .map(UserSummary::of)
                .toList();
    }

    @Transactional
    public OperationResult createWorker(User actingUser, String username, String password) {
        if (!accessPolicy.isAdmin(actingUser)) {
            return OperationResult.failure(ADMIN_REQUIRED);
        }
        String name = username == null ? "" : username.trim();
        if (name.isEmpty() || password == null || password.isEmpty()) {
            return OperationResult.failure(CREDENTIALS_REQUIRED);
        }
        if (userRepository.existsByUsername(name)) {
            return OperationResult.failure(USERNAME_TAKEN);
        }

        User worker = new User();
        worker.setUsername(name);
        worker.setPassword(password);
        worker.setRole(UserRole.WORKER);
        userRepository.save(worker);

        log.info("Worker '{}' created by '{}'", name, actingUser.getUsername());
        auditService.log(actingUser.getUsername(), "CREATE_WORKER", "Worker: " + name);
        return OperationResult.success(WORKER_CREATED);
    }
}
