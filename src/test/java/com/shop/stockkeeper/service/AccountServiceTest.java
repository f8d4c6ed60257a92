package com.shop.stockkeeper.service;

import com.shop.stockkeeper.config.ShopProperties;
import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.dto.UserSummary;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.model.UserRole;
import com.shop.stockkeeper.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private AuditService auditService;

    private AccountService accountService;

    private User admin;
    private User worker;

    @BeforeEach
    void setUp() {
        accountService = new AccountService(userRepository, new AccessPolicy(new ShopProperties()), auditService);
        admin = user(1L, "admin", UserRole.ADMIN);
        worker = user(2L, "sam", UserRole.WORKER);
    }

    private User user(Long id, String username, UserRole role) {
        User user = new User();
        user.setId(id);
        user.setUsername(username);
        user.setPassword("secret");
        user.setRole(role);
        return user;
    }

    @Test
    void authenticate_ShouldRequireBothFields() {
        assertTrue(accountService.authenticate("admin", null).isEmpty());
        assertTrue(accountService.authenticate(null, "admin").isEmpty());
        verifyNoInteractions(userRepository);
    }

    @Test
    void authenticate_ShouldMatchExactly() {
        when(userRepository.findByUsernameAndPassword("admin", "secret")).thenReturn(Optional.of(admin));

        assertEquals(Optional.of(admin), accountService.authenticate("admin", "secret"));
    }

    @Test
    void createWorker_ShouldStoreWorkerRole() {
        when(userRepository.existsByUsername("lee")).thenReturn(false);

        OperationResult result = accountService.createWorker(admin, " lee ", "pw");

        assertTrue(result.ok());
        assertEquals(AccountService.WORKER_CREATED, result.message());
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertEquals("lee", captor.getValue().getUsername());
        assertEquals("pw", captor.getValue().getPassword());
        assertEquals(UserRole.WORKER, captor.getValue().getRole());
        verify(auditService).log(eq("admin"), eq("CREATE_WORKER"), anyString());
    }

    @Test
    void createWorker_ShouldRefuseNonAdmin() {
        OperationResult result = accountService.createWorker(worker, "lee", "pw");

        assertFalse(result.ok());
        assertEquals(AccountService.ADMIN_REQUIRED, result.message());
        verifyNoInteractions(userRepository);
    }

    @Test
    void createWorker_ShouldRequireCredentials() {
        assertEquals(AccountService.CREDENTIALS_REQUIRED, accountService.createWorker(admin, " ", "pw").message());
        assertEquals(AccountService.CREDENTIALS_REQUIRED, accountService.createWorker(admin, "lee", "").message());
    }

    @Test
    void createWorker_ShouldRefuseDuplicateUsername() {
        when(userRepository.existsByUsername("sam")).thenReturn(true);

        OperationResult result = accountService.createWorker(admin, "sam", "pw");

        assertFalse(result.ok());
        assertEquals(AccountService.USERNAME_TAKEN, result.message());
        verify(userRepository, never()).save(any());
    }

    @Test
    void listUsers_ShouldProjectWithoutPasswords() {
        when(userRepository.findAllByOrderByUsernameAsc()).thenReturn(List.of(admin, worker));

        List<UserSummary> users = accountService.listUsers();

        assertEquals(2, users.size());
        assertEquals("sam", users.get(1).username());
        assertEquals(UserRole.WORKER, users.get(1).role());
    }
}
