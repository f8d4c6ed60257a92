package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.dto.LoginRequest;
import com.shop.stockkeeper.dto.OperationResult;
import com.shop.stockkeeper.dto.SessionView;
import com.shop.stockkeeper.security.SessionContext;
import com.shop.stockkeeper.security.ShopAuthenticationProvider;
import com.shop.stockkeeper.security.ShopUserPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.logout.SecurityContextLogoutHandler;
import org.springframework.security.web.context.SecurityContextRepository;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/session")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final AuthenticationManager authenticationManager;
    private final SecurityContextRepository securityContextRepository;
    private final SecurityContextLogoutHandler logoutHandler = new SecurityContextLogoutHandler();

    public SessionController(AuthenticationManager authenticationManager,
            SecurityContextRepository securityContextRepository) {
        this.authenticationManager = authenticationManager;
        this.securityContextRepository = securityContextRepository;
    }

    @PostMapping
    public ResponseEntity<?> login(@RequestBody LoginRequest login, HttpServletRequest request,
            HttpServletResponse response) {
        // A fresh login never inherits an earlier user's shop selection.
        HttpSession previous = request.getSession(false);
        if (previous != null) {
            previous.invalidate();
        }

        Authentication authentication;
        try {
            authentication = authenticationManager.authenticate(
                    UsernamePasswordAuthenticationToken.unauthenticated(login.username(), login.password()));
        } catch (AuthenticationException e) {
            logger.info("Login refused for '{}'", login.username());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(OperationResult.failure(ShopAuthenticationProvider.BAD_CREDENTIALS));
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
        securityContextRepository.saveContext(context, request, response);

        ShopUserPrincipal principal = (ShopUserPrincipal) authentication.getPrincipal();
        return ResponseEntity.ok(new SessionView(principal.userId(), principal.username(), principal.role(), null));
    }

    @GetMapping
    public SessionView current(@AuthenticationPrincipal ShopUserPrincipal principal, SessionContext context) {
        return new SessionView(principal.userId(), principal.username(), principal.role(), context.shopId());
    }

    @DeleteMapping
    public OperationResult logout(HttpServletRequest request, HttpServletResponse response,
            Authentication authentication) {
        logoutHandler.logout(request, response, authentication);
        return OperationResult.success("Logged out.");
    }
}
