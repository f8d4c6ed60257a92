package com.shop.stockkeeper.security;

import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.service.AccountService;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks a username/password pair against the users table. The same message
 * is used whichever field was wrong.
 */
@Component
public class ShopAuthenticationProvider implements AuthenticationProvider {

    public static final String BAD_CREDENTIALS = "Invalid username or password.";

    private final AccountService accountService;

    public ShopAuthenticationProvider(AccountService accountService) {
        this.accountService = accountService;
    }

    @Override
    public Authentication authenticate(Authentication authentication) throws AuthenticationException {
        String username = authentication.getName();
        Object credentials = authentication.getCredentials();
        String password = credentials == null ? null : credentials.toString();

        User user = accountService.authenticate(username, password)
                .orElseThrow(() -> new BadCredentialsException(BAD_CREDENTIALS));

        return UsernamePasswordAuthenticationToken.authenticated(
                ShopUserPrincipal.of(user),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name())));
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(authentication);
    }
}
