package com.shop.stockkeeper.security;

import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.model.UserRole;

import java.io.Serializable;
import java.security.Principal;

/**
 * Principal stored in the security context after a successful login.
 */
public record ShopUserPrincipal(Long userId, String username, UserRole role) implements Principal, Serializable {

    public static ShopUserPrincipal of(User user) {
        return new ShopUserPrincipal(user.getId(), user.getUsername(), user.getRole());
    }

    @Override
    public String getName() {
        return username;
    }
}
