package com.shop.stockkeeper.service;

import com.shop.stockkeeper.config.ShopProperties;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.security.ItemMutationPolicy;
import org.springframework.stereotype.Component;

/**
 * Role checks. Callers turn a {@code false} into a refusal, never an error.
 */
@Component
public class AccessPolicy {

    private final ShopProperties properties;

    public AccessPolicy(ShopProperties properties) {
        this.properties = properties;
    }

    public boolean isAdmin(User user) {
        return user != null && user.isAdmin();
    }

    public boolean canMutateItems(User user) {
        if (user == null) {
            return false;
        }
        ItemMutationPolicy policy = properties.getPolicy().getItemMutation();
        return policy == ItemMutationPolicy.ANY_USER || isAdmin(user);
    }
}
