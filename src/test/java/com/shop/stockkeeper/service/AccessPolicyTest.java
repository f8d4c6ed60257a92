package com.shop.stockkeeper.service;

import com.shop.stockkeeper.config.ShopProperties;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.model.UserRole;
import com.shop.stockkeeper.security.ItemMutationPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    private static User withRole(UserRole role) {
        User user = new User();
        user.setRole(role);
        return user;
    }

    @Test
    void anyUserPolicy_ShouldLetWorkersMutateItems() {
        AccessPolicy policy = new AccessPolicy(new ShopProperties());

        assertTrue(policy.canMutateItems(withRole(UserRole.WORKER)));
        assertFalse(policy.isAdmin(withRole(UserRole.WORKER)));
        assertFalse(policy.canMutateItems(null));
    }

    @Test
    void adminOnlyPolicy_ShouldRestrictItemMutationToAdmins() {
        ShopProperties properties = new ShopProperties();
        properties.getPolicy().setItemMutation(ItemMutationPolicy.ADMIN_ONLY);
        AccessPolicy policy = new AccessPolicy(properties);

        assertFalse(policy.canMutateItems(withRole(UserRole.WORKER)));
        assertTrue(policy.canMutateItems(withRole(UserRole.ADMIN)));
    }
}
