package com.shop.stockkeeper.security;

/**
 * Who may create, edit and delete items.
 */
public enum ItemMutationPolicy {
    ANY_USER,
    ADMIN_ONLY
}
