package com.shop.stockkeeper.security;

/**
 * Who is calling and which shop they are working in. Built per request from
 * the HTTP session and handed explicitly to every core operation.
 *
 * @param userId authenticated user, never null
 * @param shopId selected shop, or null when none is selected
 */
public record SessionContext(Long userId, Long shopId) {

    public boolean hasShop() {
        return shopId != null;
    }

    public SessionContext withShop(Long shopId) {
        return new SessionContext(userId, shopId);
    }
}
