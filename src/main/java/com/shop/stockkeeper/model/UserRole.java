package com.shop.stockkeeper.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of roles. The lower-case code is what the users table stores.
 */
public enum UserRole {
    ADMIN("admin"),
    WORKER("worker");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static UserRole fromCode(String code) {
        for (UserRole role : values()) {
            if (role.code.equals(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown user role: " + code);
    }
}
