package com.shop.stockkeeper.dto;

import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.model.UserRole;

public record UserSummary(Long id, String username, UserRole role) {

    public static UserSummary of(User user) {
        return new UserSummary(user.getId(), user.getUsername(), user.getRole());
    }
}
