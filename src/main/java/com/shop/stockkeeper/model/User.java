package com.shop.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

@Entity
@Table(name = "users")
@Data
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String username;

    // Plaintext, compared verbatim at login.
    @ToString.Exclude
    @Column(nullable = false)
    private String password;

    @Column(nullable = false, length = 16)
    private UserRole role;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
