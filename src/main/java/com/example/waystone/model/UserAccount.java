package com.example.waystone.model;

import java.time.Instant;

/**
 * A registered player account. Characters belong to exactly one account.
 */
public class UserAccount {
    private final String id;
    private final String username;
    private final String email;
    private final String passwordHash;
    private final String passwordSalt;
    private final boolean admin;
    private final Instant createdAt;

    public UserAccount(String id, String username, String email, String passwordHash,
                       String passwordSalt, boolean admin, Instant createdAt) {
        this.id = id;
        this.username = username;
        this.email = email;
        this.passwordHash = passwordHash;
        this.passwordSalt = passwordSalt;
        this.admin = admin;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getUsername() { return username; }
    public String getEmail() { return email; }
    public String getPasswordHash() { return passwordHash; }
    public String getPasswordSalt() { return passwordSalt; }
    public boolean isAdmin() { return admin; }
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public String toString() {
        return "UserAccount(" + username + ")";
    }
}
