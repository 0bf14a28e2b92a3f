package com.tio.identity;

import java.util.Objects;

/**
 * A user that submits jobs and owns parameter values. Identity is the user id;
 * the username is informational.
 */
public final class User {

    private final String id;
    private final String username;

    public User(String id, String username) {
        this.id = Objects.requireNonNull(id, "id").trim();
        if (this.id.isEmpty()) {
            throw new IllegalArgumentException("User id must be non-blank");
        }
        this.username = username != null ? username.trim() : "";
    }

    public static User of(String id) {
        return new User(id, id);
    }

    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((User) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "User(" + id + ")";
    }
}
