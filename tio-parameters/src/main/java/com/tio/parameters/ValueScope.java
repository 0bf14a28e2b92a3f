package com.tio.parameters;

import java.util.Objects;

/**
 * Scope of a parameter value: exactly one of user ({@code owner=user, for_organization=false}),
 * organization ({@code owner=organization owner, for_organization=true}) or system default (no owner).
 */
public final class ValueScope {

    public enum Kind {
        USER,
        ORGANIZATION,
        SYSTEM_DEFAULT
    }

    private static final ValueScope SYSTEM_DEFAULT = new ValueScope(Kind.SYSTEM_DEFAULT, null);

    private final Kind kind;
    private final String ownerId;

    private ValueScope(Kind kind, String ownerId) {
        this.kind = kind;
        this.ownerId = ownerId;
    }

    public static ValueScope user(String userId) {
        return new ValueScope(Kind.USER, requireOwner(userId));
    }

    /**
     * @param organizationOwnerId user id of the organization owner
     */
    public static ValueScope organization(String organizationOwnerId) {
        return new ValueScope(Kind.ORGANIZATION, requireOwner(organizationOwnerId));
    }

    public static ValueScope systemDefault() {
        return SYSTEM_DEFAULT;
    }

    private static String requireOwner(String ownerId) {
        String id = Objects.requireNonNull(ownerId, "ownerId").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Scope owner must be non-blank");
        }
        return id;
    }

    /**
     * Parses a key produced by {@link #key()}.
     *
     * @throws IllegalArgumentException if the key is malformed
     */
    public static ValueScope parse(String key) {
        if ("default".equals(key)) return SYSTEM_DEFAULT;
        if (key != null && key.startsWith("user:")) return user(key.substring(5));
        if (key != null && key.startsWith("org:")) return organization(key.substring(4));
        throw new IllegalArgumentException("Invalid value scope key: " + key);
    }

    public Kind getKind() {
        return kind;
    }

    /** Owner user id; null for the system default. */
    public String getOwnerId() {
        return ownerId;
    }

    public boolean isForOrganization() {
        return kind == Kind.ORGANIZATION;
    }

    /** Stable string form: {@code user:<id>}, {@code org:<ownerId>} or {@code default}. */
    public String key() {
        switch (kind) {
            case USER:
                return "user:" + ownerId;
            case ORGANIZATION:
                return "org:" + ownerId;
            default:
                return "default";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValueScope that = (ValueScope) o;
        return kind == that.kind && Objects.equals(ownerId, that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, ownerId);
    }

    @Override
    public String toString() {
        return key();
    }
}
