package com.tio.identity;

import java.util.Objects;

/**
 * Membership of a user in an organization. Organization-scoped parameter values are keyed by
 * the organization owner's user id, so the owner is carried here alongside the organization id.
 */
public final class Membership {

    private final String organizationId;
    private final String organizationName;
    private final String organizationOwnerId;

    public Membership(String organizationId, String organizationName, String organizationOwnerId) {
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId").trim();
        this.organizationName = organizationName != null ? organizationName.trim() : this.organizationId;
        this.organizationOwnerId = Objects.requireNonNull(organizationOwnerId, "organizationOwnerId").trim();
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getOrganizationName() {
        return organizationName;
    }

    /** User id of the organization owner; owner of organization-scoped values. */
    public String getOrganizationOwnerId() {
        return organizationOwnerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Membership that = (Membership) o;
        return organizationId.equals(that.organizationId)
                && organizationOwnerId.equals(that.organizationOwnerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organizationId, organizationOwnerId);
    }

    @Override
    public String toString() {
        return "Membership(" + organizationName + ")";
    }
}
