package com.tio.identity;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Organization directory held in memory: user id → membership. Used by the worker when
 * memberships are supplied at bootstrap, and by tests.
 */
public final class InMemoryOrganizationDirectory implements OrganizationDirectory {

    private final Map<String, Membership> byUserId = new ConcurrentHashMap<>();

    /**
     * Adds (or moves) a user into an organization.
     *
     * @param user       member
     * @param membership organization membership
     * @return this directory
     */
    public InMemoryOrganizationDirectory join(User user, Membership membership) {
        Objects.requireNonNull(user, "user");
        byUserId.put(user.getId(), Objects.requireNonNull(membership, "membership"));
        return this;
    }

    /** Removes the user's membership, if any. */
    public void leave(User user) {
        if (user != null) {
            byUserId.remove(user.getId());
        }
    }

    @Override
    public Optional<Membership> membershipOf(User user) {
        if (user == null) return Optional.empty();
        return Optional.ofNullable(byUserId.get(user.getId()));
    }
}
