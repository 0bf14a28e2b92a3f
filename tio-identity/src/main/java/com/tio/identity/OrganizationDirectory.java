package com.tio.identity;

import java.util.Optional;

/**
 * Identity/organization directory. Given a user, returns the user's organization membership,
 * or empty when the user belongs to no organization. Anonymous callers (null user) have no membership.
 */
public interface OrganizationDirectory {

    /** Directory in which nobody belongs to an organization. */
    OrganizationDirectory NONE = user -> Optional.empty();

    /**
     * @param user user (may be null for anonymous flows)
     * @return membership or empty
     */
    Optional<Membership> membershipOf(User user);
}
