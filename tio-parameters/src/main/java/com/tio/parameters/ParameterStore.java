package com.tio.parameters;

import com.tio.identity.Membership;
import com.tio.identity.User;
import com.tio.pluginconfig.Parameter;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent store of parameter values. At most one value exists per (parameter, scope).
 * Every operation is an independent, idempotent read or a single-row write.
 */
public interface ParameterStore {

    /** All values for the parameter, in every scope. */
    Set<ParameterValue> candidates(Parameter parameter);

    /** The value for the parameter in exactly this scope. */
    Optional<ParameterValue> find(ValueScope scope, Parameter parameter);

    /**
     * Creates or replaces the value for the parameter in this scope.
     *
     * @return the stored value
     * @throws InvalidParameterValueException if the value does not match the declared type
     */
    ParameterValue upsert(ValueScope scope, Parameter parameter, Object value);

    /**
     * @return true if a value was removed
     */
    boolean delete(ValueScope scope, Parameter parameter);

    /**
     * Values a user may see for the parameter: their own, their organization's and the system default.
     *
     * @param user       the user; null sees only defaults
     * @param membership the user's membership, or null
     */
    default Set<ParameterValue> visibleTo(Parameter parameter, User user, Membership membership) {
        Set<ParameterValue> visible = new LinkedHashSet<>();
        for (ParameterValue v : candidates(parameter)) {
            ValueScope s = v.getScope();
            boolean ownValue = user != null && s.equals(ValueScope.user(user.getId()));
            boolean orgValue = membership != null && s.equals(ValueScope.organization(membership.getOrganizationOwnerId()));
            if (ownValue || orgValue || s.getKind() == ValueScope.Kind.SYSTEM_DEFAULT) {
                visible.add(v);
            }
        }
        return visible;
    }
}
