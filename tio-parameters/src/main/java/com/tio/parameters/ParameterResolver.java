package com.tio.parameters;

import com.tio.identity.Membership;
import com.tio.identity.OrganizationDirectory;
import com.tio.identity.User;
import com.tio.job.Job;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.PluginConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses the value each plugin parameter receives for a job. Strict precedence, first match wins:
 * <ol>
 *   <li>the job's runtime override for (plugin, parameter), verbatim;</li>
 *   <li>the value scoped to the job's user;</li>
 *   <li>the value of the user's organization (owner = organization owner, for_organization);</li>
 *   <li>the system default;</li>
 *   <li>otherwise {@link ParameterNotConfiguredException}.</li>
 * </ol>
 * Each tier is a separate {@link ParameterStore#find} lookup. Values are never logged.
 */
public final class ParameterResolver {

    private static final Logger log = LoggerFactory.getLogger(ParameterResolver.class);

    private final ParameterStore store;
    private final OrganizationDirectory directory;

    public ParameterResolver(ParameterStore store, OrganizationDirectory directory) {
        this.store = Objects.requireNonNull(store, "store");
        this.directory = directory != null ? directory : OrganizationDirectory.NONE;
    }

    public ParameterStore getStore() {
        return store;
    }

    public OrganizationDirectory getDirectory() {
        return directory;
    }

    /**
     * Resolves every declared parameter of the plugin for the job. A required parameter with no value
     * fails the whole call; optional ones without a value are omitted.
     *
     * @return parameter → value in declaration order
     * @throws ParameterNotConfiguredException for the first required parameter with no value
     */
    public Map<Parameter, Object> readParams(PluginConfiguration plugin, Job job) {
        Objects.requireNonNull(plugin, "plugin");
        Objects.requireNonNull(job, "job");
        Membership membership = membershipOf(job.getUser());
        Map<Parameter, Object> out = new LinkedHashMap<>();
        for (Parameter parameter : plugin.getParameters()) {
            try {
                out.put(parameter, resolve(plugin, parameter, job, membership));
            } catch (ParameterNotConfiguredException e) {
                if (parameter.isRequired()) {
                    throw e;
                }
                log.debug("Optional parameter {} has no value for job {}; omitted", parameter, job.getId());
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Resolves one parameter of the plugin for the job.
     *
     * @throws IllegalStateException if the parameter does not belong to the plugin
     * @throws ParameterNotConfiguredException if no tier has a value
     */
    public Object resolve(PluginConfiguration plugin, Parameter parameter, Job job) {
        return resolve(plugin, parameter, job, membershipOf(job.getUser()));
    }

    private Object resolve(PluginConfiguration plugin, Parameter parameter, Job job, Membership membership) {
        if (!plugin.getRef().equals(parameter.getOwner())) {
            throw new IllegalStateException("Parameter " + parameter + " is not owned by " + plugin.getRef());
        }
        if (job.getRuntimeConfiguration().hasOverride(plugin.getName(), parameter.getName())) {
            logTier(parameter, ResolutionTier.RUNTIME_OVERRIDE);
            return job.getRuntimeConfiguration().getOverride(plugin.getName(), parameter.getName());
        }
        return resolveStored(parameter, job.getUser(), membership);
    }

    /**
     * Resolves a parameter for a user from stored values only (user, organization, default).
     * Runtime overrides play no part.
     *
     * @param user the user; null skips the user and organization tiers
     * @throws ParameterNotConfiguredException if no tier has a value
     */
    public Object resolveForUser(Parameter parameter, User user) {
        return resolveStored(parameter, user, membershipOf(user));
    }

    /** Whether {@link #resolveForUser} would find a value. */
    public boolean isConfiguredFor(Parameter parameter, User user) {
        return findStored(parameter, user, membershipOf(user)).isPresent();
    }

    private Object resolveStored(Parameter parameter, User user, Membership membership) {
        return findStored(parameter, user, membership)
                .orElseThrow(() -> new ParameterNotConfiguredException(parameter));
    }

    private Optional<Object> findStored(Parameter parameter, User user, Membership membership) {
        if (user != null) {
            Optional<ParameterValue> own = store.find(ValueScope.user(user.getId()), parameter);
            if (own.isPresent()) {
                logTier(parameter, ResolutionTier.USER);
                return Optional.of(own.get().getValue());
            }
            if (membership != null) {
                Optional<ParameterValue> org = store.find(
                        ValueScope.organization(membership.getOrganizationOwnerId()), parameter);
                if (org.isPresent()) {
                    logTier(parameter, ResolutionTier.ORGANIZATION);
                    return Optional.of(org.get().getValue());
                }
            }
        }
        Optional<ParameterValue> def = store.find(ValueScope.systemDefault(), parameter);
        if (def.isPresent()) {
            logTier(parameter, ResolutionTier.SYSTEM_DEFAULT);
            return Optional.of(def.get().getValue());
        }
        return Optional.empty();
    }

    private Membership membershipOf(User user) {
        return user != null ? directory.membershipOf(user).orElse(null) : null;
    }

    private static void logTier(Parameter parameter, ResolutionTier tier) {
        if (log.isDebugEnabled()) {
            log.debug("Resolved {} from {}", parameter, tier);
        }
    }
}
