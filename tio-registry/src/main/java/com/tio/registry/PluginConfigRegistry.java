package com.tio.registry;

import com.tio.config.QueueSettings;
import com.tio.identity.Membership;
import com.tio.identity.User;
import com.tio.job.RejectionReason;
import com.tio.parameters.ParameterResolver;
import com.tio.plugin.EntryPointLoader;
import com.tio.plugin.EntryPointNotFoundException;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginNameValidator;
import com.tio.pluginconfig.PluginSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Catalogue of plugin configurations of every kind, keyed by name (names are unique across kinds).
 * <p>
 * Registration checks the entry point against the {@link EntryPointLoader} and rejects the plugin if it cannot
 * be loaded; other plugins are unaffected. An invalid queue is not fatal: the plugin is registered on the
 * default queue and a warning is logged.
 * <p>
 * Runnability is computed on demand from the current configuration and stored values; nothing is cached.
 */
public final class PluginConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginConfigRegistry.class);

    private final Map<String, PluginConfiguration> pluginsByName = new ConcurrentHashMap<>();
    private final EntryPointLoader entryPointLoader;
    private final ParameterResolver resolver;
    private final QueueSettings queueSettings;

    public PluginConfigRegistry(EntryPointLoader entryPointLoader, ParameterResolver resolver,
                                QueueSettings queueSettings) {
        this.entryPointLoader = Objects.requireNonNull(entryPointLoader, "entryPointLoader");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.queueSettings = queueSettings != null ? queueSettings : QueueSettings.defaults();
    }

    public ParameterResolver getResolver() {
        return resolver;
    }

    public QueueSettings getQueueSettings() {
        return queueSettings;
    }

    /**
     * Registers a new plugin configuration. Never throws for a bad configuration; the result says why it was rejected.
     */
    public RegistrationResult register(PluginConfiguration plugin) {
        Objects.requireNonNull(plugin, "plugin");
        RegistrationResult checked = validate(plugin);
        if (!checked.isRegistered()) {
            return checked;
        }
        if (pluginsByName.putIfAbsent(plugin.getName(), checked.getConfiguration()) != null) {
            return reject(plugin.getName(), "plugin name already registered: " + plugin.getName());
        }
        log.info("Registered plugin {} (entryPoint={}, queue={})", plugin.getRef(), plugin.getEntryPoint(),
                checked.getConfiguration().getSettings().getQueue());
        return checked;
    }

    /**
     * Registers a plugin that must be present.
     *
     * @throws PluginRegistrationException if registration is rejected
     */
    public PluginConfiguration registerOrThrow(PluginConfiguration plugin) {
        RegistrationResult result = register(plugin);
        if (!result.isRegistered()) {
            throw new PluginRegistrationException(result);
        }
        return result.getConfiguration();
    }

    /**
     * Replaces an existing configuration (administrative change). The kind cannot change.
     * Subsequent runnability checks and dispatches see the new configuration.
     */
    public RegistrationResult replace(PluginConfiguration plugin) {
        Objects.requireNonNull(plugin, "plugin");
        PluginConfiguration current = pluginsByName.get(plugin.getName());
        if (current == null) {
            return reject(plugin.getName(), "plugin not registered: " + plugin.getName());
        }
        if (current.getKind() != plugin.getKind()) {
            return reject(plugin.getName(), "plugin " + plugin.getName() + " is a " + current.getKind()
                    + ", cannot become a " + plugin.getKind());
        }
        RegistrationResult checked = validate(plugin);
        if (!checked.isRegistered()) {
            return checked;
        }
        pluginsByName.put(plugin.getName(), checked.getConfiguration());
        log.info("Replaced configuration of plugin {}", plugin.getRef());
        return checked;
    }

    private RegistrationResult validate(PluginConfiguration plugin) {
        if (!PluginNameValidator.isValid(plugin.getName())) {
            return reject(plugin.getName(), "invalid plugin name");
        }
        try {
            entryPointLoader.load(plugin.getEntryPoint());
        } catch (EntryPointNotFoundException e) {
            return reject(plugin.getName(), e.getMessage());
        }
        List<String> warnings = new ArrayList<>();
        PluginConfiguration effective = plugin;
        String queue = plugin.getSettings().getQueue();
        if (!queueSettings.isValid(queue)) {
            String fallback = queueSettings.getDefaultQueue();
            log.warn("Plugin {} configured with invalid queue '{}'; using '{}'", plugin.getRef(), queue, fallback);
            warnings.add("invalid queue '" + queue + "', using '" + fallback + "'");
            effective = plugin.withSettings(new PluginSettings(fallback, plugin.getSettings().getSoftTimeLimitSeconds()));
        }
        return RegistrationResult.success(effective, warnings);
    }

    private static RegistrationResult reject(String name, String error) {
        RegistrationResult result = RegistrationResult.failure(name, error);
        log.error("Plugin {} rejected: {}", name, error);
        return result;
    }

    public Optional<PluginConfiguration> get(String name) {
        return name != null ? Optional.ofNullable(pluginsByName.get(name)) : Optional.empty();
    }

    /** Configurations of one kind, sorted by name. */
    public List<PluginConfiguration> all(PluginKind kind) {
        return pluginsByName.values().stream()
                .filter(p -> p.getKind() == kind)
                .sorted(Comparator.comparing(PluginConfiguration::getName))
                .collect(Collectors.toList());
    }

    /** Every configuration, sorted by name. */
    public List<PluginConfiguration> all() {
        return pluginsByName.values().stream()
                .sorted(Comparator.comparing(PluginConfiguration::getName))
                .collect(Collectors.toList());
    }

    /** Plugins of the kind that are runnable for the user, sorted by name. */
    public List<PluginConfiguration> runnable(PluginKind kind, User user) {
        return all(kind).stream().filter(p -> isRunnable(p, user)).collect(Collectors.toList());
    }

    public boolean isRunnable(PluginConfiguration plugin, User user) {
        return checkRunnable(plugin, user).isRunnable();
    }

    /**
     * Decides whether the plugin may run for the user: it must not be disabled, not be disabled for the user's
     * organization, and every required parameter must have a stored value the user can see. Runtime
     * overrides are not considered.
     */
    public RunnabilityCheck checkRunnable(PluginConfiguration plugin, User user) {
        Objects.requireNonNull(plugin, "plugin");
        PluginConfiguration current = pluginsByName.getOrDefault(plugin.getName(), plugin);
        if (current.isDisabled()) {
            return RunnabilityCheck.rejected(RejectionReason.of(current.getRef(), RejectionReason.Cause.DISABLED,
                    "plugin is disabled"));
        }
        if (user != null) {
            Optional<Membership> membership = resolver.getDirectory().membershipOf(user);
            if (membership.isPresent() && current.isDisabledFor(membership.get().getOrganizationId())) {
                return RunnabilityCheck.rejected(RejectionReason.of(current.getRef(),
                        RejectionReason.Cause.DISABLED_FOR_ORGANIZATION,
                        "plugin is disabled for organization " + membership.get().getOrganizationName()));
            }
        }
        for (Parameter parameter : requiredParameters(current)) {
            if (!resolver.isConfiguredFor(parameter, user)) {
                return RunnabilityCheck.rejected(new RejectionReason(current.getRef(), parameter.getName(),
                        RejectionReason.Cause.PARAMETER_NOT_CONFIGURED, "required parameter has no value"));
            }
        }
        return RunnabilityCheck.runnable();
    }

    public List<Parameter> requiredParameters(PluginConfiguration plugin) {
        return plugin.getParameters().stream().filter(Parameter::isRequired).collect(Collectors.toList());
    }

    public List<Parameter> secretParameters(PluginConfiguration plugin) {
        return plugin.getParameters().stream().filter(Parameter::isSecret).collect(Collectors.toList());
    }

    /** Non-secret parameters (options a user may see and set freely). */
    public List<Parameter> visibleParameters(PluginConfiguration plugin) {
        return plugin.getParameters().stream().filter(p -> !p.isSecret()).collect(Collectors.toList());
    }
}
