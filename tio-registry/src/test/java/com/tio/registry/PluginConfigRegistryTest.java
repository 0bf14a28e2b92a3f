package com.tio.registry;

import com.tio.config.QueueSettings;
import com.tio.identity.InMemoryOrganizationDirectory;
import com.tio.identity.Membership;
import com.tio.identity.User;
import com.tio.job.RejectionReason;
import com.tio.parameters.InMemoryParameterStore;
import com.tio.parameters.ParameterResolver;
import com.tio.parameters.ValueScope;
import com.tio.plugin.PluginHandlerRegistry;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.ParameterType;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginConfigRegistryTest {

    private static final User ALICE = User.of("alice");
    private static final User BOB = User.of("bob");

    private InMemoryParameterStore store;
    private PluginConfigRegistry registry;

    @BeforeEach
    void setUp() {
        PluginHandlerRegistry handlers = new PluginHandlerRegistry();
        handlers.register("validin.Validin", PluginKind.ANALYZER, "1.0", invocation -> Map.of());
        handlers.register("misp.Misp", PluginKind.CONNECTOR, "1.0", invocation -> Map.of());
        store = new InMemoryParameterStore();
        InMemoryOrganizationDirectory directory = new InMemoryOrganizationDirectory()
                .join(ALICE, new Membership("X", "Org X", "olivia"));
        registry = new PluginConfigRegistry(handlers, new ParameterResolver(store, directory),
                new QueueSettings(List.of("long"), "default", ""));
    }

    private static PluginConfiguration.Builder validin() {
        return PluginConfiguration.builder(PluginKind.ANALYZER, "Validin")
                .entryPoint("validin.Validin")
                .parameter("api_key_name", ParameterType.STRING, true, true)
                .parameter("scan_choice", ParameterType.STRING, false, false);
    }

    @Test
    void checkRunnable_disabledForUsersOrganizationOnly() {
        PluginConfiguration plugin = registry.registerOrThrow(validin().disabledInOrganization("X").build());
        store.upsert(ValueScope.systemDefault(), plugin.getParameter("api_key_name"), "D");

        RunnabilityCheck forAlice = registry.checkRunnable(plugin, ALICE);
        assertFalse(forAlice.isRunnable());
        assertEquals(RejectionReason.Cause.DISABLED_FOR_ORGANIZATION, forAlice.getRejection().getCause());
        assertTrue(registry.isRunnable(plugin, BOB));
    }

    @Test
    void checkRunnable_globallyDisabled() {
        PluginConfiguration plugin = registry.registerOrThrow(validin().disabled(true).build());
        store.upsert(ValueScope.systemDefault(), plugin.getParameter("api_key_name"), "D");

        assertEquals(RejectionReason.Cause.DISABLED, registry.checkRunnable(plugin, BOB).getRejection().getCause());
    }

    @Test
    void checkRunnable_requiredParameterWithoutValue() {
        PluginConfiguration plugin = registry.registerOrThrow(validin().build());

        RunnabilityCheck check = registry.checkRunnable(plugin, ALICE);

        assertFalse(check.isRunnable());
        assertEquals(RejectionReason.Cause.PARAMETER_NOT_CONFIGURED, check.getRejection().getCause());
        assertEquals("api_key_name", check.getRejection().getParameterName());
    }

    @Test
    void checkRunnable_organizationValueMakesMembersRunnable() {
        PluginConfiguration plugin = registry.registerOrThrow(validin().build());
        store.upsert(ValueScope.organization("olivia"), plugin.getParameter("api_key_name"), "O");

        assertTrue(registry.isRunnable(plugin, ALICE));
        assertFalse(registry.isRunnable(plugin, BOB));
        assertEquals(List.of(plugin), registry.runnable(PluginKind.ANALYZER, ALICE));
        assertTrue(registry.runnable(PluginKind.ANALYZER, BOB).isEmpty());
    }

    @Test
    void register_invalidQueueFallsBackToDefaultWithWarning() {
        RegistrationResult result = registry.register(validin().settings(new PluginSettings("gpu", 45)).build());

        assertTrue(result.isRegistered());
        assertEquals(1, result.getWarnings().size());
        PluginConfiguration stored = registry.get("Validin").orElseThrow();
        assertEquals("default", stored.getSettings().getQueue());
        assertEquals(45, stored.getSettings().getSoftTimeLimitSeconds());
    }

    @Test
    void register_validNonDefaultQueueIsKept() {
        registry.registerOrThrow(validin().settings(new PluginSettings("long", 300)).build());

        assertEquals("long", registry.get("Validin").orElseThrow().getSettings().getQueue());
    }

    @Test
    void register_missingEntryPointRejectsOnlyThatPlugin() {
        RegistrationResult bad = registry.register(PluginConfiguration.builder(PluginKind.ANALYZER, "Ghost")
                .entryPoint("ghost.Missing")
                .build());
        RegistrationResult good = registry.register(validin().build());

        assertFalse(bad.isRegistered());
        assertTrue(bad.getErrors().get(0).contains("ghost.Missing"));
        assertTrue(good.isRegistered());
        assertTrue(registry.get("Ghost").isEmpty());
    }

    @Test
    void register_nameUniqueAcrossKinds() {
        registry.registerOrThrow(validin().build());

        RegistrationResult clash = registry.register(PluginConfiguration.builder(PluginKind.CONNECTOR, "Validin")
                .entryPoint("misp.Misp")
                .build());

        assertFalse(clash.isRegistered());
        assertEquals(PluginKind.ANALYZER, registry.get("Validin").orElseThrow().getKind());
    }

    @Test
    void registerOrThrow_throwsOnRejection() {
        PluginRegistrationException e = assertThrows(PluginRegistrationException.class,
                () -> registry.registerOrThrow(PluginConfiguration.builder(PluginKind.CONNECTOR, "Ghost")
                        .entryPoint("ghost.Missing")
                        .build()));
        assertEquals("Ghost", e.getResult().getPluginName());
    }

    @Test
    void replace_newConfigurationSeenByRunnabilityChecks() {
        PluginConfiguration original = registry.registerOrThrow(validin().build());
        store.upsert(ValueScope.systemDefault(), original.getParameter("api_key_name"), "D");
        assertTrue(registry.isRunnable(original, BOB));

        assertTrue(registry.replace(validin().disabled(true).build()).isRegistered());

        assertFalse(registry.isRunnable(original, BOB));
        assertTrue(registry.get("Validin").orElseThrow().isDisabled());
    }

    @Test
    void replace_cannotChangeKindOrCreate() {
        registry.registerOrThrow(validin().build());

        assertFalse(registry.replace(PluginConfiguration.builder(PluginKind.CONNECTOR, "Validin")
                .entryPoint("misp.Misp").build()).isRegistered());
        assertFalse(registry.replace(PluginConfiguration.builder(PluginKind.CONNECTOR, "Misp")
                .entryPoint("misp.Misp").build()).isRegistered());
    }

    @Test
    void parameterViews_splitBySecrecyAndRequirement() {
        PluginConfiguration plugin = registry.registerOrThrow(validin().build());

        assertEquals(List.of("api_key_name"), names(registry.secretParameters(plugin)));
        assertEquals(List.of("scan_choice"), names(registry.visibleParameters(plugin)));
        assertEquals(List.of("api_key_name"), names(registry.requiredParameters(plugin)));
    }

    @Test
    void all_filtersByKindSortedByName() {
        registry.registerOrThrow(validin().build());
        PluginConfiguration misp = registry.registerOrThrow(PluginConfiguration.builder(PluginKind.CONNECTOR, "Misp")
                .entryPoint("misp.Misp").build());

        assertEquals(List.of(misp), registry.all(PluginKind.CONNECTOR));
        assertEquals(2, registry.all().size());
        assertSame(misp, registry.get("Misp").orElseThrow());
    }

    private static List<String> names(List<Parameter> parameters) {
        return parameters.stream().map(Parameter::getName).collect(Collectors.toList());
    }
}
