package com.tio.dispatch;

import com.tio.config.QueueSettings;
import com.tio.identity.OrganizationDirectory;
import com.tio.identity.User;
import com.tio.job.Job;
import com.tio.job.JobStatus;
import com.tio.job.Observable;
import com.tio.job.RejectionReason;
import com.tio.job.RuntimeConfiguration;
import com.tio.parameters.InMemoryParameterStore;
import com.tio.parameters.ParameterResolver;
import com.tio.parameters.ValueScope;
import com.tio.plugin.PluginHandlerRegistry;
import com.tio.pluginconfig.ObservableClassification;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.ParameterType;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginSettings;
import com.tio.registry.PluginConfigRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskSignatureBuilderTest {

    private static final User ALICE = User.of("alice");

    private InMemoryParameterStore store;
    private ParameterResolver resolver;
    private PluginConfigRegistry registry;
    private TaskSignatureBuilder builder;
    private PluginConfiguration validin;
    private Job job;

    @BeforeEach
    void setUp() {
        PluginHandlerRegistry handlers = new PluginHandlerRegistry();
        handlers.register("validin.Validin", PluginKind.ANALYZER, "1.0", invocation -> Map.of());
        store = new InMemoryParameterStore();
        resolver = new ParameterResolver(store, OrganizationDirectory.NONE);
        registry = new PluginConfigRegistry(handlers, resolver,
                new QueueSettings(List.of("long"), "default", "prod-"));
        builder = new TaskSignatureBuilder(registry, 10);
        validin = registry.registerOrThrow(PluginConfiguration.builder(PluginKind.ANALYZER, "Validin")
                .entryPoint("validin.Validin")
                .settings(new PluginSettings("long", 120))
                .parameter("api_key_name", ParameterType.STRING, true, true)
                .build());
        store.upsert(ValueScope.user(ALICE.getId()), validin.getParameter("api_key_name"), "secret-key");
        job = Job.builder()
                .user(ALICE)
                .observable(Observable.of("example.com", ObservableClassification.DOMAIN))
                .build();
    }

    @Test
    void build_mintsDistinctTokensForSameInputs() {
        Map<Parameter, Object> params = resolver.readParams(validin, job);

        TaskDescriptor first = builder.build(validin, job, params);
        TaskDescriptor second = builder.build(validin, job, params);

        assertNotEquals(first.getToken(), second.getToken());
    }

    @Test
    void build_carriesSettingsAndResolvedParameters() {
        TaskDescriptor descriptor = builder.build(validin, job, resolver.readParams(validin, job));

        assertEquals(TaskType.PLUGIN_RUN, descriptor.getType());
        assertEquals("prod-long", descriptor.getQueue());
        assertEquals(120, descriptor.getSoftTimeLimitSeconds());
        assertEquals("validin.Validin", descriptor.getEntryPoint());
        assertEquals("secret-key", descriptor.getParameters().get("api_key_name"));
        assertEquals(PluginKind.ANALYZER, descriptor.getStageKind());
        assertTrue(descriptor.getDependencies().isEmpty());
    }

    @Test
    void build_notRunnableForUserWithoutValue() {
        Job anonymous = Job.builder().observable(Observable.of("example.com", ObservableClassification.DOMAIN)).build();

        PluginNotRunnableException e = assertThrows(PluginNotRunnableException.class,
                () -> builder.build(validin, anonymous, Map.of()));
        assertEquals(RejectionReason.Cause.PARAMETER_NOT_CONFIGURED, e.getReason().getCause());
        assertEquals(validin.getRef(), e.getPlugin());
    }

    @Test
    void build_runtimeOverrideDoesNotMakePluginRunnable() {
        Job withOverride = Job.builder()
                .observable(Observable.of("example.com", ObservableClassification.DOMAIN))
                .runtimeConfiguration(RuntimeConfiguration.fromJson("{\"Validin\": {\"api_key_name\": \"R\"}}"))
                .build();

        assertThrows(PluginNotRunnableException.class,
                () -> builder.build(validin, withOverride, resolver.readParams(validin, withOverride)));
    }

    @Test
    void build_invalidQueueFallsBackAtDispatchTime() {
        PluginConfiguration unregistered = PluginConfiguration.builder(PluginKind.CONNECTOR, "Adhoc")
                .entryPoint("adhoc.Adhoc")
                .settings(new PluginSettings("gpu", 60))
                .build();

        TaskDescriptor descriptor = builder.build(unregistered, job, Map.of());

        assertEquals("prod-default", descriptor.getQueue());
    }

    @Test
    void buildStageTransition_shortLimitDefaultQueueAllDependencies() {
        TaskDescriptor a = builder.build(validin, job, resolver.readParams(validin, job));
        TaskDescriptor b = builder.build(validin, job, resolver.readParams(validin, job));

        TaskDescriptor transition = builder.buildStageTransition(job, JobStatus.ANALYZERS_COMPLETED,
                Set.of(a.getToken(), b.getToken()));

        assertEquals(TaskType.STAGE_TRANSITION, transition.getType());
        assertEquals(10, transition.getSoftTimeLimitSeconds());
        assertEquals("prod-default", transition.getQueue());
        assertEquals(Set.of(a.getToken(), b.getToken()), transition.getDependencies());
        assertEquals(JobStatus.ANALYZERS_COMPLETED, transition.getTargetStatus());
        assertNull(transition.getPluginName());
        assertFalse(transition.getDependencies().contains(transition.getToken()));
    }

    @Test
    void toString_neverPrintsParameterValues() {
        TaskDescriptor descriptor = builder.build(validin, job, resolver.readParams(validin, job));

        assertFalse(descriptor.toString().contains("secret-key"));
        assertTrue(descriptor.toString().contains("api_key_name"));
    }

    @Test
    void toJson_keepsDescriptorIntact() {
        TaskDescriptor descriptor = builder.build(validin, job, resolver.readParams(validin, job));

        TaskDescriptor copy = TaskDescriptor.fromJson(descriptor.toJson());

        assertEquals(descriptor.getToken(), copy.getToken());
        assertEquals(descriptor.getQueue(), copy.getQueue());
        assertEquals(descriptor.getParameters(), copy.getParameters());
        assertEquals(PluginKind.ANALYZER, copy.getStageKind());
    }
}
