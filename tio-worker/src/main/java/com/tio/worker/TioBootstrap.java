package com.tio.worker;

import com.tio.config.TioConfig;
import com.tio.dispatch.TaskSignatureBuilder;
import com.tio.dispatch.TaskSubmitter;
import com.tio.identity.InMemoryOrganizationDirectory;
import com.tio.identity.OrganizationDirectory;
import com.tio.internal.plugins.InternalPlugins;
import com.tio.job.InMemoryJobStore;
import com.tio.job.JobStore;
import com.tio.parameters.InMemoryParameterStore;
import com.tio.parameters.ParameterResolver;
import com.tio.parameters.ParameterStore;
import com.tio.parameters.RedisParameterStore;
import com.tio.pipeline.DispatchMetrics;
import com.tio.pipeline.JobPipelineCoordinator;
import com.tio.plugin.PluginHandlerProvider;
import com.tio.plugin.PluginHandlerRegistry;
import com.tio.plugin.PluginManager;
import com.tio.pluginconfig.PluginSettings;
import com.tio.registry.PluginConfigRegistry;
import com.tio.registry.PluginManifestLoader;
import com.tio.registry.RegistrationResult;
import com.tio.report.InMemoryReportStore;
import com.tio.report.ReportStore;
import com.tio.report.schema.ReportSchemaBootstrapper;
import com.tio.report.store.JdbcReportStore;
import com.tio.report.store.ReportConnectionProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Worker bootstrap: registers plugin handlers, creates the parameter and report stores, loads plugin
 * manifests and wires the coordinator and task executor around the given submitter.
 * <p>
 * Internal handler registration failures are fatal; discovered handlers that fail are logged and skipped.
 */
public final class TioBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TioBootstrap.class);

    /** Classpath folder holding the bundled manifests. */
    static final String MANIFEST_RESOURCE_FOLDER = "manifests";
    static final List<String> BUNDLED_MANIFESTS = List.of(
            "validin.json",
            "observable_info.json",
            "json_export.json",
            "observable_summary.json",
            "extract_host.json");

    private TioBootstrap() {
    }

    /**
     * Bootstraps with a fresh handler registry, an empty organization directory and a simple meter registry.
     */
    public static WorkerContext initialize(TioConfig config, TaskSubmitter submitter) {
        return initialize(config, submitter, new PluginHandlerRegistry(), new InMemoryOrganizationDirectory(),
                new SimpleMeterRegistry());
    }

    public static WorkerContext initialize(TioConfig config, TaskSubmitter submitter, PluginHandlerRegistry handlers,
                                           OrganizationDirectory directory, MeterRegistry meterRegistry) {
        log.info("Bootstrap: queues={} default={} prefix='{}'", config.getQueueSettings().getValidQueues(),
                config.getQueueSettings().getDefaultQueue(), config.getQueueSettings().getPrefix());
        registerHandlers(InternalPlugins.createPluginManager(), handlers);

        ParameterStore parameterStore = createParameterStore(config);
        ParameterResolver resolver = new ParameterResolver(parameterStore, directory);
        PluginConfigRegistry registry = new PluginConfigRegistry(handlers, resolver, config.getQueueSettings());
        loadManifests(config, registry, parameterStore);

        ReportStore reportStore = createReportStore(config);
        JobStore jobStore = new InMemoryJobStore();
        DispatchMetrics metrics = new DispatchMetrics(meterRegistry);
        JobPipelineCoordinator coordinator = new JobPipelineCoordinator(jobStore, registry,
                new TaskSignatureBuilder(registry, config), submitter, metrics);
        TaskExecutor executor = new TaskExecutor(handlers, jobStore, reportStore, coordinator);

        log.info("Bootstrap complete: {} handler(s), {} plugin configuration(s)", handlers.getAll().size(),
                registry.all().size());
        return new WorkerContext(config, handlers, parameterStore, registry, jobStore, reportStore, metrics,
                coordinator, executor);
    }

    static int registerHandlers(PluginManager pluginManager, PluginHandlerRegistry handlers) {
        int count = 0;
        // Internal providers: any failure is fatal.
        for (PluginHandlerProvider provider : pluginManager.getInternalProviders()) {
            if (!provider.isEnabled()) continue;
            handlers.register(provider);
            count++;
            log.info("Registered handler {} (kind={}, version={})", provider.getEntryPoint(), provider.getKind(),
                    provider.getVersion());
        }
        // Discovered providers: failure is log-and-skip.
        for (PluginHandlerProvider provider : pluginManager.getDiscoveredProviders()) {
            try {
                if (!provider.isEnabled()) continue;
                handlers.register(provider);
                count++;
                log.info("Registered discovered handler {} (kind={}, version={})", provider.getEntryPoint(),
                        provider.getKind(), provider.getVersion());
            } catch (RuntimeException e) {
                log.error("Discovered handler failed to register (skipping): entryPoint={}, error={}",
                        provider.getEntryPoint(), e.getMessage(), e);
            }
        }
        if (count == 0) {
            log.warn("No plugin handlers registered; every plugin configuration will be rejected");
        }
        return count;
    }

    static ParameterStore createParameterStore(TioConfig config) {
        if (TioConfig.PARAMETER_STORE_REDIS.equalsIgnoreCase(config.getParameterStore())) {
            log.info("Parameter store: Redis at {}:{}", config.getCacheHost(), config.getCachePort());
            return new RedisParameterStore(config);
        }
        log.info("Parameter store: in-memory");
        return new InMemoryParameterStore();
    }

    static ReportStore createReportStore(TioConfig config) {
        if (!config.isReportLedgerEnabled()) {
            return new InMemoryReportStore();
        }
        try {
            ReportConnectionProvider connections = new ReportConnectionProvider(config);
            new ReportSchemaBootstrapper(connections).ensureSchema();
            log.info("Report store: PostgreSQL at {}:{}/{}", config.getDbHost(), config.getDbPort(), config.getDbName());
            return new JdbcReportStore(connections);
        } catch (RuntimeException e) {
            log.warn("Report store using in-memory store: could not create or init JDBC store ({}). Execution continues.",
                    e.getMessage());
            return new InMemoryReportStore();
        }
    }

    /** Manifests come from the configured directory when it exists, otherwise from the bundled resources. */
    static List<RegistrationResult> loadManifests(TioConfig config, PluginConfigRegistry registry, ParameterStore store) {
        PluginManifestLoader loader = new PluginManifestLoader(registry, store, new PluginSettings(
                config.getQueueSettings().getDefaultQueue(), config.getDefaultSoftTimeLimitSeconds()));
        Path dir = Path.of(config.getManifestDir());
        if (Files.isDirectory(dir)) {
            log.info("Loading plugin manifests from {}", dir.toAbsolutePath());
            return loader.loadDirectory(dir);
        }
        log.info("Manifest directory {} not found; loading bundled manifests", dir.toAbsolutePath());
        return loader.loadResources(TioBootstrap.class.getClassLoader(), MANIFEST_RESOURCE_FOLDER, BUNDLED_MANIFESTS);
    }
}
