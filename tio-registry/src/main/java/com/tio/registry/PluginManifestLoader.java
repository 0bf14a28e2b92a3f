package com.tio.registry;

import com.tio.parameters.InvalidParameterValueException;
import com.tio.parameters.ParameterStore;
import com.tio.parameters.ValueScope;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginSettings;
import com.tio.pluginconfig.manifest.PluginManifest;
import com.tio.pluginconfig.manifest.PluginManifestParser;
import com.tio.pluginconfig.manifest.ValueDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Registers plugins from declarative JSON manifests and stores the values they carry.
 * A manifest that cannot be read, parsed or registered is logged and skipped; the rest still load.
 */
public final class PluginManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginManifestLoader.class);

    private final PluginConfigRegistry registry;
    private final ParameterStore store;
    private final PluginSettings defaults;

    public PluginManifestLoader(PluginConfigRegistry registry, ParameterStore store) {
        this(registry, store, PluginSettings.defaults());
    }

    /**
     * @param defaults queue and soft time limit of plugins whose manifest omits them
     */
    public PluginManifestLoader(PluginConfigRegistry registry, ParameterStore store, PluginSettings defaults) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.store = Objects.requireNonNull(store, "store");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    /**
     * Loads every {@code *.json} manifest in the directory, in file-name order.
     *
     * @return one result per manifest that could be parsed
     */
    public List<RegistrationResult> loadDirectory(Path dir) {
        List<RegistrationResult> results = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            log.warn("Manifest directory does not exist or is not a directory: {}", dir);
            return results;
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : stream) {
                files.add(file);
            }
        } catch (IOException e) {
            log.warn("Failed to list manifest directory {}: {}", dir, e.getMessage());
            return results;
        }
        files.sort(null);
        for (Path file : files) {
            try {
                results.add(load(PluginManifestParser.fromFile(file), file.toString()));
            } catch (UncheckedIOException | IllegalArgumentException e) {
                log.error("Skipping manifest {}: {}", file, e.getMessage());
            }
        }
        log.info("Loaded {} manifest(s) from {}", results.size(), dir);
        return results;
    }

    /**
     * Loads manifests listed by name from a classpath folder (e.g. {@code manifests/}).
     *
     * @param folder    classpath folder without trailing slash
     * @param fileNames manifest file names inside the folder
     */
    public List<RegistrationResult> loadResources(ClassLoader classLoader, String folder, List<String> fileNames) {
        ClassLoader cl = classLoader != null ? classLoader : Thread.currentThread().getContextClassLoader();
        List<RegistrationResult> results = new ArrayList<>();
        for (String name : fileNames) {
            String resource = folder + "/" + name;
            try (InputStream in = cl.getResourceAsStream(resource)) {
                if (in == null) {
                    log.error("Skipping manifest resource {}: not found", resource);
                    continue;
                }
                results.add(load(PluginManifestParser.fromStream(in), "classpath:" + resource));
            } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
                log.error("Skipping manifest resource {}: {}", resource, e.getMessage());
            }
        }
        return results;
    }

    /**
     * Registers the manifest's plugin and stores its values. Values naming an unknown parameter or
     * carrying the wrong type are logged and skipped.
     *
     * @throws IllegalArgumentException if the manifest does not describe a valid configuration
     */
    public RegistrationResult load(PluginManifest manifest, String source) {
        PluginConfiguration plugin = manifest.toConfiguration(defaults);
        RegistrationResult result = registry.register(plugin);
        if (!result.isRegistered()) {
            log.error("Manifest {} not registered: {}", source, String.join("; ", result.getErrors()));
            return result;
        }
        int stored = 0;
        for (ValueDefinition v : manifest.getValues()) {
            Parameter parameter = plugin.getParameter(v.getParameter());
            if (parameter == null) {
                log.warn("Manifest {}: value for unknown parameter '{}' ignored", source, v.getParameter());
                continue;
            }
            try {
                store.upsert(scopeOf(v), parameter, v.getValue());
                stored++;
            } catch (InvalidParameterValueException | IllegalArgumentException e) {
                log.warn("Manifest {}: value for {} ignored: {}", source, parameter, e.getMessage());
            }
        }
        log.debug("Manifest {}: registered {} with {} value(s)", source, plugin.getRef(), stored);
        return result;
    }

    static ValueScope scopeOf(ValueDefinition v) {
        if (v.isSystemDefault()) {
            return ValueScope.systemDefault();
        }
        return v.isForOrganization() ? ValueScope.organization(v.getOwner()) : ValueScope.user(v.getOwner());
    }
}
