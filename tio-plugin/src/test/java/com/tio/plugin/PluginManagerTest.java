package com.tio.plugin;

import com.tio.pluginconfig.PluginKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PluginManagerTest {

    /** Declared in the test META-INF/services file. */
    public static final class ClasspathProvider implements PluginHandlerProvider {
        @Override
        public String getEntryPoint() {
            return "test.Classpath";
        }

        @Override
        public PluginKind getKind() {
            return PluginKind.VISUALIZER;
        }

        @Override
        public PluginHandler getHandler() {
            return invocation -> Map.of("rendered", true);
        }
    }

    private static PluginHandlerProvider internal(String entryPoint) {
        return new PluginHandlerProvider() {
            @Override
            public String getEntryPoint() {
                return entryPoint;
            }

            @Override
            public PluginKind getKind() {
                return PluginKind.ANALYZER;
            }

            @Override
            public PluginHandler getHandler() {
                return invocation -> Map.of();
            }
        };
    }

    @Test
    void discoverProviders_findsServiceLoaderProviders() {
        PluginManager manager = new PluginManager();
        manager.registerInternal(internal("test.Internal"));

        manager.discoverProviders(getClass().getClassLoader());

        assertEquals(1, manager.getInternalCount());
        assertEquals(1, manager.getDiscoveredCount());
        assertEquals("test.Internal", manager.getProviders().get(0).getEntryPoint());
        assertEquals("test.Classpath", manager.getProviders().get(1).getEntryPoint());
    }

    @Test
    void discoverProviders_skipsEntryPointAlreadyInternal() {
        PluginManager manager = new PluginManager();
        manager.registerInternal(internal("test.Classpath"));

        manager.discoverProviders(getClass().getClassLoader());

        assertEquals(0, manager.getDiscoveredCount());
        assertEquals(1, manager.getProviders().size());
    }
}
