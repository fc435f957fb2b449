package com.e2eq.dats.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Map;

/**
 * Builds {@link GraphConfig} outside of a container, from the default sources (system properties,
 * environment, {@code META-INF/microprofile-config.properties}) plus optional overrides.
 */
public final class GraphConfigs {
    private GraphConfigs() {}

    private static final int OVERRIDE_ORDINAL = 1000;

    public static GraphConfig defaults() {
        return load(Map.of());
    }

    public static GraphConfig load() {
        return load(Map.of());
    }

    /**
     * @param overrides property values that take precedence over every default source,
     *                  e.g. {@code quantum.dats.graph.allow-back-links=false}
     * @return the mapped configuration
     */
    public static GraphConfig load(Map<String, String> overrides) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(GraphConfig.class);
        if (overrides != null && !overrides.isEmpty()) {
            builder.withSources(new PropertiesConfigSource(overrides, "graph-overrides", OVERRIDE_ORDINAL));
        }
        SmallRyeConfig config = builder.build();
        return config.getConfigMapping(GraphConfig.class);
    }

    public static GraphConfig withBackLinks(boolean allowBackLinks) {
        return load(Map.of("quantum.dats.graph.allow-back-links", Boolean.toString(allowBackLinks)));
    }
}
