package com.lantromipis.pgasync.configuration.utils;

import com.lantromipis.pgasync.configuration.exception.ConfigurationInitializationException;
import com.lantromipis.pgasync.configuration.properties.PgConnectionPoolProperties;
import com.lantromipis.pgasync.configuration.properties.PgConnectionProperties;
import io.smallrye.config.ConfigValidationException;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;

/**
 * Builds config mappings outside of any container. Default MicroProfile sources are always used
 * (system properties, environment, META-INF/microprofile-config.properties), explicit properties override them.
 */
@Slf4j
public class PgAsyncConfigurationLoader {

    private static final String EXPLICIT_PROPERTIES_SOURCE_NAME = "pg-async-explicit-properties";
    private static final int EXPLICIT_PROPERTIES_SOURCE_ORDINAL = 500;

    public static PgConnectionProperties loadConnectionProperties() {
        return loadConnectionProperties(Collections.emptyMap());
    }

    public static PgConnectionProperties loadConnectionProperties(Map<String, String> properties) {
        return loadMapping(PgConnectionProperties.class, properties);
    }

    public static PgConnectionPoolProperties loadPoolProperties(Map<String, String> properties) {
        return loadMapping(PgConnectionPoolProperties.class, properties);
    }

    public static <T> T loadMapping(Class<T> mappingClass, Map<String, String> properties) {
        try {
            SmallRyeConfig config = new SmallRyeConfigBuilder()
                    .addDefaultSources()
                    .addDefaultInterceptors()
                    .withSources(new PropertiesConfigSource(properties, EXPLICIT_PROPERTIES_SOURCE_NAME, EXPLICIT_PROPERTIES_SOURCE_ORDINAL))
                    .withMapping(mappingClass)
                    .build();

            return config.getConfigMapping(mappingClass);
        } catch (ConfigValidationException e) {
            log.error("Invalid pg-async configuration for {}", mappingClass.getSimpleName());
            throw new ConfigurationInitializationException("Failed to load configuration " + mappingClass.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private PgAsyncConfigurationLoader() {
    }
}
