package io.agentrelay.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import jakarta.enterprise.context.ApplicationScoped;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the defaults declared by every {@code META-INF/agentrelay-defaults.properties} on the
 * classpath. A property declared by more than one file is a packaging error.
 */
@ApplicationScoped
public class DefaultValuesConfigProvider implements ConfigProvider {

    static final String DEFAULTS_RESOURCE = "META-INF/agentrelay-defaults.properties";

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    private final Map<String, String> defaults = new HashMap<>();

    public DefaultValuesConfigProvider() {
        this(DefaultValuesConfigProvider.class.getClassLoader());
    }

    DefaultValuesConfigProvider(ClassLoader classLoader) {
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            while (resources.hasMoreElements()) {
                load(resources.nextElement());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
    }

    private void load(URL url) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = url.openStream()) {
            properties.load(in);
        }
        for (String name : properties.stringPropertyNames()) {
            String value = properties.getProperty(name);
            String existing = defaults.putIfAbsent(name, value);
            if (existing != null) {
                throw new IllegalStateException("Duplicate default value for '" + name + "' found in " + url);
            }
        }
        LOGGER.debug("Loaded {} default values from {}", properties.size(), url);
    }

    @Override
    public String getValue(String name) {
        String value = defaults.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No configuration value found for: " + name);
        }
        return value;
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        return Optional.ofNullable(defaults.get(name));
    }
}
