package io.agentrelay.server.config;

import java.util.Optional;

/**
 * Source of configuration values for the server components.
 * <p>
 * The default implementation, {@link DefaultValuesConfigProvider}, serves the values declared in
 * {@code META-INF/agentrelay-defaults.properties} files. Integrations can provide an alternative
 * bean backed by their own configuration system and fall back to the defaults.
 */
public interface ConfigProvider {

    /**
     * Returns a configuration value.
     *
     * @param name the property name
     * @return the value
     * @throws IllegalArgumentException if the property is not defined
     */
    String getValue(String name);

    /**
     * Returns a configuration value if it is defined.
     *
     * @param name the property name
     * @return the value, or an empty optional
     */
    Optional<String> getOptionalValue(String name);
}
