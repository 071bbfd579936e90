package com.mass.simulator.agent;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.FileBasedConfiguration;
import org.apache.commons.configuration2.MapConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;

import static com.google.common.collect.Maps.newHashMap;

/**
 * Assembles agent configuration. Precedence, highest first: jvm system properties, environment
 * variables, <code>config.properties</code> in the agent home directory, built in defaults.
 */
public class ConfigurationLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);

    /** Default filename for configuration properties */
    public static final String DEFAULT_CONFIG_FILENAME = "config.properties";

    /** environment variable names, keyed by the property they override */
    static final Map<String, String> ENVIRONMENT_NAMES = ImmutableMap.<String, String>builder()
            .put(AgentConfiguration.COMMAND_PROCESSOR_CLASSNAME, "COMMAND_PROCESSOR")
            .put(AgentConfiguration.DEVICE_FLAG, "DEVICE_FLAG")
            .put(AgentConfiguration.DEVICE_SERIALNUMBER, "DEVICE_SERIAL")
            .put(AgentConfiguration.DEVICE_BRAND, "DEVICE_BRAND")
            .put(AgentConfiguration.DEVICE_MODEL, "DEVICE_MODEL")
            .put(AgentConfiguration.DEVICE_PROTOCOL_VERSION, "PROTOCOL_VERSION")
            .put(AgentConfiguration.DEVICE_FIRMWARE, "FIRMWARE")
            .put(AgentConfiguration.DEVICE_MANUFACTURE_DATE, "MANUFACTURE_DATE")
            .put(AgentConfiguration.TELEMETRY_SIGNAL, "DEVICE_SIGNAL")
            .put(AgentConfiguration.TELEMETRY_CPU_TEMP, "DEVICE_CPU_TEMP")
            .put(AgentConfiguration.TELEMETRY_DRIFT_ENABLED, "TELEMETRY_DRIFT")
            .put(AgentConfiguration.MQTT_HOSTNAME, "MQTT_BROKER")
            .put(AgentConfiguration.MQTT_PORT, "MQTT_PORT")
            .put(AgentConfiguration.MQTT_USERNAME, "MQTT_USERNAME")
            .put(AgentConfiguration.MQTT_PASSWORD, "MQTT_PASSWORD")
            .put(AgentConfiguration.MQTT_KEEPALIVE, "MQTT_KEEPALIVE")
            .put(AgentConfiguration.MQTT_QOS, "MQTT_QOS")
            .put(AgentConfiguration.MQTT_OUTBOUND_TOPIC, "TOPIC_TO_SERVER")
            .put(AgentConfiguration.MQTT_INBOUND_TOPIC, "TOPIC_FROM_SERVER")
            .put(AgentConfiguration.HEARTBEAT_INTERVAL, "HEARTBEAT_INTERVAL")
            .put(AgentConfiguration.WEB_SERVER_PORT, "API_PORT")
            .put(AgentConfiguration.WEB_SERVER_RUN_ON_START, "API_ENABLED")
            .put(AgentConfiguration.UNIT_PROFILE, "UNIT_PROFILE")
            .build();

    /**
     * Load configuration for an agent home directory. A missing properties file is not an
     * error, defaults apply.
     *
     * @param homePath
     * @return the layered configuration
     */
    public CompositeConfiguration load(String homePath) {
        return load(homePath, System.getenv());
    }

    @VisibleForTesting
    CompositeConfiguration load(String homePath, Map<String, String> environment) {
        CompositeConfiguration config = new CompositeConfiguration();
        config.addConfiguration(new SystemConfiguration());
        config.addConfiguration(new MapConfiguration(fromEnvironment(environment)));

        File propsFile = homePath != null ? new File(homePath, DEFAULT_CONFIG_FILENAME) : new File(DEFAULT_CONFIG_FILENAME);
        if (propsFile.exists()) {
            LOGGER.info("Loading configuration from properties file: {}", propsFile.getAbsolutePath());
            FileBasedConfigurationBuilder<FileBasedConfiguration> builder =
                    new FileBasedConfigurationBuilder<FileBasedConfiguration>(PropertiesConfiguration.class)
                            .configure(new Parameters().properties().setFile(propsFile));
            try {
                config.addConfiguration(builder.getConfiguration());
            } catch (ConfigurationException e) {
                throw Throwables.propagate(e);
            }
        } else {
            LOGGER.info("No {} found in {}, using defaults and environment", DEFAULT_CONFIG_FILENAME, homePath);
        }
        return config;
    }

    private static Map<String, Object> fromEnvironment(Map<String, String> environment) {
        Map<String, Object> values = newHashMap();
        for (Map.Entry<String, String> entry : ENVIRONMENT_NAMES.entrySet()) {
            String value = environment.get(entry.getValue());
            if (value != null && !value.isEmpty()) {
                values.put(entry.getKey(), value);
            }
        }
        return values;
    }
}
