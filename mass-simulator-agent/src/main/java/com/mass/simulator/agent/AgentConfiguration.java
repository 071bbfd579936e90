package com.mass.simulator.agent;

/**
 * Constants for agent configuration properties.
 *
 */
public interface AgentConfiguration {

	/** Property for command processor classname */
	public static final String COMMAND_PROCESSOR_CLASSNAME = "command.processor.classname";

	/** Three character brand flag of the unit */
	public static final String DEVICE_FLAG = "device.flag";

	/** Unit serial number */
	public static final String DEVICE_SERIALNUMBER = "device.serialnumber";

	public static final String DEVICE_BRAND = "device.brand";

	public static final String DEVICE_MODEL = "device.model";

	public static final String DEVICE_PROTOCOL_VERSION = "device.protocolversion";

	public static final String DEVICE_FIRMWARE = "device.firmware";

	public static final String DEVICE_MANUFACTURE_DATE = "device.manufacturedate";

	/** Signal strength reported at startup and after a reset */
	public static final String TELEMETRY_SIGNAL = "telemetry.signal";

	/** CPU temperature reported at startup and after a reset */
	public static final String TELEMETRY_CPU_TEMP = "telemetry.cputemp";

	/** Optional, random walk of signal and cpu temperature on every heartbeat tick, default false */
	public static final String TELEMETRY_DRIFT_ENABLED = "telemetry.drift.enabled";

	/** Property for MQTT hostname */
	public static final String MQTT_HOSTNAME = "mqtt.hostname";

	/** Property for MQTT port */
	public static final String MQTT_PORT = "mqtt.port";

	/** Property for MQTT username */
	public static final String MQTT_USERNAME = "mqtt.username";

    /** Property for MQTT password */
    public static final String MQTT_PASSWORD = "mqtt.password";

	/** Optional property for keepalive on MQTT, defaults to 60 seconds */
	public static final String MQTT_KEEPALIVE = "mqtt.keepalive.seconds";

	/** Optional property for MQTT QoS of publish and subscribe, defaults to 1 */
	public static final String MQTT_QOS = "mqtt.qos";

	/** Optional property for outbound MQTT topic, default is mass/device/to_server */
	public static final String MQTT_OUTBOUND_TOPIC = "mqtt.outbound.topic";

	/** Optional property for inbound MQTT topic, default is mass/server/to_device */
	public static final String MQTT_INBOUND_TOPIC = "mqtt.inbound.topic";

	/** Optional property for heartbeat interval, defaults to 60 seconds */
	public static final String HEARTBEAT_INTERVAL = "heartbeat.interval.seconds";

	/** Port of the http control server, defaults to 8000 */
	public static final String WEB_SERVER_PORT = "webserver.port";

	/** Whether the http control server starts with the agent, defaults to true */
	public static final String WEB_SERVER_RUN_ON_START = "webserver.runonstart";

	/** Classpath resource holding the static network profile of the unit */
	public static final String UNIT_PROFILE = "unit.profile";
}
