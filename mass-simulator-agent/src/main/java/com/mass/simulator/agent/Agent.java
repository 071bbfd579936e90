package com.mass.simulator.agent;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.mass.simulator.device.DeviceDefaults;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.MassProtocol;
import org.apache.commons.configuration2.Configuration;
import org.fusesource.mqtt.client.Future;
import org.fusesource.mqtt.client.FutureConnection;
import org.fusesource.mqtt.client.MQTT;
import org.fusesource.mqtt.client.Message;
import org.fusesource.mqtt.client.QoS;
import org.fusesource.mqtt.client.Topic;
import org.fusesource.mqtt.client.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkState;

/**
 * Agent that connects the simulated unit to the MQTT broker. One connection subscribes to the
 * inbound topic and feeds frames to the processor, a second one publishes what the processor
 * sends.
 */
public class Agent {

    private static final Logger LOGGER = LoggerFactory.getLogger(Agent.class);
    private static final Logger MQTT_TRACE_LOGGER = LoggerFactory.getLogger("mqtt_trace");

    static final String DEFAULT_COMMAND_PROCESSOR = "com.mass.simulator.unit.SimulatorProcessor";
    private static final int DEFAULT_MQTT_PORT = 1883;
    private static final short DEFAULT_MQTT_KEEPALIVE = 60;
    private static final String DEFAULT_MQTT_HOSTNAME = "localhost";
    private static final int DEFAULT_MQTT_QOS = 1;
    static final String DEFAULT_OUTBOUND_TOPIC = "mass/device/to_server";
    static final String DEFAULT_INBOUND_TOPIC = "mass/server/to_device";
    static final String CLIENT_ID_PREFIX = "mass_sim_";

    private static final long RECONNECT_THROTTLE_MILLIS = 60000;

    private String commandProcessorClassname;
    private String serialNumber;
    private String mqttHostname;
    private int mqttPort;
    private String mqttUsername;
    private String mqttPassword;
    private short mqttKeepaliveSeconds;
    private QoS qos;
    private String outboundTopic;
    private String inboundTopic;

    private MQTTOutbound outbound;
    private MQTTInbound inbound;

    /** runs the inbound loop */
    private ExecutorService executor;

    /** worker pool for inbound frames, one task per frame */
    private ExecutorService dispatchExecutor;

    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private final AtomicLong lastConnectAttempt = new AtomicLong(0);

    /**
     * Start the agent. Configuration problems are fatal, broker problems are not: the inbound
     * loop keeps reconnecting.
     *
     * @param homePath
     */
    public void start(String homePath) {
        LOGGER.info("MASS simulator agent starting...");
        MQTT mqttSub = createMQTT();
        MQTT mqttPub = createMQTT();
        Configuration config;
        try {
            config = loadConfiguration(homePath);
            configureClient(mqttSub, CLIENT_ID_PREFIX + serialNumber);
            configureClient(mqttPub, CLIENT_ID_PREFIX + serialNumber + "_pub");
            // publishing fails fast, the outbound side reconnects on its own schedule
            mqttPub.setConnectAttemptsMax(1);
            mqttPub.setReconnectAttemptsMax(0);
        } catch (Exception e) {
            throw Throwables.propagate(e);
        }
        LOGGER.info("Connecting to MQTT broker at {}:{}", mqttHostname, mqttPort);

        outbound = new MQTTOutbound(mqttPub, outboundTopic);

        AgentMessageProcessor processor = createProcessor();
        processor.setConfiguration(config);
        processor.setHomePath(homePath);
        processor.setEventDispatcher(outbound);

        inbound = new MQTTInbound(mqttSub, inboundTopic, processor);
        Runtime.getRuntime().addShutdownHook(new ShutdownHandler());

        // Device state and handlers must exist before the first connect notification.
        processor.executeStartup();
        getInboundExecutor().execute(inbound);

        LOGGER.info("MASS simulator agent started.");
    }

    private void configureClient(MQTT mqtt, String clientId) throws URISyntaxException {
        mqtt.setHost("tcp://" + mqttHostname + ":" + mqttPort);
        mqtt.setClientId(clientId);
        mqtt.setCleanSession(true);
        mqtt.setKeepAlive(mqttKeepaliveSeconds);
        if (mqttUsername != null) {
            mqtt.setUserName(mqttUsername);
        }
        if (mqttPassword != null) {
            mqtt.setPassword(mqttPassword);
        }
        if (MQTT_TRACE_LOGGER.isDebugEnabled()) {
            mqtt.setTracer(new Tracer() {
                @Override
                public void debug(String message, Object... args) {
                    MQTT_TRACE_LOGGER.debug(clientId + ": " + String.format(message, args));
                }
            });
        }
    }

    private Configuration loadConfiguration(String homePath) {
        Configuration config = createConfigurationLoader().load(homePath);
        load(config);
        return config;
    }

    @VisibleForTesting
    ConfigurationLoader createConfigurationLoader() {
        return new ConfigurationLoader();
    }

    @VisibleForTesting
    AgentMessageProcessor createProcessor() {
        try {
            return Class.forName(commandProcessorClassname)
                    .asSubclass(AgentMessageProcessor.class)
                    .getDeclaredConstructor()
                    .newInstance();
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new IllegalStateException("unable to create command processor " + commandProcessorClassname, e);
        }
    }

    @VisibleForTesting
    ExecutorService getInboundExecutor() {
        if (executor == null) {
            executor = Executors.newSingleThreadExecutor();
        }
        return executor;
    }

    @VisibleForTesting
    synchronized ExecutorService getDispatchExecutor() {
        if (dispatchExecutor == null) {
            dispatchExecutor = Executors.newCachedThreadPool();
        }
        return dispatchExecutor;
    }

    @VisibleForTesting
    MQTT createMQTT() {
        return new MQTT();
    }

    private class MQTTOutbound implements DeviceEventDispatcher {

        private final MQTT mqtt;
        private final String topic;
        private final MassProtocol protocol = new MassProtocol();
        private volatile FutureConnection connection;

        MQTTOutbound(MQTT mqtt, String topic) {
            this.mqtt = mqtt;
            this.topic = topic;
            this.connection = mqtt.futureConnection();
            this.connection.connect();
        }

        @Override
        public void sendMessage(Envelope envelope) throws TransportException {
            byte[] frame = protocol.wrap(envelope);
            try {
                connection.publish(topic, frame, qos, false).await(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                LOGGER.info("Unable to publish {} (ref: {}), cannot reach broker", envelope.getFunction(), envelope.getReferenceId());
                reconnect();
                throw new TransportException("publish of " + envelope.getFunction() + " was not accepted by the broker", e);
            }
        }

        /**
         * A dropped publish connection is replaced here, throttled, so callers that check before
         * sending still bring the link back.
         */
        @Override
        public boolean isConnected() {
            if (!connection.isConnected()) {
                reconnect();
                return false;
            }
            return subscribed.get();
        }

        @Override
        public String getBrokerAddress() {
            return mqttHostname + ":" + mqttPort;
        }

        /**
         * Replace the publish connection, at most once per throttle period.
         */
        private synchronized void reconnect() {
            if (System.currentTimeMillis() - lastConnectAttempt.get() <= RECONNECT_THROTTLE_MILLIS) {
                return;
            }
            try {
                cleanUp(60);
            } catch (Exception ex) {
                LOGGER.debug("unable to close stale publish connection: {}", ex.getMessage());
            }
            try {
                connection = mqtt.futureConnection();
                connection.connect();
            } catch (Exception ex) {
                LOGGER.info("unable to reset publish connection: {}", ex.getMessage());
            } finally {
                lastConnectAttempt.set(System.currentTimeMillis());
            }
        }

        void cleanUp(int timeoutSeconds) throws Exception {
            connection.kill().await(timeoutSeconds, TimeUnit.SECONDS);
        }
    }

    /**
     * Keeps a subscription to the inbound topic alive and hands every frame to the dispatch
     * pool.
     */
    private class MQTTInbound implements Runnable {

        private final MQTT mqtt;
        private final String topic;
        private final AgentMessageProcessor processor;
        private FutureConnection connection;
        private volatile boolean running;
        private volatile Thread currentThread;

        MQTTInbound(MQTT mqtt, String topic, AgentMessageProcessor processor) {
            this.mqtt = mqtt;
            this.topic = topic;
            this.processor = processor;
        }

        @Override
        public void run() {
            running = true;
            currentThread = Thread.currentThread();
            try {
                while (isRunning()) {
                    if (!dropStaleConnection() || !connectAndSubscribe()) {
                        continue;
                    }
                    processor.handleConnected();
                    receive();
                }
            } catch (InterruptedException e) {
                LOGGER.warn("Inbound request processor interrupted.");
                Thread.currentThread().interrupt();
            } finally {
                subscribed.set(false);
                killQuietly(20);
            }
        }

        private boolean isRunning() {
            return running && !Thread.currentThread().isInterrupted();
        }

        private boolean dropStaleConnection() throws InterruptedException {
            subscribed.set(false);
            if (connection == null) {
                return true;
            }
            if (!killQuietly(60)) {
                Thread.sleep(10000);
            }
            connection = null;
            return isRunning();
        }

        private boolean connectAndSubscribe() throws InterruptedException {
            connection = mqtt.futureConnection();
            try {
                connection.connect().await(45, TimeUnit.SECONDS);
                connection.subscribe(new Topic[]{new Topic(topic, qos)}).await(45, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception ex) {
                LOGGER.info("unable to connect and subscribe within 45 seconds, will try again");
                Thread.sleep(5000);
                return false;
            }
            subscribed.set(true);
            LOGGER.info("subscribed to {}", topic);
            return true;
        }

        private void receive() throws InterruptedException {
            Future<Message> receive = connection.receive();
            while (isRunning()) {
                Message message;
                try {
                    message = receive.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    if (!connection.isConnected()) {
                        LOGGER.error("Lost connection to broker, recreating mqtt session");
                        return;
                    }
                    continue;
                }
                receive = connection.receive();
                if (message == null) {
                    continue;
                }
                message.ack();
                final byte[] payload = message.getPayload();
                getDispatchExecutor().execute(() -> processor.processInboundFrame(payload));
            }
        }

        private boolean killQuietly(int timeoutSeconds) {
            if (connection == null) {
                return true;
            }
            try {
                connection.kill().await(timeoutSeconds, TimeUnit.SECONDS);
                return true;
            } catch (Exception ex) {
                LOGGER.info("unable to terminate inbound connection: {}", ex.getMessage());
                return false;
            }
        }

        void stop() {
            running = false;
            Thread thread = currentThread;
            if (thread != null) {
                thread.interrupt();
            }
        }
    }

    private class ShutdownHandler extends Thread {
        @Override
        public void run() {
            try {
                inbound.stop();
                outbound.cleanUp(20);
                getDispatchExecutor().shutdown();
                LOGGER.info("Disconnected from MQTT broker.");
            } catch (Exception e) {
                LOGGER.warn("Shutdown initiated, exception disconnecting from MQTT broker.", e);
            }
        }
    }

    /**
     * Read and validate the transport and identity settings.
     *
     * @param config
     * @throws IllegalStateException on a value the simulator cannot run with
     */
    private void load(Configuration config) {
        commandProcessorClassname = config.getString(AgentConfiguration.COMMAND_PROCESSOR_CLASSNAME, DEFAULT_COMMAND_PROCESSOR);
        LOGGER.info("Using configured processor: {}", commandProcessorClassname);

        serialNumber = config.getString(AgentConfiguration.DEVICE_SERIALNUMBER, DeviceDefaults.SERIAL_NUMBER);
        checkState(!serialNumber.trim().isEmpty(), "%s must not be blank", AgentConfiguration.DEVICE_SERIALNUMBER);
        String flag = config.getString(AgentConfiguration.DEVICE_FLAG, DeviceDefaults.FLAG);
        checkState(flag.length() == DeviceState.FLAG_LENGTH, "%s must be exactly %s characters",
                AgentConfiguration.DEVICE_FLAG, DeviceState.FLAG_LENGTH);
        LOGGER.info("Using device {}/{}", flag, serialNumber);

        mqttHostname = config.getString(AgentConfiguration.MQTT_HOSTNAME, DEFAULT_MQTT_HOSTNAME);
        mqttPort = config.getInt(AgentConfiguration.MQTT_PORT, DEFAULT_MQTT_PORT);
        mqttUsername = Strings.emptyToNull(config.getString(AgentConfiguration.MQTT_USERNAME, "").trim());
        mqttPassword = Strings.emptyToNull(config.getString(AgentConfiguration.MQTT_PASSWORD, "").trim());
        mqttKeepaliveSeconds = config.getShort(AgentConfiguration.MQTT_KEEPALIVE, DEFAULT_MQTT_KEEPALIVE);
        LOGGER.info("Using MQTT host: {}:{}, username: {}", mqttHostname, mqttPort, mqttUsername);

        int qosLevel = config.getInt(AgentConfiguration.MQTT_QOS, DEFAULT_MQTT_QOS);
        checkState(qosLevel >= 0 && qosLevel <= 2, "%s must be 0, 1 or 2", AgentConfiguration.MQTT_QOS);
        qos = QoS.values()[qosLevel];

        outboundTopic = config.getString(AgentConfiguration.MQTT_OUTBOUND_TOPIC, DEFAULT_OUTBOUND_TOPIC);
        inboundTopic = config.getString(AgentConfiguration.MQTT_INBOUND_TOPIC, DEFAULT_INBOUND_TOPIC);
        LOGGER.info("Using MQTT topics: outbound {}, inbound {}", outboundTopic, inboundTopic);
    }
}
