package com.mass.simulator.agent;

import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FramingException;
import com.mass.simulator.protocol.MassProtocol;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.jar.Manifest;

import static com.google.common.collect.Maps.newHashMap;

/**
 * Base class for processors that decode MASS frames received on MQTT and publish replies
 */
public abstract class MassCommandProcessor implements AgentMessageProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MassCommandProcessor.class);

    private Configuration configuration;
    private String homePath;
    private DeviceEventDispatcher eventDispatcher;
    private final MassProtocol protocol = new MassProtocol();
    private final ScheduledExecutorService scheduledExecutorService = new ScheduledThreadPoolExecutor(1);
    private final Map<String, String> buildParams = newHashMap();

    protected abstract void handleStartup(Configuration configuration, String homePath, ScheduledExecutorService executorService);

    protected abstract void handleShutdown();

    /**
     * Handle a decoded request. Implementations publish whatever the request produces.
     *
     * @param envelope
     */
    protected abstract void handleInboundEnvelope(Envelope envelope);

    /**
     * Constructor
     */
    public MassCommandProcessor() {
        loadBuildProps();
        LOGGER.info("simulator build version {}", getBuildParams().get("MASS-Simulator-Version"));

        Runtime.getRuntime().addShutdownHook(new Thread() {
            @Override
            public void run() {
                handleShutdown();
                scheduledExecutorService.shutdownNow();
                try {
                    scheduledExecutorService.awaitTermination(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
        });
    }

    @Override
    public void executeStartup() {
        handleStartup(configuration, homePath, scheduledExecutorService);
    }

    @Override
    public void processInboundFrame(byte[] frame) {
        Envelope envelope;
        try {
            envelope = protocol.unwrap(frame);
        } catch (FramingException e) {
            LOGGER.warn("dropping malformed frame of {} bytes: {}", frame == null ? 0 : frame.length, e.getMessage());
            return;
        }

        LOGGER.info("received {} (ref: {})", envelope.getFunction(), envelope.getReferenceId());
        try {
            handleInboundEnvelope(envelope);
        } catch (RuntimeException e) {
            LOGGER.error("unable to process {} (ref: {})", envelope.getFunction(), envelope.getReferenceId(), e);
        }
    }

    @Override
    public void setConfiguration(Configuration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void setHomePath(String path) {
        this.homePath = path;
    }

    @Override
    public void setEventDispatcher(DeviceEventDispatcher eventDispatcher) {
        this.eventDispatcher = eventDispatcher;
    }

    public Map<String, String> getBuildParams() {
        return buildParams;
    }

    public MassProtocol getProtocol() {
        return protocol;
    }

    /**
     * retrieve the instance of mqtt message dispatcher to send messages to the server
     *
     * @return
     */
    public DeviceEventDispatcher getEventDispatcher() {
        return eventDispatcher;
    }

    /**
     * Publish one message.
     *
     * @param envelope
     * @throws TransportException
     */
    public void publish(Envelope envelope) throws TransportException {
        eventDispatcher.sendMessage(envelope);
        LOGGER.info("sent {} (ref: {})", envelope.getFunction(), envelope.getReferenceId());
    }

    /**
     * Publish messages in order. A failed publish is logged and the remaining messages are
     * still attempted.
     *
     * @param envelopes
     */
    public void publishAll(List<Envelope> envelopes) {
        for (Envelope envelope : envelopes) {
            try {
                publish(envelope);
            } catch (TransportException e) {
                LOGGER.warn("unable to publish {} (ref: {}): {}", envelope.getFunction(), envelope.getReferenceId(), e.getMessage());
            }
        }
    }

    private void loadBuildProps() {
        try {
            Enumeration<URL> resources = getClass().getClassLoader().getResources("META-INF/MANIFEST.MF");
            while (resources.hasMoreElements()) {
                try (InputStream in = resources.nextElement().openStream()) {
                    Manifest manifest = new Manifest(in);
                    if (manifest.getMainAttributes().getValue("MASS-Simulator-Version") != null) {
                        buildParams.put("MASS-Simulator-Version", manifest.getMainAttributes().getValue("MASS-Simulator-Version"));
                        break;
                    }
                }
            }
        } catch (Exception ex) {
            LOGGER.info("unable to obtain build info from jar");
        }
    }
}
