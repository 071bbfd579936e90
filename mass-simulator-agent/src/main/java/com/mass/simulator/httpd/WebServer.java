package com.mass.simulator.httpd;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mass.simulator.httpd.handler.DeviceConfigHandler;
import com.mass.simulator.httpd.handler.DeviceStateHandler;
import com.mass.simulator.httpd.handler.HealthHandler;
import com.mass.simulator.httpd.handler.MeterHandler;
import com.mass.simulator.httpd.handler.TriggerHandler;
import com.mass.simulator.agent.AgentConfiguration;
import com.mass.simulator.model.AlarmTrigger;
import com.mass.simulator.model.RelayTrigger;
import com.mass.simulator.model.WriteTrigger;
import com.mass.simulator.unit.DeviceStatusHolder;
import com.mass.simulator.unit.TriggerSurface;
import com.sun.net.httpserver.HttpServer;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Publish an HTTP service to drive the simulated unit by hand: trigger pushes, change telemetry,
 * attach meters and look at the current state.
 */
public class WebServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebServer.class);

    static final int DEFAULT_PORT = 8000;

    private HttpServer server = null;
    private final int port;

    private final TriggerSurface triggers;
    private final DeviceStatusHolder status;
    private final ObjectMapper mapper;

    /**
     * Constructor
     *
     * @param config
     * @param triggers
     * @param status
     * @param mapper
     */
    public WebServer(final Configuration config, final TriggerSurface triggers, final DeviceStatusHolder status, final ObjectMapper mapper) {
        this.triggers = triggers;
        this.status = status;
        this.mapper = mapper;
        this.port = config.getInt(AgentConfiguration.WEB_SERVER_PORT, DEFAULT_PORT);
    }

    /**
     * Start the web server
     *
     * @throws IOException
     */
    public synchronized void start() throws IOException {
        if (server == null) {
            init();
            server.start();
        }
    }

    /**
     * Stop the web server
     */
    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
    }

    public int getPort() {
        return port;
    }

    private void init() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", new HealthHandler(mapper, status));
        server.createContext("/device/state", new DeviceStateHandler(mapper, status));
        server.createContext("/device/config", new DeviceConfigHandler(mapper, triggers));
        server.createContext("/device/meter/add", new MeterHandler(mapper, triggers));
        server.createContext("/trigger/heartbeat", new TriggerHandler<Void>(mapper, null, payload -> triggers.triggerHeartbeat()));
        server.createContext("/trigger/alarm", new TriggerHandler<>(mapper, AlarmTrigger.class, triggers::triggerAlarm));
        server.createContext("/trigger/write", new TriggerHandler<>(mapper, WriteTrigger.class, triggers::triggerWrite));
        server.createContext("/trigger/reset", new TriggerHandler<Void>(mapper, null, payload -> triggers.triggerReset()));
        server.createContext("/trigger/relay", new TriggerHandler<>(mapper, RelayTrigger.class, triggers::triggerRelay));
        server.setExecutor(null);

        Runtime.getRuntime().addShutdownHook(new Thread() {
            @Override
            public void run() {
                WebServer.this.stop();
            }
        });
        LOGGER.info("control web server started on port {}", port);
    }
}
