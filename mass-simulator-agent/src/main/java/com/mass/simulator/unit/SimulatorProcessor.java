package com.mass.simulator.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.mass.simulator.agent.AgentConfiguration;
import com.mass.simulator.agent.DeviceEventDispatcher;
import com.mass.simulator.agent.MassCommandProcessor;
import com.mass.simulator.agent.TransportException;
import com.mass.simulator.device.DeviceDefaults;
import com.mass.simulator.device.DeviceIdentity;
import com.mass.simulator.device.DeviceSettingsUpdate;
import com.mass.simulator.device.DeviceSnapshot;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.device.Telemetry;
import com.mass.simulator.httpd.WebServer;
import com.mass.simulator.model.AlarmTrigger;
import com.mass.simulator.model.RelayTrigger;
import com.mass.simulator.model.WriteTrigger;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.MessageHeaderBuilder;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.handler.AlarmHandler;
import com.mass.simulator.unit.handler.ConfigurationHandler;
import com.mass.simulator.unit.handler.DirectiveHandler;
import com.mass.simulator.unit.handler.FirmwareUpdateHandler;
import com.mass.simulator.unit.handler.HandlerContext;
import com.mass.simulator.unit.handler.HeartbeatHandler;
import com.mass.simulator.unit.handler.IdentificationHandler;
import com.mass.simulator.unit.handler.LogHandler;
import com.mass.simulator.unit.handler.NotificationHandler;
import com.mass.simulator.unit.handler.ProfileHandler;
import com.mass.simulator.unit.handler.ReadHandler;
import com.mass.simulator.unit.handler.RelayHandler;
import com.mass.simulator.unit.handler.ResetHandler;
import com.mass.simulator.unit.handler.ScheduleHandler;
import com.mass.simulator.unit.handler.WriteHandler;
import com.mass.simulator.unit.sample.TelemetryDrift;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.Lists.newArrayList;

/**
 * The simulated communication unit. Owns the device state, answers server requests through the
 * function router, publishes heartbeats and exposes manual triggers to the http control server.
 */
public class SimulatorProcessor extends MassCommandProcessor implements TriggerSurface, DeviceStatusHolder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulatorProcessor.class);

    private static final long DEFAULT_HEARTBEAT_INTERVAL = 60;

    private DeviceState state;
    private FunctionRouter router;
    private ObjectMapper mapper;
    private HeartbeatScheduler heartbeat;
    private WebServer webServer;

    @Override
    protected void handleStartup(Configuration config, String homePath, ScheduledExecutorService executorService) {
        DeviceIdentity identity = new DeviceIdentity(
                config.getString(AgentConfiguration.DEVICE_FLAG, DeviceDefaults.FLAG),
                config.getString(AgentConfiguration.DEVICE_SERIALNUMBER, DeviceDefaults.SERIAL_NUMBER),
                config.getString(AgentConfiguration.DEVICE_BRAND, DeviceDefaults.BRAND),
                config.getString(AgentConfiguration.DEVICE_MODEL, DeviceDefaults.MODEL),
                config.getString(AgentConfiguration.DEVICE_PROTOCOL_VERSION, DeviceDefaults.PROTOCOL_VERSION),
                config.getString(AgentConfiguration.DEVICE_FIRMWARE, DeviceDefaults.FIRMWARE),
                config.getString(AgentConfiguration.DEVICE_MANUFACTURE_DATE, DeviceDefaults.MANUFACTURE_DATE));
        Telemetry defaults = new Telemetry(false,
                config.getInt(AgentConfiguration.TELEMETRY_SIGNAL, DeviceDefaults.SIGNAL),
                config.getInt(AgentConfiguration.TELEMETRY_CPU_TEMP, DeviceDefaults.CPU_TEMP),
                0);
        state = new DeviceState(identity, defaults, Clock.systemDefaultZone());
        mapper = getProtocol().getMapper();

        MessageHeaderBuilder headers = new MessageHeaderBuilder(() -> state.getIdentity().toAddress());
        DeviceProfile profile = DeviceProfile.load(config.getString(AgentConfiguration.UNIT_PROFILE, DeviceProfile.DEFAULT_RESOURCE), mapper);
        HandlerContext context = new HandlerContext(headers, mapper, profile);

        router = new FunctionRouter(state, headers);
        router.registerHandler(new IdentificationHandler(context));
        router.registerHandler(new HeartbeatHandler(context));
        router.registerHandler(new AlarmHandler(context));
        router.registerHandler(new ReadHandler(context));
        router.registerHandler(new ConfigurationHandler(context));
        router.registerHandler(new ScheduleHandler(context));
        router.registerHandler(new NotificationHandler(context));
        router.registerHandler(new LogHandler(context));
        router.registerHandler(new WriteHandler(context));
        router.registerHandler(new ResetHandler(context));
        router.registerHandler(new FirmwareUpdateHandler(context));
        router.registerHandler(new ProfileHandler(context));
        router.registerHandler(new DirectiveHandler(context));
        router.registerHandler(new RelayHandler(context));

        long interval = config.getLong(AgentConfiguration.HEARTBEAT_INTERVAL, DEFAULT_HEARTBEAT_INTERVAL);
        checkState(interval >= 1, "%s must be at least 1 second", AgentConfiguration.HEARTBEAT_INTERVAL);
        TelemetryDrift drift = config.getBoolean(AgentConfiguration.TELEMETRY_DRIFT_ENABLED, false) ? new TelemetryDrift() : null;
        heartbeat = new HeartbeatScheduler(router, getEventDispatcher(), state, drift, interval, TimeUnit.SECONDS);
        if (executorService != null) {
            heartbeat.start(executorService);
        }

        if (config.getBoolean(AgentConfiguration.WEB_SERVER_RUN_ON_START, true)) {
            webServer = createWebServer(config);
            try {
                webServer.start();
            } catch (IOException e) {
                throw Throwables.propagate(e);
            }
        }
        LOGGER.info("simulated unit {} started", identity);
    }

    @Override
    protected void handleShutdown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
        if (webServer != null) {
            webServer.stop();
        }
    }

    @Override
    protected void handleInboundEnvelope(Envelope envelope) {
        if (router == null) {
            LOGGER.warn("not started yet, dropping {} (ref: {})", envelope.getFunction(), envelope.getReferenceId());
            return;
        }
        publishAll(router.route(envelope));
    }

    @Override
    public void handleConnected() {
        if (router == null) {
            return;
        }
        try {
            publishAll(router.invoke(ProtocolFunction.IDENTIFICATION, null));
            LOGGER.info("identification sent");
        } catch (ValidationException e) {
            LOGGER.error("unable to build identification", e);
        }
    }

    @Override
    public void triggerHeartbeat() throws TransportException, ValidationException {
        send(ProtocolFunction.HEARTBEAT, null);
    }

    @Override
    public void triggerAlarm(AlarmTrigger alarm) throws TransportException, ValidationException {
        ObjectNode body = mapper.createObjectNode();
        body.put("type", alarm.getAlarmType());
        body.put("level", alarm.getLevel());
        if (alarm.getIncidentCode() != null) {
            body.put("incidentCode", alarm.getIncidentCode());
        }
        body.put("description", alarm.getDescription());
        if (alarm.getMeterSerial() != null) {
            ObjectNode meter = body.putObject("meter");
            meter.put("brand", alarm.getMeterBrand() != null ? alarm.getMeterBrand() : AlarmTrigger.DEFAULT_METER_BRAND);
            meter.put("serialNumber", alarm.getMeterSerial());
        }
        send(ProtocolFunction.ALARM, body);
    }

    @Override
    public void triggerWrite(WriteTrigger write) throws TransportException, ValidationException {
        ObjectNode body = mapper.createObjectNode();
        body.put("meterSerialNumber", write.getMeterSerial());
        body.put("obisCode", write.getObisCode());
        body.put("value", write.getValue());
        send(ProtocolFunction.WRITE, body);
    }

    @Override
    public void triggerReset() throws TransportException, ValidationException {
        send(ProtocolFunction.RESET, null);
    }

    @Override
    public void triggerRelay(RelayTrigger relay) throws TransportException, ValidationException {
        ObjectNode body = mapper.createObjectNode();
        body.put("name", relay.getName());
        body.put("state", relay.getState());
        send(ProtocolFunction.RELAY, body);
    }

    @Override
    public List<String> applySettings(DeviceSettingsUpdate update) throws ValidationException {
        List<Envelope> out = router.invoke(ProtocolFunction.CONFIGURATION, ConfigurationHandler.toRequest(update, mapper));
        if (isTransportConnected()) {
            publishAll(out);
        } else {
            LOGGER.info("transport not connected, configuration change not announced");
        }

        List<String> fields = newArrayList();
        for (JsonNode field : out.get(0).getNotification().path("fields")) {
            fields.add(field.asText());
        }
        return fields;
    }

    @Override
    public void addMeter(MeterDescriptor meter) throws ValidationException {
        state.addMeter(meter);
        LOGGER.info("meter {} attached", meter.getSerialNumber());
    }

    @Override
    public DeviceSnapshot getSnapshot() {
        return state.getSnapshot();
    }

    @Override
    public boolean isTransportConnected() {
        DeviceEventDispatcher dispatcher = getEventDispatcher();
        return dispatcher != null && dispatcher.isConnected();
    }

    @Override
    public String getBrokerAddress() {
        DeviceEventDispatcher dispatcher = getEventDispatcher();
        return dispatcher != null ? dispatcher.getBrokerAddress() : null;
    }

    @VisibleForTesting
    WebServer createWebServer(Configuration config) {
        return new WebServer(config, this, this, mapper);
    }

    @VisibleForTesting
    DeviceState getState() {
        return state;
    }

    @VisibleForTesting
    FunctionRouter getRouter() {
        return router;
    }

    private void send(ProtocolFunction function, ObjectNode body) throws TransportException, ValidationException {
        if (!isTransportConnected()) {
            throw new TransportException("transport is not connected");
        }
        for (Envelope envelope : router.invoke(function, body)) {
            publish(envelope);
        }
    }
}
