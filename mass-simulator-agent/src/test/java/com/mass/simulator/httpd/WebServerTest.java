package com.mass.simulator.httpd;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.mass.simulator.agent.AgentConfiguration;
import com.mass.simulator.agent.TransportException;
import com.mass.simulator.device.DeviceIdentity;
import com.mass.simulator.device.DeviceSettingsUpdate;
import com.mass.simulator.device.DeviceSnapshot;
import com.mass.simulator.device.DuplicateKeyException;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.device.Telemetry;
import com.mass.simulator.model.AlarmTrigger;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.unit.DeviceStatusHolder;
import com.mass.simulator.unit.TriggerSurface;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.net.HttpURLConnection;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WebServerTest extends WebServerTestBase {

    private static final int PORT = 8093;

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TriggerSurface triggers = mock(TriggerSurface.class);
    private static final DeviceStatusHolder status = mock(DeviceStatusHolder.class);
    private static WebServer webServer;

    @BeforeClass
    public static void init() throws Exception {
        BaseConfiguration config = new BaseConfiguration();
        config.setProperty(AgentConfiguration.WEB_SERVER_PORT, PORT);
        webServer = new WebServer(config, triggers, status, mapper);
        webServer.start();
    }

    @AfterClass
    public static void cleanup() {
        webServer.stop();
    }

    @Before
    public void resetMocks() {
        reset(triggers, status);
        DeviceIdentity identity = new DeviceIdentity("XYZ", "0123456789ABCDE", "SimulatorBrand", "SimV1.0", "1.0.0", "1.01", "2023-05-23");
        when(status.getSnapshot()).thenReturn(new DeviceSnapshot(identity, new Telemetry(false, 13, 17, 0),
                "2024-03-01 10:00:00", ImmutableList.of(), ImmutableList.of(), ImmutableList.of()));
        when(status.isTransportConnected()).thenReturn(true);
        when(status.getBrokerAddress()).thenReturn("localhost:1883");
    }

    @Override
    protected int getPort() {
        return PORT;
    }

    @Test
    public void healthReportsTransportAndDevice() throws Exception {
        HttpURLConnection conn = open("GET", "/health");

        assertThat(conn.getResponseCode(), is(200));
        JsonNode health = mapper.readTree(getContent(conn));
        assertThat(health.get("status").asText(), equalTo("healthy"));
        assertThat(health.get("mqtt_connected").asBoolean(), is(true));
        assertThat(health.get("device").asText(), equalTo("XYZ/0123456789ABCDE"));
        assertThat(health.get("broker").asText(), equalTo("localhost:1883"));
    }

    @Test
    public void stateIsTheSnapshot() throws Exception {
        HttpURLConnection conn = open("GET", "/device/state");

        assertThat(conn.getResponseCode(), is(200));
        JsonNode state = mapper.readTree(getContent(conn));
        assertThat(state.get("deviceDate").asText(), equalTo("2024-03-01 10:00:00"));
        assertThat(state.get("identity").get("flag").asText(), equalTo("XYZ"));
    }

    @Test
    public void heartbeatTriggerIsSent() throws Exception {
        HttpURLConnection conn = post("/trigger/heartbeat", null);

        assertThat(conn.getResponseCode(), is(200));
        assertThat(mapper.readTree(getContent(conn)).get("status").asText(), equalTo("sent"));
        verify(triggers).triggerHeartbeat();
    }

    @Test
    public void triggersFailWhileDisconnected() throws Exception {
        doThrow(new TransportException("transport is not connected")).when(triggers).triggerReset();

        HttpURLConnection conn = post("/trigger/reset", null);

        assertThat(conn.getResponseCode(), is(503));
        JsonNode error = mapper.readTree(getContent(conn));
        assertThat(error.get("status").asText(), equalTo("error"));
        assertThat(error.get("message").asText(), equalTo("transport is not connected"));
    }

    @Test
    public void alarmTriggerBindsTheBody() throws Exception {
        HttpURLConnection conn = post("/trigger/alarm",
                "{\"alarm_type\":\"alarm\",\"level\":\"critical\",\"incident_code\":278,"
                        + "\"description\":\"Meter cover opened\",\"meter_serial\":\"23660088\"}");

        assertThat(conn.getResponseCode(), is(200));
        ArgumentCaptor<AlarmTrigger> alarm = ArgumentCaptor.forClass(AlarmTrigger.class);
        verify(triggers).triggerAlarm(alarm.capture());
        assertThat(alarm.getValue().getAlarmType(), equalTo("alarm"));
        assertThat(alarm.getValue().getIncidentCode(), is(278));
        assertThat(alarm.getValue().getMeterSerial(), equalTo("23660088"));
    }

    @Test
    public void alarmTriggerDefaultsTypeAndLevel() throws Exception {
        HttpURLConnection conn = post("/trigger/alarm", "{\"incident_code\":278,\"description\":\"Meter cover opened\"}");

        assertThat(conn.getResponseCode(), is(200));
        ArgumentCaptor<AlarmTrigger> alarm = ArgumentCaptor.forClass(AlarmTrigger.class);
        verify(triggers).triggerAlarm(alarm.capture());
        assertThat(alarm.getValue().getAlarmType(), equalTo("alarm"));
        assertThat(alarm.getValue().getLevel(), equalTo("warning"));
        assertThat(alarm.getValue().getMeterBrand(), equalTo(AlarmTrigger.DEFAULT_METER_BRAND));
    }

    @Test
    public void alarmTriggerNeedsABody() throws Exception {
        HttpURLConnection conn = post("/trigger/alarm", null);

        assertThat(conn.getResponseCode(), is(400));
        assertThat(mapper.readTree(getContent(conn)).get("failCode").asInt(), is(FailCode.INVALID_REQUEST.getCode()));
        verify(triggers, never()).triggerAlarm(any(AlarmTrigger.class));
    }

    @Test
    public void triggersOnlyAcceptPost() throws Exception {
        HttpURLConnection conn = open("GET", "/trigger/heartbeat");

        assertThat(conn.getResponseCode(), is(405));
        verify(triggers, never()).triggerHeartbeat();
    }

    @Test
    public void configUpdatesTelemetry() throws Exception {
        when(triggers.applySettings(any(DeviceSettingsUpdate.class))).thenReturn(ImmutableList.of("signal"));

        HttpURLConnection conn = post("/device/config?signal=20", null);

        assertThat(conn.getResponseCode(), is(200));
        JsonNode result = mapper.readTree(getContent(conn));
        assertThat(result.get("status").asText(), equalTo("updated"));
        assertThat(result.get("fields").get(0).asText(), equalTo("signal"));

        ArgumentCaptor<DeviceSettingsUpdate> update = ArgumentCaptor.forClass(DeviceSettingsUpdate.class);
        verify(triggers).applySettings(update.capture());
        assertThat(update.getValue().getSignal(), is(20));
        assertThat(update.getValue().getCpuTemp(), is(nullValue()));
    }

    @Test
    public void emptyConfigIsANoOp() throws Exception {
        HttpURLConnection conn = post("/device/config", null);

        assertThat(conn.getResponseCode(), is(200));
        JsonNode result = mapper.readTree(getContent(conn));
        assertThat(result.get("status").asText(), equalTo("updated"));
        assertThat(result.get("fields").size(), is(0));
        verify(triggers, never()).applySettings(any(DeviceSettingsUpdate.class));
    }

    @Test
    public void configRejectsNonNumericValues() throws Exception {
        HttpURLConnection conn = post("/device/config?signal=abc", null);

        assertThat(conn.getResponseCode(), is(400));
        verify(triggers, never()).applySettings(any(DeviceSettingsUpdate.class));
    }

    @Test
    public void meterIsAdded() throws Exception {
        HttpURLConnection conn = post("/device/meter/add", "{\"brand\":\"LGZ\",\"serialNumber\":\"11110000\"}");

        assertThat(conn.getResponseCode(), is(200));
        JsonNode result = mapper.readTree(getContent(conn));
        assertThat(result.get("status").asText(), equalTo("added"));
        assertThat(result.get("serialNumber").asText(), equalTo("11110000"));
    }

    @Test
    public void duplicateMeterIsAConflict() throws Exception {
        doThrow(new DuplicateKeyException("meter 11110000 already exists")).when(triggers).addMeter(any(MeterDescriptor.class));

        HttpURLConnection conn = post("/device/meter/add", "{\"brand\":\"LGZ\",\"serialNumber\":\"11110000\"}");

        assertThat(conn.getResponseCode(), is(409));
        assertThat(mapper.readTree(getContent(conn)).get("failCode").asInt(), is(FailCode.DUPLICATE_KEY.getCode()));
    }
}
