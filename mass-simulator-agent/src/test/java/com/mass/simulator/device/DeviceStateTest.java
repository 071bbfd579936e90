package com.mass.simulator.device;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ValidationException;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class DeviceStateTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private DeviceState state;

    @Before
    public void setUp() {
        DeviceIdentity identity = new DeviceIdentity("XYZ", "0123456789ABCDE", "SimulatorBrand", "SimV1.0", "1.0.0", "1.01", "2023-05-23");
        state = new DeviceState(identity, new Telemetry(false, 13, 17, 0), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void itAppliesOnlySuppliedSettings() throws Exception {
        List<String> applied = state.applySettings(new DeviceSettingsUpdate().setRegistered(true).setSignal(25));

        assertThat(applied, contains(DeviceSettingsUpdate.REGISTERED, DeviceSettingsUpdate.SIGNAL));
        assertThat(state.getTelemetry().isRegistered(), is(true));
        assertThat(state.getTelemetry().getSignal(), is(25));
        assertThat(state.getTelemetry().getCpuTemp(), is(17));
    }

    @Test
    public void itMovesTheDeviceClock() throws Exception {
        state.applySettings(new DeviceSettingsUpdate().setDeviceDate(LocalDateTime.of(2024, 3, 1, 12, 30, 0)));

        assertThat(state.getDeviceTime(), equalTo(LocalDateTime.of(2024, 3, 1, 12, 30, 0)));
        assertThat(state.getSnapshot().getDeviceDate(), equalTo("2024-03-01 12:30:00"));
    }

    @Test
    public void itRejectsBadFlagWithoutChangingAnything() throws Exception {
        try {
            state.applySettings(new DeviceSettingsUpdate().setSignal(2).setFlag("TOOLONG"));
            fail("expected validation failure");
        } catch (ValidationException e) {
            assertThat(e.getFailCode(), is(FailCode.INVALID_PARAMETER));
        }
        assertThat(state.getTelemetry().getSignal(), is(13));
        assertThat(state.getIdentity().getFlag(), equalTo("XYZ"));
    }

    @Test
    public void itChangesAddressing() throws Exception {
        state.applySettings(new DeviceSettingsUpdate().setFlag("ABC").setSerialNumber("S-1"));

        assertThat(state.getIdentity().getFlag(), equalTo("ABC"));
        assertThat(state.getIdentity().getSerialNumber(), equalTo("S-1"));
        assertThat(state.getIdentity().getBrand(), equalTo("SimulatorBrand"));
    }

    @Test
    public void itResetsTelemetryButKeepsMeters() throws Exception {
        state.addMeter(meter("M1"));
        state.applySettings(new DeviceSettingsUpdate().setRegistered(true).setCpuTemp(60)
                .setDeviceDate(LocalDateTime.of(2030, 1, 1, 0, 0)));

        state.resetTelemetry();

        assertThat(state.getTelemetry().isRegistered(), is(false));
        assertThat(state.getTelemetry().getCpuTemp(), is(17));
        assertThat(state.getDeviceTime(), equalTo(LocalDateTime.of(2024, 3, 1, 10, 0, 0)));
        assertThat(state.listMeters(), hasSize(1));
    }

    @Test
    public void itUpdatesFirmware() {
        assertThat(state.updateFirmware("2.0"), equalTo("1.01"));
        assertThat(state.getIdentity().getFirmwareVersion(), equalTo("2.0"));
    }

    @Test
    public void itRejectsDuplicateMeters() throws Exception {
        state.addMeter(meter("M1"));
        try {
            state.addMeter(meter("M1"));
            fail("expected duplicate");
        } catch (DuplicateKeyException e) {
            assertThat(e.getFailCode(), is(FailCode.DUPLICATE_KEY));
        }
        assertThat(state.listMeters(), hasSize(1));
    }

    @Test(expected = ValidationException.class)
    public void itRejectsMeterWithoutSerial() throws Exception {
        state.addMeter(new MeterDescriptor());
    }

    @Test
    public void itHandsOutCopies() throws Exception {
        state.addMeter(meter("M1"));
        state.findMeter("M1").get().setSerialNumber("changed");
        state.listMeters().get(0).setBrand("changed");

        assertThat(state.findMeter("M1").isPresent(), is(true));
        assertThat(state.findMeter("M1").get().getBrand(), equalTo("LGZ"));
    }

    @Test
    public void itRemovesSchedulesIdempotently() throws Exception {
        state.addSchedules(ImmutableList.of(entry("a"), entry("b")));

        assertThat(state.removeSchedule("a"), is(true));
        assertThat(state.removeSchedule("a"), is(false));
        assertThat(state.removeSchedule("missing"), is(false));
        assertThat(state.listSchedules(), hasSize(1));
        assertThat(state.listSchedules().get(0).get("id").asText(), equalTo("b"));
    }

    @Test
    public void itRemovesNotificationsIdempotently() throws Exception {
        state.addNotifications(ImmutableList.of(entry("n1")));

        assertThat(state.removeNotification("n1"), is(true));
        assertThat(state.removeNotification("n1"), is(false));
        assertThat(state.listNotifications(), is(empty()));
    }

    @Test
    public void itRejectsEntriesWithoutId() throws Exception {
        try {
            state.addSchedules(ImmutableList.of(entry("ok"), JsonNodeFactory.instance.objectNode()));
            fail("expected ValidationException");
        } catch (ValidationException e) {
            assertThat(e.getFailCode(), is(FailCode.INVALID_PARAMETER));
        }
        assertThat(state.listSchedules(), is(empty()));
    }

    @Test
    public void itStaysConsistentUnderConcurrentUpdates() throws Exception {
        for (int i = 0; i < 100; i++) {
            state.addSchedules(ImmutableList.of(entry("s" + i)));
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);
        for (int i = 0; i < 100; i++) {
            final int n = i;
            pool.execute(() -> {
                try {
                    state.addMeter(meter("M" + n));
                } catch (ValidationException e) {
                    throw new IllegalStateException(e);
                } finally {
                    done.countDown();
                }
            });
            pool.execute(() -> {
                state.removeSchedule("s" + n);
                done.countDown();
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS), is(true));
        pool.shutdown();

        assertThat(state.listMeters(), hasSize(100));
        assertThat(state.listSchedules(), is(empty()));
    }

    @Test
    public void snapshotCarriesEverything() throws Exception {
        state.addMeter(meter("M1"));
        state.addSchedules(ImmutableList.of(entry("a")));
        state.addNotifications(ImmutableList.of(entry("n")));

        DeviceSnapshot snapshot = state.getSnapshot();

        assertThat(snapshot.getIdentity().getSerialNumber(), equalTo("0123456789ABCDE"));
        assertThat(snapshot.getMeters(), hasSize(1));
        assertThat(snapshot.getSchedules(), hasSize(1));
        assertThat(snapshot.getNotifications(), hasSize(1));
        state.removeSchedule("a");
        assertThat(snapshot.getSchedules(), hasSize(1));
    }

    private static MeterDescriptor meter(String serial) {
        MeterDescriptor meter = new MeterDescriptor();
        meter.setSerialNumber(serial);
        meter.setBrand("LGZ");
        meter.setProtocol("IEC");
        return meter;
    }

    private static ObjectNode entry(String id) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", id);
        node.put("cron", "0 0 * * *");
        return node;
    }
}
