package com.mass.simulator.device;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.MassProtocol;
import com.mass.simulator.protocol.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.Lists.newArrayList;

/**
 * The in-memory model of the communication unit. One instance per process, shared by inbound
 * request handling, the heartbeat timer and the http triggers. All access is serialized on this
 * object's monitor; nothing in here blocks or does I/O.
 */
public class DeviceState {

    private static final Logger log = LoggerFactory.getLogger(DeviceState.class);

    public static final int FLAG_LENGTH = 3;

    private final Clock clock;
    private final Telemetry defaults;

    private DeviceIdentity identity;
    private Telemetry telemetry;
    private final List<MeterDescriptor> meters = new ArrayList<>();
    private final List<ObjectNode> schedules = new ArrayList<>();
    private final List<ObjectNode> notifications = new ArrayList<>();

    /**
     * Constructor
     *
     * @param identity initial identity
     * @param defaults telemetry at startup and after a reset
     * @param clock host clock the device clock is offset from
     */
    public DeviceState(DeviceIdentity identity, Telemetry defaults, Clock clock) {
        this.identity = checkNotNull(identity);
        this.defaults = checkNotNull(defaults);
        this.telemetry = defaults;
        this.clock = checkNotNull(clock);
    }

    public synchronized DeviceSnapshot getSnapshot() {
        List<MeterDescriptor> meterCopies = newArrayList();
        for (MeterDescriptor meter : meters) {
            meterCopies.add(new MeterDescriptor(meter));
        }
        return new DeviceSnapshot(identity, telemetry, getDeviceTime().format(MassProtocol.DATE_FORMAT),
                meterCopies, copyOf(schedules), copyOf(notifications));
    }

    public synchronized DeviceIdentity getIdentity() {
        return identity;
    }

    public synchronized Telemetry getTelemetry() {
        return telemetry;
    }

    /**
     * @return current time on the device clock, to the second
     */
    public synchronized LocalDateTime getDeviceTime() {
        return LocalDateTime.now(clock).plusSeconds(telemetry.getClockOffsetSeconds()).truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Apply a partial update. Fields absent from the update keep their value. The update is
     * validated as a whole before anything is changed.
     *
     * @param update
     * @return names of the fields that were applied
     * @throws ValidationException if the flag or serial number is not acceptable
     */
    public synchronized List<String> applySettings(DeviceSettingsUpdate update) throws ValidationException {
        if (update.getFlag() != null && update.getFlag().length() != FLAG_LENGTH) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "flag must be exactly " + FLAG_LENGTH + " characters");
        }
        if (update.getSerialNumber() != null && update.getSerialNumber().trim().isEmpty()) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "serialNumber must not be blank");
        }

        List<String> applied = newArrayList();
        Telemetry next = telemetry;
        if (update.getRegistered() != null) {
            next = next.withRegistered(update.getRegistered());
            applied.add(DeviceSettingsUpdate.REGISTERED);
        }
        if (update.getDeviceDate() != null) {
            long offset = Duration.between(LocalDateTime.now(clock), update.getDeviceDate()).getSeconds();
            next = next.withClockOffsetSeconds(offset);
            applied.add(DeviceSettingsUpdate.DEVICE_DATE);
        }
        if (update.getSignal() != null) {
            next = next.withSignal(update.getSignal());
            applied.add(DeviceSettingsUpdate.SIGNAL);
        }
        if (update.getCpuTemp() != null) {
            next = next.withCpuTemp(update.getCpuTemp());
            applied.add(DeviceSettingsUpdate.CPU_TEMP);
        }
        telemetry = next;

        if (update.getFlag() != null || update.getSerialNumber() != null) {
            String flag = update.getFlag() != null ? update.getFlag() : identity.getFlag();
            String serial = update.getSerialNumber() != null ? update.getSerialNumber() : identity.getSerialNumber();
            identity = identity.withAddress(flag, serial);
            if (update.getFlag() != null) {
                applied.add(DeviceSettingsUpdate.FLAG);
            }
            if (update.getSerialNumber() != null) {
                applied.add(DeviceSettingsUpdate.SERIAL_NUMBER);
            }
        }
        log.debug("applied device settings {}", applied);
        return applied;
    }

    /**
     * Put telemetry back to the startup defaults. Identity, meters, schedules and notifications
     * are kept.
     */
    public synchronized void resetTelemetry() {
        telemetry = defaults;
    }

    /**
     * @param version
     * @return the firmware version that was replaced
     */
    public synchronized String updateFirmware(String version) {
        checkArgument(version != null && !version.trim().isEmpty(), "firmware version is required");
        String previous = identity.getFirmwareVersion();
        identity = identity.withFirmwareVersion(version);
        return previous;
    }

    /**
     * Attach a meter.
     *
     * @param meter
     * @throws DuplicateKeyException if a meter with the same serial number is attached
     * @throws ValidationException if the meter has no serial number
     */
    public synchronized void addMeter(MeterDescriptor meter) throws ValidationException {
        if (meter == null || meter.getSerialNumber() == null || meter.getSerialNumber().trim().isEmpty()) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, "meter serialNumber is required");
        }
        if (indexOfMeter(meter.getSerialNumber()) >= 0) {
            throw new DuplicateKeyException("meter " + meter.getSerialNumber() + " already exists");
        }
        meters.add(new MeterDescriptor(meter));
    }

    public synchronized List<MeterDescriptor> listMeters() {
        List<MeterDescriptor> copies = newArrayList();
        for (MeterDescriptor meter : meters) {
            copies.add(new MeterDescriptor(meter));
        }
        return copies;
    }

    public synchronized Optional<MeterDescriptor> findMeter(String serialNumber) {
        int index = indexOfMeter(serialNumber);
        return index < 0 ? Optional.empty() : Optional.of(new MeterDescriptor(meters.get(index)));
    }

    /**
     * Append schedules. Nothing is added unless every entry carries an id.
     *
     * @param entries
     * @throws ValidationException if an entry has no id
     */
    public synchronized void addSchedules(Collection<ObjectNode> entries) throws ValidationException {
        appendAll(schedules, entries);
    }

    public synchronized List<ObjectNode> listSchedules() {
        return copyOf(schedules);
    }

    /**
     * Remove every schedule with the given id. Removing an id that is not present is a no-op.
     *
     * @param id
     * @return true if anything was removed
     */
    public synchronized boolean removeSchedule(String id) {
        return removeById(schedules, id);
    }

    public synchronized void addNotifications(Collection<ObjectNode> entries) throws ValidationException {
        appendAll(notifications, entries);
    }

    public synchronized List<ObjectNode> listNotifications() {
        return copyOf(notifications);
    }

    /**
     * Remove every notification with the given id. Removing an id that is not present is a no-op.
     *
     * @param id
     * @return true if anything was removed
     */
    public synchronized boolean removeNotification(String id) {
        return removeById(notifications, id);
    }

    private int indexOfMeter(String serialNumber) {
        for (int i = 0; i < meters.size(); i++) {
            if (meters.get(i).getSerialNumber().equals(serialNumber)) {
                return i;
            }
        }
        return -1;
    }

    private static void appendAll(List<ObjectNode> target, Collection<ObjectNode> entries) throws ValidationException {
        for (ObjectNode entry : entries) {
            if (!entry.hasNonNull("id")) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "every entry needs an id");
            }
        }
        for (ObjectNode entry : entries) {
            target.add(entry.deepCopy());
        }
    }

    private static boolean removeById(List<ObjectNode> target, String id) {
        boolean removed = false;
        Iterator<ObjectNode> it = target.iterator();
        while (it.hasNext()) {
            if (it.next().get("id").asText().equals(id)) {
                it.remove();
                removed = true;
            }
        }
        return removed;
    }

    private static List<ObjectNode> copyOf(List<ObjectNode> source) {
        List<ObjectNode> copies = newArrayList();
        for (ObjectNode entry : source) {
            copies.add(entry.deepCopy());
        }
        return copies;
    }
}
