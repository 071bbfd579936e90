package com.mass.simulator.device;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Point in time copy of the device state. Safe to hand out and serialize.
 */
@JsonPropertyOrder({"identity", "telemetry", "deviceDate", "meters", "schedules", "notifications"})
public class DeviceSnapshot {

    private final DeviceIdentity identity;
    private final Telemetry telemetry;
    private final String deviceDate;
    private final List<MeterDescriptor> meters;
    private final List<ObjectNode> schedules;
    private final List<ObjectNode> notifications;

    public DeviceSnapshot(DeviceIdentity identity, Telemetry telemetry, String deviceDate, List<MeterDescriptor> meters,
                          List<ObjectNode> schedules, List<ObjectNode> notifications) {
        this.identity = identity;
        this.telemetry = telemetry;
        this.deviceDate = deviceDate;
        this.meters = ImmutableList.copyOf(meters);
        this.schedules = ImmutableList.copyOf(schedules);
        this.notifications = ImmutableList.copyOf(notifications);
    }

    public DeviceIdentity getIdentity() {
        return identity;
    }

    public Telemetry getTelemetry() {
        return telemetry;
    }

    public String getDeviceDate() {
        return deviceDate;
    }

    public List<MeterDescriptor> getMeters() {
        return meters;
    }

    public List<ObjectNode> getSchedules() {
        return schedules;
    }

    public List<ObjectNode> getNotifications() {
        return notifications;
    }
}
