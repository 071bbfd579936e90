package com.mass.simulator.device;

import java.time.LocalDateTime;

/**
 * Partial update of telemetry and addressing. Null fields are left untouched.
 */
public class DeviceSettingsUpdate {

    public static final String REGISTERED = "registered";
    public static final String DEVICE_DATE = "deviceDate";
    public static final String SIGNAL = "signal";
    public static final String CPU_TEMP = "cpuTemp";
    public static final String FLAG = "flag";
    public static final String SERIAL_NUMBER = "serialNumber";

    private Boolean registered;
    private LocalDateTime deviceDate;
    private Integer signal;
    private Integer cpuTemp;
    private String flag;
    private String serialNumber;

    public Boolean getRegistered() {
        return registered;
    }

    public DeviceSettingsUpdate setRegistered(Boolean registered) {
        this.registered = registered;
        return this;
    }

    public LocalDateTime getDeviceDate() {
        return deviceDate;
    }

    public DeviceSettingsUpdate setDeviceDate(LocalDateTime deviceDate) {
        this.deviceDate = deviceDate;
        return this;
    }

    public Integer getSignal() {
        return signal;
    }

    public DeviceSettingsUpdate setSignal(Integer signal) {
        this.signal = signal;
        return this;
    }

    public Integer getCpuTemp() {
        return cpuTemp;
    }

    public DeviceSettingsUpdate setCpuTemp(Integer cpuTemp) {
        this.cpuTemp = cpuTemp;
        return this;
    }

    public String getFlag() {
        return flag;
    }

    public DeviceSettingsUpdate setFlag(String flag) {
        this.flag = flag;
        return this;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public DeviceSettingsUpdate setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
        return this;
    }

    public boolean isEmpty() {
        return registered == null && deviceDate == null && signal == null && cpuTemp == null
                && flag == null && serialNumber == null;
    }
}
