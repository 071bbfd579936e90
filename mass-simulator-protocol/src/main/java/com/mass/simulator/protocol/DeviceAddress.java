package com.mass.simulator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The <code>device</code> block of an envelope, identifying the unit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"flag", "serialNumber"})
public class DeviceAddress {

    private String flag;
    private String serialNumber;

    public DeviceAddress() {
    }

    public DeviceAddress(String flag, String serialNumber) {
        this.flag = flag;
        this.serialNumber = serialNumber;
    }

    public String getFlag() {
        return flag;
    }

    public void setFlag(String flag) {
        this.flag = flag;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeviceAddress that = (DeviceAddress) o;
        return Objects.equals(flag, that.flag) && Objects.equals(serialNumber, that.serialNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flag, serialNumber);
    }

    @Override
    public String toString() {
        return flag + "/" + serialNumber;
    }
}
