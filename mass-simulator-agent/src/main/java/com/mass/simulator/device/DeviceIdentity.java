package com.mass.simulator.device;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mass.simulator.protocol.DeviceAddress;

/**
 * Immutable identity of the communication unit. Flag, serial number and firmware version can be
 * replaced at runtime by swapping the whole value.
 */
@JsonPropertyOrder({"flag", "serialNumber", "brand", "model", "protocolVersion", "firmwareVersion", "manufactureDate"})
public final class DeviceIdentity {

    private final String flag;
    private final String serialNumber;
    private final String brand;
    private final String model;
    private final String protocolVersion;
    private final String firmwareVersion;
    private final String manufactureDate;

    public DeviceIdentity(String flag, String serialNumber, String brand, String model,
                          String protocolVersion, String firmwareVersion, String manufactureDate) {
        this.flag = flag;
        this.serialNumber = serialNumber;
        this.brand = brand;
        this.model = model;
        this.protocolVersion = protocolVersion;
        this.firmwareVersion = firmwareVersion;
        this.manufactureDate = manufactureDate;
    }

    public String getFlag() {
        return flag;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public String getBrand() {
        return brand;
    }

    public String getModel() {
        return model;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public String getFirmwareVersion() {
        return firmwareVersion;
    }

    public String getManufactureDate() {
        return manufactureDate;
    }

    public DeviceIdentity withAddress(String newFlag, String newSerialNumber) {
        return new DeviceIdentity(newFlag, newSerialNumber, brand, model, protocolVersion, firmwareVersion, manufactureDate);
    }

    public DeviceIdentity withFirmwareVersion(String version) {
        return new DeviceIdentity(flag, serialNumber, brand, model, protocolVersion, version, manufactureDate);
    }

    public DeviceAddress toAddress() {
        return new DeviceAddress(flag, serialNumber);
    }

    @Override
    public String toString() {
        return flag + "/" + serialNumber + " " + brand + " " + model + " fw " + firmwareVersion;
    }
}
