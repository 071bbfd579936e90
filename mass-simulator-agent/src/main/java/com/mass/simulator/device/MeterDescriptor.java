package com.mass.simulator.device;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A meter attached to one of the unit's serial ports. Meters are keyed by serial number.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"protocol", "type", "brand", "serialNumber", "serialPort", "initBaud", "fixBaud", "frame"})
public class MeterDescriptor {

    private String protocol;
    private String type;
    private String brand;
    private String serialNumber;
    private String serialPort;
    private Integer initBaud;
    private Boolean fixBaud;
    private String frame;

    public MeterDescriptor() {
    }

    public MeterDescriptor(MeterDescriptor other) {
        this.protocol = other.protocol;
        this.type = other.type;
        this.brand = other.brand;
        this.serialNumber = other.serialNumber;
        this.serialPort = other.serialPort;
        this.initBaud = other.initBaud;
        this.fixBaud = other.fixBaud;
        this.frame = other.frame;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getBrand() {
        return brand;
    }

    public void setBrand(String brand) {
        this.brand = brand;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public String getSerialPort() {
        return serialPort;
    }

    public void setSerialPort(String serialPort) {
        this.serialPort = serialPort;
    }

    public Integer getInitBaud() {
        return initBaud;
    }

    public void setInitBaud(Integer initBaud) {
        this.initBaud = initBaud;
    }

    public Boolean getFixBaud() {
        return fixBaud;
    }

    public void setFixBaud(Boolean fixBaud) {
        this.fixBaud = fixBaud;
    }

    public String getFrame() {
        return frame;
    }

    public void setFrame(String frame) {
        this.frame = frame;
    }
}
