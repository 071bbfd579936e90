package com.mass.simulator.device;

/**
 * Values the unit starts with when configuration does not say otherwise.
 */
public final class DeviceDefaults {

    public static final String FLAG = "XYZ";
    public static final String SERIAL_NUMBER = "0123456789ABCDE";
    public static final String BRAND = "SimulatorBrand";
    public static final String MODEL = "SimV1.0";
    public static final String PROTOCOL_VERSION = "1.0.0";
    public static final String FIRMWARE = "1.01";
    public static final String MANUFACTURE_DATE = "2023-05-23";
    public static final int SIGNAL = 13;
    public static final int CPU_TEMP = 17;

    private DeviceDefaults() {
        // constants
    }
}
