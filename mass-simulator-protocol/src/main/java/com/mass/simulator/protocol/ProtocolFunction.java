package com.mass.simulator.protocol;

/**
 * Function names understood by the communication unit.
 */
public enum ProtocolFunction {
    ACK("ack"),
    IDENTIFICATION("identification"),
    HEARTBEAT("heartbeat"),
    ALARM("alarm"),
    READ("read"),
    CONFIGURATION("configuration"),
    SCHEDULE("schedule"),
    NOTIFICATION("notification"),
    LOG("log"),
    WRITE("write"),
    RESET("reset"),
    FIRMWARE_UPDATE("firmwareUpdate"),
    PROFILE("profile"),
    DIRECTIVE("directive"),
    RELAY("relay");

    private final String wireName;

    ProtocolFunction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @param wireName
     * @return the function, or null when the name is not a known function
     */
    public static ProtocolFunction fromWireName(String wireName) {
        for (ProtocolFunction function : values()) {
            if (function.wireName.equals(wireName)) {
                return function;
            }
        }
        return null;
    }
}
