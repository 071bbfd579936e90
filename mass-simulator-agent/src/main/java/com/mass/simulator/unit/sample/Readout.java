package com.mass.simulator.unit.sample;

/**
 * Identification line and raw register dump of a meter readout.
 */
public class Readout {

    private final String id;
    private final String rawData;

    public Readout(String id, String rawData) {
        this.id = id;
        this.rawData = rawData;
    }

    public String getId() {
        return id;
    }

    public String getRawData() {
        return rawData;
    }
}
