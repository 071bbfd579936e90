package com.mass.simulator.unit.sample;

import com.google.common.collect.ImmutableList;
import com.mass.simulator.device.MeterDescriptor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Synthesizes IEC 62056-21 style readouts. Register values depend only on the meter serial
 * number and the OBIS code, so the same request always yields the same values.
 */
public class ReadoutSampleGenerator {

    public static final String FULL_READOUT = "readout";
    public static final String SHORT_READOUT = "shortReadout";
    public static final String OBIS_READOUT = "obis";

    static final List<String> FULL_CODES = ImmutableList.of(
            "0.0.0", "0.9.2", "0.9.1", "1.8.0", "1.8.1", "1.8.2", "1.8.3", "2.8.0", "32.7.0", "31.7.0", "14.7.0");
    static final List<String> SHORT_CODES = ImmutableList.of("0.0.0", "0.9.2", "0.9.1", "1.8.0");

    private static final String DEFAULT_METER_SERIAL = "23660088";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public boolean supports(String directive) {
        return FULL_READOUT.equals(directive) || SHORT_READOUT.equals(directive) || OBIS_READOUT.equals(directive);
    }

    /**
     * @param directive one of the supported directives
     * @param obisCodes codes to read, only used by the obis directive
     * @param meter meter being read, or null for the unit's own default meter
     * @param readTime device time of the reading
     * @return the readout
     */
    public Readout generate(String directive, List<String> obisCodes, MeterDescriptor meter, LocalDateTime readTime) {
        List<String> codes;
        if (FULL_READOUT.equals(directive)) {
            codes = FULL_CODES;
        } else if (SHORT_READOUT.equals(directive)) {
            codes = SHORT_CODES;
        } else if (OBIS_READOUT.equals(directive)) {
            codes = obisCodes;
        } else {
            throw new IllegalArgumentException("unsupported directive " + directive);
        }

        String serial = meter != null ? meter.getSerialNumber() : DEFAULT_METER_SERIAL;
        StringBuilder raw = new StringBuilder();
        for (String code : codes) {
            raw.append(code).append('(').append(value(code, serial, readTime)).append(")\r\n");
        }
        return new Readout(identification(meter, serial), raw.toString());
    }

    private static String identification(MeterDescriptor meter, String serial) {
        String brand = meter != null && meter.getBrand() != null ? meter.getBrand() : "LGZ";
        String code = (brand.replaceAll("[^A-Za-z]", "") + "XXX").substring(0, 3).toUpperCase(Locale.ROOT);
        return "/" + code + "5\\2" + serial + ".P07";
    }

    private static String value(String code, String serial, LocalDateTime readTime) {
        switch (code) {
            case "0.0.0":
                return serial;
            case "0.9.2":
                return readTime.format(DATE);
            case "0.9.1":
                return readTime.format(TIME);
            case "32.7.0":
                return String.format(Locale.ROOT, "%05.1f", 220 + seeded(serial, code).nextInt(200) / 10.0);
            case "31.7.0":
                return String.format(Locale.ROOT, "%06.3f", seeded(serial, code).nextInt(40000) / 1000.0);
            case "14.7.0":
                return String.format(Locale.ROOT, "%05.2f", 49.9 + seeded(serial, code).nextInt(20) / 100.0);
            default:
                return String.format(Locale.ROOT, "%014.3f", seeded(serial, code).nextInt(100_000_000) / 1000.0);
        }
    }

    private static Random seeded(String serial, String code) {
        return new Random(Objects.hash(serial, code));
    }
}
