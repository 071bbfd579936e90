package com.mass.simulator.unit.sample;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Synthesizes load profiles: monotonic cumulative register values at a fixed interval.
 */
public class ProfileSampleGenerator {

    public static final int MAX_ENTRIES = 1000;

    /**
     * Generate profile entries from start to end inclusive. At most {@link #MAX_ENTRIES} entries
     * are produced; {@link #isTruncated(LocalDateTime, LocalDateTime, int)} tells whether the
     * range was cut short.
     *
     * @param start
     * @param end
     * @param intervalMinutes
     * @param obisCodes registers captured in every entry
     * @param meterSerial seeds the values
     * @return entries in chronological order
     */
    public List<ProfileEntry> generate(LocalDateTime start, LocalDateTime end, int intervalMinutes,
                                       List<String> obisCodes, String meterSerial) {
        Map<String, Random> increments = new LinkedHashMap<>();
        Map<String, Double> totals = new LinkedHashMap<>();
        for (String code : obisCodes) {
            Random random = new Random(Objects.hash(meterSerial, code, start));
            totals.put(code, random.nextInt(10_000_000) / 1000.0);
            increments.put(code, random);
        }

        List<ProfileEntry> entries = new ArrayList<>();
        LocalDateTime date = start;
        while (!date.isAfter(end) && entries.size() < MAX_ENTRIES) {
            Map<String, String> values = new LinkedHashMap<>();
            for (String code : obisCodes) {
                double total = totals.get(code) + increments.get(code).nextInt(500) / 1000.0;
                totals.put(code, total);
                values.put(code, String.format(Locale.ROOT, "%014.3f", total));
            }
            entries.add(new ProfileEntry(date, values));
            date = date.plusMinutes(intervalMinutes);
        }
        return entries;
    }

    public boolean isTruncated(LocalDateTime start, LocalDateTime end, int intervalMinutes) {
        return !start.plusMinutes((long) intervalMinutes * MAX_ENTRIES).isAfter(end);
    }
}
