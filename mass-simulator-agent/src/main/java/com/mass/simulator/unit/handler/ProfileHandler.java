package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.sample.ProfileEntry;
import com.mass.simulator.unit.sample.ProfileSampleGenerator;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.Lists.newArrayList;

/**
 * Load profile over a date range at a fixed interval.
 */
public class ProfileHandler extends AbstractFunctionHandler {

    public static final int DEFAULT_INTERVAL = 15;
    public static final int MAX_INTERVAL = 1440;
    static final List<String> DEFAULT_OBIS_CODES = ImmutableList.of("1.8.0");
    static final String DEFAULT_METER_SERIAL = "23660088";

    public ProfileHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.PROFILE;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        LocalDateTime start = requireDate(body, "startDate");
        LocalDateTime end = requireDate(body, "endDate");
        if (start.isAfter(end)) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "startDate must not be after endDate");
        }
        MeterDescriptor meter = optionalMeter(state, body, "meterSerialNumber");
        Integer interval = optionalInt(body, "interval");
        if (interval == null) {
            interval = DEFAULT_INTERVAL;
        } else if (interval < 1 || interval > MAX_INTERVAL) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "interval must be between 1 and " + MAX_INTERVAL + " minutes");
        }
        List<String> obisCodes = obisCodes(body);

        ProfileSampleGenerator profiles = context.getProfiles();
        String serial = meter != null ? meter.getSerialNumber() : DEFAULT_METER_SERIAL;

        ObjectNode response = newObject();
        if (meter != null) {
            response.put("meterSerialNumber", meter.getSerialNumber());
        }
        response.put("interval", interval);
        ArrayNode entries = response.putArray("entries");
        for (ProfileEntry entry : profiles.generate(start, end, interval, obisCodes, serial)) {
            ObjectNode item = entries.addObject();
            item.put("date", format(entry.getDate()));
            ObjectNode values = item.putObject("values");
            for (Map.Entry<String, String> value : entry.getValues().entrySet()) {
                values.put(value.getKey(), value.getValue());
            }
        }
        response.put("truncated", profiles.isTruncated(start, end, interval));
        return single(request, response);
    }

    private static List<String> obisCodes(ObjectNode body) throws ValidationException {
        JsonNode codes = body.get("obisCodes");
        if (codes == null || codes.isNull()) {
            return DEFAULT_OBIS_CODES;
        }
        if (!codes.isArray() || codes.size() == 0) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "obisCodes must be a non-empty array");
        }
        List<String> result = newArrayList();
        for (JsonNode code : codes) {
            if (!code.isTextual() || code.asText().trim().isEmpty()) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "obisCodes must contain obis code strings");
            }
            result.add(code.asText());
        }
        return result;
    }
}
