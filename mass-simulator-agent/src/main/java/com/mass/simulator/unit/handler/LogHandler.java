package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.sample.LogEntry;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Event log query by date range and/or incident code. Without a date range the last day of the
 * device clock is searched.
 */
public class LogHandler extends AbstractFunctionHandler {

    public LogHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.LOG;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        boolean hasStart = body.hasNonNull("startDate");
        boolean hasEnd = body.hasNonNull("endDate");
        JsonNode filter = body.get("filter");
        boolean hasFilter = filter != null && !filter.isNull();

        if (!hasStart && !hasEnd && !hasFilter) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, "startDate and endDate or filter is required");
        }
        if (hasStart != hasEnd) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, "startDate and endDate must be given together");
        }

        LocalDateTime start;
        LocalDateTime end;
        if (hasStart) {
            start = requireDate(body, "startDate");
            end = requireDate(body, "endDate");
            if (start.isAfter(end)) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "startDate must not be after endDate");
            }
        } else {
            end = state.getDeviceTime();
            start = end.minusDays(1);
        }

        Integer incidentCode = null;
        if (hasFilter) {
            if (!filter.isObject()) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "filter must be an object");
            }
            incidentCode = optionalInt((ObjectNode) filter, "incidentCode");
        }

        ArrayNode entries = newArray();
        for (LogEntry entry : context.getLogs().generate(start, end, incidentCode, state.listMeters())) {
            ObjectNode item = entries.addObject();
            item.put("incidentCode", entry.getIncidentCode());
            item.put("description", entry.getDescription());
            item.put("date", format(entry.getDate()));
            if (entry.getMeter() != null) {
                ObjectNode meter = item.putObject("meter");
                meter.put("brand", entry.getMeter().getBrand());
                meter.put("serialNumber", entry.getMeter().getSerialNumber());
            }
        }
        return single(request, entries);
    }
}
