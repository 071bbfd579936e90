package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

public class ScheduleHandler extends AbstractCollectionHandler {

    public ScheduleHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.SCHEDULE;
    }

    @Override
    protected String collectionName() {
        return "schedules";
    }

    @Override
    protected void add(DeviceState state, List<ObjectNode> entries) throws ValidationException {
        state.addSchedules(entries);
    }

    @Override
    protected List<ObjectNode> list(DeviceState state) {
        return state.listSchedules();
    }

    @Override
    protected void remove(DeviceState state, String id) {
        state.removeSchedule(id);
    }
}
