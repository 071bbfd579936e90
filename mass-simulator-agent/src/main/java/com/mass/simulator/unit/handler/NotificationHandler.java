package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

/**
 * Manages the notification subscriptions configured on the unit.
 */
public class NotificationHandler extends AbstractCollectionHandler {

    public NotificationHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.NOTIFICATION;
    }

    @Override
    protected String collectionName() {
        return "notifications";
    }

    @Override
    protected void add(DeviceState state, List<ObjectNode> entries) throws ValidationException {
        state.addNotifications(entries);
    }

    @Override
    protected List<ObjectNode> list(DeviceState state) {
        return state.listNotifications();
    }

    @Override
    protected void remove(DeviceState state, String id) {
        state.removeNotification(id);
    }
}
