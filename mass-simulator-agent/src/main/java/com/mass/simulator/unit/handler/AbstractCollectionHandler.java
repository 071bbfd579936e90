package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

import static com.google.common.collect.Lists.newArrayList;

/**
 * add / list / remove over one of the id keyed collections of the device state. The response
 * always carries the collection as it is after the operation.
 */
public abstract class AbstractCollectionHandler extends AbstractFunctionHandler {

    public static final String ADD = "add";
    public static final String LIST = "list";
    public static final String REMOVE = "remove";

    protected AbstractCollectionHandler(HandlerContext context) {
        super(context);
    }

    /**
     * @return name of the collection in requests and responses
     */
    protected abstract String collectionName();

    protected abstract void add(DeviceState state, List<ObjectNode> entries) throws ValidationException;

    protected abstract List<ObjectNode> list(DeviceState state);

    protected abstract void remove(DeviceState state, String id);

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        String operation = requireText(body, "operation");
        List<ObjectNode> after;
        synchronized (state) {
            if (ADD.equals(operation)) {
                add(state, entries(body));
            } else if (REMOVE.equals(operation)) {
                for (String id : filterIds(body)) {
                    remove(state, id);
                }
            } else if (!LIST.equals(operation)) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "operation must be one of add, list, remove");
            }
            after = list(state);
        }

        ObjectNode response = newObject();
        response.putArray(collectionName()).addAll(after);
        return single(request, response);
    }

    private List<ObjectNode> entries(ObjectNode body) throws ValidationException {
        JsonNode entries = body.get(collectionName());
        if (entries == null || entries.isNull()) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, collectionName() + " is required for add");
        }
        if (!entries.isArray()) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, collectionName() + " must be an array");
        }
        List<ObjectNode> result = newArrayList();
        for (JsonNode entry : entries) {
            if (!entry.isObject() || !hasId(entry)) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "every entry of " + collectionName() + " needs an id");
            }
            result.add((ObjectNode) entry);
        }
        return result;
    }

    /**
     * The filter is either <code>{"id": ..}</code> or <code>[{"id": ..}, ..]</code>.
     */
    private static List<String> filterIds(ObjectNode body) throws ValidationException {
        JsonNode filter = body.get("filter");
        if (filter == null || filter.isNull()) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, "filter is required for remove");
        }
        List<String> ids = newArrayList();
        if (filter.isObject() && hasId(filter)) {
            ids.add(filter.get("id").asText());
        } else if (filter.isArray()) {
            for (JsonNode item : filter) {
                if (!item.isObject() || !hasId(item)) {
                    throw new ValidationException(FailCode.INVALID_PARAMETER, "every filter entry needs an id");
                }
                ids.add(item.get("id").asText());
            }
        } else {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "filter must be {id} or [{id}]");
        }
        return ids;
    }

    private static boolean hasId(JsonNode node) {
        JsonNode id = node.get("id");
        return id != null && id.isValueNode() && !id.isNull();
    }
}
