package com.mass.simulator.protocol;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.UUID;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Builds outbound envelope headers. The device block is read from the identity supplier on
 * every call so identity changes show up in the next message.
 */
public class MessageHeaderBuilder {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAIL = "fail";

    private final Supplier<DeviceAddress> identity;
    private final Supplier<String> referenceIds;

    public MessageHeaderBuilder(Supplier<DeviceAddress> identity) {
        this(identity, () -> UUID.randomUUID().toString());
    }

    public MessageHeaderBuilder(Supplier<DeviceAddress> identity, Supplier<String> referenceIds) {
        this.identity = checkNotNull(identity);
        this.referenceIds = checkNotNull(referenceIds);
    }

    /**
     * Header of a reply to a client request.
     *
     * @param function
     * @param referenceId the id of the request being answered
     * @return
     */
    public Envelope reply(String function, String referenceId) {
        checkArgument(referenceId != null, "a reply needs the request reference id");
        return header(function, referenceId);
    }

    /**
     * Header of an unsolicited push, with a freshly minted reference id.
     *
     * @param function
     * @return
     */
    public Envelope push(String function) {
        return header(function, referenceIds.get());
    }

    public Envelope ack(String referenceId) {
        return reply(ProtocolFunction.ACK.getWireName(), referenceId);
    }

    /**
     * Reply reporting that a request could not be honoured.
     */
    public Envelope failure(String function, String referenceId, ValidationException failure) {
        Envelope envelope = reply(function, referenceId);
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("failCode", failure.getFailCode().getCode());
        // field name as published in the protocol document
        body.put("failDescrition", failure.getMessage());
        envelope.setMessageStatus(STATUS_FAIL);
        envelope.setResponse(body);
        return envelope;
    }

    private Envelope header(String function, String referenceId) {
        DeviceAddress current = identity.get();
        Envelope envelope = new Envelope();
        envelope.setDevice(new DeviceAddress(current.getFlag(), current.getSerialNumber()));
        envelope.setFunction(function);
        envelope.setReferenceId(referenceId);
        envelope.setStreaming(Boolean.FALSE);
        return envelope;
    }
}
