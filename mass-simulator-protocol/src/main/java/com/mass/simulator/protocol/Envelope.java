package com.mass.simulator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Every message on the wire. Client requests carry <code>request</code>, correlated device
 * replies carry <code>response</code> and unsolicited device pushes carry <code>notification</code>.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"device", "function", "referenceId", "streaming", "messageStatus", "request", "response", "notification"})
public class Envelope {

    private DeviceAddress device;
    private String function;
    private String referenceId;
    private Boolean streaming;
    private String messageStatus;
    private JsonNode request;
    private JsonNode response;
    private JsonNode notification;

    public DeviceAddress getDevice() {
        return device;
    }

    public void setDevice(DeviceAddress device) {
        this.device = device;
    }

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }

    public Boolean getStreaming() {
        return streaming;
    }

    public void setStreaming(Boolean streaming) {
        this.streaming = streaming;
    }

    public String getMessageStatus() {
        return messageStatus;
    }

    public void setMessageStatus(String messageStatus) {
        this.messageStatus = messageStatus;
    }

    public JsonNode getRequest() {
        return request;
    }

    public void setRequest(JsonNode request) {
        this.request = request;
    }

    public JsonNode getResponse() {
        return response;
    }

    public void setResponse(JsonNode response) {
        this.response = response;
    }

    public JsonNode getNotification() {
        return notification;
    }

    public void setNotification(JsonNode notification) {
        this.notification = notification;
    }

    /**
     * @return true when this envelope carries a request a client expects to be answered
     */
    @JsonIgnore
    public boolean isCorrelated() {
        return referenceId != null;
    }

    @Override
    public String toString() {
        return "Envelope{function=" + function + ", referenceId=" + referenceId + ", device=" + device + "}";
    }
}
