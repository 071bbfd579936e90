package com.mass.simulator.agent;

import com.mass.simulator.protocol.Envelope;

/**
 * Interface for messages that can be sent to the server
 *
 */
public interface DeviceEventDispatcher {

    /**
     * frames the envelope and publishes it on the outbound topic
     *
     * @param envelope
     * @throws TransportException if the broker did not take the message
     */
    void sendMessage(Envelope envelope) throws TransportException;

    /**
     * @return true while the inbound subscription and the publish connection are both up
     */
    boolean isConnected();

    /**
     * @return broker address as host:port
     */
    String getBrokerAddress();
}
