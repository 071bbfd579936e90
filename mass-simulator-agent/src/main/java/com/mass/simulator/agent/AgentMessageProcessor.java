package com.mass.simulator.agent;

import org.apache.commons.configuration2.Configuration;

/**
 * Interface for agent message processor
 */
public interface AgentMessageProcessor {

    /**
     * Executes logic that happens before the standard processing loop.
     */
    void executeStartup();

    /**
     * Process one framed message received on the inbound topic.
     *
     * @param frame
     */
    void processInboundFrame(byte[] frame);

    /**
     * Called each time the inbound subscription is (re)established.
     */
    void handleConnected();

    /**
     * Set the runtime configuration
     *
     * @param configuration
     */
    void setConfiguration(Configuration configuration);

    /**
     * Set the runtime working directory for agent process
     *
     * @param path
     */
    void setHomePath(String path);

    /**
     * Set the event dispatcher that allows data to be sent to the server.
     *
     * @param dispatcher
     */
    void setEventDispatcher(DeviceEventDispatcher dispatcher);
}
