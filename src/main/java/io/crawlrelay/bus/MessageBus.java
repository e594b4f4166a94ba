package io.crawlrelay.bus;

import java.util.Map;

/**
 * Push-based message bus seen by the worker: pull deliveries from a
 * subscription, settle them with ack/nack, publish to a channel.
 */
public interface MessageBus {
    BusSubscription subscribe(String subscription, FlowControl flowControl, MessageHandler handler);

    /**
     * Publishes a message and returns the id the bus assigned to it.
     *
     * @throws BusException when the message could not be published
     */
    String publish(String channel, byte[] data, Map<String, String> attributes);
}
