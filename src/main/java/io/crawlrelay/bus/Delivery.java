package io.crawlrelay.bus;

import java.util.Map;

public interface Delivery {
    String messageId();

    Map<String, String> attributes();

    byte[] data();

    /** Tells the bus the message is received and must not be redelivered. */
    void ack();

    /** Returns the message to the bus for later redelivery. */
    void nack();
}
