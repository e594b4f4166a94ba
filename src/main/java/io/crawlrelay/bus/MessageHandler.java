package io.crawlrelay.bus;

@FunctionalInterface
public interface MessageHandler {
    void onMessage(Delivery delivery);
}
