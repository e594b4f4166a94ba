package io.crawlrelay.bus;

public class BusException extends RuntimeException {
    public BusException(String message, Throwable cause) {
        super(message, cause);
    }

    public BusException(String message) {
        super(message);
    }
}
