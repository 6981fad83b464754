package io.pulse4j.hub;

import java.io.IOException;

/**
 * A write to a single connection failed.
 */
public class DeliveryFailureException extends IOException {

    private final String subscriberId;
    private final String connectionId;

    public DeliveryFailureException(String subscriberId, String connectionId, Throwable cause) {
        super("Delivery to connection " + connectionId + " of subscriber " + subscriberId + " failed: "
                + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.subscriberId = subscriberId;
        this.connectionId = connectionId;
    }

    public DeliveryFailureException(String subscriberId, String connectionId, String reason) {
        super("Delivery to connection " + connectionId + " of subscriber " + subscriberId + " failed: " + reason);
        this.subscriberId = subscriberId;
        this.connectionId = connectionId;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
