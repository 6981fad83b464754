package io.pulse4j.hub;

import java.io.IOException;

/**
 * Transport side of one live client connection.
 */
public interface ConnectionHandle {

    /**
     * Write one complete, pre-formatted text frame.
     */
    void send(String frame) throws IOException;

    /**
     * Close the transport. Must tolerate being called on an already closed transport.
     */
    void close();
}
