package com.dashboard.domain.service;

import java.io.IOException;

/**
 * A connected client that receives change notifications.
 */
public interface NotificationObserver {

    String getId();

    /**
     * @throws IOException if the message could not be delivered; the observer is then dropped
     */
    void send(String message) throws IOException;

    default void close() throws IOException {
    }
}
