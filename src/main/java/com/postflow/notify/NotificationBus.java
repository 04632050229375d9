package com.postflow.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans notifications out to listeners. A failing listener is logged and skipped.
 */
public class NotificationBus {

    private static final Logger log = LoggerFactory.getLogger(NotificationBus.class);

    private final List<EngineListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(EngineListener listener) {
        listeners.add(listener);
    }

    public void removeListener(EngineListener listener) {
        listeners.remove(listener);
    }

    public void publish(EngineNotification notification) {
        for (EngineListener listener : listeners) {
            try {
                listener.onNotification(notification);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}: {}", listener, notification.type(), e.getMessage(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
