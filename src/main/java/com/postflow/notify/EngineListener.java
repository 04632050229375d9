package com.postflow.notify;

/**
 * Receives engine notifications. Called on the engine thread, so implementations
 * must return quickly and hand slow work elsewhere.
 */
@FunctionalInterface
public interface EngineListener {

    void onNotification(EngineNotification notification);
}
