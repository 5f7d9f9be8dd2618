package com.callinsight.processing.queue;

@FunctionalInterface
public interface StatusBroadcaster {

    void broadcast(String eventType, Object payload);
}
