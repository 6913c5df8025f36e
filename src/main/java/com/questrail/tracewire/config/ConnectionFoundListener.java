package com.questrail.tracewire.config;

@FunctionalInterface
public interface ConnectionFoundListener {
    void onConnectionFound(ConnectionDescriptor connection);
}
