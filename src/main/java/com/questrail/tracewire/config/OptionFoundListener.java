package com.questrail.tracewire.config;

@FunctionalInterface
public interface OptionFoundListener {
    void onOptionFound(ProtocolOption option);
}
