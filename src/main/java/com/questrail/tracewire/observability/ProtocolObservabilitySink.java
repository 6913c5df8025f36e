package com.questrail.tracewire.observability;

/**
 * Receives lifecycle, informational and error events from protocols and
 * from the runtime. Implementations can provide logging, metrics or
 * tracing.
 *
 * <p>Callbacks may arrive on a producer thread (synchronous mode) or on a
 * scheduler worker thread (asynchronous mode) and must not block for long.</p>
 */
public interface ProtocolObservabilitySink {
    /**
     * Called when a protocol moves between connection states.
     * @param event the transition details
     */
    void onStateTransition(ProtocolStateTransitionEvent event);

    /**
     * Called for informational messages, such as the banner a console sends
     * when a socket connection opens.
     * @param event the info event
     */
    void onInfo(ProtocolInfoEvent event);

    /**
     * Called when a protocol or the runtime catches a failure instead of
     * throwing it.
     * @param event the error event
     */
    void onError(ProtocolErrorEvent event);
}
