package com.vlrnotify.domain.ports;

import com.vlrnotify.domain.model.PollOutcome;

/**
 * Port for fetching matches and results from an external source.
 */
public interface EventSource {

    /**
     * Gets the name of the source this poller handles.
     *
     * @return Source name (e.g., "vlr")
     */
    String getSourceName();

    /**
     * Performs one fetch-and-normalize cycle, bounded by the configured timeouts.
     * Transport or payload errors are reported as a failed outcome, never thrown.
     *
     * @return Normalized events, or a failure with its reason
     */
    PollOutcome poll();
}
