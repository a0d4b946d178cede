package com.rulesentinel.core.wire;

import java.io.IOException;

/**
 * Receiving end of a streamed rule listing.
 *
 * @since 1.0.0
 */
public interface RuleGroupSink {

    /**
     * Transmit one group.
     *
     * @param group projected group
     * @throws IOException if the group could not be transmitted; the stream
     *                     is aborted
     */
    void send(RuleGroupMessage group) throws IOException;

    /**
     * @return {@code true} once the caller is no longer interested in further
     *         groups
     */
    default boolean isCancelled() {
        return false;
    }
}
