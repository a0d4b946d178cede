package com.rulesentinel.ruler;

import com.fasterxml.jackson.core.JsonGenerator;
import com.rulesentinel.core.wire.RuleGroupMessage;
import com.rulesentinel.core.wire.RuleGroupSink;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link RuleGroupSink} writing each group as one element of a JSON array
 * and flushing it to the client immediately.
 *
 * <p>
 * The caller owns the generator and writes the envelope around the array.
 * Once a write fails the client is treated as gone: the failure propagates
 * and the writer reports itself cancelled from then on.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonRuleGroupWriter implements RuleGroupSink {

    private final JsonGenerator generator;
    private volatile boolean cancelled;
    private int written;

    public JsonRuleGroupWriter(JsonGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "JsonGenerator must not be null");
    }

    @Override
    public void send(RuleGroupMessage group) throws IOException {
        try {
            generator.writeObject(group);
            generator.flush();
        } catch (IOException e) {
            cancelled = true;
            throw e;
        }
        written++;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return number of groups written so far
     */
    public int getWritten() {
        return written;
    }
}
