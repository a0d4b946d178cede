package com.rulesentinel.core.engine;

import java.time.Instant;
import java.util.List;

/**
 * Executes a rule's query at a point in time.
 *
 * <p>
 * How partial failures of the underlying query backend are treated is up to
 * the implementation; one instance is bound per
 * {@link com.rulesentinel.core.model.PartialResponseStrategy}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryFunction {

    /**
     * @param query query text
     * @param time  evaluation timestamp
     * @return result samples, possibly empty
     * @throws QueryException if the query fails
     */
    List<Sample> query(String query, Instant time) throws QueryException;
}
