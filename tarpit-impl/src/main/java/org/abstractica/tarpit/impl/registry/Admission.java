package org.abstractica.tarpit.impl.registry;

import java.util.Objects;

/**
 * Outcome of {@link MetricsRegistry#connect}.
 */
public sealed interface Admission
{
    /**
     * The connection was admitted and has a slot in the registry.
     *
     * @param token       handle for later events and the disconnect
     * @param connections live connection count including this one
     */
    record Accepted(Token token, long connections) implements Admission
    {
        public Accepted
        {
            Objects.requireNonNull(token, "token");
        }
    }

    /**
     * The connection would exceed the limit and must be dropped.
     *
     * @param connections the live count this connection would have produced
     */
    record Rejected(long connections) implements Admission {}
}
