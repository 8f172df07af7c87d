package org.abstractica.tarpit.impl.registry;

import java.util.Objects;

/**
 * Point-in-time copy of the registry's statistics.
 *
 * <p>Each population is a private copy; later registry activity does not
 * change a snapshot.</p>
 *
 * @param uptimeSeconds     seconds since the registry was created
 * @param connectionsCount  currently admitted connections
 * @param connectionsTotal  connection attempts since startup, rejected ones included
 * @param current           connections open at snapshot time, timed up to now
 * @param former            connections that have already disconnected
 * @param total             current and former combined
 */
public record MetricsSnapshot(
        long uptimeSeconds,
        long connectionsCount,
        long connectionsTotal,
        ConnectionStats current,
        ConnectionStats former,
        ConnectionStats total
)
{
    public MetricsSnapshot
    {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(former, "former");
        Objects.requireNonNull(total, "total");
    }
}
