package org.abstractica.tarpit.impl.session;

import org.abstractica.tarpit.TarpitStats;
import org.abstractica.tarpit.impl.registry.MetricsRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of TarpitStats.
 *
 * <p>Reads the registry's counters without locking.</p>
 */
public class DefaultTarpitStats implements TarpitStats
{
    private final MetricsRegistry registry;

    /**
     * Creates stats for a registry.
     *
     * @param registry the registry to read
     */
    public DefaultTarpitStats(MetricsRegistry registry)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public long getActiveConnections()
    {
        return registry.connections();
    }

    @Override
    public long getTotalConnections()
    {
        return registry.connectionsTotal();
    }

    @Override
    public Duration getUptime()
    {
        return registry.uptime();
    }
}
