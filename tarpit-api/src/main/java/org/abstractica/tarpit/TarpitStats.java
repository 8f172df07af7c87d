package org.abstractica.tarpit;

import java.time.Duration;

/**
 * Pollable tarpit statistics.
 *
 * <p>Values are approximate snapshots read without locking and are meant for
 * logging and monitoring. The full accounting is available through
 * {@link Tarpit#exportMetrics()}.</p>
 */
public interface TarpitStats
{
    /**
     * Returns the number of currently admitted connections.
     *
     * @return live connection count
     */
    long getActiveConnections();

    /**
     * Returns the number of connection attempts since startup, including rejected ones.
     *
     * @return lifetime connection attempts
     */
    long getTotalConnections();

    /**
     * Returns the time since the tarpit was created.
     *
     * @return uptime
     */
    Duration getUptime();
}
