package org.abstractica.tarpit.impl.registry;

import org.abstractica.tarpit.ClientEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connection accounting shared by the listener and every session.
 *
 * <p>Owns the slot table of live connections, the statistics of connections
 * that have already disconnected ("former"), and two counters: the live
 * connection count and the number of connection attempts since startup. The
 * live count is also what admission control checks against, so there is only
 * one count to keep consistent.</p>
 *
 * <p>Thread-safe. The slot table and the former statistics each have their
 * own lock, always taken in that order and never held across I/O. The
 * counters can be read without locking for logging.</p>
 */
public class MetricsRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(MetricsRegistry.class);

    /**
     * Limit meaning "no limit" for {@link #connect}.
     */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final Clock clock;
    private final Instant startup;

    private final ReentrantLock tableLock = new ReentrantLock();
    private final SlotTable clients = new SlotTable();

    private final ReentrantLock formerLock = new ReentrantLock();
    private final ConnectionStats former = new ConnectionStats();

    private final AtomicLong connectionsCount = new AtomicLong(0);
    private final AtomicLong connectionsTotal = new AtomicLong(0);

    /**
     * Creates a registry using the system clock.
     */
    public MetricsRegistry()
    {
        this(Clock.systemUTC());
    }

    /**
     * Creates a registry.
     *
     * @param clock source of the startup instant and of connection end times
     */
    public MetricsRegistry(Clock clock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startup = clock.instant();
    }

    // ========== Admission ==========

    /**
     * Admits a new connection unless the live count would exceed the limit.
     *
     * <p>The attempt is always added to the lifetime total. The live count is
     * incremented first and checked afterwards; a rejected attempt takes its
     * increment back and never touches the slot table. Two attempts racing at
     * the limit can both pass, so the limit is a best-effort ceiling.</p>
     *
     * @param maxClients highest allowed live count, or {@link #UNLIMITED}
     * @param now        when the connection was accepted
     * @return the admission outcome
     */
    public Admission connect(long maxClients, Instant now)
    {
        Objects.requireNonNull(now, "now");

        connectionsTotal.incrementAndGet();
        long connected = connectionsCount.incrementAndGet();
        if (connected > maxClients)
        {
            connectionsCount.decrementAndGet();
            return new Admission.Rejected(connected);
        }

        ClientRecord record = new ClientRecord(now);
        tableLock.lock();
        try
        {
            int index = clients.insert(record);
            return new Admission.Accepted(new Token(index), connected);
        }
        finally
        {
            tableLock.unlock();
        }
    }

    /**
     * Removes a connection and folds its statistics into the former population.
     *
     * @param token the connection's token
     * @return the new live count and how long the connection lasted
     * @throws TokenException if the token does not name a live connection;
     *                        nothing is changed in that case
     */
    public DisconnectResult disconnect(Token token) throws TokenException
    {
        Objects.requireNonNull(token, "token");

        tableLock.lock();
        try
        {
            ClientRecord record = lookup(token);
            long connectionTime = secondsSince(record.getStart());

            formerLock.lock();
            try
            {
                former.record(
                        connectionTime,
                        record.getSentChunks(),
                        record.getSentEastereggs(),
                        record.getSentBanners()
                );
            }
            finally
            {
                formerLock.unlock();
            }

            clients.remove(token.index());
            long connected = connectionsCount.decrementAndGet();
            return new DisconnectResult(connected, connectionTime);
        }
        finally
        {
            tableLock.unlock();
        }
    }

    /**
     * Counts one event for a live connection.
     *
     * @param token the connection's token
     * @param event the event to count
     * @throws TokenException if the token does not name a live connection;
     *                        nothing is changed in that case
     */
    public void recordEvent(Token token, ClientEvent event) throws TokenException
    {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(event, "event");

        tableLock.lock();
        try
        {
            lookup(token).record(event);
        }
        finally
        {
            tableLock.unlock();
        }
    }

    // ========== Reading ==========

    /**
     * Takes a consistent snapshot of all statistics.
     *
     * <p>Live connections are timed up to now; their durations are not
     * cached. Nothing in the registry is modified.</p>
     *
     * @return the snapshot
     */
    public MetricsSnapshot snapshot()
    {
        tableLock.lock();
        try
        {
            ConnectionStats current = new ConnectionStats();
            clients.forEachOccupied(record -> current.record(
                    secondsSince(record.getStart()),
                    record.getSentChunks(),
                    record.getSentEastereggs(),
                    record.getSentBanners()
            ));

            ConnectionStats formerCopy;
            formerLock.lock();
            try
            {
                formerCopy = former.copy();
            }
            finally
            {
                formerLock.unlock();
            }

            return new MetricsSnapshot(
                    uptime().getSeconds(),
                    connectionsCount.get(),
                    connectionsTotal.get(),
                    current,
                    formerCopy,
                    formerCopy.merge(current)
            );
        }
        finally
        {
            tableLock.unlock();
        }
    }

    /**
     * Returns the live connection count without locking.
     */
    public long connections()
    {
        return connectionsCount.get();
    }

    /**
     * Returns the number of connection attempts since startup without locking.
     */
    public long connectionsTotal()
    {
        return connectionsTotal.get();
    }

    /**
     * Returns the time since this registry was created.
     */
    public Duration uptime()
    {
        return nonNegative(Duration.between(startup, clock.instant()));
    }

    /**
     * Returns the clock used for connection times.
     */
    public Clock getClock()
    {
        return clock;
    }

    /**
     * Returns the current slot table length. Never decreases.
     */
    public int slotCapacity()
    {
        tableLock.lock();
        try
        {
            return clients.size();
        }
        finally
        {
            tableLock.unlock();
        }
    }

    // ========== Internal ==========

    private ClientRecord lookup(Token token) throws TokenException
    {
        if (!clients.isAllocated(token.index()))
        {
            LOG.debug("Refusing unknown token: slot {}", token.index());
            throw new TokenException(TokenException.Reason.INVALID_TOKEN, token);
        }
        ClientRecord record = clients.get(token.index());
        if (record == null)
        {
            LOG.debug("Refusing stale token: slot {}", token.index());
            throw new TokenException(TokenException.Reason.ALREADY_DISCONNECTED, token);
        }
        return record;
    }

    private long secondsSince(Instant start)
    {
        return nonNegative(Duration.between(start, clock.instant())).getSeconds();
    }

    private static Duration nonNegative(Duration duration)
    {
        return duration.isNegative() ? Duration.ZERO : duration;
    }
}
