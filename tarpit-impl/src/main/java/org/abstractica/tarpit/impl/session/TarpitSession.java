package org.abstractica.tarpit.impl.session;

import org.abstractica.tarpit.ClientEvent;
import org.abstractica.tarpit.impl.registry.DisconnectResult;
import org.abstractica.tarpit.impl.registry.MetricsRegistry;
import org.abstractica.tarpit.impl.registry.Token;
import org.abstractica.tarpit.impl.registry.TokenException;
import org.abstractica.tarpit.impl.transport.SessionChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.CompletionHandler;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One tarpitted connection.
 *
 * <p>Runs the loop WAITING → WRITING → FLUSHING → WAITING until a write, a
 * flush or the timer fails. The session holds no thread while waiting or
 * while a write is pending: the delay runs on a shared scheduler and writes
 * complete through the channel's completion handler.</p>
 *
 * <p>On failure the session disconnects its token from the registry, logs
 * the peer, the connection time and the cause, and closes the channel. There
 * is no limit on how long a session runs.</p>
 */
public class TarpitSession
{
    private static final Logger LOG = LoggerFactory.getLogger(TarpitSession.class);

    private final SessionChannel channel;
    private final MetricsRegistry registry;
    private final Token token;
    private final ScheduledExecutorService scheduler;
    private final Duration delay;
    private final Payload payload;
    private final long startNanos;

    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile SessionState state = SessionState.NEW;

    /**
     * Creates a session for an admitted connection.
     *
     * @param channel   the connection
     * @param registry  the registry that admitted it
     * @param token     the connection's registry token
     * @param scheduler timer for the delay between writes
     * @param delay     time between writes
     * @param payload   what to write, owned by this session
     */
    public TarpitSession(
            SessionChannel channel,
            MetricsRegistry registry,
            Token token,
            ScheduledExecutorService scheduler,
            Duration delay,
            Payload payload
    )
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.token = Objects.requireNonNull(token, "token");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.startNanos = System.nanoTime();
    }

    /**
     * Starts the loop with a wait; the first write happens one delay from now.
     */
    public void start()
    {
        if (state != SessionState.NEW)
        {
            throw new IllegalStateException("Session already started");
        }
        scheduleWrite();
    }

    public SessionState getState()
    {
        return state;
    }

    public Token getToken()
    {
        return token;
    }

    // ========== Loop ==========

    private void scheduleWrite()
    {
        state = SessionState.WAITING;
        try
        {
            scheduler.schedule(this::onDelayElapsed, delay.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (RejectedExecutionException e)
        {
            terminate(new IOException("timer failure", e));
        }
    }

    private void onDelayElapsed()
    {
        if (terminated.get())
        {
            return;
        }

        Payload.Chunk chunk = payload.next();
        state = SessionState.WRITING;
        write(chunk);
    }

    private void write(Payload.Chunk chunk)
    {
        ByteBuffer data = chunk.data();
        try
        {
            channel.write(data, new CompletionHandler<Integer, Void>()
            {
                @Override
                public void completed(Integer written, Void attachment)
                {
                    if (data.hasRemaining())
                    {
                        write(chunk);
                    }
                    else
                    {
                        onWritten(chunk);
                    }
                }

                @Override
                public void failed(Throwable cause, Void attachment)
                {
                    terminate(cause);
                }
            });
        }
        catch (RuntimeException e)
        {
            // Channel group shut down or channel closed under us
            terminate(e);
        }
    }

    private void onWritten(Payload.Chunk chunk)
    {
        state = SessionState.FLUSHING;
        try
        {
            channel.flush();
        }
        catch (IOException e)
        {
            terminate(e);
            return;
        }

        for (ClientEvent event : chunk.events())
        {
            try
            {
                registry.recordEvent(token, event);
            }
            catch (TokenException e)
            {
                LOG.warn("record_event(), peer: {}, event: {}, error: {}",
                        channel.getRemoteAddress(), event, e.getMessage());
            }
        }

        scheduleWrite();
    }

    // ========== Termination ==========

    private void terminate(Throwable cause)
    {
        if (!terminated.compareAndSet(false, true))
        {
            return;
        }

        String elapsed = formatElapsed(System.nanoTime() - startNanos);
        try
        {
            DisconnectResult result = registry.disconnect(token);
            LOG.info("disconnect, peer: {}, duration: {}, error: {}, clients: {}",
                    channel.getRemoteAddress(), elapsed, describe(cause), result.connections());
        }
        catch (TokenException e)
        {
            LOG.warn("disconnect, peer: {}, duration: {}, error: {}, registry error: {}",
                    channel.getRemoteAddress(), elapsed, describe(cause), e.getMessage());
        }
        finally
        {
            channel.close();
            state = SessionState.TERMINATED;
        }
    }

    private static String formatElapsed(long nanos)
    {
        return String.format(Locale.ROOT, "%.2fs", nanos / 1_000_000_000.0);
    }

    private static String describe(Throwable cause)
    {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
