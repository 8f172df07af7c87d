package org.abstractica.tarpit.impl.session;

import org.abstractica.tarpit.Tarpit;
import org.abstractica.tarpit.TarpitBindException;
import org.abstractica.tarpit.TarpitStats;
import org.abstractica.tarpit.impl.export.MetricsTextExporter;
import org.abstractica.tarpit.impl.registry.Admission;
import org.abstractica.tarpit.impl.registry.MetricsRegistry;
import org.abstractica.tarpit.impl.transport.TcpSessionChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.AsynchronousChannelGroup;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of the Tarpit interface.
 *
 * <p>Accepts TCP connections, runs admission control against the
 * {@link MetricsRegistry}, shrinks the socket buffers of admitted
 * connections, and starts one {@link TarpitSession} for each.</p>
 *
 * <p>All sockets share one asynchronous channel group and one timer thread.
 * The accept is re-armed after each completion, so connections are handled
 * one at a time in arrival order.</p>
 */
public class DefaultTarpit implements Tarpit
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultTarpit.class);

    static final int RECEIVE_BUFFER_SIZE = 1;
    static final int SEND_BUFFER_SIZE = 64;

    private final InetSocketAddress listenAddress;
    private final long maxClients;
    private final Duration delay;
    private final Payload payload;
    private final int ioThreads;

    private final MetricsRegistry registry;
    private final MetricsTextExporter exporter;
    private final DefaultTarpitStats stats;

    private AsynchronousChannelGroup group;
    private AsynchronousServerSocketChannel listener;
    private ScheduledExecutorService scheduler;
    private volatile boolean running;
    private volatile boolean closed;

    /**
     * Creates a new tarpit.
     *
     * <p>Use {@link DefaultTarpitFactory} to create instances.</p>
     */
    DefaultTarpit(
            InetSocketAddress listenAddress,
            int maxClients,
            Duration delay,
            Payload payload,
            int ioThreads,
            MetricsRegistry registry
    )
    {
        this.listenAddress = Objects.requireNonNull(listenAddress, "listenAddress");
        this.maxClients = maxClients == 0 ? MetricsRegistry.UNLIMITED : maxClients;
        this.delay = Objects.requireNonNull(delay, "delay");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.ioThreads = ioThreads;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.exporter = new MetricsTextExporter();
        this.stats = new DefaultTarpitStats(registry);
    }

    // ========== Tarpit Interface ==========

    @Override
    public void start()
    {
        if (running || closed)
        {
            throw new IllegalStateException("Tarpit already started");
        }

        try
        {
            group = AsynchronousChannelGroup.withFixedThreadPool(ioThreads, threadFactory("tarpit-io"));
            listener = AsynchronousServerSocketChannel.open(group).bind(listenAddress);
        }
        catch (IOException e)
        {
            shutdownGroup();
            throw new TarpitBindException(listenAddress, e);
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("tarpit-timer"));
        running = true;
        acceptNext();

        LOG.info("listen, addr: {}", getLocalAddress());
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;
        running = false;

        LOG.info("Closing tarpit, clients: {}", registry.connections());

        if (listener != null)
        {
            try
            {
                listener.close();
            }
            catch (IOException e)
            {
                LOG.warn("Error closing listener", e);
            }
        }

        if (scheduler != null)
        {
            scheduler.shutdownNow();
        }
        shutdownGroup();
    }

    @Override
    public SocketAddress getLocalAddress()
    {
        if (listener == null)
        {
            return null;
        }
        try
        {
            return listener.getLocalAddress();
        }
        catch (IOException e)
        {
            return null;
        }
    }

    @Override
    public TarpitStats getStats()
    {
        return stats;
    }

    @Override
    public String exportMetrics()
    {
        return exporter.export(registry.snapshot());
    }

    /**
     * Returns the registry shared by this tarpit's sessions.
     */
    public MetricsRegistry getRegistry()
    {
        return registry;
    }

    // ========== Accept Loop ==========

    private void acceptNext()
    {
        if (!running)
        {
            return;
        }

        try
        {
            listener.accept(null, new CompletionHandler<AsynchronousSocketChannel, Void>()
            {
                @Override
                public void completed(AsynchronousSocketChannel socket, Void attachment)
                {
                    acceptNext();
                    onAccepted(socket);
                }

                @Override
                public void failed(Throwable cause, Void attachment)
                {
                    if (running)
                    {
                        LOG.error("accept(), error: {}", cause.getMessage());
                        acceptNext();
                    }
                }
            });
        }
        catch (RuntimeException e)
        {
            if (running)
            {
                LOG.error("accept(), error: {}", e.getMessage());
            }
        }
    }

    private void onAccepted(AsynchronousSocketChannel socket)
    {
        SocketAddress peer;
        try
        {
            peer = socket.getRemoteAddress();
            if (peer == null)
            {
                throw new IOException("socket is not connected");
            }
        }
        catch (IOException e)
        {
            LOG.error("peer_addr(), error: {}", e.getMessage());
            closeQuietly(socket);
            return;
        }

        Admission admission = registry.connect(maxClients, registry.getClock().instant());
        if (admission instanceof Admission.Rejected rejected)
        {
            LOG.info("reject, peer: {}, clients: {}", peer, rejected.connections());
            closeQuietly(socket);
            return;
        }

        Admission.Accepted accepted = (Admission.Accepted) admission;
        LOG.info("connect, peer: {}, clients: {}", peer, accepted.connections());

        TcpSessionChannel channel = new TcpSessionChannel(socket, peer);
        channel.configureBuffers(RECEIVE_BUFFER_SIZE, SEND_BUFFER_SIZE);

        TarpitSession session = new TarpitSession(
                channel,
                registry,
                accepted.token(),
                scheduler,
                delay,
                payload.copy()
        );
        session.start();
    }

    // ========== Internal ==========

    private void shutdownGroup()
    {
        if (group != null)
        {
            try
            {
                group.shutdownNow();
            }
            catch (IOException e)
            {
                LOG.warn("Error shutting down channel group", e);
            }
        }
    }

    private static void closeQuietly(AsynchronousSocketChannel socket)
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("close(), error: {}", e.getMessage());
        }
    }

    private static ThreadFactory threadFactory(String prefix)
    {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable ->
        {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
