package org.abstractica.tarpit;

import java.net.SocketAddress;

/**
 * A TCP tarpit that holds client connections open indefinitely.
 *
 * <p>Every admitted connection receives a small payload at a fixed interval
 * and is never served a real protocol. The tarpit only stops talking to a
 * client when the connection fails.</p>
 *
 * <p>Typical usage:</p>
 * <pre>{@code
 * Tarpit tarpit = new DefaultTarpitFactory().builder()
 *     .listenAddress(new InetSocketAddress("0.0.0.0", 2222))
 *     .maxClients(4096)
 *     .delay(Duration.ofSeconds(10))
 *     .build();
 *
 * tarpit.start();
 * String metrics = tarpit.exportMetrics();
 * }</pre>
 */
public interface Tarpit extends AutoCloseable
{
    /**
     * Binds the listening socket and starts accepting connections.
     *
     * @throws TarpitBindException   if the listen address cannot be bound
     * @throws IllegalStateException if already started
     */
    void start();

    /**
     * Closes the listener and drops every open connection.
     *
     * <p>There is no graceful drain. Calling this more than once has no effect.</p>
     */
    @Override
    void close();

    /**
     * Returns the address the listener is bound to.
     *
     * @return the local address, or null if not started
     */
    SocketAddress getLocalAddress();

    /**
     * Returns live statistics for this tarpit.
     *
     * @return the statistics view
     */
    TarpitStats getStats();

    /**
     * Renders the current statistics as a Prometheus-style text document.
     *
     * <p>Has no side effects on the collected statistics.</p>
     *
     * @return the metrics text
     */
    String exportMetrics();
}
