package org.abstractica.tarpit.impl.transport;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.CompletionHandler;

/**
 * Write side of one client connection.
 *
 * <p>The tarpit never reads from its clients, so a session channel only
 * writes. Writes are asynchronous; the calling thread is never blocked while
 * the peer's receive window is full.</p>
 */
public interface SessionChannel extends AutoCloseable
{
    /**
     * Starts writing bytes to the peer.
     *
     * <p>At most one write may be outstanding. The handler receives the
     * number of bytes written, which may be fewer than were remaining; the
     * caller is responsible for writing the rest.</p>
     *
     * @param source  the bytes to write (position to limit)
     * @param handler notified on completion or failure
     */
    void write(ByteBuffer source, CompletionHandler<Integer, Void> handler);

    /**
     * Forces previously written bytes out of any local buffering.
     *
     * @throws IOException if the channel can no longer deliver data
     */
    void flush() throws IOException;

    /**
     * Returns the peer's address.
     *
     * @return the remote address
     */
    SocketAddress getRemoteAddress();

    /**
     * Closes the connection. Closing twice has no effect.
     */
    @Override
    void close();
}
