package org.abstractica.tarpit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketAddress;

/**
 * Thrown when the tarpit cannot bind its listening socket.
 *
 * <p>This is the only fatal error of a running tarpit.</p>
 */
public class TarpitBindException extends UncheckedIOException
{
    private final SocketAddress address;

    /**
     * Creates a bind exception.
     *
     * @param address the address that could not be bound
     * @param cause   the underlying I/O error
     */
    public TarpitBindException(SocketAddress address, IOException cause)
    {
        super("bind(), addr: " + address + ", error: " + cause.getMessage(), cause);
        this.address = address;
    }

    /**
     * Returns the address that could not be bound.
     *
     * @return the bind address
     */
    public SocketAddress getAddress()
    {
        return address;
    }
}
