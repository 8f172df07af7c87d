package org.abstractica.tarpit.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.CompletionHandler;
import java.util.Objects;

/**
 * Session channel over an accepted asynchronous TCP socket.
 *
 * <p>Write completions run on the threads of the channel group the socket was
 * accepted on.</p>
 */
public class TcpSessionChannel implements SessionChannel
{
    private static final Logger LOG = LoggerFactory.getLogger(TcpSessionChannel.class);

    private final AsynchronousSocketChannel channel;
    private final SocketAddress remoteAddress;

    /**
     * Wraps an accepted socket.
     *
     * @param channel       the connected socket
     * @param remoteAddress the peer's address, already resolved
     */
    public TcpSessionChannel(AsynchronousSocketChannel channel, SocketAddress remoteAddress)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
    }

    /**
     * Shrinks the socket buffers so the peer's TCP stack sees a tiny window.
     *
     * <p>Best effort: each option that cannot be set is logged and skipped.</p>
     *
     * @param receiveBufferSize SO_RCVBUF in bytes
     * @param sendBufferSize    SO_SNDBUF in bytes
     */
    public void configureBuffers(int receiveBufferSize, int sendBufferSize)
    {
        try
        {
            channel.setOption(StandardSocketOptions.SO_RCVBUF, receiveBufferSize);
        }
        catch (IOException | RuntimeException e)
        {
            LOG.warn("set_recv_buffer_size(), peer: {}, error: {}", remoteAddress, e.getMessage());
        }

        try
        {
            channel.setOption(StandardSocketOptions.SO_SNDBUF, sendBufferSize);
        }
        catch (IOException | RuntimeException e)
        {
            LOG.warn("set_send_buffer_size(), peer: {}, error: {}", remoteAddress, e.getMessage());
        }
    }

    @Override
    public void write(ByteBuffer source, CompletionHandler<Integer, Void> handler)
    {
        channel.write(source, null, handler);
    }

    /**
     * Sockets write straight to the kernel, so there is nothing to push out;
     * a closed socket still fails the flush.
     */
    @Override
    public void flush() throws IOException
    {
        if (!channel.isOpen())
        {
            throw new ClosedChannelException();
        }
    }

    @Override
    public SocketAddress getRemoteAddress()
    {
        return remoteAddress;
    }

    @Override
    public void close()
    {
        try
        {
            channel.close();
        }
        catch (IOException e)
        {
            LOG.debug("close(), peer: {}, error: {}", remoteAddress, e.getMessage());
        }
    }
}
