package org.abstractica.tarpit.impl.session;

import org.abstractica.tarpit.TarpitBindException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultTarpit} over loopback TCP.
 */
class DefaultTarpitTest
{
    private static final Duration DELAY = Duration.ofMillis(200);

    private final List<DefaultTarpit> tarpits = new ArrayList<>();

    @AfterEach
    void tearDown()
    {
        for (DefaultTarpit tarpit : tarpits)
        {
            tarpit.close();
        }
    }

    private DefaultTarpitFactory.DefaultBuilder loopbackBuilder()
    {
        return new DefaultTarpitFactory().builder()
                .listenAddress(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))
                .delay(DELAY)
                .ioThreads(2);
    }

    private DefaultTarpit start(DefaultTarpitFactory.DefaultBuilder builder)
    {
        DefaultTarpit tarpit = builder.build();
        tarpits.add(tarpit);
        tarpit.start();
        return tarpit;
    }

    private static Socket connect(DefaultTarpit tarpit) throws IOException
    {
        Socket socket = new Socket();
        socket.connect(tarpit.getLocalAddress(), 5000);
        socket.setSoTimeout(5000);
        return socket;
    }

    private static String readBytes(InputStream in, int count) throws IOException
    {
        byte[] buffer = in.readNBytes(count);
        return new String(buffer, StandardCharsets.US_ASCII);
    }

    private static void awaitCondition(BooleanSupplier condition, String message) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean())
        {
            if (System.nanoTime() > deadline)
            {
                fail(message);
            }
            Thread.sleep(20);
        }
    }

    @Test
    void start_bindsEphemeralPort()
    {
        DefaultTarpit tarpit = start(loopbackBuilder());

        InetSocketAddress address = (InetSocketAddress) tarpit.getLocalAddress();
        assertNotNull(address);
        assertTrue(address.getPort() > 0);
    }

    @Test
    void start_twice_throws()
    {
        DefaultTarpit tarpit = start(loopbackBuilder());

        assertThrows(IllegalStateException.class, tarpit::start);
    }

    @Test
    void start_portInUse_throwsBindException()
    {
        DefaultTarpit first = start(loopbackBuilder());
        InetSocketAddress taken = (InetSocketAddress) first.getLocalAddress();

        DefaultTarpit second = loopbackBuilder().listenAddress(taken).build();
        tarpits.add(second);

        TarpitBindException e = assertThrows(TarpitBindException.class, second::start);
        assertEquals(taken, e.getAddress());
        assertTrue(e.getMessage().startsWith("bind(), addr: "), e.getMessage());
    }

    @Test
    void client_receivesBannerAfterDelay() throws Exception
    {
        DefaultTarpit tarpit = start(loopbackBuilder());

        try (Socket client = connect(tarpit))
        {
            long connected = System.nanoTime();
            String banner = readBytes(client.getInputStream(), Payload.DEFAULT_BANNER.length());
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - connected);

            assertEquals(Payload.DEFAULT_BANNER, banner);
            assertTrue(elapsedMillis >= DELAY.toMillis() - 10, "banner after " + elapsedMillis + "ms");
            assertEquals(Payload.DEFAULT_BANNER, readBytes(client.getInputStream(), Payload.DEFAULT_BANNER.length()));
        }
    }

    @Test
    void client_customBannerAndEasteregg() throws Exception
    {
        DefaultTarpit tarpit = start(loopbackBuilder()
                .banner("hi\r\n")
                .easteregg("egg\r\n")
                .eastereggInterval(1));

        try (Socket client = connect(tarpit))
        {
            assertEquals("hi\r\negg\r\nhi\r\n", readBytes(client.getInputStream(), 13));
        }
    }

    @Test
    void maxClients_rejectsExtraConnection() throws Exception
    {
        DefaultTarpit tarpit = start(loopbackBuilder().maxClients(1));

        try (Socket first = connect(tarpit))
        {
            awaitCondition(() -> tarpit.getStats().getActiveConnections() == 1, "first client not admitted");

            try (Socket second = connect(tarpit))
            {
                int read;
                try
                {
                    read = second.getInputStream().read();
                }
                catch (SocketException e)
                {
                    // Reset instead of orderly close
                    read = -1;
                }
                assertEquals(-1, read);
            }

            assertEquals(1, tarpit.getStats().getActiveConnections());
            assertEquals(2, tarpit.getStats().getTotalConnections());
            assertEquals(Payload.DEFAULT_BANNER, readBytes(first.getInputStream(), Payload.DEFAULT_BANNER.length()));
        }
    }

    @Test
    void clientClose_detectedOnNextWrite() throws Exception
    {
        DefaultTarpit tarpit = start(loopbackBuilder());

        try (Socket client = connect(tarpit))
        {
            readBytes(client.getInputStream(), Payload.DEFAULT_BANNER.length());
        }

        awaitCondition(() -> tarpit.getStats().getActiveConnections() == 0, "disconnect not detected");

        assertEquals(1, tarpit.getRegistry().snapshot().former().getCount());
        assertTrue(tarpit.getRegistry().snapshot().former().getSentBannersSum() >= 1);
        assertTrue(tarpit.exportMetrics().contains("\nformer_connection_time_seconds_bucket{le=0s} 1\n"));
    }

    @Test
    void exportMetrics_countsConnections() throws Exception
    {
        DefaultTarpit tarpit = start(loopbackBuilder());

        try (Socket client = connect(tarpit))
        {
            awaitCondition(() -> tarpit.getStats().getActiveConnections() == 1, "client not admitted");

            String metrics = tarpit.exportMetrics();

            assertTrue(metrics.contains("\nconnections_count 1\n"), metrics);
            assertTrue(metrics.contains("\nconnections_total 1\n"), metrics);
        }
    }

    @Test
    void close_isIdempotent()
    {
        DefaultTarpit tarpit = start(loopbackBuilder());

        tarpit.close();
        tarpit.close();

        assertThrows(IllegalStateException.class, tarpit::start);
    }

    @Test
    void builder_invalidArguments_rejected()
    {
        DefaultTarpitFactory.DefaultBuilder builder = new DefaultTarpitFactory().builder();

        assertThrows(IllegalArgumentException.class, () -> builder.maxClients(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.delay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.chunkSize(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.eastereggInterval(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.ioThreads(0));
        assertThrows(IllegalArgumentException.class, () -> builder.banner("").build());
    }
}
