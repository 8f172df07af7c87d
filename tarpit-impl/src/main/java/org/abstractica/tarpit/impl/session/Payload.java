package org.abstractica.tarpit.impl.session;

import org.abstractica.tarpit.ClientEvent;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Decides what a session writes on each tick.
 *
 * <p>The banner is cut into chunks of {@code chunkSize} bytes and written one
 * chunk per tick, starting over when it is complete. When an easter egg is
 * configured, every {@code eastereggInterval} completed banners the next tick
 * writes the easter egg instead.</p>
 *
 * <p>Not thread-safe. A session asks for one chunk at a time.</p>
 */
public class Payload
{
    /**
     * Banner sent when none is configured.
     */
    public static final String DEFAULT_BANNER = "bleep bloop\r\n";

    /**
     * Easter egg sent when one is enabled but none is configured.
     */
    public static final String DEFAULT_EASTEREGG = "There is nothing to see here.\r\n";

    private final byte[] banner;
    private final int chunkSize;
    private final byte[] easteregg;
    private final int eastereggInterval;

    private int offset;
    private int bannersSinceEasteregg;

    /**
     * One tick's worth of output.
     *
     * @param data   bytes to write
     * @param events events to count once the bytes are written
     */
    public record Chunk(ByteBuffer data, List<ClientEvent> events) {}

    /**
     * Creates a payload.
     *
     * @param banner            ASCII banner, non-empty
     * @param chunkSize         bytes per tick, or 0 for the whole banner
     * @param easteregg         ASCII easter egg, non-empty
     * @param eastereggInterval banners between easter eggs, or 0 to disable
     */
    public Payload(String banner, int chunkSize, String easteregg, int eastereggInterval)
    {
        this.banner = ascii(banner, "banner");
        this.easteregg = ascii(easteregg, "easteregg");
        if (chunkSize < 0)
        {
            throw new IllegalArgumentException("chunkSize must be >= 0: " + chunkSize);
        }
        if (eastereggInterval < 0)
        {
            throw new IllegalArgumentException("eastereggInterval must be >= 0: " + eastereggInterval);
        }
        this.chunkSize = chunkSize == 0 ? this.banner.length : Math.min(chunkSize, this.banner.length);
        this.eastereggInterval = eastereggInterval;
    }

    /**
     * Creates a payload that writes the default banner whole on every tick.
     */
    public static Payload defaultPayload()
    {
        return new Payload(DEFAULT_BANNER, 0, DEFAULT_EASTEREGG, 0);
    }

    /**
     * Returns a fresh payload with the same settings and no progress.
     */
    public Payload copy()
    {
        return new Payload(
                new String(banner, StandardCharsets.US_ASCII),
                chunkSize,
                new String(easteregg, StandardCharsets.US_ASCII),
                eastereggInterval
        );
    }

    /**
     * Returns what to write on the next tick and advances.
     *
     * @return the next chunk
     */
    public Chunk next()
    {
        if (eastereggInterval > 0 && offset == 0 && bannersSinceEasteregg >= eastereggInterval)
        {
            bannersSinceEasteregg = 0;
            return new Chunk(ByteBuffer.wrap(easteregg).asReadOnlyBuffer(), List.of(ClientEvent.EASTEREGG_SENT));
        }

        int end = Math.min(offset + chunkSize, banner.length);
        ByteBuffer data = ByteBuffer.wrap(banner, offset, end - offset).slice().asReadOnlyBuffer();
        if (end == banner.length)
        {
            offset = 0;
            bannersSinceEasteregg++;
            return new Chunk(data, List.of(ClientEvent.CHUNK_SENT, ClientEvent.BANNER_SENT));
        }
        offset = end;
        return new Chunk(data, List.of(ClientEvent.CHUNK_SENT));
    }

    public int getChunkSize()
    {
        return chunkSize;
    }

    private static byte[] ascii(String text, String name)
    {
        Objects.requireNonNull(text, name);
        if (text.isEmpty())
        {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        if (!StandardCharsets.US_ASCII.newEncoder().canEncode(text))
        {
            throw new IllegalArgumentException(name + " must be ASCII");
        }
        return text.getBytes(StandardCharsets.US_ASCII);
    }
}
