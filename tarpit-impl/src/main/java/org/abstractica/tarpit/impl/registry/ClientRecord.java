package org.abstractica.tarpit.impl.registry;

import org.abstractica.tarpit.ClientEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * Mutable statistics of one live connection.
 *
 * <p>Not thread-safe. Instances live in the {@link SlotTable} and are only
 * touched while the registry's table lock is held.</p>
 */
class ClientRecord
{
    private final Instant start;
    private long sentChunks;
    private long sentEastereggs;
    private long sentBanners;

    ClientRecord(Instant start)
    {
        this.start = Objects.requireNonNull(start, "start");
    }

    Instant getStart()
    {
        return start;
    }

    long getSentChunks()
    {
        return sentChunks;
    }

    long getSentEastereggs()
    {
        return sentEastereggs;
    }

    long getSentBanners()
    {
        return sentBanners;
    }

    void record(ClientEvent event)
    {
        switch (event)
        {
            case CHUNK_SENT -> sentChunks++;
            case EASTEREGG_SENT -> sentEastereggs++;
            case BANNER_SENT -> sentBanners++;
        }
    }
}
