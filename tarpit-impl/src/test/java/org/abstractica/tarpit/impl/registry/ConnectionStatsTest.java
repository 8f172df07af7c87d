package org.abstractica.tarpit.impl.registry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ConnectionStats}.
 */
class ConnectionStatsTest
{
    @Test
    void bucketFor_zero_isBucketZero()
    {
        assertEquals(0, ConnectionStats.bucketFor(0));
    }

    @Test
    void bucketFor_matchesUpperBounds()
    {
        assertEquals(1, ConnectionStats.bucketFor(1));
        assertEquals(2, ConnectionStats.bucketFor(2));
        assertEquals(2, ConnectionStats.bucketFor(3));
        assertEquals(3, ConnectionStats.bucketFor(4));
        assertEquals(3, ConnectionStats.bucketFor(7));
        assertEquals(10, ConnectionStats.bucketFor(1000));
        assertEquals(10, ConnectionStats.bucketFor(1023));
        assertEquals(11, ConnectionStats.bucketFor(1024));

        // Every duration is at most its bucket's upper bound and above the previous one
        for (long seconds = 1; seconds < 5000; seconds++)
        {
            int bucket = ConnectionStats.bucketFor(seconds);
            assertTrue(seconds <= ConnectionStats.upperBound(bucket));
            assertTrue(seconds > ConnectionStats.upperBound(bucket - 1));
        }
    }

    @Test
    void bucketFor_veryLong_lastBucket()
    {
        assertEquals(31, ConnectionStats.bucketFor(2147483647L));
        assertEquals(31, ConnectionStats.bucketFor(2147483648L));
        assertEquals(31, ConnectionStats.bucketFor(Long.MAX_VALUE));
    }

    @Test
    void upperBound_doublesFromZero()
    {
        assertEquals(0, ConnectionStats.upperBound(0));
        assertEquals(1, ConnectionStats.upperBound(1));
        assertEquals(3, ConnectionStats.upperBound(2));
        assertEquals(1023, ConnectionStats.upperBound(10));
        assertEquals(2147483647L, ConnectionStats.upperBound(31));
        assertThrows(IllegalArgumentException.class, () -> ConnectionStats.upperBound(32));
    }

    @Test
    void new_isEmpty()
    {
        ConnectionStats stats = new ConnectionStats();

        assertEquals(0, stats.getMaximumConnectionTime());
        assertEquals(ConnectionStats.NO_MINIMUM, stats.getMinimumConnectionTime());
        assertEquals(0, stats.getCount());
        assertEquals(0, stats.getConnectionTimeSum());
    }

    @Test
    void record_firstSampleSetsMinimum()
    {
        ConnectionStats stats = new ConnectionStats();
        stats.record(42, 0, 0, 0);

        assertEquals(42, stats.getMinimumConnectionTime());
        assertEquals(42, stats.getMaximumConnectionTime());
    }

    @Test
    void record_accumulatesSumsAndHistogram()
    {
        ConnectionStats stats = new ConnectionStats();
        stats.record(0, 1, 0, 1);
        stats.record(1, 2, 1, 2);
        stats.record(3, 3, 0, 3);
        stats.record(1000, 4, 2, 4);

        assertEquals(1, stats.getBucket(0));
        assertEquals(1, stats.getBucket(1));
        assertEquals(1, stats.getBucket(2));
        assertEquals(1, stats.getBucket(10));
        assertEquals(4, stats.getCount());
        assertEquals(1004, stats.getConnectionTimeSum());
        assertEquals(0, stats.getMinimumConnectionTime());
        assertEquals(1000, stats.getMaximumConnectionTime());
        assertEquals(10, stats.getSentChunksSum());
        assertEquals(3, stats.getSentEastereggsSum());
        assertEquals(10, stats.getSentBannersSum());
    }

    @Test
    void merge_combinesWithoutModifyingInputs()
    {
        ConnectionStats a = new ConnectionStats();
        a.record(5, 10, 1, 2);
        ConnectionStats b = new ConnectionStats();
        b.record(100, 20, 0, 4);
        b.record(2, 1, 0, 0);

        ConnectionStats merged = a.merge(b);

        assertEquals(100, merged.getMaximumConnectionTime());
        assertEquals(2, merged.getMinimumConnectionTime());
        assertEquals(107, merged.getConnectionTimeSum());
        assertEquals(31, merged.getSentChunksSum());
        assertEquals(1, merged.getSentEastereggsSum());
        assertEquals(6, merged.getSentBannersSum());
        assertEquals(3, merged.getCount());

        assertEquals(1, a.getCount());
        assertEquals(2, b.getCount());
    }

    @Test
    void merge_withEmpty_keepsMinimum()
    {
        ConnectionStats stats = new ConnectionStats();
        stats.record(7, 0, 0, 0);

        assertEquals(7, stats.merge(new ConnectionStats()).getMinimumConnectionTime());
        assertEquals(7, new ConnectionStats().merge(stats).getMinimumConnectionTime());
        assertEquals(ConnectionStats.NO_MINIMUM,
                new ConnectionStats().merge(new ConnectionStats()).getMinimumConnectionTime());
    }
}
