package org.abstractica.tarpit.impl.registry;

import java.util.Arrays;

/**
 * Running totals over a population of connections.
 *
 * <p>Tracks the longest and shortest connection, a histogram of connection
 * times, and sums of connection time and of the per-client event counters.
 * Connection times are whole seconds.</p>
 *
 * <p>The histogram has {@value #BUCKET_COUNT} buckets. Bucket {@code i > 0}
 * counts durations in {@code [2^(i-1), 2^i - 1]} seconds, bucket 0 counts
 * zero-second connections, and the last bucket also takes everything longer.
 * Each bucket counts only its own range.</p>
 *
 * <p>Not thread-safe. The registry guards each instance with a lock.</p>
 */
public class ConnectionStats
{
    /**
     * Number of histogram buckets.
     */
    public static final int BUCKET_COUNT = 32;

    /**
     * Minimum of an empty population. Any sample replaces it.
     */
    public static final long NO_MINIMUM = Long.MAX_VALUE;

    private long maximumConnectionTime;
    private long minimumConnectionTime = NO_MINIMUM;
    private final long[] connectionTimeBuckets = new long[BUCKET_COUNT];
    private long connectionTimeSum;
    private long sentChunksSum;
    private long sentEastereggsSum;
    private long sentBannersSum;

    /**
     * Creates an empty population.
     */
    public ConnectionStats()
    {
    }

    private ConnectionStats(ConnectionStats other)
    {
        this.maximumConnectionTime = other.maximumConnectionTime;
        this.minimumConnectionTime = other.minimumConnectionTime;
        System.arraycopy(other.connectionTimeBuckets, 0, this.connectionTimeBuckets, 0, BUCKET_COUNT);
        this.connectionTimeSum = other.connectionTimeSum;
        this.sentChunksSum = other.sentChunksSum;
        this.sentEastereggsSum = other.sentEastereggsSum;
        this.sentBannersSum = other.sentBannersSum;
    }

    /**
     * Returns the histogram bucket for a connection time.
     *
     * <p>The bucket is the bit length of the duration. Zero has no set bit and
     * is mapped to bucket 0 explicitly.</p>
     *
     * @param seconds connection time in whole seconds
     * @return bucket index in {@code [0, BUCKET_COUNT)}
     */
    public static int bucketFor(long seconds)
    {
        if (seconds <= 0)
        {
            return 0;
        }
        int bitLength = Long.SIZE - Long.numberOfLeadingZeros(seconds);
        return Math.min(bitLength, BUCKET_COUNT - 1);
    }

    /**
     * Returns the inclusive upper bound of a bucket in seconds.
     *
     * @param bucket bucket index
     * @return {@code 2^bucket - 1}
     */
    public static long upperBound(int bucket)
    {
        if (bucket < 0 || bucket >= BUCKET_COUNT)
        {
            throw new IllegalArgumentException("Bucket must be 0-" + (BUCKET_COUNT - 1) + ": " + bucket);
        }
        return (1L << bucket) - 1;
    }

    // ========== Accumulation ==========

    /**
     * Adds one connection to the population.
     *
     * @param connectionTime connection time in whole seconds
     * @param sentChunks     chunks sent to the connection
     * @param sentEastereggs easter eggs sent to the connection
     * @param sentBanners    full banners sent to the connection
     */
    public void record(long connectionTime, long sentChunks, long sentEastereggs, long sentBanners)
    {
        maximumConnectionTime = Math.max(maximumConnectionTime, connectionTime);
        minimumConnectionTime = Math.min(minimumConnectionTime, connectionTime);
        connectionTimeBuckets[bucketFor(connectionTime)]++;
        connectionTimeSum += connectionTime;
        sentChunksSum += sentChunks;
        sentEastereggsSum += sentEastereggs;
        sentBannersSum += sentBanners;
    }

    /**
     * Returns a new population holding both this one and another.
     *
     * @param other the population to combine with
     * @return the combined population; neither input is modified
     */
    public ConnectionStats merge(ConnectionStats other)
    {
        ConnectionStats merged = new ConnectionStats(this);
        merged.maximumConnectionTime = Math.max(maximumConnectionTime, other.maximumConnectionTime);
        merged.minimumConnectionTime = Math.min(minimumConnectionTime, other.minimumConnectionTime);
        for (int i = 0; i < BUCKET_COUNT; i++)
        {
            merged.connectionTimeBuckets[i] += other.connectionTimeBuckets[i];
        }
        merged.connectionTimeSum += other.connectionTimeSum;
        merged.sentChunksSum += other.sentChunksSum;
        merged.sentEastereggsSum += other.sentEastereggsSum;
        merged.sentBannersSum += other.sentBannersSum;
        return merged;
    }

    /**
     * Returns an independent copy.
     */
    public ConnectionStats copy()
    {
        return new ConnectionStats(this);
    }

    // ========== Accessors ==========

    public long getMaximumConnectionTime()
    {
        return maximumConnectionTime;
    }

    /**
     * Returns the shortest connection time, or {@link #NO_MINIMUM} if empty.
     */
    public long getMinimumConnectionTime()
    {
        return minimumConnectionTime;
    }

    /**
     * Returns the count of one histogram bucket.
     *
     * @param bucket bucket index
     * @return connections whose time falls in the bucket
     */
    public long getBucket(int bucket)
    {
        return connectionTimeBuckets[bucket];
    }

    /**
     * Returns the number of connections recorded.
     */
    public long getCount()
    {
        return Arrays.stream(connectionTimeBuckets).sum();
    }

    public long getConnectionTimeSum()
    {
        return connectionTimeSum;
    }

    public long getSentChunksSum()
    {
        return sentChunksSum;
    }

    public long getSentEastereggsSum()
    {
        return sentEastereggsSum;
    }

    public long getSentBannersSum()
    {
        return sentBannersSum;
    }
}
