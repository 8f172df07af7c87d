package org.abstractica.tarpit.impl.session;

import org.abstractica.tarpit.Tarpit;
import org.abstractica.tarpit.TarpitFactory;
import org.abstractica.tarpit.impl.registry.MetricsRegistry;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of TarpitFactory.
 *
 * <p>Creates DefaultTarpit instances using a builder pattern.</p>
 */
public class DefaultTarpitFactory implements TarpitFactory
{
    /**
     * Listen address used when none is configured.
     */
    public static final InetSocketAddress DEFAULT_LISTEN_ADDRESS = new InetSocketAddress("0.0.0.0", 2222);

    /**
     * Delay used when none is configured.
     */
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(10);

    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private InetSocketAddress listenAddress = DEFAULT_LISTEN_ADDRESS;
        private int maxClients = 0; // 0 = unlimited
        private Duration delay = DEFAULT_DELAY;
        private String banner = Payload.DEFAULT_BANNER;
        private int chunkSize = 0; // 0 = whole banner
        private String easteregg = Payload.DEFAULT_EASTEREGG;
        private int eastereggInterval = 0; // 0 = never
        private int ioThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
        private Clock clock = Clock.systemUTC();

        @Override
        public DefaultBuilder listenAddress(InetSocketAddress address)
        {
            this.listenAddress = Objects.requireNonNull(address, "address");
            return this;
        }

        @Override
        public DefaultBuilder maxClients(int maxClients)
        {
            if (maxClients < 0)
            {
                throw new IllegalArgumentException("maxClients must be >= 0: " + maxClients);
            }
            this.maxClients = maxClients;
            return this;
        }

        @Override
        public DefaultBuilder delay(Duration delay)
        {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative() || delay.isZero())
            {
                throw new IllegalArgumentException("Delay must be positive");
            }
            this.delay = delay;
            return this;
        }

        @Override
        public DefaultBuilder banner(String banner)
        {
            this.banner = Objects.requireNonNull(banner, "banner");
            return this;
        }

        @Override
        public DefaultBuilder chunkSize(int chunkSize)
        {
            if (chunkSize < 0)
            {
                throw new IllegalArgumentException("chunkSize must be >= 0: " + chunkSize);
            }
            this.chunkSize = chunkSize;
            return this;
        }

        @Override
        public DefaultBuilder easteregg(String easteregg)
        {
            this.easteregg = Objects.requireNonNull(easteregg, "easteregg");
            return this;
        }

        @Override
        public DefaultBuilder eastereggInterval(int interval)
        {
            if (interval < 0)
            {
                throw new IllegalArgumentException("eastereggInterval must be >= 0: " + interval);
            }
            this.eastereggInterval = interval;
            return this;
        }

        /**
         * Sets the number of threads completing socket I/O.
         *
         * <p>Defaults to the number of available processors.</p>
         *
         * @param ioThreads thread count
         * @return this builder
         */
        public DefaultBuilder ioThreads(int ioThreads)
        {
            if (ioThreads <= 0)
            {
                throw new IllegalArgumentException("ioThreads must be positive: " + ioThreads);
            }
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Sets the clock for connection times, for testing purposes.
         *
         * @param clock the clock to use
         * @return this builder
         */
        public DefaultBuilder clock(Clock clock)
        {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        @Override
        public DefaultTarpit build()
        {
            // Fails fast on a non-ASCII or empty banner
            Payload payload = new Payload(banner, chunkSize, easteregg, eastereggInterval);

            return new DefaultTarpit(
                    listenAddress,
                    maxClients,
                    delay,
                    payload,
                    ioThreads,
                    new MetricsRegistry(clock)
            );
        }
    }
}
