package org.abstractica.tarpit;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Factory for creating Tarpit instances.
 *
 * <p>Use the builder to configure the tarpit before creation:</p>
 * <pre>{@code
 * TarpitFactory factory = new DefaultTarpitFactory();
 * Tarpit tarpit = factory.builder()
 *     .listenAddress(new InetSocketAddress(2222))
 *     .delay(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public interface TarpitFactory
{
    /**
     * Creates a new tarpit builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Tarpit.
     */
    interface Builder
    {
        /**
         * Sets the address to listen on.
         *
         * <p>Optional. Defaults to {@code 0.0.0.0:2222}.</p>
         *
         * @param address the listen address
         * @return this builder
         */
        Builder listenAddress(InetSocketAddress address);

        /**
         * Sets the best-effort maximum number of concurrent connections.
         *
         * <p>Optional. Defaults to unlimited (0).</p>
         *
         * @param maxClients maximum connections, or 0 for unlimited
         * @return this builder
         */
        Builder maxClients(int maxClients);

        /**
         * Sets the delay between two writes to the same client.
         *
         * <p>Optional. Defaults to 10 seconds.</p>
         *
         * @param delay the delay
         * @return this builder
         */
        Builder delay(Duration delay);

        /**
         * Sets the banner dribbled to every client.
         *
         * <p>Optional. Must be non-empty ASCII.</p>
         *
         * @param banner the banner text
         * @return this builder
         */
        Builder banner(String banner);

        /**
         * Sets how many bytes of the banner are written per tick.
         *
         * <p>Optional. Defaults to the whole banner (0).</p>
         *
         * @param chunkSize bytes per tick, or 0 for the whole banner
         * @return this builder
         */
        Builder chunkSize(int chunkSize);

        /**
         * Sets the easter egg line sent in place of a banner.
         *
         * <p>Optional. Must be non-empty ASCII.</p>
         *
         * @param easteregg the easter egg text
         * @return this builder
         */
        Builder easteregg(String easteregg);

        /**
         * Sets after how many full banners the easter egg is sent.
         *
         * <p>Optional. Defaults to 0, which never sends it.</p>
         *
         * @param interval banners between easter eggs, or 0 to disable
         * @return this builder
         */
        Builder eastereggInterval(int interval);

        /**
         * Builds the tarpit.
         *
         * @return the configured tarpit, not yet started
         */
        Tarpit build();
    }
}
