package org.abstractica.tarpit;

/**
 * Per-connection events counted by the tarpit.
 */
public enum ClientEvent
{
    /**
     * One chunk of the banner was written.
     */
    CHUNK_SENT,

    /**
     * An easter egg line was written in place of a banner chunk.
     */
    EASTEREGG_SENT,

    /**
     * The last chunk of a banner was written, completing one full banner.
     */
    BANNER_SENT
}
