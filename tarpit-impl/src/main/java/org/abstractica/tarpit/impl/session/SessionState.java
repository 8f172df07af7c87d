package org.abstractica.tarpit.impl.session;

/**
 * State of a tarpit session.
 */
public enum SessionState
{
    /**
     * Created but not yet started.
     */
    NEW,

    /**
     * Sleeping until the next write is due.
     */
    WAITING,

    /**
     * A chunk is being written to the peer.
     */
    WRITING,

    /**
     * The chunk is written and being pushed out.
     */
    FLUSHING,

    /**
     * The connection failed and the session has been disconnected.
     */
    TERMINATED
}
