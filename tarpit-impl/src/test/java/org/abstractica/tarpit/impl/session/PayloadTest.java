package org.abstractica.tarpit.impl.session;

import org.abstractica.tarpit.ClientEvent;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Payload}.
 */
class PayloadTest
{
    private static String text(ByteBuffer buffer)
    {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return new String(bytes, StandardCharsets.US_ASCII);
    }

    @Test
    void next_defaultPayload_wholeBannerEachTick()
    {
        Payload payload = Payload.defaultPayload();

        for (int i = 0; i < 3; i++)
        {
            Payload.Chunk chunk = payload.next();
            assertEquals(Payload.DEFAULT_BANNER, text(chunk.data()));
            assertEquals(List.of(ClientEvent.CHUNK_SENT, ClientEvent.BANNER_SENT), chunk.events());
        }
    }

    @Test
    void next_chunked_bannerEventOnLastChunk()
    {
        Payload payload = new Payload("abcdefg", 3, "egg", 0);

        Payload.Chunk first = payload.next();
        Payload.Chunk second = payload.next();
        Payload.Chunk third = payload.next();
        Payload.Chunk wrapped = payload.next();

        assertEquals("abc", text(first.data()));
        assertEquals(List.of(ClientEvent.CHUNK_SENT), first.events());
        assertEquals("def", text(second.data()));
        assertEquals(List.of(ClientEvent.CHUNK_SENT), second.events());
        assertEquals("g", text(third.data()));
        assertEquals(List.of(ClientEvent.CHUNK_SENT, ClientEvent.BANNER_SENT), third.events());
        assertEquals("abc", text(wrapped.data()));
    }

    @Test
    void next_chunkLargerThanBanner_clamped()
    {
        Payload payload = new Payload("abc", 100, "egg", 0);

        assertEquals(3, payload.getChunkSize());
        assertEquals("abc", text(payload.next().data()));
    }

    @Test
    void next_eastereggAfterInterval()
    {
        Payload payload = new Payload("b", 0, "egg", 2);

        assertEquals("b", text(payload.next().data()));
        assertEquals("b", text(payload.next().data()));
        Payload.Chunk egg = payload.next();
        assertEquals("egg", text(egg.data()));
        assertEquals(List.of(ClientEvent.EASTEREGG_SENT), egg.events());
        assertEquals("b", text(payload.next().data()));
        assertEquals("b", text(payload.next().data()));
        assertEquals("egg", text(payload.next().data()));
    }

    @Test
    void next_eastereggNeverSplitsBanner()
    {
        Payload payload = new Payload("abcd", 2, "egg", 1);

        assertEquals("ab", text(payload.next().data()));
        assertEquals("cd", text(payload.next().data()));
        assertEquals("egg", text(payload.next().data()));
        assertEquals("ab", text(payload.next().data()));
    }

    @Test
    void next_dataIsReadOnly()
    {
        Payload payload = Payload.defaultPayload();

        assertTrue(payload.next().data().isReadOnly());
    }

    @Test
    void copy_startsFromBeginning()
    {
        Payload payload = new Payload("abcd", 2, "egg", 0);
        payload.next();

        Payload copy = payload.copy();

        assertEquals("ab", text(copy.next().data()));
        assertEquals("cd", text(payload.next().data()));
    }

    @Test
    void new_invalidArguments_rejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new Payload("", 0, "egg", 0));
        assertThrows(IllegalArgumentException.class, () -> new Payload("b", 0, "", 0));
        assertThrows(IllegalArgumentException.class, () -> new Payload("bléep", 0, "egg", 0));
        assertThrows(IllegalArgumentException.class, () -> new Payload("b", -1, "egg", 0));
        assertThrows(IllegalArgumentException.class, () -> new Payload("b", 0, "egg", -1));
        assertThrows(NullPointerException.class, () -> new Payload(null, 0, "egg", 0));
    }
}
