package org.abstractica.tarpit.impl.registry;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SlotTable}.
 */
class SlotTableTest
{
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void insert_emptyTable_appends()
    {
        SlotTable table = new SlotTable();

        assertEquals(0, table.insert(new ClientRecord(START)));
        assertEquals(1, table.insert(new ClientRecord(START)));
        assertEquals(2, table.size());
        assertEquals(2, table.occupiedCount());
    }

    @Test
    void insert_reusesLowestFreeSlot()
    {
        SlotTable table = new SlotTable();
        for (int i = 0; i < 4; i++)
        {
            table.insert(new ClientRecord(START));
        }

        // Free 2 first, then 0: the next insert still takes 0
        table.remove(2);
        table.remove(0);

        assertEquals(0, table.insert(new ClientRecord(START)));
        assertEquals(2, table.insert(new ClientRecord(START)));
        assertEquals(4, table.insert(new ClientRecord(START)));
        assertEquals(5, table.size());
    }

    @Test
    void remove_neverShrinks()
    {
        SlotTable table = new SlotTable();
        table.insert(new ClientRecord(START));
        table.insert(new ClientRecord(START));

        table.remove(1);
        table.remove(0);

        assertEquals(2, table.size());
        assertEquals(0, table.occupiedCount());
        assertTrue(table.isAllocated(1));
        assertNull(table.get(1));
    }

    @Test
    void isAllocated_outOfRange_false()
    {
        SlotTable table = new SlotTable();
        table.insert(new ClientRecord(START));

        assertTrue(table.isAllocated(0));
        assertFalse(table.isAllocated(1));
        assertFalse(table.isAllocated(-1));
    }

    @Test
    void forEachOccupied_skipsHoles()
    {
        SlotTable table = new SlotTable();
        ClientRecord first = new ClientRecord(START);
        ClientRecord second = new ClientRecord(START);
        ClientRecord third = new ClientRecord(START);
        table.insert(first);
        table.insert(second);
        table.insert(third);
        table.remove(1);

        List<ClientRecord> visited = new ArrayList<>();
        table.forEachOccupied(visited::add);

        assertEquals(List.of(first, third), visited);
    }
}
