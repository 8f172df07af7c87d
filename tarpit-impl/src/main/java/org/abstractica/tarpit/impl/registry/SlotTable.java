package org.abstractica.tarpit.impl.registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.Consumer;

/**
 * Growable table of client records addressed by small integer slots.
 *
 * <p>Freed slots are reused lowest index first, so the table stays as long as
 * the highest number of concurrent connections seen so far. The table never
 * shrinks.</p>
 *
 * <p>Not thread-safe; the owning registry serializes all access.</p>
 */
class SlotTable
{
    private final List<ClientRecord> slots = new ArrayList<>();
    private final BitSet occupied = new BitSet();

    /**
     * Stores a record in the first free slot, appending if there is none.
     *
     * @param record the record to store
     * @return the slot index
     */
    int insert(ClientRecord record)
    {
        int index = occupied.nextClearBit(0);
        if (index == slots.size())
        {
            slots.add(record);
        }
        else
        {
            slots.set(index, record);
        }
        occupied.set(index);
        return index;
    }

    /**
     * Returns whether the index was ever handed out.
     */
    boolean isAllocated(int index)
    {
        return index >= 0 && index < slots.size();
    }

    /**
     * Returns the record in a slot.
     *
     * @param index an allocated slot index
     * @return the record, or null if the slot is empty
     */
    ClientRecord get(int index)
    {
        return slots.get(index);
    }

    /**
     * Empties a slot.
     *
     * @param index an allocated slot index
     * @return the removed record, or null if the slot was already empty
     */
    ClientRecord remove(int index)
    {
        ClientRecord removed = slots.set(index, null);
        occupied.clear(index);
        return removed;
    }

    /**
     * Returns the table length, occupied or not.
     */
    int size()
    {
        return slots.size();
    }

    /**
     * Returns the number of occupied slots.
     */
    int occupiedCount()
    {
        return occupied.cardinality();
    }

    void forEachOccupied(Consumer<ClientRecord> action)
    {
        for (int i = occupied.nextSetBit(0); i >= 0; i = occupied.nextSetBit(i + 1))
        {
            action.accept(slots.get(i));
        }
    }
}
