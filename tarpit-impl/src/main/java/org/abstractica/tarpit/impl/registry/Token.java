package org.abstractica.tarpit.impl.registry;

/**
 * Handle for one admitted connection in the {@link MetricsRegistry}.
 *
 * <p>A token names a slot of the registry's slot table. It is valid while the
 * slot is occupied and dangles as soon as the connection is disconnected; the
 * slot index may then be handed out again to a later connection.</p>
 *
 * @param index the slot index
 */
public record Token(int index)
{
    public Token
    {
        if (index < 0)
        {
            throw new IllegalArgumentException("Slot index must be >= 0: " + index);
        }
    }
}
