// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.object;

/**
 * A stable handle identifying one object instance for the whole of its
 * life, and never any other instance afterwards. It consists of a slot
 * number in the {@link ObjectDB} and the generation of that slot at the
 * time the object was added. When the object is released the slot
 * generation advances, so every {@code InstanceId} issued for the old
 * occupant becomes stale, even when the slot is re-used.
 * <p>
 * An {@code InstanceId} does not keep its object alive, and holding one
 * confers no ownership.
 */
public final class InstanceId {

    /** The id of no object at all. It is never valid. */
    public static final InstanceId NONE = new InstanceId(-1, 0);

    /** Index of the slot in the object database. */
    final int slot;

    /** Generation of the slot when this id was issued. */
    final int generation;

    InstanceId(int slot, int generation) {
        this.slot = slot;
        this.generation = generation;
    }

    /**
     * Test whether the object identified is still registered with the
     * {@link ObjectDB}, that is, has not been released.
     *
     * @return {@code true} iff the object is alive
     */
    public boolean isValid() { return ObjectDB.isAlive(this); }

    /**
     * The slot and generation packed into a single {@code long}, for
     * use as a compact key.
     *
     * @return packed value of this id
     */
    public long asLong() {
        return ((long)generation << 32) | (slot & 0xFFFF_FFFFL);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof InstanceId) {
            InstanceId o = (InstanceId)obj;
            return o.slot == slot && o.generation == generation;
        }
        return false;
    }

    @Override
    public int hashCode() { return Long.hashCode(asLong()); }

    @Override
    public String toString() {
        return String.format("#%d.%d", slot, generation);
    }
}
