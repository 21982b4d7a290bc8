// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.object;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.support.ReflectionError;

/**
 * The table of live {@link MetaObject}s, from which each receives its
 * {@link InstanceId}. The reflection layer consults it to decide
 * whether an object reference (in a {@code Variant} or as the receiver
 * of a call) may still be used, independently of how the object itself
 * is managed.
 * <p>
 * Slots vacated by released objects are re-used, with their generation
 * advanced, so a stale id never matches the new occupant.
 * <p>
 * Entries are strong references. An object is removed only when it is
 * released (see {@link MetaObject}), never by garbage collection.
 */
public final class ObjectDB {

    /** Logger for the object database. */
    static final Logger logger = LoggerFactory.getLogger(ObjectDB.class);

    private static final int INITIAL_CAPACITY = 64;

    /** Object occupying each slot, or {@code null} if vacant. */
    private static MetaObject[] objects = new MetaObject[INITIAL_CAPACITY];

    /** Current generation of each slot. */
    private static int[] generations = new int[INITIAL_CAPACITY];

    /** Stack of vacant slots below {@link #used}. */
    private static int[] free = new int[INITIAL_CAPACITY];

    /** Number of entries in {@link #free}. */
    private static int freeCount;

    /** Number of slots ever used (high-water mark). */
    private static int used;

    /** Number of objects currently alive. */
    private static int count;

    /** Lock protecting all the static state. */
    private static final Object LOCK = new Object();

    private ObjectDB() {} // no instances

    /**
     * Enter an object in the database and issue its identity.
     *
     * @param obj to enter
     * @return the identity of {@code obj}
     */
    static InstanceId add(MetaObject obj) {
        synchronized (LOCK) {
            int slot;
            if (freeCount > 0) {
                slot = free[--freeCount];
            } else {
                if (used == objects.length) { grow(); }
                slot = used++;
            }
            objects[slot] = obj;
            count++;
            return new InstanceId(slot, generations[slot]);
        }
    }

    /**
     * Remove an object from the database, invalidating its identity.
     *
     * @param id of the object to remove
     * @throws ReflectionError if {@code id} is not alive
     */
    static void remove(InstanceId id) throws ReflectionError {
        synchronized (LOCK) {
            if (!isAliveLocked(id)) {
                throw new ReflectionError("object %s is not alive", id);
            }
            objects[id.slot] = null;
            generations[id.slot]++;
            free[freeCount++] = id.slot;
            count--;
        }
    }

    /**
     * Test whether the object with the given identity is still alive.
     *
     * @param id identity to test
     * @return {@code true} iff it identifies a live object
     */
    public static boolean isAlive(InstanceId id) {
        synchronized (LOCK) { return isAliveLocked(id); }
    }

    /**
     * Find the live object with the given identity.
     *
     * @param id identity to resolve
     * @return the object or {@code null} if it is not alive
     */
    public static MetaObject get(InstanceId id) {
        synchronized (LOCK) {
            return isAliveLocked(id) ? objects[id.slot] : null;
        }
    }

    /**
     * Return the number of objects currently alive.
     *
     * @return number of live objects
     */
    public static int size() {
        synchronized (LOCK) { return count; }
    }

    private static boolean isAliveLocked(InstanceId id) {
        int slot = id.slot;
        return slot >= 0 && slot < used && objects[slot] != null
                && generations[slot] == id.generation;
    }

    private static void grow() {
        int n = objects.length * 2;
        objects = Arrays.copyOf(objects, n);
        generations = Arrays.copyOf(generations, n);
        free = Arrays.copyOf(free, n);
        logger.atDebug().setMessage("Object table grown to {} slots")
                .addArgument(n).log();
    }
}
