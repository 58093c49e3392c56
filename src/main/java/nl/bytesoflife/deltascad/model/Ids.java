package nl.bytesoflife.deltascad.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide source of object ids. Ids increase monotonically and are never
 * reused.
 */
public final class Ids {

    private static final AtomicInteger NEXT = new AtomicInteger();

    private Ids() {
    }

    public static int next() {
        return NEXT.getAndIncrement();
    }
}
