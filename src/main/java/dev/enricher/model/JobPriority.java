package dev.enricher.model;

/**
 * Queue priorities. Lower value dequeues first.
 */
public final class JobPriority {

    public static final int CRITICAL = 1;
    public static final int HIGH = 3;
    public static final int NORMAL = 5;
    public static final int LOW = 8;

    public static final int MIN = 1;
    public static final int MAX = 10;

    private JobPriority() {
    }
}
