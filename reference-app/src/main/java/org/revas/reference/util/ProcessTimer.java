package org.revas.reference.util;

/**
 * Tracks elapsed time of a long running process and signals when a reporting interval has passed.
 */
public class ProcessTimer {

    public static final long DEFAULT_INTERVAL = 5000;

    private final long interval;
    private final long start;
    private long lastIntervalStart;

    public ProcessTimer() {
        this(DEFAULT_INTERVAL);
    }

    public ProcessTimer(final long interval) {
        this.interval = interval;
        this.start = System.currentTimeMillis();
        this.lastIntervalStart = this.start;
    }

    public boolean hasIntervalPassed() {
        final long now = System.currentTimeMillis();
        final boolean hasPassed = ((now - lastIntervalStart) > interval);
        if (hasPassed) {
            lastIntervalStart = now;
        }
        return hasPassed;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    /**
     * @return number of items completed per second since the timer was started.
     */
    public double getRate(final long completedCount) {
        final long elapsed = Math.max(1, getElapsedMilliseconds());
        return (completedCount * 1000.0) / elapsed;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
