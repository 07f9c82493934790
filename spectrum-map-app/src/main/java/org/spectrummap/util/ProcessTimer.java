package org.spectrummap.util;

/**
 * Tracks elapsed time of a run and paces progress log statements.
 */
public class ProcessTimer {

    public static final long DEFAULT_INTERVAL = 5000;

    private final long interval;
    private final long start;
    private long lastIntervalStart;

    public ProcessTimer() {
        this(DEFAULT_INTERVAL);
    }

    /**
     * @param  interval  number of milliseconds between progress reports.
     */
    public ProcessTimer(final long interval) {
        this.interval = interval;
        this.start = System.currentTimeMillis();
        this.lastIntervalStart = this.start;
    }

    /**
     * @return true (and restarts the interval) if more than one interval has passed since the last restart.
     */
    public boolean hasIntervalPassed() {
        final long now = System.currentTimeMillis();
        final boolean hasPassed = (now - lastIntervalStart) > interval;
        if (hasPassed) {
            lastIntervalStart = now;
        }
        return hasPassed;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long elapsed = getElapsedMilliseconds();
        final long totalSeconds = elapsed / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        final long milliseconds = elapsed % 1000;
        return minutes + " minutes, " + seconds + "." + String.format("%03d", milliseconds) + " seconds";
    }
}
