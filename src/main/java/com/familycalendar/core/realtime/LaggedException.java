package com.familycalendar.core.realtime;

/**
 * Reported once to a subscriber that fell more than the channel capacity behind. The
 * subscription has already been moved to the head; the next receive returns the first payload
 * published after this report.
 */
public class LaggedException extends Exception {

    private final long skipped;

    public LaggedException(long skipped) {
        super(skipped + " broadcast message(s) skipped");
        this.skipped = skipped;
    }

    public long getSkipped() {
        return skipped;
    }
}
