package warden.core.model.behavior;

/**
 * Hours of the day a user is typically active, as an inclusive interval that may
 * wrap past midnight (e.g. 22 to 2).
 *
 * @param startHour first active hour, 0-23
 * @param endHour   last active hour, 0-23
 */
public record ActiveHours(int startHour, int endHour) {

    public static final ActiveHours ALL_DAY = new ActiveHours(0, 23);

    public ActiveHours {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 23) {
            throw new IllegalArgumentException("Hours must be within 0-23: " + startHour + "-" + endHour);
        }
    }

    public static ActiveHours of(int hour) {
        return new ActiveHours(hour, hour);
    }

    /**
     * Number of hours covered, 1-24.
     */
    public int length() {
        return Math.floorMod(endHour - startHour, 24) + 1;
    }

    /**
     * Whether an hour falls inside the interval widened by a tolerance on both sides.
     *
     * @param hour      hour of day
     * @param tolerance hours of slack
     * @return true if inside
     */
    public boolean contains(int hour, int tolerance) {
        if (length() + 2 * tolerance >= 24) {
            return true;
        }
        final var offset = Math.floorMod(hour - (startHour - tolerance), 24);
        return offset < length() + 2 * tolerance;
    }

    /**
     * Smallest interval containing this one and the given hour.
     *
     * @param hour hour of day
     * @return the widened interval
     */
    public ActiveHours extendTo(int hour) {
        if (contains(hour, 0)) {
            return this;
        }
        final var backward = new ActiveHours(hour, endHour);
        final var forward = new ActiveHours(startHour, hour);
        final var widened = backward.length() < forward.length() ? backward : forward;
        return widened.length() >= 24 ? ALL_DAY : widened;
    }
}
