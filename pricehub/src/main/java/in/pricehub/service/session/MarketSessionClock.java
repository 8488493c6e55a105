package in.pricehub.service.session;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Market Session Clock - US equities regular session boundaries.
 *
 * NYSE/Nasdaq Regular Session: 09:30 AM - 04:00 PM America/New_York, Monday to Friday.
 * Exchange holidays are not modelled. Used for status reporting only; streaming runs regardless.
 */
public final class MarketSessionClock {
    public static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static final LocalTime SESSION_START = LocalTime.of(9, 30);
    private static final LocalTime SESSION_END = LocalTime.of(16, 0);

    private final Clock clock;

    public MarketSessionClock() {
        this(Clock.systemUTC());
    }

    public MarketSessionClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Session start for a given date (09:30 New York).
     */
    public static Instant getSessionStart(LocalDate date) {
        return ZonedDateTime.of(date, SESSION_START, NEW_YORK).toInstant();
    }

    /**
     * Session end for a given date (16:00 New York).
     */
    public static Instant getSessionEnd(LocalDate date) {
        return ZonedDateTime.of(date, SESSION_END, NEW_YORK).toInstant();
    }

    /**
     * Check if the given instant falls inside a weekday regular session. Both boundaries are inclusive.
     */
    public static boolean isWithinSession(Instant timestamp) {
        ZonedDateTime local = timestamp.atZone(NEW_YORK);
        DayOfWeek day = local.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        LocalDate date = local.toLocalDate();
        return !timestamp.isBefore(getSessionStart(date)) && !timestamp.isAfter(getSessionEnd(date));
    }

    /**
     * Check if the market is open now.
     */
    public boolean isMarketOpen() {
        return isWithinSession(clock.instant());
    }

    /**
     * Format timestamp in New York time for logging.
     */
    public static String formatNewYork(Instant timestamp) {
        return timestamp.atZone(NEW_YORK).toString();
    }
}
