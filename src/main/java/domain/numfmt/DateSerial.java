package domain.numfmt;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Serial number to calendar conversion for both workbook date systems.
 *
 * <p>1900 system: day 1 is 1900-01-01 and day 60 is the non-existent 1900-02-29, kept for
 * compatibility with Lotus 1-2-3; serials after 60 are therefore one day ahead of a true
 * day count from 1899-12-31. 1904 system: day 0 is 1904-01-01, no leap bug.</p>
 */
public final class DateSerial {

    /** 9999-12-31 in the 1900 system. */
    public static final double MAX_SERIAL_1900 = 2_958_465.0;
    /** 9999-12-31 in the 1904 system. */
    public static final double MAX_SERIAL_1904 = 2_957_003.0;

    private static final LocalDate BASE_1900_EARLY = LocalDate.of(1899, 12, 31);
    private static final LocalDate BASE_1900 = LocalDate.of(1899, 12, 30);
    private static final LocalDate BASE_1904 = LocalDate.of(1904, 1, 1);

    private DateSerial() {
    }

    /**
     * @param keepMillis round to the millisecond instead of the second
     * @return components, or null for negative / NaN / past-9999 serials
     */
    public static SerialDateTime toDateTime(double serial, boolean date1904, boolean keepMillis) {
        if (Double.isNaN(serial) || Double.isInfinite(serial) || serial < 0) return null;
        if (serial >= (date1904 ? MAX_SERIAL_1904 : MAX_SERIAL_1900) + 1) return null;

        long days = (long) Math.floor(serial);
        double frac = serial - days;

        long totalMillis = keepMillis
                ? Math.round(frac * 86_400_000.0)
                : Math.round(frac * 86_400.0) * 1000L;
        if (totalMillis >= 86_400_000L) {
            days += 1;
            totalMillis -= 86_400_000L;
        }

        int hour = (int) (totalMillis / 3_600_000L);
        int minute = (int) ((totalMillis / 60_000L) % 60);
        int second = (int) ((totalMillis / 1000L) % 60);
        int millis = (int) (totalMillis % 1000L);

        if (date1904) {
            LocalDate d = BASE_1904.plusDays(days);
            return new SerialDateTime(d.getYear(), d.getMonthValue(), d.getDayOfMonth(),
                    hour, minute, second, millis, d.getDayOfWeek().getValue() % 7);
        }

        int dow = (int) ((days + 6) % 7);
        if (days == 0) {
            return new SerialDateTime(1900, 1, 0, hour, minute, second, millis, dow);
        }
        if (days == 60) {
            return new SerialDateTime(1900, 2, 29, hour, minute, second, millis, dow);
        }
        LocalDate d = days < 60 ? BASE_1900_EARLY.plusDays(days) : BASE_1900.plusDays(days);
        return new SerialDateTime(d.getYear(), d.getMonthValue(), d.getDayOfMonth(),
                hour, minute, second, millis, dow);
    }

    /**
     * Inverse of {@link #toDateTime} for whole dates.
     */
    public static double toSerial(LocalDate date, boolean date1904) {
        if (date1904) {
            return ChronoUnit.DAYS.between(BASE_1904, date);
        }
        long n = ChronoUnit.DAYS.between(BASE_1900, date);
        // dates before 1900-03-01 sit before the phantom leap day
        return n <= 60 ? n - 1 : n;
    }
}
