package domain.numfmt;

/**
 * Calendar components of a serial date. {@code day} may be 0 for the 1900 system's serial 0
 * (rendered as 1900-01-00). {@code dayOfWeek}: 0 = Sunday.
 */
public record SerialDateTime(
        int year,
        int month,
        int day,
        int hour,
        int minute,
        int second,
        int millis,
        int dayOfWeek
) {
}
