package bbt.tao.reclaim.time;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;

public record CalendarFields(
        int year,
        int month,
        int day,
        int hour,
        int minute,
        int second,
        int millisecond
) {

    public static CalendarFields of(LocalDateTime dateTime) {
        return new CalendarFields(
                dateTime.getYear(),
                dateTime.getMonthValue(),
                dateTime.getDayOfMonth(),
                dateTime.getHour(),
                dateTime.getMinute(),
                dateTime.getSecond(),
                dateTime.get(ChronoField.MILLI_OF_SECOND)
        );
    }

    public LocalDateTime toLocalDateTime() {
        return LocalDateTime.of(year, month, day, hour, minute, second, millisecond * 1_000_000);
    }

    /**
     * Epoch milliseconds obtained by reading these components as if they were UTC.
     * Only meaningful for comparing wall-clock values with each other.
     */
    public long toNaiveEpochMillis() {
        return toLocalDateTime().toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
