package bbt.tao.reclaim.time;

import bbt.tao.reclaim.exception.InvalidInputException;

public record TimeInput(Integer days, String text) {

    public static TimeInput ofDays(int days) {
        return new TimeInput(days, null);
    }

    public static TimeInput ofText(String text) {
        return new TimeInput(null, text);
    }

    /**
     * Combines the two channels of a single field. Returns {@code null} when neither is set.
     */
    public static TimeInput of(String fieldName, String text, Integer days) {
        boolean hasText = text != null && !text.isBlank();
        if (hasText && days != null) {
            throw new InvalidInputException("Provide either " + fieldName + " or " + fieldName + "InDays, not both.");
        }
        if (hasText) {
            return ofText(text);
        }
        if (days != null) {
            return ofDays(days);
        }
        return null;
    }

    public boolean isRelativeDays() {
        return days != null;
    }

    @Override
    public String toString() {
        return isRelativeDays() ? days + " day(s)" : "\"" + text + "\"";
    }
}
