package bbt.tao.reclaim.time;

import java.time.Instant;

public interface TimeExpression {

    /** N x 24h from the instant of evaluation. */
    record RelativeDays(int days) implements TimeExpression {
    }

    /** Calendar components that still need a timezone to become an instant. */
    record LocalDateTimeExpression(CalendarFields fields) implements TimeExpression {
    }

    /** Already unambiguous: the input carried an offset or a zone. */
    record AbsoluteDateTime(Instant instant) implements TimeExpression {
    }
}
