package bbt.tao.reclaim.normalize;

import bbt.tao.reclaim.time.TimeInput;
import lombok.Builder;

/**
 * Task fields exactly as a caller supplied them. Minute based fields override their chunk counterparts.
 */
@Builder(toBuilder = true)
public record RawTaskFields(
        String title,
        String notes,
        String eventCategory,
        String eventSubType,
        String priority,
        Integer timeChunksRequired,
        Integer durationMinutes,
        Integer minChunkSize,
        Integer minDurationMinutes,
        Integer maxChunkSize,
        Integer maxDurationMinutes,
        Boolean lockChunkSizeToDuration,
        Boolean onDeck,
        Boolean alwaysPrivate,
        String timeSchemeId,
        String status,
        TimeInput deadline,
        TimeInput snoozeUntil,
        TimeInput startTime,
        String eventColor
) {
}
