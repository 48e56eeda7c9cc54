package bbt.tao.reclaim.dto.reclaim;

import bbt.tao.reclaim.time.ResolvedInstant;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized task payload as sent to {@code POST /tasks} and {@code PATCH /tasks/{id}}.
 * Unset fields are omitted so a PATCH only touches what the caller supplied.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskInputData {
    private String title;
    private String notes;
    private String eventCategory;
    private String eventSubType;
    private String priority;
    private Integer timeChunksRequired; // 1 chunk = 15 minutes
    private Integer minChunkSize;
    private Integer maxChunkSize;
    private Boolean onDeck;
    private Boolean alwaysPrivate;
    private String timeSchemeId;
    private String status;
    private ResolvedInstant due;
    private ResolvedInstant snoozeUntil;
    private String eventColor;

    @JsonIgnore
    public boolean hasNoFields() {
        return title == null && notes == null && eventCategory == null && eventSubType == null
                && priority == null && timeChunksRequired == null && minChunkSize == null
                && maxChunkSize == null && onDeck == null && alwaysPrivate == null
                && timeSchemeId == null && status == null && due == null && snoozeUntil == null
                && eventColor == null;
    }
}
