package bbt.tao.reclaim.dto.reclaim;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task as returned by the Reclaim API.
 * <p>
 * {@code COMPLETE} means the scheduled time allocation ran out, not that the user finished the task;
 * finished tasks are {@code ARCHIVED} or {@code CANCELLED}. Fields the API adds later are kept in
 * {@link #getAdditionalProperties()} so nothing is lost when the task is echoed back.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReclaimTask {
    private Long id;
    private String title;
    private String notes;
    private String eventCategory;
    private String eventSubType;
    private String priority;
    private Integer timeChunksRequired;
    private Integer timeChunksSpent;
    private Integer timeChunksRemaining;
    private Integer minChunkSize;
    private Integer maxChunkSize;
    private String status;
    private String due;
    private String snoozeUntil;
    private String eventColor;
    private Boolean deleted;
    private Boolean onDeck;
    private Boolean atRisk;
    private Boolean alwaysPrivate;
    private String timeSchemeId;
    private String created;
    private String updated;
    private String finished;

    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, Object value) {
        additionalProperties.put(name, value);
    }

    /**
     * Not deleted and neither {@code ARCHIVED} nor {@code CANCELLED}. {@code COMPLETE} tasks stay active.
     */
    @JsonIgnore
    public boolean isActive() {
        return !Boolean.TRUE.equals(deleted)
                && !"ARCHIVED".equals(status)
                && !"CANCELLED".equals(status);
    }
}
