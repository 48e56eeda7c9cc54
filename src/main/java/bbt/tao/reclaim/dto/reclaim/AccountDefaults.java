package bbt.tao.reclaim.dto.reclaim;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountDefaults(
        @JsonProperty("category") @JsonAlias("eventCategory") String eventCategory,
        @JsonProperty("eventSubType") String eventSubType,
        @JsonProperty("priority") String priority,
        @JsonProperty("timeChunksRequired") Integer timeChunksRequired,
        @JsonProperty("minChunkSize") Integer minChunkSize,
        @JsonProperty("maxChunkSize") Integer maxChunkSize,
        @JsonProperty("dueInDays") @JsonAlias("defaultDueDays") Integer dueInDays,
        @JsonProperty("onDeck") Boolean onDeck,
        @JsonProperty("alwaysPrivate") Boolean alwaysPrivate,
        @JsonProperty("timeSchemeId") @JsonAlias("timeSchemeID") String timeSchemeId
) {
    public static final AccountDefaults NONE = new AccountDefaults(null, null, null, null, null, null, null, null, null, null);
}
