package bbt.tao.reclaim;

import bbt.tao.reclaim.dto.reclaim.AccountDefaults;
import bbt.tao.reclaim.dto.reclaim.TaskInputData;
import bbt.tao.reclaim.exception.ChunkSizeConflictException;
import bbt.tao.reclaim.exception.InvalidInputException;
import bbt.tao.reclaim.normalize.NormalizedTask;
import bbt.tao.reclaim.normalize.RawTaskFields;
import bbt.tao.reclaim.normalize.TaskFieldNormalizer;
import bbt.tao.reclaim.normalize.TaskFlow;
import bbt.tao.reclaim.time.LocalTimeResolver;
import bbt.tao.reclaim.time.ResolutionContext;
import bbt.tao.reclaim.time.TimeExpressionParser;
import bbt.tao.reclaim.time.TimeInput;
import bbt.tao.reclaim.time.ZonedTimeConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskFieldNormalizerTest {

    private static final ResolutionContext LOS_ANGELES = ResolutionContext.explicit("America/Los_Angeles");

    private TaskFieldNormalizer normalizer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-10T12:00:00Z"), ZoneOffset.UTC);
        normalizer = new TaskFieldNormalizer(
                new LocalTimeResolver(new TimeExpressionParser(), new ZonedTimeConverter(), clock));
    }

    private TaskInputData create(RawTaskFields raw, AccountDefaults defaults) {
        return normalizer.normalize(raw, defaults, LOS_ANGELES, TaskFlow.CREATE).payload();
    }

    private static RawTaskFields.RawTaskFieldsBuilder titled() {
        return RawTaskFields.builder().title("Write report");
    }

    @Test
    void minuteFieldsBecomeChunks() {
        TaskInputData payload = create(titled()
                .durationMinutes(60)
                .minDurationMinutes(30)
                .maxDurationMinutes(60)
                .build(), null);

        assertThat(payload.getTimeChunksRequired()).isEqualTo(4);
        assertThat(payload.getMinChunkSize()).isEqualTo(2);
        assertThat(payload.getMaxChunkSize()).isEqualTo(4);
    }

    @Test
    void minutesOverrideChunkFields() {
        TaskInputData payload = create(titled().timeChunksRequired(2).durationMinutes(120).build(), null);

        assertThat(payload.getTimeChunksRequired()).isEqualTo(8);
    }

    @Test
    void minutesMustBeMultiplesOfFifteen() {
        assertThatThrownBy(() -> create(titled().durationMinutes(50).build(), null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("durationMinutes must be a multiple of 15 minutes. Example: 60 minutes = 4 chunks.");
    }

    @Test
    void nonPositiveChunkCountsAreRejected() {
        assertThatThrownBy(() -> create(titled().minChunkSize(0).build(), null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("minChunkSize");
    }

    @Test
    void conflictingMinuteBoundsAreRejected() {
        RawTaskFields raw = titled().minDurationMinutes(60).maxDurationMinutes(30).build();

        assertThatThrownBy(() -> create(raw, null))
                .isInstanceOf(ChunkSizeConflictException.class)
                .hasMessage("minChunkSize (4) cannot be greater than maxChunkSize (2).");
    }

    @Test
    void conflictingChunkBoundsAreRepaired() {
        TaskInputData payload = create(titled().minChunkSize(4).maxChunkSize(2).build(), null);

        assertThat(payload.getTimeChunksRequired()).isEqualTo(4);
        assertThat(payload.getMinChunkSize()).isEqualTo(4);
        assertThat(payload.getMaxChunkSize()).isEqualTo(4);
    }

    @Test
    void boundsConflictingAfterAccountDefaultsAreRepaired() {
        AccountDefaults defaults = new AccountDefaults(null, null, null, null, 4, null, null, null, null, null);

        TaskInputData payload = create(titled().timeChunksRequired(6).maxChunkSize(2).build(), defaults);

        assertThat(payload.getTimeChunksRequired()).isEqualTo(6);
        assertThat(payload.getMinChunkSize()).isEqualTo(4);
        assertThat(payload.getMaxChunkSize()).isEqualTo(4);
    }

    @Test
    void lockPinsBothBoundsToTheTotal() {
        TaskInputData payload = create(titled()
                .durationMinutes(90)
                .minChunkSize(1)
                .maxChunkSize(2)
                .lockChunkSizeToDuration(true)
                .build(), null);

        assertThat(payload.getTimeChunksRequired()).isEqualTo(6);
        assertThat(payload.getMinChunkSize()).isEqualTo(6);
        assertThat(payload.getMaxChunkSize()).isEqualTo(6);
    }

    @Test
    void lockWithoutTotalIsRejected() {
        assertThatThrownBy(() -> create(titled().lockChunkSizeToDuration(true).build(), null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("lockChunkSizeToDuration");
    }

    @Test
    void createFillsGapsFromAccountDefaults() {
        AccountDefaults defaults = new AccountDefaults("personal", null, "high", 8, 2, 4, 3, true, null, "scheme-1");

        TaskInputData payload = create(titled().build(), defaults);

        assertThat(payload.getEventCategory()).isEqualTo("PERSONAL");
        assertThat(payload.getEventSubType()).isNull();
        assertThat(payload.getPriority()).isEqualTo("P2");
        assertThat(payload.getTimeChunksRequired()).isEqualTo(8);
        assertThat(payload.getMinChunkSize()).isEqualTo(2);
        assertThat(payload.getMaxChunkSize()).isEqualTo(4);
        assertThat(payload.getOnDeck()).isTrue();
        assertThat(payload.getAlwaysPrivate()).isNull();
        assertThat(payload.getTimeSchemeId()).isEqualTo("scheme-1");
        assertThat(payload.getDue().iso()).isEqualTo("2026-01-13T12:00:00.000Z");
    }

    @Test
    void explicitFieldsBeatAccountDefaults() {
        AccountDefaults defaults = new AccountDefaults("WORK", "FOCUS", "P4", 8, 2, 4, 3, false, null, null);

        TaskInputData payload = create(titled().priority("P1").onDeck(true).timeChunksRequired(2).build(), defaults);

        assertThat(payload.getPriority()).isEqualTo("P1");
        assertThat(payload.getOnDeck()).isTrue();
        assertThat(payload.getTimeChunksRequired()).isEqualTo(2);
        // default min and max are capped at the explicit total
        assertThat(payload.getMinChunkSize()).isEqualTo(2);
        assertThat(payload.getMaxChunkSize()).isEqualTo(2);
    }

    @Test
    void createWithoutDefaultsFallsBackToOneChunkDueTomorrow() {
        TaskInputData payload = create(titled().build(), null);

        assertThat(payload.getEventCategory()).isNull();
        assertThat(payload.getPriority()).isNull();
        assertThat(payload.getTimeChunksRequired()).isEqualTo(1);
        assertThat(payload.getMinChunkSize()).isEqualTo(1);
        assertThat(payload.getMaxChunkSize()).isEqualTo(1);
        assertThat(payload.getDue().iso()).isEqualTo("2026-01-11T12:00:00.000Z");
    }

    @Test
    void personalSubTypeImpliesPersonalCategory() {
        TaskInputData payload = create(titled().eventSubType("errands").build(), null);

        assertThat(payload.getEventCategory()).isEqualTo("PERSONAL");
        assertThat(payload.getEventSubType()).isEqualTo("ERRAND");
    }

    @Test
    void updateForwardsOnlyExplicitFields() {
        AccountDefaults defaults = new AccountDefaults("PERSONAL", null, "P1", 8, 2, 4, 3, true, true, "scheme-1");

        TaskInputData payload = normalizer.normalize(RawTaskFields.builder().title("Renamed").build(),
                defaults, LOS_ANGELES, TaskFlow.UPDATE).payload();

        assertThat(payload).isEqualTo(TaskInputData.builder().title("Renamed").build());
    }

    @Test
    void updateWithNothingProducesAnEmptyPayload() {
        TaskInputData payload = normalizer.normalize(RawTaskFields.builder().build(), null, LOS_ANGELES, TaskFlow.UPDATE)
                .payload();

        assertThat(payload.hasNoFields()).isTrue();
    }

    @Test
    void titleRules() {
        assertThatThrownBy(() -> create(RawTaskFields.builder().build(), null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Title cannot be empty.");
        assertThatThrownBy(() -> normalizer.normalize(RawTaskFields.builder().title("  ").build(), null, LOS_ANGELES, TaskFlow.UPDATE))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void deadlineAndSnoozeAreResolvedInTheContextZone() {
        TaskInputData payload = create(titled()
                .deadline(TimeInput.ofText("2026-01-05T08:00:00"))
                .snoozeUntil(TimeInput.ofDays(2))
                .build(), null);

        assertThat(payload.getDue().iso()).isEqualTo("2026-01-05T16:00:00.000Z");
        assertThat(payload.getSnoozeUntil().iso()).isEqualTo("2026-01-12T12:00:00.000Z");
    }

    @Test
    void atTimeDefaultDueIsStartPlusDuration() {
        NormalizedTask normalized = normalizer.normalize(titled()
                        .durationMinutes(90)
                        .startTime(TimeInput.ofText("2026-01-05T09:00:00"))
                        .build(),
                null, LOS_ANGELES, TaskFlow.CREATE_AT_TIME);

        assertThat(normalized.startTime().iso()).isEqualTo("2026-01-05T17:00:00.000Z");
        assertThat(normalized.payload().getDue().iso()).isEqualTo("2026-01-05T18:30:00.000Z");
    }

    @Test
    void atTimeRequiresStartTime() {
        assertThatThrownBy(() -> normalizer.normalize(titled().build(), null, LOS_ANGELES, TaskFlow.CREATE_AT_TIME))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("startTime");
    }

    @Test
    void unknownEnumerationValuesFallBack() {
        TaskInputData payload = create(titled()
                .eventCategory("hobby")
                .eventSubType("gardening")
                .priority("whenever")
                .eventColor("ultraviolet")
                .build(), null);

        assertThat(payload.getEventCategory()).isEqualTo("WORK");
        assertThat(payload.getEventSubType()).isEqualTo("FOCUS");
        assertThat(payload.getPriority()).isEqualTo("P3");
        assertThat(payload.getEventColor()).isNull();
    }

    @Test
    void enumerationsAreCanonicalized() {
        TaskInputData payload = create(titled()
                .eventCategory(" work ")
                .eventSubType("team meeting")
                .priority("urgent")
                .eventColor("purple")
                .build(), null);

        assertThat(payload.getEventCategory()).isEqualTo("WORK");
        assertThat(payload.getEventSubType()).isEqualTo("STAFF_MEETING");
        assertThat(payload.getPriority()).isEqualTo("P1");
        assertThat(payload.getEventColor()).isEqualTo("GRAPE");
    }

    @Test
    void statusIsValidated() {
        RawTaskFields canceled = RawTaskFields.builder().status("canceled").build();
        assertThat(normalizer.normalize(canceled, null, LOS_ANGELES, TaskFlow.UPDATE).payload().getStatus())
                .isEqualTo("CANCELLED");

        RawTaskFields unknown = RawTaskFields.builder().status("paused").build();
        assertThatThrownBy(() -> normalizer.normalize(unknown, null, LOS_ANGELES, TaskFlow.UPDATE))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("paused");
    }
}
