package bbt.tao.reclaim;

import bbt.tao.reclaim.exception.InvalidInputException;
import bbt.tao.reclaim.normalize.TaskEnumCanonicalizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskEnumCanonicalizerTest {

    @Test
    void inputIsTokenizedBeforeLookup() {
        assertThat(TaskEnumCanonicalizer.subType("one-on-one", null)).isEqualTo("ONE_ON_ONE");
        assertThat(TaskEnumCanonicalizer.subType("  deep   work ", null)).isEqualTo("FOCUS");
        assertThat(TaskEnumCanonicalizer.color("light green")).isEqualTo("SAGE");
    }

    @Test
    void aliasesResolveToCanonicalTags() {
        assertThat(TaskEnumCanonicalizer.subType("meeting", null)).isEqualTo("STAFF_MEETING");
        assertThat(TaskEnumCanonicalizer.priority("critical")).isEqualTo("P1");
        assertThat(TaskEnumCanonicalizer.priority("High")).isEqualTo("P2");
        assertThat(TaskEnumCanonicalizer.priority("normal")).isEqualTo("P3");
        assertThat(TaskEnumCanonicalizer.priority("low")).isEqualTo("P4");
        assertThat(TaskEnumCanonicalizer.category("home")).isEqualTo("PERSONAL");
    }

    @Test
    void subTypeFallbackDependsOnCategory() {
        assertThat(TaskEnumCanonicalizer.subType("knitting", "PERSONAL")).isEqualTo("OTHER_PERSONAL");
        assertThat(TaskEnumCanonicalizer.subType("knitting", "WORK")).isEqualTo("FOCUS");
        assertThat(TaskEnumCanonicalizer.subType("knitting", null)).isEqualTo("FOCUS");
    }

    @Test
    void categoryFollowsSubType() {
        assertThat(TaskEnumCanonicalizer.categoryForSubType("HEALTH")).isEqualTo("PERSONAL");
        assertThat(TaskEnumCanonicalizer.categoryForSubType("VACATION")).isEqualTo("PERSONAL");
        assertThat(TaskEnumCanonicalizer.categoryForSubType("ONE_ON_ONE")).isEqualTo("WORK");
    }

    @Test
    void missingValuesStayMissing() {
        assertThat(TaskEnumCanonicalizer.category(null)).isNull();
        assertThat(TaskEnumCanonicalizer.priority(" ")).isNull();
        assertThat(TaskEnumCanonicalizer.status(null)).isNull();
    }

    @Test
    void unknownStatusFails() {
        assertThatThrownBy(() -> TaskEnumCanonicalizer.status("DONE"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageStartingWith("Unknown status \"DONE\"");
        assertThat(TaskEnumCanonicalizer.status("in progress")).isEqualTo("IN_PROGRESS");
    }
}
