package ru.javaboys.huntysourcing.engine.quota;

import org.junit.jupiter.api.Test;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class QuotaAllocatorTest {

    private final QuotaAllocator allocator = new QuotaAllocator(SeniorityWeights.defaults());

    @Test
    void allocate_shouldSplitByWeightWithLargestRemainder() {
        Map<SeniorityLevel, Integer> quotas = allocator.allocate(
                List.of(SeniorityLevel.ASSOCIATE, SeniorityLevel.ANALYST), 5);

        assertThat(quotas).containsExactly(entry(SeniorityLevel.ANALYST, 3), entry(SeniorityLevel.ASSOCIATE, 2));
    }

    @Test
    void allocate_shouldAlwaysSumToTotal() {
        List<SeniorityLevel> all = List.of(SeniorityLevel.ANALYST, SeniorityLevel.ASSOCIATE, SeniorityLevel.VP,
                SeniorityLevel.DIRECTOR, SeniorityLevel.EXECUTIVE_DIRECTOR, SeniorityLevel.MANAGING_DIRECTOR);

        for (int total = 0; total <= 25; total++) {
            Map<SeniorityLevel, Integer> quotas = allocator.allocate(all, total);
            assertThat(quotas.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(total);
        }
    }

    @Test
    void allocate_shouldGiveEverythingToSingleLevel() {
        assertThat(allocator.allocate(List.of(SeniorityLevel.VP), 7)).containsExactly(entry(SeniorityLevel.VP, 7));
    }

    @Test
    void allocate_shouldBreakTiesTowardsJuniorLevel() {
        Map<SeniorityLevel, Integer> quotas = allocator.allocate(
                List.of(SeniorityLevel.MANAGING_DIRECTOR, SeniorityLevel.DIRECTOR), 1);

        assertThat(quotas).containsExactly(entry(SeniorityLevel.DIRECTOR, 1), entry(SeniorityLevel.MANAGING_DIRECTOR, 0));
    }

    @Test
    void allocate_shouldIgnoreUnknownAndHandleEmptySelection() {
        assertThat(allocator.allocate(List.of(SeniorityLevel.UNKNOWN), 4)).isEmpty();
        assertThat(allocator.allocate(List.of(), 4)).isEmpty();
        assertThat(allocator.allocate(null, 4)).isEmpty();
    }

    @Test
    void weights_shouldRejectNonPositiveValues() {
        assertThatThrownBy(() -> new SeniorityWeights(Map.of(SeniorityLevel.ANALYST, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
