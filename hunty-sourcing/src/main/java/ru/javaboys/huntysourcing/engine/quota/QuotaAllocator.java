package ru.javaboys.huntysourcing.engine.quota;

import lombok.RequiredArgsConstructor;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a slot budget across seniority levels by weighted largest-remainder (Hamilton) apportionment.
 * Remainders are compared as exact integers; equal remainders go to the more junior level.
 */
@RequiredArgsConstructor
public class QuotaAllocator {

    private final SeniorityWeights weights;

    public Map<SeniorityLevel, Integer> allocate(List<SeniorityLevel> selected, int total) {
        Set<SeniorityLevel> levels = new LinkedHashSet<>();
        if (selected != null) {
            selected.stream()
                    .filter(l -> l != null && l.isKnown())
                    .sorted()
                    .forEach(levels::add);
        }
        Map<SeniorityLevel, Integer> quotas = new LinkedHashMap<>();
        if (levels.isEmpty()) return quotas;
        if (total <= 0) {
            levels.forEach(l -> quotas.put(l, 0));
            return quotas;
        }

        long weightSum = 0;
        for (SeniorityLevel l : levels) weightSum += weights.weightOf(l);

        Map<SeniorityLevel, Long> remainders = new EnumMap<>(SeniorityLevel.class);
        int assigned = 0;
        for (SeniorityLevel l : levels) {
            long numerator = (long) total * weights.weightOf(l);
            int floor = (int) (numerator / weightSum);
            quotas.put(l, floor);
            remainders.put(l, numerator % weightSum);
            assigned += floor;
        }

        List<SeniorityLevel> byRemainder = new ArrayList<>(levels);
        byRemainder.sort(Comparator.comparing((SeniorityLevel l) -> remainders.get(l)).reversed()
                .thenComparing(Comparator.naturalOrder()));
        int left = total - assigned;
        for (int i = 0; i < left; i++) {
            SeniorityLevel l = byRemainder.get(i % byRemainder.size());
            quotas.merge(l, 1, Integer::sum);
        }
        return quotas;
    }
}
