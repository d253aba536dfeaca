package ru.javaboys.huntysourcing.engine.quota;

import ru.javaboys.huntysourcing.engine.Candidate;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Applies per-level quotas to one company's candidate pool, then backfills free slots.
 */
public class CompanyResultSelector {

    public static final Comparator<Candidate> BY_SCORE = Comparator.comparingInt(Candidate::getFitScore).reversed()
            .thenComparing(Candidate::getFullName);

    public static final Comparator<Candidate> BY_LEVEL_THEN_SCORE =
            Comparator.comparingInt((Candidate c) -> levelOf(c).priority()).thenComparing(BY_SCORE);

    public List<Candidate> select(List<Candidate> pool, Map<SeniorityLevel, Integer> quotas, int maxPerCompany) {
        if (maxPerCompany <= 0 || pool == null || pool.isEmpty()) return List.of();

        Map<SeniorityLevel, List<Candidate>> groups = new EnumMap<>(SeniorityLevel.class);
        for (Candidate c : pool) {
            groups.computeIfAbsent(levelOf(c), k -> new ArrayList<>()).add(c);
        }
        groups.values().forEach(g -> g.sort(BY_SCORE));

        List<Candidate> picked = new ArrayList<>();
        Set<String> keys = new HashSet<>();

        // 1) квоты по уровням
        for (Map.Entry<SeniorityLevel, Integer> quota : quotas.entrySet()) {
            int taken = 0;
            for (Candidate c : groups.getOrDefault(quota.getKey(), List.of())) {
                if (taken >= quota.getValue() || picked.size() >= maxPerCompany) break;
                if (keys.add(c.identityKey())) {
                    picked.add(c);
                    taken++;
                }
            }
        }

        // 2) добор из выбранных уровней, 3) из Unknown и невыбранных
        backfill(picked, keys, pool.stream().filter(c -> quotas.containsKey(levelOf(c))), maxPerCompany);
        backfill(picked, keys, pool.stream().filter(c -> !quotas.containsKey(levelOf(c))), maxPerCompany);

        picked.sort(BY_LEVEL_THEN_SCORE);
        return new ArrayList<>(picked.subList(0, Math.min(maxPerCompany, picked.size())));
    }

    private static void backfill(List<Candidate> picked, Set<String> keys,
                                 Stream<Candidate> source, int max) {
        if (picked.size() >= max) return;
        List<Candidate> ordered = source.sorted(BY_SCORE).collect(Collectors.toList());
        for (Candidate c : ordered) {
            if (picked.size() >= max) return;
            if (keys.add(c.identityKey())) picked.add(c);
        }
    }

    public static SeniorityLevel levelOf(Candidate c) {
        SeniorityLevel l = c.getDiagnostics() == null ? null : c.getDiagnostics().getLevel();
        return l == null ? SeniorityLevel.UNKNOWN : l;
    }
}
