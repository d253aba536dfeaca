package ru.javaboys.huntysourcing.engine.role;

import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * Seniority ladder used for classification, quotas and ordering.
 * Declaration order is the priority order: most junior first, {@link #UNKNOWN} last.
 */
public enum SeniorityLevel {

    ANALYST("Analyst"),
    ASSOCIATE("Associate"),
    VP("VP"),
    DIRECTOR("Director"),
    EXECUTIVE_DIRECTOR("Executive Director"),
    MANAGING_DIRECTOR("Managing Director"),
    UNKNOWN("Unknown");

    private final String id;

    SeniorityLevel(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public int priority() {
        return ordinal();
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public boolean isSeniorTo(SeniorityLevel other) {
        return isKnown() && other.isKnown() && ordinal() > other.ordinal();
    }

    @Nullable
    public static SeniorityLevel fromId(String id) {
        if (id == null) return null;
        String t = id.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        for (SeniorityLevel at : SeniorityLevel.values()) {
            if (at.getId().toLowerCase(Locale.ROOT).equals(t)) {
                return at;
            }
        }
        // допускаем сокращения и полные формы
        if (t.equals("vice president") || t.equals("svp") || t.equals("avp")) return VP;
        if (t.equals("md")) return MANAGING_DIRECTOR;
        if (t.equals("ed")) return EXECUTIVE_DIRECTOR;
        if (t.equals("principal")) return DIRECTOR;
        return null;
    }
}
