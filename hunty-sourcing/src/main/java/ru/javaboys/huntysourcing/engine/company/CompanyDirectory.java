package ru.javaboys.huntysourcing.engine.company;

import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only company name → email domain lookup.
 * Keys are lower-case company names, values are bare domains.
 */
public final class CompanyDirectory {

    private final Map<String, String> domains;

    public CompanyDirectory(Map<String, String> domains) {
        Map<String, String> copy = new LinkedHashMap<>();
        domains.forEach((k, v) -> {
            if (StringUtils.isNoneBlank(k, v)) {
                copy.put(k.trim().toLowerCase(Locale.ROOT), v.trim().toLowerCase(Locale.ROOT));
            }
        });
        this.domains = Collections.unmodifiableMap(copy);
    }

    public static CompanyDirectory empty() {
        return new CompanyDirectory(Map.of());
    }

    @Nullable
    public String get(String name) {
        return name == null ? null : domains.get(name.trim().toLowerCase(Locale.ROOT));
    }

    public Map<String, String> entries() {
        return domains;
    }

    public int size() {
        return domains.size();
    }
}
