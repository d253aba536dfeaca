package ru.javaboys.huntysourcing.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.List;

/**
 * Campaign targeting. Company order is priority order.
 */
@Value
@Builder(toBuilder = true)
public class Filters {
    @Singular
    List<String> companies;
    @Singular
    List<String> cities;
    @Singular
    List<String> schools;
    @Singular
    List<SeniorityLevel> levels;
    @Singular
    List<String> customKeywords;
    @Singular
    List<String> frontOfficeKeywords;
    @Singular
    List<String> hrKeywords;
    int maxPerCompany;
}
