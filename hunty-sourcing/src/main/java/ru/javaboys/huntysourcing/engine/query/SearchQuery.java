package ru.javaboys.huntysourcing.engine.query;

import lombok.Value;
import org.springframework.lang.Nullable;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

@Value
public class SearchQuery {
    String company;
    String city;
    String keyword;
    @Nullable
    SeniorityLevel level; // null = без уточнения уровня
    String text;
}
