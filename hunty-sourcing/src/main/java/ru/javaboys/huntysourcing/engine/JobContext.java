package ru.javaboys.huntysourcing.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * The outreach target. Supplies defaults when filters leave something out.
 */
@Value
@Builder(toBuilder = true)
public class JobContext {
    String jobName;
    String company;
    @Nullable
    String city;
    @Nullable
    String jobDescription;
    @Singular
    List<String> extractedKeywords;

    public static JobContext empty() {
        return JobContext.builder().jobName("").company("").build();
    }
}
