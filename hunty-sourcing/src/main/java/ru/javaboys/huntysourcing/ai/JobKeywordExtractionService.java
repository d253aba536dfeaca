package ru.javaboys.huntysourcing.ai;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import ru.javaboys.huntysourcing.ai.dto.JobKeywords;
import ru.javaboys.huntysourcing.engine.keyword.KeywordExpander;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pulls desk and product keywords out of a job description.
 * Any failure of the model call yields an empty list; sourcing then relies on the job title.
 */
@Service
@Slf4j
public class JobKeywordExtractionService {

    private static final int MAX_DESCRIPTION_CHARS = 12_000;

    private final OpenAiService openAiService;
    private final boolean enabled;
    private final int maxKeywords;

    public JobKeywordExtractionService(OpenAiService openAiService,
                                       @Value("${hunty.ai.keyword-extraction.enabled:false}") boolean enabled,
                                       @Value("${hunty.sourcing.max-keywords:8}") int maxKeywords) {
        this.openAiService = openAiService;
        this.enabled = enabled;
        this.maxKeywords = maxKeywords;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> extractKeywords(@Nullable String jobName, @Nullable String jobDescription) {
        if (!enabled || StringUtils.isBlank(jobDescription)) {
            return List.of();
        }
        SystemMessage system = new SystemMessage("You help a recruiter source bankers. Return strictly JSON for the Java class JobKeywords. "
                + "keywords: at most " + maxKeywords + " short desk, product or coverage-group phrases (e.g. \"Leveraged Finance\", \"FIG\"), "
                + "no seniority words, no company names, no duplicates.");
        UserMessage user = new UserMessage("Job title: " + StringUtils.defaultString(jobName)
                + "\nJob description:\n" + StringUtils.abbreviate(jobDescription, MAX_DESCRIPTION_CHARS));
        try {
            JobKeywords result = openAiService.structuredTalkToChatGPT(system, user, JobKeywords.class);
            List<String> keywords = clean(result);
            log.info("Extracted {} keywords from job description", keywords.size());
            return keywords;
        } catch (RuntimeException e) {
            log.warn("Keyword extraction failed, continuing without it: {}", e.getMessage());
            return List.of();
        }
    }

    private List<String> clean(@Nullable JobKeywords result) {
        if (result == null || result.getKeywords() == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String raw : result.getKeywords()) {
            String keyword = KeywordExpander.canonicalize(raw);
            if (keyword.isEmpty() || !seen.add(keyword.toLowerCase(Locale.ROOT))) {
                continue;
            }
            out.add(keyword);
            if (out.size() >= maxKeywords) {
                break;
            }
        }
        return out;
    }
}
