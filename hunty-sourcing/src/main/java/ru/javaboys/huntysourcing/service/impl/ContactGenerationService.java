package ru.javaboys.huntysourcing.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import ru.javaboys.huntysourcing.ai.JobKeywordExtractionService;
import ru.javaboys.huntysourcing.dto.GenerateContactsRequest;
import ru.javaboys.huntysourcing.dto.GeneratedContacts;
import ru.javaboys.huntysourcing.engine.Candidate;
import ru.javaboys.huntysourcing.engine.CandidateDiscoveryEngine;
import ru.javaboys.huntysourcing.engine.EngineResult;
import ru.javaboys.huntysourcing.engine.Filters;
import ru.javaboys.huntysourcing.engine.JobContext;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;
import ru.javaboys.huntysourcing.service.DocParseService;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for a campaign: turns the comma separated form into engine input and
 * post-processes the ranked list (previously contacted people out, exact target size).
 */
@Service
@Slf4j
public class ContactGenerationService {

    private static final int PER_COMPANY_SURPLUS = 2;

    private final CandidateDiscoveryEngine engine;
    private final JobKeywordExtractionService keywordExtractionService;
    private final DocParseService docParseService;
    private final String serpApiKey;
    private final String defaultCity;
    private final String defaultLevels;

    public ContactGenerationService(CandidateDiscoveryEngine engine,
                                    JobKeywordExtractionService keywordExtractionService,
                                    DocParseService docParseService,
                                    @Value("${hunty.search.serpapi.api-key:}") String serpApiKey,
                                    @Value("${hunty.sourcing.default-city:New York}") String defaultCity,
                                    @Value("${hunty.sourcing.default-levels:Analyst,Associate}") String defaultLevels) {
        this.engine = engine;
        this.keywordExtractionService = keywordExtractionService;
        this.docParseService = docParseService;
        this.serpApiKey = serpApiKey;
        this.defaultCity = defaultCity;
        this.defaultLevels = defaultLevels;
    }

    /**
     * Same as {@link #generate(GenerateContactsRequest)}, with the job description taken from an uploaded file.
     */
    public GeneratedContacts generate(GenerateContactsRequest request, InputStream jobDocument, @Nullable String fileName) {
        if (request == null) {
            throw new IllegalArgumentException("Request is required");
        }
        String text = docParseService.parseToText(jobDocument, fileName);
        log.info("Job description '{}' parsed: {} chars", fileName, text.length());
        request.setJobDescription(text);
        return generate(request);
    }

    public GeneratedContacts generate(GenerateContactsRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request is required");
        }
        if (request.getTargetCount() < 0) {
            throw new IllegalArgumentException("Target count must not be negative: " + request.getTargetCount());
        }

        List<String> companies = splitList(request.getCompanyList());
        List<String> cities = splitList(request.getLocationList());
        List<String> schools = splitList(request.getTargetSchools());
        List<String> keywords = splitList(request.getTitleKeywords());
        List<SeniorityLevel> levels = parseLevels(request.getSeniorityLevels());
        if (levels.isEmpty()) {
            levels = parseLevels(defaultLevels);
        }

        int companyCount = Math.max(1, companies.size());
        int maxPerCompany = (int) Math.min(Integer.MAX_VALUE,
                (long) Math.max(1, request.getTargetCount() / companyCount) + PER_COMPANY_SURPLUS);

        Filters filters = Filters.builder()
                .companies(companies)
                .cities(cities)
                .schools(schools)
                .levels(levels)
                .customKeywords(keywords)
                .maxPerCompany(maxPerCompany)
                .build();

        // ключевые слова из формы уже в фильтрах, здесь только извлечённые из описания
        List<String> extracted = keywords.isEmpty()
                ? keywordExtractionService.extractKeywords(request.getName(), request.getJobDescription())
                : List.of();

        JobContext jobContext = JobContext.builder()
                .jobName(StringUtils.defaultString(request.getName()))
                .company(companies.isEmpty() ? "" : companies.get(0))
                .city(cities.isEmpty() ? defaultCity : cities.get(0))
                .jobDescription(request.getJobDescription())
                .extractedKeywords(extracted)
                .build();

        log.info("Generating contacts for campaign '{}': {} companies, target {}, {} per company",
                request.getName(), companies.size(), request.getTargetCount(), maxPerCompany);
        EngineResult result = engine.generate(filters, jobContext, serpApiKey);

        List<Candidate> contacts = result.getCandidates();
        int skipped = 0;
        if (request.isAvoidDuplicates() && request.getPreviouslyContactedEmails() != null
                && !request.getPreviouslyContactedEmails().isEmpty()) {
            Set<String> contacted = request.getPreviouslyContactedEmails().stream()
                    .filter(Objects::nonNull)
                    .map(e -> e.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            List<Candidate> fresh = contacts.stream()
                    .filter(c -> !contacted.contains(StringUtils.defaultString(c.getEmail()).trim().toLowerCase(Locale.ROOT)))
                    .collect(Collectors.toList());
            skipped = contacts.size() - fresh.size();
            contacts = fresh;
        }

        if (contacts.size() > request.getTargetCount()) {
            contacts = contacts.subList(0, request.getTargetCount());
        }
        log.info("Campaign '{}': {} contacts after {} queries ({} already contacted)",
                request.getName(), contacts.size(), result.getQueriesIssued(), skipped);
        return new GeneratedContacts(List.copyOf(contacts), result.getQueriesIssued(), skipped);
    }

    static List<String> splitList(String raw) {
        if (StringUtils.isBlank(raw)) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }

    static List<SeniorityLevel> parseLevels(String raw) {
        List<SeniorityLevel> levels = new ArrayList<>();
        for (String label : splitList(raw)) {
            SeniorityLevel level = SeniorityLevel.fromId(label);
            if (level == null || !level.isKnown()) {
                log.warn("Ignoring unknown seniority level '{}'", label);
                continue;
            }
            if (!levels.contains(level)) {
                levels.add(level);
            }
        }
        return levels;
    }
}
