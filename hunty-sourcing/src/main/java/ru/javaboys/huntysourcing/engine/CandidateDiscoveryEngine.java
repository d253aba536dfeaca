package ru.javaboys.huntysourcing.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;
import ru.javaboys.huntysourcing.email.EmailFinder;
import ru.javaboys.huntysourcing.engine.company.CompanyMatcher;
import ru.javaboys.huntysourcing.engine.company.DomainMatch;
import ru.javaboys.huntysourcing.engine.keyword.KeywordExpander;
import ru.javaboys.huntysourcing.engine.parse.ParsedTitle;
import ru.javaboys.huntysourcing.engine.parse.PersonName;
import ru.javaboys.huntysourcing.engine.parse.ResultParser;
import ru.javaboys.huntysourcing.engine.query.QuerySynthesizer;
import ru.javaboys.huntysourcing.engine.query.SearchQuery;
import ru.javaboys.huntysourcing.engine.quota.CompanyResultSelector;
import ru.javaboys.huntysourcing.engine.quota.QuotaAllocator;
import ru.javaboys.huntysourcing.engine.role.RoleClassifier;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;
import ru.javaboys.huntysourcing.engine.score.FitScore;
import ru.javaboys.huntysourcing.engine.score.FitScorer;
import ru.javaboys.huntysourcing.engine.score.ScoringInput;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;
import ru.javaboys.huntysourcing.engine.verify.CurrentRoleVerifier;
import ru.javaboys.huntysourcing.engine.verify.VerificationResult;
import ru.javaboys.huntysourcing.search.SearchClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the company × city × keyword × level search fan-out and turns raw hits into
 * scored, deduplicated, seniority-balanced candidate rows.
 * <p>
 * Single-threaded per call: the identity-key set and company pools are local to one run.
 */
@Slf4j
@RequiredArgsConstructor
public class CandidateDiscoveryEngine {

    public static final Comparator<Candidate> FINAL_ORDER =
            Comparator.comparingInt((Candidate c) -> CompanyResultSelector.levelOf(c).priority())
                    .thenComparing(Comparator.comparingInt(Candidate::getFitScore).reversed())
                    .thenComparing(Candidate::getCompany)
                    .thenComparing(Candidate::getFullName);

    private final SearchClient searchClient;
    private final EmailFinder emailFinder;
    private final CompanyMatcher companyMatcher;
    private final KeywordExpander keywordExpander;
    private final QuerySynthesizer querySynthesizer;
    private final ResultParser resultParser;
    private final RoleClassifier roleClassifier;
    private final CurrentRoleVerifier currentRoleVerifier;
    private final FitScorer fitScorer;
    private final QuotaAllocator quotaAllocator;
    private final CompanyResultSelector resultSelector;
    private final EngineSettings settings;

    public EngineResult generate(Filters filters, @Nullable JobContext jobContext, String searchCredential) {
        if (filters == null) {
            throw new IllegalArgumentException("Filters are required");
        }
        if (filters.getMaxPerCompany() < 0) {
            throw new IllegalArgumentException("maxPerCompany must not be negative: " + filters.getMaxPerCompany());
        }
        JobContext ctx = jobContext == null ? JobContext.empty() : jobContext;
        int maxPerCompany = filters.getMaxPerCompany();

        List<String> companies = resolveCompanies(filters, ctx);
        if (companies.isEmpty() || maxPerCompany == 0) {
            log.warn("Nothing to search: companies={}, maxPerCompany={}", companies, maxPerCompany);
            return EngineResult.empty();
        }

        RunPlan plan = new RunPlan(
                resolveCities(filters, ctx),
                resolveKeywords(filters, ctx),
                resolveLevels(filters),
                filters.getSchools(),
                jobTerms(ctx));
        Map<SeniorityLevel, Integer> quotas = quotaAllocator.allocate(plan.levels, maxPerCompany);
        log.info("Discovery run: companies={}, cities={}, keywords={}, levels={}, quotas={}",
                companies, plan.cities, plan.keywords, plan.levels, quotas);

        Set<String> seenKeys = new HashSet<>();
        List<Candidate> rows = new ArrayList<>();
        int queriesIssued = 0;

        for (String company : companies) {
            List<Candidate> pool = new ArrayList<>();
            int gatherLimit = (int) Math.min(Integer.MAX_VALUE, (long) maxPerCompany * settings.getGatherMultiplier());
            int companyQueries = 0;

            for (SearchQuery query : querySynthesizer.plan(company, plan.cities, plan.keywords, plan.levels)) {
                if (pool.size() >= gatherLimit) break;
                List<RawResult> results = safeSearch(query.getText(), searchCredential);
                queriesIssued++;
                companyQueries++;

                for (RawResult raw : results) {
                    if (pool.size() >= gatherLimit) break;
                    Optional<Candidate> candidate = toCandidate(raw, query, company, plan);
                    if (candidate.isEmpty()) continue;
                    if (!seenKeys.add(candidate.get().identityKey())) {
                        log.debug("Duplicate candidate dropped: {}", candidate.get().identityKey());
                        continue;
                    }
                    pool.add(candidate.get());
                }
            }

            List<Candidate> selected = resultSelector.select(pool, quotas, maxPerCompany);
            log.info("Company '{}': queries={}, pool={}, selected={}", company, companyQueries, pool.size(), selected.size());
            rows.addAll(selected);
        }

        rows.sort(FINAL_ORDER);
        log.info("Discovery finished: rows={}, queries={}", rows.size(), queriesIssued);
        return new EngineResult(List.copyOf(rows), queriesIssued);
    }

    private Optional<Candidate> toCandidate(RawResult raw, SearchQuery query, String targetCompany, RunPlan plan) {
        ParsedTitle parsed = resultParser.parseTitle(raw.getTitle());
        PersonName name = resultParser.cleanFullName(parsed.getName());
        if (name.isEmpty()) {
            log.debug("No name in result title '{}'", raw.getTitle());
            return Optional.empty();
        }

        PrecisionMode mode = settings.getPrecisionMode();
        VerificationResult verification = currentRoleVerifier.verify(parsed.getRoleCompany(), targetCompany, raw.getSnippet(), mode);
        if (!verification.isAccepted()) {
            log.debug("Rejected '{}' for {}: {}", name.getFullName(), targetCompany, verification.getReasons());
            return Optional.empty();
        }

        String title = currentRoleVerifier.titlePart(parsed.getRoleCompany());
        SeniorityLevel level = roleClassifier.detectLevel(title.isEmpty() ? parsed.getRoleCompany() : title);
        String company = verification.getCompany() != null ? verification.getCompany() : targetCompany;
        String city = resolveCity(raw, plan.cities);
        String school = matchSchool(raw, plan.schools);

        Optional<DomainMatch> domain = companyMatcher.resolveDomain(company, targetCompany, companyMatcher.normalizeCompany(targetCompany));
        String email = predictEmail(name, domain.map(DomainMatch::getDomain).orElse(null));

        FitScore fit = fitScorer.score(ScoringInput.builder()
                .targetCompany(targetCompany)
                .company(company)
                .currentRole(true)
                .title(title)
                .roleText(parsed.getRoleCompany())
                .city(city)
                .targetCities(plan.cities)
                .level(level)
                .targetLevels(plan.levels)
                .keywords(plan.keywords)
                .jobTerms(plan.jobTerms)
                .school(school)
                .email(email)
                .build(), mode);

        CandidateDiagnostics diagnostics = CandidateDiagnostics.builder()
                .fitScore(fit.getScore())
                .reasons(fit.getReasons())
                .level(level)
                .query(query.getText())
                .companyEvidence(verification.getEvidence())
                .explicitAt(verification.isExplicitAt())
                .verifierReasons(verification.getReasons())
                .keywordMatch(fit.getKeywordMatch())
                .domain(domain.map(DomainMatch::getDomain).orElse(null))
                .build();

        return Optional.of(Candidate.builder()
                .fullName(name.getFullName())
                .firstName(name.getFirstName())
                .lastName(name.getLastName())
                .title(title)
                .company(company)
                .city(city)
                .school(school)
                .url(raw.getUrl() == null ? "" : raw.getUrl())
                .email(email)
                .diagnostics(diagnostics)
                .build());
    }

    private List<RawResult> safeSearch(String query, String credential) {
        try {
            List<RawResult> results = searchClient.search(query, credential);
            return results == null ? List.of() : results;
        } catch (RuntimeException e) {
            log.error("Search failed for query '{}'", query, e);
            return List.of();
        }
    }

    private String predictEmail(PersonName name, @Nullable String domain) {
        if (domain == null || name.getLastName().isEmpty()) return FitScorer.NO_EMAIL;
        try {
            String email = emailFinder.findEmail(name.getFirstName(), name.getLastName(), domain);
            return StringUtils.isBlank(email) ? FitScorer.NO_EMAIL : email.trim();
        } catch (RuntimeException e) {
            log.warn("Email lookup failed for {} @ {}: {}", name.getFullName(), domain, e.getMessage());
            return FitScorer.NO_EMAIL;
        }
    }

    private String resolveCity(RawResult raw, List<String> targetCities) {
        String extracted = resultParser.extractCity(raw.getSnippet());
        if (!extracted.isEmpty()) return extracted;
        for (String city : targetCities) {
            if (TextNormalizer.containsPhrase(raw.getSnippet(), city) || TextNormalizer.containsPhrase(raw.getTitle(), city)) {
                return city;
            }
        }
        return "";
    }

    @Nullable
    private String matchSchool(RawResult raw, List<String> schools) {
        for (String school : schools) {
            if (TextNormalizer.containsPhrase(raw.getSnippet(), school) || TextNormalizer.containsPhrase(raw.getTitle(), school)) {
                return school;
            }
        }
        return null;
    }

    // -------- defaults --------

    private List<String> resolveCompanies(Filters filters, JobContext ctx) {
        List<String> source = filters.getCompanies().isEmpty() && StringUtils.isNotBlank(ctx.getCompany())
                ? List.of(ctx.getCompany())
                : filters.getCompanies();
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String c : source) {
            if (StringUtils.isBlank(c)) continue;
            String key = companyMatcher.normalizeCompany(c);
            byKey.putIfAbsent(key.isEmpty() ? c.trim() : key, c.trim());
        }
        return new ArrayList<>(byKey.values());
    }

    private List<String> resolveCities(Filters filters, JobContext ctx) {
        List<String> cities = filters.getCities().stream()
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .distinct()
                .collect(Collectors.toList());
        if (cities.isEmpty() && StringUtils.isNotBlank(ctx.getCity())) {
            cities = List.of(ctx.getCity().trim());
        }
        return cities;
    }

    private List<String> resolveKeywords(Filters filters, JobContext ctx) {
        List<String> jobName = StringUtils.isNotBlank(ctx.getJobName()) ? List.of(ctx.getJobName()) : List.of();
        return keywordExpander.keywordSet(
                List.of(filters.getCustomKeywords(), filters.getFrontOfficeKeywords(), filters.getHrKeywords()),
                List.of(ctx.getExtractedKeywords(), jobName, List.of(settings.getDefaultKeyword())),
                settings.getMaxKeywords());
    }

    private static List<SeniorityLevel> resolveLevels(Filters filters) {
        return filters.getLevels().stream()
                .filter(l -> l != null && l.isKnown())
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private static List<String> jobTerms(JobContext ctx) {
        List<String> terms = new ArrayList<>();
        if (StringUtils.isNotBlank(ctx.getJobName())) terms.add(ctx.getJobName());
        terms.addAll(ctx.getExtractedKeywords());
        return terms;
    }


    private static final class RunPlan {
        private final List<String> cities;
        private final List<String> keywords;
        private final List<SeniorityLevel> levels;
        private final List<String> schools;
        private final List<String> jobTerms;

        private RunPlan(List<String> cities, List<String> keywords, List<SeniorityLevel> levels,
                        List<String> schools, List<String> jobTerms) {
            this.cities = cities;
            this.keywords = keywords;
            this.levels = levels;
            this.schools = schools;
            this.jobTerms = jobTerms;
        }
    }
}
