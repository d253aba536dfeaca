package ru.javaboys.huntysourcing.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import ru.javaboys.huntysourcing.email.EmailFinder;
import ru.javaboys.huntysourcing.engine.CandidateDiscoveryEngine;
import ru.javaboys.huntysourcing.engine.EngineSettings;
import ru.javaboys.huntysourcing.engine.PrecisionMode;
import ru.javaboys.huntysourcing.engine.company.CompanyDirectory;
import ru.javaboys.huntysourcing.engine.company.CompanyMatcher;
import ru.javaboys.huntysourcing.engine.company.CompanyNameRules;
import ru.javaboys.huntysourcing.engine.keyword.KeywordExpander;
import ru.javaboys.huntysourcing.engine.parse.ResultParser;
import ru.javaboys.huntysourcing.engine.query.QuerySynthesizer;
import ru.javaboys.huntysourcing.engine.quota.CompanyResultSelector;
import ru.javaboys.huntysourcing.engine.quota.QuotaAllocator;
import ru.javaboys.huntysourcing.engine.quota.SeniorityWeights;
import ru.javaboys.huntysourcing.engine.role.RoleClassifier;
import ru.javaboys.huntysourcing.engine.score.FitScorer;
import ru.javaboys.huntysourcing.engine.verify.CurrentRoleVerifier;
import ru.javaboys.huntysourcing.search.SearchClient;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Wires the discovery engine. Lookup tables are immutable beans so tests can swap them.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public CompanyDirectory companyDirectory(ObjectMapper objectMapper,
                                             @Value("${hunty.sourcing.company-domains:classpath:company-domains.json}") Resource resource) {
        try (InputStream is = resource.getInputStream()) {
            Map<String, String> domains = objectMapper.readValue(is, new TypeReference<Map<String, String>>() {
            });
            CompanyDirectory directory = new CompanyDirectory(domains);
            log.info("Loaded {} company domains from {}", directory.size(), resource.getDescription());
            return directory;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read company domain directory " + resource.getDescription(), e);
        }
    }

    @Bean
    public CompanyNameRules companyNameRules() {
        return CompanyNameRules.defaults();
    }

    @Bean
    public SeniorityWeights seniorityWeights() {
        return SeniorityWeights.defaults();
    }

    @Bean
    public CompanyMatcher companyMatcher(CompanyNameRules rules, CompanyDirectory directory) {
        return new CompanyMatcher(rules, directory);
    }

    @Bean
    public KeywordExpander keywordExpander() {
        return new KeywordExpander();
    }

    @Bean
    public QuerySynthesizer querySynthesizer(@Value("${hunty.sourcing.exclude-senior-levels:true}") boolean excludeSeniorLevels) {
        return new QuerySynthesizer(excludeSeniorLevels);
    }

    @Bean
    public ResultParser resultParser() {
        return new ResultParser();
    }

    @Bean
    public RoleClassifier roleClassifier() {
        return new RoleClassifier();
    }

    @Bean
    public CurrentRoleVerifier currentRoleVerifier(CompanyMatcher companyMatcher) {
        return new CurrentRoleVerifier(companyMatcher);
    }

    @Bean
    public FitScorer fitScorer(CompanyMatcher companyMatcher, KeywordExpander keywordExpander) {
        return new FitScorer(companyMatcher, keywordExpander);
    }

    @Bean
    public QuotaAllocator quotaAllocator(SeniorityWeights weights) {
        return new QuotaAllocator(weights);
    }

    @Bean
    public CompanyResultSelector companyResultSelector() {
        return new CompanyResultSelector();
    }

    @Bean
    public EngineSettings engineSettings(@Value("${hunty.sourcing.gather-multiplier:6}") int gatherMultiplier,
                                         @Value("${hunty.sourcing.max-keywords:8}") int maxKeywords,
                                         @Value("${hunty.sourcing.default-keyword:Investment Banking}") String defaultKeyword,
                                         @Value("${hunty.sourcing.precision-mode:SEARCH}") PrecisionMode precisionMode) {
        return EngineSettings.builder()
                .gatherMultiplier(gatherMultiplier)
                .maxKeywords(maxKeywords)
                .defaultKeyword(defaultKeyword)
                .precisionMode(precisionMode)
                .build();
    }

    @Bean
    public CandidateDiscoveryEngine candidateDiscoveryEngine(SearchClient searchClient,
                                                             EmailFinder emailFinder,
                                                             CompanyMatcher companyMatcher,
                                                             KeywordExpander keywordExpander,
                                                             QuerySynthesizer querySynthesizer,
                                                             ResultParser resultParser,
                                                             RoleClassifier roleClassifier,
                                                             CurrentRoleVerifier currentRoleVerifier,
                                                             FitScorer fitScorer,
                                                             QuotaAllocator quotaAllocator,
                                                             CompanyResultSelector companyResultSelector,
                                                             EngineSettings engineSettings) {
        return new CandidateDiscoveryEngine(searchClient, emailFinder, companyMatcher, keywordExpander,
                querySynthesizer, resultParser, roleClassifier, currentRoleVerifier, fitScorer,
                quotaAllocator, companyResultSelector, engineSettings);
    }
}
