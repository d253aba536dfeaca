package ru.javaboys.huntysourcing.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.javaboys.huntysourcing.ai.JobKeywordExtractionService;
import ru.javaboys.huntysourcing.dto.GenerateContactsRequest;
import ru.javaboys.huntysourcing.dto.GeneratedContacts;
import ru.javaboys.huntysourcing.engine.Candidate;
import ru.javaboys.huntysourcing.engine.CandidateDiagnostics;
import ru.javaboys.huntysourcing.engine.CandidateDiscoveryEngine;
import ru.javaboys.huntysourcing.engine.EngineResult;
import ru.javaboys.huntysourcing.engine.Filters;
import ru.javaboys.huntysourcing.engine.JobContext;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;
import ru.javaboys.huntysourcing.service.DocParseService;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContactGenerationServiceTest {

    @Mock
    private CandidateDiscoveryEngine engine;
    @Mock
    private JobKeywordExtractionService keywordExtractionService;
    @Mock
    private DocParseService docParseService;

    private ContactGenerationService service;

    @BeforeEach
    void setUp() {
        service = new ContactGenerationService(engine, keywordExtractionService, docParseService,
                "serp-key", "New York", "Analyst,Associate");
    }

    private static Candidate candidate(String name, String email) {
        return Candidate.builder()
                .fullName(name)
                .firstName(name)
                .lastName("")
                .title("Analyst")
                .company("Lazard")
                .city("New York")
                .url("https://www.linkedin.com/in/" + name)
                .email(email)
                .diagnostics(CandidateDiagnostics.builder().fitScore(50).level(SeniorityLevel.ANALYST).build())
                .build();
    }

    @Nested
    @DisplayName("engine input")
    class EngineInput {

        @Test
        void shouldSplitFormAndApplyDefaults() {
            when(engine.generate(any(Filters.class), any(JobContext.class), eq("serp-key"))).thenReturn(EngineResult.empty());
            ArgumentCaptor<Filters> filters = ArgumentCaptor.forClass(Filters.class);
            ArgumentCaptor<JobContext> ctx = ArgumentCaptor.forClass(JobContext.class);

            service.generate(GenerateContactsRequest.builder()
                    .name("LevFin push")
                    .companyList("Goldman Sachs, Lazard ,")
                    .titleKeywords("Leveraged Finance")
                    .targetCount(5)
                    .build());

            verify(engine).generate(filters.capture(), ctx.capture(), eq("serp-key"));
            assertThat(filters.getValue().getCompanies()).containsExactly("Goldman Sachs", "Lazard");
            assertThat(filters.getValue().getCities()).isEmpty();
            assertThat(filters.getValue().getLevels()).containsExactly(SeniorityLevel.ANALYST, SeniorityLevel.ASSOCIATE);
            assertThat(filters.getValue().getCustomKeywords()).containsExactly("Leveraged Finance");
            assertThat(filters.getValue().getMaxPerCompany()).isEqualTo(4);
            assertThat(ctx.getValue().getCompany()).isEqualTo("Goldman Sachs");
            assertThat(ctx.getValue().getCity()).isEqualTo("New York");
            assertThat(ctx.getValue().getExtractedKeywords()).isEmpty();
            verifyNoInteractions(keywordExtractionService);
        }

        @Test
        void shouldAskModelForKeywordsWhenNoneGiven() {
            when(keywordExtractionService.extractKeywords("Restructuring VP", "Advise distressed companies"))
                    .thenReturn(List.of("Restructuring"));
            when(engine.generate(any(Filters.class), any(JobContext.class), eq("serp-key"))).thenReturn(EngineResult.empty());
            ArgumentCaptor<JobContext> ctx = ArgumentCaptor.forClass(JobContext.class);

            service.generate(GenerateContactsRequest.builder()
                    .name("Restructuring VP")
                    .companyList("Houlihan Lokey")
                    .locationList("Los Angeles")
                    .seniorityLevels("VP")
                    .jobDescription("Advise distressed companies")
                    .build());

            verify(engine).generate(any(Filters.class), ctx.capture(), eq("serp-key"));
            assertThat(ctx.getValue().getExtractedKeywords()).containsExactly("Restructuring");
            assertThat(ctx.getValue().getCity()).isEqualTo("Los Angeles");
        }

        @Test
        void shouldReadJobDescriptionFromDocument() {
            InputStream doc = new ByteArrayInputStream(new byte[]{1, 2, 3});
            when(docParseService.parseToText(doc, "jd.pdf")).thenReturn("Coverage banker for FIG");
            when(keywordExtractionService.extractKeywords("FIG Associate", "Coverage banker for FIG")).thenReturn(List.of("FIG"));
            when(engine.generate(any(Filters.class), any(JobContext.class), eq("serp-key"))).thenReturn(EngineResult.empty());
            ArgumentCaptor<JobContext> ctx = ArgumentCaptor.forClass(JobContext.class);

            service.generate(GenerateContactsRequest.builder().name("FIG Associate").companyList("UBS").build(), doc, "jd.pdf");

            verify(engine).generate(any(Filters.class), ctx.capture(), eq("serp-key"));
            assertThat(ctx.getValue().getJobDescription()).isEqualTo("Coverage banker for FIG");
            assertThat(ctx.getValue().getExtractedKeywords()).containsExactly("FIG");
        }
    }

    @Nested
    @DisplayName("post-processing")
    class PostProcessing {

        private final List<Candidate> rows = List.of(
                candidate("a", "a@lazard.com"),
                candidate("b", "b@lazard.com"),
                candidate("c", "N/A"),
                candidate("d", "d@lazard.com"));

        @Test
        void shouldDropPreviouslyContactedAndTrim() {
            when(engine.generate(any(Filters.class), any(JobContext.class), eq("serp-key"))).thenReturn(new EngineResult(rows, 6));

            GeneratedContacts result = service.generate(GenerateContactsRequest.builder()
                    .companyList("Lazard")
                    .targetCount(2)
                    .previouslyContactedEmails(Set.of(" B@Lazard.com"))
                    .build());

            assertThat(result.getContacts()).extracting(Candidate::getFullName).containsExactly("a", "c");
            assertThat(result.getSkippedAsDuplicates()).isEqualTo(1);
            assertThat(result.getQueriesIssued()).isEqualTo(6);
        }

        @Test
        void shouldKeepEveryoneWhenDuplicatesAllowed() {
            when(engine.generate(any(Filters.class), any(JobContext.class), eq("serp-key"))).thenReturn(new EngineResult(rows, 6));

            GeneratedContacts result = service.generate(GenerateContactsRequest.builder()
                    .companyList("Lazard")
                    .targetCount(3)
                    .avoidDuplicates(false)
                    .previouslyContactedEmails(Set.of("b@lazard.com"))
                    .build());

            assertThat(result.getContacts()).extracting(Candidate::getFullName).containsExactly("a", "b", "c");
            assertThat(result.getSkippedAsDuplicates()).isZero();
        }
    }

    @Test
    void generate_shouldRejectNegativeTarget() {
        assertThatThrownBy(() -> service.generate(GenerateContactsRequest.builder().targetCount(-1).build()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(engine);
    }

    @Test
    void generate_shouldCapPerCompanyBudgetForHugeTargets() {
        when(engine.generate(any(Filters.class), any(JobContext.class), eq("serp-key"))).thenReturn(EngineResult.empty());
        ArgumentCaptor<Filters> filters = ArgumentCaptor.forClass(Filters.class);

        service.generate(GenerateContactsRequest.builder().companyList("Lazard").targetCount(Integer.MAX_VALUE).build());

        verify(engine).generate(filters.capture(), any(JobContext.class), eq("serp-key"));
        assertThat(filters.getValue().getMaxPerCompany()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void parseLevels_shouldSkipUnknownLabels() {
        assertThat(ContactGenerationService.parseLevels("VP, md, Partner, vp"))
                .containsExactly(SeniorityLevel.VP, SeniorityLevel.MANAGING_DIRECTOR);
    }
}
