package ru.javaboys.huntysourcing.service.impl;

import org.junit.jupiter.api.Test;
import ru.javaboys.huntysourcing.engine.Candidate;
import ru.javaboys.huntysourcing.engine.CandidateDiagnostics;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateCsvExporterTest {

    private final CandidateCsvExporter exporter = new CandidateCsvExporter();

    @Test
    void export_shouldWriteHeaderAndEscapedRows() {
        Candidate jane = Candidate.builder()
                .fullName("Jane Doe")
                .firstName("Jane")
                .lastName("Doe")
                .title("Associate, Leveraged Finance")
                .company("Goldman Sachs")
                .city("New York")
                .school("Columbia \"CBS\"")
                .url("https://www.linkedin.com/in/janedoe")
                .email("jane.doe@gs.com")
                .diagnostics(CandidateDiagnostics.builder().fitScore(87).level(SeniorityLevel.ASSOCIATE).build())
                .build();
        Candidate ken = Candidate.builder()
                .fullName("Ken Ito")
                .firstName("Ken")
                .lastName("Ito")
                .title("Analyst")
                .company("Lazard")
                .city("")
                .url("https://www.linkedin.com/in/kenito")
                .email("N/A")
                .diagnostics(CandidateDiagnostics.builder().fitScore(40).level(SeniorityLevel.ANALYST).build())
                .build();

        String csv = exporter.export(List.of(jane, ken));

        assertThat(csv.split("\r\n")).containsExactly(
                "First Name,Last Name,Title,Company,Location,School,LinkedIn,Email,Fit Score",
                "Jane,Doe,\"Associate, Leveraged Finance\",Goldman Sachs,New York,\"Columbia \"\"CBS\"\"\",https://www.linkedin.com/in/janedoe,jane.doe@gs.com,87",
                "Ken,Ito,Analyst,Lazard,,,https://www.linkedin.com/in/kenito,N/A,40");
    }

    @Test
    void export_shouldWriteHeaderOnlyForEmptyList() {
        assertThat(exporter.export(List.of())).isEqualTo(CandidateCsvExporter.HEADER + "\r\n");
    }
}
