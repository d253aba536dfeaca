package ru.javaboys.huntysourcing.service.impl;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import ru.javaboys.huntysourcing.engine.Candidate;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class CandidateCsvExporter {

    static final String HEADER = "First Name,Last Name,Title,Company,Location,School,LinkedIn,Email,Fit Score";

    public String export(List<Candidate> candidates) {
        StringBuilder sb = new StringBuilder(HEADER).append("\r\n");
        for (Candidate c : candidates) {
            sb.append(row(c)).append("\r\n");
        }
        return sb.toString();
    }

    private String row(Candidate c) {
        return Stream.of(c.getFirstName(), c.getLastName(), c.getTitle(), c.getCompany(), c.getCity(),
                        c.getSchool(), c.getUrl(), c.getEmail(), String.valueOf(c.getFitScore()))
                .map(StringUtils::defaultString)
                .map(CandidateCsvExporter::escape)
                .collect(Collectors.joining(","));
    }

    // RFC 4180: кавычим, если есть запятая, кавычка или перевод строки
    static String escape(String value) {
        if (StringUtils.containsAny(value, ',', '"', '\r', '\n')) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
