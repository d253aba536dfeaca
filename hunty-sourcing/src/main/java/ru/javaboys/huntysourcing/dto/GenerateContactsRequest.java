package ru.javaboys.huntysourcing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Campaign form as the recruiter fills it in: lists are comma separated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateContactsRequest {
    @Builder.Default
    private String name = "Untitled Campaign";
    @Builder.Default
    private String companyList = "";
    @Builder.Default
    private String titleKeywords = "";
    @Builder.Default
    private String locationList = "";
    @Builder.Default
    private String targetSchools = "";
    @Builder.Default
    private String seniorityLevels = "";
    @Builder.Default
    private int targetCount = 10;
    @Builder.Default
    private boolean avoidDuplicates = true;
    @Builder.Default
    private Set<String> previouslyContactedEmails = new HashSet<>();
    private String jobDescription; // может быть null
}
