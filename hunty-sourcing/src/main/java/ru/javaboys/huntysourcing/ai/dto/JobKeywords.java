package ru.javaboys.huntysourcing.ai.dto;

import lombok.Data;

import java.util.List;

@Data
public class JobKeywords {
    private String jobTitle; // e.g., Leveraged Finance Associate
    private List<String> keywords; // desks, products, coverage groups
}
