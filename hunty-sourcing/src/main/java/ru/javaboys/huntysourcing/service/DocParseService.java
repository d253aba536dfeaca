package ru.javaboys.huntysourcing.service;

import org.springframework.lang.Nullable;

import java.io.InputStream;

public interface DocParseService {
    String parseToText(InputStream is, @Nullable String originalName);
}
