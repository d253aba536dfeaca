package ru.javaboys.huntysourcing.email;

import org.springframework.lang.Nullable;

public interface EmailFinder {
    @Nullable
    String findEmail(String firstName, String lastName, String domain);
}
