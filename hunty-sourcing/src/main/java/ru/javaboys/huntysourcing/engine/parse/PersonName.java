package ru.javaboys.huntysourcing.engine.parse;

import lombok.Value;

@Value
public class PersonName {
    String fullName;
    String firstName;
    String lastName;

    public boolean isEmpty() {
        return fullName.isEmpty();
    }
}
