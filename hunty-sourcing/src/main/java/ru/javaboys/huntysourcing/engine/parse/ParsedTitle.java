package ru.javaboys.huntysourcing.engine.parse;

import lombok.Value;

@Value
public class ParsedTitle {
    String name;
    String roleCompany; // "title - company" или "title at company", может быть пустым
}
