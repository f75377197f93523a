package com.company.clientpulse.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Typed value carried in {@link CheckResult#getDetails()}. A detail is either free text,
 * a number or a list of strings; node listings are text with one node per line or a list.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DetailValue {

    public enum Kind {
        TEXT,
        NUMBER,
        LIST
    }

    private final Kind kind;
    private final String text;
    private final Double number;
    private final List<String> items;

    private DetailValue(Kind kind, String text, Double number, List<String> items) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.items = items;
    }

    public static DetailValue text(String text) {
        return new DetailValue(Kind.TEXT, text == null ? "" : text, null, List.of());
    }

    public static DetailValue number(double number) {
        return new DetailValue(Kind.NUMBER, null, number, List.of());
    }

    public static DetailValue list(List<String> items) {
        return new DetailValue(Kind.LIST, null, null, items == null ? List.of() : List.copyOf(items));
    }

    /**
     * Lines of a text or list value; numbers have no lines.
     */
    public List<String> lines() {
        switch (kind) {
            case TEXT:
                return Arrays.asList(text.split("\n"));
            case LIST:
                return items;
            default:
                return List.of();
        }
    }

    /**
     * Keeps only the lines accepted by the filter. Returns null when a text or list value
     * has nothing left; numbers are returned unchanged.
     */
    public DetailValue retainLines(Predicate<String> filter) {
        if (kind == Kind.NUMBER) {
            return this;
        }
        List<String> kept = lines().stream().filter(filter).collect(Collectors.toList());
        if (kept.isEmpty()) {
            return null;
        }
        return kind == Kind.TEXT ? text(String.join("\n", kept)) : list(kept);
    }

    public String asText() {
        switch (kind) {
            case TEXT:
                return text;
            case LIST:
                return String.join("\n", items);
            default:
                return number % 1 == 0 ? String.valueOf(number.longValue()) : String.valueOf(number);
        }
    }
}
