package com.aerojob.survey.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Answer value as one of three shapes: free text, a number, or a list of strings.
 * Built from the loosely typed JSON a client sends; booleans are read as text.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AnswerValue {

    public enum Kind {
        TEXT, NUMBER, TEXT_LIST
    }

    private final Kind kind;
    private final String text;
    private final Number number;
    private final List<String> items;

    private AnswerValue(Kind kind, String text, Number number, List<String> items) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.items = items;
    }

    public static AnswerValue text(String text) {
        return new AnswerValue(Kind.TEXT, text, null, null);
    }

    public static AnswerValue number(Number number) {
        return new AnswerValue(Kind.NUMBER, null, number, null);
    }

    public static AnswerValue items(List<String> items) {
        return new AnswerValue(Kind.TEXT_LIST, null, null, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    /**
     * @throws IllegalArgumentException for objects and nested lists, which no question type accepts
     */
    public static AnswerValue from(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("value is missing");
        }
        if (raw instanceof Number) {
            return number((Number) raw);
        }
        if (raw instanceof CharSequence || raw instanceof Boolean) {
            return text(raw.toString());
        }
        if (raw instanceof Collection) {
            List<String> items = new ArrayList<>();
            for (Object item : (Collection<?>) raw) {
                if (item == null) {
                    continue;
                }
                if (item instanceof Collection || item instanceof Map) {
                    throw new IllegalArgumentException("list entries must be plain values");
                }
                items.add(item.toString());
            }
            return items(items);
        }
        throw new IllegalArgumentException("unsupported value of type " + raw.getClass().getSimpleName());
    }

    /**
     * Absent, an empty list, or text that trims to nothing. Zero is not empty.
     */
    public boolean isEmpty() {
        switch (kind) {
            case TEXT:
                return text.trim().isEmpty();
            case TEXT_LIST:
                return items.isEmpty();
            default:
                return false;
        }
    }

    public boolean isNumeric() {
        if (kind == Kind.NUMBER) {
            return true;
        }
        if (kind != Kind.TEXT) {
            return false;
        }
        try {
            new BigDecimal(text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Plain value handed to the document mapper.
     */
    public Object toStorage() {
        switch (kind) {
            case NUMBER:
                return number;
            case TEXT_LIST:
                return new ArrayList<>(items);
            default:
                return text;
        }
    }
}
