package com.aerojob.survey.model;

import com.aerojob.survey.support.SynonymKeys;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Question type with the accepted input spellings. Anything not listed folds to {@link #SHORT_TEXT}.
 */
public enum QuestionType {
    SHORT_TEXT("short_text", "shorttext", "text", "input", "single line"),
    LONG_TEXT("long_text", "longtext", "textarea", "paragraph"),
    MULTIPLE_CHOICE("multiple_choice", "radio", "single select", "single"),
    CHECKBOX("checkbox", "multi select", "multiple", "multi"),
    RATING("rating", "stars", "scale");

    private static final Map<String, QuestionType> LOOKUP = new HashMap<>();

    static {
        for (QuestionType type : values()) {
            LOOKUP.put(SynonymKeys.normalize(type.wireName), type);
            for (String synonym : type.synonyms) {
                LOOKUP.put(SynonymKeys.normalize(synonym), type);
            }
        }
    }

    private final String wireName;
    private final String[] synonyms;

    QuestionType(String wireName, String... synonyms) {
        this.wireName = wireName;
        this.synonyms = synonyms;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isChoice() {
        return this == MULTIPLE_CHOICE || this == CHECKBOX;
    }

    public static QuestionType fold(String raw) {
        return LOOKUP.getOrDefault(SynonymKeys.normalize(raw), SHORT_TEXT);
    }
}
