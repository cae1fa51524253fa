package com.aerojob.survey.model;

import com.aerojob.survey.support.SynonymKeys;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Survey lifecycle. Responses are accepted only while {@link #ACTIVE}.
 */
public enum SurveyStatus {
    DRAFT("draft"),
    ACTIVE("active", "published", "live", "open"),
    ARCHIVED("archived", "closed");

    private static final Map<String, SurveyStatus> LOOKUP = new HashMap<>();

    static {
        for (SurveyStatus status : values()) {
            LOOKUP.put(status.wireName, status);
            for (String synonym : status.synonyms) {
                LOOKUP.put(SynonymKeys.normalize(synonym), status);
            }
        }
    }

    private final String wireName;
    private final String[] synonyms;

    SurveyStatus(String wireName, String... synonyms) {
        this.wireName = wireName;
        this.synonyms = synonyms;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * A survey that has been opened never goes back to draft.
     */
    public boolean canTransitionTo(SurveyStatus next) {
        return this == next || this == DRAFT || next != DRAFT;
    }

    /**
     * Spellings that may be found in stored documents for this status.
     */
    public Set<String> storedForms() {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(wireName);
        forms.addAll(Arrays.asList(synonyms));
        return forms;
    }

    public static Optional<SurveyStatus> fold(String raw) {
        return Optional.ofNullable(LOOKUP.get(SynonymKeys.normalize(raw)));
    }
}
