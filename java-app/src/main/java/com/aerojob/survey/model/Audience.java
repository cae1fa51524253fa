package com.aerojob.survey.model;

import com.aerojob.survey.support.SynonymKeys;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Participant category a survey targets. Older survey documents may still carry a synonym
 * ("student", "alumnus", ...) as the stored value, so queries match on {@link #storedForms()}.
 */
public enum Audience {
    ALL("all", "everyone", "everybody", "any"),
    STUDENTS("students", "student"),
    ALUMNI("alumni", "alumnus", "alumnae", "alumna");

    private static final Map<String, Audience> LOOKUP = new HashMap<>();

    static {
        for (Audience audience : values()) {
            for (String form : audience.storedForms) {
                LOOKUP.put(SynonymKeys.normalize(form), audience);
            }
        }
    }

    private final String wireName;
    private final Set<String> storedForms;

    Audience(String wireName, String... synonyms) {
        this.wireName = wireName;
        Set<String> forms = new LinkedHashSet<>();
        forms.add(wireName);
        forms.addAll(Arrays.asList(synonyms));
        this.storedForms = Collections.unmodifiableSet(forms);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Set<String> storedForms() {
        return storedForms;
    }

    /**
     * Blank input means {@link #ALL}; an unrecognized value yields empty.
     */
    public static Optional<Audience> fold(String raw) {
        String key = SynonymKeys.normalize(raw);
        if (key.isEmpty()) {
            return Optional.of(ALL);
        }
        return Optional.ofNullable(LOOKUP.get(key));
    }
}
