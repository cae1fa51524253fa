package com.aerojob.survey.model;

import com.aerojob.survey.support.SynonymKeys;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public enum Role {
    STUDENT(Audience.STUDENTS, "student", "students"),
    ALUMNI(Audience.ALUMNI, "alumni", "alumnus", "alumnae", "alumna"),
    ADMIN(null, "admin", "administrator"),
    UNKNOWN(null);

    private static final Map<String, Role> LOOKUP = new HashMap<>();

    static {
        for (Role role : values()) {
            for (String name : role.names) {
                LOOKUP.put(name, role);
            }
        }
    }

    private final Audience audience;
    private final String[] names;

    Role(Audience audience, String... names) {
        this.audience = audience;
        this.names = names;
    }

    /**
     * Audience bucket the role belongs to, beyond {@link Audience#ALL}.
     */
    public Optional<Audience> audience() {
        return Optional.ofNullable(audience);
    }

    public static Role fold(String raw) {
        return LOOKUP.getOrDefault(SynonymKeys.normalize(raw), UNKNOWN);
    }
}
