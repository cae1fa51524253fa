package com.aerojob.survey.security;

import com.aerojob.survey.error.exception.ForbiddenException;
import com.aerojob.survey.error.exception.UnauthenticatedException;
import com.aerojob.survey.model.Role;

/**
 * The principal a request runs as. Anonymous callers have no participant id and {@link Role#UNKNOWN}.
 */
public record Caller(String participantId, Role role) {

    private static final Caller ANONYMOUS = new Caller(null, Role.UNKNOWN);

    public static Caller anonymous() {
        return ANONYMOUS;
    }

    public static Caller of(String participantId, Role role) {
        return new Caller(participantId, role == null ? Role.UNKNOWN : role);
    }

    public boolean isAnonymous() {
        return participantId == null;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public Caller requireAuthenticated() {
        if (isAnonymous()) {
            throw UnauthenticatedException.missingCredential();
        }
        return this;
    }

    public Caller requireAdmin() {
        requireAuthenticated();
        if (!isAdmin()) {
            throw new ForbiddenException();
        }
        return this;
    }
}
