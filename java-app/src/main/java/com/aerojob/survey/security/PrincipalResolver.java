package com.aerojob.survey.security;

import javax.servlet.http.HttpServletRequest;
import java.util.Optional;

public interface PrincipalResolver {

    /**
     * @return empty when the request carries no credential
     * @throws com.aerojob.survey.error.exception.UnauthenticatedException when a credential is present but invalid
     */
    Optional<Caller> resolve(HttpServletRequest request);
}
