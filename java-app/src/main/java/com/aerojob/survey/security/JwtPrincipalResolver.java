package com.aerojob.survey.security;

import com.aerojob.survey.error.exception.UnauthenticatedException;
import com.aerojob.survey.model.Participant;
import com.aerojob.survey.model.Role;
import com.aerojob.survey.repository.ParticipantRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import javax.servlet.http.Cookie;
import javax.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Verifies HS256 bearer tokens issued by the account service.
 * The subject (or the {@code id} claim of older tokens) is the participant id. The role comes from
 * {@code role} or {@code userType}; tokens carrying neither get the role stored on the participant's account.
 */
@Slf4j
@Component
public class JwtPrincipalResolver implements PrincipalResolver {

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String TOKEN_COOKIE = "token";
    private static final String LEGACY_ROLE_CLAIM = "userType";
    private static final String LEGACY_ID_CLAIM = "id";

    private final SecretKey secretKey;
    private final String roleClaim;
    private final ParticipantRepository participantRepository;

    public JwtPrincipalResolver(
            @Value("${auth.jwt.secret}") String secret,
            @Value("${auth.jwt.role-claim:role}") String roleClaim,
            ParticipantRepository participantRepository) {
        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException("JWT secret must be at least 32 characters for HS256");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.roleClaim = roleClaim;
        this.participantRepository = participantRepository;
    }

    @Override
    public Optional<Caller> resolve(HttpServletRequest request) {
        String token = extractToken(request);
        if (token == null) {
            return Optional.empty();
        }

        Claims claims;
        try {
            claims = Jwts.parser().verifyWith(secretKey).build().parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw UnauthenticatedException.invalidCredential(e);
        }

        String subject = claims.getSubject();
        if (!StringUtils.hasText(subject)) {
            Object legacyId = claims.get(LEGACY_ID_CLAIM);
            subject = legacyId == null ? null : legacyId.toString();
        }
        if (subject == null || !ObjectId.isValid(subject)) {
            throw UnauthenticatedException.invalidCredential();
        }
        String role = claims.get(roleClaim, String.class);
        if (!StringUtils.hasText(role)) {
            role = claims.get(LEGACY_ROLE_CLAIM, String.class);
        }
        if (!StringUtils.hasText(role)) {
            role = storedRole(subject);
        }
        return Optional.of(Caller.of(subject, Role.fold(role)));
    }

    private String storedRole(String participantId) {
        Participant participant = participantRepository.findById(participantId)
                .orElseThrow(UnauthenticatedException::invalidCredential);
        return participant.roleName();
    }

    private String extractToken(HttpServletRequest request) {
        String header = request.getHeader(AUTHORIZATION_HEADER);
        if (StringUtils.hasText(header) && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (TOKEN_COOKIE.equals(cookie.getName()) && StringUtils.hasText(cookie.getValue())) {
                    return cookie.getValue();
                }
            }
        }
        return null;
    }
}
