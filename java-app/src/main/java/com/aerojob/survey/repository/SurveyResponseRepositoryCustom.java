package com.aerojob.survey.repository;

import com.aerojob.survey.model.SurveyResponse;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Queries over responses that match both the canonical and the legacy link fields.
 */
public interface SurveyResponseRepositoryCustom {

    /**
     * Newest first. {@code participantId} may be {@code null} for all participants.
     */
    List<SurveyResponse> findForSurvey(String surveyId, String participantId);

    Optional<SurveyResponse> findForSurveyAndParticipant(String surveyId, String participantId);

    /**
     * Union of the survey ids referenced by the participant's responses through either link scheme.
     */
    Set<String> findAnsweredSurveyIds(String participantId);

    long deleteAllForSurvey(String surveyId);

    /**
     * Copies legacy link values into the canonical fields where those are missing.
     *
     * @return number of documents rewritten
     */
    long migrateLegacyReferences();
}
