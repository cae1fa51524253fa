package com.aerojob.survey.service;

import com.aerojob.survey.dto.ResponseFilter;
import com.aerojob.survey.dto.ResponseView;
import com.aerojob.survey.dto.SubmitResponseRequest;
import com.aerojob.survey.error.exception.NotFoundException;
import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyResponse;
import com.aerojob.survey.repository.SurveyRepository;
import com.aerojob.survey.security.Caller;
import com.aerojob.survey.support.ObjectIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Submission flow: eligibility, then validation against the question bank, then the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurveyResponseService {

    private final SurveyRepository surveyRepository;
    private final EligibilityResolver eligibilityResolver;
    private final ResponseValidator responseValidator;
    private final ResponseStore responseStore;
    private final SurveyEventPublisher eventPublisher;
    private final SubmissionAuditService auditService;

    public SurveyResponse submit(String surveyId, Caller caller, SubmitResponseRequest request) {
        caller.requireAuthenticated();
        Survey survey = eligibilityResolver.submittableSurvey(surveyId, caller);

        List<SurveyResponse.Answer> answers = responseValidator.validate(
                survey, request == null ? null : request.getAnswers());
        SurveyResponse saved = responseStore.submit(survey.getId(), caller.participantId(), answers);
        if (!surveyRepository.existsById(survey.getId())) {
            // survey deleted while this submission was in flight; its cascade may have missed the new response
            responseStore.discard(saved);
            throw NotFoundException.notEligible();
        }

        eventPublisher.publishResponseSubmitted(saved);
        auditService.recordSubmission(saved, caller);
        return saved;
    }

    public List<ResponseView> responsesFor(String surveyId, ResponseFilter filter) {
        requireSurvey(surveyId);
        String participantId = null;
        if (StringUtils.hasText(filter.getParticipantId())) {
            participantId = ObjectIds.requireValid(filter.getParticipantId().trim(), "participant");
        }
        return responseStore.forSurvey(surveyId, ResponseFilter.builder()
                .role(filter.getRole())
                .participantId(participantId)
                .build());
    }

    public byte[] exportCsv(String surveyId) {
        requireSurvey(surveyId);
        byte[] csv = responseStore.exportCsv(surveyId);
        log.info("Exported responses of survey {} ({} bytes)", surveyId, csv.length);
        return csv;
    }

    public Optional<SurveyResponse> myResponse(String surveyId, Caller caller) {
        caller.requireAuthenticated();
        ObjectIds.requireValid(surveyId, "survey");
        return responseStore.findFor(surveyId, caller.participantId());
    }

    public void deleteResponse(String responseId) {
        responseStore.delete(responseId);
    }

    private void requireSurvey(String surveyId) {
        ObjectIds.requireValid(surveyId, "survey");
        if (!surveyRepository.existsById(surveyId)) {
            throw NotFoundException.survey();
        }
    }
}
