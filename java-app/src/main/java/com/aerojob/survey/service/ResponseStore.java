package com.aerojob.survey.service;

import com.aerojob.survey.dto.ParticipantSummary;
import com.aerojob.survey.dto.ResponseFilter;
import com.aerojob.survey.dto.ResponseView;
import com.aerojob.survey.error.exception.ConflictException;
import com.aerojob.survey.error.exception.NotFoundException;
import com.aerojob.survey.model.Participant;
import com.aerojob.survey.model.Role;
import com.aerojob.survey.model.SurveyResponse;
import com.aerojob.survey.repository.ParticipantRepository;
import com.aerojob.survey.repository.SurveyResponseRepository;
import com.aerojob.survey.support.ObjectIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Persists at most one response per survey and participant.
 *
 * <p>The unique index on {@code (surveyId, participantId)} decides which of two concurrent submissions
 * wins. The lookup before the insert only spares the common case a round trip to a failing write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseStore {

    private final SurveyResponseRepository responseRepository;
    private final ParticipantRepository participantRepository;
    private final ResponseCsvExporter csvExporter;

    public SurveyResponse submit(String surveyId, String participantId, List<SurveyResponse.Answer> answers) {
        if (hasResponded(surveyId, participantId)) {
            throw new ConflictException(surveyId, participantId);
        }

        SurveyResponse response = SurveyResponse.builder()
                .surveyId(surveyId)
                .participantId(participantId)
                .answers(answers)
                .build();
        try {
            SurveyResponse saved = responseRepository.insert(response);
            log.info("Stored response {} for survey {} (participant={}, answers={})",
                    saved.getId(), surveyId, participantId, answers.size());
            return saved;
        } catch (DuplicateKeyException e) {
            log.info("Concurrent duplicate response rejected for survey {} (participant={})", surveyId, participantId);
            throw new ConflictException(surveyId, participantId);
        }
    }

    /**
     * Removes a response that was stored for a survey deleted in the meantime.
     */
    public void discard(SurveyResponse response) {
        responseRepository.delete(response);
        log.info("Discarded response {} stored for deleted survey {}", response.getId(), response.resolvedSurveyId());
    }

    public boolean hasResponded(String surveyId, String participantId) {
        return responseRepository.findForSurveyAndParticipant(surveyId, participantId).isPresent();
    }

    public Optional<SurveyResponse> findFor(String surveyId, String participantId) {
        return responseRepository.findForSurveyAndParticipant(surveyId, participantId);
    }

    public Set<String> answeredSurveyIds(String participantId) {
        return responseRepository.findAnsweredSurveyIds(participantId);
    }

    /**
     * Responses joined with their participants, newest first.
     */
    public List<ResponseView> forSurvey(String surveyId, ResponseFilter filter) {
        List<SurveyResponse> responses = responseRepository.findForSurvey(surveyId, filter.getParticipantId());

        Set<String> participantIds = responses.stream()
                .map(SurveyResponse::resolvedParticipantId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, Participant> participants = StreamSupport
                .stream(participantRepository.findAllById(participantIds).spliterator(), false)
                .collect(Collectors.toMap(Participant::getId, Function.identity(), (a, b) -> a));

        return responses.stream()
                .map(r -> {
                    Participant participant = participants.get(r.resolvedParticipantId());
                    return ResponseView.of(r, participant == null ? null : ParticipantSummary.from(participant));
                })
                .filter(view -> matchesRole(view.getRole(), filter.getRole()))
                .collect(Collectors.toList());
    }

    public byte[] exportCsv(String surveyId) {
        return csvExporter.export(surveyId, forSurvey(surveyId, ResponseFilter.none()));
    }

    public long deleteAllForSurvey(String surveyId) {
        return responseRepository.deleteAllForSurvey(surveyId);
    }

    public void delete(String responseId) {
        ObjectIds.requireValid(responseId, "response");
        SurveyResponse response = responseRepository.findById(responseId).orElseThrow(NotFoundException::response);
        responseRepository.delete(response);
        log.info("Deleted response {} of survey {}", response.getId(), response.resolvedSurveyId());
    }

    private static boolean matchesRole(String actual, String wanted) {
        if (!StringUtils.hasText(wanted)) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        Role wantedRole = Role.fold(wanted);
        if (wantedRole != Role.UNKNOWN) {
            return Role.fold(actual) == wantedRole;
        }
        return actual.trim().equalsIgnoreCase(wanted.trim());
    }
}
