package com.aerojob.survey.service;

import com.aerojob.survey.dto.SurveyFilter;
import com.aerojob.survey.dto.SurveyRequest;
import com.aerojob.survey.error.exception.NotFoundException;
import com.aerojob.survey.error.exception.ValidationException;
import com.aerojob.survey.model.Question;
import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyStatus;
import com.aerojob.survey.repository.SurveyRepository;
import com.aerojob.survey.support.ObjectIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns survey documents and their lifecycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurveyRegistry {

    private final SurveyRepository surveyRepository;
    private final SurveyNormalizer normalizer;
    private final ResponseStore responseStore;
    private final SurveyEventPublisher eventPublisher;

    public Survey create(SurveyRequest request, String createdBy) {
        Survey survey = normalizer.normalize(request);
        if (survey.getStatus() == null) {
            survey.setStatus(SurveyStatus.DRAFT.wireName());
        }
        survey.getQuestions().forEach(q -> q.setId(ObjectIds.newId()));
        survey.setCreatedBy(createdBy);

        Survey saved = surveyRepository.save(survey);
        log.info("Created survey {} '{}' ({} questions, status={}, audience={})",
                saved.getId(), saved.getTitle(), saved.getQuestions().size(), saved.getStatus(), saved.getAudience());
        return saved;
    }

    /**
     * Replaces the definition. A question keeps its id only when the request sends the id of a question
     * this survey already has; anything else gets a fresh id.
     */
    public Survey update(String surveyId, SurveyRequest request) {
        Survey existing = get(surveyId);
        Survey incoming = normalizer.normalize(request);

        if (incoming.getStatus() != null) {
            SurveyStatus current = SurveyStatus.fold(existing.getStatus()).orElse(SurveyStatus.DRAFT);
            SurveyStatus next = SurveyStatus.fold(incoming.getStatus()).orElse(current);
            if (!current.canTransitionTo(next)) {
                throw ValidationException.invalidInput(
                        "survey cannot move from " + current.wireName() + " to " + next.wireName());
            }
            existing.setStatus(next.wireName());
        }

        Set<String> knownIds = existing.getQuestions().stream()
                .map(Question::getId)
                .collect(Collectors.toSet());
        Set<String> claimed = new HashSet<>();
        for (Question question : incoming.getQuestions()) {
            String id = question.getId();
            if (id == null || !knownIds.contains(id) || !claimed.add(id)) {
                question.setId(ObjectIds.newId());
            }
        }

        existing.setTitle(incoming.getTitle());
        existing.setDescription(incoming.getDescription());
        existing.setAudience(incoming.getAudience());
        existing.setQuestions(incoming.getQuestions());

        Survey saved = surveyRepository.save(existing);
        log.info("Updated survey {} (status={}, {} questions)", saved.getId(), saved.getStatus(), saved.getQuestions().size());
        return saved;
    }

    /**
     * Deletes the survey and every response linked to it.
     */
    public void delete(String surveyId) {
        Survey survey = get(surveyId);
        surveyRepository.delete(survey);
        long removed = responseStore.deleteAllForSurvey(survey.getId());
        log.info("Deleted survey {} and {} responses", survey.getId(), removed);
        eventPublisher.publishSurveyDeleted(survey.getId(), removed);
    }

    public Survey get(String surveyId) {
        ObjectIds.requireValid(surveyId, "survey");
        return surveyRepository.findById(surveyId).orElseThrow(NotFoundException::survey);
    }

    public List<Survey> list(SurveyFilter filter) {
        return surveyRepository.search(filter);
    }
}
