package com.aerojob.survey.service;

import com.aerojob.survey.error.exception.NotFoundException;
import com.aerojob.survey.model.Audience;
import com.aerojob.survey.model.Role;
import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyStatus;
import com.aerojob.survey.repository.SurveyRepository;
import com.aerojob.survey.security.Caller;
import com.aerojob.survey.support.ObjectIds;
import com.aerojob.survey.support.SynonymKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which surveys a caller may see and answer: active, aimed at everyone or at the caller's
 * audience bucket, and not yet answered by the caller.
 *
 * <p>Non-admin lookups of a survey that fails this test are reported as not found, whatever the reason.
 */
@Service
@RequiredArgsConstructor
public class EligibilityResolver {

    private static final String ACTIVE_PATTERN = SynonymKeys.anyOfPattern(SurveyStatus.ACTIVE.storedForms(), false);
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final SurveyRepository surveyRepository;
    private final ResponseStore responseStore;

    public List<Survey> eligibleSurveys(Caller caller) {
        List<Survey> active = surveyRepository.findByStatusAndAudienceMatching(
                ACTIVE_PATTERN, SynonymKeys.anyOfPattern(audienceForms(caller.role()), true), NEWEST_FIRST);
        Set<String> answered = caller.isAnonymous()
                ? Set.of()
                : responseStore.answeredSurveyIds(caller.participantId());
        return active.stream()
                .filter(s -> isOpenTo(s, caller.role()))
                .filter(s -> !answered.contains(s.getId()))
                .collect(Collectors.toList());
    }

    public boolean isEligible(Survey survey, Caller caller) {
        if (!isOpenTo(survey, caller.role())) {
            return false;
        }
        return caller.isAnonymous() || !responseStore.hasResponded(survey.getId(), caller.participantId());
    }

    /**
     * Survey detail as the caller is allowed to see it. Admins see every survey.
     */
    public Survey visibleSurvey(String surveyId, Caller caller) {
        if (caller.isAdmin()) {
            ObjectIds.requireValid(surveyId, "survey");
            return surveyRepository.findById(surveyId).orElseThrow(NotFoundException::survey);
        }
        Optional<Survey> survey = findSurvey(surveyId);
        if (survey.isEmpty() || !isEligible(survey.get(), caller)) {
            throw NotFoundException.notEligible();
        }
        return survey.get();
    }

    /**
     * Survey the caller may submit to. Whether the caller already answered is left to
     * {@link ResponseStore#submit}, which reports it as a conflict.
     */
    public Survey submittableSurvey(String surveyId, Caller caller) {
        return findSurvey(surveyId)
                .filter(s -> isOpenTo(s, caller.role()))
                .orElseThrow(NotFoundException::notEligible);
    }

    private Optional<Survey> findSurvey(String surveyId) {
        ObjectIds.requireValid(surveyId, "survey");
        return surveyRepository.findById(surveyId);
    }

    private static boolean isOpenTo(Survey survey, Role role) {
        if (!survey.isActive()) {
            return false;
        }
        Optional<Audience> audience = survey.audienceValue();
        if (audience.isEmpty()) {
            return false;
        }
        return audience.get() == Audience.ALL || role.audience().filter(a -> a == audience.get()).isPresent();
    }

    static Set<String> audienceForms(Role role) {
        Set<String> forms = new LinkedHashSet<>(Audience.ALL.storedForms());
        role.audience().ifPresent(a -> forms.addAll(a.storedForms()));
        return forms;
    }
}
