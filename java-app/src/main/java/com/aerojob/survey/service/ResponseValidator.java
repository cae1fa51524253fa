package com.aerojob.survey.service;

import com.aerojob.survey.error.exception.ValidationException;
import com.aerojob.survey.model.AnswerValue;
import com.aerojob.survey.model.Question;
import com.aerojob.survey.model.QuestionType;
import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a raw answer payload onto a survey's question bank and enforces required questions.
 *
 * <p>Each raw entry is either an object naming its question ({@code questionId}, or {@code qid} from
 * older clients) or a bare value that belongs to the question at the same position. Entries that name
 * no known question are dropped; for repeated questions the last entry wins.
 *
 * <p>Questions are checked in bank order and the first failing one aborts validation.
 */
@Slf4j
@Component
public class ResponseValidator {

    private static final String QUESTION_ID_KEY = "questionId";
    private static final String LEGACY_QUESTION_ID_KEY = "qid";
    private static final String VALUE_KEY = "value";

    public List<SurveyResponse.Answer> validate(Survey survey, List<Object> rawAnswers) {
        Map<String, Object> byQuestion = resolve(survey, rawAnswers == null ? Collections.emptyList() : rawAnswers);

        List<SurveyResponse.Answer> normalized = new ArrayList<>();
        for (Question question : survey.getQuestions()) {
            Object raw = byQuestion.get(question.getId());
            if (raw == null) {
                if (question.isRequired()) {
                    throw ValidationException.requiredQuestion(question.getText());
                }
                continue;
            }

            AnswerValue value = toValue(question, raw);
            if (value.isEmpty()) {
                if (question.isRequired()) {
                    throw ValidationException.requiredQuestion(question.getText());
                }
            } else {
                checkType(question, value);
            }
            normalized.add(new SurveyResponse.Answer(question.getId(), value.toStorage()));
        }
        return normalized;
    }

    private Map<String, Object> resolve(Survey survey, List<Object> rawAnswers) {
        List<Question> questions = survey.getQuestions();
        Map<String, Object> byQuestion = new HashMap<>();

        for (int i = 0; i < rawAnswers.size(); i++) {
            Object entry = rawAnswers.get(i);
            String questionId;
            Object value;

            if (entry instanceof Map && isExplicit((Map<?, ?>) entry)) {
                Map<?, ?> explicit = (Map<?, ?>) entry;
                questionId = idText(explicit.get(QUESTION_ID_KEY));
                if (!StringUtils.hasText(questionId)) {
                    questionId = idText(explicit.get(LEGACY_QUESTION_ID_KEY));
                }
                value = explicit.get(VALUE_KEY);
                if (survey.findQuestion(questionId).isEmpty()) {
                    log.debug("Dropping answer for unknown question {} on survey {}", questionId, survey.getId());
                    continue;
                }
            } else if (i < questions.size()) {
                questionId = questions.get(i).getId();
                value = entry;
            } else {
                log.debug("Dropping positional answer #{} beyond the {} questions of survey {}",
                        i, questions.size(), survey.getId());
                continue;
            }
            byQuestion.put(questionId, value);
        }
        return byQuestion;
    }

    private static String idText(Object id) {
        return id == null ? null : id.toString().trim();
    }

    private static boolean isExplicit(Map<?, ?> entry) {
        return entry.containsKey(QUESTION_ID_KEY) || entry.containsKey(LEGACY_QUESTION_ID_KEY);
    }

    private static AnswerValue toValue(Question question, Object raw) {
        try {
            return AnswerValue.from(raw);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidAnswer(question.getText(), e.getMessage());
        }
    }

    private static void checkType(Question question, AnswerValue value) {
        QuestionType type = question.questionType();
        if (value.getKind() == AnswerValue.Kind.TEXT_LIST && type != QuestionType.CHECKBOX) {
            throw ValidationException.invalidAnswer(question.getText(), "only checkbox questions take several values");
        }
        if (type == QuestionType.RATING && !value.isNumeric()) {
            throw ValidationException.invalidAnswer(question.getText(), "rating must be a number");
        }
    }
}
