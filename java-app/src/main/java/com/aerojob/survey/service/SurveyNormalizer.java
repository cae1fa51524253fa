package com.aerojob.survey.service;

import com.aerojob.survey.dto.QuestionRequest;
import com.aerojob.survey.dto.SurveyRequest;
import com.aerojob.survey.error.exception.ValidationException;
import com.aerojob.survey.model.Audience;
import com.aerojob.survey.model.Question;
import com.aerojob.survey.model.QuestionType;
import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns loose admin input into a survey document: free text trimmed, enum-like fields folded
 * through their synonym tables, options kept only on choice questions.
 * Question ids are carried over as sent; {@link SurveyRegistry} decides which ones survive.
 */
@Component
public class SurveyNormalizer {

    /**
     * @return a survey without id or timestamps; {@code status} is {@code null} when the request omits it
     */
    public Survey normalize(SurveyRequest request) {
        if (request == null) {
            throw ValidationException.invalidInput("survey body is missing");
        }

        String title = trim(request.getTitle());
        if (title.isEmpty()) {
            throw ValidationException.invalidInput("title is required");
        }

        Audience audience = Audience.fold(request.getAudience())
                .orElseThrow(() -> ValidationException.invalidInput("unknown audience '" + request.getAudience() + "'"));

        String status = null;
        if (StringUtils.hasText(request.getStatus())) {
            status = SurveyStatus.fold(request.getStatus())
                    .orElseThrow(() -> ValidationException.invalidInput("unknown status '" + request.getStatus() + "'"))
                    .wireName();
        }

        return Survey.builder()
                .title(title)
                .description(trim(request.getDescription()))
                .audience(audience.wireName())
                .status(status)
                .questions(normalizeQuestions(request.getQuestions()))
                .build();
    }

    private List<Question> normalizeQuestions(List<QuestionRequest> requested) {
        List<Question> questions = new ArrayList<>();
        if (requested == null) {
            return questions;
        }
        for (int i = 0; i < requested.size(); i++) {
            QuestionRequest q = requested.get(i);
            int position = i + 1;
            if (q == null) {
                throw ValidationException.invalidInput("question " + position + " is empty");
            }

            String text = q.getText() == null ? "Q" + position : q.getText().trim();
            if (text.isEmpty()) {
                throw ValidationException.invalidInput("question " + position + " has no text");
            }

            QuestionType type = QuestionType.fold(q.getType());
            questions.add(Question.builder()
                    .id(StringUtils.hasText(q.getId()) ? q.getId().trim() : null)
                    .text(text)
                    .type(type.wireName())
                    .required(Boolean.TRUE.equals(q.getRequired()))
                    .options(type.isChoice() ? normalizeOptions(q.getOptions()) : new ArrayList<>())
                    .build());
        }
        return questions;
    }

    private List<String> normalizeOptions(List<String> options) {
        if (options == null) {
            return new ArrayList<>();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String option : options) {
            String trimmed = trim(option);
            if (!trimmed.isEmpty()) {
                distinct.add(trimmed);
            }
        }
        return new ArrayList<>(distinct);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
