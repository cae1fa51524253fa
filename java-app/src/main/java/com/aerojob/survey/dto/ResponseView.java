package com.aerojob.survey.dto;

import com.aerojob.survey.model.SurveyResponse;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Admin listing row: a response joined with its participant.
 */
@Value
@Builder
public class ResponseView {
    String id;
    String surveyId;
    String participantId;
    String role;
    ParticipantSummary participant;
    List<SurveyResponse.Answer> answers;
    LocalDateTime createdAt;

    public static ResponseView of(SurveyResponse response, ParticipantSummary participant) {
        return ResponseView.builder()
                .id(response.getId())
                .surveyId(response.resolvedSurveyId())
                .participantId(response.resolvedParticipantId())
                .role(participant != null ? participant.getRole() : null)
                .participant(participant)
                .answers(response.getAnswers())
                .createdAt(response.getCreatedAt())
                .build();
    }
}
