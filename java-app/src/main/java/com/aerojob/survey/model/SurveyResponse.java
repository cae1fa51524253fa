package com.aerojob.survey.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One participant's answers to one survey. Written once; never updated.
 *
 * <p>{@code surveyId} and {@code participantId} are the canonical links. Documents created by
 * earlier releases link through {@code survey}, {@code user} and {@code userId} instead; those
 * fields are mapped read-only here so queries can match either scheme. New code never writes them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "surveyresponses")
public class SurveyResponse {

    @Id
    private String id;

    @Field(targetType = FieldType.OBJECT_ID)
    private String surveyId;

    @Field(targetType = FieldType.OBJECT_ID)
    private String participantId;

    @JsonIgnore
    @Field(value = "survey", targetType = FieldType.OBJECT_ID)
    private String legacySurvey;

    @JsonIgnore
    @Field(value = "user", targetType = FieldType.OBJECT_ID)
    private String legacyUser;

    @JsonIgnore
    @Field(value = "userId", targetType = FieldType.OBJECT_ID)
    private String legacyUserId;

    @Builder.Default
    private List<Answer> answers = new ArrayList<>();

    @CreatedDate
    private LocalDateTime createdAt;

    public String resolvedSurveyId() {
        return surveyId != null ? surveyId : legacySurvey;
    }

    public String resolvedParticipantId() {
        if (participantId != null) {
            return participantId;
        }
        return legacyUser != null ? legacyUser : legacyUserId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Answer {

        @Field(targetType = FieldType.OBJECT_ID)
        private String questionId;

        /** String, number or list of strings; see {@link AnswerValue}. */
        private Object value;
    }
}
