package com.aerojob.survey.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Survey metadata plus its question bank. Audience and status are kept as stored strings
 * because documents written by older clients may hold synonyms or mixed case.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "surveys")
public class Survey {

    @Id
    private String id;

    private String title;

    @Builder.Default
    private String description = "";

    @Builder.Default
    private String audience = Audience.ALL.wireName();

    @Builder.Default
    private String status = SurveyStatus.DRAFT.wireName();

    @Builder.Default
    private List<Question> questions = new ArrayList<>();

    private String createdBy;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isActive() {
        return SurveyStatus.fold(status).orElse(null) == SurveyStatus.ACTIVE;
    }

    @JsonIgnore
    public Optional<Audience> audienceValue() {
        return Audience.fold(audience);
    }

    public Optional<Question> findQuestion(String questionId) {
        if (questionId == null) {
            return Optional.empty();
        }
        return questions.stream()
                .filter(q -> questionId.equals(q.getId()))
                .findFirst();
    }
}
