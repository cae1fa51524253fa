package com.aerojob.survey.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Survey definition as sent by the admin UI. Enum-like fields arrive as free strings
 * and are folded by {@link com.aerojob.survey.service.SurveyNormalizer}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SurveyRequest {
    private String title;
    private String description;
    private String audience;
    private String status;
    private List<QuestionRequest> questions;
}
