package com.aerojob.survey.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SurveyFilter {
    /** Matched case-insensitively against the stored status. */
    String status;
    /** Case-insensitive substring of the title. */
    String titleQuery;
}
