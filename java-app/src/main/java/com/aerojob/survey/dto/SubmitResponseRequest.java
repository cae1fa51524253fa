package com.aerojob.survey.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Entries are either {@code {"questionId": ..., "value": ...}} objects (or {@code qid}),
 * or bare values matched to questions by position.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitResponseRequest {
    private List<Object> answers;
}
