package com.aerojob.survey.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestionRequest {

    /** Present when editing an existing question. */
    @JsonAlias("_id")
    private String id;

    private String text;
    private String type;
    private Boolean required;
    private List<String> options;
}
