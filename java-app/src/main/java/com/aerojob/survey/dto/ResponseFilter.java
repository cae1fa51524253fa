package com.aerojob.survey.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResponseFilter {
    String role;
    String participantId;

    public static ResponseFilter none() {
        return ResponseFilter.builder().build();
    }
}
