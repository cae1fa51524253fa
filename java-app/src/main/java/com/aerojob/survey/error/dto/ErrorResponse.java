package com.aerojob.survey.error.dto;

import com.aerojob.survey.error.ErrorCode;
import com.aerojob.survey.error.exception.BaseException;
import com.aerojob.survey.error.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int status, String code, String message, String question, LocalDateTime timestamp) {

    /**
     * Business failures keep their formatted message; validation failures also name the question.
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
        String question = e instanceof ValidationException ? ((ValidationException) e).getQuestionText() : null;
        return ResponseEntity
                .status(e.getErrorCode().getStatus())
                .body(ErrorResponse.builder()
                        .status(e.getErrorCode().getStatus().value())
                        .code(e.getErrorCode().getCode())
                        .message(e.getMessage())
                        .question(question)
                        .timestamp(LocalDateTime.now())
                        .build());
    }

    /**
     * Unexpected failures only expose the code's default message.
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ErrorResponse.builder()
                        .status(errorCode.getStatus().value())
                        .code(errorCode.getCode())
                        .message(errorCode.getMessage())
                        .timestamp(LocalDateTime.now())
                        .build());
    }
}
