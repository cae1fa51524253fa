package com.aerojob.survey.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum SurveyErrorCode implements ErrorCode {
    // 4xx
    INVALID_INPUT("C001", "Invalid data: %s", HttpStatus.BAD_REQUEST),
    INVALID_REFERENCE("C002", "Invalid %s id: %s", HttpStatus.BAD_REQUEST),
    REQUIRED_QUESTION_UNANSWERED("C003", "Question \"%s\" is required.", HttpStatus.BAD_REQUEST),
    INVALID_ANSWER("C004", "Question \"%s\": %s", HttpStatus.BAD_REQUEST),
    SURVEY_NOT_FOUND("C005", "Survey not found", HttpStatus.NOT_FOUND),
    SURVEY_NOT_ELIGIBLE("C006", "Survey not found or not eligible", HttpStatus.NOT_FOUND),
    RESPONSE_NOT_FOUND("C007", "Response not found", HttpStatus.NOT_FOUND),
    ALREADY_ANSWERED("C008", "Survey already answered", HttpStatus.CONFLICT),
    NOT_AUTHENTICATED("C009", "Not authenticated", HttpStatus.UNAUTHORIZED),
    INVALID_CREDENTIAL("C010", "Token is not valid", HttpStatus.UNAUTHORIZED),
    ADMIN_REQUIRED("C011", "Access denied. Admin privileges required.", HttpStatus.FORBIDDEN),
    METHOD_NOT_ALLOWED("C012", "Method not allowed", HttpStatus.METHOD_NOT_ALLOWED),
    NOT_ACCEPTABLE("C013", "Requested representation not available", HttpStatus.NOT_ACCEPTABLE),
    UNSUPPORTED_MEDIA_TYPE("C014", "Unsupported content type", HttpStatus.UNSUPPORTED_MEDIA_TYPE),

    // 5xx
    INTERNAL_SERVER_ERROR("S001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR),
    EXPORT_FAILURE("S002", "Failed to export responses for survey %s", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
