package com.aerojob.survey.error.exception;

import com.aerojob.survey.error.SurveyErrorCode;
import lombok.Getter;

/**
 * Malformed survey definition or incomplete answer payload.
 */
@Getter
public class ValidationException extends BaseException {

    /** Text of the offending question, or {@code null} for survey-level problems. */
    private final String questionText;

    private ValidationException(SurveyErrorCode errorCode, String questionText, Object... args) {
        super(errorCode, args);
        this.questionText = questionText;
    }

    public static ValidationException invalidInput(String detail) {
        return new ValidationException(SurveyErrorCode.INVALID_INPUT, null, detail);
    }

    public static ValidationException requiredQuestion(String questionText) {
        return new ValidationException(SurveyErrorCode.REQUIRED_QUESTION_UNANSWERED, questionText, questionText);
    }

    public static ValidationException invalidAnswer(String questionText, String detail) {
        return new ValidationException(SurveyErrorCode.INVALID_ANSWER, questionText, questionText, detail);
    }
}
