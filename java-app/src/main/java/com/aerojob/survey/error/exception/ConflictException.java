package com.aerojob.survey.error.exception;

import com.aerojob.survey.error.SurveyErrorCode;
import lombok.Getter;

@Getter
public class ConflictException extends BaseException {

    private final String surveyId;
    private final String participantId;

    public ConflictException(String surveyId, String participantId) {
        super(SurveyErrorCode.ALREADY_ANSWERED);
        this.surveyId = surveyId;
        this.participantId = participantId;
    }
}
