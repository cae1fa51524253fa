package com.aerojob.survey.error.exception;

import com.aerojob.survey.error.SurveyErrorCode;

public class InvalidReferenceException extends BaseException {

    public InvalidReferenceException(String kind, String value) {
        super(SurveyErrorCode.INVALID_REFERENCE, kind, value);
    }
}
