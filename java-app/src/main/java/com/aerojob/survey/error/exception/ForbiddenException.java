package com.aerojob.survey.error.exception;

import com.aerojob.survey.error.SurveyErrorCode;

public class ForbiddenException extends BaseException {

    public ForbiddenException() {
        super(SurveyErrorCode.ADMIN_REQUIRED);
    }
}
