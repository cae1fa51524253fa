package com.aerojob.survey.error.exception;

import com.aerojob.survey.error.SurveyErrorCode;

public class ExportException extends BaseException {

    public ExportException(String surveyId, Throwable cause) {
        super(SurveyErrorCode.EXPORT_FAILURE, cause, surveyId);
    }
}
