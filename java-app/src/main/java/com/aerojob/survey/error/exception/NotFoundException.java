package com.aerojob.survey.error.exception;

import com.aerojob.survey.error.SurveyErrorCode;

/**
 * A survey or response is absent, or exists but is not visible to the caller.
 * Ineligible surveys are reported through this type too so that their existence is not revealed.
 */
public class NotFoundException extends BaseException {

    public NotFoundException(SurveyErrorCode errorCode) {
        super(errorCode);
    }

    public static NotFoundException survey() {
        return new NotFoundException(SurveyErrorCode.SURVEY_NOT_FOUND);
    }

    public static NotFoundException notEligible() {
        return new NotFoundException(SurveyErrorCode.SURVEY_NOT_ELIGIBLE);
    }

    public static NotFoundException response() {
        return new NotFoundException(SurveyErrorCode.RESPONSE_NOT_FOUND);
    }
}
