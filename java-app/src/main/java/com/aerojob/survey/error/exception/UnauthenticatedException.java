package com.aerojob.survey.error.exception;

import com.aerojob.survey.error.SurveyErrorCode;

public class UnauthenticatedException extends BaseException {

    private UnauthenticatedException(SurveyErrorCode errorCode) {
        super(errorCode);
    }

    private UnauthenticatedException(SurveyErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public static UnauthenticatedException missingCredential() {
        return new UnauthenticatedException(SurveyErrorCode.NOT_AUTHENTICATED);
    }

    public static UnauthenticatedException invalidCredential(Throwable cause) {
        return new UnauthenticatedException(SurveyErrorCode.INVALID_CREDENTIAL, cause);
    }

    public static UnauthenticatedException invalidCredential() {
        return new UnauthenticatedException(SurveyErrorCode.INVALID_CREDENTIAL);
    }
}
