package com.aerojob.survey.error;

import com.aerojob.survey.error.dto.ErrorResponse;
import com.aerojob.survey.error.exception.BaseException;
import com.aerojob.survey.error.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseException.class)
    protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
        if (e.getErrorCode().getStatus().is5xxServerError()) {
            log.error("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    protected ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(ValidationException.invalidInput("malformed request"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    protected ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        log.warn("Method not supported: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(SurveyErrorCode.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    protected ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e) {
        log.warn("Unsupported media type: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(SurveyErrorCode.UNSUPPORTED_MEDIA_TYPE);
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    protected ResponseEntity<ErrorResponse> handleMediaTypeNotAcceptable(HttpMediaTypeNotAcceptableException e) {
        log.warn("Not acceptable: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(SurveyErrorCode.NOT_ACCEPTABLE);
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected System Failure: ", e);
        return ErrorResponse.toResponseEntity(SurveyErrorCode.INTERNAL_SERVER_ERROR);
    }
}
