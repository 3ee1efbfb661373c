package com.virtualcommittee.committee.config;

import com.virtualcommittee.common.exception.CommitteeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CommitteeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CommitteeExceptionHandler.class);

    @ExceptionHandler(CommitteeException.class)
    public ProblemDetail handleCommitteeException(CommitteeException exception) {
        log.warn("Rejected request: {}", exception.getMessage());
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
        problemDetail.setProperty("code", "invalid_request");
        problemDetail.setProperty("component", exception.getComponent());
        if (exception.getInstrumentId() != null) {
            problemDetail.setProperty("instrumentId", exception.getInstrumentId());
        }
        return problemDetail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpectedException(Exception exception) {
        log.error("Unexpected error while serving committee request", exception);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected server error"
        );
        problemDetail.setProperty("code", "internal_error");
        return problemDetail;
    }
}
