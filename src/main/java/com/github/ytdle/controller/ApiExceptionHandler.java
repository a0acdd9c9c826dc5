package com.github.ytdle.controller;

import com.github.ytdle.exception.EngineClosedException;
import com.github.ytdle.exception.HistoryStoreException;
import com.github.ytdle.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ProblemDetail handleInvalidRequest(InvalidRequestException e) {
        log.warn("Rejected submission: {}", e.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
        problem.setProperty("requestIndex", e.getRequestIndex());
        return problem;
    }

    @ExceptionHandler(EngineClosedException.class)
    public ProblemDetail handleEngineClosed(EngineClosedException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(HistoryStoreException.class)
    public ProblemDetail handleHistoryStore(HistoryStoreException e) {
        log.error("History store error on {}: {}", e.getStorePath(), e.getMessage(), e);
        return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
}
