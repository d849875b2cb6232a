package com.fragrance.compliance.web;

import com.fragrance.compliance.service.InvalidFormulaEntryException;
import com.fragrance.compliance.service.MaterialNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(InvalidFormulaEntryException.class)
    public ProblemDetail handleInvalidEntry(InvalidFormulaEntryException ex, HttpServletRequest request) {
        log.warn("Invalid formula entry on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        detail.setTitle("Invalid formula entry");
        detail.setDetail(ex.getMessage());
        detail.setProperty("entryIndex", ex.getEntryIndex());
        detail.setProperty("entryName", ex.getEntryName());
        detail.setProperty("field", ex.getField());
        detail.setProperty("path", request.getRequestURI());
        return detail;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        detail.setTitle("Bad Request");
        detail.setDetail(ex.getMessage());
        detail.setProperty("path", request.getRequestURI());
        return detail;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        detail.setTitle("Bad Request");
        detail.setDetail("Request body could not be read.");
        detail.setProperty("path", request.getRequestURI());
        return detail;
    }

    @ExceptionHandler(MaterialNotFoundException.class)
    public ProblemDetail handleMaterialNotFound(MaterialNotFoundException ex, HttpServletRequest request) {
        ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
        detail.setTitle("Not Found");
        detail.setDetail(ex.getMessage());
        detail.setProperty("path", request.getRequestURI());
        return detail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        detail.setTitle("Internal Server Error");
        detail.setDetail("Unexpected error");
        detail.setProperty("path", request.getRequestURI());
        return detail;
    }
}
