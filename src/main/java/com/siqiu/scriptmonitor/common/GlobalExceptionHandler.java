package com.siqiu.scriptmonitor.common;

import com.siqiu.scriptmonitor.execution.ExecutionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ExecutionNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> handleExecutionNotFound(ExecutionNotFoundException ex) {
        return Map.of("message", ex.getMessage());
    }

    // e.g. a non-UUID execution id in the path
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleBadArgument(MethodArgumentTypeMismatchException ex) {
        return Map.of("message", "Invalid value for '" + ex.getName() + "'");
    }
}
