package com.infomedia.abacox.callorchestrator.controller;

import com.infomedia.abacox.callorchestrator.component.durable.SignalRejectedException;
import com.infomedia.abacox.callorchestrator.component.durable.UnknownChannelException;
import com.infomedia.abacox.callorchestrator.component.durable.UnknownWorkflowTypeException;
import com.infomedia.abacox.callorchestrator.component.durable.WorkerNotAcceptingWorkException;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowAlreadyStartedException;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowFailedException;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowNotFoundException;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowNotReadyException;
import com.infomedia.abacox.callorchestrator.component.postcall.PostCallJobNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
@Log4j2
public class ApiExceptionHandler {

    @ExceptionHandler({WorkflowNotFoundException.class, PostCallJobNotFoundException.class})
    public ResponseEntity<ProblemDetail> notFound(RuntimeException e, HttpServletRequest request) {
        return ErrorController.problem(HttpStatus.NOT_FOUND, e.getMessage(), request.getRequestURI());
    }

    @ExceptionHandler({UnknownChannelException.class, UnknownWorkflowTypeException.class,
            IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ProblemDetail> badRequest(Exception e, HttpServletRequest request) {
        return ErrorController.problem(HttpStatus.BAD_REQUEST, e.getMessage(), request.getRequestURI());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> invalidBody(MethodArgumentNotValidException e, HttpServletRequest request) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ErrorController.problem(HttpStatus.BAD_REQUEST, detail, request.getRequestURI());
    }

    @ExceptionHandler({WorkflowAlreadyStartedException.class, SignalRejectedException.class,
            WorkflowNotReadyException.class, WorkflowFailedException.class, IllegalStateException.class})
    public ResponseEntity<ProblemDetail> conflict(RuntimeException e, HttpServletRequest request) {
        return ErrorController.problem(HttpStatus.CONFLICT, e.getMessage(), request.getRequestURI());
    }

    @ExceptionHandler(WorkerNotAcceptingWorkException.class)
    public ResponseEntity<ProblemDetail> unavailable(WorkerNotAcceptingWorkException e, HttpServletRequest request) {
        log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return ErrorController.problem(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), request.getRequestURI());
    }
}
