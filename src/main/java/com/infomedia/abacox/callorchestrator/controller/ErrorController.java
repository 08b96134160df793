package com.infomedia.abacox.callorchestrator.controller;

import io.swagger.v3.oas.annotations.Hidden;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.web.servlet.error.ErrorAttributes;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.ServletWebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;

/**
 * Renders container-level errors (unmapped paths, errors outside the handlers) as problem
 * details, and builds the problem documents {@link ApiExceptionHandler} returns.
 */
@Hidden
@Log4j2
@RestController
@RequiredArgsConstructor
@RequestMapping("${server.error.path:${error.path:/error}}")
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    private final ErrorAttributes errorAttributes;

    @RequestMapping
    public ResponseEntity<ProblemDetail> error(HttpServletRequest request) {
        Throwable error = errorAttributes.getError(new ServletWebRequest(request));
        HttpStatus status = request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE) instanceof Integer code
                ? HttpStatus.valueOf(code) : HttpStatus.INTERNAL_SERVER_ERROR;
        String path = request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI) instanceof String uri
                ? uri : request.getRequestURI();

        if (status.is5xxServerError()) {
            log.error("Request to {} failed with {}", path, status.value(), error);
        }
        return problem(status, error != null ? error.getMessage() : status.getReasonPhrase(), path);
    }

    /**
     * Problem document with type {@code status-<reason>}, the request path as instance, and a
     * timestamp.
     */
    static ResponseEntity<ProblemDetail> problem(HttpStatus status, String detail, String path) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(typeOf(status)));
        if (path != null) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("timestamp", Instant.now().toString());
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(problem);
    }

    // "Service Unavailable" -> "status-service-unavailable"
    static String typeOf(HttpStatus status) {
        String reason = status.getReasonPhrase().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s-]", "");
        return "status-" + reason.trim().replaceAll("[\\s-]+", "-");
    }
}
