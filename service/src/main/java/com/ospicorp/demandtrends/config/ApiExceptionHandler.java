package com.ospicorp.demandtrends.config;

import com.ospicorp.demandtrends.trend.controller.InvalidParameterException;
import com.ospicorp.demandtrends.trend.service.ExternalFetchException;
import com.ospicorp.demandtrends.trend.service.InsufficientDataException;
import com.ospicorp.demandtrends.trend.service.TrendAnalysisException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String PROBLEM_DOCS_BASE = "https://docs.demand-trends.dev/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.UNPROCESSABLE_ENTITY, "insufficient-data",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error",
      HttpStatus.BAD_GATEWAY, "history-unavailable"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      HandlerMethodValidationException.class, HttpMessageNotReadableException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ProblemDetail> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("parameter", ex.parameter());
      detail.setProperty("errorCode", ex.errorCode());
      detail.setProperty("moreInfo", ex.moreInfo());
    }
    return response;
  }

  @ExceptionHandler(InsufficientDataException.class)
  public ResponseEntity<ProblemDetail> handleInsufficientData(InsufficientDataException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response =
        buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("observed", ex.observed());
      detail.setProperty("required", ex.required());
    }
    return response;
  }

  @ExceptionHandler(ExternalFetchException.class)
  public ResponseEntity<ProblemDetail> handleExternalFetch(ExternalFetchException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_GATEWAY, ex, request);
  }

  @ExceptionHandler(TrendAnalysisException.class)
  public ResponseEntity<ProblemDetail> handleAnalysisFailure(TrendAnalysisException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response =
        buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null && ex.stage() != null) {
      detail.setProperty("stage", ex.stage().name().toLowerCase(Locale.ROOT));
    }
    return response;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoResourceFoundException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_DOCS_BASE
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String method = request.getMethod();
    String uriWithQuery = RequestLoggingFilter.getRequestUriWithQuery(request);
    String clientIp = RequestLoggingFilter.getClientIp(request);
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage);
    }
  }
}
