package com.otcdesk.deskapi.config;

import com.otcdesk.domain.deals.DealNotFoundException;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.InfrastructureException;
import com.otcdesk.domain.deals.PriceDivergenceException;
import com.otcdesk.domain.deals.SettlementWindowExpiredException;
import com.otcdesk.integration.ledger.ChainException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
    problem.setType(URI.create(TYPE_PREFIX + "validation-error"));
    problem.setTitle("Validation Error");
    problem.setProperty(
        "errors",
        ex.getFieldErrors().stream()
            .map(
                fe ->
                    new FieldError(
                        fe.getField(),
                        fe.getDefaultMessage(),
                        String.valueOf(fe.getRejectedValue())))
            .toList());
    return problem;
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParam(MissingServletRequestParameterException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "missing-parameter"));
    problem.setTitle("Missing Parameter");
    return problem;
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String detail =
        String.format(
            "Parameter '%s' should be of type '%s'",
            ex.getName(),
            ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setType(URI.create(TYPE_PREFIX + "type-mismatch"));
    problem.setTitle("Type Mismatch");
    return problem;
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "method-not-allowed"));
    problem.setTitle("Method Not Allowed");
    return problem;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail handleNoResource(NoResourceFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "not-found"));
    problem.setTitle("Not Found");
    return problem;
  }

  @ExceptionHandler(DealValidationException.class)
  public ProblemDetail handleDealValidation(DealValidationException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "validation-error"));
    problem.setTitle("Validation Error");
    return problem;
  }

  @ExceptionHandler(DealNotFoundException.class)
  public ProblemDetail handleDealNotFound(DealNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "not-found"));
    problem.setTitle("Not Found");
    problem.setProperty("recordType", ex.recordType());
    problem.setProperty("recordId", ex.recordId());
    return problem;
  }

  @ExceptionHandler(PriceDivergenceException.class)
  public ProblemDetail handlePriceDivergence(PriceDivergenceException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "price-divergence"));
    problem.setTitle("Price Divergence");
    problem.setProperty("candidatePrice", ex.candidatePrice());
    problem.setProperty("aggregatedPrice", ex.aggregatedPrice());
    problem.setProperty("divergencePercent", ex.divergencePercent());
    return problem;
  }

  @ExceptionHandler(SettlementWindowExpiredException.class)
  public ProblemDetail handleWindowExpired(SettlementWindowExpiredException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "settlement-window-expired"));
    problem.setTitle("Settlement Window Expired");
    problem.setProperty("expiredAt", ex.expiredAt());
    return problem;
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "invalid-argument"));
    problem.setTitle("Invalid Argument");
    return problem;
  }

  @ExceptionHandler(ChainException.class)
  public ProblemDetail handleChain(ChainException ex) {
    if (ex.isTransient()) {
      log.warn("Ledger unavailable chain={} reason={}", ex.chain(), ex.reason());
      return unavailable("Ledger temporarily unavailable");
    }
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "chain-reverted"));
    problem.setTitle("Ledger Rejected Transaction");
    problem.setProperty("reason", ex.reason());
    return problem;
  }

  @ExceptionHandler(InfrastructureException.class)
  public ProblemDetail handleInfrastructure(InfrastructureException ex) {
    log.warn("Infrastructure failure error={}", ex.getMessage());
    return unavailable(ex.getMessage());
  }

  @ExceptionHandler(DataAccessException.class)
  public ProblemDetail handleDataAccess(DataAccessException ex) {
    log.error("Deal store unavailable", ex);
    return unavailable("Deal store temporarily unavailable");
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please try again later.");
    problem.setType(URI.create(TYPE_PREFIX + "internal-error"));
    problem.setTitle("Internal Server Error");
    return problem;
  }

  private static ProblemDetail unavailable(String detail) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, detail);
    problem.setType(URI.create(TYPE_PREFIX + "infrastructure-unavailable"));
    problem.setTitle("Service Unavailable");
    return problem;
  }

  private record FieldError(String field, String message, String rejectedValue) {}
}
