package io.github.samzhu.finops.controller;

import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.finops.exception.ConfigurationException;
import io.github.samzhu.finops.exception.GenerationException;
import io.github.samzhu.finops.exception.RecordNotFoundException;
import io.github.samzhu.finops.exception.TransformException;
import io.github.samzhu.finops.exception.WarehouseException;

/**
 * API 例外對應。
 *
 * <p>將領域例外轉為 RFC 7807 {@link ProblemDetail}，detail 保留原始訊息：
 * <ul>
 *   <li>{@link ConfigurationException}、{@link IllegalArgumentException} → 400</li>
 *   <li>{@link RecordNotFoundException} → 404</li>
 *   <li>{@link TransformException} → 422</li>
 *   <li>{@link WarehouseException}、{@link GenerationException} → 502</li>
 *   <li>{@link DataAccessException} → 503</li>
 * </ul>
 *
 * <p>非同步端點的失敗可能包在 {@link CompletionException} 中，先取出原因再對應。
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/web/webmvc/mvc-ann-rest-exceptions.html">Error Responses</a>
 */
@RestControllerAdvice
public class GlobalExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionAdvice.class);

    @ExceptionHandler({ConfigurationException.class, IllegalArgumentException.class})
    public ProblemDetail handleBadRequest(RuntimeException e) {
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", e);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ProblemDetail handleNotFound(RecordNotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", e);
    }

    @ExceptionHandler(TransformException.class)
    public ProblemDetail handleTransform(TransformException e) {
        ProblemDetail detail = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed Warehouse Row", e);
        detail.setProperty("rowIndex", e.getRowIndex());
        return detail;
    }

    @ExceptionHandler(WarehouseException.class)
    public ProblemDetail handleWarehouse(WarehouseException e) {
        return problem(HttpStatus.BAD_GATEWAY, "Warehouse Failure", e);
    }

    @ExceptionHandler(GenerationException.class)
    public ProblemDetail handleGeneration(GenerationException e) {
        ProblemDetail detail = problem(HttpStatus.BAD_GATEWAY, "Insight Generation Failure", e);
        detail.setProperty("insightType", e.getInsightType());
        return detail;
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleStore(DataAccessException e) {
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Store Failure", e);
    }

    @ExceptionHandler(CompletionException.class)
    public ProblemDetail handleCompletion(CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof ConfigurationException || cause instanceof IllegalArgumentException) {
            return handleBadRequest((RuntimeException) cause);
        }
        if (cause instanceof RecordNotFoundException notFound) {
            return handleNotFound(notFound);
        }
        if (cause instanceof TransformException transform) {
            return handleTransform(transform);
        }
        if (cause instanceof WarehouseException warehouse) {
            return handleWarehouse(warehouse);
        }
        if (cause instanceof GenerationException generation) {
            return handleGeneration(generation);
        }
        if (cause instanceof DataAccessException dataAccess) {
            return handleStore(dataAccess);
        }
        log.error("Unhandled async failure", cause);
        return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, cause.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, Exception e) {
        if (status.is5xxServerError()) {
            log.error("{}: {}", title, e.getMessage(), e);
        } else {
            log.debug("{}: {}", title, e.getMessage());
        }
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, e.getMessage());
        detail.setTitle(title);
        return detail;
    }
}
