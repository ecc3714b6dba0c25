package io.github.samzhu.finops.exception;

/**
 * FinOps 服務領域例外的共同父類別。
 *
 * <p>皆為 unchecked，由 {@link io.github.samzhu.finops.controller.GlobalExceptionAdvice}
 * 對應為 HTTP 狀態碼。
 */
public abstract class FinopsException extends RuntimeException {

    protected FinopsException(String message) {
        super(message);
    }

    protected FinopsException(String message, Throwable cause) {
        super(message, cause);
    }
}
