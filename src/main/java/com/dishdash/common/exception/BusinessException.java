package com.dishdash.common.exception;

import lombok.Getter;

/**
 * Unchecked exception for every domain rule violation in the order lifecycle.
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.CONFLICT, "Order already picked up by another courier");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
