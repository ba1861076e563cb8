package com.ryuqq.reviewflow.application.export;

/**
 * 원장 직렬화 실패.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class LedgerExportException extends RuntimeException {

    public LedgerExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
