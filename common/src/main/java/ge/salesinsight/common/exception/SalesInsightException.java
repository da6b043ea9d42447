package ge.salesinsight.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all Sales Insight business exceptions.
 */
@Getter
public class SalesInsightException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public SalesInsightException(String message) {
        super(message);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "SI_ERR_001";
    }

    public SalesInsightException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public SalesInsightException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public SalesInsightException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "SI_ERR_001";
    }
}
