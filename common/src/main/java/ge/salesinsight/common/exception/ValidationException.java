package ge.salesinsight.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when validation fails: bad uploads, missing columns, unreadable cells.
 */
public class ValidationException extends SalesInsightException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "SI_ERR_400");
    }

    public ValidationException(String field, String message) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "SI_ERR_400"
        );
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "SI_ERR_400",
            cause
        );
    }
}
