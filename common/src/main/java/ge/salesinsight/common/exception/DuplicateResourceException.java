package ge.salesinsight.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a resource with the same identifier is already active.
 */
public class DuplicateResourceException extends SalesInsightException {

    public DuplicateResourceException(String resourceType, String identifier) {
        super(
            String.format("%s already exists with identifier: %s", resourceType, identifier),
            HttpStatus.CONFLICT,
            "SI_ERR_409"
        );
    }

    public DuplicateResourceException(String message) {
        super(message, HttpStatus.CONFLICT, "SI_ERR_409");
    }
}
