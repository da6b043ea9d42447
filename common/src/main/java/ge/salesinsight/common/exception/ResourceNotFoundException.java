package ge.salesinsight.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a dataset, job or result cannot be found.
 */
public class ResourceNotFoundException extends SalesInsightException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
            String.format("%s not found with identifier: %s", resourceType, identifier),
            HttpStatus.NOT_FOUND,
            "SI_ERR_404"
        );
    }

    public ResourceNotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND, "SI_ERR_404");
    }
}
