package net.imagecraft.exception;

import java.util.List;

/**
 * Every unit of a synchronous batch failed. Partial failures are not exceptional and are reported
 * on the batch outcome instead.
 */
public class BatchGenerationException extends RuntimeException {

    private final List<String> unitErrors;

    public BatchGenerationException(List<String> unitErrors) {
        super("All generations failed: " + String.join("; ", unitErrors == null ? List.of() : unitErrors));
        this.unitErrors = unitErrors == null ? List.of() : List.copyOf(unitErrors);
    }

    public List<String> getUnitErrors() {
        return unitErrors;
    }
}
