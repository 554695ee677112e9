package net.imagecraft.application.fallback;

import java.util.List;

/**
 * Outcome of a first-success run over a fallback chain.
 */
public sealed interface FallbackResult<T> permits FallbackResult.Success, FallbackResult.Failure {

    /**
     * Errors from the strategies that failed, in attempt order.
     */
    List<AttemptError> errors();

    /**
     * @param value      output of the winning strategy
     * @param strategyId identity of the winning strategy
     * @param errors     failures that preceded the winner
     */
    record Success<T>(T value, String strategyId, List<AttemptError> errors) implements FallbackResult<T> {
        public Success {
            errors = List.copyOf(errors);
        }
    }

    record Failure<T>(List<AttemptError> errors) implements FallbackResult<T> {
        public Failure {
            errors = List.copyOf(errors);
        }

        public List<String> attempted() {
            return errors.stream().map(AttemptError::strategyId).toList();
        }

        public Throwable lastError() {
            return errors.isEmpty() ? null : errors.get(errors.size() - 1).error();
        }
    }

    record AttemptError(String strategyId, Throwable error) {
    }
}
