package net.imagecraft.application.fallback;

import java.util.ArrayList;
import java.util.List;
import net.imagecraft.exception.AllAdaptersFailedException;
import net.imagecraft.exception.ModelAdapterException;
import net.imagecraft.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs fallback chains with first-success semantics.
 *
 * <p>Strategies are attempted strictly in list order on the calling thread. A failure is recorded
 * and the next strategy runs immediately, with no delay and no retry of the failed one. The first
 * success ends the chain: later strategies are never invoked.</p>
 */
@Component
public class FallbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(FallbackExecutor.class);

    public <T> FallbackResult<T> firstSuccess(List<FallbackStrategy<T>> strategies) {
        List<FallbackResult.AttemptError> errors = new ArrayList<>();
        for (FallbackStrategy<T> strategy : strategies) {
            try {
                FallbackResult.Success<T> outcome = strategy.attempt().get();
                if (outcome == null || outcome.value() == null) {
                    throw new ModelAdapterException(strategy.id(), "returned no result");
                }
                if (!errors.isEmpty()) {
                    log.info("Strategy {} succeeded after {} failed attempt(s)", outcome.strategyId(), errors.size());
                }
                return new FallbackResult.Success<>(outcome.value(), outcome.strategyId(), errors);
            } catch (RuntimeException ex) {
                log.warn("Strategy {} failed: {}", strategy.id(), LoggingUtils.summarize(ex));
                log.debug("Strategy {} failure detail", strategy.id(), ex);
                errors.add(new FallbackResult.AttemptError(strategy.id(), ex));
            }
        }
        return new FallbackResult.Failure<>(errors);
    }

    /**
     * Runs the chain and unwraps the winner.
     *
     * @throws AllAdaptersFailedException when every strategy failed; its cause is the last error
     */
    public <T> T execute(List<FallbackStrategy<T>> strategies) {
        return unwrap(firstSuccess(strategies)).value();
    }

    /**
     * Like {@link #execute(List)} but keeps the winning strategy id.
     */
    public <T> FallbackResult.Success<T> executeTracked(List<FallbackStrategy<T>> strategies) {
        return unwrap(firstSuccess(strategies));
    }

    private static <T> FallbackResult.Success<T> unwrap(FallbackResult<T> result) {
        if (result instanceof FallbackResult.Success<T> success) {
            return success;
        }
        FallbackResult.Failure<T> failure = (FallbackResult.Failure<T>) result;
        throw new AllAdaptersFailedException(failure.attempted(), failure.lastError());
    }
}
