package net.imagecraft.application.fallback;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.support.adapter.ModelAdapter;

/**
 * One fallible attempt in a fallback chain.
 *
 * @param id      identity reported in failure diagnostics, e.g. {@code edit-with-mask:gpt-image}
 * @param attempt the call to make, returning the value with the id of whatever produced it, or
 *                {@code null} for no result; any runtime exception counts as failure
 */
public record FallbackStrategy<T>(String id, Supplier<FallbackResult.Success<T>> attempt) {

    public FallbackStrategy {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(attempt, "attempt");
    }

    public static <T> FallbackStrategy<T> of(String id, Supplier<T> attempt) {
        Objects.requireNonNull(attempt, "attempt");
        return new FallbackStrategy<>(id, () -> {
            T value = attempt.get();
            return value == null ? null : new FallbackResult.Success<>(value, id, List.of());
        });
    }

    public static FallbackStrategy<byte[]> synthesize(ModelAdapter adapter, String prompt, PixelDimensions size) {
        return of(adapter.id(), () -> adapter.synthesize(prompt, size));
    }

    /**
     * One text-to-image strategy per adapter, in the given order.
     */
    public static List<FallbackStrategy<byte[]>> synthesizeAll(List<ModelAdapter> adapters, String prompt, PixelDimensions size) {
        return adapters.stream().map(adapter -> synthesize(adapter, prompt, size)).toList();
    }

    /**
     * Wraps a whole inner chain as a single stage of an outer chain. The stage fails with the
     * inner chain's {@link net.imagecraft.exception.AllAdaptersFailedException}; on success it
     * reports {@code id:innerWinner}, e.g. {@code regenerate:gemini-image}.
     */
    public static <T> FallbackStrategy<T> nested(String id, FallbackExecutor executor, List<FallbackStrategy<T>> inner) {
        List<FallbackStrategy<T>> chain = List.copyOf(inner);
        return new FallbackStrategy<>(id, () -> {
            FallbackResult.Success<T> winner = executor.executeTracked(chain);
            return new FallbackResult.Success<>(winner.value(), id + ":" + winner.strategyId(), List.of());
        });
    }
}
