package net.imagecraft.application.fallback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.imagecraft.exception.AllAdaptersFailedException;
import net.imagecraft.exception.ModelAdapterException;
import org.junit.jupiter.api.Test;

class FallbackExecutorTest {

    private final FallbackExecutor executor = new FallbackExecutor();

    @Test
    void should_ReturnSecondResultAndSkipThird_When_FirstFails() {
        AtomicInteger thirdCalls = new AtomicInteger();
        List<FallbackStrategy<String>> chain = List.of(
            FallbackStrategy.of("a", () -> { throw new ModelAdapterException("a", "quota exceeded"); }),
            FallbackStrategy.of("b", () -> "from-b"),
            FallbackStrategy.of("c", () -> {
                thirdCalls.incrementAndGet();
                return "from-c";
            }));

        FallbackResult.Success<String> result = executor.executeTracked(chain);

        assertThat(result.value()).isEqualTo("from-b");
        assertThat(result.strategyId()).isEqualTo("b");
        assertThat(result.errors()).extracting(FallbackResult.AttemptError::strategyId).containsExactly("a");
        assertThat(thirdCalls).hasValue(0);
    }

    @Test
    void should_ThrowWithLastErrorAsCause_When_AllStrategiesFail() {
        RuntimeException lastError = new ModelAdapterException("c", "timeout");
        List<FallbackStrategy<String>> chain = List.of(
            FallbackStrategy.of("a", () -> { throw new ModelAdapterException("a", "quota"); }),
            FallbackStrategy.of("b", () -> { throw new IllegalStateException("bad response"); }),
            FallbackStrategy.of("c", () -> { throw lastError; }));

        assertThatThrownBy(() -> executor.execute(chain))
            .isInstanceOf(AllAdaptersFailedException.class)
            .hasCause(lastError)
            .satisfies(ex -> assertThat(((AllAdaptersFailedException) ex).getAttempted()).containsExactly("a", "b", "c"));
    }

    @Test
    void should_TreatNullAsFailure_When_StrategyReturnsNothing() {
        List<FallbackStrategy<String>> chain = List.of(
            FallbackStrategy.of("empty", () -> null),
            FallbackStrategy.of("real", () -> "value"));

        assertThat(executor.execute(chain)).isEqualTo("value");
    }

    @Test
    void should_RunInnerChainAsOneStrategy_When_Nested() {
        AtomicInteger outerTail = new AtomicInteger();
        List<FallbackStrategy<String>> inner = List.of(
            FallbackStrategy.of("inner-1", () -> { throw new IllegalStateException("down"); }),
            FallbackStrategy.of("inner-2", () -> "inner-value"));
        List<FallbackStrategy<String>> outer = List.of(
            FallbackStrategy.of("edit", () -> { throw new IllegalStateException("edit down"); }),
            FallbackStrategy.nested("regenerate", executor, inner),
            FallbackStrategy.of("tail", () -> {
                outerTail.incrementAndGet();
                return "tail";
            }));

        FallbackResult.Success<String> result = executor.executeTracked(outer);

        assertThat(result.value()).isEqualTo("inner-value");
        assertThat(result.strategyId()).isEqualTo("regenerate:inner-2");
        assertThat(outerTail).hasValue(0);
    }

    @Test
    void should_ReportFailureWithoutThrowing_When_UsingFirstSuccess() {
        FallbackResult<String> result = executor.firstSuccess(List.of(
            FallbackStrategy.of("only", () -> { throw new IllegalStateException("nope"); })));

        assertThat(result).isInstanceOf(FallbackResult.Failure.class);
        assertThat(((FallbackResult.Failure<String>) result).attempted()).containsExactly("only");
    }
}
