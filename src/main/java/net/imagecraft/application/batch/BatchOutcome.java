package net.imagecraft.application.batch;

import jakarta.annotation.Nullable;
import java.util.List;
import net.imagecraft.model.image.ImageAsset;

/**
 * Result of a synchronous batch with at least one success.
 *
 * @param results successful assets in completion order
 * @param errors  one message per failed unit; non-empty means partial failure
 * @param groupId id shared by every asset of the batch, when one was assigned
 */
public record BatchOutcome(List<ImageAsset> results, List<String> errors, @Nullable String groupId) {

    public BatchOutcome {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }

    public boolean isPartial() {
        return !errors.isEmpty();
    }
}
