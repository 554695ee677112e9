package net.imagecraft.service.lineage;

import java.time.Instant;
import net.imagecraft.model.image.OperationKind;

/**
 * One step of an asset's history, oldest first.
 */
public record HistoryEntry(String assetId, OperationKind kind, String prompt, Instant createdAt, int position) {

    public String label() {
        return kind.label();
    }
}
