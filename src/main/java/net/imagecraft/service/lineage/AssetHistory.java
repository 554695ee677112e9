package net.imagecraft.service.lineage;

import java.util.List;

/**
 * Root chain of an asset with navigation state.
 *
 * @param entries      chain from the oldest reachable ancestor to the asset itself
 * @param currentIndex index of the asset inside {@code entries}, always the last one
 * @param canUndo      whether the asset has a resolvable parent
 * @param canRedo      whether the asset has at least one child
 */
public record AssetHistory(List<HistoryEntry> entries, int currentIndex, boolean canUndo, boolean canRedo) {

    public AssetHistory {
        entries = List.copyOf(entries);
    }
}
