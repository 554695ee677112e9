package net.imagecraft.exception;

/**
 * Undo was requested on an asset with no resolvable parent. User-visible, non-fatal.
 */
public class NothingToUndoException extends RuntimeException {

    public NothingToUndoException(String assetId) {
        super("Nothing to undo: asset " + assetId + " has no parent");
    }
}
