package net.imagecraft.exception;

/**
 * Redo was requested on an asset with no children. User-visible, non-fatal.
 */
public class NothingToRedoException extends RuntimeException {

    public NothingToRedoException(String assetId) {
        super("Nothing to redo: asset " + assetId + " has no children");
    }
}
