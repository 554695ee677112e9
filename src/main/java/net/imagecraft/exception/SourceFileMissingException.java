package net.imagecraft.exception;

/**
 * The asset record exists but its raster file is gone from the raster store.
 */
public class SourceFileMissingException extends RuntimeException {

    private final String assetId;
    private final String filename;

    public SourceFileMissingException(String assetId, String filename) {
        super("Image file not found for asset " + assetId + ": " + filename);
        this.assetId = assetId;
        this.filename = filename;
    }

    public String getAssetId() {
        return assetId;
    }

    public String getFilename() {
        return filename;
    }
}
