package net.imagecraft.exception;

/**
 * No asset record exists for the requested id.
 */
public class AssetNotFoundException extends RuntimeException {

    private final String assetId;

    public AssetNotFoundException(String assetId) {
        super("Image not found: " + assetId);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
