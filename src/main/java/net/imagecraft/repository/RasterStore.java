package net.imagecraft.repository;

import java.util.Optional;

/**
 * Byte storage for asset rasters, addressed by file name.
 */
public interface RasterStore {

    void write(String filename, byte[] bytes);

    /**
     * @return the raster bytes, or empty when no file with that name exists
     */
    Optional<byte[]> read(String filename);
}
