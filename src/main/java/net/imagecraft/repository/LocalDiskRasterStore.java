package net.imagecraft.repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import net.imagecraft.config.ImageCraftProperties;
import net.imagecraft.exception.ImageValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Stores rasters as plain files in one directory.
 */
@Repository
public class LocalDiskRasterStore implements RasterStore {

    private static final Logger log = LoggerFactory.getLogger(LocalDiskRasterStore.class);

    private final Path directory;

    @Autowired
    public LocalDiskRasterStore(ImageCraftProperties properties) {
        this(properties.getStorage().rasterDirectory());
    }

    public LocalDiskRasterStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public void write(String filename, byte[] bytes) {
        Path target = resolve(filename);
        try {
            Files.createDirectories(directory);
            Files.write(target, bytes);
            log.debug("Wrote raster {} ({} bytes)", filename, bytes.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write raster " + filename, e);
        }
    }

    @Override
    public Optional<byte[]> read(String filename) {
        Path target = resolve(filename);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read raster " + filename, e);
        }
    }

    private Path resolve(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ImageValidationException("Raster file name is required");
        }
        Path resolved = directory.resolve(filename).normalize();
        if (!resolved.getParent().equals(directory)) {
            throw new ImageValidationException("Raster file name must not contain path segments: " + filename);
        }
        return resolved;
    }
}
