package net.imagecraft.repository;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.PixelDimensions;

/**
 * Reads records written in the older flat format: snake_case keys, a {@code size} label,
 * zone-less timestamps and boolean edit flags instead of a single operation kind.
 *
 * <p>The boolean flags are carried as {@link ImageAsset#legacyMarkers()} and the kind is left
 * unset, so history labels are resolved at read time.</p>
 */
final class LegacyAssetRecordMapper {

    static final List<String> MARKER_FLAGS = List.of(
        "outpainted", "adjusted", "upscaled", "background_removed", "style_transfer", "watermarked");

    private static final PixelDimensions DEFAULT_SIZE = new PixelDimensions(1024, 1024);

    private LegacyAssetRecordMapper() {
    }

    /**
     * Current-format records always carry {@code dimensions}; legacy ones never do.
     */
    static boolean isLegacy(JsonNode node) {
        return !node.has("dimensions");
    }

    static ImageAsset toAsset(JsonNode node, long sequence) {
        Set<String> markers = new LinkedHashSet<>();
        for (String flag : MARKER_FLAGS) {
            if (node.path(flag).asBoolean(false)) {
                markers.add(flag);
            }
        }
        return ImageAsset.builder()
            .id(node.path("id").asText())
            .parentId(text(node, "parent_id"))
            .prompt(node.path("prompt").asText(""))
            .style(node.path("style").asText("none"))
            .model(text(node, "model"))
            .groupId(text(node, "group_id"))
            .filename(node.path("filename").asText())
            .dimensions(size(node))
            .legacyMarkers(markers)
            .createdAt(timestamp(node.path("created_at").asText(null)))
            .sequence(sequence)
            .favorited(node.path("favorite").asBoolean(false) || node.path("favorited").asBoolean(false))
            .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }

    private static PixelDimensions size(JsonNode node) {
        String label = text(node, "size");
        if (label == null) {
            return DEFAULT_SIZE;
        }
        try {
            return PixelDimensions.parse(label);
        } catch (RuntimeException ex) {
            return DEFAULT_SIZE;
        }
    }

    private static Instant timestamp(String value) {
        if (value == null || value.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                return Instant.EPOCH;
            }
        }
    }
}
