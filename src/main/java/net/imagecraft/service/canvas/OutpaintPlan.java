package net.imagecraft.service.canvas;

import java.util.List;
import net.imagecraft.model.image.OutpaintDirection;
import net.imagecraft.model.image.PixelDimensions;

/**
 * Extended canvas geometry for an outpaint request.
 *
 * @param original   size of the source image
 * @param target     size of the extended canvas
 * @param directions directions that were extended, in enum order
 * @param extendUp   pixels added above
 * @param extendDown pixels added below
 * @param extendLeft pixels added on the left
 * @param extendRight pixels added on the right
 */
public record OutpaintPlan(PixelDimensions original,
                          PixelDimensions target,
                          List<OutpaintDirection> directions,
                          int extendUp,
                          int extendDown,
                          int extendLeft,
                          int extendRight) {

    public OutpaintPlan {
        directions = List.copyOf(directions);
    }

    /** X offset of the original inside the extended canvas. */
    public int originX() {
        return extendLeft;
    }

    /** Y offset of the original inside the extended canvas. */
    public int originY() {
        return extendUp;
    }
}
