package net.imagecraft.service.canvas;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.OutpaintDirection;
import net.imagecraft.model.image.PixelDimensions;
import org.springframework.stereotype.Component;

/**
 * Size arithmetic and canvas preparation for outpainting.
 *
 * <p>Content for the new regions is synthesized by a model adapter. This class only computes the
 * extended canvas, places the original on it and builds the matching edit mask.</p>
 */
@Component
public class OutpaintPlanner {

    public static final int MIN_AMOUNT_PERCENT = 10;
    public static final int MAX_AMOUNT_PERCENT = 100;

    /**
     * Computes the extended canvas.
     *
     * @param amountPercent extension per selected direction as a percentage of the matching dimension
     * @throws ImageValidationException when no direction is given or the amount is outside 10..100
     */
    public OutpaintPlan plan(PixelDimensions original, Collection<OutpaintDirection> directions, int amountPercent) {
        if (directions == null || directions.isEmpty()) {
            throw new ImageValidationException("At least one outpaint direction is required");
        }
        if (amountPercent < MIN_AMOUNT_PERCENT || amountPercent > MAX_AMOUNT_PERCENT) {
            throw new ImageValidationException("Outpaint amount must be between 10 and 100 percent, got " + amountPercent);
        }
        EnumSet<OutpaintDirection> selected = EnumSet.copyOf(directions);
        int horizontal = extension(original.width(), amountPercent);
        int vertical = extension(original.height(), amountPercent);

        int up = selected.contains(OutpaintDirection.UP) ? vertical : 0;
        int down = selected.contains(OutpaintDirection.DOWN) ? vertical : 0;
        int left = selected.contains(OutpaintDirection.LEFT) ? horizontal : 0;
        int right = selected.contains(OutpaintDirection.RIGHT) ? horizontal : 0;

        PixelDimensions target = new PixelDimensions(original.width() + left + right, original.height() + up + down);
        return new OutpaintPlan(original, target, List.copyOf(selected), up, down, left, right);
    }

    /**
     * Places the original on a transparent canvas of the planned size.
     */
    public BufferedImage extendCanvas(BufferedImage original, OutpaintPlan plan) {
        BufferedImage canvas = new BufferedImage(plan.target().width(), plan.target().height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.drawImage(original, plan.originX(), plan.originY(), null);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }

    /**
     * Edit mask for the extended canvas: opaque over the original, transparent over the new regions.
     */
    public BufferedImage buildMask(OutpaintPlan plan) {
        BufferedImage mask = new BufferedImage(plan.target().width(), plan.target().height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = mask.createGraphics();
        try {
            graphics.setComposite(AlphaComposite.Src);
            graphics.setColor(Color.BLACK);
            graphics.fillRect(plan.originX(), plan.originY(), plan.original().width(), plan.original().height());
        } finally {
            graphics.dispose();
        }
        return mask;
    }

    private static int extension(int dimension, int amountPercent) {
        return (int) (dimension * (amountPercent / 100.0));
    }
}
