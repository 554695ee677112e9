package net.imagecraft.service.canvas;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.Color;
import java.awt.image.BufferedImage;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.AdjustmentLevels;
import net.imagecraft.testutil.ImageTestData;
import org.junit.jupiter.api.Test;

class ImageAdjusterTest {

    private final ImageAdjuster adjuster = new ImageAdjuster();

    @Test
    void should_LeavePixelsUnchanged_When_LevelsAreIdentity() {
        BufferedImage source = ImageTestData.solid(new Color(10, 120, 200), 16, 16);

        BufferedImage result = adjuster.apply(source, AdjustmentLevels.identity());

        assertThat(result.getRGB(8, 8)).isEqualTo(source.getRGB(8, 8));
    }

    @Test
    void should_DarkenImage_When_BrightnessHalved() {
        BufferedImage source = ImageTestData.gray(200, 8, 8);

        BufferedImage result = adjuster.apply(source, new AdjustmentLevels(0.5, 1.0, 1.0, 1.0, 0.0));

        assertThat(result.getRGB(4, 4) & 0xFF).isEqualTo(100);
    }

    @Test
    void should_ProduceGray_When_SaturationIsZero() {
        BufferedImage source = ImageTestData.solid(Color.RED, 8, 8);

        int pixel = adjuster.apply(source, new AdjustmentLevels(1.0, 1.0, 0.0, 1.0, 0.0)).getRGB(4, 4);

        int r = (pixel >> 16) & 0xFF;
        int g = (pixel >> 8) & 0xFF;
        int b = pixel & 0xFF;
        assertThat(r).isEqualTo(g).isEqualTo(b).isEqualTo(76);
    }

    @Test
    void should_FlattenToMean_When_ContrastIsZero() {
        BufferedImage source = ImageTestData.gray(0, 10, 10);
        for (int x = 0; x < 10; x++) {
            for (int y = 0; y < 5; y++) {
                source.setRGB(x, y, Color.WHITE.getRGB());
            }
        }

        BufferedImage result = adjuster.apply(source, new AdjustmentLevels(1.0, 0.0, 1.0, 1.0, 0.0));

        assertThat(result.getRGB(0, 0) & 0xFF).isEqualTo(128);
        assertThat(result.getRGB(9, 9) & 0xFF).isEqualTo(128);
    }

    @Test
    void should_RejectLevels_When_OutOfRange() {
        assertThatThrownBy(() -> new AdjustmentLevels(2.5, 1.0, 1.0, 1.0, 0.0)).isInstanceOf(ImageValidationException.class);
        assertThatThrownBy(() -> new AdjustmentLevels(1.0, 1.0, 1.0, 1.0, 11.0)).isInstanceOf(ImageValidationException.class);
    }
}
