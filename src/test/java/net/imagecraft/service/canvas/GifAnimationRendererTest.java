package net.imagecraft.service.canvas;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.GifEffect;
import net.imagecraft.testutil.ImageTestData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class GifAnimationRendererTest {

    private final GifAnimationRenderer renderer = new GifAnimationRenderer();

    @Test
    void should_RoundDurationTimesFps_When_CountingFrames() {
        assertThat(GifAnimationRenderer.frameCount(2.0, 15)).isEqualTo(30);
        assertThat(GifAnimationRenderer.frameCount(1.0, 24)).isEqualTo(24);
        assertThat(GifAnimationRenderer.frameCount(0.01, 1)).isEqualTo(1);
    }

    @Test
    void should_RoundHalfToEven_When_FrameCountIsExactlyHalf() {
        assertThat(GifAnimationRenderer.frameCount(0.5, 5)).isEqualTo(2);
        assertThat(GifAnimationRenderer.frameCount(1.5, 5)).isEqualTo(8);
    }

    @Test
    void should_TruncateDelays_When_FpsDoesNotDivideOneSecond() {
        assertThat(GifAnimationRenderer.frameDelayMillis(15)).isEqualTo(66);
        assertThat(GifAnimationRenderer.frameDelayMillis(24)).isEqualTo(41);
        assertThat(GifSequenceEncoder.delayCentiseconds(66)).isEqualTo(6);
        assertThat(GifSequenceEncoder.delayCentiseconds(100)).isEqualTo(10);
        assertThat(GifSequenceEncoder.delayCentiseconds(5)).isEqualTo(1);
    }

    @Test
    void should_FollowEffectCurves_When_ProgressAdvances() {
        assertThat(GifAnimationRenderer.zoomScale(0.0)).isEqualTo(1.0);
        assertThat(GifAnimationRenderer.zoomScale(0.5)).isCloseTo(1.15, within(1e-9));
        assertThat(GifAnimationRenderer.zoomScale(1.0)).isCloseTo(1.3, within(1e-9));

        assertThat(GifAnimationRenderer.pulseScale(0.0)).isEqualTo(1.0);
        assertThat(GifAnimationRenderer.pulseScale(0.25)).isCloseTo(1.1, within(1e-9));
        assertThat(GifAnimationRenderer.pulseScale(0.5)).isCloseTo(1.0, within(1e-9));
        assertThat(GifAnimationRenderer.pulseScale(0.75)).isCloseTo(0.9, within(1e-9));

        assertThat(GifAnimationRenderer.rotationDegrees(0.0)).isEqualTo(-5.0);
        assertThat(GifAnimationRenderer.rotationDegrees(0.5)).isEqualTo(0.0);
        assertThat(GifAnimationRenderer.rotationDegrees(1.0)).isEqualTo(5.0);
    }

    @Test
    void should_SlidePanWindowByTwentyPercent_When_ProgressAdvances() {
        assertThat(GifAnimationRenderer.panWindowWidth(100)).isEqualTo(80);
        assertThat(GifAnimationRenderer.panOffset(100, 0.0)).isZero();
        assertThat(GifAnimationRenderer.panOffset(100, 0.5)).isEqualTo(10);
        assertThat(GifAnimationRenderer.panOffset(100, 1.0)).isEqualTo(20);
        assertThat(GifAnimationRenderer.panOffset(1000, 1.0)).isEqualTo(200);
    }

    @Test
    void should_CropCenteredWindow_When_Zooming() {
        BufferedImage source = horizontalRamp(100, 40);

        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.ZOOM, 0.0), 50, 20)).isEqualTo(100);
        // 1.15: 86 px window starting at x=7
        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.ZOOM, 0.5), 0, 20)).isCloseTo(14, within(4));
        // 1.3: 76 px window starting at x=12
        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.ZOOM, 1.0), 0, 20)).isCloseTo(24, within(4));
        // pulse at t=0.25 matches a 1.1 zoom: 90 px window starting at x=5
        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.PULSE, 0.25), 0, 20)).isCloseTo(10, within(4));
    }

    @Test
    void should_ShowShiftedWindow_When_Panning() {
        BufferedImage source = horizontalRamp(100, 40);

        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.PAN, 0.0), 0, 20)).isCloseTo(0, within(4));
        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.PAN, 0.0), 99, 20)).isCloseTo(158, within(4));
        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.PAN, 0.5), 0, 20)).isCloseTo(20, within(4));
        assertThat(red(GifAnimationRenderer.frame(source, GifEffect.PAN, 1.0), 0, 20)).isCloseTo(40, within(4));
    }

    @Test
    void should_TiltAndFillCornersBlack_When_Rotating() {
        BufferedImage source = splitRedOverBlue(200);

        BufferedImage start = GifAnimationRenderer.frame(source, GifEffect.ROTATE, 0.0);
        BufferedImage middle = GifAnimationRenderer.frame(source, GifEffect.ROTATE, 0.5);
        BufferedImage end = GifAnimationRenderer.frame(source, GifEffect.ROTATE, 1.0);

        // -5 degrees turns clockwise on screen: the right side of the split drops about 8 px
        assertThat(isRed(start, 190, 104)).isTrue();
        assertThat(isBlue(start, 190, 112)).isTrue();
        assertThat(isBlue(start, 10, 104)).isTrue();
        assertThat(start.getRGB(0, 0) & 0xFFFFFF).isZero();

        assertThat(isRed(middle, 190, 96)).isTrue();
        assertThat(isBlue(middle, 190, 104)).isTrue();
        assertThat(isRed(middle, 0, 0)).isTrue();

        assertThat(isBlue(end, 190, 104)).isTrue();
        assertThat(isRed(end, 10, 104)).isTrue();
        assertThat(end.getRGB(199, 199) & 0xFFFFFF).isZero();
    }

    @Test
    void should_ScaleBrightnessByProgress_When_Fading() {
        BufferedImage source = ImageTestData.solid(new Color(200, 100, 50), 8, 8);

        assertThat(GifAnimationRenderer.frame(source, GifEffect.FADE, 0.0).getRGB(4, 4) & 0xFFFFFF).isZero();
        assertThat(GifAnimationRenderer.frame(source, GifEffect.FADE, 0.5).getRGB(4, 4) & 0xFFFFFF)
            .isEqualTo(new Color(100, 50, 25).getRGB() & 0xFFFFFF);
        assertThat(GifAnimationRenderer.frame(source, GifEffect.FADE, 1.0).getRGB(4, 4) & 0xFFFFFF)
            .isEqualTo(new Color(200, 100, 50).getRGB() & 0xFFFFFF);
    }

    @Test
    void should_Reject_When_DurationOrFpsOutOfRange() {
        assertThatThrownBy(() -> GifAnimationRenderer.frameCount(0.0, 10)).isInstanceOf(ImageValidationException.class);
        assertThatThrownBy(() -> GifAnimationRenderer.frameCount(10.5, 10)).isInstanceOf(ImageValidationException.class);
        assertThatThrownBy(() -> GifAnimationRenderer.frameCount(1.0, 31)).isInstanceOf(ImageValidationException.class);
    }

    @ParameterizedTest
    @EnumSource(GifEffect.class)
    void should_BoundFramesTo512_When_SourceIsLarge(GifEffect effect) {
        BufferedImage source = ImageTestData.solid(Color.CYAN, 1024, 768);

        List<BufferedImage> frames = renderer.renderFrames(source, effect, 0.5, 8);

        assertThat(frames).hasSize(4);
        assertThat(frames).allSatisfy(frame -> {
            assertThat(frame.getWidth()).isLessThanOrEqualTo(512);
            assertThat(frame.getHeight()).isLessThanOrEqualTo(512);
        });
    }

    @Test
    void should_FadeFromBlack_When_EffectIsFade() {
        BufferedImage source = ImageTestData.solid(Color.WHITE, 32, 32);

        List<BufferedImage> frames = renderer.renderFrames(source, GifEffect.FADE, 1.0, 3);

        assertThat(frames.get(0).getRGB(16, 16) & 0xFFFFFF).isZero();
        assertThat(frames.get(2).getRGB(16, 16) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    }

    @Test
    void should_EncodeGif_When_Rendering() {
        byte[] png = ImageTestData.solidPng(Color.MAGENTA, 64, 64);

        GifAnimation animation = renderer.render(png, GifEffect.ZOOM, 1.0, 10);

        assertThat(animation.frameCount()).isEqualTo(10);
        assertThat(animation.frameDelayMillis()).isEqualTo(100);
        assertThat(new String(animation.bytes(), 0, 6, StandardCharsets.US_ASCII)).isEqualTo("GIF89a");
    }

    /** Red channel equal to {@code 2x}. */
    private static BufferedImage horizontalRamp(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, new Color(Math.min(255, 2 * x), 0, 0).getRGB());
            }
        }
        return image;
    }

    private static BufferedImage splitRedOverBlue(int size) {
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                image.setRGB(x, y, (y < size / 2 ? Color.RED : Color.BLUE).getRGB());
            }
        }
        return image;
    }

    private static int red(BufferedImage image, int x, int y) {
        return (image.getRGB(x, y) >> 16) & 0xFF;
    }

    private static boolean isRed(BufferedImage image, int x, int y) {
        int rgb = image.getRGB(x, y);
        return ((rgb >> 16) & 0xFF) > 200 && (rgb & 0xFF) < 55;
    }

    private static boolean isBlue(BufferedImage image, int x, int y) {
        int rgb = image.getRGB(x, y);
        return (rgb & 0xFF) > 200 && ((rgb >> 16) & 0xFF) < 55;
    }
}
