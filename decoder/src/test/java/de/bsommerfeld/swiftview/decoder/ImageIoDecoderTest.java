package de.bsommerfeld.swiftview.decoder;

import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.domain.TargetSize;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ImageIoDecoderTest {

    @TempDir
    Path tempDir;

    private final ImageIoDecoder decoder = new ImageIoDecoder();

    @Test
    void decode_withoutTarget_shouldReturnFullResolution() throws Exception {
        Path file = TestImages.writePng(tempDir.resolve("red.png"), 40, 30, Color.RED);

        PixelBuffer pixels = decoder.decode(file, null);

        assertEquals(40, pixels.width());
        assertEquals(30, pixels.height());
        assertEquals(0xFFFF0000, pixels.pixelAt(10, 10));
    }

    @Test
    void decode_withoutTarget_shouldKeepEveryPixelOpaqueAndExact() throws Exception {
        BufferedImage source = new BufferedImage(37, 23, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < source.getHeight(); y++)
            for (int x = 0; x < source.getWidth(); x++)
                source.setRGB(x, y, (x * 7) << 16 | (y * 11) << 8 | (x + y));
        Path file = tempDir.resolve("gradient.png");
        ImageIO.write(source, "png", file.toFile());

        PixelBuffer pixels = decoder.decode(file, null);

        for (int y = 0; y < source.getHeight(); y++)
            for (int x = 0; x < source.getWidth(); x++)
                assertEquals(source.getRGB(x, y), pixels.pixelAt(x, y), "pixel " + x + "," + y);
    }

    @Test
    void decode_withTarget_shouldFitBoxAndKeepAspectRatio() throws Exception {
        Path file = TestImages.writePng(tempDir.resolve("wide.png"), 400, 200, Color.BLUE);

        PixelBuffer pixels = decoder.decode(file, TargetSize.of(100, 100));

        assertEquals(100, pixels.width());
        assertEquals(50, pixels.height());
    }

    @Test
    void decode_withWidthOnly_shouldIgnoreHeight() throws Exception {
        Path file = TestImages.writePng(tempDir.resolve("tall.png"), 100, 400, Color.GREEN);

        PixelBuffer pixels = decoder.decode(file, TargetSize.width(50));

        assertEquals(50, pixels.width());
        assertEquals(200, pixels.height());
    }

    @Test
    void decode_shouldNeverUpscale() throws Exception {
        Path file = TestImages.writePng(tempDir.resolve("small.png"), 50, 40, Color.GRAY);

        PixelBuffer pixels = decoder.decode(file, TargetSize.of(256, 195));

        assertEquals(50, pixels.width());
        assertEquals(40, pixels.height());
    }

    @Test
    void decode_shouldFlattenTransparencyOntoBlack() throws Exception {
        BufferedImage argb = new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB);
        Path file = tempDir.resolve("clear.png");
        ImageIO.write(argb, "png", file.toFile());

        PixelBuffer pixels = decoder.decode(file, null);

        assertTrue(Arrays.stream(pixels.pixels()).allMatch(p -> p == 0xFF000000));
    }

    @Test
    void decodeToEncodedBytes_shouldProducePngWithSourceDimensions() throws Exception {
        Path file = TestImages.writePng(tempDir.resolve("photo.png"), 800, 600, Color.ORANGE);

        EncodedImage encoded = decoder.decodeToEncodedBytes(file, TargetSize.of(256, 195));

        assertEquals(800, encoded.sourceWidth());
        assertEquals(600, encoded.sourceHeight());
        assertEquals(256, encoded.width());
        assertEquals(192, encoded.height());
        assertEquals((byte) 0x89, encoded.bytes()[0]);
        assertEquals('P', encoded.bytes()[1]);

        PixelBuffer roundTrip = decoder.decodeEncoded(encoded.bytes());
        assertEquals(encoded.width(), roundTrip.width());
    }

    @Test
    void readDimensions_shouldReadHeader() throws Exception {
        Path file = TestImages.writePng(tempDir.resolve("dims.png"), 123, 45, Color.WHITE);

        assertEquals(new Dimensions(123, 45), decoder.readDimensions(file));
    }

    @Test
    void decode_missingFile_shouldFailUnreadable() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> decoder.decode(tempDir.resolve("nope.png"), null));

        assertEquals(DecodeError.Kind.UNREADABLE, e.getError().kind());
    }

    @Test
    void decode_directory_shouldFailUnreadable() {
        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode(tempDir, null));

        assertEquals(DecodeError.Kind.UNREADABLE, e.getError().kind());
    }

    @Test
    void decode_unknownContent_shouldFailUnsupportedFormat() throws IOException {
        Path file = tempDir.resolve("notes.png");
        Files.writeString(file, "this is not an image, just text pretending to be one");

        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode(file, null));

        assertEquals(DecodeError.Kind.UNSUPPORTED_FORMAT, e.getError().kind());
    }

    @Test
    void decode_truncatedFile_shouldFailCorrupt() throws Exception {
        Path full = TestImages.writePng(tempDir.resolve("full.png"), 64, 64, Color.MAGENTA);
        byte[] bytes = Files.readAllBytes(full);
        // signature and IHDR survive, image data does not
        Path truncated = Files.write(tempDir.resolve("truncated.png"), Arrays.copyOf(bytes, 45));

        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode(truncated, null));

        assertEquals(DecodeError.Kind.CORRUPT, e.getError().kind());
    }

    @Test
    void decodeEncoded_garbage_shouldFailCorrupt() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> decoder.decodeEncoded(new byte[] { 1, 2, 3, 4, 5 }));

        assertEquals(DecodeError.Kind.CORRUPT, e.getError().kind());
    }

    @Test
    void scaleFor_shouldUseTighterAxis() {
        assertEquals(0.5, ImageIoDecoder.scaleFor(400, 200, TargetSize.of(200, 200)), 1e-9);
        assertEquals(0.25, ImageIoDecoder.scaleFor(400, 800, TargetSize.of(200, 200)), 1e-9);
        assertEquals(1.0, ImageIoDecoder.scaleFor(400, 800, null), 1e-9);
    }

    @Test
    void subsamplingStep_shouldKeepTwiceTheTargetResolution() {
        assertEquals(1, ImageIoDecoder.subsamplingStep(1.0));
        assertEquals(1, ImageIoDecoder.subsamplingStep(0.5));
        assertEquals(2, ImageIoDecoder.subsamplingStep(0.25));
        assertEquals(5, ImageIoDecoder.subsamplingStep(0.1));
    }
}
