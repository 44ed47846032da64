package de.bsommerfeld.swiftview.decoder;

import de.bsommerfeld.swiftview.core.domain.DecodeError.Kind;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.domain.TargetSize;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.FileImageInputStream;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.awt.image.SampleModel;
import java.awt.image.SinglePixelPackedSampleModel;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * {@link Decoder} backed by {@code javax.imageio}.
 *
 * <p>
 * Failure mapping:
 * <ul>
 * <li>missing, unreadable or non-regular file: {@code UNREADABLE}</li>
 * <li>no registered reader for the content: {@code UNSUPPORTED_FORMAT}</li>
 * <li>a reader accepted the header but the data is broken:
 * {@code CORRUPT}</li>
 * </ul>
 *
 * Down-sampled decodes use reader-side subsampling first and a bilinear
 * scale for the rest. Output is always opaque RGB; transparent pixels are
 * flattened against black.
 *
 * <p>
 * Full-resolution decodes of opaque images are read straight into an
 * {@code INT_RGB} image whose backing array becomes the {@link PixelBuffer},
 * so a view holds one copy of the pixels.
 */
public class ImageIoDecoder implements Decoder {

    @Override
    public PixelBuffer decode(Path file, TargetSize target) throws DecodeException {
        return toPixels(read(file, target).image());
    }

    @Override
    public EncodedImage decodeToEncodedBytes(Path file, TargetSize target) throws DecodeException {
        Decoded decoded = read(file, target);
        BufferedImage image = decoded.image();
        return new EncodedImage(encodePng(image, file.toString()), image.getWidth(), image.getHeight(),
                decoded.sourceWidth(), decoded.sourceHeight());
    }

    @Override
    public Dimensions readDimensions(Path file) throws DecodeException {
        checkReadable(file);
        try (ImageInputStream in = new FileImageInputStream(file.toFile())) {
            ImageReader reader = firstReader(in, file);
            try {
                reader.setInput(in, true, true);
                return new Dimensions(reader.getWidth(0), reader.getHeight(0));
            } catch (IOException | RuntimeException e) {
                throw new DecodeException(Kind.CORRUPT, "Unreadable header in " + file + ": " + e.getMessage(), e);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new DecodeException(Kind.UNREADABLE, "Cannot open " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public PixelBuffer decodeEncoded(byte[] encoded) throws DecodeException {
        if (encoded == null || encoded.length == 0)
            throw new DecodeException(Kind.CORRUPT, "Empty image data", null);
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
            if (image == null)
                throw new DecodeException(Kind.CORRUPT, "Unrecognized image data (" + encoded.length + " bytes)",
                        null);
            return toPixels(fit(image, image.getWidth(), image.getHeight()));
        } catch (IOException | RuntimeException e) {
            throw new DecodeException(Kind.CORRUPT, "Broken image data: " + e.getMessage(), e);
        }
    }

    // =====================================================================
    // Reading
    // =====================================================================

    private Decoded read(Path file, TargetSize target) throws DecodeException {
        checkReadable(file);
        try (ImageInputStream in = new FileImageInputStream(file.toFile())) {
            ImageReader reader = firstReader(in, file);
            try {
                reader.setInput(in, true, true);
                int sourceWidth = reader.getWidth(0);
                int sourceHeight = reader.getHeight(0);

                double scale = scaleFor(sourceWidth, sourceHeight, target);
                ImageReadParam param = reader.getDefaultReadParam();
                int step = subsamplingStep(scale);
                if (step > 1)
                    param.setSourceSubsampling(step, step, 0, 0);
                preferIntRgb(reader, param);

                BufferedImage raw = reader.read(0, param);
                int width = Math.max(1, (int) Math.round(sourceWidth * scale));
                int height = Math.max(1, (int) Math.round(sourceHeight * scale));
                return new Decoded(fit(raw, width, height), sourceWidth, sourceHeight);
            } catch (IOException | RuntimeException e) {
                throw new DecodeException(Kind.CORRUPT, "Failed to decode " + file + ": " + e.getMessage(), e);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new DecodeException(Kind.UNREADABLE, "Cannot open " + file + ": " + e.getMessage(), e);
        }
    }

    private static void checkReadable(Path file) throws DecodeException {
        if (!Files.isRegularFile(file) || !Files.isReadable(file))
            throw new DecodeException(Kind.UNREADABLE, "Not a readable file: " + file, null);
    }

    /** Decodes into {@code INT_RGB} when the reader offers it for this image. */
    private static void preferIntRgb(ImageReader reader, ImageReadParam param) throws IOException {
        Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
        while (types.hasNext()) {
            ImageTypeSpecifier type = types.next();
            if (type.getBufferedImageType() == BufferedImage.TYPE_INT_RGB) {
                param.setDestinationType(type);
                return;
            }
        }
    }

    private static ImageReader firstReader(ImageInputStream in, Path file) throws DecodeException {
        Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
        if (!readers.hasNext())
            throw new DecodeException(Kind.UNSUPPORTED_FORMAT, "No image reader for " + file, null);
        return readers.next();
    }

    // =====================================================================
    // Geometry
    // =====================================================================

    /**
     * Uniform scale that fits the source into the target box. Unconstrained
     * axes are ignored; the result never exceeds 1.
     */
    static double scaleFor(int sourceWidth, int sourceHeight, TargetSize target) {
        if (target == null || target.isUnbounded())
            return 1.0;
        double scale = 1.0;
        if (target.width() > 0)
            scale = Math.min(scale, (double) target.width() / sourceWidth);
        if (target.height() > 0)
            scale = Math.min(scale, (double) target.height() / sourceHeight);
        return scale;
    }

    /** Reader subsampling keeps about twice the final resolution. */
    static int subsamplingStep(double scale) {
        if (scale >= 1.0)
            return 1;
        return Math.max(1, (int) Math.floor(1.0 / scale) / 2);
    }

    /** {@code source} itself if it already is opaque RGB of that size. */
    private static BufferedImage fit(BufferedImage source, int width, int height) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB && source.getWidth() == width
                && source.getHeight() == height)
            return source;
        return render(source, width, height);
    }

    private static BufferedImage render(BufferedImage source, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, width, height);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static PixelBuffer toPixels(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] backing = packedRgb(image);
        if (backing == null)
            return new PixelBuffer(w, h, image.getRGB(0, 0, w, h, null, 0, w));

        // INT_RGB leaves the alpha byte undefined
        for (int i = 0; i < backing.length; i++)
            backing[i] |= 0xFF000000;
        return new PixelBuffer(w, h, backing);
    }

    /**
     * The backing array of an {@code INT_RGB} image laid out as one int per
     * pixel without padding, or {@code null}.
     */
    private static int[] packedRgb(BufferedImage image) {
        if (image.getType() != BufferedImage.TYPE_INT_RGB)
            return null;
        WritableRaster raster = image.getRaster();
        SampleModel model = raster.getSampleModel();
        if (!(raster.getDataBuffer() instanceof DataBufferInt buffer)
                || !(model instanceof SinglePixelPackedSampleModel packed))
            return null;
        if (buffer.getNumBanks() != 1 || buffer.getOffset() != 0
                || raster.getSampleModelTranslateX() != 0 || raster.getSampleModelTranslateY() != 0
                || packed.getScanlineStride() != image.getWidth())
            return null;
        int[] data = buffer.getData();
        return data.length == image.getWidth() * image.getHeight() ? data : null;
    }

    private static byte[] encodePng(BufferedImage image, String source) throws DecodeException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out))
                throw new DecodeException(Kind.INTERNAL, "No PNG writer available", null);
        } catch (IOException e) {
            throw new DecodeException(Kind.INTERNAL, "Failed to encode thumbnail of " + source, e);
        }
        return out.toByteArray();
    }

    private record Decoded(BufferedImage image, int sourceWidth, int sourceHeight) {
    }
}
