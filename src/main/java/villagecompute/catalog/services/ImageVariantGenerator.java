/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import com.google.common.hash.Hashing;
import jakarta.enterprise.context.ApplicationScoped;
import net.coobird.thumbnailator.Thumbnails;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Produces the fixed set of width-targeted JPEG derivatives of an image.
 *
 * <p>
 * Every variant is scaled to exactly its target width (upscaling smaller sources) with
 * {@code height = round(sourceHeight * targetWidth / sourceWidth)}, then encoded as RGB JPEG at
 * {@code catalog.images.jpeg-quality}.
 */
@ApplicationScoped
public class ImageVariantGenerator {

    /**
     * Target widths, in generation order.
     */
    public static final List<Integer> TARGET_WIDTHS = List.of(256, 512, 1024);

    public static final String CONTENT_TYPE = "image/jpeg";

    @ConfigProperty(
            name = "catalog.images.jpeg-quality",
            defaultValue = "0.85")
    double jpegQuality;

    /**
     * One encoded variant.
     */
    public record RenderedVariant(int width, int height, byte[] bytes, String checksum) {

        public String label() {
            return String.valueOf(width);
        }
    }

    /**
     * Decodes image bytes.
     *
     * @param bytes
     *            assembled file content
     * @return decoded image
     * @throws IOException
     *             if the bytes are not a readable image
     */
    public BufferedImage decode(byte[] bytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("Unsupported or corrupt image data (" + bytes.length + " bytes)");
        }
        return image;
    }

    /**
     * Scales and encodes one variant.
     *
     * @param source
     *            decoded source image
     * @param targetWidth
     *            width of the variant in pixels
     * @return encoded variant with its dimensions and SHA-256
     * @throws IOException
     *             if encoding fails
     */
    public RenderedVariant render(BufferedImage source, int targetWidth) throws IOException {
        int targetHeight = scaledHeight(source.getWidth(), source.getHeight(), targetWidth);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Thumbnails.of(source).size(targetWidth, targetHeight).keepAspectRatio(false)
                .imageType(BufferedImage.TYPE_INT_RGB).outputFormat("jpg").outputQuality(jpegQuality)
                .toOutputStream(out);

        byte[] encoded = out.toByteArray();
        return new RenderedVariant(targetWidth, targetHeight, encoded, Hashing.sha256().hashBytes(encoded).toString());
    }

    /**
     * Height preserving the source aspect ratio at {@code targetWidth}, rounded half up, never below 1.
     */
    public static int scaledHeight(int sourceWidth, int sourceHeight, int targetWidth) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + sourceWidth + "x" + sourceHeight);
        }
        long height = Math.round((double) sourceHeight * targetWidth / sourceWidth);
        return (int) Math.max(1, height);
    }
}
