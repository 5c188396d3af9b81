package org.tfviewer.datapipeline.formats;

import org.tfviewer.datapipeline.api.decode.ImageData;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.OptionalInt;

/**
 * Turns encoded or raw pixel data into {@link ImageData.RawBlob}s.
 * <p>
 * Only 8-bit grayscale and RGB without alpha are supported; anything else becomes
 * {@link ImageData.Unavailable}. Output rows are padded to a multiple of four bytes and the
 * description gets a trailing {@code Size: HxWxC} line.
 */
public final class ImageConversion {

    private ImageConversion() {
        // Utility class - prevent instantiation
    }

    /**
     * Decodes a PNG/JPEG/... byte string.
     *
     * @throws IOException if the bytes cannot be read as an image.
     */
    public static BufferedImage decode(byte[] encoded) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
        if (image == null) {
            throw new IOException("Unsupported image format (" + encoded.length + " bytes)");
        }
        return image;
    }

    public static ImageData fromEncoded(byte[] encoded, String description) throws IOException {
        return fromImage(decode(encoded), description);
    }

    public static ImageData fromImage(BufferedImage image, String description) {
        int channels = channelsOf(image);
        if (channels == 1) {
            Raster raster = image.getRaster();
            byte[] pixels = new byte[image.getWidth() * image.getHeight()];
            for (int y = 0; y < image.getHeight(); y++) {
                for (int x = 0; x < image.getWidth(); x++) {
                    pixels[y * image.getWidth() + x] = (byte) raster.getSample(x, y, 0);
                }
            }
            return fromPixels(pixels, image.getWidth(), image.getHeight(), 1, description);
        }
        if (channels == 3) {
            byte[] pixels = new byte[image.getWidth() * image.getHeight() * 3];
            int i = 0;
            for (int y = 0; y < image.getHeight(); y++) {
                for (int x = 0; x < image.getWidth(); x++) {
                    int rgb = image.getRGB(x, y);
                    pixels[i++] = (byte) (rgb >> 16);
                    pixels[i++] = (byte) (rgb >> 8);
                    pixels[i++] = (byte) rgb;
                }
            }
            return fromPixels(pixels, image.getWidth(), image.getHeight(), 3, description);
        }
        return new ImageData.Unavailable("Unsupported pixel layout in " + describeLayout(image));
    }

    /**
     * Interprets unpadded pixel bytes of a {@code height x width} image. The channel count is
     * derived from the byte length.
     */
    public static ImageData fromRaw(byte[] raw, long height, long width, String description) {
        OptionalInt pixels = pixelCount(height, width);
        if (pixels.isEmpty()) {
            return new ImageData.Unavailable("Invalid image size " + height + "x" + width);
        }
        int channels = raw.length / pixels.getAsInt();
        if (raw.length != pixels.getAsInt() * channels || (channels != 1 && channels != 3)) {
            return new ImageData.Unavailable(
                "Raw image of " + raw.length + " bytes does not match " + height + "x" + width);
        }
        return fromPixels(raw, (int) width, (int) height, channels, description);
    }

    /**
     * @return {@code height x width} if both are positive and the product fits an array,
     * otherwise empty.
     */
    public static OptionalInt pixelCount(long height, long width) {
        if (height <= 0 || width <= 0 || height > Integer.MAX_VALUE / width) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) (height * width));
    }

    /**
     * Pads tightly packed rows to the output stride.
     */
    static ImageData.RawBlob fromPixels(byte[] pixels, int width, int height, int channels, String description) {
        int rowLength = width * channels;
        int stride = ImageData.strideFor(width, channels);
        byte[] bytes;
        if (stride == rowLength) {
            bytes = pixels;
        } else {
            bytes = new byte[stride * height];
            for (int y = 0; y < height; y++) {
                System.arraycopy(pixels, y * rowLength, bytes, y * stride, rowLength);
            }
        }
        return new ImageData.RawBlob(bytes, width, height, channels == 3,
            describe(description, height, width, channels));
    }

    static String describe(String description, int height, int width, int channels) {
        return description + "\nSize: " + height + "x" + width + "x" + channels;
    }

    /**
     * @return 1 for 8-bit grayscale, 3 for 8-bit RGB, 0 for anything else.
     */
    static int channelsOf(BufferedImage image) {
        ColorModel model = image.getColorModel();
        if (model instanceof IndexColorModel || model.hasAlpha()) {
            return 0;
        }
        for (int size : model.getComponentSize()) {
            if (size != 8) {
                return 0;
            }
        }
        int components = model.getNumComponents();
        return components == 1 || components == 3 ? components : 0;
    }

    private static String describeLayout(BufferedImage image) {
        ColorModel model = image.getColorModel();
        return "image of type " + image.getType() + " with " + model.getNumComponents()
            + " component(s)" + (model.hasAlpha() ? " and alpha" : "");
    }
}
