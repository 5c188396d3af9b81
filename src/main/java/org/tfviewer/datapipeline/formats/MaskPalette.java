package org.tfviewer.datapipeline.formats;

import org.tfviewer.datapipeline.api.decode.ImageData;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Renders segmentation masks.
 * <p>
 * Raw masks hold small class indices (at most {@link #MASK_CHANNELS}) and are scaled to the
 * full gray range. Compressed masks are 8-bit PNGs with all masks stacked vertically; each
 * mask is cropped out and coloured through a 12-colour palette, other indices render white.
 */
public final class MaskPalette {

    static final int MASK_CHANNELS = 8;

    private static final int[] DEFAULT_COLORS = {
        141, 211, 199,
        255, 255, 179,
        190, 186, 218,
        251, 128, 114,
        128, 177, 211,
        253, 180, 98,
        179, 222, 105,
        252, 205, 229,
        217, 217, 217,
        188, 128, 189,
        204, 235, 197,
        255, 237, 111,
    };

    private static final byte[] LOOKUP = buildLookup();

    private MaskPalette() {
        // Utility class - prevent instantiation
    }

    private static byte[] buildLookup() {
        byte[] lookup = new byte[256 * 3];
        Arrays.fill(lookup, (byte) 255);
        for (int i = 0; i < DEFAULT_COLORS.length; i++) {
            lookup[i] = (byte) DEFAULT_COLORS[i];
        }
        return lookup;
    }

    /**
     * @return The RGB colour of a mask index as {@code 0xRRGGBB}.
     */
    public static int colorOf(int index) {
        int base = (index & 0xFF) * 3;
        return (LOOKUP[base] & 0xFF) << 16 | (LOOKUP[base + 1] & 0xFF) << 8 | LOOKUP[base + 2] & 0xFF;
    }

    /**
     * Extracts mask {@code maskIndex} from a raw {@code masks x height x width} blob as a scaled
     * grayscale image.
     */
    public static ImageData fromRaw(byte[] raw, int maskIndex, long height, long width, String description) {
        OptionalInt count = ImageConversion.pixelCount(height, width);
        if (count.isEmpty()) {
            return new ImageData.Unavailable("Invalid mask size " + height + "x" + width);
        }
        int size = count.getAsInt();
        long end = (maskIndex + 1L) * size;
        if (maskIndex < 0 || end > raw.length) {
            return new ImageData.Unavailable("Mask " + maskIndex + " is outside the raw mask data");
        }
        int from = (int) (end - size);
        int factor = 255 / MASK_CHANNELS;
        byte[] pixels = new byte[size];
        for (int i = 0; i < size; i++) {
            pixels[i] = (byte) Math.min(255, (raw[from + i] & 0xFF) * factor);
        }
        return ImageConversion.fromPixels(pixels, (int) width, (int) height, 1, description);
    }

    /**
     * Crops mask {@code maskIndex} out of a vertically stacked 8-bit mask image and colours it.
     */
    public static ImageData fromStacked(BufferedImage stacked, int maskIndex, long height, long width,
                                        String description) {
        if (ImageConversion.channelsOf(stacked) != 1) {
            return new ImageData.Unavailable("Compressed mask is not an 8-bit grayscale image");
        }
        long bottom = (maskIndex + 1L) * height;
        int cropWidth = (int) Math.min(width, stacked.getWidth());
        if (maskIndex < 0 || height <= 0 || bottom > stacked.getHeight() || cropWidth <= 0) {
            return new ImageData.Unavailable("Mask " + maskIndex + " is outside the compressed mask image");
        }
        int rows = (int) height;
        int top = (int) bottom - rows;
        Raster raster = stacked.getRaster();
        byte[] pixels = new byte[cropWidth * rows * 3];
        int i = 0;
        for (int y = top; y < top + rows; y++) {
            for (int x = 0; x < cropWidth; x++) {
                int base = raster.getSample(x, y, 0) * 3;
                pixels[i++] = LOOKUP[base];
                pixels[i++] = LOOKUP[base + 1];
                pixels[i++] = LOOKUP[base + 2];
            }
        }
        return ImageConversion.fromPixels(pixels, cropWidth, rows, 3, description);
    }
}
