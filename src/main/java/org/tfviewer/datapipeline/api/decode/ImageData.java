package org.tfviewer.datapipeline.api.decode;

import java.util.Objects;

/**
 * Result of materializing the heavy payload of an image entry.
 */
public sealed interface ImageData permits ImageData.CompressedBlob, ImageData.RawBlob, ImageData.Unavailable {

    /**
     * Encoded image bytes (PNG, JPEG, ...) that the consumer decodes itself.
     */
    record CompressedBlob(byte[] bytes) implements ImageData {
        public CompressedBlob {
            Objects.requireNonNull(bytes, "bytes");
        }
    }

    /**
     * Decoded pixel rows. Each row is padded to a multiple of four bytes; pixels are one byte
     * (grayscale) or three bytes (RGB) wide.
     */
    record RawBlob(byte[] bytes, int width, int height, boolean color, String description) implements ImageData {
        public RawBlob {
            Objects.requireNonNull(bytes, "bytes");
        }

        public int stride() {
            return strideFor(width, color ? 3 : 1);
        }
    }

    /**
     * The payload exists but cannot be turned into an image.
     */
    record Unavailable(String reason) implements ImageData {
    }

    /**
     * Row length in bytes for the given width and channel count, rounded up to a multiple of four.
     */
    static int strideFor(int width, int channels) {
        int stride = width * channels;
        return (stride + 3) / 4 * 4;
    }
}
