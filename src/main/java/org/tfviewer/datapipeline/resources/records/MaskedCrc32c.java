package org.tfviewer.datapipeline.resources.records;

import java.util.zip.CRC32C;

/**
 * CRC-32C checksums in the masked form used by the TFRecord framing.
 */
public final class MaskedCrc32c {

    private static final int MASK_DELTA = 0xa282ead8;

    private MaskedCrc32c() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static int crc32c(byte[] data, int offset, int length) {
        CRC32C crc = new CRC32C();
        crc.update(data, offset, length);
        return (int) crc.getValue();
    }

    public static int mask(int crc) {
        return ((crc >>> 15) | (crc << 17)) + MASK_DELTA;
    }

    public static int unmask(int maskedCrc) {
        int rot = maskedCrc - MASK_DELTA;
        return (rot >>> 17) | (rot << 15);
    }

    /**
     * @return The masked CRC-32C of {@code data[offset, offset + length)}.
     */
    public static int maskedCrc32c(byte[] data, int offset, int length) {
        return mask(crc32c(data, offset, length));
    }
}
