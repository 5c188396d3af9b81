package org.tfviewer.datapipeline.formats;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tfviewer.datapipeline.api.decode.ImageData;

import java.awt.image.BufferedImage;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MaskPaletteTest {

    @Test
    void testColorOf_PaletteThenWhite() {
        assertThat(MaskPalette.colorOf(0)).isEqualTo(0x8DD3C7);
        assertThat(MaskPalette.colorOf(11)).isEqualTo(0xFFED6F);
        assertThat(MaskPalette.colorOf(12)).isEqualTo(0xFFFFFF);
        assertThat(MaskPalette.colorOf(255)).isEqualTo(0xFFFFFF);
    }

    @Test
    void testFromRaw_ScalesClassIndices() {
        byte[] raw = new byte[2 * 2 * 2];
        Arrays.fill(raw, 4, 8, (byte) 2);

        ImageData data = MaskPalette.fromRaw(raw, 1, 2, 2, "mask");

        assertThat(data).isInstanceOf(ImageData.RawBlob.class);
        ImageData.RawBlob blob = (ImageData.RawBlob) data;
        assertThat(blob.color()).isFalse();
        assertThat(blob.stride()).isEqualTo(4);
        assertThat(blob.bytes()[0] & 0xFF).isEqualTo(2 * (255 / MaskPalette.MASK_CHANNELS));
        assertThat(blob.bytes()[2]).isZero();
        assertThat(blob.description()).isEqualTo("mask\nSize: 2x2x1");
    }

    @Test
    void testFromRaw_MaskOutsideData() {
        ImageData data = MaskPalette.fromRaw(new byte[4], 1, 2, 2, "mask");

        assertThat(data).isInstanceOf(ImageData.Unavailable.class);
    }

    @Test
    void testFromRaw_SizeBeyondArrayRange() {
        assertThat(MaskPalette.fromRaw(new byte[16], 0, 65536, 65536, "mask")).isInstanceOf(ImageData.Unavailable.class);
        assertThat(MaskPalette.fromRaw(new byte[16], Integer.MAX_VALUE, 2, 2, "mask")).isInstanceOf(ImageData.Unavailable.class);
        BufferedImage stacked = new BufferedImage(2, 4, BufferedImage.TYPE_BYTE_GRAY);
        assertThat(MaskPalette.fromStacked(stacked, 1, 1L << 32, 2, "mask")).isInstanceOf(ImageData.Unavailable.class);
    }

    @Test
    void testFromStacked_CropsAndColours() {
        BufferedImage stacked = new BufferedImage(2, 4, BufferedImage.TYPE_BYTE_GRAY);
        for (int x = 0; x < 2; x++) {
            stacked.getRaster().setSample(x, 0, 0, 12);
            stacked.getRaster().setSample(x, 1, 0, 12);
            stacked.getRaster().setSample(x, 2, 0, 0);
            stacked.getRaster().setSample(x, 3, 0, 1);
        }

        ImageData.RawBlob blob = (ImageData.RawBlob) MaskPalette.fromStacked(stacked, 1, 2, 2, "mask");

        assertThat(blob.color()).isTrue();
        assertThat(blob.width()).isEqualTo(2);
        assertThat(blob.height()).isEqualTo(2);
        assertThat(blob.stride()).isEqualTo(8);
        assertThat(rgbAt(blob, 0, 0)).isEqualTo(MaskPalette.colorOf(0));
        assertThat(rgbAt(blob, 1, 1)).isEqualTo(MaskPalette.colorOf(1));
    }

    @Test
    void testFromStacked_RejectsColourImages() {
        BufferedImage rgb = new BufferedImage(2, 4, BufferedImage.TYPE_INT_RGB);

        assertThat(MaskPalette.fromStacked(rgb, 0, 2, 2, "mask")).isInstanceOf(ImageData.Unavailable.class);
    }

    @Test
    void testFromStacked_MaskBelowImage() {
        BufferedImage stacked = new BufferedImage(2, 4, BufferedImage.TYPE_BYTE_GRAY);

        assertThat(MaskPalette.fromStacked(stacked, 2, 2, 2, "mask")).isInstanceOf(ImageData.Unavailable.class);
    }

    private static int rgbAt(ImageData.RawBlob blob, int x, int y) {
        int base = y * blob.stride() + x * 3;
        byte[] bytes = blob.bytes();
        return (bytes[base] & 0xFF) << 16 | (bytes[base + 1] & 0xFF) << 8 | bytes[base + 2] & 0xFF;
    }
}
