package org.tfviewer.datapipeline.formats;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.datapipeline.api.contracts.Example;
import org.tfviewer.datapipeline.api.decode.DecodedRecord;
import org.tfviewer.datapipeline.api.decode.DecodedValue;
import org.tfviewer.datapipeline.api.decode.RecordDecoder;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Decodes {@link Example} records of image segmentation datasets.
 * <p>
 * A record with {@code height} and {@code width} yields an {@value #IMAGE_TAG} value if it has
 * {@code image_raw} or {@code image_compressed}, and one {@code mask/<i>} value per mask packed
 * into {@code mask_raw} or {@code mask_compressed}. The payload index of a mask value is the
 * mask index. Records carry no step, the loader numbers them. A size whose pixel count does
 * not fit an array makes the record malformed.
 */
public class ExampleRecordDecoder implements RecordDecoder {

    private static final Logger log = LoggerFactory.getLogger(ExampleRecordDecoder.class);

    public static final String IMAGE_TAG = "image";
    public static final String MASK_TAG = "mask";

    @Override
    public DecodedRecord decodeRecord(byte[] payload) throws InvalidProtocolBufferException {
        ExampleFeatures features = ExampleFeatures.of(Example.parseFrom(payload));
        if (!features.hasSize()) {
            return DecodedRecord.empty();
        }
        if (features.pixelCount().isEmpty()) {
            throw new InvalidProtocolBufferException(
                "Invalid image size " + features.height() + "x" + features.width());
        }
        String description = describe(features);
        List<DecodedValue> values = new ArrayList<>();
        if (features.has(ExampleFeatures.IMAGE_RAW) || features.has(ExampleFeatures.IMAGE_COMPRESSED)) {
            values.add(DecodedValue.payload(IMAGE_TAG, 0, description));
        }
        int masks = countMasks(features);
        for (int i = 0; i < masks; i++) {
            values.add(DecodedValue.payload(MASK_TAG + "/" + i, i, description));
        }
        return new DecodedRecord(OptionalLong.empty(), values);
    }

    /**
     * @return The {@code Name:} and {@code Label:} lines for the record, possibly empty.
     */
    static String describe(ExampleFeatures features) {
        StringBuilder description = new StringBuilder();
        features.string(ExampleFeatures.IDENTIFIER).ifPresent(name -> description.append("Name: ").append(name));
        OptionalLong label = features.int64(ExampleFeatures.LABEL);
        if (label.isPresent()) {
            if (description.length() > 0) {
                description.append('\n');
            }
            description.append("Label: ").append(label.getAsLong());
        }
        return description.toString();
    }

    /**
     * Counts the masks in a record. Raw masks are {@code masks x height x width} bytes; compressed
     * masks are one image with all masks stacked vertically.
     */
    static int countMasks(ExampleFeatures features) {
        OptionalInt pixels = features.pixelCount();
        if (pixels.isEmpty()) {
            return 0;
        }
        Optional<ByteString> raw = features.bytes(ExampleFeatures.MASK_RAW);
        if (raw.isPresent()) {
            return raw.get().size() / pixels.getAsInt();
        }
        Optional<ByteString> compressed = features.bytes(ExampleFeatures.MASK_COMPRESSED);
        if (compressed.isPresent()) {
            try {
                return (int) (readImageHeight(compressed.get()) / features.height());
            } catch (IOException e) {
                log.warn("Cannot read compressed mask header: {}", e.getMessage());
                return 0;
            }
        }
        return 0;
    }

    /**
     * Reads the height of an encoded image from its header without decoding pixels.
     */
    static int readImageHeight(ByteString encoded) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(encoded.newInput())) {
            if (in == null) {
                throw new IOException("No image input stream available");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IOException("Unsupported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return reader.getHeight(0);
            } finally {
                reader.dispose();
            }
        }
    }
}
