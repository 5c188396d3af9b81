package org.tfviewer.datapipeline.formats;

import com.google.protobuf.ByteString;
import org.tfviewer.datapipeline.api.contracts.Example;
import org.tfviewer.datapipeline.api.contracts.Feature;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Read access to the first value of named features of a {@link Example}, following the field
 * names used by image segmentation datasets.
 */
public final class ExampleFeatures {

    public static final String HEIGHT = "height";
    public static final String WIDTH = "width";
    public static final String IDENTIFIER = "identifier";
    public static final String LABEL = "label";
    public static final String IMAGE_RAW = "image_raw";
    public static final String IMAGE_COMPRESSED = "image_compressed";
    public static final String MASK_RAW = "mask_raw";
    public static final String MASK_COMPRESSED = "mask_compressed";

    private final Map<String, Feature> features;

    private ExampleFeatures(Map<String, Feature> features) {
        this.features = features;
    }

    public static ExampleFeatures of(Example example) {
        return new ExampleFeatures(example.getFeatures().getFeatureMap());
    }

    public boolean has(String name) {
        return features.containsKey(name);
    }

    /**
     * @return true if both {@value #HEIGHT} and {@value #WIDTH} are present.
     */
    public boolean hasSize() {
        return int64(HEIGHT).isPresent() && int64(WIDTH).isPresent();
    }

    public long height() {
        return int64(HEIGHT).orElse(0);
    }

    public long width() {
        return int64(WIDTH).orElse(0);
    }

    /**
     * @return {@code height x width}, empty if the size is missing or does not fit a pixel array.
     */
    public OptionalInt pixelCount() {
        return ImageConversion.pixelCount(height(), width());
    }

    public OptionalLong int64(String name) {
        Feature feature = features.get(name);
        if (feature == null || !feature.hasInt64List() || feature.getInt64List().getValueCount() == 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(feature.getInt64List().getValue(0));
    }

    public Optional<ByteString> bytes(String name) {
        Feature feature = features.get(name);
        if (feature == null || !feature.hasBytesList() || feature.getBytesList().getValueCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(feature.getBytesList().getValue(0));
    }

    public Optional<String> string(String name) {
        return bytes(name).map(ByteString::toStringUtf8);
    }
}
