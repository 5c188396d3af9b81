package org.tfviewer.datapipeline.entries;

import com.google.protobuf.ByteString;
import org.tfviewer.datapipeline.api.contracts.Example;
import org.tfviewer.datapipeline.api.decode.ImageData;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.formats.ExampleFeatures;
import org.tfviewer.datapipeline.formats.ImageConversion;
import org.tfviewer.datapipeline.resources.files.TrackedFile;
import org.tfviewer.datapipeline.services.decode.DecodeWorkerPool;

import java.io.IOException;
import java.util.Optional;

/**
 * The input image of a record file example, stored raw or compressed.
 */
public class RecordImageEntry extends ImageEntry {

    private final String description;

    public RecordImageEntry(TrackedFile file, long offset, Tag tag, long step, LoaderId loaderId,
                            DecodeWorkerPool pool, String description) {
        super(file, offset, tag, step, loaderId, pool);
        this.description = description;
    }

    @Override
    public ImageData readImageData() throws IOException {
        ExampleFeatures features = ExampleFeatures.of(
            requireFile().readCachedAndDecodeAt(getOffset(), Example.parser()));
        if (!features.hasSize()) {
            return new ImageData.Unavailable("Example has no image size");
        }
        String info = describe(description);
        Optional<ByteString> raw = features.bytes(ExampleFeatures.IMAGE_RAW);
        if (raw.isPresent()) {
            return ImageConversion.fromRaw(raw.get().toByteArray(), features.height(), features.width(),
                info + "\nCompressed: False");
        }
        Optional<ByteString> compressed = features.bytes(ExampleFeatures.IMAGE_COMPRESSED);
        if (compressed.isPresent()) {
            return ImageConversion.fromEncoded(compressed.get().toByteArray(), info + "\nCompressed: True");
        }
        return new ImageData.Unavailable("Example has no image data");
    }
}
