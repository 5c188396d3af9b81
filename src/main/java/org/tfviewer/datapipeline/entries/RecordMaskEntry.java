package org.tfviewer.datapipeline.entries;

import com.google.protobuf.ByteString;
import org.tfviewer.datapipeline.api.contracts.Example;
import org.tfviewer.datapipeline.api.decode.ImageData;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.formats.ExampleFeatures;
import org.tfviewer.datapipeline.formats.ImageConversion;
import org.tfviewer.datapipeline.formats.MaskPalette;
import org.tfviewer.datapipeline.resources.files.TrackedFile;
import org.tfviewer.datapipeline.services.decode.DecodeWorkerPool;

import java.io.IOException;
import java.util.Optional;

/**
 * One mask out of the packed masks of a record file example.
 */
public class RecordMaskEntry extends ImageEntry {

    private final int maskIndex;
    private final String description;

    public RecordMaskEntry(TrackedFile file, long offset, Tag tag, long step, LoaderId loaderId,
                           DecodeWorkerPool pool, int maskIndex, String description) {
        super(file, offset, tag, step, loaderId, pool);
        this.maskIndex = maskIndex;
        this.description = description;
    }

    public int getMaskIndex() {
        return maskIndex;
    }

    @Override
    public ImageData readImageData() throws IOException {
        ExampleFeatures features = ExampleFeatures.of(
            requireFile().readCachedAndDecodeAt(getOffset(), Example.parser()));
        if (!features.hasSize()) {
            return new ImageData.Unavailable("Example has no image size");
        }
        String info = describe(description);
        Optional<ByteString> raw = features.bytes(ExampleFeatures.MASK_RAW);
        if (raw.isPresent()) {
            return MaskPalette.fromRaw(raw.get().toByteArray(), maskIndex, features.height(), features.width(),
                info + "\nCompressed: False");
        }
        Optional<ByteString> compressed = features.bytes(ExampleFeatures.MASK_COMPRESSED);
        if (compressed.isPresent()) {
            return MaskPalette.fromStacked(ImageConversion.decode(compressed.get().toByteArray()), maskIndex,
                features.height(), features.width(), info + "\nCompressed: True");
        }
        return new ImageData.Unavailable("Example has no mask data");
    }
}
