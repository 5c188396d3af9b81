package org.tfviewer.datapipeline.entries;

import org.tfviewer.datapipeline.api.contracts.Event;
import org.tfviewer.datapipeline.api.contracts.Summary;
import org.tfviewer.datapipeline.api.decode.ImageData;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.formats.ImageConversion;
import org.tfviewer.datapipeline.resources.files.TrackedFile;
import org.tfviewer.datapipeline.services.decode.DecodeWorkerPool;

import java.io.IOException;

/**
 * An image summary value inside an event record.
 */
public class ImageEventEntry extends ImageEntry {

    private final int valueIndex;

    /**
     * @param valueIndex Index of the image value within the event's summary.
     */
    public ImageEventEntry(TrackedFile file, long offset, int valueIndex, Tag tag, long step,
                           LoaderId loaderId, DecodeWorkerPool pool) {
        super(file, offset, tag, step, loaderId, pool);
        this.valueIndex = valueIndex;
    }

    /**
     * Decodes the image to raw pixels. Images in a layout raw blobs cannot carry (alpha,
     * palettes, 16 bit) are passed on still encoded.
     */
    @Override
    public ImageData readImageData() throws IOException {
        Event event = requireFile().readCachedAndDecodeAt(getOffset(), Event.parser());
        Summary summary = event.getSummary();
        if (valueIndex >= summary.getValueCount() || !summary.getValue(valueIndex).hasImage()) {
            return new ImageData.Unavailable("No image at value " + valueIndex + " of " + this);
        }
        byte[] encoded = summary.getValue(valueIndex).getImage().getEncodedImageString().toByteArray();
        ImageData data = ImageConversion.fromEncoded(encoded, tagString());
        if (data instanceof ImageData.Unavailable) {
            return new ImageData.CompressedBlob(encoded);
        }
        return data;
    }
}
