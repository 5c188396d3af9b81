package org.tfviewer.datapipeline.api.decode;

import java.io.IOException;

/**
 * Heavy-decode capability of an entry. Invoked on a worker thread only; implementations must
 * not touch shared engine state.
 */
@FunctionalInterface
public interface ImageSource {

    /**
     * Re-reads the entry's record and materializes its image.
     *
     * @return The image data, {@link ImageData.Unavailable} if the payload cannot be shown.
     * @throws IOException if the record cannot be read.
     */
    ImageData readImageData() throws IOException;
}
