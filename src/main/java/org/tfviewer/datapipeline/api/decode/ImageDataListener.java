package org.tfviewer.datapipeline.api.decode;

/**
 * Callbacks of an asynchronous image decode. Both are invoked on the thread that finishes or
 * cancels the decode.
 */
public interface ImageDataListener {

    /**
     * Called at most once, only when the decode completed without being cancelled or failing.
     */
    void onDataReady(ImageData data);

    /**
     * Called exactly once when the decode completed, failed or was cancelled.
     */
    void onDone();

    /**
     * Creates a listener that only reacts to the terminal notification.
     */
    static ImageDataListener onDone(Runnable action) {
        return new ImageDataListener() {
            @Override
            public void onDataReady(ImageData data) {
            }

            @Override
            public void onDone() {
                action.run();
            }
        };
    }
}
