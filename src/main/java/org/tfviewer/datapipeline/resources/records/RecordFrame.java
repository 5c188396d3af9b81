package org.tfviewer.datapipeline.resources.records;

/**
 * A fully validated record read from a TFRecord file.
 *
 * @param payload     The record payload.
 * @param startOffset Offset of the frame's first byte.
 * @param endOffset   Offset immediately after the frame; reading resumes here.
 */
public record RecordFrame(byte[] payload, long startOffset, long endOffset) {
}
