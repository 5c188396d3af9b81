package org.tfviewer.datapipeline.api.decode;

import com.google.protobuf.InvalidProtocolBufferException;

/**
 * Format-specific capability that turns the payload of one framed record into values.
 * Implementations must be stateless and thread-safe.
 */
@FunctionalInterface
public interface RecordDecoder {

    /**
     * @param payload The raw record payload, checksum already verified.
     * @return The decoded record, possibly without values.
     * @throws InvalidProtocolBufferException if the payload is not a valid message of the expected type.
     */
    DecodedRecord decodeRecord(byte[] payload) throws InvalidProtocolBufferException;
}
