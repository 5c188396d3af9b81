package org.tfviewer.datapipeline.api.decode;

import java.util.List;
import java.util.OptionalLong;

/**
 * The result of decoding one framed record.
 *
 * @param step   The step the record belongs to, empty when the format has no notion of
 *               steps (the loader then numbers records itself).
 * @param values The values found in the record, in record order.
 */
public record DecodedRecord(OptionalLong step, List<DecodedValue> values) {

    public DecodedRecord {
        values = List.copyOf(values);
    }

    public static DecodedRecord empty() {
        return new DecodedRecord(OptionalLong.empty(), List.of());
    }
}
