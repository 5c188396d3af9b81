package org.tfviewer.datapipeline.formats;

import com.google.protobuf.InvalidProtocolBufferException;
import org.tfviewer.datapipeline.api.contracts.Event;
import org.tfviewer.datapipeline.api.contracts.Summary;
import org.tfviewer.datapipeline.api.decode.DecodedRecord;
import org.tfviewer.datapipeline.api.decode.DecodedValue;
import org.tfviewer.datapipeline.api.decode.RecordDecoder;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Decodes TensorFlow event records. Summary values with a simple value become scalars, image
 * values become payload references to their index in the summary. Other event kinds (file
 * version, graphs) decode to no values.
 */
public class EventRecordDecoder implements RecordDecoder {

    @Override
    public DecodedRecord decodeRecord(byte[] payload) throws InvalidProtocolBufferException {
        Event event = Event.parseFrom(payload);
        if (!event.hasSummary()) {
            return new DecodedRecord(OptionalLong.of(event.getStep()), List.of());
        }
        List<Summary.Value> summaryValues = event.getSummary().getValueList();
        List<DecodedValue> values = new ArrayList<>(summaryValues.size());
        for (int i = 0; i < summaryValues.size(); i++) {
            Summary.Value value = summaryValues.get(i);
            switch (value.getValueCase()) {
                case SIMPLE_VALUE:
                    values.add(DecodedValue.scalar(value.getTag(), value.getSimpleValue()));
                    break;
                case IMAGE:
                    values.add(DecodedValue.payload(value.getTag(), i, ""));
                    break;
                default:
                    break;
            }
        }
        return new DecodedRecord(OptionalLong.of(event.getStep()), values);
    }
}
