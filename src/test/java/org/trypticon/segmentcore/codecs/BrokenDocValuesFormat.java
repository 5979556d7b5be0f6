package org.trypticon.segmentcore.codecs;

import java.io.IOException;

import org.trypticon.segmentcore.index.SegmentReadState;

/**
 * Writes like the other recording formats but can never be opened for reading.
 */
public class BrokenDocValuesFormat extends RecordingDocValuesFormat {
    public BrokenDocValuesFormat() {
        super("DvBroken");
    }

    @Override
    public DocValuesProducer fieldsProducer(SegmentReadState state) throws IOException {
        throw new IOException("cannot open " + state.segmentInfo.name + "_" + state.segmentSuffix);
    }
}
