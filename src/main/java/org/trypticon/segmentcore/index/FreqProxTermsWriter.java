/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.trypticon.segmentcore.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.lucene.util.Counter;
import org.apache.lucene.util.IOUtils;
import org.trypticon.segmentcore.codecs.FieldsConsumer;
import org.trypticon.segmentcore.codecs.TermsConsumer;

/**
 * Primary level of the term chain: writes postings to the segment's
 * postings format at flush.
 */
public final class FreqProxTermsWriter extends TermsHash {

  /**
   * @param bytesUsed counter charged for the memory of this level.
   * @param termVectors the next level, or {@code null} when no field stores term vectors.
   */
  public FreqProxTermsWriter(Counter bytesUsed, TermVectorsConsumer termVectors) {
    super(bytesUsed, true, termVectors);
  }

  @Override
  public void flush(Map<String,TermsHashPerField> fieldsToFlush, final SegmentWriteState state) throws IOException {
    super.flush(fieldsToFlush, state);

    // Gather all fields that saw any postings:
    List<FreqProxTermsWriterPerField> allFields = new ArrayList<>();

    for (TermsHashPerField f : fieldsToFlush.values()) {
      final FreqProxTermsWriterPerField perField = (FreqProxTermsWriterPerField) f;
      if (perField.bytesHash.size() > 0) {
        allFields.add(perField);
      }
    }

    if (allFields.isEmpty()) {
      return;
    }

    // Sort by field name
    Collections.sort(allFields);

    final int maxDoc = state.segmentInfo.getDocCount();
    long termCount = 0;

    FieldsConsumer consumer = state.segmentInfo.getCodec().postingsFormat().fieldsConsumer(state);
    boolean success = false;
    try {
      for (FreqProxTermsWriterPerField fieldWriter : allFields) {
        final TermsConsumer termsConsumer = consumer.addField(fieldWriter.fieldInfo);
        termCount += fieldWriter.flush(termsConsumer, maxDoc);
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(consumer);
      } else {
        IOUtils.closeWhileHandlingException(consumer);
      }
    }

    for (FreqProxTermsWriterPerField fieldWriter : allFields) {
      final int numPostings = fieldWriter.bytesHash.size();
      fieldWriter.reset();
      fieldWriter.shrinkHash(numPostings);
    }
    reset();

    if (state.infoStream.isEnabled("TH")) {
      state.infoStream.message("TH", "flushed " + allFields.size() + " fields with " + termCount + " terms for segment " + state.segmentInfo.name);
    }
  }

  @Override
  public TermsHashPerField addField(FieldInvertState invertState, FieldInfo fieldInfo) {
    if (!fieldInfo.isIndexed()) {
      throw new IllegalArgumentException("field \"" + fieldInfo.name + "\" is not indexed");
    }
    return new FreqProxTermsWriterPerField(invertState, this, fieldInfo,
        nextTermsHash == null ? null : nextTermsHash.addField(invertState, fieldInfo));
  }
}
