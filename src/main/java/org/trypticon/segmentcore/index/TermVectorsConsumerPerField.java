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

import org.apache.lucene.util.BytesRef;
import org.trypticon.segmentcore.codecs.TermVectorsWriter;

/**
 * Second level of the term chain: collects the terms of one field of the
 * current document and hands them to the {@link TermVectorsWriter} when the
 * document is finished. Stream 0 holds position deltas.
 */
final class TermVectorsConsumerPerField extends TermsHashPerField {

  private TermVectorsPostingsArray termVectorsPostingsArray;

  final TermVectorsConsumer termsWriter;

  boolean doVectors;

  TermVectorsConsumerPerField(FieldInvertState invertState, TermVectorsConsumer termsWriter, FieldInfo fieldInfo) {
    super(1, invertState, termsWriter, null, fieldInfo);
    this.termsWriter = termsWriter;
  }

  /** Queues the field for writing at the end of the document. */
  @Override
  public void finish() {
    if (!doVectors || bytesHash.size() == 0) {
      return;
    }

    termsWriter.addFieldToFlush(this);
  }

  void finishDocument() throws IOException {
    if (!doVectors) {
      return;
    }

    doVectors = false;

    final int numPostings = bytesHash.size();

    final BytesRef flushTerm = termsWriter.flushTerm;

    assert numPostings >= 0;

    TermVectorsPostingsArray postings = termVectorsPostingsArray;
    final TermVectorsWriter tv = termsWriter.writer;

    final int[] termIDs = sortPostings();

    tv.startField(fieldInfo, numPostings, true);

    final ByteSliceReader posReader = termsWriter.vectorSliceReaderPos;

    for (int j = 0; j < numPostings; j++) {
      final int termID = termIDs[j];
      final int freq = postings.freqs[termID];

      // Get BytesRef
      bytesHash.get(termID, flushTerm);
      tv.startTerm(flushTerm, freq);

      initReader(posReader, termID, 0);
      int position = 0;
      for (int i = 0; i < freq; i++) {
        position += posReader.readVInt();
        tv.addPosition(position);
      }
      tv.finishTerm();
    }
    tv.finishField();

    reset();
  }

  @Override
  public boolean start(boolean first) {
    super.start(first);
    if (first) {
      if (bytesHash.size() != 0) {
        // left over from a document that failed while writing vectors
        reset();
      }
      doVectors = fieldInfo.hasVectors();
    }
    return doVectors;
  }

  void writeProx(TermVectorsPostingsArray postings, int termID) {
    writeVInt(0, fieldState.position - postings.lastPositions[termID]);
    postings.lastPositions[termID] = fieldState.position;
  }

  @Override
  void newTerm(final int termID) {
    TermVectorsPostingsArray postings = termVectorsPostingsArray;

    postings.freqs[termID] = 1;
    postings.lastPositions[termID] = 0;

    writeProx(postings, termID);
  }

  @Override
  void addTerm(final int termID) {
    TermVectorsPostingsArray postings = termVectorsPostingsArray;

    postings.freqs[termID]++;

    writeProx(postings, termID);
  }

  @Override
  void newPostingsArray() {
    termVectorsPostingsArray = (TermVectorsPostingsArray) postingsArray;
  }

  @Override
  ParallelPostingsArray createPostingsArray(int size) {
    return new TermVectorsPostingsArray(size);
  }

  static final class TermVectorsPostingsArray extends ParallelPostingsArray {
    TermVectorsPostingsArray(int size) {
      super(size);
      freqs = new int[size];
      lastPositions = new int[size];
    }

    int[] freqs;                                       // How many times this term occurred in the current doc
    int[] lastPositions;                               // Last position where this term occurred

    @Override
    ParallelPostingsArray newInstance(int size) {
      return new TermVectorsPostingsArray(size);
    }

    @Override
    void copyTo(ParallelPostingsArray toArray, int numToCopy) {
      assert toArray instanceof TermVectorsPostingsArray;
      TermVectorsPostingsArray to = (TermVectorsPostingsArray) toArray;

      super.copyTo(toArray, numToCopy);

      System.arraycopy(freqs, 0, to.freqs, 0, numToCopy);
      System.arraycopy(lastPositions, 0, to.lastPositions, 0, numToCopy);
    }

    @Override
    int bytesPerPosting() {
      return super.bytesPerPosting() + 2 * Integer.BYTES;
    }
  }
}
