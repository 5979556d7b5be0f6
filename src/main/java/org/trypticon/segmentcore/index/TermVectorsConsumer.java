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

import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IOUtils;
import org.trypticon.segmentcore.codecs.TermVectorsWriter;

/**
 * Second level of the term chain, writing term vectors document by
 * document. The writer is opened lazily on the first document with vectors;
 * documents without vectors are written as empty entries.
 */
public final class TermVectorsConsumer extends TermsHash {

  private final Directory directory;
  private final SegmentInfo segmentInfo;

  TermVectorsWriter writer;

  final BytesRef flushTerm = new BytesRef();

  final ByteSliceReader vectorSliceReaderPos = new ByteSliceReader();

  int lastDocID;

  private final List<TermVectorsConsumerPerField> perFields = new ArrayList<>();

  public TermVectorsConsumer(Directory directory, SegmentInfo segmentInfo) {
    super(null, false, null);
    this.directory = directory;
    this.segmentInfo = segmentInfo;
  }

  @Override
  public void flush(Map<String,TermsHashPerField> fieldsToFlush, final SegmentWriteState state) throws IOException {
    if (writer != null) {
      int numDocs = state.segmentInfo.getDocCount();
      assert numDocs > 0;
      try {
        fill(numDocs);
        writer.finish(numDocs);
      } finally {
        IOUtils.close(writer);
        writer = null;
        lastDocID = 0;
      }
    }
  }

  /** Fills in no-term-vectors for all docs we haven't seen
   *  since the last doc that had term vectors. */
  void fill(int docID) throws IOException {
    while (lastDocID < docID) {
      writer.startDocument(0);
      writer.finishDocument();
      lastDocID++;
    }
  }

  private void initTermVectorsWriter() throws IOException {
    if (writer == null) {
      writer = segmentInfo.getCodec().termVectorsFormat().vectorsWriter(directory, segmentInfo, IOContext.DEFAULT);
      lastDocID = 0;
    }
  }

  @Override
  public void finishDocument() throws IOException {

    if (perFields.isEmpty()) {
      return;
    }

    // sorted by field name
    Collections.sort(perFields);

    initTermVectorsWriter();

    fill(docID);

    // Append term vectors to the real outputs:
    writer.startDocument(perFields.size());
    for (TermVectorsConsumerPerField perField : perFields) {
      perField.finishDocument();
    }
    writer.finishDocument();

    assert lastDocID == docID : "lastDocID=" + lastDocID + " docID=" + docID;

    lastDocID++;

    super.reset();
    perFields.clear();
  }

  @Override
  public void abort() {
    try {
      super.abort();
    } finally {
      IOUtils.closeWhileHandlingException(writer);
      writer = null;
      lastDocID = 0;
      perFields.clear();
    }
  }

  @Override
  public TermsHashPerField addField(FieldInvertState invertState, FieldInfo fieldInfo) {
    return new TermVectorsConsumerPerField(invertState, this, fieldInfo);
  }

  void addFieldToFlush(TermVectorsConsumerPerField fieldToFlush) {
    perFields.add(fieldToFlush);
  }

  @Override
  public void startDocument(int docID) throws IOException {
    super.startDocument(docID);
    perFields.clear();
  }
}
