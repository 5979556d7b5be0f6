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
import java.util.HashMap;
import java.util.Map;

import org.apache.lucene.util.ByteBlockPool;
import org.apache.lucene.util.Counter;
import org.apache.lucene.util.IntBlockPool;

/**
 * One level of the indexing-time term chain for one indexing thread. Owns
 * the int and byte pools its per-field builders write into; the term bytes
 * themselves live in the primary level's byte pool and are shared by every
 * level below it.
 * <p>
 * The chain is fixed when it is built: each level is handed its next level
 * at construction and never rewired.
 */
public abstract class TermsHash {

  final TermsHash nextTermsHash;

  final IntBlockPool intPool;
  final ByteBlockPool bytePool;
  ByteBlockPool termBytePool;
  final Counter bytesUsed;
  final boolean trackAllocations;

  int docID;

  TermsHash(Counter bytesUsed, boolean trackAllocations, TermsHash nextTermsHash) {
    this.trackAllocations = trackAllocations;
    this.nextTermsHash = nextTermsHash;
    this.bytesUsed = trackAllocations ? bytesUsed : Counter.newCounter();
    intPool = new IntBlockPool(new IntBlockPool.DirectAllocator());
    bytePool = new ByteBlockPool(new ByteBlockPool.DirectTrackingAllocator(this.bytesUsed));
    termBytePool = bytePool;

    if (nextTermsHash != null) {
      // We are primary
      nextTermsHash.termBytePool = bytePool;
    }
  }

  /** Returns the counter charged for the memory of this level. */
  public Counter bytesUsed() {
    return bytesUsed;
  }

  /**
   * Drops all pooled data of this level and every level below it. Per-field
   * builders must be aborted by their owner as well.
   */
  public void abort() {
    try {
      reset();
    } finally {
      if (nextTermsHash != null) {
        nextTermsHash.abort();
      }
    }
  }

  // Clear all state
  void reset() {
    // we don't reuse so we drop everything and don't fill with 0
    intPool.reset(false, false);
    bytePool.reset(false, false);
  }

  /**
   * Flushes the given per-field builders, keyed by field name, and the
   * matching builders of the next level.
   */
  public void flush(Map<String,TermsHashPerField> fieldsToFlush, final SegmentWriteState state) throws IOException {
    if (nextTermsHash != null) {
      Map<String,TermsHashPerField> nextChildFields = new HashMap<>();
      for (final Map.Entry<String,TermsHashPerField> entry : fieldsToFlush.entrySet()) {
        if (entry.getValue().nextPerField != null) {
          nextChildFields.put(entry.getKey(), entry.getValue().nextPerField);
        }
      }
      nextTermsHash.flush(nextChildFields, state);
    }
  }

  /**
   * Creates the builder for one field of this level, together with its
   * next-level builder when this level has a next level.
   */
  public abstract TermsHashPerField addField(FieldInvertState fieldInvertState, FieldInfo fieldInfo);

  public void finishDocument() throws IOException {
    if (nextTermsHash != null) {
      nextTermsHash.finishDocument();
    }
  }

  public void startDocument(int docID) throws IOException {
    this.docID = docID;
    if (nextTermsHash != null) {
      nextTermsHash.startDocument(docID);
    }
  }
}
