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

import org.apache.lucene.util.ByteBlockPool;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.Counter;
import org.apache.lucene.util.IntBlockPool;
import org.trypticon.segmentcore.util.BytesRefHash;

/**
 * Accumulates the terms of one field on one indexing thread. Each distinct
 * term gets a term ID from the dedup table, and per term ID the builder keeps
 * {@code streamCount} byte streams whose write cursors live in the int pool.
 * Subclasses decide what goes into the streams.
 */
public abstract class TermsHashPerField implements Comparable<TermsHashPerField> {
  private static final int HASH_INIT_SIZE = 4;

  final TermsHash termsHash;

  final TermsHashPerField nextPerField;
  protected final FieldInvertState fieldState;

  // Copied from our perThread
  final IntBlockPool intPool;
  final ByteBlockPool bytePool;
  final ByteBlockPool termBytePool;

  final int streamCount;
  final int numPostingInt;

  protected final FieldInfo fieldInfo;

  final BytesRefHash<PostingsBytesStartArray> bytesHash;

  ParallelPostingsArray postingsArray;
  private final Counter bytesUsed;

  /** streamCount: how many streams this field stores per term.
   * E.g. doc(+freq) is 1 stream, prox is a second. */
  TermsHashPerField(int streamCount, FieldInvertState fieldState, TermsHash termsHash, TermsHashPerField nextPerField, FieldInfo fieldInfo) {
    intPool = termsHash.intPool;
    bytePool = termsHash.bytePool;
    termBytePool = termsHash.termBytePool;
    this.termsHash = termsHash;
    bytesUsed = termsHash.bytesUsed;
    this.fieldState = fieldState;
    this.streamCount = streamCount;
    numPostingInt = 2 * streamCount;
    this.fieldInfo = fieldInfo;
    this.nextPerField = nextPerField;
    PostingsBytesStartArray byteStarts = new PostingsBytesStartArray(this, bytesUsed);
    bytesHash = new BytesRefHash<>(termBytePool, HASH_INIT_SIZE, byteStarts);
  }

  /**
   * Forgets every term of this field, here and in the next level. The pools
   * are left alone.
   */
  public void reset() {
    bytesHash.clear(false);
    if (nextPerField != null) {
      nextPerField.reset();
    }
  }

  /**
   * Discards everything accumulated so far. Safe to call at any time and
   * any number of times.
   */
  public void abort() {
    reset();
    if (nextPerField != null) {
      nextPerField.abort();
    }
  }

  /**
   * Drops any remaining terms and shrinks the dedup table toward
   * {@code targetSize} terms.
   */
  public void shrinkHash(int targetSize) {
    // clearing an empty table would shrink it to nothing first
    if (bytesHash.size() != 0) {
      bytesHash.clear(false);
    }
    bytesHash.shrink(targetSize);
  }

  /** Returns the number of distinct terms accumulated. */
  public int numTerms() {
    return bytesHash.size();
  }

  public FieldInfo getFieldInfo() {
    return fieldInfo;
  }

  public TermsHashPerField getNextPerField() {
    return nextPerField;
  }

  /** Positions {@code reader} at the start of one stream of a term. */
  public void initReader(ByteSliceReader reader, int termID, int stream) {
    assert stream < streamCount;
    int intStart = postingsArray.intStarts[termID];
    final int[] ints = intPool.buffers[intStart >> IntBlockPool.INT_BLOCK_SHIFT];
    final int upto = intStart & IntBlockPool.INT_BLOCK_MASK;
    reader.init(bytePool,
                postingsArray.byteStarts[termID] + stream * ByteSlices.FIRST_LEVEL_SIZE,
                ints[upto + stream]);
  }

  int[] sortedTermIDs;

  /** Collapse the hash table and sort in-place; also sets
   * this.sortedTermIDs to the results */
  public int[] sortPostings() {
    sortedTermIDs = bytesHash.sort();
    return sortedTermIDs;
  }

  private boolean doNextCall;

  // Secondary entry point (for 2nd & subsequent TermsHash),
  // because token text has already been "interned" into
  // textStart, so we hash by textStart.  term vectors use
  // this API.
  void add(int textStart) throws IOException {
    int termID = bytesHash.addByPoolOffset(textStart);
    if (termID >= 0) {      // New posting
      // First time we are seeing this token since we last
      // flushed the hash.
      initStreamSlices(termID);
      newTerm(termID);

    } else {
      termID = positionStreamSlice(termID);
      addTerm(termID);
    }
  }

  /**
   * Called once per inverted token. This is the primary entry point (for
   * the first level of the chain); postings use this API.
   *
   * @throws BytesRefHash.MaxBytesLengthExceededException if the term does not fit into a pool block.
   */
  public void add(BytesRef termBytes) throws IOException {
    // We are first in the chain so we must "intern" the
    // term text into textStart address
    int termID = bytesHash.add(termBytes);

    if (termID >= 0) {// New posting
      initStreamSlices(termID);
      newTerm(termID);

    } else {
      termID = positionStreamSlice(termID);
      addTerm(termID);
    }

    if (doNextCall) {
      nextPerField.add(postingsArray.textStarts[termID]);
    }
  }

  private void initStreamSlices(int termID) {
    // Init stream slices
    if (numPostingInt + intPool.intUpto > IntBlockPool.INT_BLOCK_SIZE) {
      intPool.nextBuffer();
    }

    if (ByteBlockPool.BYTE_BLOCK_SIZE - bytePool.byteUpto < numPostingInt * ByteSlices.FIRST_LEVEL_SIZE) {
      bytePool.nextBuffer();
    }

    intUptos = intPool.buffer;
    intUptoStart = intPool.intUpto;
    intPool.intUpto += streamCount;

    postingsArray.intStarts[termID] = intUptoStart + intPool.intOffset;

    for (int i = 0; i < streamCount; i++) {
      final int upto = ByteSlices.newSlice(bytePool, ByteSlices.FIRST_LEVEL_SIZE);
      intUptos[intUptoStart + i] = upto + bytePool.byteOffset;
    }
    postingsArray.byteStarts[termID] = intUptos[intUptoStart];
  }

  private int positionStreamSlice(int encodedTermID) {
    final int termID = (-encodedTermID) - 1;
    int intStart = postingsArray.intStarts[termID];
    intUptos = intPool.buffers[intStart >> IntBlockPool.INT_BLOCK_SHIFT];
    intUptoStart = intStart & IntBlockPool.INT_BLOCK_MASK;
    return termID;
  }

  int[] intUptos;
  int intUptoStart;

  void writeByte(int stream, byte b) {
    int upto = intUptos[intUptoStart + stream];
    byte[] bytes = bytePool.buffers[upto >> ByteBlockPool.BYTE_BLOCK_SHIFT];
    assert bytes != null;
    int offset = upto & ByteBlockPool.BYTE_BLOCK_MASK;
    if (bytes[offset] != 0) {
      // End of slice; allocate a new one
      offset = ByteSlices.allocSlice(bytePool, bytes, offset);
      bytes = bytePool.buffer;
      intUptos[intUptoStart + stream] = offset + bytePool.byteOffset;
    }
    bytes[offset] = b;
    (intUptos[intUptoStart + stream])++;
  }

  void writeVInt(int stream, int i) {
    assert stream < streamCount;
    while ((i & ~0x7F) != 0) {
      writeByte(stream, (byte)((i & 0x7f) | 0x80));
      i >>>= 7;
    }
    writeByte(stream, (byte) i);
  }

  /**
   * Storage for the postings columns of one field. The dedup table uses
   * the text start column as its own per-ordinal array; the rest of the
   * columns ride along and are resized with it.
   */
  static final class PostingsBytesStartArray implements BytesRefHash.BytesStartArray {

    private final TermsHashPerField perField;
    private final Counter bytesUsed;

    private PostingsBytesStartArray(
        TermsHashPerField perField, Counter bytesUsed) {
      this.perField = perField;
      this.bytesUsed = bytesUsed;
    }

    @Override
    public int[] init(int capacity) {
      if (perField.postingsArray == null) {
        perField.postingsArray = perField.createPostingsArray(capacity);
        perField.newPostingsArray();
        bytesUsed.addAndGet(perField.postingsArray.size * (long) perField.postingsArray.bytesPerPosting());
      }
      return perField.postingsArray.textStarts;
    }

    @Override
    public int[] grow() {
      ParallelPostingsArray postingsArray = perField.postingsArray;
      if (postingsArray == null) {
        throw new IllegalStateException("grow called before init for field \"" + perField.fieldInfo.name + "\"");
      }
      final int oldSize = postingsArray.size;
      postingsArray = perField.postingsArray = postingsArray.grow();
      perField.newPostingsArray();
      bytesUsed.addAndGet(postingsArray.bytesPerPosting() * (long) (postingsArray.size - oldSize));
      return postingsArray.textStarts;
    }

    @Override
    public int[] clear() {
      if (perField.postingsArray != null) {
        bytesUsed.addAndGet(-(perField.postingsArray.size * (long) perField.postingsArray.bytesPerPosting()));
        perField.postingsArray = null;
        perField.newPostingsArray();
      }
      return null;
    }

    @Override
    public Counter bytesUsed() {
      return bytesUsed;
    }
  }

  @Override
  public int compareTo(TermsHashPerField other) {
    return fieldInfo.name.compareTo(other.fieldInfo.name);
  }

  /** Finish adding all instances of this field to the
   *  current document. */
  public void finish() throws IOException {
    if (nextPerField != null) {
      nextPerField.finish();
    }
  }

  /** Start adding a new field instance; first is true if
   *  this is the first time this field name was seen in the
   *  document.
   *
   * @return whether this level accepts the field's terms for the document.
   */
  public boolean start(boolean first) {
    if (nextPerField != null) {
      doNextCall = nextPerField.start(first);
    }
    return true;
  }

  /** Called when a term is seen for the first time. */
  abstract void newTerm(int termID) throws IOException;

  /** Called when a previously seen term is seen again. */
  abstract void addTerm(int termID) throws IOException;

  /** Called when the postingsArray is initialized or
   *  resized. */
  abstract void newPostingsArray();

  /** Creates a new postings array of the specified size. */
  abstract ParallelPostingsArray createPostingsArray(int size);
}
