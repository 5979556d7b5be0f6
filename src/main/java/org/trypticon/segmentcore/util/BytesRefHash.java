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
package org.trypticon.segmentcore.util;

import java.util.Arrays;

import org.apache.lucene.util.ByteBlockPool;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.Counter;
import org.apache.lucene.util.IntroSorter;

import static org.apache.lucene.util.ByteBlockPool.BYTE_BLOCK_MASK;
import static org.apache.lucene.util.ByteBlockPool.BYTE_BLOCK_SHIFT;
import static org.apache.lucene.util.ByteBlockPool.BYTE_BLOCK_SIZE;

/**
 * Hash table mapping distinct terms, stored in a shared {@link ByteBlockPool},
 * to dense ordinals {@code 0..size()-1}.
 * <p>
 * The table only owns its slot array. The array holding each ordinal's text
 * start, and any columns stored alongside it, belong to a pluggable
 * {@link BytesStartArray} which the table asks to allocate, grow and release.
 *
 * @param <A> the backing storage type.
 */
public final class BytesRefHash<A extends BytesRefHash.BytesStartArray> {

  private final ByteBlockPool pool;
  private int[] bytesStart;

  private final BytesRef scratch = new BytesRef();
  private int hashSize;
  private int hashHalfSize;
  private int hashMask;
  private int count;
  private int lastCount = -1;
  private int[] ords;
  private final A bytesStartArray;
  private final Counter bytesUsed;

  public BytesRefHash(ByteBlockPool pool, int capacity, A bytesStartArray) {
    if (Integer.bitCount(capacity) != 1) {
      throw new IllegalArgumentException("capacity must be a power of two: " + capacity);
    }
    hashSize = capacity;
    hashHalfSize = hashSize >> 1;
    hashMask = hashSize - 1;
    this.pool = pool;
    ords = new int[hashSize];
    Arrays.fill(ords, -1);
    this.bytesStartArray = bytesStartArray;
    bytesStart = bytesStartArray.init(hashHalfSize);
    bytesUsed = bytesStartArray.bytesUsed() == null ? Counter.newCounter() : bytesStartArray.bytesUsed();
    bytesUsed.addAndGet(hashSize * (long) Integer.BYTES);
  }

  public A storage() {
    return bytesStartArray;
  }

  public int size() {
    return count;
  }

  /** Current number of slots; always a power of two. */
  public int capacity() {
    return hashSize;
  }

  /**
   * Populates {@code ref} with the bytes of the given ordinal. The returned
   * reference points into the pool and must not be modified.
   */
  public BytesRef get(int ord, BytesRef ref) {
    assert bytesStart != null : "bytesStart is null - not initialized";
    assert ord < bytesStart.length : "ord exceeds byteStart len: " + bytesStart.length;
    return textAt(ref, bytesStart[ord]);
  }

  /**
   * Moves all ordinals to the front of the slot array, in no particular order.
   * The table is unusable until {@link #clear(boolean)} is called.
   */
  public int[] compact() {
    assert bytesStart != null : "bytesStart is null - not initialized";
    int upto = 0;
    for (int i = 0; i < hashSize; i++) {
      if (ords[i] != -1) {
        if (upto < i) {
          ords[upto] = ords[i];
          ords[i] = -1;
        }
        upto++;
      }
    }

    assert upto == count;
    lastCount = count;
    return ords;
  }

  /**
   * Compacts the table and returns the ordinals sorted by the unsigned byte
   * order of their terms. Only the first {@link #size()} entries are valid.
   */
  public int[] sort() {
    final int[] compact = compact();
    new IntroSorter() {
      private final BytesRef pivot = new BytesRef();
      private final BytesRef scratch1 = new BytesRef();
      private final BytesRef scratch2 = new BytesRef();

      @Override
      protected void swap(int i, int j) {
        final int o = compact[i];
        compact[i] = compact[j];
        compact[j] = o;
      }

      @Override
      protected int compare(int i, int j) {
        return textAt(scratch1, bytesStart[compact[i]])
            .compareTo(textAt(scratch2, bytesStart[compact[j]]));
      }

      @Override
      protected void setPivot(int i) {
        textAt(pivot, bytesStart[compact[i]]);
      }

      @Override
      protected int comparePivot(int j) {
        return pivot.compareTo(textAt(scratch2, bytesStart[compact[j]]));
      }
    }.sort(0, count);
    return compact;
  }

  /**
   * Halves the slot array while a quarter of it would still hold
   * {@code targetSize} entries. Must only be called on an empty table.
   *
   * @return {@code true} if the slot array was reallocated.
   */
  public boolean shrink(int targetSize) {
    assert count == 0 : "shrink on a table holding " + count + " terms";
    // power of two is required, so ArrayUtil.shrink won't do
    int newSize = hashSize;
    while (newSize >= 8 && newSize / 4 > targetSize) {
      newSize /= 2;
    }
    if (newSize != hashSize) {
      bytesUsed.addAndGet(Integer.BYTES * (long) -(hashSize - newSize));
      hashSize = newSize;
      ords = new int[hashSize];
      Arrays.fill(ords, -1);
      hashHalfSize = newSize / 2;
      hashMask = newSize - 1;
      return true;
    } else {
      return false;
    }
  }

  /**
   * Drops every term. The backing storage is released through
   * {@link BytesStartArray#clear()} and acquired again on the next add.
   *
   * @param resetPool whether the term byte pool is also reset.
   */
  public void clear(boolean resetPool) {
    lastCount = count;
    count = 0;
    if (resetPool) {
      pool.reset(false, false);
    }
    bytesStart = bytesStartArray.clear();
    if (lastCount != -1 && shrink(lastCount)) {
      // shrink clears the hash entries
      return;
    }
    Arrays.fill(ords, -1);
  }

  /**
   * Adds a term.
   *
   * @return the new ordinal, or {@code -(ord + 1)} if the term was already present.
   * @throws MaxBytesLengthExceededException if the term does not fit into one pool block.
   */
  public int add(BytesRef bytes) {
    ensureInitialized();
    final int slot = slotOf(bytes);
    final int ord = ords[slot];
    if (ord != -1) {
      return -(ord + 1);
    }
    return newOrdinal(slot, intern(bytes), true);
  }

  /**
   * Adds a term whose bytes are already interned in the pool at
   * {@code offset}, typically by another table sharing the same pool.
   *
   * @return the new ordinal, or {@code -(ord + 1)} if the offset was already present.
   */
  public int addByPoolOffset(int offset) {
    ensureInitialized();
    int slot = offset & hashMask;
    while (ords[slot] != -1 && bytesStart[ords[slot]] != offset) {
      slot = (slot + 1) & hashMask;
    }
    final int ord = ords[slot];
    if (ord != -1) {
      return -(ord + 1);
    }
    return newOrdinal(slot, offset, false);
  }

  /**
   * Returns the ordinal of a term, or {@code -1} if absent.
   */
  public int find(BytesRef bytes) {
    if (bytesStart == null) {
      return -1;
    }
    return ords[slotOf(bytes)];
  }

  /**
   * Returns the pool offset of the given ordinal's text.
   */
  public int byteStart(int ord) {
    assert bytesStart != null : "bytesStart is null - not initialized";
    assert ord >= 0 && ord < count : ord;
    return bytesStart[ord];
  }

  private void ensureInitialized() {
    if (bytesStart == null) {
      bytesStart = bytesStartArray.init(hashHalfSize);
    }
  }

  // first slot holding the term, or the empty slot where it belongs
  private int slotOf(BytesRef bytes) {
    int slot = hash(bytes.bytes, bytes.offset, bytes.length) & hashMask;
    while (ords[slot] != -1 && !textAt(scratch, bytesStart[ords[slot]]).bytesEquals(bytes)) {
      slot = (slot + 1) & hashMask;
    }
    return slot;
  }

  // copies the term into the pool behind a 1 or 2 byte length prefix
  private int intern(BytesRef bytes) {
    final int length = bytes.length;
    final int needed = length + 2;
    if (needed > BYTE_BLOCK_SIZE) {
      throw new MaxBytesLengthExceededException("bytes can be at most "
          + (BYTE_BLOCK_SIZE - 2) + " in length; got " + length);
    }
    if (pool.byteUpto + needed > BYTE_BLOCK_SIZE) {
      pool.nextBuffer();
    }
    final byte[] block = pool.buffer;
    int pos = pool.byteUpto;
    final int textStart = pos + pool.byteOffset;
    if (length < 128) {
      block[pos++] = (byte) length;
    } else {
      block[pos++] = (byte) (0x80 | (length & 0x7f));
      block[pos++] = (byte) ((length >> 7) & 0xff);
    }
    System.arraycopy(bytes.bytes, bytes.offset, block, pos, length);
    pool.byteUpto = pos + length;
    return textStart;
  }

  private int newOrdinal(int slot, int textStart, boolean hashOnText) {
    if (count >= bytesStart.length) {
      bytesStart = bytesStartArray.grow();
      assert count < bytesStart.length : "count: " + count + " len: " + bytesStart.length;
    }
    final int ord = count++;
    bytesStart[ord] = textStart;
    ords[slot] = ord;
    if (count == hashHalfSize) {
      rehash(2 * hashSize, hashOnText);
    }
    return ord;
  }

  private void rehash(int newSize, boolean hashOnText) {
    final int newMask = newSize - 1;
    final int[] newOrds = new int[newSize];
    Arrays.fill(newOrds, -1);
    bytesUsed.addAndGet(Integer.BYTES * (long) (newSize - hashSize));
    for (int ord : ords) {
      if (ord == -1) {
        continue;
      }
      int slot;
      if (hashOnText) {
        BytesRef text = textAt(scratch, bytesStart[ord]);
        slot = hash(text.bytes, text.offset, text.length) & newMask;
      } else {
        slot = bytesStart[ord] & newMask;
      }
      while (newOrds[slot] != -1) {
        slot = (slot + 1) & newMask;
      }
      newOrds[slot] = ord;
    }
    ords = newOrds;
    hashSize = newSize;
    hashHalfSize = newSize / 2;
    hashMask = newMask;
  }

  private static int hash(byte[] bytes, int offset, int length) {
    int h = 0;
    for (int i = offset, end = offset + length; i < end; i++) {
      h = 31 * h + bytes[i];
    }
    return h;
  }

  // points term at the text stored at textStart
  private BytesRef textAt(BytesRef term, int textStart) {
    final byte[] block = pool.buffers[textStart >> BYTE_BLOCK_SHIFT];
    final int pos = textStart & BYTE_BLOCK_MASK;
    term.bytes = block;
    if ((block[pos] & 0x80) == 0) {
      term.length = block[pos];
      term.offset = pos + 1;
    } else {
      term.length = (block[pos] & 0x7f) | ((block[pos + 1] & 0xff) << 7);
      term.offset = pos + 2;
    }
    return term;
  }

  /**
   * Thrown when a term is too long to be stored in a single pool block.
   */
  @SuppressWarnings("serial")
  public static class MaxBytesLengthExceededException extends RuntimeException {
    MaxBytesLengthExceededException(String message) {
      super(message);
    }
  }

  /**
   * Storage lifecycle for the per-ordinal text start column. Implementations
   * may keep further columns indexed by ordinal and must keep them the same
   * length as the array they return.
   */
  public interface BytesStartArray {

    /**
     * Allocates the storage if it is not allocated yet.
     *
     * @param capacity the minimum number of ordinals to hold on a fresh allocation.
     * @return the text start column; the existing one if already allocated.
     */
    int[] init(int capacity);

    /**
     * Grows the storage by at least one entry, preserving contents.
     *
     * @return the new text start column.
     */
    int[] grow();

    /**
     * Releases the storage.
     *
     * @return {@code null}.
     */
    int[] clear();

    /**
     * The counter charged for this storage, or {@code null} for a private one.
     */
    Counter bytesUsed();
  }
}
