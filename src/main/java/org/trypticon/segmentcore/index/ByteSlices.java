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

import org.apache.lucene.util.ByteBlockPool;

import static org.apache.lucene.util.ByteBlockPool.BYTE_BLOCK_SIZE;

/**
 * Allocates chained slices inside a {@link ByteBlockPool}. Each slice ends
 * with a non-zero level marker; once a writer reaches the marker it calls
 * {@link #allocSlice} which links a bigger slice by overwriting the last four
 * bytes with the big-endian address of the next one. {@link ByteSliceReader}
 * follows the same layout.
 */
final class ByteSlices {

  // Size of each slice.  These arrays should be at most 16
  // elements (index is encoded with 4 bits).  First array
  // is just a compact way to encode X+1 with a max.  Second
  // array is the length of each slice, ie first slice is 5
  // bytes, next slice is 14 bytes, etc.

  static final int[] NEXT_LEVEL_ARRAY = {1, 2, 3, 4, 5, 6, 7, 8, 9, 9};

  static final int[] LEVEL_SIZE_ARRAY = {5, 14, 20, 30, 40, 40, 80, 80, 120, 200};

  static final int FIRST_LEVEL_SIZE = LEVEL_SIZE_ARRAY[0];

  private ByteSlices() {}

  /**
   * Allocates a new slice of the given size in the pool's current buffer.
   *
   * @return the offset of the slice within the current buffer.
   */
  static int newSlice(ByteBlockPool pool, final int size) {
    if (pool.byteUpto > BYTE_BLOCK_SIZE - size) {
      pool.nextBuffer();
    }
    final int upto = pool.byteUpto;
    pool.byteUpto += size;
    pool.buffer[pool.byteUpto - 1] = 16;
    return upto;
  }

  /**
   * Creates a new slice with the next level size, linking the full slice
   * ending at {@code upto} to it.
   *
   * @return the offset within the pool's current buffer where writing continues.
   */
  static int allocSlice(ByteBlockPool pool, final byte[] slice, final int upto) {

    final int level = slice[upto] & 15;
    final int newLevel = NEXT_LEVEL_ARRAY[level];
    final int newSize = LEVEL_SIZE_ARRAY[newLevel];

    // Maybe allocate another block
    if (pool.byteUpto > BYTE_BLOCK_SIZE - newSize) {
      pool.nextBuffer();
    }

    final byte[] buffer = pool.buffer;
    final int newUpto = pool.byteUpto;
    final int offset = newUpto + pool.byteOffset;
    pool.byteUpto += newSize;

    // Copy forward the past 3 bytes (which we are about
    // to overwrite with the forwarding address):
    buffer[newUpto] = slice[upto - 3];
    buffer[newUpto + 1] = slice[upto - 2];
    buffer[newUpto + 2] = slice[upto - 1];

    // Write forwarding address at end of last slice:
    slice[upto - 3] = (byte) (offset >>> 24);
    slice[upto - 2] = (byte) (offset >>> 16);
    slice[upto - 1] = (byte) (offset >>> 8);
    slice[upto] = (byte) offset;

    // Write new level:
    buffer[pool.byteUpto - 1] = (byte) (16 | newLevel);

    return newUpto + 3;
  }
}
