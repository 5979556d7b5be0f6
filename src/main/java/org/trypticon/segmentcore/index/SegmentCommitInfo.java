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
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * The state one commit records for a segment on top of its
 * {@link SegmentInfo}: how many documents are deleted, which live docs
 * generation holds those deletes, and the segment's total size on disk.
 * <p>
 * Live docs generations are written once each. A failed write burns its
 * generation, so the next attempt always targets a fresh file name.
 */
public class SegmentCommitInfo {

  private static final long NO_DELETES = -1;
  private static final long UNKNOWN_SIZE = -1;

  public final SegmentInfo info;

  private int delCount;
  private long delGen;
  private long nextWriteDelGen;
  private long bufferedUpdatesGen;

  private volatile long sizeInBytes = UNKNOWN_SIZE;

  /**
   * @param delCount number of deleted documents in this segment.
   * @param delGen live docs generation, or {@code -1} if nothing was deleted yet.
   */
  public SegmentCommitInfo(SegmentInfo info, int delCount, long delGen) {
    this.info = info;
    this.delCount = delCount;
    this.delGen = delGen;
    nextWriteDelGen = delGen == NO_DELETES ? 1 : delGen + 1;
  }

  /** Makes the generation just written the current one. */
  void advanceDelGen() {
    delGen = nextWriteDelGen;
    nextWriteDelGen = delGen + 1;
    invalidateSize();
  }

  /** Skips the generation whose write just failed. */
  void advanceNextWriteDelGen() {
    nextWriteDelGen++;
  }

  public boolean hasDeletions() {
    return delGen != NO_DELETES;
  }

  /** Returns the live docs generation, or {@code -1} if there are no deletes. */
  public long getDelGen() {
    return delGen;
  }

  /** Returns the generation the next live docs write goes to. */
  public long getNextDelGen() {
    return nextWriteDelGen;
  }

  public int getDelCount() {
    return delCount;
  }

  void setDelCount(int delCount) {
    int docCount = info.getDocCount();
    if (delCount < 0 || delCount > docCount) {
      throw new IllegalArgumentException("delCount must be between 0 and " + docCount
          + " for segment " + info.name + ", got " + delCount);
    }
    this.delCount = delCount;
  }

  long getBufferedUpdatesGen() {
    return bufferedUpdatesGen;
  }

  void setBufferedUpdatesGen(long bufferedUpdatesGen) {
    this.bufferedUpdatesGen = bufferedUpdatesGen;
    invalidateSize();
  }

  /**
   * Returns the segment's files plus the current live docs file, recomputed
   * on every call.
   */
  public Collection<String> files() throws IOException {
    Set<String> files = new HashSet<>(info.files());
    info.getCodec().liveDocsFormat().files(this, files);
    return files;
  }

  /**
   * Returns the summed length of {@link #files()}. The sum is cached until
   * the live docs generation changes. A failed length lookup leaves the
   * cache empty so the next call retries.
   */
  public long sizeInBytes() throws IOException {
    long size = sizeInBytes;
    if (size == UNKNOWN_SIZE) {
      size = 0;
      for (String file : files()) {
        size += info.dir.fileLength(file);
      }
      sizeInBytes = size;
    }
    return size;
  }

  private void invalidateSize() {
    sizeInBytes = UNKNOWN_SIZE;
  }

  /**
   * Describes the segment as {@code name:CdocCount/delCount:delGen=gen},
   * counting {@code pendingDelCount} as deleted too.
   */
  public String toString(int pendingDelCount) {
    String s = info.toString(delCount + pendingDelCount);
    return hasDeletions() ? s + ":delGen=" + delGen : s;
  }

  @Override
  public String toString() {
    return toString(0);
  }

  /** Copies the commit state. The copy computes its own size. */
  @Override
  public SegmentCommitInfo clone() {
    SegmentCommitInfo copy = new SegmentCommitInfo(info, delCount, delGen);
    copy.nextWriteDelGen = nextWriteDelGen;
    copy.bufferedUpdatesGen = bufferedUpdatesGen;
    return copy;
  }
}
