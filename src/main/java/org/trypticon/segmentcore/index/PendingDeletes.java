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

import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.TrackingDirectoryWrapper;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.FixedBitSet;
import org.apache.lucene.util.IOUtils;
import org.trypticon.segmentcore.InfoStream;
import org.trypticon.segmentcore.codecs.LiveDocsFormat;

/**
 * Buffers deletions for a single segment and writes them as a new live docs
 * generation. Not thread safe; callers hold the writer's lock.
 */
public class PendingDeletes {
  protected final SegmentCommitInfo info;
  private final InfoStream infoStream;
  // Read-only live docs, null until live docs are initialized or if all docs are alive
  private Bits liveDocs;
  // Writeable live docs, null if this instance is not ready to accept writes, in which
  // case getMutableBits needs to be called
  private FixedBitSet writeableLiveDocs;
  protected int pendingDeleteCount;

  public PendingDeletes(SegmentCommitInfo info, InfoStream infoStream) {
    this.info = info;
    this.infoStream = infoStream == null ? InfoStream.NO_OUTPUT : infoStream;
  }

  protected FixedBitSet getMutableBits() throws IOException {
    if (writeableLiveDocs == null) {
      // copy on write; a snapshot handed out by getLiveDocs stays unchanged
      if (liveDocs == null && info.hasDeletions()) {
        LiveDocsFormat liveDocsFormat = info.info.getCodec().liveDocsFormat();
        liveDocs = liveDocsFormat.readLiveDocs(info.info.dir, info, IOContext.DEFAULT);
      }
      if (liveDocs != null) {
        writeableLiveDocs = FixedBitSet.copyOf(liveDocs);
      } else {
        writeableLiveDocs = new FixedBitSet(info.info.getDocCount());
        writeableLiveDocs.set(0, info.info.getDocCount());
      }
      liveDocs = writeableLiveDocs;
    }
    return writeableLiveDocs;
  }

  /**
   * Marks a document as deleted in this segment.
   *
   * @return {@code true} if the document was live before this call,
   *         {@code false} if it was already deleted.
   */
  public boolean delete(int docID) throws IOException {
    FixedBitSet mutableBits = getMutableBits();
    assert mutableBits != null;
    assert docID >= 0 && docID < mutableBits.length() : "out of bounds: docid=" + docID + " liveDocsLength=" + mutableBits.length() + " seg=" + info.info.name + " maxDoc=" + info.info.getDocCount();
    final boolean didDelete = mutableBits.get(docID);
    if (didDelete) {
      mutableBits.clear(docID);
      pendingDeleteCount++;
    }
    return didDelete;
  }

  /**
   * Returns a snapshot of the current live docs, or {@code null} if no
   * document has been deleted through this instance.
   */
  public Bits getLiveDocs() {
    // Prevent modifications to the returned live docs
    writeableLiveDocs = null;
    return liveDocs;
  }

  /**
   * Returns the number of pending deletes that are not written to disk.
   */
  public int numPendingDeletes() {
    return pendingDeleteCount;
  }

  /**
   * Resets the pending docs
   */
  void dropChanges() {
    pendingDeleteCount = 0;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("PendingDeletes(seg=").append(info);
    sb.append(" numPendingDeletes=").append(pendingDeleteCount);
    sb.append(" writeable=").append(writeableLiveDocs != null);
    return sb.toString();
  }

  /**
   * Writes the live docs to disk and returns <code>true</code> if any new docs were written.
   */
  public boolean writeLiveDocs(Directory dir) throws IOException {
    if (pendingDeleteCount == 0) {
      return false;
    }

    Bits liveDocs = this.liveDocs;
    assert liveDocs != null;
    assert liveDocs.length() == info.info.getDocCount();

    // the new file is not live until the segments file is written
    TrackingDirectoryWrapper trackingDir = new TrackingDirectoryWrapper(dir);

    final long attemptedGen = info.getNextDelGen();
    boolean success = false;
    try {
      info.info.getCodec().liveDocsFormat().writeLiveDocs(liveDocs, trackingDir, info, pendingDeleteCount, IOContext.DEFAULT);
      success = true;
    } finally {
      if (!success) {
        // Advance only the nextWriteDelGen so that a 2nd
        // attempt to write will write to a new file
        info.advanceNextWriteDelGen();

        // Delete any partially created file(s):
        for (String fileName : trackingDir.getCreatedFiles()) {
          IOUtils.deleteFilesIgnoringExceptions(dir, fileName);
        }
        if (infoStream.isEnabled("PD")) {
          infoStream.message("PD", "failed to write live docs gen " + attemptedGen + " for " + info.info.name
              + "; next attempt uses gen " + info.getNextDelGen());
        }
      }
    }

    info.advanceDelGen();
    info.setDelCount(info.getDelCount() + pendingDeleteCount);
    if (infoStream.isEnabled("PD")) {
      infoStream.message("PD", "wrote " + pendingDeleteCount + " new deletes for " + info.info.name
          + " at gen " + info.getDelGen() + "; delCount=" + info.getDelCount());
    }
    dropChanges();
    return true;
  }

  /**
   * Returns the number of deleted docs in the segment, written or pending.
   */
  public int getDelCount() {
    return info.getDelCount() + numPendingDeletes();
  }

  /**
   * Returns <code>true</code> iff the segment represented by this {@link PendingDeletes} is fully deleted
   */
  public boolean isFullyDeleted() {
    return getDelCount() == info.info.getDocCount();
  }
}
