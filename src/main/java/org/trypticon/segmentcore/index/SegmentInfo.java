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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import org.apache.lucene.store.Directory;
import org.trypticon.segmentcore.codecs.Codec;

/**
 * Name, directory, codec and files of one segment. Commit time state
 * such as deletions lives in {@link SegmentCommitInfo}.
 */
public final class SegmentInfo {

  public final String name;
  public final Directory dir;
  private final Codec codec;

  // -1 while the segment is still being written
  private int docCount;

  private Set<String> files;

  /**
   * @param docCount the number of documents, or {@code -1} if it is set later
   *        through {@link #setDocCount(int)}.
   */
  public SegmentInfo(Directory dir, String name, int docCount, Codec codec) {
    this.dir = dir;
    this.name = name;
    this.docCount = docCount;
    this.codec = codec;
  }

  public Codec getCodec() {
    return codec;
  }

  public int getDocCount() {
    if (docCount < 0) {
      throw new IllegalStateException("docCount of segment " + name + " is not known yet");
    }
    return docCount;
  }

  /** Records the document count once the segment is flushed. */
  public void setDocCount(int docCount) {
    if (this.docCount >= 0) {
      throw new IllegalStateException("docCount of segment " + name + " is already " + this.docCount);
    }
    this.docCount = docCount;
  }

  /** Returns the files written for this segment, without live docs. */
  public Set<String> files() {
    if (files == null) {
      throw new IllegalStateException("files of segment " + name + " are not known yet");
    }
    return Collections.unmodifiableSet(files);
  }

  public void setFiles(Collection<String> files) {
    checkFileNames(files);
    this.files = new TreeSet<>(files);
  }

  public void addFiles(Collection<String> files) {
    checkFileNames(files);
    if (this.files == null) {
      this.files = new TreeSet<>();
    }
    this.files.addAll(files);
  }

  public void addFile(String file) {
    addFiles(Collections.singleton(file));
  }

  private static void checkFileNames(Collection<String> files) {
    for (String file : files) {
      if (!IndexFileNames.CODEC_FILE_PATTERN.matcher(file).matches()) {
        throw new IllegalArgumentException("invalid codec filename '" + file + "', must match: "
            + IndexFileNames.CODEC_FILE_PATTERN.pattern());
      }
    }
  }

  @Override
  public String toString() {
    return toString(0);
  }

  /**
   * Used for debugging. Format is {@code name:CdocCount}, followed by
   * {@code /delCount} when {@code delCount} is not zero.
   */
  public String toString(int delCount) {
    String s = name + ":C" + docCount;
    return delCount == 0 ? s : s + "/" + delCount;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SegmentInfo)) {
      return false;
    }
    SegmentInfo other = (SegmentInfo) obj;
    return other.dir == dir && other.name.equals(name);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(dir) + name.hashCode();
  }
}
