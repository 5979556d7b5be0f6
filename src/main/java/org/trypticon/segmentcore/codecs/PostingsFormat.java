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
package org.trypticon.segmentcore.codecs;

import java.io.IOException;
import java.util.Set;

import org.apache.lucene.util.NamedSPILoader;
import org.trypticon.segmentcore.index.SegmentReadState;
import org.trypticon.segmentcore.index.SegmentWriteState;

/**
 * Writes and reads the postings of a segment.
 * <p>
 * The name given at construction is persisted with every field the format
 * writes and resolved again through {@link #forName(String)} when the
 * segment is opened. Implementations therefore need a public no-argument
 * constructor and an entry in
 * {@code META-INF/services/org.trypticon.segmentcore.codecs.PostingsFormat}.
 */
public abstract class PostingsFormat implements NamedSPILoader.NamedSPI {

  private static final NamedSPILoader<PostingsFormat> FORMATS = new NamedSPILoader<>(PostingsFormat.class);

  private final String name;

  /**
   * @param name ASCII letters, digits and underscores, shorter than 128 characters.
   * @throws IllegalArgumentException if the name cannot be used as a service name.
   */
  protected PostingsFormat(String name) {
    NamedSPILoader.checkServiceName(name);
    this.name = name;
  }

  @Override
  public final String getName() {
    return name;
  }

  /** Opens a consumer for the segment (and suffix) of {@code state}. */
  public abstract FieldsConsumer fieldsConsumer(SegmentWriteState state) throws IOException;

  /**
   * Opens a producer for the segment (and suffix) of {@code state}. The
   * producer holds every file it needs by the time this returns.
   */
  public abstract FieldsProducer fieldsProducer(SegmentReadState state) throws IOException;

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ")";
  }

  /**
   * Resolves a persisted format name.
   *
   * @throws IllegalArgumentException if no format of that name is registered.
   */
  public static PostingsFormat forName(String name) {
    return FORMATS.lookup(name);
  }

  public static Set<String> availablePostingsFormats() {
    return FORMATS.availableServices();
  }

  /** Rescans {@code classloader} for formats registered after startup. */
  public static void reloadPostingsFormats(ClassLoader classloader) {
    FORMATS.reload(classloader);
  }
}
