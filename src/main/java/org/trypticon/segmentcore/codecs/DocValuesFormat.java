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
 * Writes and reads per-document values. Registered and resolved by name
 * the same way as {@link PostingsFormat}.
 */
public abstract class DocValuesFormat implements NamedSPILoader.NamedSPI {

  private static final NamedSPILoader<DocValuesFormat> FORMATS = new NamedSPILoader<>(DocValuesFormat.class);

  private final String name;

  protected DocValuesFormat(String name) {
    NamedSPILoader.checkServiceName(name);
    this.name = name;
  }

  @Override
  public final String getName() {
    return name;
  }

  public abstract DocValuesConsumer fieldsConsumer(SegmentWriteState state) throws IOException;

  public abstract DocValuesProducer fieldsProducer(SegmentReadState state) throws IOException;

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ")";
  }

  public static DocValuesFormat forName(String name) {
    return FORMATS.lookup(name);
  }

  public static Set<String> availableDocValuesFormats() {
    return FORMATS.availableServices();
  }
}
