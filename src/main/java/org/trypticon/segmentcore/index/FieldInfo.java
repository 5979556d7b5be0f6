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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Describes a single field: how it is indexed and the codec attributes
 * recorded for it.
 */
public final class FieldInfo {
  public final String name;
  public final int number;

  private final boolean indexed;
  private final IndexOptions indexOptions;
  private final boolean storeTermVector;
  private final DocValuesType docValuesType;

  private final Map<String,String> attributes;

  public enum IndexOptions {
    // NOTE: order is important; later options include the earlier ones
    DOCS_ONLY,
    DOCS_AND_FREQS,
    DOCS_AND_FREQS_AND_POSITIONS,
  }

  public enum DocValuesType {
    NUMERIC,
    BINARY,
    SORTED,
    SORTED_SET
  }

  public FieldInfo(String name, int number, boolean indexed, IndexOptions indexOptions,
                   boolean storeTermVector, DocValuesType docValuesType, Map<String,String> attributes) {
    if (name == null) {
      throw new NullPointerException("name must not be null");
    }
    if (number < 0) {
      throw new IllegalArgumentException("field number must be >= 0, got " + number + " for field \"" + name + "\"");
    }
    this.name = name;
    this.number = number;
    this.indexed = indexed;
    if (indexed) {
      this.indexOptions = indexOptions == null ? IndexOptions.DOCS_AND_FREQS_AND_POSITIONS : indexOptions;
      this.storeTermVector = storeTermVector;
    } else { // for non-indexed fields, leave defaults
      this.indexOptions = null;
      this.storeTermVector = false;
    }
    this.docValuesType = docValuesType;
    this.attributes = attributes == null ? new HashMap<>() : new HashMap<>(attributes);
  }

  public boolean isIndexed() {
    return indexed;
  }

  public IndexOptions getIndexOptions() {
    return indexOptions;
  }

  public boolean hasVectors() {
    return storeTermVector;
  }

  public boolean hasDocValues() {
    return docValuesType != null;
  }

  public DocValuesType getDocValuesType() {
    return docValuesType;
  }

  public String getAttribute(String key) {
    return attributes.get(key);
  }

  /**
   * Puts a codec attribute value.
   *
   * @return the previous value, or {@code null}.
   */
  public String putAttribute(String key, String value) {
    return attributes.put(key, value);
  }

  public Map<String,String> attributes() {
    return Collections.unmodifiableMap(attributes);
  }

  @Override
  public String toString() {
    return "FieldInfo(name=" + name + ",number=" + number + ",indexed=" + indexed + ",indexOptions=" + indexOptions
        + ",vectors=" + storeTermVector + ",docValues=" + docValuesType + ")";
  }
}
