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

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The fields of one segment, iterated in field number order. Names and
 * numbers must both be unique.
 */
public class FieldInfos implements Iterable<FieldInfo> {
  private final List<FieldInfo> ordered;
  private final Map<String,FieldInfo> byName = new HashMap<>();
  private boolean hasVectors;
  private boolean hasDocValues;

  public FieldInfos(FieldInfo... infos) {
    FieldInfo[] sorted = infos.clone();
    Arrays.sort(sorted, Comparator.comparingInt((FieldInfo info) -> info.number));
    for (int i = 0; i < sorted.length; i++) {
      FieldInfo info = sorted[i];
      if (i > 0 && sorted[i - 1].number == info.number) {
        throw new IllegalArgumentException("fields \"" + sorted[i - 1].name + "\" and \"" + info.name
            + "\" share field number " + info.number);
      }
      FieldInfo sameName = byName.put(info.name, info);
      if (sameName != null) {
        throw new IllegalArgumentException("field \"" + info.name + "\" appears with numbers "
            + sameName.number + " and " + info.number);
      }
      hasVectors |= info.hasVectors();
      hasDocValues |= info.hasDocValues();
    }
    ordered = Collections.unmodifiableList(Arrays.asList(sorted));
  }

  /** Returns true if any field stores term vectors. */
  public boolean hasVectors() {
    return hasVectors;
  }

  /** Returns true if any field has doc values. */
  public boolean hasDocValues() {
    return hasDocValues;
  }

  public int size() {
    return ordered.size();
  }

  @Override
  public Iterator<FieldInfo> iterator() {
    return ordered.iterator();
  }

  /** Returns the field of that name, or {@code null} if there is none. */
  public FieldInfo fieldInfo(String fieldName) {
    return byName.get(fieldName);
  }
}
