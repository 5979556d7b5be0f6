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

/**
 * Access to the terms in a specific field.
 */
public abstract class Terms {

  protected Terms() {
  }

  /** Returns the number of terms for this field, or -1 if this
   *  measure isn't stored by the codec. */
  public abstract long size() throws IOException;

  /** Returns the sum of the total term frequencies of all terms in this
   *  field, or -1 if frequencies were omitted for the field. */
  public abstract long getSumTotalTermFreq() throws IOException;

  /** Returns the sum of the document frequencies of all terms in this
   *  field. */
  public abstract long getSumDocFreq() throws IOException;

  /** Returns the number of documents that have at least one
   *  term for this field. */
  public abstract int getDocCount() throws IOException;
}
