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

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;

import org.trypticon.segmentcore.index.Terms;

/** Abstract API that produces terms, doc, freq, prox, offset and
 *  payloads postings.
 */
public abstract class FieldsProducer implements Closeable {

  protected FieldsProducer() {
  }

  /** Returns an iterator over the field names with postings, in sorted order. */
  public abstract Iterator<String> iterator();

  /** Get the {@link Terms} for this field, or {@code null} if the field has none. */
  public abstract Terms terms(String field) throws IOException;

  /** Returns the number of fields, or -1 if the number is unknown. */
  public abstract int size();

  @Override
  public abstract void close() throws IOException;
}
