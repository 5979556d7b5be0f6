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

import org.apache.lucene.util.BytesRef;
import org.trypticon.segmentcore.index.FieldInfo;

/**
 * Codec API for writing term vectors:
 * <ol>
 *   <li>For every document, {@link #startDocument(int)} is called,
 *       informing the Codec how many fields will be written.
 *   <li>{@link #startField(FieldInfo, int, boolean)} is called for
 *       each field in the document, informing the codec how many terms
 *       will be written for that field, and whether or not positions
 *       are enabled.
 *   <li>Within each field, {@link #startTerm(BytesRef, int)} is called
 *       for each term.
 *   <li>If positions are enabled, {@link #addPosition(int)} will be called for each
 *       term occurrence.
 *   <li>After all documents have been written, {@link #finish(int)}
 *       is called for verification/sanity-checks.
 *   <li>Finally the writer is closed ({@link #close()})
 * </ol>
 */
public abstract class TermVectorsWriter implements Closeable {

  protected TermVectorsWriter() {
  }

  /** Called before writing the term vectors of the document.
   *  {@link #startField(FieldInfo, int, boolean)} will
   *  be called <code>numVectorFields</code> times. Note that if term
   *  vectors are enabled, this is called even if the document
   *  has no vector fields, in this case <code>numVectorFields</code>
   *  will be zero. */
  public abstract void startDocument(int numVectorFields) throws IOException;

  /** Called after a doc and all its fields have been added. */
  public void finishDocument() throws IOException {}

  /** Called before writing the terms of the field.
   *  {@link #startTerm(BytesRef, int)} will be called <code>numTerms</code> times. */
  public abstract void startField(FieldInfo info, int numTerms, boolean positions) throws IOException;

  /** Called after a field and all its terms have been added. */
  public void finishField() throws IOException {}

  /** Adds a term and its term frequency <code>freq</code>.
   * If this field has positions enabled, then
   * {@link #addPosition(int)} will be called
   * <code>freq</code> times respectively.
   */
  public abstract void startTerm(BytesRef term, int freq) throws IOException;

  /** Called after a term and all its positions have been added. */
  public void finishTerm() throws IOException {}

  /** Adds a term position */
  public abstract void addPosition(int position) throws IOException;

  /** Called before {@link #close()}, passing in the number
   *  of documents that were written. This must equal the number
   *  of calls to {@link #startDocument(int)}. */
  public abstract void finish(int numDocs) throws IOException;

  @Override
  public abstract void close() throws IOException;
}
