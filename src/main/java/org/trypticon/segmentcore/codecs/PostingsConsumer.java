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

/**
 * Abstract API that consumes postings for an individual term.
 * <p>
 * For every document {@link #startDoc(int, int)} is called, followed by one
 * {@link #addPosition(int)} per occurrence when positions are indexed, and
 * finally {@link #finishDoc()}.
 */
public abstract class PostingsConsumer {

  protected PostingsConsumer() {
  }

  /** Adds a new doc in this term.
   *  <code>freq</code> will be -1 when term frequencies are omitted
   *  for the field. */
  public abstract void startDoc(int docID, int freq) throws IOException;

  /** Add a new position. */
  public abstract void addPosition(int position) throws IOException;

  /** Called when we are done adding positions for
   *  the current document. */
  public abstract void finishDoc() throws IOException;
}
