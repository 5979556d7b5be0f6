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

/**
 * Tracks the number and position of terms while inverting one field of one
 * document. The caller sets {@link #position} before posting each token.
 */
public final class FieldInvertState {
  final String name;
  public int position;
  public int length;
  public int uniqueTermCount;
  public int maxTermFrequency;

  public FieldInvertState(String name) {
    this.name = name;
  }

  /** Re-initialize the state for a new document. */
  public void reset() {
    position = 0;
    length = 0;
    uniqueTermCount = 0;
    maxTermFrequency = 0;
  }

  public String getName() {
    return name;
  }
}
