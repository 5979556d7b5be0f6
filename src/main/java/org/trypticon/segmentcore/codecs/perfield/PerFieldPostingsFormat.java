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
package org.trypticon.segmentcore.codecs.perfield;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import org.apache.lucene.util.IOUtils;
import org.trypticon.segmentcore.InfoStream;
import org.trypticon.segmentcore.UnknownFormatException;
import org.trypticon.segmentcore.codecs.FieldsConsumer;
import org.trypticon.segmentcore.codecs.FieldsProducer;
import org.trypticon.segmentcore.codecs.PostingsFormat;
import org.trypticon.segmentcore.codecs.TermsConsumer;
import org.trypticon.segmentcore.index.FieldInfo;
import org.trypticon.segmentcore.index.SegmentReadState;
import org.trypticon.segmentcore.index.SegmentWriteState;
import org.trypticon.segmentcore.index.Terms;

/**
 * Enables per field postings support.
 * <p>
 * Note, when extending this class, the name ({@link #getName}) is
 * written into the index. In order for the field to be read, the
 * name must resolve to your implementation via {@link #forName(String)}.
 * This method uses Java's
 * {@link java.util.ServiceLoader Service Provider Interface} to resolve format names.
 * <p>
 * Files written by each posting format have an additional suffix containing the
 * format name and a per-name counter. For example, in a per-field configuration
 * instead of <code>_1.prx</code> filenames would look like
 * <code>_1_Lucene40_0.prx</code>. Two distinct format instances with the same
 * name get distinct counters even when they are equal.
 *
 * @see java.util.ServiceLoader
 */
public abstract class PerFieldPostingsFormat extends PostingsFormat {
  /** Name of this {@link PostingsFormat}. */
  public static final String PER_FIELD_NAME = "PerField40";

  /** {@link FieldInfo} attribute name used to store the
   *  format name for each field. */
  public static final String PER_FIELD_FORMAT_KEY = PerFieldPostingsFormat.class.getSimpleName() + ".format";

  /** {@link FieldInfo} attribute name used to store the
   *  segment suffix name for each field. */
  public static final String PER_FIELD_SUFFIX_KEY = PerFieldPostingsFormat.class.getSimpleName() + ".suffix";

  static final String INFO_STREAM_COMPONENT = "PFPF";

  /** Sole constructor. */
  public PerFieldPostingsFormat() {
    super(PER_FIELD_NAME);
  }

  @Override
  public final FieldsConsumer fieldsConsumer(SegmentWriteState state)
      throws IOException {
    return new FieldsWriter(state);
  }

  static class FieldsConsumerAndSuffix implements Closeable {
    final FieldsConsumer consumer;
    final int suffix;

    FieldsConsumerAndSuffix(FieldsConsumer consumer, int suffix) {
      this.consumer = consumer;
      this.suffix = suffix;
    }

    @Override
    public void close() throws IOException {
      consumer.close();
    }
  }

  private class FieldsWriter extends FieldsConsumer {

    // keyed by instance: equal formats still get their own files
    private final Map<PostingsFormat,FieldsConsumerAndSuffix> formats = new IdentityHashMap<>();
    private final Map<String,Integer> suffixes = new HashMap<>();
    private boolean closed;

    private final SegmentWriteState segmentWriteState;

    FieldsWriter(SegmentWriteState state) {
      segmentWriteState = state;
    }

    @Override
    public TermsConsumer addField(FieldInfo field) throws IOException {
      final PostingsFormat format = getPostingsFormatForField(field.name);
      if (format == null) {
        throw new IllegalStateException("invalid null PostingsFormat for field=\"" + field.name + "\"");
      }
      final String formatName = format.getName();

      checkUnset(field, PER_FIELD_FORMAT_KEY);
      checkUnset(field, PER_FIELD_SUFFIX_KEY);

      FieldsConsumerAndSuffix consumer = formats.get(format);
      if (consumer == null) {
        // First time we are seeing this format; create a new instance

        // bump the suffix
        Integer suffix = suffixes.get(formatName);
        if (suffix == null) {
          suffix = 0;
        } else {
          suffix = suffix + 1;
        }

        final String segmentSuffix = getFullSegmentSuffix(field.name,
                                                          segmentWriteState.segmentSuffix,
                                                          getSuffix(formatName, Integer.toString(suffix)));
        suffixes.put(formatName, suffix);
        consumer = new FieldsConsumerAndSuffix(format.fieldsConsumer(new SegmentWriteState(segmentWriteState, segmentSuffix)), suffix);
        formats.put(format, consumer);

        InfoStream infoStream = segmentWriteState.infoStream;
        if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
          infoStream.message(INFO_STREAM_COMPONENT, "segment " + segmentWriteState.segmentInfo.name
              + ": opened consumer " + segmentSuffix + " for field " + field.name);
        }
      } else {
        // we've already seen this format, so just grab its suffix
        assert suffixes.containsKey(formatName);
      }

      field.putAttribute(PER_FIELD_FORMAT_KEY, formatName);
      field.putAttribute(PER_FIELD_SUFFIX_KEY, Integer.toString(consumer.suffix));

      return consumer.consumer.addField(field);
    }

    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      IOUtils.close(formats.values());
    }
  }

  static void checkUnset(FieldInfo field, String key) {
    final String previous = field.getAttribute(key);
    if (previous != null) {
      throw new IllegalStateException("field \"" + field.name + "\" already has " + key + "=" + previous);
    }
  }

  static String getSuffix(String formatName, String suffix) {
    return formatName + "_" + suffix;
  }

  static String getFullSegmentSuffix(String fieldName, String outerSegmentSuffix, String segmentSuffix) {
    if (outerSegmentSuffix.length() == 0) {
      return segmentSuffix;
    } else {
      throw new IllegalStateException("cannot embed PerFieldPostingsFormat inside itself (field \"" + fieldName + "\" returned PerFieldPostingsFormat)");
    }
  }

  private static class FieldsReader extends FieldsProducer {

    private final Map<String,FieldsProducer> fields = new TreeMap<>();
    private final Map<String,FieldsProducer> formats = new HashMap<>();

    private final String segment;
    private boolean closed;

    FieldsReader(final SegmentReadState readState) throws IOException {

      boolean success = false;
      try {
        // Read field name -> format name
        for (FieldInfo fi : readState.fieldInfos) {
          if (fi.isIndexed()) {
            final String fieldName = fi.name;
            final String formatName = fi.getAttribute(PER_FIELD_FORMAT_KEY);
            if (formatName != null) {
              // null formatName means the field is in fieldInfos, but has no postings!
              final String suffix = fi.getAttribute(PER_FIELD_SUFFIX_KEY);
              if (suffix == null) {
                throw new IllegalStateException("missing attribute: " + PER_FIELD_SUFFIX_KEY + " for field: " + fieldName);
              }
              String segmentSuffix = getSuffix(formatName, suffix);
              if (!formats.containsKey(segmentSuffix)) {
                PostingsFormat format = lookup(formatName, fieldName, readState);
                formats.put(segmentSuffix, format.fieldsProducer(new SegmentReadState(readState, segmentSuffix)));
                if (readState.infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
                  readState.infoStream.message(INFO_STREAM_COMPONENT, "segment " + readState.segmentInfo.name
                      + ": opened producer " + segmentSuffix + " for field " + fieldName);
                }
              }
              fields.put(fieldName, formats.get(segmentSuffix));
            }
          }
        }
        success = true;
      } finally {
        if (!success) {
          if (readState.infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
            readState.infoStream.message(INFO_STREAM_COMPONENT, "segment " + readState.segmentInfo.name
                + ": failed to open; closing " + formats.size() + " producers");
          }
          IOUtils.closeWhileHandlingException(formats.values());
        }
      }

      this.segment = readState.segmentInfo.name;
    }

    private static PostingsFormat lookup(String formatName, String fieldName, SegmentReadState readState) throws IOException {
      try {
        return PostingsFormat.forName(formatName);
      } catch (IllegalArgumentException e) {
        throw new UnknownFormatException("unknown postings format " + formatName + " for field " + fieldName,
            "segment " + readState.segmentInfo.name, e);
      }
    }

    @Override
    public Iterator<String> iterator() {
      return Collections.unmodifiableSet(fields.keySet()).iterator();
    }

    @Override
    public Terms terms(String field) throws IOException {
      FieldsProducer fieldsProducer = fields.get(field);
      return fieldsProducer == null ? null : fieldsProducer.terms(field);
    }

    @Override
    public int size() {
      return fields.size();
    }

    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      IOUtils.close(formats.values());
    }

    @Override
    public String toString() {
      return "PerFieldPostings(segment=" + segment + " formats=" + formats.size() + ")";
    }
  }

  @Override
  public final FieldsProducer fieldsProducer(SegmentReadState state)
      throws IOException {
    return new FieldsReader(state);
  }

  /**
   * Returns the postings format that should be used for writing
   * new segments of <code>field</code>.
   * <p>
   * The field to format mapping is written to the index, so
   * this method is only invoked when writing, not when reading. */
  public abstract PostingsFormat getPostingsFormatForField(String field);
}
