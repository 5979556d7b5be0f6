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
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.TreeMap;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IOUtils;
import org.trypticon.segmentcore.UnknownFormatException;
import org.trypticon.segmentcore.codecs.DocValuesConsumer;
import org.trypticon.segmentcore.codecs.DocValuesFormat;
import org.trypticon.segmentcore.codecs.DocValuesProducer;
import org.trypticon.segmentcore.index.BinaryDocValues;
import org.trypticon.segmentcore.index.FieldInfo;
import org.trypticon.segmentcore.index.NumericDocValues;
import org.trypticon.segmentcore.index.SegmentReadState;
import org.trypticon.segmentcore.index.SegmentWriteState;
import org.trypticon.segmentcore.index.SortedDocValues;
import org.trypticon.segmentcore.index.SortedSetDocValues;

/**
 * Enables per field docvalues support.
 * <p>
 * Works like {@link PerFieldPostingsFormat} but records its choices under
 * its own attribute keys, so a field with both postings and doc values
 * carries both pairs.
 */
public abstract class PerFieldDocValuesFormat extends DocValuesFormat {
  /** Name of this {@link DocValuesFormat}. */
  public static final String PER_FIELD_NAME = "PerFieldDV40";

  /** {@link FieldInfo} attribute name used to store the
   *  format name for each field. */
  public static final String PER_FIELD_FORMAT_KEY = PerFieldDocValuesFormat.class.getSimpleName() + ".format";

  /** {@link FieldInfo} attribute name used to store the
   *  segment suffix name for each field. */
  public static final String PER_FIELD_SUFFIX_KEY = PerFieldDocValuesFormat.class.getSimpleName() + ".suffix";

  static final String INFO_STREAM_COMPONENT = "PFDVF";

  /** Sole constructor. */
  public PerFieldDocValuesFormat() {
    super(PER_FIELD_NAME);
  }

  @Override
  public final DocValuesConsumer fieldsConsumer(SegmentWriteState state) throws IOException {
    return new FieldsWriter(state);
  }

  static class ConsumerAndSuffix implements Closeable {
    DocValuesConsumer consumer;
    int suffix;

    @Override
    public void close() throws IOException {
      consumer.close();
    }
  }

  private class FieldsWriter extends DocValuesConsumer {

    private final Map<DocValuesFormat,ConsumerAndSuffix> formats = new IdentityHashMap<>();
    private final Map<String,Integer> suffixes = new HashMap<>();
    private boolean closed;

    private final SegmentWriteState segmentWriteState;

    FieldsWriter(SegmentWriteState state) {
      segmentWriteState = state;
    }

    @Override
    public void addNumericField(FieldInfo field, Iterable<Number> values) throws IOException {
      getInstance(field).addNumericField(field, values);
    }

    @Override
    public void addBinaryField(FieldInfo field, Iterable<BytesRef> values) throws IOException {
      getInstance(field).addBinaryField(field, values);
    }

    @Override
    public void addSortedField(FieldInfo field, Iterable<BytesRef> values, Iterable<Number> docToOrd) throws IOException {
      getInstance(field).addSortedField(field, values, docToOrd);
    }

    @Override
    public void addSortedSetField(FieldInfo field, Iterable<BytesRef> values, Iterable<Number> docToOrdCount, Iterable<Number> ords) throws IOException {
      getInstance(field).addSortedSetField(field, values, docToOrdCount, ords);
    }

    private DocValuesConsumer getInstance(FieldInfo field) throws IOException {
      final DocValuesFormat format = getDocValuesFormatForField(field.name);
      if (format == null) {
        throw new IllegalStateException("invalid null DocValuesFormat for field=\"" + field.name + "\"");
      }
      final String formatName = format.getName();

      PerFieldPostingsFormat.checkUnset(field, PER_FIELD_FORMAT_KEY);
      PerFieldPostingsFormat.checkUnset(field, PER_FIELD_SUFFIX_KEY);

      ConsumerAndSuffix consumer = formats.get(format);
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
        consumer = new ConsumerAndSuffix();
        consumer.consumer = format.fieldsConsumer(new SegmentWriteState(segmentWriteState, segmentSuffix));
        consumer.suffix = suffix;
        formats.put(format, consumer);

        if (segmentWriteState.infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
          segmentWriteState.infoStream.message(INFO_STREAM_COMPONENT, "segment " + segmentWriteState.segmentInfo.name
              + ": opened consumer " + segmentSuffix + " for field " + field.name);
        }
      } else {
        // we've already seen this format, so just grab its suffix
        assert suffixes.containsKey(formatName);
      }

      field.putAttribute(PER_FIELD_FORMAT_KEY, formatName);
      field.putAttribute(PER_FIELD_SUFFIX_KEY, Integer.toString(consumer.suffix));

      return consumer.consumer;
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

  static String getSuffix(String formatName, String suffix) {
    return formatName + "_" + suffix;
  }

  static String getFullSegmentSuffix(String fieldName, String outerSegmentSuffix, String segmentSuffix) {
    if (outerSegmentSuffix.length() == 0) {
      return segmentSuffix;
    } else {
      throw new IllegalStateException("cannot embed PerFieldDocValuesFormat inside itself (field \"" + fieldName + "\" returned PerFieldDocValuesFormat)");
    }
  }

  private static class FieldsReader extends DocValuesProducer {

    private final Map<String,DocValuesProducer> fields = new TreeMap<>();
    private final Map<String,DocValuesProducer> formats = new HashMap<>();
    private boolean closed;

    FieldsReader(final SegmentReadState readState) throws IOException {

      // Init each unique format:
      boolean success = false;
      try {
        // Read field name -> format name
        for (FieldInfo fi : readState.fieldInfos) {
          if (fi.hasDocValues()) {
            final String fieldName = fi.name;
            final String formatName = fi.getAttribute(PER_FIELD_FORMAT_KEY);
            if (formatName != null) {
              // null formatName means the field is in fieldInfos, but has no docvalues!
              final String suffix = fi.getAttribute(PER_FIELD_SUFFIX_KEY);
              if (suffix == null) {
                throw new IllegalStateException("missing attribute: " + PER_FIELD_SUFFIX_KEY + " for field: " + fieldName);
              }
              String segmentSuffix = getSuffix(formatName, suffix);
              if (!formats.containsKey(segmentSuffix)) {
                DocValuesFormat format = lookup(formatName, fieldName, readState);
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
    }

    private static DocValuesFormat lookup(String formatName, String fieldName, SegmentReadState readState) throws IOException {
      try {
        return DocValuesFormat.forName(formatName);
      } catch (IllegalArgumentException e) {
        throw new UnknownFormatException("unknown doc values format " + formatName + " for field " + fieldName,
            "segment " + readState.segmentInfo.name, e);
      }
    }

    @Override
    public NumericDocValues getNumeric(FieldInfo field) throws IOException {
      DocValuesProducer producer = fields.get(field.name);
      return producer == null ? null : producer.getNumeric(field);
    }

    @Override
    public BinaryDocValues getBinary(FieldInfo field) throws IOException {
      DocValuesProducer producer = fields.get(field.name);
      return producer == null ? null : producer.getBinary(field);
    }

    @Override
    public SortedDocValues getSorted(FieldInfo field) throws IOException {
      DocValuesProducer producer = fields.get(field.name);
      return producer == null ? null : producer.getSorted(field);
    }

    @Override
    public SortedSetDocValues getSortedSet(FieldInfo field) throws IOException {
      DocValuesProducer producer = fields.get(field.name);
      return producer == null ? null : producer.getSortedSet(field);
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

  @Override
  public final DocValuesProducer fieldsProducer(SegmentReadState state) throws IOException {
    return new FieldsReader(state);
  }

  /**
   * Returns the doc values format that should be used for writing
   * new segments of <code>field</code>.
   * <p>
   * The field to format mapping is written to the index, so
   * this method is only invoked when writing, not when reading. */
  public abstract DocValuesFormat getDocValuesFormatForField(String field);
}
