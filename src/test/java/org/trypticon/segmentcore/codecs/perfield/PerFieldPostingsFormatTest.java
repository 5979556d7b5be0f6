package org.trypticon.segmentcore.codecs.perfield;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.util.BytesRef;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.trypticon.segmentcore.InfoStream;
import org.trypticon.segmentcore.PrintStreamInfoStream;
import org.trypticon.segmentcore.UnknownFormatException;
import org.trypticon.segmentcore.codecs.AlphaPostingsFormat;
import org.trypticon.segmentcore.codecs.BetaPostingsFormat;
import org.trypticon.segmentcore.codecs.BrokenPostingsFormat;
import org.trypticon.segmentcore.codecs.FieldsConsumer;
import org.trypticon.segmentcore.codecs.FieldsProducer;
import org.trypticon.segmentcore.codecs.PostingsConsumer;
import org.trypticon.segmentcore.codecs.PostingsFormat;
import org.trypticon.segmentcore.codecs.RecordingCodec;
import org.trypticon.segmentcore.codecs.RecordingPostingsFormat;
import org.trypticon.segmentcore.codecs.RecordingPostingsFormat.RecordedTerms;
import org.trypticon.segmentcore.codecs.RecordingPostingsFormat.RecordingFieldsConsumer;
import org.trypticon.segmentcore.codecs.RecordingPostingsFormat.RecordingFieldsProducer;
import org.trypticon.segmentcore.codecs.TermStats;
import org.trypticon.segmentcore.codecs.TermsConsumer;
import org.trypticon.segmentcore.index.FieldInfo;
import org.trypticon.segmentcore.index.FieldInfos;
import org.trypticon.segmentcore.index.SegmentInfo;
import org.trypticon.segmentcore.index.SegmentReadState;
import org.trypticon.segmentcore.index.SegmentWriteState;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link PerFieldPostingsFormat}.
 */
public class PerFieldPostingsFormatTest {
    private Directory directory;
    private SegmentInfo segmentInfo;

    @Before
    public void setUp() {
        RecordingPostingsFormat.clearRegistry();
        directory = new ByteBuffersDirectory();
    }

    @After
    public void tearDown() throws IOException {
        directory.close();
    }

    private static FieldInfo field(String name, int number) {
        return new FieldInfo(name, number, true, null, false, null, null);
    }

    private SegmentWriteState writeState(PostingsFormat format, FieldInfos fieldInfos, String suffix) {
        segmentInfo = new SegmentInfo(directory, "_1", 1, new RecordingCodec(format, null));
        return new SegmentWriteState(InfoStream.NO_OUTPUT, directory, segmentInfo, fieldInfos, suffix, IOContext.DEFAULT);
    }

    private SegmentReadState readState(FieldInfos fieldInfos, InfoStream infoStream) {
        return new SegmentReadState(directory, segmentInfo, fieldInfos, IOContext.DEFAULT, "", infoStream);
    }

    private static void writeOneTerm(FieldsConsumer consumer, FieldInfo field, String term) throws IOException {
        TermsConsumer termsConsumer = consumer.addField(field);
        BytesRef text = new BytesRef(term);
        PostingsConsumer postingsConsumer = termsConsumer.startTerm(text);
        postingsConsumer.startDoc(0, 1);
        postingsConsumer.addPosition(0);
        postingsConsumer.finishDoc();
        termsConsumer.finishTerm(text, new TermStats(1, 1));
        termsConsumer.finish(1, 1, 1);
    }

    private FieldInfos writeSegment(PerFieldPostingsFormat format, FieldInfo... fields) throws IOException {
        FieldInfos fieldInfos = new FieldInfos(fields);
        try (FieldsConsumer consumer = format.fieldsConsumer(writeState(format, fieldInfos, ""))) {
            for (FieldInfo field : fields) {
                writeOneTerm(consumer, field, field.name + "-term");
            }
        }
        return fieldInfos;
    }

    @Test
    public void testWrite_SharedFormatSharesConsumer() throws IOException {
        AlphaPostingsFormat alpha = new AlphaPostingsFormat();
        FieldInfos fieldInfos = writeSegment(new RoutedPostingsFormat(alpha).route("id", new BetaPostingsFormat()),
                                             field("body", 0), field("id", 1), field("title", 2));

        assertThat(RecordingPostingsFormat.CONSUMERS.size(), is(2));
        assertThat(RecordingPostingsFormat.CONSUMERS.get(0).fieldNames, contains("body", "title"));
        assertThat(fieldInfos.fieldInfo("body").getAttribute(PerFieldPostingsFormat.PER_FIELD_SUFFIX_KEY), is("0"));
        assertThat(fieldInfos.fieldInfo("title").getAttribute(PerFieldPostingsFormat.PER_FIELD_SUFFIX_KEY), is("0"));
        assertThat(fieldInfos.fieldInfo("id").getAttribute(PerFieldPostingsFormat.PER_FIELD_FORMAT_KEY), is("Beta"));
    }

    @Test
    public void testWrite_SameNameDifferentInstancesGetOwnSuffix() throws IOException {
        FieldInfos fieldInfos = writeSegment(new RoutedPostingsFormat(new AlphaPostingsFormat()).route("b", new AlphaPostingsFormat()),
                                             field("a", 0), field("b", 1));

        assertThat(RecordingPostingsFormat.CONSUMERS.size(), is(2));
        assertThat(RecordingPostingsFormat.CONSUMERS.get(0).segmentSuffix, is("Alpha_0"));
        assertThat(RecordingPostingsFormat.CONSUMERS.get(1).segmentSuffix, is("Alpha_1"));
        assertThat(fieldInfos.fieldInfo("a").getAttribute(PerFieldPostingsFormat.PER_FIELD_SUFFIX_KEY), is("0"));
        assertThat(fieldInfos.fieldInfo("b").getAttribute(PerFieldPostingsFormat.PER_FIELD_SUFFIX_KEY), is("1"));
    }

    @Test
    public void testWrite_AttributeAlreadySet() throws IOException {
        FieldInfo body = field("body", 0);
        body.putAttribute(PerFieldPostingsFormat.PER_FIELD_FORMAT_KEY, "Beta");
        PerFieldPostingsFormat format = new RoutedPostingsFormat(new AlphaPostingsFormat());

        try (FieldsConsumer consumer = format.fieldsConsumer(writeState(format, new FieldInfos(body), ""))) {
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> consumer.addField(body));
            assertThat(e.getMessage(), containsString("already has"));
        }
        assertThat(RecordingPostingsFormat.CONSUMERS.isEmpty(), is(true));
        assertThat(body.getAttribute(PerFieldPostingsFormat.PER_FIELD_FORMAT_KEY), is("Beta"));
    }

    @Test
    public void testWrite_NullFormat() throws IOException {
        FieldInfo body = field("body", 0);
        PerFieldPostingsFormat format = new RoutedPostingsFormat(null);

        try (FieldsConsumer consumer = format.fieldsConsumer(writeState(format, new FieldInfos(body), ""))) {
            assertThrows(IllegalStateException.class, () -> consumer.addField(body));
        }
    }

    @Test
    public void testWrite_CannotEmbedInsideSuffixedSegment() throws IOException {
        FieldInfo body = field("body", 0);
        PerFieldPostingsFormat format = new RoutedPostingsFormat(new AlphaPostingsFormat());

        try (FieldsConsumer consumer = format.fieldsConsumer(writeState(format, new FieldInfos(body), "outer"))) {
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> consumer.addField(body));
            assertThat(e.getMessage(), containsString("cannot embed"));
        }
    }

    @Test
    public void testWrite_CloseClosesEveryConsumerEvenOnFailure() throws IOException {
        FieldInfo a = field("a", 0);
        FieldInfo b = field("b", 1);
        PerFieldPostingsFormat format = new RoutedPostingsFormat(new AlphaPostingsFormat()).route("b", new BetaPostingsFormat());
        FieldsConsumer consumer = format.fieldsConsumer(writeState(format, new FieldInfos(a, b), ""));
        writeOneTerm(consumer, a, "x");
        writeOneTerm(consumer, b, "y");

        IOException failure = new IOException("simulated close failure");
        RecordingPostingsFormat.CONSUMERS.get(0).failOnClose(failure);

        IOException e = assertThrows(IOException.class, consumer::close);
        assertThat(e, is(failure));
        for (RecordingFieldsConsumer sub : RecordingPostingsFormat.CONSUMERS) {
            assertThat(sub.getCloseCount(), is(1));
        }
    }

    @Test
    public void testWrite_CloseTwiceClosesConsumersOnce() throws IOException {
        FieldInfo a = field("a", 0);
        FieldInfo b = field("b", 1);
        PerFieldPostingsFormat format = new RoutedPostingsFormat(new AlphaPostingsFormat()).route("b", new BetaPostingsFormat());
        FieldsConsumer consumer = format.fieldsConsumer(writeState(format, new FieldInfos(a, b), ""));
        writeOneTerm(consumer, a, "x");
        writeOneTerm(consumer, b, "y");

        consumer.close();
        consumer.close();

        assertThat(RecordingPostingsFormat.CONSUMERS.size(), is(2));
        for (RecordingFieldsConsumer sub : RecordingPostingsFormat.CONSUMERS) {
            assertThat(sub.getCloseCount(), is(1));
        }
    }

    @Test
    public void testRead_OneProducerPerSuffix() throws IOException {
        FieldInfo stored = new FieldInfo("stored", 3, false, null, false, null, null);
        stored.putAttribute(PerFieldPostingsFormat.PER_FIELD_FORMAT_KEY, "Alpha");
        FieldInfos written = writeSegment(new RoutedPostingsFormat(new AlphaPostingsFormat()).route("id", new BetaPostingsFormat()),
                                          field("title", 0), field("body", 1), field("id", 2));
        List<FieldInfo> all = new ArrayList<>();
        written.forEach(all::add);
        all.add(stored);
        FieldInfos fieldInfos = new FieldInfos(all.toArray(new FieldInfo[0]));

        PerFieldPostingsFormat format = new RoutedPostingsFormat(null);
        try (FieldsProducer producer = format.fieldsProducer(readState(fieldInfos, InfoStream.NO_OUTPUT))) {
            assertThat(RecordingPostingsFormat.PRODUCERS.size(), is(2));
            assertThat(producer.size(), is(3));
            List<String> names = new ArrayList<>();
            producer.iterator().forEachRemaining(names::add);
            assertThat(names, contains("body", "id", "title"));

            RecordedTerms body = (RecordedTerms) producer.terms("body");
            assertThat(body.postings.keySet(), contains("body-term"));
            assertThat(producer.terms("stored"), is(nullValue()));
            assertThat(producer.terms("missing"), is(nullValue()));
        }
    }

    @Test
    public void testRead_UnknownFormatClosesOpenedProducers() throws IOException {
        FieldInfo a = field("a", 0);
        writeSegment(new RoutedPostingsFormat(new AlphaPostingsFormat()), a);
        FieldInfo b = field("b", 1);
        b.putAttribute(PerFieldPostingsFormat.PER_FIELD_FORMAT_KEY, "Nope");
        b.putAttribute(PerFieldPostingsFormat.PER_FIELD_SUFFIX_KEY, "0");

        ByteArrayOutputStream log = new ByteArrayOutputStream();
        PrintStream stream = new PrintStream(log, true, "UTF-8");
        PerFieldPostingsFormat format = new RoutedPostingsFormat(null);
        UnknownFormatException e = assertThrows(UnknownFormatException.class,
                () -> format.fieldsProducer(readState(new FieldInfos(a, b), new PrintStreamInfoStream(stream))));

        assertThat(e.getMessage(), containsString("Nope"));
        assertThat(e.getCause(), is(instanceOf(IllegalArgumentException.class)));
        RecordingFieldsProducer opened = RecordingPostingsFormat.PRODUCERS.get(0);
        assertThat(opened.getCloseCount(), is(1));
        assertThat(new String(log.toByteArray(), StandardCharsets.UTF_8), containsString("failed to open; closing 1 producers"));
    }

    @Test
    public void testRead_ProducerFailureClosesOpenedProducers() throws IOException {
        FieldInfo a = field("a", 0);
        FieldInfo b = field("b", 1);
        writeSegment(new RoutedPostingsFormat(new AlphaPostingsFormat()).route("b", new BrokenPostingsFormat()), a, b);

        PerFieldPostingsFormat format = new RoutedPostingsFormat(null);
        IOException e = assertThrows(IOException.class,
                () -> format.fieldsProducer(readState(new FieldInfos(a, b), InfoStream.NO_OUTPUT)));

        assertThat(e.getMessage(), containsString("Broken_0"));
        assertThat(RecordingPostingsFormat.PRODUCERS.size(), is(1));
        assertThat(RecordingPostingsFormat.PRODUCERS.get(0).getCloseCount(), is(1));
    }

    @Test
    public void testRead_MissingSuffix() throws IOException {
        FieldInfo a = field("a", 0);
        a.putAttribute(PerFieldPostingsFormat.PER_FIELD_FORMAT_KEY, "Alpha");
        segmentInfo = new SegmentInfo(directory, "_1", 1, null);

        PerFieldPostingsFormat format = new RoutedPostingsFormat(null);
        assertThrows(IllegalStateException.class,
                     () -> format.fieldsProducer(readState(new FieldInfos(a), InfoStream.NO_OUTPUT)));
    }

    @Test
    public void testRead_NoFieldsWithPostings() throws IOException {
        segmentInfo = new SegmentInfo(directory, "_1", 1, null);

        PerFieldPostingsFormat format = new RoutedPostingsFormat(null);
        try (FieldsProducer producer = format.fieldsProducer(readState(new FieldInfos(field("a", 0)), InfoStream.NO_OUTPUT))) {
            assertThat(producer.size(), is(0));
            assertThat(producer.iterator().hasNext(), is(false));
        }
    }

    @Test
    public void testClose_Idempotent() throws IOException {
        FieldInfos fieldInfos = writeSegment(new RoutedPostingsFormat(new AlphaPostingsFormat()), field("a", 0));

        FieldsProducer producer = new RoutedPostingsFormat(null).fieldsProducer(readState(fieldInfos, InfoStream.NO_OUTPUT));
        producer.close();
        producer.close();

        assertThat(RecordingPostingsFormat.PRODUCERS.get(0).getCloseCount(), is(1));
    }
}
