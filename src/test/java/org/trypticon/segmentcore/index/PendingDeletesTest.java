package org.trypticon.segmentcore.index;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.Bits;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.trypticon.segmentcore.InfoStream;
import org.trypticon.segmentcore.PrintStreamInfoStream;
import org.trypticon.segmentcore.codecs.RecordingCodec;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContainingInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyArray;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link PendingDeletes}.
 */
public class PendingDeletesTest {
    private Directory directory;
    private RecordingCodec codec;
    private SegmentInfo segmentInfo;

    @Before
    public void setUp() {
        directory = new ByteBuffersDirectory();
        codec = new RecordingCodec();
        segmentInfo = new SegmentInfo(directory, "_0", 6, codec);
        segmentInfo.setFiles(Collections.emptySet());
    }

    @After
    public void tearDown() throws IOException {
        directory.close();
    }

    @Test
    public void testDelete() throws IOException {
        PendingDeletes deletes = new PendingDeletes(new SegmentCommitInfo(segmentInfo, 0, -1), InfoStream.NO_OUTPUT);
        assertThat(deletes.getLiveDocs(), is(nullValue()));

        assertThat(deletes.delete(2), is(true));
        assertThat(deletes.delete(2), is(false));
        assertThat(deletes.delete(4), is(true));

        assertThat(deletes.numPendingDeletes(), is(2));
        assertThat(deletes.getDelCount(), is(2));
        Bits liveDocs = deletes.getLiveDocs();
        assertThat(liveDocs.get(2), is(false));
        assertThat(liveDocs.get(3), is(true));
    }

    @Test
    public void testGetLiveDocs_SnapshotUnaffectedByLaterDeletes() throws IOException {
        PendingDeletes deletes = new PendingDeletes(new SegmentCommitInfo(segmentInfo, 0, -1), InfoStream.NO_OUTPUT);
        deletes.delete(1);
        Bits snapshot = deletes.getLiveDocs();

        deletes.delete(5);

        assertThat(snapshot.get(5), is(true));
        assertThat(deletes.getLiveDocs().get(5), is(false));
    }

    @Test
    public void testWriteLiveDocs_NothingPending() throws IOException {
        SegmentCommitInfo info = new SegmentCommitInfo(segmentInfo, 0, -1);
        PendingDeletes deletes = new PendingDeletes(info, InfoStream.NO_OUTPUT);

        assertThat(deletes.writeLiveDocs(directory), is(false));
        assertThat(info.getDelGen(), is(-1L));
        assertThat(directory.listAll(), is(emptyArray()));
    }

    @Test
    public void testWriteLiveDocs_AdvancesGenerations() throws IOException {
        SegmentCommitInfo info = new SegmentCommitInfo(segmentInfo, 0, -1);
        PendingDeletes deletes = new PendingDeletes(info, InfoStream.NO_OUTPUT);
        deletes.delete(0);
        deletes.delete(3);

        assertThat(deletes.writeLiveDocs(directory), is(true));
        assertThat(info.getDelGen(), is(1L));
        assertThat(info.getNextDelGen(), is(2L));
        assertThat(info.getDelCount(), is(2));
        assertThat(deletes.numPendingDeletes(), is(0));
        assertThat(directory.listAll(), is(arrayContainingInAnyOrder("_0_1.liv")));

        deletes.delete(1);
        assertThat(deletes.writeLiveDocs(directory), is(true));
        assertThat(info.getDelGen(), is(2L));
        assertThat(info.getNextDelGen(), is(3L));
        assertThat(info.getDelCount(), is(3));
        assertThat(info.files().contains("_0_2.liv"), is(true));
    }

    @Test
    public void testWriteLiveDocs_FailureThenRetryUsesNewGeneration() throws IOException {
        SegmentCommitInfo info = new SegmentCommitInfo(segmentInfo, 0, -1);
        ByteArrayOutputStream log = new ByteArrayOutputStream();
        try (PrintStream stream = new PrintStream(log, true, "UTF-8")) {
            PendingDeletes deletes = new PendingDeletes(info, new PrintStreamInfoStream(stream));
            deletes.delete(0);
            deletes.writeLiveDocs(directory);

            deletes.delete(1);
            codec.liveDocsFormat().failNextWrite();
            assertThrows(IOException.class, () -> deletes.writeLiveDocs(directory));

            assertThat(info.getDelGen(), is(1L));
            assertThat(info.getNextDelGen(), is(3L));
            assertThat(info.getDelCount(), is(1));
            assertThat(deletes.numPendingDeletes(), is(1));
            assertThat(directory.listAll(), is(arrayContainingInAnyOrder("_0_1.liv")));

            assertThat(deletes.writeLiveDocs(directory), is(true));
        }

        assertThat(info.getDelGen(), is(3L));
        assertThat(info.getNextDelGen(), is(4L));
        assertThat(info.getDelCount(), is(2));
        assertThat(directory.listAll(), is(arrayContainingInAnyOrder("_0_1.liv", "_0_3.liv")));
        String messages = new String(log.toByteArray(), StandardCharsets.UTF_8);
        assertThat(messages, containsString("failed to write live docs gen 2 for _0; next attempt uses gen 3"));
        assertThat(messages, containsString("at gen 3"));
    }

    @Test
    public void testGetMutableBits_ReadsExistingLiveDocs() throws IOException {
        SegmentCommitInfo info = new SegmentCommitInfo(segmentInfo, 0, -1);
        PendingDeletes first = new PendingDeletes(info, InfoStream.NO_OUTPUT);
        first.delete(2);
        first.writeLiveDocs(directory);

        PendingDeletes second = new PendingDeletes(info, InfoStream.NO_OUTPUT);
        assertThat(second.delete(2), is(false));
        assertThat(second.delete(5), is(true));
        assertThat(second.getDelCount(), is(2));
        assertThat(second.getLiveDocs().get(2), is(false));
    }

    @Test
    public void testIsFullyDeleted() throws IOException {
        PendingDeletes deletes = new PendingDeletes(new SegmentCommitInfo(segmentInfo, 4, -1), InfoStream.NO_OUTPUT);
        assertThat(deletes.isFullyDeleted(), is(false));
        deletes.delete(0);
        deletes.delete(1);
        assertThat(deletes.isFullyDeleted(), is(true));
    }
}
