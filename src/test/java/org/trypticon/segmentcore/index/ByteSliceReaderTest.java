package org.trypticon.segmentcore.index;

import java.io.IOException;

import org.apache.lucene.util.ByteBlockPool;
import org.apache.lucene.util.Counter;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link ByteSliceReader} reading streams laid out by {@link ByteSlices}.
 */
public class ByteSliceReaderTest {
    private ByteBlockPool pool;

    @Before
    public void setUp() {
        pool = new ByteBlockPool(new ByteBlockPool.DirectTrackingAllocator(Counter.newCounter()));
        pool.nextBuffer();
    }

    /** Writes a stream the way the term builders do; returns {start, end}. */
    private int[] writeStream(int length, int seed) {
        int start = ByteSlices.newSlice(pool, ByteSlices.FIRST_LEVEL_SIZE) + pool.byteOffset;
        int upto = start;
        for (int i = 0; i < length; i++) {
            byte[] bytes = pool.buffers[upto >> ByteBlockPool.BYTE_BLOCK_SHIFT];
            int offset = upto & ByteBlockPool.BYTE_BLOCK_MASK;
            if (bytes[offset] != 0) {
                offset = ByteSlices.allocSlice(pool, bytes, offset);
                bytes = pool.buffer;
                upto = offset + pool.byteOffset;
            }
            bytes[offset] = (byte) (seed + i);
            upto++;
        }
        return new int[] {start, upto};
    }

    @Test
    public void testReadWithinFirstSlice() throws IOException {
        int[] range = writeStream(3, 7);
        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, range[0], range[1]);

        assertThat(reader.readByte(), is((byte) 7));
        assertThat(reader.readByte(), is((byte) 8));
        assertThat(reader.readByte(), is((byte) 9));
        assertThat(reader.eof(), is(true));
    }

    @Test
    public void testReadAcrossSlices() throws IOException {
        int[] range = writeStream(1000, 1);
        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, range[0], range[1]);

        for (int i = 0; i < 1000; i++) {
            assertThat(reader.eof(), is(false));
            assertThat(reader.readByte(), is((byte) (1 + i)));
        }
        assertThat(reader.eof(), is(true));
    }

    @Test
    public void testConsecutiveStreams() throws IOException {
        int[] first = writeStream(40, 0);
        int[] second = writeStream(300, 100);

        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, first[0], first[1]);
        byte[] bytes = new byte[40];
        reader.readBytes(bytes, 0, 40);
        assertThat(bytes[39], is((byte) 39));
        assertThat(reader.eof(), is(true));

        reader.init(pool, second[0], second[1]);
        reader.skipBytes(250);
        assertThat(reader.readByte(), is((byte) (100 + 250)));
    }

    @Test
    public void testEmptyStream() {
        int[] range = writeStream(0, 0);
        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, range[0], range[1]);
        assertThat(reader.eof(), is(true));
    }
}
