package org.trypticon.segmentcore.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.ByteBlockPool;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.Counter;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link BytesRefHash}.
 */
public class BytesRefHashTest {
    private Counter bytesUsed;
    private ByteBlockPool pool;
    private SimpleStartArray startArray;
    private BytesRefHash<SimpleStartArray> hash;

    @Before
    public void setUp() {
        bytesUsed = Counter.newCounter();
        pool = new ByteBlockPool(new ByteBlockPool.DirectTrackingAllocator(bytesUsed));
        startArray = new SimpleStartArray(bytesUsed);
        hash = new BytesRefHash<>(pool, 16, startArray);
    }

    @Test
    public void testAdd_AssignsDenseOrdinals() {
        assertThat(hash.add(new BytesRef("apple")), is(0));
        assertThat(hash.add(new BytesRef("banana")), is(1));
        assertThat(hash.add(new BytesRef("cherry")), is(2));
        assertThat(hash.size(), is(3));
    }

    @Test
    public void testAdd_Duplicate() {
        hash.add(new BytesRef("apple"));
        hash.add(new BytesRef("banana"));
        assertThat(hash.add(new BytesRef("banana")), is(-2));
        assertThat(hash.size(), is(2));
    }

    @Test
    public void testFind() {
        hash.add(new BytesRef("apple"));
        hash.add(new BytesRef("banana"));
        assertThat(hash.find(new BytesRef("banana")), is(1));
        assertThat(hash.find(new BytesRef("durian")), is(-1));
    }

    @Test
    public void testGet_ReturnsStoredBytes() {
        int ord = hash.add(new BytesRef("apple"));
        BytesRef scratch = new BytesRef();
        assertThat(hash.get(ord, scratch).utf8ToString(), is("apple"));
    }

    @Test
    public void testAdd_ManyTermsRehashesAndGrows() {
        Set<String> terms = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            String term = "term" + i;
            terms.add(term);
            assertThat(hash.add(new BytesRef(term)), is(i));
        }
        assertThat(hash.size(), is(1000));
        assertThat(hash.capacity() > 1000, is(true));

        BytesRef scratch = new BytesRef();
        for (int i = 0; i < 1000; i++) {
            assertThat(hash.get(i, scratch).utf8ToString(), is("term" + i));
            assertThat(hash.find(new BytesRef("term" + i)), is(i));
        }
    }

    @Test
    public void testAdd_LongTermUsesTwoByteLength() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            sb.append((char) ('a' + i % 26));
        }
        int ord = hash.add(new BytesRef(sb.toString()));
        assertThat(hash.get(ord, new BytesRef()).utf8ToString(), is(sb.toString()));
    }

    @Test
    public void testAdd_TermLongerThanBlock() {
        BytesRef huge = new BytesRef(new byte[ByteBlockPool.BYTE_BLOCK_SIZE]);
        assertThrows(BytesRefHash.MaxBytesLengthExceededException.class, () -> hash.add(huge));
        assertThat(hash.size(), is(0));
    }

    @Test
    public void testSort_UnsignedByteOrder() {
        List<String> input = new ArrayList<>();
        input.add("pear");
        input.add("apple");
        input.add("zucchini");
        input.add("banana");
        input.add("éclair");
        TreeSet<BytesRef> expected = new TreeSet<>();
        for (String term : input) {
            hash.add(new BytesRef(term));
            expected.add(new BytesRef(term));
        }

        int[] sorted = hash.sort();
        List<BytesRef> actual = new ArrayList<>();
        for (int i = 0; i < hash.size(); i++) {
            actual.add(BytesRef.deepCopyOf(hash.get(sorted[i], new BytesRef())));
        }
        assertEquals(new ArrayList<>(expected), actual);
    }

    @Test
    public void testClear_ReleasesStorageAndReinitializesOnAdd() {
        hash.add(new BytesRef("apple"));
        hash.clear(false);
        assertThat(hash.size(), is(0));
        assertThat(startArray.clearCount, is(1));
        assertThat(hash.find(new BytesRef("apple")), is(-1));

        assertThat(hash.add(new BytesRef("banana")), is(0));
        assertThat(startArray.initCount, is(2));
    }

    @Test
    public void testClear_ShrinksTowardLastCount() {
        for (int i = 0; i < 1000; i++) {
            hash.add(new BytesRef("term" + i));
        }
        int bigCapacity = hash.capacity();
        hash.clear(true);
        hash.add(new BytesRef("one"));
        hash.clear(true);
        assertThat(hash.capacity(), lessThan(bigCapacity));
    }

    @Test
    public void testAddByPoolOffset_SharesTermBytes() {
        SimpleStartArray otherArray = new SimpleStartArray(bytesUsed);
        BytesRefHash<SimpleStartArray> other = new BytesRefHash<>(pool, 4, otherArray);

        int apple = hash.add(new BytesRef("apple"));
        int banana = hash.add(new BytesRef("banana"));

        assertThat(other.addByPoolOffset(hash.byteStart(banana)), is(0));
        assertThat(other.addByPoolOffset(hash.byteStart(apple)), is(1));
        assertThat(other.addByPoolOffset(hash.byteStart(banana)), is(-1));
        assertThat(other.get(1, new BytesRef()).utf8ToString(), is("apple"));
    }

    @Test
    public void testConstructor_CapacityMustBePowerOfTwo() {
        assertThrows(IllegalArgumentException.class,
                     () -> new BytesRefHash<>(pool, 10, new SimpleStartArray(bytesUsed)));
    }

    private static class SimpleStartArray implements BytesRefHash.BytesStartArray {
        private final Counter bytesUsed;
        private int[] bytesStart;
        int initCount;
        int clearCount;

        SimpleStartArray(Counter bytesUsed) {
            this.bytesUsed = bytesUsed;
        }

        @Override
        public int[] init(int capacity) {
            if (bytesStart == null) {
                initCount++;
                bytesStart = new int[ArrayUtil.oversize(capacity, Integer.BYTES)];
            }
            return bytesStart;
        }

        @Override
        public int[] grow() {
            return bytesStart = ArrayUtil.grow(bytesStart, bytesStart.length + 1);
        }

        @Override
        public int[] clear() {
            clearCount++;
            return bytesStart = null;
        }

        @Override
        public Counter bytesUsed() {
            return bytesUsed;
        }
    }
}
