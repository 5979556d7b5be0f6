package org.trypticon.segmentcore.index;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertEquals;

/**
 * Tests for {@link IndexFileNames}.
 */
public class IndexFileNamesTest {

    @Test
    public void testFileNameFromGeneration() {
        assertThat(IndexFileNames.fileNameFromGeneration("_0", "liv", -1), is(nullValue()));
        assertEquals("_0.liv", IndexFileNames.fileNameFromGeneration("_0", "liv", 0));
        assertEquals("_0_1.liv", IndexFileNames.fileNameFromGeneration("_0", "liv", 1));
        assertEquals("_0_a.liv", IndexFileNames.fileNameFromGeneration("_0", "liv", 10));
        assertEquals("_0_10.liv", IndexFileNames.fileNameFromGeneration("_0", "liv", 36));
    }

    @Test
    public void testSegmentFileName() {
        assertEquals("_3.tst", IndexFileNames.segmentFileName("_3", "", "tst"));
        assertEquals("_3_Alpha_0.tst", IndexFileNames.segmentFileName("_3", "Alpha_0", "tst"));
        assertEquals("_3_Alpha_0", IndexFileNames.segmentFileName("_3", "Alpha_0", ""));
        assertEquals("_3", IndexFileNames.segmentFileName("_3", "", ""));
    }

    @Test
    public void testGetExtension() {
        assertEquals("liv", IndexFileNames.getExtension("_0_1.liv"));
        assertThat(IndexFileNames.getExtension("segments"), is(nullValue()));
    }

    @Test
    public void testCodecFilePattern() {
        assertThat(IndexFileNames.CODEC_FILE_PATTERN.matcher("_0_Alpha_0.tst").matches(), is(true));
        assertThat(IndexFileNames.CODEC_FILE_PATTERN.matcher("_a1.liv").matches(), is(true));
        assertThat(IndexFileNames.CODEC_FILE_PATTERN.matcher("segments_1").matches(), is(false));
        assertThat(IndexFileNames.CODEC_FILE_PATTERN.matcher("_0").matches(), is(false));
    }
}
