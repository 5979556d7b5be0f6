package org.trypticon.segmentcore;

import org.apache.lucene.index.CorruptIndexException;

/**
 * Thrown when a segment refers to a format which is not available on the class path.
 */
public class UnknownFormatException extends CorruptIndexException {
    public UnknownFormatException(String message, String resourceDescription, Throwable cause) {
        super(message, resourceDescription, cause);
    }
}
