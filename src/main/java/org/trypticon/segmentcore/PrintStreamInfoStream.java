package org.trypticon.segmentcore;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Info stream which writes every message to a {@link PrintStream}.
 */
public class PrintStreamInfoStream implements InfoStream {

    @Nonnull
    private final PrintStream stream;

    private final Set<String> components;

    /**
     * Creates an info stream logging every component.
     *
     * @param stream the stream to write to.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this(stream, Collections.emptySet());
    }

    /**
     * Creates an info stream logging only some components.
     *
     * @param stream the stream to write to.
     * @param components the components to log. Empty means all of them.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream, @Nonnull Set<String> components) {
        this.stream = stream;
        this.components = new HashSet<>(components);
    }

    @Override
    public void message(String component, String line) {
        stream.println(component + " " + Instant.now() + "; " + Thread.currentThread().getName() + ": " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return components.isEmpty() || components.contains(component);
    }
}
