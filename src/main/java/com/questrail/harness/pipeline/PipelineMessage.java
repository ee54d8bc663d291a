package com.questrail.harness.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Messages a {@link Pipeline} posts to its listeners.
 *
 * <p>{@code source} names the pipeline element that posted the message; a
 * message whose source is the pipeline's own name concerns the pipeline as a
 * whole.</p>
 */
public sealed interface PipelineMessage
{
    String source();

    record Error(String source, int code, String domain, String text, String debug) implements PipelineMessage
    {
        public Error {
            Objects.requireNonNull(source, "source");
        }
    }

    record Tag(String source, Map<String, Object> tags) implements PipelineMessage
    {
        public Tag {
            Objects.requireNonNull(source, "source");
            tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        }
    }

    record EndOfStream(String source) implements PipelineMessage
    {
        public EndOfStream {
            Objects.requireNonNull(source, "source");
        }
    }

    record StateChanged(String source, PipelineState old, PipelineState current, PipelineState pending)
            implements PipelineMessage
    {
        public StateChanged {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(old, "old");
            Objects.requireNonNull(current, "current");
            Objects.requireNonNull(pending, "pending");
        }
    }

    /**
     * Anything the monitor has no built-in handling for.
     */
    record Other(String source, String type) implements PipelineMessage
    {
        public Other {
            Objects.requireNonNull(source, "source");
        }
    }
}
