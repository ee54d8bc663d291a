package com.questrail.harness.pipeline;

import com.questrail.harness.api.Subscription;
import com.questrail.harness.capability.CapabilityDescriptor;
import com.questrail.harness.capability.CapabilityLayer;
import com.questrail.harness.observability.FailureKind;
import com.questrail.harness.remote.RemoteTest;
import com.questrail.harness.remote.WorkerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PipelineMonitor
 * =============================================================================
 * Worker-side test that drives a {@link Pipeline} to its initial state and
 * judges it by the messages it posts.
 *
 * <h2>Checkitems</h2>
 * <ul>
 *   <li>{@code valid-pipeline}: {@link #createPipeline()} returned a pipeline</li>
 *   <li>{@code reached-initial-state}: the pipeline settled in
 *       {@link #initialState()} and {@link #pipelineReachedInitialState()}
 *       asked to stop</li>
 *   <li>{@code no-errors-seen}: no error message was posted</li>
 * </ul>
 *
 * <h2>Extra-infos</h2>
 * {@code errors}: list of {@code [code, domain, message, debug]};
 * {@code tags}: merged tag map. Both are reported during teardown.
 *
 * <h2>Threading model</h2>
 * Pipeline listeners may fire on any thread; every message is hopped onto the
 * test's event loop.
 */
public abstract class PipelineMonitor extends RemoteTest
{
    private static final Logger log = LoggerFactory.getLogger(PipelineMonitor.class);

    public static final String VALID_PIPELINE = "valid-pipeline";
    public static final String REACHED_INITIAL_STATE = "reached-initial-state";
    public static final String NO_ERRORS_SEEN = "no-errors-seen";

    public static final String ERRORS = "errors";
    public static final String TAGS = "tags";

    public static final CapabilityLayer PIPELINE_LAYER = CapabilityLayer.builder("pipeline-monitor")
            .description("Tests that run a processing pipeline")
            .includes(RemoteTest.REMOTE_LAYER)
            .checkItem(VALID_PIPELINE, "The test pipeline was properly created")
            .checkItem(REACHED_INITIAL_STATE, "The pipeline reached the initial state")
            .checkItem(NO_ERRORS_SEEN, "No errors were emitted from the pipeline")
            .extraInfo(ERRORS, "List of errors emitted by the pipeline")
            .extraInfo(TAGS, "List of tags emitted by the pipeline")
            .build();

    private final List<PipelineErrorRecord> errors = new ArrayList<>();
    private final Map<String, Object> tags = new LinkedHashMap<>();

    private Pipeline pipeline;
    private Subscription messages;

    protected PipelineMonitor(WorkerSession session, CapabilityDescriptor descriptor, Map<String, ?> arguments)
    {
        super(session, descriptor, arguments);
    }

    // ---------------------------------------------------------------------
    // Hooks
    // ---------------------------------------------------------------------

    /**
     * State the pipeline is driven to when the test starts.
     */
    protected PipelineState initialState()
    {
        return PipelineState.PLAYING;
    }

    /**
     * Builds the pipeline under test.
     *
     * @return the pipeline, or {@code null} if it could not be created
     */
    protected Pipeline createPipeline()
    {
        String description = pipelineDescription();
        log.debug("Test {}: parsing pipeline '{}'", uuid(), description);
        try {
            return pipelineParser().parse(description);
        } catch (PipelineParseException e) {
            log.warn("Test {}: could not create pipeline '{}'", uuid(), description, e);
            return null;
        }
    }

    /**
     * Declarative description used by the default {@link #createPipeline()}.
     */
    protected String pipelineDescription()
    {
        throw new UnsupportedOperationException(getClass().getName() + " does not describe its pipeline");
    }

    protected PipelineParser pipelineParser()
    {
        throw new UnsupportedOperationException(getClass().getName() + " has no pipeline parser");
    }

    /**
     * Called once the pipeline settled in its initial state.
     *
     * @return {@code true} to stop the test (the default), {@code false} to
     *         keep it running
     */
    protected boolean pipelineReachedInitialState()
    {
        return true;
    }

    /**
     * Sees every message first.
     *
     * @return {@code false} to skip the built-in handling
     */
    protected boolean handleMessage(PipelineMessage message)
    {
        return true;
    }

    protected final Pipeline pipeline()
    {
        return pipeline;
    }

    public final List<PipelineErrorRecord> errors()
    {
        return Collections.unmodifiableList(errors);
    }

    // ---------------------------------------------------------------------
    // Remote lifecycle
    // ---------------------------------------------------------------------

    @Override
    protected void remoteSetUp()
    {
        pipeline = createPipeline();
        if (pipeline == null) {
            reportFailure(FailureKind.PIPELINE_CREATION_FAILURE, "no pipeline created", null);
            stop();
            return;
        }
        validateStep(VALID_PIPELINE);

        messages = pipeline.addMessageListener(message -> loop().execute(() -> onMessage(message)));
        remoteReady();
    }

    @Override
    protected void remoteTest()
    {
        log.debug("Test {}: setting pipeline to {}", uuid(), initialState());
        pipeline.setState(initialState());
    }

    @Override
    protected void remoteTearDown()
    {
        if (pipeline != null) {
            pipeline.setState(PipelineState.NULL);
        }
        if (messages != null) {
            messages.close();
            messages = null;
        }

        if (errors.isEmpty()) {
            validateStep(NO_ERRORS_SEEN);
        }
        else {
            List<Object> reported = new ArrayList<>(errors.size());
            for (PipelineErrorRecord e : errors) {
                reported.add(e.toList());
            }
            extraInfo(ERRORS, reported);
        }
        if (!tags.isEmpty()) {
            extraInfo(TAGS, new LinkedHashMap<>(tags));
        }
    }

    // ---------------------------------------------------------------------
    // Message dispatch
    // ---------------------------------------------------------------------

    private void onMessage(PipelineMessage message)
    {
        log.debug("Test {}: message from {}: {}", uuid(), message.source(), message);
        if (!handleMessage(message)) {
            return;
        }

        if (message instanceof PipelineMessage.Error error) {
            errors.add(PipelineErrorRecord.of(error));
            if (!isStopping()) {
                reportFailure(FailureKind.PIPELINE_RUNTIME_ERROR,
                        error.source() + ": " + error.text(), null);
                stop();
            }
        }
        else if (message instanceof PipelineMessage.Tag tag) {
            mergeTags(tag.tags());
        }
        else if (isStopping() || pipeline == null || !pipeline.name().equals(message.source())) {
            return;
        }
        else if (message instanceof PipelineMessage.EndOfStream) {
            stop();
        }
        else if (message instanceof PipelineMessage.StateChanged changed) {
            if (changed.current() == initialState()
                    && changed.pending() == PipelineState.VOID_PENDING
                    && pipelineReachedInitialState()) {
                log.debug("Test {}: pipeline reached {}, stopping", uuid(), changed.current());
                validateStep(REACHED_INITIAL_STATE);
                stop();
            }
        }
    }

    private void mergeTags(Map<String, Object> incoming)
    {
        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                tags.put(entry.getKey(), value);
            }
            else {
                tags.put(entry.getKey(), String.valueOf(value));
            }
        }
    }
}
