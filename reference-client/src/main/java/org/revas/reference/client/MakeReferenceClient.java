package org.revas.reference.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.revas.reference.CancellationToken;
import org.revas.reference.ReferenceFrame;
import org.revas.reference.ReferenceFrameBuilder;
import org.revas.reference.ReferenceFrameParameters;
import org.revas.reference.ReferenceFrameStore;
import org.revas.reference.client.parameter.CommandLineParameters;
import org.revas.reference.json.JsonUtils;
import org.revas.reference.motion.MotionTrace;
import org.revas.reference.util.FileUtil;
import org.revas.reference.video.AviFrameSource;
import org.revas.reference.video.AviStabilizedVideoWriter;
import org.revas.reference.video.FrameSource;
import org.revas.reference.video.StabilizedFrameSinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for building the reference frame of a strip-registered retinal video.
 */
public class MakeReferenceClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--video",
                description = "Path of the (uncompressed AVI) video to build a reference frame for",
                required = true)
        public String video;

        @Parameter(
                names = "--motionTrace",
                description = "Path of the JSON strip motion trace estimated for the video",
                required = true)
        public String motionTrace;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for reference frame artifacts (omit to use the video's directory)")
        public String outputDirectory;

        @Parameter(
                names = "--parametersJson",
                description = "JSON file with reference frame parameters (replaces all reference frame options " +
                              "specified on the command line)")
        public String parametersJson;

        @ParametersDelegate
        public ReferenceFrameParameters reference = new ReferenceFrameParameters();

        public File getOutputDirectory() {
            return outputDirectory == null ? null : new File(outputDirectory).getAbsoluteFile();
        }

        /**
         * @return parameters loaded from {@link #parametersJson} if specified, otherwise the command line parameters.
         */
        public ReferenceFrameParameters getReferenceParameters()
                throws IOException {
            if (parametersJson == null) {
                return reference;
            }
            try (final Reader reader = FileUtil.getReader(parametersJson)) {
                return PARAMETERS_HELPER.fromJson(reader);
            } catch (final IllegalArgumentException e) {
                throw new IOException("failed to parse " + parametersJson, e);
            }
        }
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final MakeReferenceClient client = new MakeReferenceClient(parameters);
                final ShutdownCancellation shutdownCancellation =
                        new ShutdownCancellation(new CancellationToken(), SHUTDOWN_WAIT_MILLIS);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownCancellation, "reference-shutdown"));

                try {
                    client.makeReference(shutdownCancellation.getCancellationToken());
                } finally {
                    shutdownCancellation.clientFinished();
                }
            }
        };
        clientRunner.run();
    }

    /**
     * Shutdown hook task that cancels a running build and then waits (for a bounded time) until the client
     * has stopped, so that partial artifacts are removed before the JVM halts.
     * Returns immediately when the client has already finished.
     */
    public static class ShutdownCancellation
            implements Runnable {

        private final CancellationToken cancellationToken;
        private final long maxWaitMillis;
        private final CountDownLatch clientFinishedLatch;

        public ShutdownCancellation(final CancellationToken cancellationToken,
                                    final long maxWaitMillis) {
            this.cancellationToken = cancellationToken;
            this.maxWaitMillis = maxWaitMillis;
            this.clientFinishedLatch = new CountDownLatch(1);
        }

        public CancellationToken getCancellationToken() {
            return cancellationToken;
        }

        public void clientFinished() {
            clientFinishedLatch.countDown();
        }

        @Override
        public void run() {

            if (clientFinishedLatch.getCount() == 0) {
                return;
            }

            LOG.info("run: shutdown requested, cancelling reference frame build");
            cancellationToken.cancel();

            try {
                if (! clientFinishedLatch.await(maxWaitMillis, TimeUnit.MILLISECONDS)) {
                    LOG.warn("run: build did not stop within {}ms, partial artifacts may remain", maxWaitMillis);
                }
            } catch (final InterruptedException e) {
                LOG.warn("run: interrupted while waiting for build to stop", e);
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final long SHUTDOWN_WAIT_MILLIS = 60_000;

    private static final JsonUtils.Helper<ReferenceFrameParameters> PARAMETERS_HELPER =
            new JsonUtils.Helper<>(ReferenceFrameParameters.class);

    private final Parameters parameters;
    private final ReferenceFrameStore store;

    public MakeReferenceClient(final Parameters parameters) {
        this.parameters = parameters;
        this.store = ReferenceFrameStore.forVideo(parameters.video, parameters.getOutputDirectory());
    }

    public ReferenceFrameStore getStore() {
        return store;
    }

    /**
     * Builds and persists the reference frame for the video,
     * or loads the existing one when it has already been built and overwrite is not requested.
     *
     * Artifacts of a cancelled or failed build are removed before the exception is propagated.
     */
    public ReferenceFrame makeReference(final CancellationToken cancellationToken)
            throws IOException, CancellationException {

        final ReferenceFrameParameters referenceParameters = parameters.getReferenceParameters();

        if (store.exists()) {
            if (! referenceParameters.overwrite) {
                LOG.info("makeReference: {} exists and overwrite is not requested, returning existing reference",
                         store.getRecordFile().getAbsolutePath());
                return store.load();
            }
            LOG.info("makeReference: overwriting {}", store.getRecordFile().getAbsolutePath());
            store.deleteReferenceArtifacts();
        }

        final MotionTrace motionTrace = loadMotionTrace(parameters.motionTrace);

        final ReferenceFrameBuilder builder = new ReferenceFrameBuilder(referenceParameters)
                .withCancellationToken(cancellationToken);

        final File stabilizedVideoFile = store.getStabilizedVideoFile();
        final StabilizedFrameSinkFactory sinkFactory =
                (width, height, frameRate) -> new AviStabilizedVideoWriter(stabilizedVideoFile,
                                                                          width,
                                                                          height,
                                                                          frameRate);

        final ReferenceFrame referenceFrame;
        try (final FrameSource frameSource = new AviFrameSource(parameters.video)) {
            referenceFrame = store.save(builder.build(motionTrace, frameSource, sinkFactory));
        } catch (final CancellationException e) {
            LOG.info("makeReference: build cancelled, removing partial artifacts");
            removeArtifacts();
            throw e;
        } catch (final IOException | RuntimeException e) {
            removeArtifacts();
            throw e;
        }

        return referenceFrame;
    }

    private void removeArtifacts() {
        store.deleteReferenceArtifacts();
        FileUtil.deleteIfExists(store.getStabilizedVideoFile());
    }

    static MotionTrace loadMotionTrace(final String path)
            throws IOException {
        try (final Reader reader = FileUtil.getReader(path)) {
            return MotionTrace.fromJson(reader);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(MakeReferenceClient.class);
}
