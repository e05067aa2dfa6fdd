package org.revas.reference;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;

import org.revas.reference.json.JsonUtils;
import org.revas.reference.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists reference frames as a JSON record (resolved parameters and strip statistics)
 * next to an 8-bit TIFF of the reference and a 32-bit TIFF of the un-quantized reference.
 *
 * For a base name "session_1" in directory "/out" the artifacts are:
 * <pre>
 *   /out/session_1_reference.json
 *   /out/session_1_reference.tif
 *   /out/session_1_reference_float.tif
 *   /out/session_1_stabilized.avi      (only when a stabilized video is requested)
 * </pre>
 * The JSON record is written last, so its presence marks a complete artifact.
 */
public class ReferenceFrameStore {

    private final File recordFile;
    private final File referenceFile;
    private final File referenceFloatFile;
    private final File stabilizedVideoFile;

    public ReferenceFrameStore(final File directory,
                               final String baseName) {
        this.recordFile = new File(directory, baseName + "_reference.json");
        this.referenceFile = new File(directory, baseName + "_reference.tif");
        this.referenceFloatFile = new File(directory, baseName + "_reference_float.tif");
        this.stabilizedVideoFile = new File(directory, baseName + "_stabilized.avi");
    }

    /**
     * @return store for artifacts named after the specified video, in the specified directory
     *         (or the video's own directory when directory is null).
     */
    public static ReferenceFrameStore forVideo(final String videoPath,
                                               final File directory) {
        final File videoFile = new File(videoPath).getAbsoluteFile();
        final File outputDirectory = directory == null ? videoFile.getParentFile() : directory;
        return new ReferenceFrameStore(outputDirectory, FileUtil.getBaseName(videoFile.getName()));
    }

    public File getRecordFile() {
        return recordFile;
    }

    public File getReferenceFile() {
        return referenceFile;
    }

    public File getReferenceFloatFile() {
        return referenceFloatFile;
    }

    public File getStabilizedVideoFile() {
        return stabilizedVideoFile;
    }

    public boolean exists() {
        return recordFile.exists();
    }

    /**
     * Writes all artifacts for the specified reference frame.
     * Partially written artifacts are removed if any write fails.
     *
     * @return the reference frame with its artifact path set.
     */
    public ReferenceFrame save(final ReferenceFrame referenceFrame)
            throws IOException {

        final File directory = recordFile.getAbsoluteFile().getParentFile();
        try {
            FileUtil.ensureWritableDirectory(directory);
        } catch (final IllegalArgumentException e) {
            throw new IOException("cannot write reference frame to " + directory, e);
        }

        final Record record = new Record(referenceFrame, referenceFile.getName(), referenceFloatFile.getName());
        try {
            saveTiff(referenceFrame.getReference(), referenceFile);
            saveTiff(referenceFrame.getReferenceFloat(), referenceFloatFile);
            FileUtil.saveJsonFile(recordFile.getAbsolutePath(), record);
        } catch (final IOException e) {
            deleteReferenceArtifacts();
            throw e;
        }

        LOG.info("save: wrote {}", recordFile.getAbsolutePath());

        return referenceFrame.withArtifactPath(recordFile.getAbsolutePath());
    }

    /**
     * @return previously persisted reference frame.
     *
     * @throws IOException
     *   if any artifact is missing or cannot be parsed.
     */
    public ReferenceFrame load()
            throws IOException {

        final Record record;
        try (final Reader reader = FileUtil.getReader(recordFile.getAbsolutePath())) {
            record = RECORD_HELPER.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse " + recordFile.getAbsolutePath(), e);
        }

        final File directory = recordFile.getAbsoluteFile().getParentFile();
        final ImageProcessor reference = openImage(new File(directory, record.referenceImage));
        final ImageProcessor referenceFloat = openImage(new File(directory, record.referenceFloatImage));

        if (! (reference instanceof ByteProcessor)) {
            throw new IOException(record.referenceImage + " is not an 8-bit image");
        }
        if (! (referenceFloat instanceof FloatProcessor)) {
            throw new IOException(record.referenceFloatImage + " is not a 32-bit image");
        }

        return new ReferenceFrame((ByteProcessor) reference,
                                  (FloatProcessor) referenceFloat,
                                  record.parameters,
                                  recordFile.getAbsolutePath(),
                                  record.usableStripCount,
                                  record.accumulatedStripCount);
    }

    /**
     * Removes the record and both reference images (used to clean up cancelled or failed runs).
     */
    public void deleteReferenceArtifacts() {
        FileUtil.deleteIfExists(recordFile);
        FileUtil.deleteIfExists(referenceFile);
        FileUtil.deleteIfExists(referenceFloatFile);
    }

    private static void saveTiff(final ImageProcessor ip,
                                 final File file)
            throws IOException {
        final ImagePlus imagePlus = new ImagePlus(file.getName(), ip);
        if (! new FileSaver(imagePlus).saveAsTiff(file.getAbsolutePath())) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }
    }

    private static ImageProcessor openImage(final File file)
            throws IOException {
        if (! file.canRead()) {
            throw new IOException("cannot read " + file.getAbsolutePath());
        }
        final ImagePlus imagePlus = new Opener().openImage(file.getAbsolutePath());
        if (imagePlus == null) {
            throw new IOException("failed to open " + file.getAbsolutePath());
        }
        return imagePlus.getProcessor();
    }

    /**
     * JSON form of a persisted reference frame.
     */
    public static class Record
            implements Serializable {

        private ReferenceFrameParameters parameters;
        private int width;
        private int height;
        private int usableStripCount;
        private int accumulatedStripCount;
        private String referenceImage;
        private String referenceFloatImage;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private Record() {
        }

        public Record(final ReferenceFrame referenceFrame,
                      final String referenceImage,
                      final String referenceFloatImage) {
            this.parameters = referenceFrame.getParameters();
            this.width = referenceFrame.getWidth();
            this.height = referenceFrame.getHeight();
            this.usableStripCount = referenceFrame.getUsableStripCount();
            this.accumulatedStripCount = referenceFrame.getAccumulatedStripCount();
            this.referenceImage = referenceImage;
            this.referenceFloatImage = referenceFloatImage;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }
    }

    private static final JsonUtils.Helper<Record> RECORD_HELPER = new JsonUtils.Helper<>(Record.class);

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceFrameStore.class);
}
