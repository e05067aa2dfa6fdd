package org.revas.reference;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

/**
 * A built (or previously persisted) reference frame.
 *
 * The 8-bit reference is the artifact used by downstream registration.
 * The floating point reference keeps the un-quantized accumulator / counter values
 * (NaN where no strip was placed) for precision sensitive consumers.
 */
public class ReferenceFrame {

    private final ByteProcessor reference;
    private final FloatProcessor referenceFloat;
    private final ReferenceFrameParameters parameters;
    private final String artifactPath;
    private final int usableStripCount;
    private final int accumulatedStripCount;

    public ReferenceFrame(final ByteProcessor reference,
                          final FloatProcessor referenceFloat,
                          final ReferenceFrameParameters parameters,
                          final String artifactPath,
                          final int usableStripCount,
                          final int accumulatedStripCount) {
        this.reference = reference;
        this.referenceFloat = referenceFloat;
        this.parameters = parameters;
        this.artifactPath = artifactPath;
        this.usableStripCount = usableStripCount;
        this.accumulatedStripCount = accumulatedStripCount;
    }

    public ByteProcessor getReference() {
        return reference;
    }

    public FloatProcessor getReferenceFloat() {
        return referenceFloat;
    }

    public ReferenceFrameParameters getParameters() {
        return parameters;
    }

    /**
     * @return path of the persisted record for this frame, or null if it has not been persisted.
     */
    public String getArtifactPath() {
        return artifactPath;
    }

    public int getUsableStripCount() {
        return usableStripCount;
    }

    public int getAccumulatedStripCount() {
        return accumulatedStripCount;
    }

    public int getWidth() {
        return reference.getWidth();
    }

    public int getHeight() {
        return reference.getHeight();
    }

    public ReferenceFrame withArtifactPath(final String path) {
        return new ReferenceFrame(reference, referenceFloat, parameters, path,
                                  usableStripCount, accumulatedStripCount);
    }

    @Override
    public String toString() {
        return "{ \"width\": " + getWidth() + ", \"height\": " + getHeight() +
               ", \"usableStripCount\": " + usableStripCount +
               ", \"accumulatedStripCount\": " + accumulatedStripCount +
               ", \"artifactPath\": " + (artifactPath == null ? null : "\"" + artifactPath + "\"") + " }";
    }
}
