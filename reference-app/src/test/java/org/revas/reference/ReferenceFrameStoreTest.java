package org.revas.reference;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.revas.reference.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link ReferenceFrameStore} class.
 */
public class ReferenceFrameStoreTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        final SimpleDateFormat TIMESTAMP = new SimpleDateFormat("yyyyMMddHHmmssSSS");
        testDirectory = new File("test_store_" + TIMESTAMP.format(new Date())).getCanonicalFile();
    }

    @After
    public void tearDown() {
        if (testDirectory.exists()) {
            FileUtil.deleteRecursive(testDirectory);
        }
    }

    @Test
    public void testForVideo() {
        final ReferenceFrameStore store = ReferenceFrameStore.forVideo("/data/session_1.avi", testDirectory);
        Assert.assertEquals("invalid record file",
                            new File(testDirectory, "session_1_reference.json"), store.getRecordFile());
        Assert.assertEquals("invalid stabilized video file",
                            new File(testDirectory, "session_1_stabilized.avi"), store.getStabilizedVideoFile());

        final ReferenceFrameStore besideVideo = ReferenceFrameStore.forVideo("/data/session_2.avi", null);
        Assert.assertEquals("store should default to the video directory",
                            new File("/data/session_2_reference.tif"), besideVideo.getReferenceFile());
    }

    @Test
    public void testSaveAndLoad() throws Exception {

        final ReferenceFrameParameters parameters = new ReferenceFrameParameters();
        parameters.newStripHeight = 3;
        parameters.badFrames.add(5);

        final ByteProcessor reference = new ByteProcessor(7, 5);
        final FloatProcessor referenceFloat = new FloatProcessor(7, 5);
        for (int i = 0; i < reference.getPixelCount(); i++) {
            reference.set(i, i * 3);
            referenceFloat.setf(i, i * 3.25f);
        }
        referenceFloat.setf(0, Float.NaN);

        final ReferenceFrameStore store = new ReferenceFrameStore(testDirectory, "session_1");
        Assert.assertFalse("store should not exist before save", store.exists());

        final ReferenceFrame saved = store.save(new ReferenceFrame(reference, referenceFloat, parameters,
                                                                   null, 20, 18));

        Assert.assertTrue("store should exist after save", store.exists());
        Assert.assertEquals("saved frame should have artifact path",
                            store.getRecordFile().getAbsolutePath(), saved.getArtifactPath());

        final String json = new String(Files.readAllBytes(store.getRecordFile().toPath()), StandardCharsets.UTF_8);
        Assert.assertTrue("record should reference the image, json is " + json,
                          json.contains("session_1_reference.tif"));

        final ReferenceFrame loaded = store.load();

        Assert.assertEquals("invalid loaded width", 7, loaded.getWidth());
        Assert.assertEquals("invalid loaded height", 5, loaded.getHeight());
        Assert.assertEquals("invalid usable strip count", 20, loaded.getUsableStripCount());
        Assert.assertEquals("invalid accumulated strip count", 18, loaded.getAccumulatedStripCount());
        Assert.assertEquals("invalid loaded strip height", Integer.valueOf(3), loaded.getParameters().newStripHeight);
        Assert.assertTrue("loaded bad frames should contain 5", loaded.getParameters().badFrames.contains(5));
        Assert.assertArrayEquals("invalid loaded reference pixels",
                                 (byte[]) reference.getPixels(), (byte[]) loaded.getReference().getPixels());
        Assert.assertEquals("invalid loaded float pixel", 6.5f, loaded.getReferenceFloat().getf(2), 0f);
        Assert.assertTrue("NaN float pixel should survive", Float.isNaN(loaded.getReferenceFloat().getf(0)));

        store.deleteReferenceArtifacts();
        Assert.assertFalse("record should be deleted", store.exists());
        Assert.assertFalse("reference image should be deleted", store.getReferenceFile().exists());
    }

    @Test
    public void testLoadWithMissingImage() throws Exception {

        final ReferenceFrameStore store = new ReferenceFrameStore(testDirectory, "session_3");
        store.save(new ReferenceFrame(new ByteProcessor(4, 4), new FloatProcessor(4, 4),
                                      new ReferenceFrameParameters(), null, 1, 1));

        Assert.assertTrue("reference should be deleted for test", store.getReferenceFloatFile().delete());

        try {
            store.load();
            Assert.fail("load with missing image should fail");
        } catch (final IOException e) {
            Assert.assertTrue("message should name the missing file, message is " + e.getMessage(),
                              e.getMessage().contains("session_3_reference_float.tif"));
        }
    }

}
