package pixinsight.ext.pipeline.controller;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk description of a checkpoint: the live branches immediately before {@code stepId},
 * each with the handle it had and the image file it was saved to.
 */
public class CheckpointManifest {

    /**
     * One saved branch image.
     */
    public static class Entry {
        private String handleId;
        private String filename;

        public Entry() {
        }

        public Entry(String handleId, String filename) {
            this.handleId = handleId;
            this.filename = filename;
        }

        public String getHandleId() {
            return handleId;
        }

        public String getFilename() {
            return filename;
        }
    }

    private String stepId;
    private String timestamp;
    private Map<String, Entry> images;

    public CheckpointManifest() {
    }

    public CheckpointManifest(String stepId, String timestamp, Map<String, Entry> images) {
        this.stepId = stepId;
        this.timestamp = timestamp;
        this.images = new LinkedHashMap<>(images);
    }

    public String getStepId() {
        return stepId;
    }

    public String getTimestamp() {
        return timestamp;
    }

    /** Branch id to saved image, in registry order. */
    public Map<String, Entry> getImages() {
        return images == null ? Map.of() : Collections.unmodifiableMap(images);
    }
}
