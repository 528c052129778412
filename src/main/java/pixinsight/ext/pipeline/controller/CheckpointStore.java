package pixinsight.ext.pipeline.controller;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.Step;
import pixinsight.ext.pipeline.model.ImageInfo;
import pixinsight.ext.pipeline.model.LiveImageRegistry;
import pixinsight.ext.pipeline.service.ImageEngine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Durable snapshots of the live-branch set, keyed by the step they precede.
 *
 * <h3>Layout</h3>
 * <p>A checkpoint for step X lives in one flat directory:</p>
 * <ul>
 *   <li>{@code <X>__<branch>.xisf}, one image per live branch</li>
 *   <li>{@code <X>.checkpoint.json}, the manifest recording each branch's file and the
 *       engine handle it had when it was saved</li>
 * </ul>
 * <p>Step and branch ids are reduced to {@code [A-Za-z0-9_.-]} for file names.</p>
 *
 * <h3>Saving</h3>
 * <p>Images are first written under {@code .partial.xisf} names. Only when every branch has
 * been saved is the old manifest removed, the images moved over the previous ones and the
 * new manifest written (temp file + move). A save that fails part way deletes its partial
 * files and leaves an earlier checkpoint for the same step as it was.</p>
 *
 * <h3>Restoring</h3>
 * <p>Every file the manifest names is checked before anything is closed, so a damaged
 * checkpoint leaves the session untouched. Then the registry's images and any open image
 * holding a recorded handle are closed, the files reopened and each image given back the
 * handle it had when it was saved.</p>
 *
 * <h3>Policy</h3>
 * <p>Checkpoints are taken before the steps of a default "heavy" set unless a step
 * disables it, and before any step that asks for one with {@code checkpoint: true}.</p>
 *
 * <p>Typical use from the run loop:</p>
 * <pre>{@code
 * if (store.shouldCheckpoint(step)) {
 *     store.save(step.getId(), registry);
 * }
 * ...
 * store.restore(restartFrom, registry);
 * }</pre>
 */
public class CheckpointStore {
    private static final Logger logger = LoggerFactory.getLogger(CheckpointStore.class);

    static final String MANIFEST_SUFFIX = ".checkpoint.json";
    static final String IMAGE_EXTENSION = ".xisf";
    static final String PARTIAL_SUFFIX = ".partial";

    private final Path directory;
    private final ImageEngine engine;
    private final Set<String> defaultSteps;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public CheckpointStore(Path directory, ImageEngine engine, Set<String> defaultSteps) {
        this.directory = directory;
        this.engine = engine;
        this.defaultSteps = Set.copyOf(defaultSteps);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Explicit flag wins; otherwise membership of the step id in the default set.
     */
    public boolean shouldCheckpoint(Step step) {
        if (step.getCheckpoint() != null) {
            return step.getCheckpoint();
        }
        return defaultSteps.contains(step.getId());
    }

    /**
     * Persists every live branch and writes the manifest.
     *
     * @throws IOException if any branch cannot be saved; an earlier checkpoint for the same
     *                     step is then left intact
     */
    public CheckpointManifest save(String stepId, LiveImageRegistry registry) throws IOException {
        Files.createDirectories(directory);
        Map<String, CheckpointManifest.Entry> images = new LinkedHashMap<>();
        List<Path> staged = new ArrayList<>();

        try {
            for (Map.Entry<String, String> live : registry.snapshot().entrySet()) {
                String branchId = live.getKey();
                String handle = live.getValue();
                String filename = imageFilename(stepId, branchId);
                Path partial = directory.resolve(partialFilename(filename));
                staged.add(partial);
                String after = engine.saveImage(handle, partial);
                if (!handle.equals(after)) {
                    logger.debug("Engine renamed {} to {} while saving; renaming back", handle, after);
                    String restored = engine.renameImage(after, handle);
                    if (!handle.equals(restored)) {
                        registry.replace(branchId, restored);
                        handle = restored;
                    }
                }
                images.put(branchId, new CheckpointManifest.Entry(handle, filename));
            }
        } catch (IOException | RuntimeException e) {
            discard(staged);
            throw e;
        }

        Path target = manifestPath(stepId);
        Files.deleteIfExists(target);
        for (CheckpointManifest.Entry entry : images.values()) {
            Files.move(directory.resolve(partialFilename(entry.getFilename())),
                    directory.resolve(entry.getFilename()), StandardCopyOption.REPLACE_EXISTING);
        }

        CheckpointManifest manifest = new CheckpointManifest(stepId, Instant.now().toString(), images);
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(temp, gson.toJson(manifest), StandardCharsets.UTF_8);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Checkpoint saved before '{}': {} branch(es) {}", stepId, images.size(), images.keySet());
        return manifest;
    }

    /**
     * Rebuilds the registry from the checkpoint taken before {@code stepId}.
     *
     * @throws NoSuchCheckpointException if there is no manifest for the step or one of its
     *                                   images is missing; the registry is not touched
     */
    public CheckpointManifest restore(String stepId, LiveImageRegistry registry) throws IOException {
        CheckpointManifest manifest = read(stepId);
        for (CheckpointManifest.Entry entry : manifest.getImages().values()) {
            Path file = directory.resolve(entry.getFilename());
            if (!Files.exists(file)) {
                throw new NoSuchCheckpointException(stepId, file.toString());
            }
        }

        for (String handle : registry.handles()) {
            closeQuietly(handle);
        }
        registry.clear();

        Set<String> recorded = new HashSet<>();
        manifest.getImages().values().forEach(e -> recorded.add(e.getHandleId()));
        for (ImageInfo open : engine.listImages()) {
            if (recorded.contains(open.id())) {
                logger.debug("Closing stale {} before restore", open.id());
                closeQuietly(open.id());
            }
        }

        Map<String, String> mapping = new LinkedHashMap<>();
        for (Map.Entry<String, CheckpointManifest.Entry> entry : manifest.getImages().entrySet()) {
            Path file = directory.resolve(entry.getValue().getFilename());
            List<ImageInfo> opened = engine.openImage(file);
            if (opened.isEmpty()) {
                throw new IOException("Engine opened nothing for " + file);
            }
            for (ImageInfo extra : opened.subList(1, opened.size())) {
                closeQuietly(extra.id());
            }
            String handle = opened.get(0).id();
            String wanted = entry.getValue().getHandleId();
            if (!handle.equals(wanted)) {
                handle = engine.renameImage(handle, wanted);
            }
            mapping.put(entry.getKey(), handle);
        }
        registry.resetTo(mapping);
        logger.info("Restored checkpoint '{}' from {}: {}", stepId, manifest.getTimestamp(), mapping);
        return manifest;
    }

    private void discard(List<Path> staged) {
        for (Path partial : staged) {
            try {
                Files.deleteIfExists(partial);
            } catch (IOException e) {
                logger.warn("Could not delete partial checkpoint image {}: {}", partial.getFileName(), e.getMessage());
            }
        }
    }

    private void closeQuietly(String handle) {
        try {
            engine.closeImage(handle);
        } catch (IOException e) {
            logger.warn("Could not close {}: {}", handle, e.getMessage());
        }
    }

    public boolean exists(String stepId) {
        return Files.exists(manifestPath(stepId));
    }

    /**
     * @throws NoSuchCheckpointException if absent
     */
    public CheckpointManifest read(String stepId) throws IOException {
        Path path = manifestPath(stepId);
        if (!Files.exists(path)) {
            throw new NoSuchCheckpointException(stepId, directory.toString());
        }
        try {
            CheckpointManifest manifest = gson.fromJson(Files.readString(path, StandardCharsets.UTF_8),
                    CheckpointManifest.class);
            if (manifest == null) {
                throw new IOException("Empty checkpoint manifest " + path);
            }
            return manifest;
        } catch (JsonParseException e) {
            throw new IOException("Malformed checkpoint manifest " + path, e);
        }
    }

    /**
     * All readable manifests, keyed by step id. Malformed manifests are skipped.
     */
    public Map<String, CheckpointManifest> list() throws IOException {
        Map<String, CheckpointManifest> manifests = new TreeMap<>();
        if (!Files.isDirectory(directory)) {
            return manifests;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + MANIFEST_SUFFIX)) {
            for (Path file : files) {
                try {
                    CheckpointManifest manifest = gson.fromJson(
                            Files.readString(file, StandardCharsets.UTF_8), CheckpointManifest.class);
                    if (manifest != null && manifest.getStepId() != null) {
                        manifests.put(manifest.getStepId(), manifest);
                    }
                } catch (JsonParseException e) {
                    logger.warn("Skipping malformed manifest {}", file.getFileName());
                }
            }
        }
        return manifests;
    }

    /**
     * Deletes every manifest and checkpoint image.
     *
     * @return number of files removed
     */
    public int clear() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(MANIFEST_SUFFIX) || name.endsWith(IMAGE_EXTENSION)) {
                    Files.delete(file);
                    removed++;
                }
            }
        }
        logger.info("Cleared {} checkpoint file(s) from {}", removed, directory);
        return removed;
    }

    Path manifestPath(String stepId) {
        return directory.resolve(safe(stepId) + MANIFEST_SUFFIX);
    }

    static String imageFilename(String stepId, String branchId) {
        return safe(stepId) + "__" + safe(branchId) + IMAGE_EXTENSION;
    }

    static String partialFilename(String imageFilename) {
        return imageFilename.substring(0, imageFilename.length() - IMAGE_EXTENSION.length())
                + PARTIAL_SUFFIX + IMAGE_EXTENSION;
    }

    private static String safe(String id) {
        return id.replaceAll("[^A-Za-z0-9_.-]", "_");
    }
}
