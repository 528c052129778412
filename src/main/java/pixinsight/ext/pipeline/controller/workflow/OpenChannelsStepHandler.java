package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.BranchSpec;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.config.Step;
import pixinsight.ext.pipeline.controller.PipelineSetupException;
import pixinsight.ext.pipeline.model.ImageInfo;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.service.ProcessCall;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Opens the configured channel files and builds the {@code main} working image.
 *
 * <p>Sequence:</p>
 * <ol>
 *   <li>open each channel file, dropping {@code crop_mask} side windows; when a file opens
 *       several windows the channel's view is the one carrying its filter token
 *       ({@code FILTER_R}, {@code FILTER-Ha}, ...)</li>
 *   <li>crop frames larger than the reference frame (R, else L, else the first channel) to
 *       its geometry around the centre</li>
 *   <li>close everything that was open before the step and forget all branches</li>
 *   <li>combine R, G and B into an RGB {@code main}; otherwise use L or the only channel</li>
 *   <li>channels named like a declared branch that forks here become that branch</li>
 *   <li>close the remaining raw channel views</li>
 * </ol>
 *
 * <p>Missing files, views that cannot be identified and unusable geometry stop the run.
 * Until every channel has opened the previous images and branches are left alone; on failure
 * only the windows this step opened are closed.</p>
 */
public class OpenChannelsStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(OpenChannelsStepHandler.class);

    static final String CROP_MASK_TOKEN = "crop_mask";

    @Override
    public ParamSchema schema() {
        return ParamSchema.of(
                ParamSpec.optional("channels", ParamSpec.Type.LIST),
                ParamSpec.optional("crop", ParamSpec.Type.BOOLEAN));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        ImageEngine engine = context.getEngine();
        Step step = context.getStep();
        Map<String, String> files = selectChannels(context);
        if (files.isEmpty()) {
            throw new PipelineSetupException("Step '" + step.getId() + "': no channel files configured");
        }

        List<String> previous = engine.listImages().stream().map(ImageInfo::id).toList();
        Map<String, ImageInfo> channels = new LinkedHashMap<>();
        List<String> mainSources;
        try {
            for (Map.Entry<String, String> entry : files.entrySet()) {
                channels.put(entry.getKey(), openChannel(context, entry.getKey(), entry.getValue()));
            }

            String referenceKey = findKey(channels, "R");
            if (referenceKey == null) {
                referenceKey = findKey(channels, "L");
            }
            if (referenceKey == null) {
                referenceKey = channels.keySet().iterator().next();
            }
            ImageInfo reference = channels.get(referenceKey);
            if (context.getParams().getBoolean("crop", true)) {
                for (Map.Entry<String, ImageInfo> entry : channels.entrySet()) {
                    entry.setValue(matchGeometry(engine, entry.getKey(), entry.getValue(), reference));
                }
            }
            mainSources = mainSources(context, channels);
        } catch (IOException | RuntimeException e) {
            discardOpenedSince(engine, previous);
            throw e;
        }

        for (String id : previous) {
            engine.closeImage(id);
        }
        context.resetBranches();

        String mainHandle = buildMain(context, channels, mainSources);
        context.forkBranch(Step.MAIN_BRANCH, mainHandle);
        logger.info("Step '{}': main image is {}", step.getId(), mainHandle);

        for (Map.Entry<String, ImageInfo> entry : channels.entrySet()) {
            String branchId = branchFor(context, entry.getKey());
            if (branchId != null) {
                String handle = engine.renameImage(entry.getValue().id(), context.uniqueHandle(branchId));
                context.forkBranch(branchId, handle);
                logger.info("Step '{}': channel {} forked into branch '{}' as {}",
                        step.getId(), entry.getKey(), branchId, handle);
            } else {
                engine.closeImage(entry.getValue().id());
            }
        }
    }

    private Map<String, String> selectChannels(StepContext context) {
        Map<String, String> all = context.getConfig().getChannelFiles();
        List<Object> wanted = context.getParams().getList("channels");
        if (wanted.isEmpty()) {
            return all;
        }
        Map<String, String> selected = new LinkedHashMap<>();
        for (Object key : wanted) {
            String path = all.get(String.valueOf(key));
            if (path == null) {
                throw new PipelineSetupException("Step '" + context.getStep().getId()
                        + "': channel '" + key + "' has no file configured");
            }
            selected.put(String.valueOf(key), path);
        }
        return selected;
    }

    private ImageInfo openChannel(StepContext context, String key, String file) throws IOException {
        ImageEngine engine = context.getEngine();
        String stepId = context.getStep().getId();
        Path path = Paths.get(file);
        if (!Files.isRegularFile(path)) {
            throw new PipelineSetupException("Step '" + stepId + "': file for channel " + key
                    + " not found: " + path);
        }

        List<ImageInfo> windows = new ArrayList<>();
        for (ImageInfo window : engine.openImage(path)) {
            if (window.id().toLowerCase(Locale.ROOT).contains(CROP_MASK_TOKEN)) {
                logger.debug("Closing crop mask window {}", window.id());
                engine.closeImage(window.id());
            } else {
                windows.add(window);
            }
        }
        if (windows.isEmpty()) {
            throw new PipelineSetupException("Step '" + stepId + "': " + path + " opened no image for channel " + key);
        }

        ImageInfo chosen;
        if (windows.size() == 1) {
            chosen = windows.get(0);
        } else {
            List<ImageInfo> matches = new ArrayList<>();
            for (ImageInfo window : windows) {
                if (matchesFilter(window, key)) {
                    matches.add(window);
                }
            }
            if (matches.size() != 1) {
                throw new PipelineSetupException("Step '" + stepId + "': " + (matches.isEmpty() ? "no" : "several")
                        + " views of " + path + " match channel " + key + " (views: "
                        + windows.stream().map(ImageInfo::id).toList() + ")");
            }
            chosen = matches.get(0);
            for (ImageInfo window : windows) {
                if (window != chosen) {
                    engine.closeImage(window.id());
                }
            }
        }

        String handle = engine.renameImage(chosen.id(), context.uniqueHandle("raw_" + key));
        logger.info("Opened channel {} from {} as {} ({}x{})", key, path.getFileName(), handle,
                chosen.width(), chosen.height());
        return new ImageInfo(handle, chosen.filePath(), chosen.width(), chosen.height(),
                chosen.channels(), chosen.color());
    }

    /**
     * True when the view id or file name carries {@code FILTER_<key>}, {@code FILTER-<key>}
     * or {@code FILTER<key>} not followed by another letter or digit.
     */
    static boolean matchesFilter(ImageInfo window, String key) {
        Pattern token = Pattern.compile("FILTER[-_]?" + Pattern.quote(key) + "(?![A-Za-z0-9])",
                Pattern.CASE_INSENSITIVE);
        String fileName = window.filePath() == null ? "" : Paths.get(window.filePath()).getFileName().toString();
        return token.matcher(window.id()).find() || token.matcher(fileName).find();
    }

    private ImageInfo matchGeometry(ImageEngine engine, String key, ImageInfo image, ImageInfo reference)
            throws IOException {
        if (image.width() == reference.width() && image.height() == reference.height()) {
            return image;
        }
        if (image.width() < reference.width() || image.height() < reference.height()) {
            throw new PipelineSetupException("Channel " + key + " (" + image.width() + "x" + image.height()
                    + ") is smaller than the reference frame (" + reference.width() + "x" + reference.height() + ")");
        }
        ProcessCall crop = ProcessCall.of("DynamicCrop")
                .with("centerX", 0.5)
                .with("centerY", 0.5)
                .with("width", (double) reference.width() / image.width())
                .with("height", (double) reference.height() / image.height());
        engine.runProcess(image.id(), crop);
        logger.info("Cropped channel {} from {}x{} to {}x{}", key, image.width(), image.height(),
                reference.width(), reference.height());
        return new ImageInfo(image.id(), image.filePath(), reference.width(), reference.height(),
                image.channels(), image.color());
    }

    /**
     * Channel keys the main image is built from: R, G and B, else L, else the only channel.
     */
    private static List<String> mainSources(StepContext context, Map<String, ImageInfo> channels) {
        String r = findKey(channels, "R");
        String g = findKey(channels, "G");
        String b = findKey(channels, "B");
        if (r != null && g != null && b != null) {
            return List.of(r, g, b);
        }
        String l = findKey(channels, "L");
        if (l == null && channels.size() == 1) {
            l = channels.keySet().iterator().next();
        }
        if (l == null) {
            throw new PipelineSetupException("Step '" + context.getStep().getId()
                    + "': need R, G and B, or L, or a single channel to build the main image; have "
                    + channels.keySet());
        }
        return List.of(l);
    }

    private String buildMain(StepContext context, Map<String, ImageInfo> channels, List<String> sources)
            throws IOException {
        ImageEngine engine = context.getEngine();
        String target = context.uniqueHandle(context.targetName());
        if (sources.size() == 3) {
            List<String> ids = sources.stream().map(key -> channels.get(key).id()).toList();
            return engine.createImage(target, ids, ids.get(0));
        }
        return engine.cloneImage(channels.get(sources.get(0)).id(), target);
    }

    private static void discardOpenedSince(ImageEngine engine, List<String> previous) {
        try {
            for (ImageInfo open : engine.listImages()) {
                if (!previous.contains(open.id())) {
                    engine.closeImage(open.id());
                }
            }
        } catch (IOException e) {
            logger.warn("Could not close channel views after a failed open: {}", e.getMessage());
        }
    }

    /**
     * Declared branch this channel feeds, matched case-insensitively by name.
     */
    private String branchFor(StepContext context, String channelKey) {
        String stepId = context.getStep().getId();
        for (Map.Entry<String, BranchSpec> entry : context.getConfig().getBranches().entrySet()) {
            BranchSpec spec = entry.getValue();
            boolean forksHere = spec == null || spec.getForkAfterStepId() == null
                    || stepId.equals(spec.getForkAfterStepId());
            if (forksHere && entry.getKey().equalsIgnoreCase(channelKey) && !context.isLive(entry.getKey())) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static String findKey(Map<String, ?> map, String key) {
        for (String k : map.keySet()) {
            if (k.equalsIgnoreCase(key)) {
                return k;
            }
        }
        return null;
    }
}
