package pixinsight.ext.pipeline.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.model.ImageInfo;
import pixinsight.ext.pipeline.model.ImageStatistics;
import pixinsight.ext.pipeline.service.bridge.BridgeClient;
import pixinsight.ext.pipeline.service.bridge.BridgeCommand;
import pixinsight.ext.pipeline.service.bridge.BridgeResult;
import pixinsight.ext.pipeline.service.bridge.CallClass;
import pixinsight.ext.pipeline.stretch.PixelTransform;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static pixinsight.ext.pipeline.service.ProcessScriptBuilder.path;
import static pixinsight.ext.pipeline.service.ProcessScriptBuilder.quote;

/**
 * {@link ImageEngine} backed by the PixInsight watcher.
 *
 * <p>Simple operations use the watcher's built-in tools ({@code list_open_images},
 * {@code close_image}); everything else is a generated PJSR script sent through
 * {@code run_script} whose final expression is a JSON document, returned by the watcher
 * as console output. Processes and pixel transforms use the long polling budget, queries
 * the short one.</p>
 */
public class BridgeImageEngine implements ImageEngine {
    private static final Logger logger = LoggerFactory.getLogger(BridgeImageEngine.class);

    private final BridgeClient bridge;
    private final Gson gson = new Gson();

    /** Shape of a window as the watcher reports it. */
    private static class WindowInfo {
        String id;
        String filePath;
        int width;
        int height;
        int channels;
        boolean isColor;

        ImageInfo toImageInfo() {
            return new ImageInfo(id, filePath, width, height, channels, isColor);
        }
    }

    private static class ChannelStats {
        double median;
        double mad;
        double min;
        double max;
        double mean;
    }

    public BridgeImageEngine(BridgeClient bridge) {
        this.bridge = bridge;
    }

    @Override
    public List<ImageInfo> listImages() throws IOException {
        BridgeResult result = bridge.execute(
                BridgeCommand.global("list_open_images", "__internal__", null), CallClass.SHORT);
        Object images = result.getOutputs().get("images");
        List<ImageInfo> infos = new ArrayList<>();
        if (images != null) {
            for (WindowInfo w : convert(images, new TypeToken<List<WindowInfo>>() {}.getType(), List.<WindowInfo>of())) {
                infos.add(w.toImageInfo());
            }
        }
        return infos;
    }

    @Override
    public List<ImageInfo> openImage(Path file) throws IOException {
        String script = "var ws = ImageWindow.open(" + path(file) + ");\n"
                + "if (ws.length === 0) throw new Error('Failed to open image: ' + " + path(file) + ");\n"
                + "var out = [];\n"
                + "for (var i = 0; i < ws.length; ++i) { ws[i].show(); var im = ws[i].mainView.image;\n"
                + "  out.push({id: ws[i].mainView.id, filePath: ws[i].filePath, width: im.width, height: im.height,"
                + " channels: im.numberOfChannels, isColor: im.isColor}); }\n"
                + "JSON.stringify(out);";
        List<WindowInfo> windows = runJson(script, CallClass.LONG,
                new TypeToken<List<WindowInfo>>() {}.getType());
        List<ImageInfo> infos = new ArrayList<>();
        for (WindowInfo w : windows) {
            infos.add(w.toImageInfo());
        }
        logger.info("Opened {} -> {}", file.getFileName(), infos.stream().map(ImageInfo::id).toList());
        return infos;
    }

    @Override
    public String saveImage(String handle, Path file) throws IOException {
        String script = ProcessScriptBuilder.viewFunction()
                + "var w = view(" + quote(handle) + ").window;\n"
                + "w.saveAs(" + path(file) + ", false, false, false, false);\n"
                + "JSON.stringify({id: w.mainView.id});";
        String id = runJson(script, CallClass.LONG, WindowInfo.class).id;
        logger.debug("Saved {} to {} (now {})", handle, file, id);
        return id != null ? id : handle;
    }

    @Override
    public void closeImage(String handle) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("viewId", handle);
        bridge.execute(BridgeCommand.global("close_image", "__internal__", params), CallClass.SHORT);
        logger.debug("Closed {}", handle);
    }

    @Override
    public String renameImage(String handle, String newId) throws IOException {
        String script = ProcessScriptBuilder.viewFunction()
                + "var v = view(" + quote(handle) + ");\n"
                + "v.id = " + quote(newId) + ";\n"
                + "JSON.stringify({id: v.id});";
        return runJson(script, CallClass.SHORT, WindowInfo.class).id;
    }

    @Override
    public String cloneImage(String handle, String newId) throws IOException {
        String script = ProcessScriptBuilder.viewFunction()
                + "var src = view(" + quote(handle) + ").image;\n"
                + "var nw = new ImageWindow(src.width, src.height, src.numberOfChannels, src.bitsPerSample,"
                + " src.isReal, src.isColor, " + quote(newId) + ");\n"
                + "nw.mainView.beginProcess(UndoFlag_NoSwapFile);\n"
                + "nw.mainView.image.assign(src);\n"
                + "nw.mainView.endProcess();\n"
                + "nw.show();\n"
                + "JSON.stringify({id: nw.mainView.id});";
        return runJson(script, CallClass.LONG, WindowInfo.class).id;
    }

    @Override
    public ImageStatistics statistics(String handle) throws IOException {
        String script = ProcessScriptBuilder.viewFunction()
                + "var img = view(" + quote(handle) + ").image;\n"
                + "var out = [];\n"
                + "for (var c = 0; c < img.numberOfChannels; ++c) { img.selectedChannel = c;\n"
                + "  out.push({median: img.median(), mad: img.MAD(), min: img.minimum(), max: img.maximum(),"
                + " mean: img.mean()}); }\n"
                + "img.resetSelections();\n"
                + "JSON.stringify(out);";
        List<ChannelStats> raw = runJson(script, CallClass.SHORT,
                new TypeToken<List<ChannelStats>>() {}.getType());
        List<ImageStatistics.Channel> channels = new ArrayList<>();
        for (ChannelStats s : raw) {
            channels.add(new ImageStatistics.Channel(s.median, s.mad, s.min, s.max, s.mean));
        }
        return new ImageStatistics(channels);
    }

    @Override
    public double[] regionMedians(String handle, double boxFraction) throws IOException {
        String script = ProcessScriptBuilder.viewFunction()
                + "var img = view(" + quote(handle) + ").image;\n"
                + "var s = Math.max(1, Math.round(Math.min(img.width, img.height) * " + boxFraction + "));\n"
                + "var W = img.width, H = img.height;\n"
                + "var boxes = [[0,0],[W-s,0],[0,H-s],[W-s,H-s],[Math.round((W-s)/2),Math.round((H-s)/2)]];\n"
                + "var wts = img.isColor ? [0.2126,0.7152,0.0722] : [1];\n"
                + "var out = [];\n"
                + "for (var i = 0; i < boxes.length; ++i) { var m = 0;\n"
                + "  for (var c = 0; c < wts.length; ++c) { img.selectedChannel = c;\n"
                + "    img.selectedRect = new Rect(boxes[i][0], boxes[i][1], boxes[i][0]+s, boxes[i][1]+s);\n"
                + "    m += wts[c] * img.median(); }\n"
                + "  out.push(m); }\n"
                + "img.resetSelections();\n"
                + "JSON.stringify(out);";
        return runJson(script, CallClass.SHORT, double[].class);
    }

    @Override
    public void applyTransform(String handle, PixelTransform transform) throws IOException {
        String[] color = transform.colorExpressions();
        List<String> expressions = color == null ? List.of(transform.expression()) : List.of(color);
        ProcessScriptBuilder builder = pixelMathBuilder(expressions, transform.truncates());
        if (transform.symbols() != null) {
            builder.property("symbols", transform.symbols());
        }
        logger.debug("Applying {} to {}", transform.name(), handle);
        runScript(builder.executeOn(handle).build(), CallClass.LONG);
    }

    @Override
    public void pixelMath(String handle, List<String> expressions, boolean truncate) throws IOException {
        runScript(pixelMathBuilder(expressions, truncate).executeOn(handle).build(), CallClass.LONG);
    }

    @Override
    public String createImage(String newId, List<String> expressions, String geometryReference) throws IOException {
        Set<String> before = ids(listImages());
        String geometry = ProcessScriptBuilder.viewFunction()
                + "var ref = view(" + quote(geometryReference) + ").image;\n";
        ProcessScriptBuilder builder = pixelMathBuilder(expressions, true)
                .property("createNewImage", true)
                .property("showNewImage", true)
                .property("newImageId", newId)
                .property("newImageWidth", new ProcessScriptBuilder.Raw("ref.width"))
                .property("newImageHeight", new ProcessScriptBuilder.Raw("ref.height"))
                .property("newImageColorSpace", new ProcessScriptBuilder.Raw(
                        expressions.size() == 3 ? "PixelMath.prototype.RGB" : "PixelMath.prototype.Gray"))
                .property("newImageSampleFormat", new ProcessScriptBuilder.Raw("PixelMath.prototype.f32"))
                .executeGlobal();
        runScript(geometry + builder.build(), CallClass.LONG);
        List<String> created = newIds(before);
        if (created.isEmpty()) {
            throw new IOException("PixelMath did not create image " + newId);
        }
        return created.contains(newId) ? newId : created.get(0);
    }

    @Override
    public List<String> runProcess(String handle, ProcessCall call) throws IOException {
        Set<String> before = ids(listImages());
        logger.info("Running {} on {} {}", call.processName(), handle, call.properties());
        runScript(ProcessScriptBuilder.forCall(call).executeOn(handle).build(), CallClass.LONG);
        List<String> created = newIds(before);
        if (!created.isEmpty()) {
            logger.debug("{} created {}", call.processName(), created);
        }
        return created;
    }

    @Override
    public void purgeHistory(String handle) throws IOException {
        String script = ProcessScriptBuilder.viewFunction()
                + "view(" + quote(handle) + ").window.purge();\n'ok';";
        runScript(script, CallClass.SHORT);
    }

    private static ProcessScriptBuilder pixelMathBuilder(List<String> expressions, boolean truncate) {
        if (expressions.size() != 1 && expressions.size() != 3) {
            throw new IllegalArgumentException("PixelMath takes 1 or 3 expressions, got " + expressions.size());
        }
        ProcessScriptBuilder builder = ProcessScriptBuilder.builder().process("PixelMath")
                .property("expression", expressions.get(0))
                .property("useSingleExpression", expressions.size() == 1);
        if (expressions.size() == 3) {
            builder.property("expression1", expressions.get(1)).property("expression2", expressions.get(2));
        }
        return builder
                .property("createNewImage", false)
                .property("use64BitWorkingImage", true)
                .property("truncate", truncate)
                .property("truncateLower", 0)
                .property("truncateUpper", 1);
    }

    private List<String> newIds(Set<String> before) throws IOException {
        List<String> created = new ArrayList<>();
        for (ImageInfo info : listImages()) {
            if (!before.contains(info.id())) {
                created.add(info.id());
            }
        }
        return created;
    }

    private static Set<String> ids(List<ImageInfo> infos) {
        Set<String> ids = new HashSet<>();
        for (ImageInfo info : infos) {
            ids.add(info.id());
        }
        return ids;
    }

    private BridgeResult runScript(String code, CallClass callClass) throws IOException {
        return bridge.execute(BridgeCommand.script(code), callClass);
    }

    private <T> T runJson(String code, CallClass callClass, Class<T> type) throws IOException {
        return runJson(code, callClass, (Type) type);
    }

    private <T> T runJson(String code, CallClass callClass, Type type) throws IOException {
        String output = runScript(code, callClass).getConsoleOutput();
        if (output == null) {
            throw new IOException("Script returned no output");
        }
        try {
            T parsed = gson.fromJson(output, type);
            if (parsed == null) {
                throw new IOException("Script returned empty JSON");
            }
            return parsed;
        } catch (JsonParseException e) {
            throw new IOException("Unexpected script output: " + output, e);
        }
    }

    private <T> T convert(Object value, Type type, T fallback) {
        try {
            T parsed = gson.fromJson(gson.toJsonTree(value), type);
            return parsed != null ? parsed : fallback;
        } catch (JsonParseException e) {
            logger.warn("Could not interpret watcher output {}: {}", value, e.getMessage());
            return fallback;
        }
    }
}
