package pixinsight.ext.pipeline.controller.workflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pixinsight.ext.pipeline.SimulatedImageEngine;
import pixinsight.ext.pipeline.config.BranchSpec;
import pixinsight.ext.pipeline.config.OrchestratorSettings;
import pixinsight.ext.pipeline.config.PipelineConfig;
import pixinsight.ext.pipeline.config.Step;
import pixinsight.ext.pipeline.controller.PipelineSetupException;
import pixinsight.ext.pipeline.model.EngineState;
import pixinsight.ext.pipeline.model.ImageInfo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenChannelsStepHandlerTest {

    @TempDir
    Path dir;

    private SimulatedImageEngine engine;
    private EngineState state;
    private final OpenChannelsStepHandler handler = new OpenChannelsStepHandler();

    @BeforeEach
    void setUp() {
        engine = new SimulatedImageEngine();
        state = new EngineState();
    }

    private static double[] flat(int size, double value) {
        double[] values = new double[size];
        Arrays.fill(values, value);
        return values;
    }

    private String channelFile(String name, int size, double value) throws IOException {
        Path file = dir.resolve(name);
        SimulatedImageEngine.writeImageFile(file, size, size, flat(size * size, value));
        return file.toString();
    }

    private void run(Map<String, String> files, Map<String, BranchSpec> branches) throws IOException {
        Map<String, String> all = new LinkedHashMap<>(files);
        all.put(PipelineConfig.TARGET_NAME_KEY, "M81");
        PipelineConfig config = new PipelineConfig("t", all, branches, List.of(new Step("combine", null, null)));
        handler.execute(new StepContext(config.getSteps().get(0), config, engine, state,
                OrchestratorSettings.defaults()));
    }

    private List<String> openIds() {
        return engine.listImages().stream().map(ImageInfo::id).toList();
    }

    // ==================== Main image ====================

    @Test
    @DisplayName("R, G and B are combined into an RGB main and the raw views closed")
    void combinesRgb() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("R", channelFile("R.xisf", 4, 0.1));
        files.put("G", channelFile("G.xisf", 4, 0.2));
        files.put("B", channelFile("B.xisf", 4, 0.3));

        run(files, Map.of());

        assertEquals("M81", state.getRegistry().requireHandle(Step.MAIN_BRANCH));
        assertEquals(List.of("M81"), openIds());
        double[][] rgb = engine.pixels("M81");
        assertEquals(3, rgb.length);
        assertEquals(0.1, rgb[0][5], 1e-12);
        assertEquals(0.3, rgb[2][5], 1e-12);
    }

    @Test
    void singleChannelIsCloned() throws IOException {
        run(Map.of("L", channelFile("lum.xisf", 3, 0.4)), Map.of());

        String main = state.getRegistry().requireHandle(Step.MAIN_BRANCH);
        assertEquals(1, engine.pixels(main).length);
        assertEquals(List.of("M81"), openIds());
    }

    @Test
    @DisplayName("previously open images and branches are discarded")
    void startsFromScratch() throws IOException {
        state.getRegistry().register("stars", engine.addImage("old_stars", 1, 1, new double[]{0.5}));

        run(Map.of("L", channelFile("lum.xisf", 3, 0.4)), Map.of());

        assertFalse(engine.isOpen("old_stars"));
        assertFalse(state.getRegistry().isLive("stars"));
    }

    @Test
    @DisplayName("a channel that cannot be opened leaves earlier images and branches untouched")
    void failedOpenKeepsPreviousState() throws IOException {
        state.getRegistry().register("stars", engine.addImage("old_stars", 1, 1, new double[]{0.5}));
        Map<String, String> files = new LinkedHashMap<>();
        files.put("R", channelFile("R.xisf", 4, 0.1));
        files.put("G", dir.resolve("missing.xisf").toString());

        assertThrows(PipelineSetupException.class, () -> run(files, Map.of()));

        assertEquals(List.of("old_stars"), openIds());
        assertEquals(Map.of("stars", "old_stars"), state.getRegistry().snapshot());
    }

    @Test
    @DisplayName("larger frames are cropped around the centre to the R geometry")
    void cropsLargerFrames() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("R", channelFile("R.xisf", 4, 0.1));
        files.put("G", channelFile("G.xisf", 6, 0.2));
        files.put("B", channelFile("B.xisf", 4, 0.3));

        run(files, Map.of());

        assertEquals(1, engine.countCalls("runProcess raw_G DynamicCrop"));
        assertEquals(16, engine.pixels("M81")[1].length);
    }

    @Test
    void smallerFrameIsFatal() {
        assertThrows(PipelineSetupException.class, () -> {
            Map<String, String> files = new LinkedHashMap<>();
            files.put("R", channelFile("R.xisf", 4, 0.1));
            files.put("G", channelFile("G.xisf", 3, 0.2));
            files.put("B", channelFile("B.xisf", 4, 0.3));
            run(files, Map.of());
        });
    }

    @Test
    void missingFileIsFatal() {
        PipelineSetupException e = assertThrows(PipelineSetupException.class,
                () -> run(Map.of("R", dir.resolve("nope.xisf").toString()), Map.of()));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void twoChannelsWithoutRgbOrLumAreFatal() {
        assertThrows(PipelineSetupException.class, () -> {
            Map<String, String> files = new LinkedHashMap<>();
            files.put("R", channelFile("R.xisf", 4, 0.1));
            files.put("Ha", channelFile("Ha.xisf", 4, 0.2));
            run(files, Map.of());
        });
    }

    // ==================== Windows ====================

    @Test
    void cropMaskWindowsAreClosed() throws IOException {
        String file = channelFile("lum.xisf", 3, 0.4);
        engine.addCompanionWindow("lum.xisf", "lum_crop_mask");

        run(Map.of("L", file), Map.of());

        assertFalse(engine.isOpen("lum_crop_mask"));
        assertEquals(1, engine.countCalls("closeImage lum_crop_mask"));
    }

    @Test
    @DisplayName("with several views the one carrying the filter token is used")
    void filterTokenSelectsView() throws IOException {
        String file = channelFile("stack.xisf", 3, 0.4);
        engine.addCompanionWindow("stack.xisf", "stack_FILTER_L_view");
        engine.addCompanionWindow("stack.xisf", "stack_FILTER_Lum");

        run(Map.of("L", file), Map.of());

        assertEquals(1, engine.countCalls("renameImage stack_FILTER_L_view raw_L"));
        assertEquals(List.of("M81"), openIds());
    }

    @Test
    void ambiguousViewsAreFatal() throws IOException {
        String file = channelFile("stack.xisf", 3, 0.4);
        engine.addCompanionWindow("stack.xisf", "FILTER_L_a");
        engine.addCompanionWindow("stack.xisf", "FILTER-L_b");

        PipelineSetupException e = assertThrows(PipelineSetupException.class, () -> run(Map.of("L", file), Map.of()));
        assertTrue(e.getMessage().contains("several views"));
    }

    @Test
    void filterTokenMatching() {
        assertTrue(OpenChannelsStepHandler.matchesFilter(new ImageInfo("x", "/d/M81_FILTER-Ha_300s.xisf", 1, 1, 1, false), "Ha"));
        assertTrue(OpenChannelsStepHandler.matchesFilter(new ImageInfo("filterR", null, 1, 1, 1, false), "R"));
        assertFalse(OpenChannelsStepHandler.matchesFilter(new ImageInfo("FILTER_Red", null, 1, 1, 1, false), "R"));
        assertFalse(OpenChannelsStepHandler.matchesFilter(new ImageInfo("stack", "/d/stack.xisf", 1, 1, 1, false), "R"));
    }

    // ==================== Branches ====================

    @Test
    @DisplayName("a channel named like a declared branch becomes that branch")
    void channelForksBranch() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("R", channelFile("R.xisf", 4, 0.1));
        files.put("G", channelFile("G.xisf", 4, 0.2));
        files.put("B", channelFile("B.xisf", 4, 0.3));
        files.put("Ha", channelFile("Ha.xisf", 4, 0.6));

        run(files, Map.of("ha", new BranchSpec("H-alpha", null)));

        assertEquals("ha", state.getRegistry().requireHandle("ha"));
        assertEquals(0.6, engine.pixels("ha")[0][0], 1e-12);
        assertEquals(List.of("M81", "ha"), openIds());
    }

    @Test
    void branchForkingElsewhereIsNotFedByChannel() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("L", channelFile("L.xisf", 4, 0.1));
        files.put("Ha", channelFile("Ha.xisf", 4, 0.6));

        run(files, Map.of("ha", new BranchSpec(null, "stretch")));

        assertFalse(state.getRegistry().isLive("ha"));
        assertEquals(List.of("M81"), openIds());
    }
}
