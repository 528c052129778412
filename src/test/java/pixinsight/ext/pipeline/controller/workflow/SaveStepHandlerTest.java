package pixinsight.ext.pipeline.controller.workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pixinsight.ext.pipeline.config.Step;
import pixinsight.ext.pipeline.controller.PipelineSetupException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SaveStepHandlerTest {

    @TempDir
    Path dir;

    private final SaveStepHandler handler = new SaveStepHandler();

    @Test
    void savesStepBranchWithDefaultName() throws IOException {
        HandlerFixture fixture = new HandlerFixture().withOutputDir(dir.resolve("out"));
        fixture.live("main", "M81", 0.1, 0.2);

        handler.execute(fixture.context("save_linear", null));

        assertTrue(Files.exists(dir.resolve("out").resolve("M81_save_linear.xisf")));
    }

    @Test
    void savesNamedBranchAndFile() throws IOException {
        HandlerFixture fixture = new HandlerFixture().withOutputDir(dir);
        fixture.live("main", "M81", 0.1);
        fixture.live("stars", "stars", 0.9);

        handler.execute(fixture.context("save", Map.of("branch", "stars", "filename", "stars_only.xisf")));

        assertTrue(Files.exists(dir.resolve("stars_only.xisf")));
        assertEquals(1, fixture.engine.countCalls("saveImage stars stars_only.xisf"));
    }

    @Test
    @DisplayName("a save that renames the image leaves the branch handle unchanged")
    void renameOnSaveIsUndone() throws IOException {
        HandlerFixture fixture = new HandlerFixture().withOutputDir(dir);
        fixture.live("main", "M81", 0.1);
        fixture.engine.setRenameOnSave(true);

        handler.execute(fixture.context(new Step("save", null, null)));

        assertEquals("M81", fixture.handle("main"));
        assertTrue(fixture.engine.isOpen("M81"));
    }

    @Test
    void outputDirIsRequired() {
        HandlerFixture fixture = new HandlerFixture();
        fixture.live("main", "M81", 0.1);
        assertThrows(PipelineSetupException.class, () -> handler.execute(fixture.context("save", null)));
    }
}
