package pixinsight.ext.pipeline.controller.workflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StretchStepHandlerTest {

    private HandlerFixture fixture;
    private final StretchStepHandler handler = new StretchStepHandler();

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
        fixture.live("main", "M81", 0.02, 0.03, 0.04, 0.05, 0.9);
    }

    @Test
    void modeNoneLeavesImageAlone() throws IOException {
        handler.execute(fixture.context("stretch", Map.of("mode", "none")));
        assertEquals(0, fixture.engine.countCalls("applyTransform"));
        assertEquals(0.04, fixture.engine.pixels("M81")[0][2], 1e-12);
    }

    @Test
    @DisplayName("identity and invalid GHS passes are skipped, valid ones applied")
    void ghsPasses() throws IOException {
        handler.execute(fixture.context("stretch", Map.of(
                "mode", "none",
                "ghs", List.of(
                        Map.of("D", 0.0),
                        Map.of("D", -1.0),
                        Map.of("D", 2.0, "B", 0.0)))));

        assertEquals(1, fixture.engine.countCalls("applyTransform"));
        assertTrue(fixture.engine.pixels("M81")[0][2] > 0.04);
    }

    @Test
    @DisplayName("statistical stretch brings the median towards the target")
    void statisticalStretchRaisesMedian() throws IOException {
        handler.execute(fixture.context("stretch", Map.of("targetMedian", 0.25)));

        double median = fixture.engine.statistics("M81").getMedian();
        assertTrue(median > 0.04, "median " + median);
        assertTrue(fixture.engine.countCalls("applyTransform") >= 1);
    }
}
