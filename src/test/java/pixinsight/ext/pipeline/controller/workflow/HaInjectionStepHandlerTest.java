package pixinsight.ext.pipeline.controller.workflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pixinsight.ext.pipeline.model.ImageInfo;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HaInjectionStepHandlerTest {

    private HandlerFixture fixture;
    private final HaInjectionStepHandler handler = new HaInjectionStepHandler();

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
    }

    @Test
    void injectionExpression() {
        assertEquals("iif(ha>$T,$T+0.5*(ha-med(ha)),$T)", HaInjectionStepHandler.injectionExpression("ha", 0.5));
    }

    @Test
    @DisplayName("Ha brighter than the target is added above its median")
    void injectsIntoMono() throws IOException {
        fixture.live("main", "M81", 0.2, 0.2, 0.2, 0.2);
        fixture.live("ha", "ha", 0.1, 0.6, 0.3, 0.1);

        handler.execute(fixture.context("ha_inject", null));

        double[] out = fixture.engine.pixels("M81")[0];
        assertArrayEquals(new double[]{0.2, 0.4, 0.25, 0.2}, out, 1e-12);
    }

    @Test
    @DisplayName("colour targets get the injection on red only")
    void injectsIntoRedChannel() throws IOException {
        fixture.liveColor("main", "M81",
                new double[]{0.2, 0.2}, new double[]{0.3, 0.3}, new double[]{0.4, 0.4});
        fixture.live("ha", "ha", 0.1, 0.9);

        handler.execute(fixture.context("ha_inject", Map.of("strength", 1.0)));

        double[][] rgb = fixture.engine.pixels("M81");
        assertEquals(0.2, rgb[0][0], 1e-12);
        assertEquals(0.2 + (0.9 - 0.5), rgb[0][1], 1e-12);
        assertArrayEquals(new double[]{0.3, 0.3}, rgb[1], 1e-12);
        assertArrayEquals(new double[]{0.4, 0.4}, rgb[2], 1e-12);
    }

    @Test
    @DisplayName("linear fit runs against a temporary reference that is closed afterwards")
    void linearFitReferenceIsClosed() throws IOException {
        fixture.live("main", "M81", 0.2, 0.2);
        fixture.live("ha", "ha", 0.1, 0.6);

        handler.execute(fixture.context("ha_inject", null));

        assertEquals(1, fixture.engine.countCalls("createImage"));
        assertEquals(1, fixture.engine.countCalls("runProcess ha LinearFit"));
        assertEquals(List.of("M81", "ha"), fixture.engine.listImages().stream().map(ImageInfo::id).toList());
    }

    @Test
    void linearFitCanBeDisabled() throws IOException {
        fixture.live("main", "M81", 0.2, 0.2);
        fixture.live("ha", "ha", 0.1, 0.6);

        handler.execute(fixture.context("ha_inject", Map.of("linearFit", false)));

        assertEquals(0, fixture.engine.countCalls("createImage"));
        assertEquals(0, fixture.engine.countCalls("runProcess"));
    }

    @Test
    void missingHaBranchIsAStepFailure() {
        fixture.live("main", "M81", 0.2, 0.2);
        assertThrows(IllegalStateException.class, () -> handler.execute(fixture.context("ha_inject", null)));
    }
}
