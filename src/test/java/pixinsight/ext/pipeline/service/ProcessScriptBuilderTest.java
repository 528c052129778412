package pixinsight.ext.pipeline.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessScriptBuilderTest {

    @Test
    @DisplayName("process script sets properties in order and executes on the view")
    void buildsProcessScript() {
        ProcessCall call = ProcessCall.of("NoiseXTerminator")
                .with("denoise", 0.75)
                .with("iterations", 2)
                .with("linear", true)
                .with("mode", "fast");

        String script = ProcessScriptBuilder.forCall(call).executeOn("M81").build();

        assertTrue(script.startsWith(ProcessScriptBuilder.viewFunction()));
        int denoise = script.indexOf("P.denoise = 0.75;");
        int iterations = script.indexOf("P.iterations = 2;");
        assertTrue(denoise > 0 && iterations > denoise, script);
        assertTrue(script.contains("var P = new NoiseXTerminator;"));
        assertTrue(script.contains("P.linear = true;"));
        assertTrue(script.contains("P.mode = 'fast';"));
        assertTrue(script.contains("P.executeOn(view('M81'));"));
        assertTrue(script.endsWith("'ok';"));
    }

    @Test
    void nullPropertiesAreLeftAtEngineDefaults() {
        String script = ProcessScriptBuilder.builder()
                .process("SCNR")
                .property("amount", null)
                .executeGlobal()
                .build();
        assertFalse(script.contains("amount"));
        assertTrue(script.contains("P.executeGlobal();"));
    }

    @Test
    void trailerReplacesDefaultResult() {
        String script = ProcessScriptBuilder.builder()
                .process("PixelMath")
                .property("useSingleExpression", new ProcessScriptBuilder.Raw("false"))
                .executeOn("img")
                .thenEvaluate("JSON.stringify({ok:true});")
                .build();
        assertTrue(script.contains("P.useSingleExpression = false;"));
        assertTrue(script.endsWith("JSON.stringify({ok:true});"));
    }

    @Test
    @DisplayName("missing process and target view are both reported")
    void validatesRequiredParts() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ProcessScriptBuilder.builder().build());
        assertEquals("Missing required parameters: process, target view", e.getMessage());
    }

    @Test
    void rejectsPropertyNamesThatAreNotIdentifiers() {
        ProcessScriptBuilder builder = ProcessScriptBuilder.builder()
                .process("Curves")
                .property("a; evil()", 1)
                .executeOn("img");
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    // ==================== Literals ====================

    @Test
    void literalsRenderAsJavaScript() {
        assertEquals("3", ProcessScriptBuilder.literal(3.0));
        assertEquals("-2", ProcessScriptBuilder.literal(-2));
        assertEquals("0.125", ProcessScriptBuilder.literal(0.125));
        assertEquals("-0.5", ProcessScriptBuilder.literal(-0.5));
        assertEquals("false", ProcessScriptBuilder.literal(Boolean.FALSE));
        assertEquals("[[0,0],[0.5,0.6],[1,1]]", ProcessScriptBuilder.literal(
                List.of(List.of(0, 0), List.of(0.5, 0.6), List.of(1, 1))));
    }

    @Test
    void quoteEscapesSpecialCharacters() {
        assertEquals("'it\\'s'", ProcessScriptBuilder.quote("it's"));
        assertEquals("'a\\\\b'", ProcessScriptBuilder.quote("a\\b"));
        assertEquals("'line\\nnext'", ProcessScriptBuilder.quote("line\nnext"));
    }
}
