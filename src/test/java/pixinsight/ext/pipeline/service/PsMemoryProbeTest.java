package pixinsight.ext.pipeline.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PsMemoryProbeTest {

    private static final String PS_OUTPUT = String.join("\n",
            "  1024 /sbin/launchd",
            "2097152 /Applications/PixInsight/PixInsight.app/Contents/MacOS/PixInsight",
            " 524288 PixInsight-helper",
            "   abc PixInsight",
            "",
            "  2048 java");

    @Test
    void sumsResidentMemoryOfMatchingProcesses() {
        PsMemoryProbe probe = new PsMemoryProbe("PixInsight", 5);
        assertEquals((2097152L + 524288L) * 1024L, probe.parse(PS_OUTPUT));
    }

    @Test
    void noMatchingProcessMeansZero() {
        PsMemoryProbe probe = new PsMemoryProbe("siril", 5);
        assertEquals(0L, probe.parse(PS_OUTPUT));
        assertEquals(0L, probe.parse(""));
    }
}
