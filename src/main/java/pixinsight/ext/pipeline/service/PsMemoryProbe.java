package pixinsight.ext.pipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Reads engine memory from {@code ps}: the resident set sizes of every process whose
 * command name contains the configured pattern, summed.
 */
public class PsMemoryProbe implements MemoryProbe {
    private static final Logger logger = LoggerFactory.getLogger(PsMemoryProbe.class);

    private final String processPattern;
    private final int timeoutSec;

    public PsMemoryProbe(String processPattern, int timeoutSec) {
        this.processPattern = processPattern.toLowerCase(Locale.ROOT);
        this.timeoutSec = timeoutSec;
    }

    @Override
    public long sampleBytes() throws IOException {
        List<String> cmd = List.of("ps", "-axo", "rss=,comm=");
        Process process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        try {
            if (!process.waitFor(timeoutSec, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("Command timed out after " + timeoutSec + " seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while sampling memory", e);
        }
        String stdout = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (process.exitValue() != 0) {
            throw new IOException("Command " + cmd + " failed (exit " + process.exitValue() + "):\n" + stdout.trim());
        }
        return parse(stdout);
    }

    /**
     * Sums the RSS column (KiB) of matching lines.
     */
    long parse(String psOutput) {
        long kib = 0;
        int matched = 0;
        for (String line : psOutput.split("\\R")) {
            String trimmed = line.trim();
            int space = trimmed.indexOf(' ');
            if (space <= 0) {
                continue;
            }
            String command = trimmed.substring(space + 1).trim();
            if (!command.toLowerCase(Locale.ROOT).contains(processPattern)) {
                continue;
            }
            try {
                kib += Long.parseLong(trimmed.substring(0, space));
                matched++;
            } catch (NumberFormatException e) {
                logger.debug("Ignoring ps line '{}'", line);
            }
        }
        if (matched == 0) {
            logger.debug("No process matching '{}' found", processPattern);
        }
        return kib * 1024;
    }
}
