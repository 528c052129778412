package pixinsight.ext.pipeline.service;

import java.io.IOException;

/**
 * Samples the memory the image engine currently uses.
 */
@FunctionalInterface
public interface MemoryProbe {

    /**
     * @return resident memory of the engine in bytes
     */
    long sampleBytes() throws IOException;
}
