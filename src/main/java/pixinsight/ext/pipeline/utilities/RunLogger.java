package pixinsight.ext.pipeline.utilities;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Utility for writing the log of one pipeline run next to its output.
 *
 * <p>While a session is open every orchestrator log message is also written to
 * {@code <outputDir>/pipeline.log}. The file is appended to, so a resumed run continues
 * the log of the run it resumes.</p>
 *
 * <pre>{@code
 * try (RunLogger.Session session = RunLogger.start(outputDir)) {
 *     logger.info("Starting pipeline...");
 *     // ... run ...
 * } // appender detached
 * }</pre>
 *
 * @since 0.2.0
 */
public class RunLogger {
    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(RunLogger.class);

    public static final String LOG_FILE_NAME = "pipeline.log";
    static final String APPENDER_NAME = "PIPELINE_RUN_LOG";
    static final String LOGGER_NAME = "pixinsight.ext.pipeline";

    private RunLogger() {
    }

    /**
     * Starts a run logging session with automatic cleanup.
     *
     * @param outputDir directory for {@code pipeline.log}; null or missing disables the session
     * @return a session that detaches the appender when closed
     */
    public static Session start(Path outputDir) {
        return new Session(outputDir);
    }

    private static FileAppender<ILoggingEvent> attach(Path outputDir) {
        if (outputDir == null) {
            return null;
        }
        File dir = outputDir.toFile();
        if (!dir.isDirectory()) {
            logger.warn("Cannot enable run logging: directory does not exist: {}", outputDir);
            return null;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.debug("Logback is not the active SLF4J binding; run log disabled");
            return null;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level %logger{0} - %msg%n");
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(new File(dir, LOG_FILE_NAME).getAbsolutePath());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        context.getLogger(LOGGER_NAME).addAppender(appender);
        logger.info("Run logging enabled: {}", appender.getFile());
        return appender;
    }

    private static void detach(FileAppender<ILoggingEvent> appender) {
        logger.info("Run logging disabled: {}", appender.getFile());
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger pipelineLogger = context.getLogger(LOGGER_NAME);
        pipelineLogger.detachAppender(appender);
        appender.stop();
    }

    /**
     * Auto-closeable session for the run log.
     */
    public static class Session implements AutoCloseable {
        private final FileAppender<ILoggingEvent> appender;

        private Session(Path outputDir) {
            this.appender = attach(outputDir);
        }

        /**
         * @return true if the run log is being written
         */
        public boolean isActive() {
            return appender != null;
        }

        @Override
        public void close() {
            if (appender != null) {
                detach(appender);
            }
        }
    }
}
