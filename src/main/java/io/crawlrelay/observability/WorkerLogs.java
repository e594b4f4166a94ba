package io.crawlrelay.observability;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import io.crawlrelay.util.SafeNames;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide registry of per-subscription loggers.
 *
 * <p>Each subscription gets the logger {@code crawlrelay.worker.<name>}. When a
 * log directory is given and Logback is the SLF4J backend, the logger also
 * writes to {@code <logDir>/crawlrelay-<name>.log}. The appender is attached
 * once per subscription no matter how often the logger is requested.
 */
public final class WorkerLogs {
    public static final String LOGGER_PREFIX = "crawlrelay.worker.";
    static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%level] %msg%n";

    private static final Logger LOG = LoggerFactory.getLogger(WorkerLogs.class);
    private static final ConcurrentMap<String, Logger> REGISTRY = new ConcurrentHashMap<>();

    private WorkerLogs() {
    }

    public static Logger forSubscription(String subscription, Path logDir) {
        return REGISTRY.computeIfAbsent(subscription, key -> create(key, logDir));
    }

    public static boolean isRegistered(String subscription) {
        return REGISTRY.containsKey(subscription);
    }

    public static Path logFile(Path logDir, String subscription) {
        return logDir.resolve("crawlrelay-" + SafeNames.sanitizeOrDefault(subscription, "subscription") + ".log");
    }

    private static Logger create(String subscription, Path logDir) {
        String name = LOGGER_PREFIX + SafeNames.sanitizeOrDefault(subscription, "subscription");
        Logger logger = LoggerFactory.getLogger(name);
        if (logDir == null) {
            return logger;
        }
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            LOG.warn("Logback not bound; per-subscription log file disabled. subscription={}", subscription);
            return logger;
        }
        Path logFile = logFile(logDir, subscription);
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            LOG.warn("Log dir unavailable; per-subscription log file disabled. dir={}", logDir, e);
            return logger;
        }
        attachFileAppender((LoggerContext) factory, name, logFile);
        logger.info("Logger initialized. log_path={}", logFile);
        return logger;
    }

    private static void attachFileAppender(LoggerContext context, String loggerName, Path logFile) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("file-" + loggerName);
        appender.setFile(logFile.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        context.getLogger(loggerName).addAppender(appender);
    }
}
