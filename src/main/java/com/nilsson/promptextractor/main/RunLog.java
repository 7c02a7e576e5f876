package com.nilsson.promptextractor.main;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 <h2>RunLog</h2>
 <p>
 Appends WARN and ERROR events to a log file inside the processed folder for the duration of one run.
 The appender is attached to the root logger on {@link #attach(Path)} and detached again on {@link #close()}.
 </p>
 <p>
 If SLF4J is not bound to logback the run log is skipped and only console logging applies.
 </p>
 */
public final class RunLog implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RunLog.class);
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss} - %level - %msg%n";

    private final ch.qos.logback.classic.Logger root;
    private final FileAppender<ILoggingEvent> appender;

    private RunLog(ch.qos.logback.classic.Logger root, FileAppender<ILoggingEvent> appender) {
        this.root = root;
        this.appender = appender;
    }

    public static RunLog attach(Path logFile) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            logger.debug("Logging backend is not logback, run log disabled");
            return new RunLog(null, null);
        }
        LoggerContext context = (LoggerContext) factory;

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();

        ThresholdFilter threshold = new ThresholdFilter();
        threshold.setLevel(Level.WARN.levelStr);
        threshold.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("run-log-" + logFile.getFileName());
        appender.setFile(logFile.toAbsolutePath().toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.addFilter(threshold);
        appender.start();

        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);
        return new RunLog(root, appender);
    }

    public boolean isActive() {
        return appender != null;
    }

    @Override
    public void close() {
        if (appender == null) return;
        root.detachAppender(appender);
        appender.stop();
    }
}
