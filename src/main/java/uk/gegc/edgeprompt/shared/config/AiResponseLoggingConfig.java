package uk.gegc.edgeprompt.shared.config;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Dedicated file logger for raw prompts and completions, kept out of the application log.
 */
@Configuration
public class AiResponseLoggingConfig {

    private static final String AI_RESPONSE_LOGGER_NAME = "ai.response.logger";
    private static final String LOG_FILE_PREFIX = "ai-responses";

    @Value("${edgeprompt.ai.response-log-dir:logs}")
    private String logDir;

    @Bean
    @Lazy
    public Logger aiResponseLogger() {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        Logger aiLogger = loggerContext.getLogger(AI_RESPONSE_LOGGER_NAME);
        aiLogger.setAdditive(false);

        FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setContext(loggerContext);
        fileAppender.setName("ai-response-file-appender");

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss"));
        String fileName = String.format("%s_%s.log", LOG_FILE_PREFIX, timestamp);

        try {
            Path logsDir = Paths.get(logDir);
            Files.createDirectories(logsDir);
            fileAppender.setFile(logsDir.resolve(fileName).toString());
        } catch (Exception e) {
            // Fall back to the working directory
            fileAppender.setFile(fileName);
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern("%d{ISO8601} %msg%n");
        encoder.start();

        fileAppender.setEncoder(encoder);
        fileAppender.start();

        aiLogger.addAppender(fileAppender);

        return aiLogger;
    }
}
