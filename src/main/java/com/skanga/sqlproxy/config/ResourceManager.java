package com.skanga.sqlproxy.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Properties;

/**
 * Central access to externalized user-facing messages.
 * Messages live in {@code error-messages.properties} on the classpath and use
 * {@link MessageFormat} placeholders ({@code {0}}, {@code {1}}, ...).
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String MESSAGES_RESOURCE = "/error-messages.properties";
    private static final Properties errorMessages = loadMessages();

    private ResourceManager() {
    }

    /**
     * Looks up a message by key and formats it with the given arguments.
     * Unknown keys are returned verbatim so a missing entry never hides the original problem.
     *
     * @param messageKey Key in the messages file
     * @param messageArgs Values substituted into the message placeholders
     * @return The formatted message
     */
    public static String getErrorMessage(String messageKey, Object... messageArgs) {
        String messagePattern = errorMessages.getProperty(messageKey);
        if (messagePattern == null) {
            logger.debug("No message defined for key: {}", messageKey);
            return messageKey;
        }
        if (messageArgs == null || messageArgs.length == 0) {
            return messagePattern;
        }
        return new MessageFormat(messagePattern).format(messageArgs);
    }

    private static Properties loadMessages() {
        Properties loadedMessages = new Properties();
        try (InputStream inputStream = ResourceManager.class.getResourceAsStream(MESSAGES_RESOURCE)) {
            if (inputStream == null) {
                logger.warn("Message resource {} not found on classpath", MESSAGES_RESOURCE);
                return loadedMessages;
            }
            try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
                loadedMessages.load(reader);
            }
        } catch (IOException e) {
            logger.warn("Failed to load message resource {}: {}", MESSAGES_RESOURCE, e.getMessage());
        }
        return loadedMessages;
    }
}
