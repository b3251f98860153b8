package com.vbot.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ConfigValidator - Validates configuration on startup.
 * Reports problems instead of throwing, so a half-configured bot still boots and logs why.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        public boolean isError() {
            return "ERROR".equals(severity);
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateTelegram(config, errors);
        validateAuth(config, errors);
        validatePrefixes(config, errors);
        validateDispatch(config, errors);

        return errors;
    }

    private void validateTelegram(Configuration config, List<ValidationError> errors) {
        if (config.telegramToken == null || config.telegramToken.isBlank()) {
            errors.add(new ValidationError("telegramToken is required - the bot cannot receive messages", "ERROR"));
        }
    }

    private void validateAuth(Configuration config, List<ValidationError> errors) {
        if (config.ownerId == 0) {
            errors.add(new ValidationError("ownerId is required", "ERROR"));
        }
        if (config.developerIds == null || config.developerIds.isEmpty()) {
            errors.add(new ValidationError("At least one developer id is recommended", "WARNING"));
        }
        if (config.adminCacheTtlSeconds <= 0) {
            errors.add(new ValidationError(
                    "adminCacheTtlSeconds must be positive (was " + config.adminCacheTtlSeconds + ")", "ERROR"));
        }
    }

    private void validatePrefixes(Configuration config, List<ValidationError> errors) {
        String[] prefixes = { config.developerPrefix, config.adminPrefix, config.publicPrefix };
        Set<String> seen = new HashSet<>();
        for (String prefix : prefixes) {
            if (prefix == null || prefix.length() != 1) {
                errors.add(new ValidationError("Command prefix must be a single character: '" + prefix + "'", "ERROR"));
            } else if (!seen.add(prefix)) {
                errors.add(new ValidationError("Command prefix '" + prefix + "' is used for more than one tier", "ERROR"));
            }
        }
    }

    private void validateDispatch(Configuration config, List<ValidationError> errors) {
        if (config.dispatchThreads < 1) {
            errors.add(new ValidationError("dispatchThreads must be at least 1", "ERROR"));
        }
        if (config.acknowledgeCommands
                && (config.acknowledgementPhases == null || config.acknowledgementPhases.isEmpty())) {
            errors.add(new ValidationError("acknowledgeCommands is on but no acknowledgementPhases are set", "WARNING"));
        }
    }

    /**
     * Logs every entry and returns true if nothing of severity ERROR was found.
     */
    public boolean validateAndLog(Configuration config) {
        List<ValidationError> errors = validate(config);
        for (ValidationError error : errors) {
            if (error.isError())
                logger.error("❌ {}", error.message);
            else
                logger.warn("⚠️ {}", error.message);
        }
        return errors.stream().noneMatch(ValidationError::isError);
    }
}
