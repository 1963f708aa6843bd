package com.tinyeditor.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * ConfigValidator - Validates configuration on startup.
 * Catches malformed plugin settings before the editor receives them.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    static final Set<String> RECORDING_TYPES = Set.of("audio", "video", "screen", "both", "all");
    private static final String[] RECORDING_NUMBERS = {
            "audiobitrate", "videobitrate", "screenbitrate",
            "audiotimelimit", "videotimelimit", "screentimelimit"
    };

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    /**
     * Validate configuration and return list of errors/warnings
     */
    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        // 1. Recording settings
        validateRecording(config, errors);

        // 2. Equation libraries
        validateEquation(config, errors);

        // 3. Upload limits
        validateUploadLimits(config, errors);

        // 4. Premium
        validatePremium(config, errors);

        return errors;
    }

    private void validateRecording(Configuration config, List<ValidationError> errors) {
        String screenSize = config.getPluginSetting("tiny_recordrtc", "screensize", null);
        if (screenSize != null) {
            String[] parts = screenSize.split(",");
            if (parts.length != 2 || !isPositiveInteger(parts[0]) || !isPositiveInteger(parts[1])) {
                errors.add(new ValidationError(
                        "tiny_recordrtc/screensize must be 'width,height' but is: " + screenSize,
                        "ERROR"));
            }
        }

        for (String key : RECORDING_NUMBERS) {
            String value = config.getPluginSetting("tiny_recordrtc", key, null);
            if (value != null && !isPositiveInteger(value)) {
                errors.add(new ValidationError(
                        "tiny_recordrtc/" + key + " is not a positive number: " + value,
                        "ERROR"));
            }
        }

        String allowedTypes = config.getPluginSetting("tiny_recordrtc", "allowedtypes", null);
        if (allowedTypes != null) {
            for (String type : allowedTypes.split(",")) {
                if (!RECORDING_TYPES.contains(type.trim())) {
                    errors.add(new ValidationError(
                            "Unknown recording type in tiny_recordrtc/allowedtypes: " + type.trim(),
                            "WARNING"));
                }
            }
        }
    }

    private void validateEquation(Configuration config, List<ValidationError> errors) {
        for (int i = 1; i <= 4; i++) {
            String group = config.getPluginSetting("tiny_equation", "librarygroup" + i, null);
            if (group != null && group.trim().isEmpty()) {
                errors.add(new ValidationError(
                        "tiny_equation/librarygroup" + i + " is empty - the group will show no elements",
                        "WARNING"));
            }
        }
    }

    private void validateUploadLimits(Configuration config, List<ValidationError> errors) {
        String serverLimit = config.getPluginSetting(Configuration.CORE_NAMESPACE, "uploadmaxfilesize", "0");
        String siteLimit = config.getPluginSetting(Configuration.CORE_NAMESPACE, "maxbytes", "0");
        if (!isNonNegativeInteger(serverLimit)) {
            errors.add(new ValidationError("core/uploadmaxfilesize is not a number: " + serverLimit, "ERROR"));
        }
        if (!isNonNegativeInteger(siteLimit)) {
            errors.add(new ValidationError("core/maxbytes is not a number: " + siteLimit, "ERROR"));
        }
    }

    private void validatePremium(Configuration config, List<ValidationError> errors) {
        if (config.isPluginEnabled("premium")
                && config.getPluginSetting("tiny_premium", "apikey", "").isBlank()) {
            errors.add(new ValidationError(
                    "Premium plugin enabled but no API key configured - it will not be offered",
                    "WARNING"));
        }
    }

    private static boolean isPositiveInteger(String value) {
        try {
            return Long.parseLong(value.trim()) > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isNonNegativeInteger(String value) {
        try {
            return Long.parseLong(value.trim()) >= 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Validate and report errors to logger.
     * Throws RuntimeException if critical errors found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new RuntimeException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
