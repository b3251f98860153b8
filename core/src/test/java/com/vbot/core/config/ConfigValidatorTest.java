package com.vbot.core.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {
    private final ConfigValidator validator = new ConfigValidator();
    private Configuration config;

    @BeforeEach
    void setUp() {
        config = new Configuration();
        config.telegramToken = "123:abc";
        config.ownerId = 1;
        config.developerIds = new ArrayList<>(List.of(2L));
    }

    @Test
    void testCompleteConfigIsValid() {
        assertTrue(validator.validate(config).isEmpty());
        assertTrue(validator.validateAndLog(config));
    }

    @Test
    void testDefaultsLackCredentials() {
        List<ConfigValidator.ValidationError> errors = validator.validate(new Configuration());
        assertTrue(errors.stream().anyMatch(e -> e.isError() && e.message.contains("telegramToken")));
        assertTrue(errors.stream().anyMatch(e -> e.isError() && e.message.contains("ownerId")));
        assertFalse(validator.validateAndLog(new Configuration()));
    }

    @Test
    void testPrefixesMustBeDistinctSingleCharacters() {
        config.adminPrefix = "#";
        assertFalse(validator.validateAndLog(config));

        config.adminPrefix = "!!";
        assertFalse(validator.validateAndLog(config));
    }

    @Test
    void testNumericLimits() {
        config.adminCacheTtlSeconds = 0;
        assertFalse(validator.validateAndLog(config));

        config.adminCacheTtlSeconds = 300;
        config.dispatchThreads = 0;
        assertFalse(validator.validateAndLog(config));
    }

    @Test
    void testWarningsDoNotFailValidation() {
        config.developerIds = new ArrayList<>();
        config.acknowledgementPhases = new ArrayList<>();

        List<ConfigValidator.ValidationError> errors = validator.validate(config);
        assertEquals(2, errors.size());
        assertTrue(errors.stream().noneMatch(ConfigValidator.ValidationError::isError));
        assertTrue(validator.validateAndLog(config));
    }
}
