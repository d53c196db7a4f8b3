package com.nodepulse.importer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AppConfig} validation logic.
 */
class AppConfigTest {

    @Test
    @DisplayName("Test constructor creates config with valid values")
    void validConfig() {
        AppConfig config = new AppConfig("my-project", "/secrets/key.json");

        assertEquals("my-project", config.getGcpProjectId());
        assertEquals("/secrets/key.json", config.getGoogleApplicationCredentials());
    }

    @Test
    @DisplayName("Credentials file is optional")
    void credentialsOptional() {
        AppConfig config = new AppConfig("my-project", null);

        assertNull(config.getGoogleApplicationCredentials());
    }

    @Test
    @DisplayName("Throws when IMPORTER_GCP_PROJECT_ID is missing")
    void missingProject_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("", null));

        assertTrue(ex.getMessage().contains("IMPORTER_GCP_PROJECT_ID"));
    }

    @Test
    @DisplayName("Throws when values are blank (whitespace only)")
    void blankValues_throws() {
        assertThrows(IllegalStateException.class, () -> new AppConfig("  ", "/key.json"));
    }
}
