package com.nodepulse.importer.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink credentials resolved from environment variables, falling back to a
 * {@code .env} file in the working directory (dotenv-java). Used when the
 * importer runs with {@code --authenv}.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String PROJECT_ID_VAR = "IMPORTER_GCP_PROJECT_ID";
    static final String CREDENTIALS_VAR = "GOOGLE_APPLICATION_CREDENTIALS";

    private final String gcpProjectId;
    private final String googleApplicationCredentials;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.gcpProjectId = resolve(dotenv, PROJECT_ID_VAR);
        this.googleApplicationCredentials = resolveOptional(dotenv, CREDENTIALS_VAR);

        validate();

        logger.info("Credentials resolved from environment: gcpProjectId={}, credentialsFile={}",
                gcpProjectId, googleApplicationCredentials != null ? googleApplicationCredentials : "default");
    }

    /**
     * Constructor for testing. Accepts values directly.
     */
    public AppConfig(String gcpProjectId, String googleApplicationCredentials) {
        this.gcpProjectId = gcpProjectId;
        this.googleApplicationCredentials = googleApplicationCredentials;

        validate();
    }

    private void validate() {
        if (isBlank(gcpProjectId)) {
            throw new IllegalStateException("Missing required environment variables: " + PROJECT_ID_VAR);
        }
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null ? dotenvValue : "";
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return isBlank(dotenvValue) ? null : dotenvValue;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getGcpProjectId() {
        return gcpProjectId;
    }

    public String getGoogleApplicationCredentials() {
        return googleApplicationCredentials;
    }
}
