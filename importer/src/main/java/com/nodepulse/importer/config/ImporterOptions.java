package com.nodepulse.importer.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Command-line settings of the importer.
 *
 * <p>Run {@code --help} for the flag list. Explicit {@code --project} and
 * {@code --credentials} win over values resolved through {@code --authenv}.
 * The failed and processed directories default to {@code failed} and
 * {@code processed} below the input directory.</p>
 */
public final class ImporterOptions {

    public static final String DEFAULT_INDIR = "/indir";

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: importer -k DATASET [options]",
            "",
            "Parses .json files below the input directory and inserts them into",
            "BigQuery. All directories and the dataset must exist before start.",
            "",
            "  -k, --dataset NAME       Dataset to insert into (required)",
            "      --project ID         GCP project id",
            "      --credentials FILE   Service account key file",
            "      --authenv            Read " + AppConfig.PROJECT_ID_VAR + " and "
                    + AppConfig.CREDENTIALS_VAR + " from env/.env",
            "  -i, --interval N         Seconds between scans (default -1, run once)",
            "  -c, --concurrency N      Number of workers (default 1, max available processors)",
            "  -I, --indir DIR          Directory to scan (default " + DEFAULT_INDIR + ")",
            "  -F, --failed DIR         Failed files (default INDIR/failed)",
            "  -P, --processed DIR      Processed files (default INDIR/processed)",
            "      --validate           Validate records before import",
            "  -V, --verbosity N        Validator verbosity (default 0)",
            "      --debug              Do not execute inserts or move files",
            "  -h, --help               Show this help");

    private String dataset;
    private String projectId;
    private String credentialsFile;
    private boolean authEnv;
    private int intervalSeconds = -1;
    private int concurrency = 1;
    private Path inputDir = Path.of(DEFAULT_INDIR);
    private Path failedDir;
    private Path processedDir;
    private boolean validate;
    private int verbosity;
    private boolean debug;
    private boolean help;

    private ImporterOptions() {
    }

    public static ImporterOptions parse(String[] args) {
        return parse(args, Runtime.getRuntime().availableProcessors());
    }

    /**
     * @throws IllegalArgumentException naming the offending flag
     */
    static ImporterOptions parse(String[] args, int maxConcurrency) {
        ImporterOptions options = new ImporterOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-k", "--dataset" -> options.dataset = value(args, ++i, arg);
                case "--project" -> options.projectId = value(args, ++i, arg);
                case "--credentials" -> options.credentialsFile = value(args, ++i, arg);
                case "--authenv" -> options.authEnv = true;
                case "-i", "--interval" -> options.intervalSeconds = intValue(args, ++i, arg);
                case "-c", "--concurrency" -> options.concurrency = intValue(args, ++i, arg);
                case "-I", "--indir" -> options.inputDir = Path.of(value(args, ++i, arg));
                case "-F", "--failed" -> options.failedDir = Path.of(value(args, ++i, arg));
                case "-P", "--processed" -> options.processedDir = Path.of(value(args, ++i, arg));
                case "--validate" -> options.validate = true;
                case "-V", "--verbosity" -> options.verbosity = intValue(args, ++i, arg);
                case "--debug" -> options.debug = true;
                case "-h", "--help" -> options.help = true;
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        if (!options.help) {
            options.check(maxConcurrency);
        }
        return options;
    }

    private void check(int maxConcurrency) {
        if (dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("-k/--dataset is required");
        }
        if (concurrency < 1 || concurrency > maxConcurrency) {
            throw new IllegalArgumentException(String.format(
                    "-c/--concurrency must be between 1 and %d, was %d", maxConcurrency, concurrency));
        }
        if (verbosity < 0) {
            throw new IllegalArgumentException("-V/--verbosity must not be negative, was " + verbosity);
        }
        if (!debug && !authEnv && (projectId == null || projectId.isBlank())) {
            throw new IllegalArgumentException("either --authenv or --project PROJECT needs to be defined");
        }
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    // numeric values may be negative, so a leading '-' is not a missing value here
    private static int intValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        String raw = args[index];
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number, got '" + raw + "'");
        }
    }

    /**
     * Project id from {@code --project}, else from {@code environment}.
     *
     * @param environment resolved environment, or {@code null} without {@code --authenv}
     */
    public String resolveProjectId(AppConfig environment) {
        if (projectId != null && !projectId.isBlank()) {
            return projectId;
        }
        return environment != null ? environment.getGcpProjectId() : null;
    }

    /**
     * Credentials file from {@code --credentials}, else from {@code environment},
     * else {@code null} for application default credentials.
     */
    public String resolveCredentialsFile(AppConfig environment) {
        if (credentialsFile != null && !credentialsFile.isBlank()) {
            return credentialsFile;
        }
        return environment != null ? environment.getGoogleApplicationCredentials() : null;
    }

    public static String usage() {
        return USAGE;
    }

    public String getDataset() {
        return dataset;
    }

    public String getCredentialsFile() {
        return credentialsFile;
    }

    public boolean isAuthEnv() {
        return authEnv;
    }

    public Duration getInterval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public int getConcurrency() {
        return concurrency;
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getFailedDir() {
        return failedDir != null ? failedDir : inputDir.resolve("failed");
    }

    public Path getProcessedDir() {
        return processedDir != null ? processedDir : inputDir.resolve("processed");
    }

    public boolean isValidate() {
        return validate;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public boolean isDebug() {
        return debug;
    }

    public boolean isHelp() {
        return help;
    }

    @Override
    public String toString() {
        return "dataset=" + dataset
                + ", project=" + projectId
                + ", authenv=" + authEnv
                + ", indir=" + inputDir
                + ", failed=" + getFailedDir()
                + ", processed=" + getProcessedDir()
                + ", interval=" + intervalSeconds
                + ", concurrency=" + concurrency
                + ", validate=" + validate
                + ", debug=" + debug;
    }
}
