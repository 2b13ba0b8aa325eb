package de.mirkosertic.corpuscoverage.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for a corpus coverage run.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.corpuscoverage/config.yaml, or the file given on the command line)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_OUTPUT_DIR = "CORPUS_OUTPUT_DIR";
    private static final String PROP_SAMPLE_FRACTION = "corpus.sample.fraction";
    private static final String PROP_SAMPLE_SEED = "corpus.sample.seed";
    private static final String PROP_OUTPUT_DIR = "corpus.output.dir";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".corpuscoverage";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Corpus settings
    private List<SourceSettings> sources = new ArrayList<>();

    // Sampling settings
    private double sampleFraction = 0.1;
    private long sampleSeed = 1001L;

    // Word lists
    private String stopwordsLocation = "classpath:wordlists/stopwords-en.txt";
    private String profanityLocation = "classpath:wordlists/profanity-en.txt";

    // Analysis settings
    private int threadPoolSize = 4;
    private int partitions = 8;
    private int topWordsPerSource = 20;
    private List<GranularitySettings> granularities = GranularitySettings.defaults();

    // Output
    private String outputDirectory;

    // Profile settings
    private boolean batchMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(null);
    }

    /**
     * Load configuration, reading {@code configFile} instead of the user config file when given.
     */
    public static ApplicationConfig load(final @Nullable Path configFile) {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(configFile != null ? configFile : getUserConfigPath(), configFile != null);

        // Step 3: Apply system properties and environment variables (highest priority)
        config.applyOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        config.validate();

        logger.info("Configuration loaded: sources={}, sampleFraction={}, seed={}, granularities={}, outputDirectory={}",
                config.sources.size(), config.sampleFraction, config.sampleSeed,
                config.granularities.size(), config.outputDirectory);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath, final boolean required) {
        if (!Files.exists(configPath)) {
            if (required) {
                throw new ConfigurationException("Config file does not exist: " + configPath);
            }
            return;
        }
        try (final InputStream is = Files.newInputStream(configPath)) {
            final Yaml yaml = new Yaml();
            final Map<String, Object> config = yaml.load(is);
            if (config != null) {
                applyYamlConfig(config);
                logger.debug("Loaded config from: {}", configPath);
            }
        } catch (final IOException e) {
            if (required) {
                throw new ConfigurationException("Failed to read config file: " + configPath, e);
            }
            logger.warn("Failed to load user config from: {}", configPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to corpus section
        final Map<String, Object> corpusConfig = (Map<String, Object>) config.get("corpus");
        if (corpusConfig == null) {
            return;
        }

        if (corpusConfig.containsKey("sources")) {
            final Object list = corpusConfig.get("sources");
            if (list instanceof List) {
                final List<SourceSettings> parsed = new ArrayList<>();
                for (final Object entry : (List<Object>) list) {
                    final Map<String, Object> source = (Map<String, Object>) entry;
                    parsed.add(new SourceSettings(
                            String.valueOf(source.get("name")),
                            resolveVariables(String.valueOf(source.get("path")))));
                }
                this.sources = parsed;
            }
        }

        final Map<String, Object> sampleConfig = (Map<String, Object>) corpusConfig.get("sample");
        if (sampleConfig != null) {
            if (sampleConfig.containsKey("fraction")) {
                this.sampleFraction = ((Number) sampleConfig.get("fraction")).doubleValue();
            }
            if (sampleConfig.containsKey("seed")) {
                this.sampleSeed = ((Number) sampleConfig.get("seed")).longValue();
            }
        }

        final Map<String, Object> wordlistConfig = (Map<String, Object>) corpusConfig.get("wordlists");
        if (wordlistConfig != null) {
            if (wordlistConfig.containsKey("stopwords")) {
                this.stopwordsLocation = resolveVariables(wordlistConfig.get("stopwords").toString());
            }
            if (wordlistConfig.containsKey("profanity")) {
                this.profanityLocation = resolveVariables(wordlistConfig.get("profanity").toString());
            }
        }

        final Map<String, Object> analysisConfig = (Map<String, Object>) corpusConfig.get("analysis");
        if (analysisConfig != null) {
            applyAnalysisConfig(analysisConfig);
        }

        final Map<String, Object> outputConfig = (Map<String, Object>) corpusConfig.get("output");
        if (outputConfig != null && outputConfig.get("directory") != null) {
            this.outputDirectory = resolveVariables(outputConfig.get("directory").toString());
        }
    }

    @SuppressWarnings("unchecked")
    private void applyAnalysisConfig(final Map<String, Object> analysisConfig) {
        if (analysisConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) analysisConfig.get("thread-pool-size")).intValue();
        }
        if (analysisConfig.containsKey("partitions")) {
            this.partitions = ((Number) analysisConfig.get("partitions")).intValue();
        }
        if (analysisConfig.containsKey("top-words-per-source")) {
            this.topWordsPerSource = ((Number) analysisConfig.get("top-words-per-source")).intValue();
        }
        if (analysisConfig.containsKey("granularities")) {
            final Object list = analysisConfig.get("granularities");
            if (list instanceof List) {
                final List<GranularitySettings> parsed = new ArrayList<>();
                for (final Object entry : (List<Object>) list) {
                    final Map<String, Object> granularity = (Map<String, Object>) entry;
                    final List<Double> thresholds = new ArrayList<>();
                    final Object rawThresholds = granularity.get("thresholds");
                    if (rawThresholds instanceof List) {
                        for (final Object threshold : (List<Object>) rawThresholds) {
                            thresholds.add(((Number) threshold).doubleValue());
                        }
                    }
                    parsed.add(new GranularitySettings(
                            String.valueOf(granularity.get("name")),
                            ((Number) granularity.getOrDefault("n", 1)).intValue(),
                            Boolean.TRUE.equals(granularity.get("filtered")),
                            thresholds));
                }
                this.granularities = parsed;
            }
        }
    }

    private void applyOverrides() {
        final String propFraction = System.getProperty(PROP_SAMPLE_FRACTION);
        if (propFraction != null && !propFraction.isBlank()) {
            this.sampleFraction = parseDouble(PROP_SAMPLE_FRACTION, propFraction);
        }

        final String propSeed = System.getProperty(PROP_SAMPLE_SEED);
        if (propSeed != null && !propSeed.isBlank()) {
            try {
                this.sampleSeed = Long.parseLong(propSeed.trim());
            } catch (final NumberFormatException e) {
                throw new ConfigurationException("Invalid " + PROP_SAMPLE_SEED + ": " + propSeed, e);
            }
        }

        final String propOutput = System.getProperty(PROP_OUTPUT_DIR);
        if (propOutput != null && !propOutput.isBlank()) {
            this.outputDirectory = propOutput.trim();
        }

        // Output directory from environment
        final String envOutput = System.getenv(ENV_OUTPUT_DIR);
        if (envOutput != null && !envOutput.trim().isEmpty()) {
            this.outputDirectory = envOutput.trim();
            logger.info("Output directory from environment: {}", this.outputDirectory);
        }

        // Default output directory if not set
        if (this.outputDirectory == null || this.outputDirectory.isEmpty()) {
            this.outputDirectory = Paths.get("clean_repos").toString();
        }
    }

    private static double parseDouble(final String key, final String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (final NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + ": " + value, e);
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.batchMode = "batch".equalsIgnoreCase(profile);
    }

    private void validate() {
        if (!(sampleFraction > 0.0 && sampleFraction <= 1.0)) {
            throw new ConfigurationException("Sample fraction must be in (0, 1], got " + sampleFraction);
        }
        if (threadPoolSize < 1) {
            throw new ConfigurationException("thread-pool-size must be positive, got " + threadPoolSize);
        }
        if (partitions < 1) {
            throw new ConfigurationException("partitions must be positive, got " + partitions);
        }
        if (sources.isEmpty()) {
            throw new ConfigurationException("No corpus sources configured");
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public List<SourceSettings> getSources() {
        return sources;
    }

    public double getSampleFraction() {
        return sampleFraction;
    }

    public long getSampleSeed() {
        return sampleSeed;
    }

    public String getStopwordsLocation() {
        return stopwordsLocation;
    }

    public String getProfanityLocation() {
        return profanityLocation;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getPartitions() {
        return partitions;
    }

    public int getTopWordsPerSource() {
        return topWordsPerSource;
    }

    public List<GranularitySettings> getGranularities() {
        return granularities;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public boolean isBatchMode() {
        return batchMode;
    }
}
