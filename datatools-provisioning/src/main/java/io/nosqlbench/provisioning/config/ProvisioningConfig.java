package io.nosqlbench.provisioning.config;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Immutable settings shared by every orchestrator.
///
/// Values come from {@link #builder()} or from an optional `provisioning.yaml` read by
/// {@link #load(Path)}. YAML keys are the kebab-case forms of the builder names, for example
/// `storage-root`, `hub-base-url` or `max-concurrent-requests`. Durations are either a number
/// of seconds or an ISO-8601 duration such as `PT1.5S`.
public final class ProvisioningConfig {

    private static final Logger logger = LogManager.getLogger(ProvisioningConfig.class);

    /// The file name {@link #load(Path)} looks for
    public static final String CONFIG_FILE = "provisioning.yaml";

    /// Extensions of dataset files that are downloaded by default
    public static final Set<String> DEFAULT_DATASET_EXTENSIONS =
        Set.of("pdf", "epub", "txt", "md", "json", "jsonl", "csv", "tsv");

    private final Path storageRoot;
    private final String hubBaseUrl;
    private final String hubToken;
    private final int maxConcurrentRequests;
    private final Duration metadataTimeout;
    private final Duration finishedGrace;
    private final Duration failedGrace;
    private final Duration maxBackoff;
    private final double emaAlpha;
    private final Duration staleWindow;
    private final Duration sampleInterval;
    private final Duration uiTick;
    private final double maxInstantSpeed;
    private final Duration sweepInterval;
    private final double finalizeThreshold;
    private final double activeProgressCeiling;
    private final Set<String> datasetExtensions;
    private final String bundleRepository;
    private final String userAgent;

    private ProvisioningConfig(Builder b) {
        this.storageRoot = b.storageRoot;
        this.hubBaseUrl = stripTrailingSlash(b.hubBaseUrl);
        this.hubToken = b.hubToken;
        this.maxConcurrentRequests = b.maxConcurrentRequests;
        this.metadataTimeout = b.metadataTimeout;
        this.finishedGrace = b.finishedGrace;
        this.failedGrace = b.failedGrace;
        this.maxBackoff = b.maxBackoff;
        this.emaAlpha = b.emaAlpha;
        this.staleWindow = b.staleWindow;
        this.sampleInterval = b.sampleInterval;
        this.uiTick = b.uiTick;
        this.maxInstantSpeed = b.maxInstantSpeed;
        this.sweepInterval = b.sweepInterval;
        this.finalizeThreshold = b.finalizeThreshold;
        this.activeProgressCeiling = b.activeProgressCeiling;
        this.datasetExtensions = Set.copyOf(b.datasetExtensions);
        this.bundleRepository = b.bundleRepository;
        this.userAgent = b.userAgent;
    }

    /// @return a builder primed with the defaults
    public static Builder builder() {
        return new Builder();
    }

    /// @return the default configuration
    public static ProvisioningConfig defaults() {
        return builder().build();
    }

    /// Loads `provisioning.yaml` from the directory when present.
    ///
    /// @param configDir the directory to look in, `~` is expanded to the user home
    /// @return the configuration, or the defaults when no file exists
    /// @throws IllegalArgumentException when the file is not a valid settings document
    public static ProvisioningConfig load(Path configDir) {
        Path dir = expandHome(configDir);
        Path file = dir.resolve(CONFIG_FILE);
        if (!Files.exists(file)) {
            logger.debug("no {} in {}, using defaults", CONFIG_FILE, dir);
            return defaults();
        }
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read " + file, e);
        }
        Object document;
        try {
            Load yaml = new Load(LoadSettings.builder().build());
            document = yaml.loadFromString(text);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException(file + " is not valid YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return defaults();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(file + " must contain a mapping of settings");
        }
        Builder builder = builder();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            apply(builder, String.valueOf(entry.getKey()), entry.getValue(), file);
        }
        logger.info("loaded provisioning settings from {}", file);
        return builder.build();
    }

    private static void apply(Builder b, String key, Object value, Path file) {
        try {
            switch (key) {
                case "storage-root" -> b.withStorageRoot(expandHome(Path.of(text(value))));
                case "hub-base-url" -> b.withHubBaseUrl(text(value));
                case "hub-token" -> b.withHubToken(text(value));
                case "max-concurrent-requests" -> b.withMaxConcurrentRequests(number(value).intValue());
                case "metadata-timeout" -> b.withMetadataTimeout(duration(value));
                case "finished-grace" -> b.withFinishedGrace(duration(value));
                case "failed-grace" -> b.withFailedGrace(duration(value));
                case "max-backoff" -> b.withMaxBackoff(duration(value));
                case "ema-alpha" -> b.withEmaAlpha(number(value).doubleValue());
                case "stale-window" -> b.withStaleWindow(duration(value));
                case "sample-interval" -> b.withSampleInterval(duration(value));
                case "ui-tick" -> b.withUiTick(duration(value));
                case "max-instant-speed" -> b.withMaxInstantSpeed(number(value).doubleValue());
                case "sweep-interval" -> b.withSweepInterval(duration(value));
                case "finalize-threshold" -> b.withFinalizeThreshold(number(value).doubleValue());
                case "active-progress-ceiling" -> b.withActiveProgressCeiling(number(value).doubleValue());
                case "dataset-extensions" -> b.withDatasetExtensions(list(value));
                case "bundle-repository" -> b.withBundleRepository(text(value));
                case "user-agent" -> b.withUserAgent(text(value));
                default -> logger.warn("ignoring unknown setting '{}' in {}", key, file);
            }
        } catch (ClassCastException | DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for '" + key + "' in " + file + ": " + value, e);
        }
    }

    private static String text(Object value) {
        if (value == null) {
            throw new ClassCastException("null");
        }
        return String.valueOf(value);
    }

    private static Number number(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        return Double.valueOf(text(value));
    }

    private static Duration duration(Object value) {
        if (value instanceof Number n) {
            return Duration.ofMillis(Math.round(n.doubleValue() * 1000d));
        }
        String s = text(value).trim();
        if (s.toUpperCase(Locale.ROOT).startsWith("P")) {
            return Duration.parse(s);
        }
        return Duration.ofMillis(Math.round(Double.parseDouble(s) * 1000d));
    }

    private static List<String> list(Object value) {
        if (value instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).toList();
        }
        throw new ClassCastException("expected a list");
    }

    /// @param path a path that may start with `~`
    /// @return the path with a leading `~` replaced by the user home
    public static Path expandHome(Path path) {
        String s = path.toString();
        if (s.equals("~") || s.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + s.substring(1));
        }
        return path;
    }

    private static String stripTrailingSlash(String url) {
        String s = url.trim();
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    public Path storageRoot() {
        return storageRoot;
    }

    public String hubBaseUrl() {
        return hubBaseUrl;
    }

    /// @return the bearer token, or null when requests are anonymous
    public String hubToken() {
        return hubToken;
    }

    public int maxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public Duration metadataTimeout() {
        return metadataTimeout;
    }

    public Duration finishedGrace() {
        return finishedGrace;
    }

    public Duration failedGrace() {
        return failedGrace;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public double emaAlpha() {
        return emaAlpha;
    }

    public Duration staleWindow() {
        return staleWindow;
    }

    public Duration sampleInterval() {
        return sampleInterval;
    }

    public Duration uiTick() {
        return uiTick;
    }

    /// @return the ceiling for one instantaneous speed sample, in bytes per second
    public double maxInstantSpeed() {
        return maxInstantSpeed;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public double finalizeThreshold() {
        return finalizeThreshold;
    }

    public double activeProgressCeiling() {
        return activeProgressCeiling;
    }

    public Set<String> datasetExtensions() {
        return datasetExtensions;
    }

    /// @return the hub repository that publishes SLM bundles
    public String bundleRepository() {
        return bundleRepository;
    }

    public String userAgent() {
        return userAgent;
    }

    /// Fluent builder for {@link ProvisioningConfig}.
    public static final class Builder {
        private Path storageRoot = expandHome(Path.of("~/.cache/provisioning"));
        private String hubBaseUrl = "https://huggingface.co";
        private String hubToken;
        private int maxConcurrentRequests = 2;
        private Duration metadataTimeout = Duration.ofSeconds(10);
        private Duration finishedGrace = Duration.ofSeconds(3);
        private Duration failedGrace = Duration.ofSeconds(5);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private double emaAlpha = 0.30;
        private Duration staleWindow = Duration.ofMillis(1250);
        private Duration sampleInterval = Duration.ofMillis(250);
        private Duration uiTick = Duration.ofMillis(100);
        private double maxInstantSpeed = 512d * 1024 * 1024;
        private Duration sweepInterval = Duration.ofSeconds(1);
        private double finalizeThreshold = 0.995;
        private double activeProgressCeiling = 0.999;
        private Set<String> datasetExtensions = new LinkedHashSet<>(DEFAULT_DATASET_EXTENSIONS);
        private String bundleRepository = "nosqlbench/slm-bundles";
        private String userAgent = "datatools-provisioning";

        private Builder() {
        }

        public Builder withStorageRoot(Path storageRoot) {
            this.storageRoot = storageRoot;
            return this;
        }

        public Builder withHubBaseUrl(String hubBaseUrl) {
            this.hubBaseUrl = hubBaseUrl;
            return this;
        }

        public Builder withHubToken(String hubToken) {
            this.hubToken = (hubToken == null || hubToken.isBlank()) ? null : hubToken.trim();
            return this;
        }

        public Builder withMaxConcurrentRequests(int maxConcurrentRequests) {
            if (maxConcurrentRequests < 1) {
                throw new IllegalArgumentException("maxConcurrentRequests must be at least 1");
            }
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder withMetadataTimeout(Duration metadataTimeout) {
            this.metadataTimeout = metadataTimeout;
            return this;
        }

        public Builder withFinishedGrace(Duration finishedGrace) {
            this.finishedGrace = finishedGrace;
            return this;
        }

        public Builder withFailedGrace(Duration failedGrace) {
            this.failedGrace = failedGrace;
            return this;
        }

        public Builder withMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder withEmaAlpha(double emaAlpha) {
            if (emaAlpha <= 0 || emaAlpha > 1) {
                throw new IllegalArgumentException("emaAlpha must be in (0,1]: " + emaAlpha);
            }
            this.emaAlpha = emaAlpha;
            return this;
        }

        public Builder withStaleWindow(Duration staleWindow) {
            this.staleWindow = staleWindow;
            return this;
        }

        public Builder withSampleInterval(Duration sampleInterval) {
            this.sampleInterval = sampleInterval;
            return this;
        }

        public Builder withUiTick(Duration uiTick) {
            this.uiTick = uiTick;
            return this;
        }

        public Builder withMaxInstantSpeed(double maxInstantSpeed) {
            this.maxInstantSpeed = maxInstantSpeed;
            return this;
        }

        public Builder withSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder withFinalizeThreshold(double finalizeThreshold) {
            this.finalizeThreshold = finalizeThreshold;
            return this;
        }

        public Builder withActiveProgressCeiling(double activeProgressCeiling) {
            if (activeProgressCeiling <= 0 || activeProgressCeiling >= 1) {
                throw new IllegalArgumentException("activeProgressCeiling must be in (0,1): " + activeProgressCeiling);
            }
            this.activeProgressCeiling = activeProgressCeiling;
            return this;
        }

        public Builder withDatasetExtensions(Collection<String> extensions) {
            Set<String> normalized = new LinkedHashSet<>();
            for (String ext : extensions) {
                String e = ext.trim().toLowerCase(Locale.ROOT);
                normalized.add(e.startsWith(".") ? e.substring(1) : e);
            }
            this.datasetExtensions = normalized;
            return this;
        }

        public Builder withBundleRepository(String bundleRepository) {
            this.bundleRepository = bundleRepository;
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public ProvisioningConfig build() {
            return new ProvisioningConfig(this);
        }
    }
}
