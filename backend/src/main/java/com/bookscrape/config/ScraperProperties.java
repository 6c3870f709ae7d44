package com.bookscrape.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/117.0.0.0 Safari/537.36";
    private static final Set<String> OUTPUT_FORMATS = Set.of("csv", "json", "dual");

    private String baseUrl = "https://books.toscrape.com";
    private String userAgent;
    private int maxPages = 50;
    private int parallelism = 16;
    private int requestTimeoutMs = 10_000;
    private int requestDelayMs = 0;
    private int randomDelayMs = 0;
    private Retry retry = new Retry();
    private Pipeline pipeline = new Pipeline();
    private Output output = new Output();
    private Cli cli = new Cli();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl == null ? null : baseUrl.trim();
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxPages() {
        return Math.max(1, maxPages);
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(1, maxPages);
    }

    public int getParallelism() {
        return Math.max(1, parallelism);
    }

    public void setParallelism(int parallelism) {
        this.parallelism = Math.max(1, parallelism);
    }

    public int getRequestTimeoutMs() {
        return Math.max(1, requestTimeoutMs);
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = Math.max(1, requestTimeoutMs);
    }

    public int getRequestDelayMs() {
        return Math.max(0, requestDelayMs);
    }

    public void setRequestDelayMs(int requestDelayMs) {
        this.requestDelayMs = Math.max(0, requestDelayMs);
    }

    public int getRandomDelayMs() {
        return Math.max(0, randomDelayMs);
    }

    public void setRandomDelayMs(int randomDelayMs) {
        this.randomDelayMs = Math.max(0, randomDelayMs);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Checks the combinations the setters cannot clamp on their own.
     *
     * @throws InvalidScraperConfigException naming every offending property
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        URI base = parseBaseUrl(baseUrl);
        if (base == null) {
            problems.add("scraper.base-url must be an absolute http(s) URL with a host");
        }
        if (retry.getBackoffMaxMs() > 0 && retry.getBackoffMs() > retry.getBackoffMaxMs()) {
            problems.add("scraper.retry.backoff-ms (" + retry.getBackoffMs()
                + ") cannot exceed scraper.retry.backoff-max-ms (" + retry.getBackoffMaxMs() + ")");
        }
        if (output.getFile() == null || output.getFile().isBlank()) {
            problems.add("scraper.output.file cannot be blank");
        }
        if (!OUTPUT_FORMATS.contains(output.getFormat())) {
            problems.add("scraper.output.format must be csv, json or dual");
        }
        if (!problems.isEmpty()) {
            throw new InvalidScraperConfigException(problems);
        }
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static URI parseBaseUrl(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null) {
                return null;
            }
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                return null;
            }
            return uri;
        } catch (Exception e) {
            return null;
        }
    }

    public static class Retry {
        private int maxRetries = 2;
        private long backoffMs = 200;
        private long backoffMaxMs = 2_000;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public long getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }

        public long getBackoffMaxMs() {
            return backoffMaxMs;
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }
    }

    public static class Pipeline {
        private int bufferSize = 512;
        private int batchSize = 64;
        private long drainTimeoutMs = 5_000;
        private long metricsLogIntervalMs = 10_000;

        public int getBufferSize() {
            return Math.max(1, bufferSize);
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = Math.max(1, bufferSize);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public long getDrainTimeoutMs() {
            return Math.max(1, drainTimeoutMs);
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = Math.max(1, drainTimeoutMs);
        }

        public long getMetricsLogIntervalMs() {
            return metricsLogIntervalMs;
        }

        public void setMetricsLogIntervalMs(long metricsLogIntervalMs) {
            this.metricsLogIntervalMs = metricsLogIntervalMs;
        }
    }

    public static class Output {
        private String file = "output/books.csv";
        private String format = "csv";

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format == null ? "csv" : format.trim().toLowerCase(Locale.ROOT);
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
