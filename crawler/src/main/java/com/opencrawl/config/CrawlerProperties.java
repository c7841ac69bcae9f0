package com.opencrawl.config;

import com.opencrawl.crawl.model.ExtractionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "OpenCrawl/0.1.0";

    private String userAgent;
    private int maxConcurrentRequests = 5;
    private int workerThreads = 0;
    private int requestTimeoutSeconds = 30;
    private boolean sslVerify = true;
    private boolean followRedirects = true;
    private int maxRedirects = 10;
    private Map<String, String> defaultHeaders = new LinkedHashMap<>();
    private Map<String, String> defaultCookies = new LinkedHashMap<>();
    private Retry retry = new Retry();
    private Proxy proxy = new Proxy();
    private Extraction extraction = new Extraction();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxConcurrentRequests() {
        return Math.max(1, maxConcurrentRequests);
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
    }

    /**
     * Size of the worker pool that runs batch requests. Zero means "one worker per
     * concurrency slot".
     */
    public int getWorkerThreads() {
        return workerThreads <= 0 ? getMaxConcurrentRequests() : workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = Math.max(0, workerThreads);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public boolean isSslVerify() {
        return sslVerify;
    }

    public void setSslVerify(boolean sslVerify) {
        this.sslVerify = sslVerify;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public void setFollowRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
    }

    public int getMaxRedirects() {
        return Math.max(0, maxRedirects);
    }

    public void setMaxRedirects(int maxRedirects) {
        this.maxRedirects = Math.max(0, maxRedirects);
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public void setDefaultHeaders(Map<String, String> defaultHeaders) {
        this.defaultHeaders = defaultHeaders == null ? new LinkedHashMap<>() : defaultHeaders;
    }

    public Map<String, String> getDefaultCookies() {
        return defaultCookies;
    }

    public void setDefaultCookies(Map<String, String> defaultCookies) {
        this.defaultCookies = defaultCookies == null ? new LinkedHashMap<>() : defaultCookies;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    /**
     * Immutable snapshot handed to a crawler instance. Later changes to this bean do not
     * affect crawlers already built from it.
     */
    public CrawlerConfig toConfig() {
        return new CrawlerConfig(
            getMaxConcurrentRequests(),
            getWorkerThreads(),
            Duration.ofSeconds(getRequestTimeoutSeconds()),
            getUserAgent(),
            defaultHeaders,
            defaultCookies,
            sslVerify,
            followRedirects,
            getMaxRedirects(),
            new RetrySettings(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseDelayMs()),
                retry.getBackoffFactor(),
                Duration.ofMillis(retry.getMaxDelayMs())
            ),
            new ProxySettings(
                proxy.getAddresses(),
                proxy.getFile(),
                proxy.getTestUrl(),
                Duration.ofSeconds(proxy.getProbeTimeoutSeconds()),
                proxy.getFailureThreshold(),
                Duration.ofSeconds(proxy.getRevalidateAfterSeconds())
            ),
            new ExtractionSettings(
                extraction.getStrategy(),
                extraction.isStripScripts(),
                extraction.isStripStyles(),
                extraction.isStripComments(),
                extraction.isStripNav(),
                extraction.isStripHeaders(),
                extraction.isStripFooters(),
                extraction.getMinTextLength(),
                extraction.isExtractMetadata(),
                extraction.isExtractLinks(),
                extraction.isExtractImages(),
                extraction.getMaxBodyBytes()
            )
        );
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private double backoffFactor = 2.0;
        private long maxDelayMs = 30_000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public double getBackoffFactor() {
            return Math.max(1.0, backoffFactor);
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = Math.max(1.0, backoffFactor);
        }

        public long getMaxDelayMs() {
            return Math.max(getBaseDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Proxy {
        private List<String> addresses = new ArrayList<>();
        private String file;
        private String testUrl = "http://httpbin.org/ip";
        private int probeTimeoutSeconds = 5;
        private int failureThreshold = 3;
        private int revalidateAfterSeconds = 600;

        public List<String> getAddresses() {
            return addresses;
        }

        public void setAddresses(List<String> addresses) {
            this.addresses = addresses == null ? new ArrayList<>() : addresses;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getTestUrl() {
            return testUrl;
        }

        public void setTestUrl(String testUrl) {
            this.testUrl = testUrl;
        }

        public int getProbeTimeoutSeconds() {
            return Math.max(1, probeTimeoutSeconds);
        }

        public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
            this.probeTimeoutSeconds = Math.max(1, probeTimeoutSeconds);
        }

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public int getRevalidateAfterSeconds() {
            return Math.max(0, revalidateAfterSeconds);
        }

        public void setRevalidateAfterSeconds(int revalidateAfterSeconds) {
            this.revalidateAfterSeconds = Math.max(0, revalidateAfterSeconds);
        }
    }

    public static class Extraction {
        private ExtractionStrategy strategy = ExtractionStrategy.CONTENT;
        private boolean stripScripts = true;
        private boolean stripStyles = true;
        private boolean stripComments = true;
        private boolean stripNav = false;
        private boolean stripHeaders = false;
        private boolean stripFooters = false;
        private int minTextLength = 10;
        private boolean extractMetadata = true;
        private boolean extractLinks = true;
        private boolean extractImages = true;
        private int maxBodyBytes = 5_000_000;

        public ExtractionStrategy getStrategy() {
            return strategy == null ? ExtractionStrategy.CONTENT : strategy;
        }

        public void setStrategy(ExtractionStrategy strategy) {
            this.strategy = strategy;
        }

        public boolean isStripScripts() {
            return stripScripts;
        }

        public void setStripScripts(boolean stripScripts) {
            this.stripScripts = stripScripts;
        }

        public boolean isStripStyles() {
            return stripStyles;
        }

        public void setStripStyles(boolean stripStyles) {
            this.stripStyles = stripStyles;
        }

        public boolean isStripComments() {
            return stripComments;
        }

        public void setStripComments(boolean stripComments) {
            this.stripComments = stripComments;
        }

        public boolean isStripNav() {
            return stripNav;
        }

        public void setStripNav(boolean stripNav) {
            this.stripNav = stripNav;
        }

        public boolean isStripHeaders() {
            return stripHeaders;
        }

        public void setStripHeaders(boolean stripHeaders) {
            this.stripHeaders = stripHeaders;
        }

        public boolean isStripFooters() {
            return stripFooters;
        }

        public void setStripFooters(boolean stripFooters) {
            this.stripFooters = stripFooters;
        }

        public int getMinTextLength() {
            return Math.max(0, minTextLength);
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = Math.max(0, minTextLength);
        }

        public boolean isExtractMetadata() {
            return extractMetadata;
        }

        public void setExtractMetadata(boolean extractMetadata) {
            this.extractMetadata = extractMetadata;
        }

        public boolean isExtractLinks() {
            return extractLinks;
        }

        public void setExtractLinks(boolean extractLinks) {
            this.extractLinks = extractLinks;
        }

        public boolean isExtractImages() {
            return extractImages;
        }

        public void setExtractImages(boolean extractImages) {
            this.extractImages = extractImages;
        }

        public int getMaxBodyBytes() {
            return Math.max(ExtractionSettings.MIN_BODY_BYTES, maxBodyBytes);
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = Math.max(ExtractionSettings.MIN_BODY_BYTES, maxBodyBytes);
        }
    }

    public static class Cli {
        private boolean run;
        private String urls = "";
        private String urlsFile;
        private String output = "crawl-results.json";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUrls() {
            return urls;
        }

        public void setUrls(String urls) {
            this.urls = urls;
        }

        public String getUrlsFile() {
            return urlsFile;
        }

        public void setUrlsFile(String urlsFile) {
            this.urlsFile = urlsFile;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
