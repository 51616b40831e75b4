package com.delta.signaltracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {
    private static final String DEFAULT_USER_AGENT = "delta-signal-tracker/0.1 (+contact)";

    private String userAgent;
    private int globalConcurrency = 5;
    private int minDelayBetweenStartsMs = 0;
    private int acquireTimeoutMs = 30_000;
    private int fetchTimeoutSeconds = 120;
    private int fetchMaxAttempts = 2;
    private int fetchRetryBaseDelayMs = 500;
    private int fetchRetryMaxDelayMs = 5_000;
    private int quotaBackoffSeconds = 60;
    private int requestTimeoutSeconds = 20;
    private int maxConcurrentRuns = 2;
    private List<String> activeSources = new ArrayList<>();
    private Throttle throttle = new Throttle();
    private Filter filter = new Filter();
    private Embedding embedding = new Embedding();
    private Map<String, Source> sources = new LinkedHashMap<>();
    private Sink sink = new Sink();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getMinDelayBetweenStartsMs() {
        return Math.max(0, minDelayBetweenStartsMs);
    }

    public void setMinDelayBetweenStartsMs(int minDelayBetweenStartsMs) {
        this.minDelayBetweenStartsMs = Math.max(0, minDelayBetweenStartsMs);
    }

    public int getAcquireTimeoutMs() {
        return Math.max(0, acquireTimeoutMs);
    }

    public void setAcquireTimeoutMs(int acquireTimeoutMs) {
        this.acquireTimeoutMs = Math.max(0, acquireTimeoutMs);
    }

    public Duration acquireTimeout() {
        return Duration.ofMillis(getAcquireTimeoutMs());
    }

    public int getFetchTimeoutSeconds() {
        return Math.max(1, fetchTimeoutSeconds);
    }

    public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
        this.fetchTimeoutSeconds = Math.max(1, fetchTimeoutSeconds);
    }

    public int getFetchMaxAttempts() {
        return Math.max(1, fetchMaxAttempts);
    }

    public void setFetchMaxAttempts(int fetchMaxAttempts) {
        this.fetchMaxAttempts = Math.max(1, fetchMaxAttempts);
    }

    public int getFetchRetryBaseDelayMs() {
        return Math.max(0, fetchRetryBaseDelayMs);
    }

    public void setFetchRetryBaseDelayMs(int fetchRetryBaseDelayMs) {
        this.fetchRetryBaseDelayMs = Math.max(0, fetchRetryBaseDelayMs);
    }

    public int getFetchRetryMaxDelayMs() {
        return Math.max(0, fetchRetryMaxDelayMs);
    }

    public void setFetchRetryMaxDelayMs(int fetchRetryMaxDelayMs) {
        this.fetchRetryMaxDelayMs = Math.max(0, fetchRetryMaxDelayMs);
    }

    public int getQuotaBackoffSeconds() {
        return Math.max(1, quotaBackoffSeconds);
    }

    public void setQuotaBackoffSeconds(int quotaBackoffSeconds) {
        this.quotaBackoffSeconds = Math.max(1, quotaBackoffSeconds);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxConcurrentRuns() {
        return Math.max(1, maxConcurrentRuns);
    }

    public void setMaxConcurrentRuns(int maxConcurrentRuns) {
        this.maxConcurrentRuns = Math.max(1, maxConcurrentRuns);
    }

    public List<String> getActiveSources() {
        return activeSources;
    }

    public void setActiveSources(List<String> activeSources) {
        this.activeSources = activeSources == null ? new ArrayList<>() : activeSources;
    }

    public Throttle getThrottle() {
        return throttle;
    }

    public void setThrottle(Throttle throttle) {
        this.throttle = throttle;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public Sink getSink() {
        return sink;
    }

    public void setSink(Sink sink) {
        this.sink = sink;
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

    public static class Throttle {
        private int defaultCapacity = 5;
        private double defaultRefillPerSecond = 1.0;
        private Map<String, Bucket> sources = new LinkedHashMap<>();

        public int getDefaultCapacity() {
            return Math.max(1, defaultCapacity);
        }

        public void setDefaultCapacity(int defaultCapacity) {
            this.defaultCapacity = Math.max(1, defaultCapacity);
        }

        public double getDefaultRefillPerSecond() {
            return defaultRefillPerSecond > 0 ? defaultRefillPerSecond : 1.0;
        }

        public void setDefaultRefillPerSecond(double defaultRefillPerSecond) {
            this.defaultRefillPerSecond = defaultRefillPerSecond;
        }

        public Map<String, Bucket> getSources() {
            return sources;
        }

        public void setSources(Map<String, Bucket> sources) {
            this.sources = sources == null ? new LinkedHashMap<>() : sources;
        }
    }

    public static class Bucket {
        private Integer capacity;
        private Double refillPerSecond;

        public Integer getCapacity() {
            return capacity;
        }

        public void setCapacity(Integer capacity) {
            this.capacity = capacity;
        }

        public Double getRefillPerSecond() {
            return refillPerSecond;
        }

        public void setRefillPerSecond(Double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
        }
    }

    public static class Filter {
        private double threshold = 0.35;
        private int maxTextLength = 2_000;
        private int embeddingMaxAttempts = 3;
        private List<String> keywords = new ArrayList<>();

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = Math.min(1.0, Math.max(0.0, threshold));
        }

        public int getMaxTextLength() {
            return Math.max(1, maxTextLength);
        }

        public void setMaxTextLength(int maxTextLength) {
            this.maxTextLength = Math.max(1, maxTextLength);
        }

        public int getEmbeddingMaxAttempts() {
            return Math.max(1, embeddingMaxAttempts);
        }

        public void setEmbeddingMaxAttempts(int embeddingMaxAttempts) {
            this.embeddingMaxAttempts = Math.max(1, embeddingMaxAttempts);
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : keywords;
        }
    }

    public static class Embedding {
        private String provider = "hashing";
        private int dimension = 384;
        private String endpoint;
        private String apiKey;
        private String model = "text-embedding-3-small";
        private int timeoutSeconds = 30;

        public String getProvider() {
            return provider == null || provider.isBlank() ? "hashing" : provider.trim();
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getDimension() {
            return Math.max(1, dimension);
        }

        public void setDimension(int dimension) {
            this.dimension = Math.max(1, dimension);
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Source {
        private String type;
        private boolean enabled = true;
        private String sourceType;
        private List<String> urls = new ArrayList<>();
        private boolean requireCompanyMention;
        private LinkedIn linkedin = new LinkedIn();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSourceType() {
            return sourceType;
        }

        public void setSourceType(String sourceType) {
            this.sourceType = sourceType;
        }

        public List<String> getUrls() {
            return urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls == null ? new ArrayList<>() : urls;
        }

        public boolean isRequireCompanyMention() {
            return requireCompanyMention;
        }

        public void setRequireCompanyMention(boolean requireCompanyMention) {
            this.requireCompanyMention = requireCompanyMention;
        }

        public LinkedIn getLinkedin() {
            return linkedin;
        }

        public void setLinkedin(LinkedIn linkedin) {
            this.linkedin = linkedin;
        }
    }

    public static class LinkedIn {
        private String apiUrl = "https://api.phantombuster.com/api/v2";
        private String apiKey;
        private String sessionCookie;
        private String userAgent;
        private int maxPosts = 3;
        private boolean fetchProfile = true;
        private boolean fetchPosts = true;
        private String urlFinderId;
        private String companyScraperId;
        private String activityExtractorId;
        private int pollAttempts = 30;
        private int pollDelayMs = 5_000;
        private int maxCallsPerHour = 10;
        private int maxCallsPerDay = 50;
        private int minDelayBetweenCallsMs = 60_000;
        private int maxConcurrentCalls = 1;
        private int randomDelayMinMs = 10_000;
        private int randomDelayMaxMs = 30_000;
        private int callSlotTimeoutMs = 600_000;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getSessionCookie() {
            return sessionCookie;
        }

        public void setSessionCookie(String sessionCookie) {
            this.sessionCookie = sessionCookie;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getMaxPosts() {
            return Math.max(1, maxPosts);
        }

        public void setMaxPosts(int maxPosts) {
            this.maxPosts = Math.max(1, maxPosts);
        }

        public boolean isFetchProfile() {
            return fetchProfile;
        }

        public void setFetchProfile(boolean fetchProfile) {
            this.fetchProfile = fetchProfile;
        }

        public boolean isFetchPosts() {
            return fetchPosts;
        }

        public void setFetchPosts(boolean fetchPosts) {
            this.fetchPosts = fetchPosts;
        }

        public String getUrlFinderId() {
            return urlFinderId;
        }

        public void setUrlFinderId(String urlFinderId) {
            this.urlFinderId = urlFinderId;
        }

        public String getCompanyScraperId() {
            return companyScraperId;
        }

        public void setCompanyScraperId(String companyScraperId) {
            this.companyScraperId = companyScraperId;
        }

        public String getActivityExtractorId() {
            return activityExtractorId;
        }

        public void setActivityExtractorId(String activityExtractorId) {
            this.activityExtractorId = activityExtractorId;
        }

        public int getPollAttempts() {
            return Math.max(1, pollAttempts);
        }

        public void setPollAttempts(int pollAttempts) {
            this.pollAttempts = Math.max(1, pollAttempts);
        }

        public int getPollDelayMs() {
            return Math.max(0, pollDelayMs);
        }

        public void setPollDelayMs(int pollDelayMs) {
            this.pollDelayMs = Math.max(0, pollDelayMs);
        }

        public int getMaxCallsPerHour() {
            return Math.max(1, maxCallsPerHour);
        }

        public void setMaxCallsPerHour(int maxCallsPerHour) {
            this.maxCallsPerHour = Math.max(1, maxCallsPerHour);
        }

        public int getMaxCallsPerDay() {
            return Math.max(1, maxCallsPerDay);
        }

        public void setMaxCallsPerDay(int maxCallsPerDay) {
            this.maxCallsPerDay = Math.max(1, maxCallsPerDay);
        }

        public int getMinDelayBetweenCallsMs() {
            return Math.max(0, minDelayBetweenCallsMs);
        }

        public void setMinDelayBetweenCallsMs(int minDelayBetweenCallsMs) {
            this.minDelayBetweenCallsMs = Math.max(0, minDelayBetweenCallsMs);
        }

        public int getMaxConcurrentCalls() {
            return Math.max(1, maxConcurrentCalls);
        }

        public void setMaxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = Math.max(1, maxConcurrentCalls);
        }

        public int getRandomDelayMinMs() {
            return Math.max(0, randomDelayMinMs);
        }

        public void setRandomDelayMinMs(int randomDelayMinMs) {
            this.randomDelayMinMs = Math.max(0, randomDelayMinMs);
        }

        /**
         * Upper bound of the random pause added before each agent call; 0 disables it.
         */
        public int getRandomDelayMaxMs() {
            return Math.max(getRandomDelayMinMs(), randomDelayMaxMs);
        }

        public void setRandomDelayMaxMs(int randomDelayMaxMs) {
            this.randomDelayMaxMs = Math.max(0, randomDelayMaxMs);
        }

        public int getCallSlotTimeoutMs() {
            return Math.max(0, callSlotTimeoutMs);
        }

        public void setCallSlotTimeoutMs(int callSlotTimeoutMs) {
            this.callSlotTimeoutMs = Math.max(0, callSlotTimeoutMs);
        }
    }

    public static class Sink {
        private String outputDir = "./data/signals";

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }
    }

    public static class Cli {
        private boolean run;
        private String companyName = "";
        private String city;
        private String industry;
        private String aliases = "";
        private String sources = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCompanyName() {
            return companyName;
        }

        public void setCompanyName(String companyName) {
            this.companyName = companyName;
        }

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = city;
        }

        public String getIndustry() {
            return industry;
        }

        public void setIndustry(String industry) {
            this.industry = industry;
        }

        public String getAliases() {
            return aliases;
        }

        public void setAliases(String aliases) {
            this.aliases = aliases;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
