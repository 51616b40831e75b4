package com.delta.signaltracker.ingest.plugin;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.http.SignalHttpClient;
import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.HttpFetchResult;
import com.delta.signaltracker.ingest.model.RawRecord;
import com.delta.signaltracker.ingest.ratelimit.CallQuotaTracker;
import com.delta.signaltracker.ingest.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Company profile and recent posts from LinkedIn, scraped through three PhantomBuster
 * agents: URL finder, company scraper and activity extractor.
 */
public class LinkedInPlugin implements SourcePlugin {
    private static final Logger log = LoggerFactory.getLogger(LinkedInPlugin.class);
    private static final Pattern RESULT_JSON = Pattern.compile("https?://\\S+result\\.json");
    private static final String JSON_ACCEPT = "application/json";
    private static final String DEFAULT_SOURCE_TYPE = "company news";

    private final String name;
    private final String sourceType;
    private final IngestionProperties.LinkedIn settings;
    private final CallQuotaTracker quotaTracker;
    private final SignalHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;

    public LinkedInPlugin(
        String name,
        String sourceType,
        IngestionProperties.LinkedIn settings,
        CallQuotaTracker quotaTracker,
        SignalHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        if (settings == null || isBlank(settings.getApiKey()) || isBlank(settings.getSessionCookie())) {
            throw new IllegalArgumentException("LinkedIn plugin '" + name + "' needs an api key and session cookie");
        }
        if (isBlank(settings.getUrlFinderId())
            || isBlank(settings.getCompanyScraperId())
            || isBlank(settings.getActivityExtractorId())) {
            throw new IllegalArgumentException("LinkedIn plugin '" + name + "' needs all three phantom ids");
        }
        this.name = name;
        this.sourceType = isBlank(sourceType) ? DEFAULT_SOURCE_TYPE : sourceType;
        this.settings = settings;
        this.quotaTracker = quotaTracker;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        String base = settings.getApiUrl() == null ? "" : settings.getApiUrl().trim();
        this.apiUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Stream<RawRecord> fetch(CompanyTarget target, Instant since) {
        SourcePlugin.requireValidRequest(target, since);

        String linkedinUrl = findCompanyUrl(target);
        if (linkedinUrl == null) {
            log.warn("No LinkedIn URL found for '{}' in '{}'", target.name(), target.city());
            return Stream.empty();
        }

        Map<String, String> profile = settings.isFetchProfile() ? fetchProfile(linkedinUrl) : Map.of();
        List<RawRecord> records = new ArrayList<>();
        if (settings.isFetchPosts()) {
            for (JsonNode post : fetchPosts(linkedinUrl)) {
                records.add(toPostRecord(post, linkedinUrl, profile));
            }
        }
        if (records.isEmpty() && !profile.isEmpty()) {
            records.add(toProfileRecord(target, linkedinUrl, profile));
        }
        log.info("LinkedIn produced {} record(s) for '{}'", records.size(), target.name());
        return records.stream().filter(record -> !record.publishedBefore(since));
    }

    String findCompanyUrl(CompanyTarget target) {
        ObjectNode arguments = baseArguments();
        arguments.put("csvName", "result");
        String query = target.city() == null ? target.name() : target.name() + " " + target.city();
        arguments.put("spreadsheetUrl", query);
        arguments.put("numberOfLinesToProcess", 1);

        JsonNode result = launchAndFetchResult(settings.getUrlFinderId(), arguments);
        JsonNode first = firstRow(result, "URL finder");
        if (first == null) {
            return null;
        }
        String url = first.path("linkedinUrl").asText("");
        return url.isBlank() ? null : url.trim();
    }

    Map<String, String> fetchProfile(String linkedinUrl) {
        ObjectNode arguments = baseArguments();
        arguments.put("companiesPerLaunch", 1);
        arguments.put("delayBetween", 2);
        arguments.put("spreadsheetUrl", linkedinUrl);
        arguments.put("saveImg", false);

        JsonNode result = launchAndFetchResult(settings.getCompanyScraperId(), arguments);
        JsonNode first = firstRow(result, "company scraper");
        if (first == null) {
            return Map.of();
        }
        Map<String, String> profile = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = first.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isValueNode() && !value.isNull()) {
                profile.put("profile." + field.getKey(), value.asText());
            }
        }
        return profile;
    }

    List<JsonNode> fetchPosts(String linkedinUrl) {
        ObjectNode arguments = baseArguments();
        arguments.put("numberOfLinesPerLaunch", 1);
        arguments.put("numberMaxOfPosts", settings.getMaxPosts());
        arguments.put("csvName", "result");
        arguments.putArray("activitiesToScrape").add("Post");
        arguments.put("spreadsheetUrl", linkedinUrl);

        JsonNode result = launchAndFetchResult(settings.getActivityExtractorId(), arguments);
        if (result == null || result.isNull() || result.isMissingNode()) {
            return List.of();
        }
        if (!result.isArray()) {
            throw new MalformedResponseException(name, "Activity extractor returned " + result.getNodeType() + ", expected array");
        }
        List<JsonNode> posts = new ArrayList<>();
        for (JsonNode post : result) {
            if (post.isObject()) {
                posts.add(post);
            }
            if (posts.size() >= settings.getMaxPosts()) {
                break;
            }
        }
        return posts;
    }

    /**
     * Launches the agent, polls its output log until a result.json link shows up and
     * downloads that document. One call slot of the quota tracker is held throughout.
     */
    JsonNode launchAndFetchResult(String phantomId, ObjectNode arguments) {
        Duration slotTimeout = Duration.ofMillis(settings.getCallSlotTimeoutMs());
        try (CallQuotaTracker.CallSlot slot = quotaTracker.acquireSlot(phantomId, slotTimeout)) {
            admitCall(phantomId);
            return runAgent(phantomId, arguments);
        }
    }

    private JsonNode runAgent(String phantomId, ObjectNode arguments) {
        Map<String, String> headers = Map.of("x-phantombuster-key", settings.getApiKey());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", phantomId);
        payload.set("arguments", arguments);
        HttpFetchResult launch = httpClient.postJson(apiUrl + "/agents/launch", writeJson(payload), JSON_ACCEPT, headers);
        requireSuccess(launch, "launch of agent " + phantomId);
        String containerId = readJson(launch.body(), "launch response").path("containerId").asText("");
        if (containerId.isBlank()) {
            throw new MalformedResponseException(name, "Agent " + phantomId + " launch response has no containerId");
        }
        log.info("Phantom {} launched, container {}", phantomId, containerId);

        String outputUrl = apiUrl + "/agents/fetch-output?id=" + URLEncoder.encode(phantomId, StandardCharsets.UTF_8);
        for (int attempt = 1; attempt <= settings.getPollAttempts(); attempt++) {
            HttpFetchResult poll = httpClient.get(outputUrl, JSON_ACCEPT, headers);
            if ("timeout".equals(poll.errorCode())) {
                log.warn("Timeout polling output of agent {} (attempt {})", phantomId, attempt);
            } else {
                requireSuccess(poll, "output poll of agent " + phantomId);
                String output = readJson(poll.body(), "output poll").path("output").asText("");
                Matcher matcher = RESULT_JSON.matcher(output);
                if (matcher.find()) {
                    String resultUrl = matcher.group();
                    log.info("Result of agent {} available at {}", phantomId, resultUrl);
                    HttpFetchResult download = httpClient.get(resultUrl, JSON_ACCEPT);
                    requireSuccess(download, "result download of agent " + phantomId);
                    return readJson(download.body(), "agent result");
                }
            }
            if (attempt < settings.getPollAttempts()) {
                pause(settings.getPollDelayMs());
            }
        }
        throw new SourceUnavailableException(
            name,
            ReasonCodeClassifier.TIMEOUT,
            "Agent " + phantomId + " produced no result after " + settings.getPollAttempts() + " poll(s)"
        );
    }

    private void admitCall(String phantomId) {
        CallQuotaTracker.Admission admission = quotaTracker.admit(phantomId);
        if (!admission.allowed()) {
            throw new SourceQuotaExceededException(
                name,
                "Call quota exhausted for agent " + phantomId,
                admission.delay()
            );
        }
        if (!admission.delay().isZero()) {
            log.info("Spacing agent {} call by {} ms", phantomId, admission.delay().toMillis());
            pause(admission.delay().toMillis());
        }
    }

    private void requireSuccess(HttpFetchResult result, String what) {
        if (result.isSuccessful()) {
            return;
        }
        if (result.statusCode() == 429) {
            throw new SourceQuotaExceededException(name, "PhantomBuster throttled " + what, result.retryAfter());
        }
        throw new SourceUnavailableException(
            name,
            ReasonCodeClassifier.fromFetchResult(result),
            "PhantomBuster " + what + " failed: " + result.describe()
        );
    }

    private JsonNode readJson(String body, String what) {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException(name, "Empty " + what);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(name, "Invalid JSON in " + what, e);
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize agent payload", e);
        }
    }

    private JsonNode firstRow(JsonNode result, String agent) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return null;
        }
        if (!result.isArray()) {
            throw new MalformedResponseException(name, agent + " returned " + result.getNodeType() + ", expected array");
        }
        ArrayNode rows = (ArrayNode) result;
        if (rows.isEmpty()) {
            return null;
        }
        JsonNode first = rows.get(0);
        if (!first.isObject()) {
            throw new MalformedResponseException(name, agent + " row is " + first.getNodeType() + ", expected object");
        }
        return first;
    }

    private ObjectNode baseArguments() {
        ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("sessionCookie", settings.getSessionCookie());
        if (!isBlank(settings.getUserAgent())) {
            arguments.put("userAgent", settings.getUserAgent());
        }
        return arguments;
    }

    private RawRecord toPostRecord(JsonNode post, String linkedinUrl, Map<String, String> profile) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("linkedin_url", linkedinUrl);
        metadata.putAll(profile);
        return new RawRecord(
            name,
            sourceType,
            textOrNull(post, "author"),
            textOrNull(post, "postContent"),
            textOrNull(post, "postUrl"),
            parseTimestamp(textOrNull(post, "postTimestamp")),
            metadata
        );
    }

    private RawRecord toProfileRecord(CompanyTarget target, String linkedinUrl, Map<String, String> profile) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("linkedin_url", linkedinUrl);
        metadata.putAll(profile);
        String description = profile.getOrDefault("profile.description", profile.get("profile.tagLine"));
        return new RawRecord(
            name,
            sourceType,
            profile.getOrDefault("profile.name", target.name()),
            description,
            linkedinUrl,
            null,
            metadata
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable post timestamp '{}'", value);
            return null;
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(name, ReasonCodeClassifier.INTERRUPTED, "Interrupted while waiting on PhantomBuster", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
