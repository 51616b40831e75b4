package com.delta.signaltracker.ingest.plugin;

import com.delta.signaltracker.ingest.http.SignalHttpClient;
import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.HttpFetchResult;
import com.delta.signaltracker.ingest.model.RawRecord;
import com.delta.signaltracker.ingest.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Aggregates RSS 2.0 and Atom feeds. A failing feed is skipped; the fetch only fails when
 * no configured feed could be read.
 */
public class RssFeedPlugin implements SourcePlugin {
    private static final Logger log = LoggerFactory.getLogger(RssFeedPlugin.class);
    private static final String FEED_ACCEPT =
        "application/rss+xml,application/atom+xml,application/xml;q=0.9,text/xml;q=0.8,*/*;q=0.1";
    private static final String DEFAULT_SOURCE_TYPE = "news";

    private final String name;
    private final String sourceType;
    private final List<String> feedUrls;
    private final boolean requireCompanyMention;
    private final SignalHttpClient httpClient;

    public RssFeedPlugin(
        String name,
        String sourceType,
        List<String> feedUrls,
        boolean requireCompanyMention,
        SignalHttpClient httpClient
    ) {
        if (feedUrls == null || feedUrls.isEmpty()) {
            throw new IllegalArgumentException("RSS plugin '" + name + "' needs at least one feed URL");
        }
        this.name = name;
        this.sourceType = sourceType == null || sourceType.isBlank() ? DEFAULT_SOURCE_TYPE : sourceType;
        this.feedUrls = List.copyOf(feedUrls);
        this.requireCompanyMention = requireCompanyMention;
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Stream<RawRecord> fetch(CompanyTarget target, Instant since) {
        SourcePlugin.requireValidRequest(target, since);
        log.info("Fetching {} RSS feed(s) for '{}' from {}", feedUrls.size(), target.name(), name);

        List<RawRecord> records = new ArrayList<>();
        List<SourceFetchException> failures = new ArrayList<>();
        for (String url : feedUrls) {
            try {
                List<RawRecord> feedRecords = fetchFeed(url);
                log.info("Extracted {} item(s) from {}", feedRecords.size(), url);
                records.addAll(feedRecords);
            } catch (SourceFetchException e) {
                log.warn("RSS feed {} failed for {}: {}", url, name, e.getMessage());
                failures.add(e);
            }
        }
        if (!failures.isEmpty() && failures.size() == feedUrls.size()) {
            throw aggregateFailure(failures);
        }

        List<String> terms = lowerCaseTerms(target);
        return records.stream()
            .filter(record -> !record.publishedBefore(since))
            .filter(record -> !requireCompanyMention || mentionsCompany(record, terms));
    }

    List<RawRecord> fetchFeed(String url) {
        HttpFetchResult fetch = httpClient.get(url, FEED_ACCEPT);
        if (!fetch.isSuccessful()) {
            String reason = ReasonCodeClassifier.fromFetchResult(fetch);
            if (fetch.statusCode() == 429) {
                throw new SourceQuotaExceededException(name, "Feed " + url + " throttled", fetch.retryAfter());
            }
            throw new SourceUnavailableException(name, reason, "Feed " + url + " returned " + fetch.describe());
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            throw new MalformedResponseException(name, "Feed " + url + " returned an empty payload");
        }
        return parseFeed(url, fetch.body());
    }

    List<RawRecord> parseFeed(String feedUrl, String payload) {
        Document xml = Jsoup.parse(payload, feedUrl, Parser.xmlParser());
        if (xml.selectFirst("rss, feed, rdf|RDF, channel") == null) {
            throw new MalformedResponseException(name, "Feed " + feedUrl + " is neither RSS nor Atom");
        }
        List<RawRecord> records = new ArrayList<>();
        for (Element item : xml.select("item")) {
            records.add(toRecord(
                feedUrl,
                childText(item, "title"),
                childText(item, "link"),
                firstNonBlank(childText(item, "description"), childText(item, "content|encoded")),
                firstNonBlank(childText(item, "pubDate"), childText(item, "dc|date")),
                childText(item, "guid")
            ));
        }
        for (Element entry : xml.select("entry")) {
            records.add(toRecord(
                feedUrl,
                childText(entry, "title"),
                atomLink(entry),
                firstNonBlank(childText(entry, "summary"), childText(entry, "content")),
                firstNonBlank(childText(entry, "published"), childText(entry, "updated")),
                childText(entry, "id")
            ));
        }
        return records;
    }

    private RawRecord toRecord(String feedUrl, String title, String link, String summary, String published, String guid) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("feed_url", feedUrl);
        if (guid != null) {
            metadata.put("guid", guid);
        }
        return new RawRecord(
            name,
            sourceType,
            title == null ? null : cleanHtml(title),
            summary == null ? null : cleanHtml(summary),
            link,
            parseDate(published),
            metadata
        );
    }

    private SourceFetchException aggregateFailure(List<SourceFetchException> failures) {
        for (SourceFetchException failure : failures) {
            if (failure instanceof SourceQuotaExceededException) {
                return failure;
            }
        }
        boolean allMalformed = failures.stream().allMatch(f -> f instanceof MalformedResponseException);
        if (allMalformed) {
            return new MalformedResponseException(name, "No readable feed: " + failures.get(0).getMessage());
        }
        SourceFetchException first = failures.get(0);
        return new SourceUnavailableException(
            name,
            first.reasonCode(),
            "All " + failures.size() + " feed(s) failed, first: " + first.getMessage(),
            first
        );
    }

    private static String atomLink(Element entry) {
        String fallback = null;
        for (Element link : entry.select("link")) {
            String href = link.attr("href");
            if (href.isBlank()) {
                continue;
            }
            String rel = link.attr("rel");
            if (rel.isBlank() || "alternate".equalsIgnoreCase(rel)) {
                return href.trim();
            }
            if (fallback == null) {
                fallback = href.trim();
            }
        }
        return fallback;
    }

    private static String childText(Element parent, String tag) {
        Element child = parent.selectFirst("> " + tag);
        if (child == null) {
            return null;
        }
        String text = child.text();
        return text.isBlank() ? null : text.trim();
    }

    private static String firstNonBlank(String first, String second) {
        return first != null ? first : second;
    }

    static String cleanHtml(String value) {
        return Jsoup.parse(value).text().trim();
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            // not RFC-1123, try ISO-8601 below
        }
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time either
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable feed date '{}'", trimmed);
            return null;
        }
    }

    private static List<String> lowerCaseTerms(CompanyTarget target) {
        List<String> terms = new ArrayList<>();
        for (String term : target.searchTerms()) {
            terms.add(term.toLowerCase(Locale.ROOT));
        }
        return terms;
    }

    private static boolean mentionsCompany(RawRecord record, List<String> terms) {
        String haystack = ((record.title() == null ? "" : record.title()) + " "
            + (record.body() == null ? "" : record.body())).toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (haystack.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
