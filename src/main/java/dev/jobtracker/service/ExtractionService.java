package dev.jobtracker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobtracker.ai.ExtractionClient;
import dev.jobtracker.ai.ExtractionException;
import dev.jobtracker.ai.ExtractionPrompt;
import dev.jobtracker.config.TrackerProperties;
import dev.jobtracker.metrics.TrackerMetrics;
import dev.jobtracker.model.CandidatePosting;
import dev.jobtracker.model.ExtractionResult;
import dev.jobtracker.model.RawContent;
import dev.jobtracker.util.TextNormalizer;
import dev.jobtracker.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Turns fetched page content into validated candidate postings.
 * <p>
 * The page is stripped of markup that never carries listings, capped in size, handed to the
 * configured {@link ExtractionClient}, and the model's reply is parsed leniently: code fences are
 * ignored, a wrapping object is unwrapped, and complete objects are salvaged from a truncated array.
 */
@Slf4j
@Service
public class ExtractionService {

    static final int MAX_TITLE_LENGTH = 500;
    static final int MAX_URL_LENGTH = 2048;
    static final int MAX_COMPANY_LENGTH = 255;

    private static final Set<String> PLACEHOLDERS = Set.of(
            "", "unknown", "not specified", "n/a", "na", "none", "null", "-", "not available");

    private final ExtractionClient client;
    private final ObjectMapper objectMapper;
    private final TrackerMetrics metrics;
    private final TrackerProperties.Extraction settings;

    public ExtractionService(ExtractionClient client, ObjectMapper objectMapper, TrackerMetrics metrics,
            TrackerProperties properties) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.settings = properties.getExtraction();
    }

    /**
     * Extract postings from one page.
     *
     * @param content    fetched page
     * @param sourceName used as the company when the model reports none
     */
    public Mono<ExtractionResult> extract(RawContent content, String sourceName) {
        return Mono.defer(() -> {
            if (content == null || content.isBlank()) {
                return Mono.error(new ExtractionException(ExtractionException.Kind.EMPTY_CONTENT,
                        "Page content is empty"));
            }

            String cleaned = clean(content.html());
            if (cleaned.isBlank()) {
                return Mono.error(new ExtractionException(ExtractionException.Kind.EMPTY_CONTENT,
                        "Page has no content after cleaning"));
            }

            String submitted = truncateUtf8(cleaned, settings.getMaxContentBytes());
            boolean truncated = submitted.length() < cleaned.length();
            if (truncated) {
                log.warn("Content of '{}' truncated to {} bytes before extraction", sourceName,
                        settings.getMaxContentBytes());
            }
            log.debug("Submitting {} chars from '{}' to {}", submitted.length(), sourceName, client.getName());

            return client.complete(ExtractionPrompt.build(submitted, sourceName))
                    .timeout(settings.getTimeout())
                    .onErrorMap(TimeoutException.class, e -> new ExtractionException(
                            ExtractionException.Kind.UPSTREAM_FAILURE,
                            "Extraction timed out after " + settings.getTimeout().toSeconds() + "s", e))
                    .switchIfEmpty(Mono.error(new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE,
                            "Extraction service returned nothing")))
                    .map(reply -> toResult(reply, content.finalUrl(), sourceName, truncated));
        });
    }

    private ExtractionResult toResult(String reply, String finalUrl, String sourceName, boolean truncated) {
        List<JsonNode> entries = parseEntries(reply);
        List<CandidatePosting> candidates = new ArrayList<>(entries.size());
        int dropped = 0;
        for (JsonNode entry : entries) {
            CandidatePosting candidate = validate(entry, finalUrl, sourceName);
            if (candidate == null) {
                dropped++;
            } else {
                candidates.add(candidate);
            }
        }

        metrics.recordPostingsExtracted(candidates.size());
        if (dropped > 0) {
            metrics.recordCandidatesDropped(dropped);
            log.info("Dropped {} extracted entries without a usable title from '{}'", dropped, sourceName);
        }
        log.info("Extracted {} postings from '{}'", candidates.size(), sourceName);
        return new ExtractionResult(candidates, dropped, truncated);
    }

    /**
     * Remove markup that never carries listings and collapse whitespace.
     */
    String clean(String html) {
        Document document = Jsoup.parse(html);
        document.select("script, style, noscript, svg, template, iframe").remove();

        List<Node> comments = new ArrayList<>();
        document.forEachNode(node -> {
            if (node instanceof Comment) {
                comments.add(node);
            }
        });
        comments.forEach(Node::remove);

        document.outputSettings().prettyPrint(false);
        String body = document.body() != null ? document.body().html() : document.html();
        return TextNormalizer.collapseWhitespace(body);
    }

    /**
     * Cut to at most {@code maxBytes} UTF-8 bytes without splitting a code point.
     */
    static String truncateUtf8(String value, int maxBytes) {
        if (value.length() * 3L <= maxBytes || value.getBytes(StandardCharsets.UTF_8).length <= maxBytes) {
            return value;
        }
        int bytes = 0;
        int index = 0;
        while (index < value.length()) {
            int codePoint = value.codePointAt(index);
            int size = utf8Length(codePoint);
            if (bytes + size > maxBytes) {
                break;
            }
            bytes += size;
            index += Character.charCount(codePoint);
        }
        return value.substring(0, index);
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    List<JsonNode> parseEntries(String reply) {
        String text = stripCodeFences(reply);
        try {
            JsonNode root = objectMapper.readTree(text);
            List<JsonNode> entries = entriesOf(root);
            if (entries != null) {
                return entries;
            }
        } catch (JsonProcessingException e) {
            log.debug("Extraction reply is not valid JSON, attempting partial recovery: {}", e.getOriginalMessage());
        }

        List<JsonNode> recovered = recoverObjects(text);
        if (recovered.isEmpty()) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE,
                    "No posting array in extraction reply: " + preview(reply));
        }
        log.info("Recovered {} postings from a partial extraction reply", recovered.size());
        return recovered;
    }

    private List<JsonNode> entriesOf(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return null;
        }
        if (root.isArray()) {
            List<JsonNode> entries = new ArrayList<>(root.size());
            root.forEach(entries::add);
            return entries;
        }
        if (root.isObject()) {
            for (String wrapper : List.of("jobs", "postings")) {
                JsonNode inner = field(root, wrapper);
                if (inner != null && inner.isArray()) {
                    return entriesOf(inner);
                }
            }
            if (field(root, "title") != null) {
                return List.of(root);
            }
        }
        return null;
    }

    static String stripCodeFences(String reply) {
        if (reply == null) {
            return "";
        }
        String text = reply.trim();
        if (text.startsWith("```")) {
            int newline = text.indexOf('\n');
            text = newline >= 0 ? text.substring(newline + 1) : text.substring(3);
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.trim();
    }

    /**
     * Collect every complete top-level object following the first '['. Braces inside strings are ignored.
     */
    private List<JsonNode> recoverObjects(String text) {
        List<JsonNode> objects = new ArrayList<>();
        int start = text.indexOf('[');
        if (start < 0) {
            return objects;
        }

        int depth = 0;
        int objectStart = -1;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                if (depth == 0) {
                    objectStart = i;
                }
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0 && objectStart >= 0) {
                    readObject(text.substring(objectStart, i + 1), objects);
                    objectStart = -1;
                }
            }
        }
        return objects;
    }

    private void readObject(String json, List<JsonNode> into) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node.isObject() && field(node, "title") != null) {
                into.add(node);
            }
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed object in partial reply: {}", e.getOriginalMessage());
        }
    }

    /**
     * Map one raw entry to a candidate, or null when it has no usable title.
     */
    CandidatePosting validate(JsonNode entry, String finalUrl, String sourceName) {
        if (entry == null || !entry.isObject()) {
            return null;
        }
        Map<String, JsonNode> fields = lowerCaseFields(entry);

        String title = textValue(fields.get("title"));
        if (title == null) {
            return null;
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH);
        }

        String company = textValue(fields.get("company"));
        if (company == null) {
            company = sourceName != null && !sourceName.isBlank() ? sourceName : UrlUtils.hostOf(finalUrl);
        }
        if (company == null) {
            company = "Unknown";
        }
        if (company.length() > MAX_COMPANY_LENGTH) {
            company = company.substring(0, MAX_COMPANY_LENGTH);
        }

        String location = textValue(fields.get("location"));
        if (location != null && location.length() > MAX_TITLE_LENGTH) {
            location = location.substring(0, MAX_TITLE_LENGTH);
        }

        String url = UrlUtils.resolve(finalUrl, textValue(fields.get("url")));
        if (url != null && url.length() > MAX_URL_LENGTH) {
            url = null;
        }

        return new CandidatePosting(title, company, location, url);
    }

    private static Map<String, JsonNode> lowerCaseFields(JsonNode entry) {
        Map<String, JsonNode> fields = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = entry.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            fields.putIfAbsent(field.getKey().trim().toLowerCase(Locale.ROOT), field.getValue());
        }
        return fields;
    }

    private static JsonNode field(JsonNode node, String name) {
        Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            if (field.getKey().trim().equalsIgnoreCase(name)) {
                return field.getValue();
            }
        }
        return null;
    }

    private static String textValue(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = TextNormalizer.collapseWhitespace(node.asText());
        if (value == null || PLACEHOLDERS.contains(value.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return value;
    }

    private static String preview(String reply) {
        if (reply == null) {
            return "<null>";
        }
        String flat = reply.replace('\n', ' ');
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
