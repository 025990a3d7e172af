/* (C)2026 */
package com.ammann.valuation.parser;

import com.ammann.valuation.enumeration.ParseAttempt;
import com.ammann.valuation.enumeration.PassKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Recovers a JSON object from generative output that may be fenced, contain stray control
 * characters or invalid escapes, be wrapped in prose, or be truncated.
 *
 * <p>Attempts in order:
 * <ol>
 *   <li>strip code fences and parse;</li>
 *   <li>remove control characters, repair invalid backslash escapes and parse leniently;</li>
 *   <li>extract the outermost {@code {...}} and parse it cleaned as in attempt 2;</li>
 *   <li>salvage: narrative text becomes {@code {"content": text}}, extraction output keeps the
 *       top-level scalar fields a regex can still find.</li>
 * </ol>
 */
@ApplicationScoped
public class ResponseParser {

    private static final Logger LOG = Logger.getLogger(ResponseParser.class);

    private static final Pattern LEADING_FENCE = Pattern.compile("^\\s*```[a-zA-Z]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*$");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern ESCAPE = Pattern.compile("\\\\([\\s\\S]?)");
    private static final String VALID_ESCAPES = "\"\\\\/bfnrtu";
    private static final Pattern OUTER_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final Pattern SCALAR_FIELD = Pattern.compile(
            "\"([A-Za-z_][A-Za-z0-9_]*)\"\\s*:\\s*(-?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?|\"((?:[^\"\\\\]|\\\\.)*)\"|true|false|null)");

    private final ObjectMapper strict;
    private final ObjectMapper lenient;

    public ResponseParser() {
        this.strict = new ObjectMapper();
        this.lenient = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
                .build();
    }

    /**
     * Parses one response for a pass of the given kind. Never throws; the result carries
     * {@link ParseAttempt#FAILED} when nothing could be recovered.
     */
    public ParsedResponse parse(String rawText, PassKind kind) {
        if (rawText == null || rawText.isBlank()) {
            return ParsedResponse.failed(rawText);
        }

        String unfenced = stripFences(rawText);
        JsonNode node = tryParse(strict, unfenced);
        if (node != null) {
            return new ParsedResponse(ParseAttempt.ATTEMPT_1, node, rawText);
        }

        String cleaned = clean(unfenced);
        node = tryParse(lenient, cleaned);
        if (node != null) {
            LOG.debugf("Response recovered after cleaning (%d chars)", rawText.length());
            return new ParsedResponse(ParseAttempt.ATTEMPT_2, node, rawText);
        }

        Matcher outer = OUTER_OBJECT.matcher(rawText);
        if (outer.find()) {
            node = tryParse(lenient, clean(outer.group()));
            if (node != null) {
                LOG.debugf("Response recovered from embedded object (%d chars)", rawText.length());
                return new ParsedResponse(ParseAttempt.ATTEMPT_3, node, rawText);
            }
        }

        ObjectNode salvaged = salvage(unfenced, kind);
        if (salvaged != null) {
            LOG.warnf("Response salvaged for %s pass, %d field(s) kept", kind, salvaged.size());
            return new ParsedResponse(ParseAttempt.ATTEMPT_4, salvaged, rawText);
        }

        LOG.warnf("Unable to parse %s response: %s", kind, preview(rawText));
        return ParsedResponse.failed(rawText);
    }

    static String stripFences(String text) {
        String result = LEADING_FENCE.matcher(text).replaceFirst("");
        return TRAILING_FENCE.matcher(result).replaceFirst("").trim();
    }

    static String clean(String text) {
        String withoutControl = CONTROL_CHARS.matcher(text).replaceAll("");
        return ESCAPE.matcher(withoutControl).replaceAll(match -> {
            String next = match.group(1);
            String escape = !next.isEmpty() && VALID_ESCAPES.contains(next) ? "\\" : "\\\\";
            return Matcher.quoteReplacement(escape + next);
        });
    }

    private JsonNode tryParse(ObjectMapper mapper, String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node != null && node.isContainerNode() ? node : null;
        } catch (JsonProcessingException e) {
            LOG.tracef("Parse attempt failed: %s", e.getOriginalMessage());
            return null;
        }
    }

    private ObjectNode salvage(String text, PassKind kind) {
        ObjectNode result = strict.createObjectNode();
        if (kind == PassKind.NARRATIVE) {
            result.put("content", text.trim());
            return result;
        }

        Matcher matcher = SCALAR_FIELD.matcher(text);
        while (matcher.find()) {
            String field = matcher.group(1);
            String value = matcher.group(2);
            if (result.has(field)) {
                continue;
            }
            if (matcher.group(3) != null) {
                result.put(field, matcher.group(3));
            } else if ("true".equals(value) || "false".equals(value)) {
                result.put(field, Boolean.parseBoolean(value));
            } else if ("null".equals(value)) {
                result.putNull(field);
            } else {
                result.put(field, Double.parseDouble(value));
            }
        }
        if (result.isEmpty() && kind == PassKind.RESEARCH) {
            result.put("content", text.trim());
        }
        return result.isEmpty() ? null : result;
    }

    private static String preview(String text) {
        String flat = text.replaceAll("\\s+", " ");
        return flat.length() <= 120 ? flat : flat.substring(0, 120) + "...";
    }
}
