package com.campaignkeeper.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads and writes Markdown documents with a {@code ---} delimited YAML header.
 */
public class FrontmatterCodec {

    private static final String DELIMITER = "---";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper;

    public FrontmatterCodec() {
        YAMLFactory factory = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .stringQuotingChecker(new ScalarQuotingChecker())
            .build();
        this.yamlMapper = new ObjectMapper(factory);
    }

    public ObjectMapper yamlMapper() {
        return yamlMapper;
    }

    /**
     * Splits a document into its frontmatter map and trimmed body. A document
     * without a header yields an empty map and the whole text as body.
     */
    public ParsedDocument parse(String raw) throws FrontmatterParseException {
        String text = raw == null ? "" : raw;
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        text = text.replace("\r\n", "\n");

        if (!text.startsWith(DELIMITER + "\n")) {
            return new ParsedDocument(new LinkedHashMap<>(), text.trim());
        }

        int headerStart = DELIMITER.length() + 1;
        int closing = findClosingDelimiter(text, headerStart);
        if (closing < 0) {
            throw new FrontmatterParseException("Frontmatter is not terminated by '" + DELIMITER + "'");
        }

        String header = text.substring(headerStart, closing);
        int bodyStart = text.indexOf('\n', closing);
        String body = bodyStart < 0 ? "" : text.substring(bodyStart + 1);

        return new ParsedDocument(readHeader(header), body.trim());
    }

    public String serialize(Map<String, Object> frontmatter, String content) throws JsonProcessingException {
        StringBuilder out = new StringBuilder();
        out.append(DELIMITER).append('\n');
        if (frontmatter != null && !frontmatter.isEmpty()) {
            out.append(yamlMapper.writeValueAsString(frontmatter));
        }
        out.append(DELIMITER).append('\n');
        if (content != null && !content.isEmpty()) {
            out.append(content);
            if (!content.endsWith("\n")) {
                out.append('\n');
            }
        }
        return out.toString();
    }

    private Map<String, Object> readHeader(String header) throws FrontmatterParseException {
        if (header.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode node = yamlMapper.readTree(header);
            if (node == null || !node.isObject()) {
                throw new FrontmatterParseException("Frontmatter must be a key-value map");
            }
            return yamlMapper.convertValue(node, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new FrontmatterParseException("Invalid frontmatter: " + e.getOriginalMessage(), e);
        }
    }

    private int findClosingDelimiter(String text, int from) {
        int lineStart = from;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            String line = lineEnd < 0 ? text.substring(lineStart) : text.substring(lineStart, lineEnd);
            if (line.stripTrailing().equals(DELIMITER)) {
                return lineStart;
            }
            if (lineEnd < 0) {
                return -1;
            }
            lineStart = lineEnd + 1;
        }
        return -1;
    }

    /**
     * Quotes every string a YAML reader could resolve to something else: anything
     * starting like a number ({@code 0x1F}, {@code 1_000}, {@code .inf}, {@code -.NaN})
     * and the boolean and null words.
     */
    static final class ScalarQuotingChecker extends StringQuotingChecker.Default {

        private static final long serialVersionUID = 1L;
        private static final Pattern NUMBER_LIKE = Pattern.compile("^[-+.]?[0-9.]");
        private static final Pattern RESERVED = Pattern.compile(
            "(?i)(true|false|yes|no|y|n|on|off|null|~|[-+]?\\.(inf|nan))");

        @Override
        public boolean needToQuoteValue(String value) {
            return value.isEmpty()
                || NUMBER_LIKE.matcher(value).find()
                || RESERVED.matcher(value).matches()
                || super.needToQuoteValue(value);
        }
    }

    public static final class ParsedDocument {
        private final Map<String, Object> frontmatter;
        private final String content;

        public ParsedDocument(Map<String, Object> frontmatter, String content) {
            this.frontmatter = frontmatter;
            this.content = content;
        }

        public Map<String, Object> getFrontmatter() {
            return frontmatter;
        }

        public String getContent() {
            return content;
        }
    }
}
