package com.gsdorchestrator.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits a Markdown artifact into its YAML header and body.
 */
public class FrontmatterParser {

    private static final Pattern HEADER = Pattern.compile(
        "\\A---[ \\t]*\\r?\\n(?:(.*?)\\r?\\n)?---[ \\t]*(?:\\r?\\n|\\z)", Pattern.DOTALL);

    private final ObjectMapper yamlMapper;

    public FrontmatterParser() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public FrontmatterParser(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    public Document parse(String content, String path) {
        if (content == null) {
            throw new ArtifactParseException(path, "File is empty");
        }
        String normalized = content.startsWith("\uFEFF") ? content.substring(1) : content;
        Matcher matcher = HEADER.matcher(normalized);
        if (!matcher.find()) {
            throw new ArtifactParseException(path, "Missing frontmatter header");
        }
        String header = matcher.group(1);
        String body = normalized.substring(matcher.end());
        if (header == null || header.isBlank()) {
            return new Document(Collections.emptyMap(), body);
        }
        try {
            Object parsed = yamlMapper.readValue(header, Object.class);
            if (!(parsed instanceof Map)) {
                throw new ArtifactParseException(path, "Frontmatter is not a key/value mapping");
            }
            Map<String, Object> fields = yamlMapper.convertValue(parsed, new TypeReference<LinkedHashMap<String, Object>>() {});
            return new Document(fields, body);
        } catch (JsonProcessingException e) {
            throw new ArtifactParseException(path, "Invalid frontmatter: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parsed header fields plus the remaining body text.
     */
    public static class Document {
        private final Map<String, Object> fields;
        private final String body;

        Document(Map<String, Object> fields, String body) {
            this.fields = fields;
            this.body = body;
        }

        public Map<String, Object> getFields() {
            return fields;
        }

        public String getBody() {
            return body;
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        public String string(String key) {
            Object value = fields.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof List) {
                // YAML reads an unquoted "[phase]" hint as a sequence
                return ((List<?>) value).stream()
                    .map(item -> "[" + item + "]")
                    .collect(Collectors.joining(" "));
            }
            String text = value.toString().trim();
            return text.isEmpty() ? null : text;
        }

        public List<String> stringList(String key) {
            Object value = fields.get(key);
            if (value == null) {
                return Collections.emptyList();
            }
            if (value instanceof List) {
                return ((List<?>) value).stream()
                    .filter(item -> item != null)
                    .map(item -> item.toString().trim())
                    .filter(item -> !item.isEmpty())
                    .collect(Collectors.toList());
            }
            return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
        }
    }
}
