package com.flowauto.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Reads and writes automation documents as YAML.
 *
 * <p>
 * Output is deterministic: maps are written in insertion order, no document
 * start marker is emitted, and strings are quoted only when a plain scalar
 * would be read back as something else.
 */
public final class YamlCodec {

    private final ObjectMapper mapper;

    public YamlCodec() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
        this.mapper = new ObjectMapper(factory);
    }

    /** Serializes a document. Failure here is a defect, not a user error. */
    public String write(Object document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize YAML document", e);
        }
    }

    /**
     * Parses YAML text into plain maps, lists and scalars. Returns null for an
     * empty document.
     */
    public Object read(String text) throws JsonProcessingException {
        if (text == null || text.isBlank())
            return null;
        return mapper.readValue(text, Object.class);
    }
}
