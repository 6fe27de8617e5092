package org.dxworks.notebookdeps.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of notebook content as handed over by a notebook loader.
 * The type tag is kept verbatim; {@link org.dxworks.notebookdeps.BlockType#fromTag(String)} resolves it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Block {
    private final String id;
    private final String type;
    private final String content;
    private final Map<String, Object> metadata;

    @JsonCreator
    public Block(@JsonProperty("id") String id,
                 @JsonProperty("type") String type,
                 @JsonProperty("content") String content,
                 @JsonProperty("metadata") Map<String, Object> metadata) {
        this.id = id;
        this.type = type;
        this.content = content != null ? content : "";
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public Block(String id, String type, String content) {
        this(id, type, content, null);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
