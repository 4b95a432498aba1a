package com.flowauto.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of the stored graph JSON, as exchanged with the editor.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphDocument {
    private String id, name, description;
    private List<NodeDoc> nodes;
    private List<EdgeDoc> edges;
    private SettingsDoc metadata;
    private Integer version;

    /** One node: kind tag, canvas position and variant data. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDoc {
        private String id, type;
        private PositionDoc position;
        private Map<String, Object> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PositionDoc {
        private double x, y;
    }

    /** One edge; {@code sourceHandle} is "true", "false" or absent. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeDoc {
        private String id, source, target;
        private String sourceHandle;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class SettingsDoc {
        private String mode;
        private Integer max;
        @JsonProperty("max_exceeded")
        private String maxExceeded;
        @JsonProperty("initial_state")
        private Boolean initialState;
    }
}
