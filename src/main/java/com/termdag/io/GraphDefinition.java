package com.termdag.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a graph to draw.
 *
 * <pre>
 * {"graph": {"name": "build", "style": "ASCII",
 *            "nodes": [{"name": "compile"},
 *                      {"name": "test", "dependencies": ["compile"]}]}}
 * </pre>
 *
 * Dependencies are parents: {@code compile -> test} above.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information about the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name, style;
        private List<NodeDef> nodes;
    }

    /** Definition of a single node in the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, description;
        private List<String> dependencies;
    }
}
