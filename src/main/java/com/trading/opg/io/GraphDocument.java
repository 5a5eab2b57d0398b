package com.trading.opg.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.trading.opg.api.ParameterEntry;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO form of a persisted graph:
 *
 * <pre>
 * { "nodes": [ { "id": "...", "type": "ADD", "parameters": [ {"column": "x"}, {"value": 5} ] } ],
 *   "edges": [ { "source": "...", "target": "..." } ] }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDocument {
    private List<NodeDef> nodes = new ArrayList<>();
    private List<EdgeDef> edges = new ArrayList<>();

    /** A single node. {@code type} is the operation kind tag. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeDef {
        private String id;
        private String type;
        private List<ParameterEntry> parameters = new ArrayList<>();
    }

    /** A dependency; {@code target} runs after {@code source}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String source;
        private String target;
    }
}
