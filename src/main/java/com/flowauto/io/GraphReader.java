package com.flowauto.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowauto.TranspilerException;
import com.flowauto.node.*;
import com.flowauto.validate.NodeDataSchema;
import com.flowauto.validate.ValidationError;
import com.flowauto.validate.ValidationError.Code;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Reads stored graph JSON into a {@link FlowGraph}.
 *
 * <p>
 * Shape problems (unknown node kinds, malformed node data, bad branch handles)
 * are collected and raised together as a {@link TranspilerException}. Graph
 * structure is not checked here.
 */
@Log4j2
public final class GraphReader {

    private final ObjectMapper mapper = new ObjectMapper();
    private final NodeDataSchema schema = new NodeDataSchema();

    public FlowGraph read(String json) {
        GraphDocument doc;
        try {
            doc = mapper.readValue(json, GraphDocument.class);
        } catch (JsonProcessingException e) {
            throw new TranspilerException("Unreadable graph JSON", List.of(
                    new ValidationError(Code.INVALID_VALUE, "", e.getOriginalMessage())));
        }
        if (doc == null)
            throw new TranspilerException("Unreadable graph JSON", List.of(
                    new ValidationError(Code.REQUIRED, "", "Graph document is empty")));
        return toGraph(doc);
    }

    public FlowGraph toGraph(GraphDocument doc) {
        List<ValidationError> errors = new ArrayList<>();
        if (doc.getId() == null || doc.getId().isEmpty())
            errors.add(new ValidationError(Code.REQUIRED, "id", "Graph id is required"));
        if (doc.getName() == null || doc.getName().isEmpty())
            errors.add(new ValidationError(Code.REQUIRED, "name", "Graph name is required"));

        List<FlowNode> nodes = new ArrayList<>();
        List<GraphDocument.NodeDoc> nodeDocs = doc.getNodes() == null ? List.of() : doc.getNodes();
        for (int i = 0; i < nodeDocs.size(); i++) {
            GraphDocument.NodeDoc nd = nodeDocs.get(i);
            String path = "nodes[" + i + "]";
            if (nd.getId() == null || nd.getId().isEmpty()) {
                errors.add(new ValidationError(Code.REQUIRED, path + ".id", "Node id is required"));
                continue;
            }
            NodeKind kind = NodeKind.fromWire(nd.getType());
            if (kind == null) {
                errors.add(new ValidationError(Code.INVALID_TYPE, path + ".type",
                        "Unknown node type \"" + nd.getType() + "\""));
                continue;
            }
            Map<String, Object> data = nd.getData() == null ? Map.of() : nd.getData();
            int before = errors.size();
            schema.check(kind, data, path + ".data", errors);
            if (errors.size() > before)
                continue;
            Position position = nd.getPosition() == null ? Position.ORIGIN
                    : new Position(nd.getPosition().getX(), nd.getPosition().getY());
            nodes.add(FlowNode.of(kind, nd.getId(), position, data));
        }

        List<FlowEdge> edges = new ArrayList<>();
        List<GraphDocument.EdgeDoc> edgeDocs = doc.getEdges() == null ? List.of() : doc.getEdges();
        for (int i = 0; i < edgeDocs.size(); i++) {
            GraphDocument.EdgeDoc ed = edgeDocs.get(i);
            String path = "edges[" + i + "]";
            if (ed.getSource() == null || ed.getTarget() == null) {
                errors.add(new ValidationError(Code.REQUIRED, path, "Edge source and target are required"));
                continue;
            }
            BranchTag branch = null;
            if (ed.getSourceHandle() != null) {
                branch = BranchTag.fromWire(ed.getSourceHandle());
                if (branch == null) {
                    errors.add(new ValidationError(Code.INVALID_VALUE, path + ".sourceHandle",
                            "Branch handle must be \"true\" or \"false\", got \"" + ed.getSourceHandle() + "\""));
                    continue;
                }
            }
            String id = ed.getId() != null ? ed.getId() : "e-" + ed.getSource() + "-" + ed.getTarget();
            edges.add(new FlowEdge(id, ed.getSource(), ed.getTarget(), branch));
        }

        ExecutionSettings settings = settings(doc.getMetadata(), errors);
        if (!errors.isEmpty()) {
            log.debug("Graph JSON rejected with {} shape errors", errors.size());
            throw new TranspilerException("Invalid graph", errors);
        }
        int version = doc.getVersion() == null ? FlowGraph.SCHEMA_VERSION : doc.getVersion();
        return new FlowGraph(doc.getId(), doc.getName(), doc.getDescription(), nodes, edges, settings, version);
    }

    private static ExecutionSettings settings(GraphDocument.SettingsDoc sd, List<ValidationError> errors) {
        if (sd == null)
            return ExecutionSettings.DEFAULT;
        ExecutionMode mode = null;
        if (sd.getMode() != null) {
            mode = ExecutionMode.fromWire(sd.getMode());
            if (mode == null)
                errors.add(new ValidationError(Code.INVALID_VALUE, "metadata.mode",
                        "Unknown mode \"" + sd.getMode() + "\""));
        }
        OverflowPolicy overflow = null;
        if (sd.getMaxExceeded() != null) {
            overflow = OverflowPolicy.fromWire(sd.getMaxExceeded());
            if (overflow == null)
                errors.add(new ValidationError(Code.INVALID_VALUE, "metadata.max_exceeded",
                        "Unknown max_exceeded policy \"" + sd.getMaxExceeded() + "\""));
        }
        if (sd.getMax() != null && sd.getMax() < 1)
            errors.add(new ValidationError(Code.INVALID_VALUE, "metadata.max", "max must be positive"));
        return new ExecutionSettings(mode, sd.getMax(), overflow, !Boolean.FALSE.equals(sd.getInitialState()));
    }
}
