package com.flowauto.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowauto.node.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Writes a {@link FlowGraph} as stored graph JSON.
 */
public final class GraphWriter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String write(FlowGraph graph) {
        try {
            return mapper.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph " + graph.id(), e);
        }
    }

    public GraphDocument toDocument(FlowGraph graph) {
        GraphDocument doc = new GraphDocument();
        doc.setId(graph.id());
        doc.setName(graph.name());
        doc.setDescription(graph.description());
        doc.setVersion(graph.version());

        List<GraphDocument.NodeDoc> nodes = new ArrayList<>();
        for (FlowNode n : graph.nodes()) {
            GraphDocument.NodeDoc nd = new GraphDocument.NodeDoc();
            nd.setId(n.id());
            nd.setType(n.kind().wireName());
            GraphDocument.PositionDoc p = new GraphDocument.PositionDoc();
            p.setX(n.position().x());
            p.setY(n.position().y());
            nd.setPosition(p);
            nd.setData(new LinkedHashMap<>(n.data()));
            nodes.add(nd);
        }
        doc.setNodes(nodes);

        List<GraphDocument.EdgeDoc> edges = new ArrayList<>();
        for (FlowEdge e : graph.edges()) {
            GraphDocument.EdgeDoc ed = new GraphDocument.EdgeDoc();
            ed.setId(e.id());
            ed.setSource(e.source());
            ed.setTarget(e.target());
            if (e.branch() != null)
                ed.setSourceHandle(e.branch().wireName());
            edges.add(ed);
        }
        doc.setEdges(edges);

        ExecutionSettings s = graph.settings();
        GraphDocument.SettingsDoc sd = new GraphDocument.SettingsDoc();
        sd.setMode(s.mode().wireName());
        sd.setMax(s.max());
        if (s.maxExceeded() != null)
            sd.setMaxExceeded(s.maxExceeded().wireName());
        if (!s.initialState())
            sd.setInitialState(false);
        doc.setMetadata(sd);
        return doc;
    }
}
