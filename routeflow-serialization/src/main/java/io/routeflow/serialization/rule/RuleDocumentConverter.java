package io.routeflow.serialization.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.routeflow.core.graph.FlowGraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts between external rule documents and flow graphs.
///
/// ### Import
/// A document is a single rule object or an array of them. Each rule becomes one graph named
/// `Rule1`, `Rule2`, ... in document order, built per {@link RuleShape}. The graph remembers
/// the rule object it came from.
///
/// ### Export
/// A graph that remembers its source rule exports exactly that rule, even if the graph was
/// edited since. Other graphs get a document re-derived from their node kinds.
///
/// {@snippet :
/// RuleDocumentConverter converter = new RuleDocumentConverter();
/// List<FlowGraph> graphs = converter.importRules(Files.readString(rulesFile));
/// String json = converter.toJson(converter.exportRules(graphs));
/// }
///
/// @implNote Thread-safe. Holds only an `ObjectMapper`, which is not reconfigured after
/// construction.
public final class RuleDocumentConverter {

    private static final Logger logger = Logger.getLogger(RuleDocumentConverter.class.getName());

    static final String NAME_PREFIX = "Rule";

    private final ObjectMapper mapper;

    public RuleDocumentConverter() {
        this(new ObjectMapper());
    }

    /// @param mapper mapper used to parse and print rule documents, not null
    public RuleDocumentConverter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper required");
    }

    /// Imports rule documents from JSON text.
    ///
    /// @param json one rule object or an array of them, not null
    /// @return graphs in document order, never null
    /// @throws IllegalArgumentException if the text is not JSON
    /// @throws UnsupportedRuleFormatException if a rule has an unknown shape
    public List<FlowGraph> importRules(String json) {
        try {
            return importRules(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to parse rule document: " + e.getOriginalMessage(), e);
        }
    }

    /// Imports parsed rule documents.
    ///
    /// @param root one rule object or an array of them, not null
    /// @return graphs in document order, never null
    /// @throws UnsupportedRuleFormatException if a rule has an unknown shape
    public List<FlowGraph> importRules(JsonNode root) {
        Objects.requireNonNull(root, "root required");
        List<JsonNode> rules = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(rules::add);
        } else {
            rules.add(root);
        }
        List<FlowGraph> graphs = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            graphs.add(RuleGraphImporter.importDocument(rules.get(i), NAME_PREFIX + (i + 1)));
        }
        logger.info("Imported " + graphs.size() + " rule document(s)");
        return graphs;
    }

    /// Exports one graph as a rule document.
    ///
    /// @param graph graph to export, not null
    /// @return the stored source rule for imported graphs, a derived rule otherwise
    /// @throws IllegalArgumentException if a stored source rule is not valid JSON
    public JsonNode exportRule(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph required");
        if (graph.getMetadata().isImported()) {
            try {
                return mapper.readTree(graph.getMetadata().sourceDocument());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException(
                        "Stored source document is not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
        logger.fine(() -> "Deriving rule document for " + graph.getMetadata().name());
        return RuleDocumentExporter.derive(graph);
    }

    /// Exports several graphs as an array of rule documents.
    public ArrayNode exportRules(List<FlowGraph> graphs) {
        ArrayNode array = mapper.createArrayNode();
        for (FlowGraph graph : graphs) {
            array.add(exportRule(graph));
        }
        return array;
    }

    /// Prints a document as indented JSON.
    ///
    /// @throws IllegalArgumentException if printing fails
    public String toJson(JsonNode document) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize rule document: " + e.getMessage(), e);
        }
    }
}
