package io.routeflow.core.graph;

/// Descriptive data carried alongside a graph.
///
/// `sourceDocument` holds the JSON text of the external rule document the graph was imported
/// from. Exporters return it verbatim instead of re-deriving a document from the nodes.
///
/// @param name flow name, may be null
/// @param sourceDocument original rule document as JSON text, null for authored graphs
public record GraphMetadata(String name, String sourceDocument) {

    public static final GraphMetadata EMPTY = new GraphMetadata(null, null);

    /// Returns whether the graph came out of a rule-document import.
    public boolean isImported() {
        return sourceDocument != null;
    }

    public GraphMetadata withName(String newName) {
        return new GraphMetadata(newName, sourceDocument);
    }
}
