package com.github.fsmgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable node/edge description of a state machine. Nodes are keyed by qualified name and kept
 * in declaration order; edges keep insertion order and are never deduplicated.
 *
 * Problems found while building the model travel with it so that strict callers can reject a model
 * built from broken markup.
 */
public final class GraphModel {
  private final Map<String, GraphNode> nodes;
  private final List<GraphEdge> edges;
  private final List<DiagramException> problems;
  // markup descriptor -> qualified name of its node
  private final Map<StateDescriptor, String> descriptors;

  GraphModel(final Map<String, GraphNode> nodes, final List<GraphEdge> edges,
      final List<DiagramException> problems) {
    this(nodes, edges, problems, Collections.emptyMap());
  }

  GraphModel(final Map<String, GraphNode> nodes, final List<GraphEdge> edges,
      final List<DiagramException> problems, final Map<StateDescriptor, String> descriptors) {
    this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
    this.descriptors = Collections.unmodifiableMap(new IdentityHashMap<>(descriptors));
  }

  public Collection<GraphNode> getNodes() {
    return nodes.values();
  }

  public Set<String> getNodeNames() {
    return nodes.keySet();
  }

  public GraphNode getNode(final String name) {
    return nodes.get(name);
  }

  public boolean hasNode(final String name) {
    return nodes.containsKey(name);
  }

  /**
   * Qualified name of the node built from this very descriptor instance, empty if the descriptor
   * is not part of the markup the model was built from.
   */
  public Optional<String> getQualifiedName(final StateDescriptor state) {
    return Optional.ofNullable(descriptors.get(state));
  }

  public List<GraphEdge> getEdges() {
    return edges;
  }

  public List<GraphEdge> getEdges(final String source, final String dest) {
    final EdgeKey key = EdgeKey.of(source, dest);
    final List<GraphEdge> between = new ArrayList<>();
    for (final GraphEdge edge : edges) {
      if (edge.getKey().equals(key)) {
        between.add(edge);
      }
    }
    return between;
  }

  /**
   * Direct children of a composite node, in declaration order.
   */
  public List<GraphNode> getChildren(final String parent) {
    final List<GraphNode> children = new ArrayList<>();
    for (final GraphNode node : nodes.values()) {
      if (node.getParent().isPresent() && node.getParent().get().equals(parent)) {
        children.add(node);
      }
    }
    return children;
  }

  /**
   * True if any state has children.
   */
  public boolean isHierarchical() {
    for (final GraphNode node : nodes.values()) {
      if (node.isComposite()) {
        return true;
      }
    }
    return false;
  }

  public List<DiagramException> getProblems() {
    return problems;
  }

  @Override
  public String toString() {
    return "GraphModel [nodes=" + nodes.size() + ", edges=" + edges.size() + ", problems="
        + problems.size() + "]";
  }
}
