package com.github.fsmgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Style overrides of one observed model. Nodes are addressed by qualified name, edges by their
 * (source, dest) pair, so all parallel edges of a pair share one style.
 *
 * Every registry entry owns its own tracker; trackers are never shared between models even if the
 * models are driven by the same machine. Not thread-safe, the owning {@link ModelGraph} serializes
 * access.
 */
public final class StyleTracker {
  private final Map<String, StyleClass> nodeStyles = new LinkedHashMap<>();
  private final Map<EdgeKey, StyleClass> edgeStyles = new LinkedHashMap<>();

  /**
   * Drops all overrides; every element falls back to its baseline style.
   */
  public void resetStyling() {
    nodeStyles.clear();
    edgeStyles.clear();
  }

  /**
   * Marks the edges between source and dest, and both endpoints, as {@link StyleClass#PREVIOUS}.
   */
  public void setPreviousTransition(final String source, final String dest) {
    edgeStyles.put(EdgeKey.of(source, dest), StyleClass.PREVIOUS);
    nodeStyles.put(source, StyleClass.PREVIOUS);
    if (dest != null) {
      nodeStyles.put(dest, StyleClass.PREVIOUS);
    }
  }

  public void setNodeStyle(final String state, final StyleClass styleClass) {
    nodeStyles.put(state, styleClass);
  }

  public void setEdgeStyle(final String source, final String dest, final StyleClass styleClass) {
    edgeStyles.put(EdgeKey.of(source, dest), styleClass);
  }

  /**
   * The override for a node, null if the node has none.
   */
  public StyleClass getNodeStyle(final String state) {
    return nodeStyles.get(state);
  }

  /**
   * The override for the edges of a pair, null if they have none.
   */
  public StyleClass getEdgeStyle(final String source, final String dest) {
    return edgeStyles.get(EdgeKey.of(source, dest));
  }

  /**
   * Effective style of a node: its override, else its baseline.
   */
  public StyleClass resolve(final GraphNode node) {
    final StyleClass override = nodeStyles.get(node.getName());
    return override != null ? override : node.getDefaultStyle();
  }

  public StyleClass resolve(final GraphEdge edge) {
    final StyleClass override = edgeStyles.get(edge.getKey());
    return override != null ? override : StyleClass.DEFAULT;
  }

  /**
   * Names of the nodes currently styled {@link StyleClass#ACTIVE}.
   */
  public List<String> getActiveStates() {
    final List<String> active = new ArrayList<>();
    for (final Map.Entry<String, StyleClass> entry : nodeStyles.entrySet()) {
      if (entry.getValue() == StyleClass.ACTIVE) {
        active.add(entry.getKey());
      }
    }
    return active;
  }

  public Map<String, StyleClass> getNodeStyles() {
    return Collections.unmodifiableMap(nodeStyles);
  }

  public Map<EdgeKey, StyleClass> getEdgeStyles() {
    return Collections.unmodifiableMap(edgeStyles);
  }

  /**
   * An independent tracker holding the same overrides.
   */
  public StyleTracker copy() {
    final StyleTracker copy = new StyleTracker();
    copy.nodeStyles.putAll(nodeStyles);
    copy.edgeStyles.putAll(edgeStyles);
    return copy;
  }

  @Override
  public String toString() {
    return "StyleTracker [nodeStyles=" + nodeStyles + ", edgeStyles=" + edgeStyles + "]";
  }
}
