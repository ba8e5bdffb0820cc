package com.github.fsmgraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.fsmgraph.DiagramException.Code;

/**
 * A drawable graph produced by a {@link GraphRenderer}. Styles can still be changed after
 * generation; the textual source always reflects the current styles.
 */
public abstract class RenderedGraph {
  private final GraphAttributes attributes;
  private final GraphModel model;
  private final StyleSheet styleSheet;
  private final Map<String, StyleClass> nodeStyles = new LinkedHashMap<>();
  private final Map<EdgeKey, StyleClass> edgeStyles = new LinkedHashMap<>();

  protected RenderedGraph(final GraphAttributes attributes, final GraphModel model,
      final StyleSheet styleSheet) {
    this.attributes = attributes;
    this.model = model;
    this.styleSheet = styleSheet;
    for (final GraphNode node : model.getNodes()) {
      nodeStyles.put(node.getName(), node.getDefaultStyle());
    }
    for (final GraphEdge edge : model.getEdges()) {
      edgeStyles.put(edge.getKey(), StyleClass.DEFAULT);
    }
  }

  /**
   * Returns false if the graph has no such node.
   */
  public boolean setNodeStyle(final String state, final StyleClass styleClass) {
    if (!nodeStyles.containsKey(state)) {
      return false;
    }
    nodeStyles.put(state, styleClass);
    return true;
  }

  /**
   * Styles all edges between source and dest. Returns false if there are none.
   */
  public boolean setEdgeStyle(final String source, final String dest,
      final StyleClass styleClass) {
    final EdgeKey key = EdgeKey.of(source, dest);
    if (!edgeStyles.containsKey(key)) {
      return false;
    }
    edgeStyles.put(key, styleClass);
    return true;
  }

  public StyleClass getNodeStyle(final String state) {
    return nodeStyles.get(state);
  }

  public StyleClass getEdgeStyle(final String source, final String dest) {
    return edgeStyles.get(EdgeKey.of(source, dest));
  }

  public GraphAttributes getAttributes() {
    return attributes;
  }

  public String getTitle() {
    return attributes.getTitle();
  }

  public GraphModel getModel() {
    return model;
  }

  public StyleSheet getStyleSheet() {
    return styleSheet;
  }

  public List<DiagramException> getProblems() {
    return model.getProblems();
  }

  protected Map<String, StyleClass> nodeStyles() {
    return Collections.unmodifiableMap(nodeStyles);
  }

  protected Map<EdgeKey, StyleClass> edgeStyles() {
    return Collections.unmodifiableMap(edgeStyles);
  }

  /**
   * An independent graph of the same backend and model, carrying the current styles.
   */
  public RenderedGraph copy() {
    final RenderedGraph copy = newGraph(attributes, model, styleSheet);
    copy.nodeStyles.putAll(nodeStyles);
    copy.edgeStyles.putAll(edgeStyles);
    return copy;
  }

  protected abstract RenderedGraph newGraph(GraphAttributes attributes, GraphModel model,
      StyleSheet styleSheet);

  public abstract RendererType getType();

  /**
   * The textual graph description in this backend's language.
   */
  public abstract String getSource();

  /**
   * Writes the graph description to {@code target}, replacing an existing file.
   */
  public void draw(final Path target) throws DiagramException {
    try {
      final Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(target, getSource().getBytes(StandardCharsets.UTF_8));
    } catch (IOException problem) {
      throw new DiagramException(Code.RENDER_FAILURE, problem);
    }
  }

  @Override
  public String toString() {
    return getSource();
  }
}
