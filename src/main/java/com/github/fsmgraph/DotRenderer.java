package com.github.fsmgraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.fsmgraph.StyleSheet.Element;

/**
 * Renders graphs as graphviz dot source. The output can be fed to any graphviz installation, e.g.
 * {@code dot -Tpng machine.gv -o machine.png}.
 *
 * Composite states become {@code cluster_} subgraphs. Transitions that start or end at a composite
 * state attach to its anchor point and are clipped at the cluster border ({@code ltail} /
 * {@code lhead}). Internal transitions are drawn as self loops.
 */
public final class DotRenderer implements GraphRenderer {

  @Override
  public RendererType getType() {
    return RendererType.DOT;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public RenderedGraph generate(final GraphAttributes attributes, final GraphModel model,
      final StyleSheet styleSheet) {
    return new DotGraph(attributes, model, styleSheet);
  }

  static final class DotGraph extends RenderedGraph {
    private static final String CLUSTER_PREFIX = "cluster_";

    private DotGraph(final GraphAttributes attributes, final GraphModel model,
        final StyleSheet styleSheet) {
      super(attributes, model, styleSheet);
    }

    @Override
    protected RenderedGraph newGraph(final GraphAttributes attributes, final GraphModel model,
        final StyleSheet styleSheet) {
      return new DotGraph(attributes, model, styleSheet);
    }

    @Override
    public RendererType getType() {
      return RendererType.DOT;
    }

    @Override
    public String getSource() {
      final StringBuilder dot = new StringBuilder(1024);
      if (getAttributes().isStrict()) {
        dot.append("strict ");
      }
      dot.append("digraph ").append(id(getTitle())).append(" {\n");
      dot.append("  graph [").append(attributeList(getAttributes().asMap())).append("];\n");
      dot.append("  node [")
          .append(attributeList(getStyleSheet().getAttributes(Element.NODE, StyleClass.DEFAULT)))
          .append("];\n");
      dot.append("  edge [")
          .append(attributeList(getStyleSheet().getAttributes(Element.EDGE, StyleClass.DEFAULT)))
          .append("];\n");

      final Map<String, List<GraphNode>> byParent = new LinkedHashMap<>();
      for (final GraphNode node : getModel().getNodes()) {
        byParent.computeIfAbsent(visibleParent(node), key -> new ArrayList<>()).add(node);
      }
      writeScope(dot, byParent, null, "  ");

      for (final GraphEdge edge : getModel().getEdges()) {
        final String source = edge.getSource();
        final String dest = edge.getDest().orElse(source);
        final Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("label", edge.getLabel());
        if (isCluster(source)) {
          attrs.put("ltail", CLUSTER_PREFIX + source);
        }
        if (isCluster(dest) && !dest.equals(source)) {
          attrs.put("lhead", CLUSTER_PREFIX + dest);
        }
        final StyleClass style = edgeStyles().get(edge.getKey());
        if (style != null && style != StyleClass.DEFAULT) {
          attrs.putAll(getStyleSheet().resolve(Element.EDGE, style));
        }
        dot.append("  ").append(id(endpoint(source))).append(" -> ").append(id(endpoint(dest)))
            .append(" [").append(attributeList(attrs)).append("];\n");
      }
      dot.append("}\n");
      return dot.toString();
    }

    private void writeScope(final StringBuilder dot, final Map<String, List<GraphNode>> byParent,
        final String parent, final String indent) {
      final List<GraphNode> nodes = byParent.get(parent);
      if (nodes == null) {
        return;
      }
      for (final GraphNode node : nodes) {
        if (node.isComposite()) {
          final StyleClass style = nodeStyles().get(node.getName());
          final Map<String, String> attrs = new LinkedHashMap<>();
          attrs.put("label", node.getLabel());
          attrs.putAll(getStyleSheet().resolve(Element.GRAPH, style));
          dot.append(indent).append("subgraph ").append(id(CLUSTER_PREFIX + node.getName()))
              .append(" {\n");
          dot.append(indent).append("  graph [").append(attributeList(attrs)).append("];\n");
          final String anchor = node.getName() + HierarchyFlattener.ANCHOR_SUFFIX;
          if (!getModel().hasNode(anchor)) {
            // composites without default child still need a point for edges to attach to
            dot.append(indent).append("  ").append(id(anchor)).append(" [")
                .append(anchorAttributes()).append("];\n");
          }
          writeScope(dot, byParent, node.getName(), indent + "  ");
          dot.append(indent).append("}\n");
        } else if (node.isAnchor()) {
          dot.append(indent).append(id(node.getName())).append(" [").append(anchorAttributes())
              .append("];\n");
        } else {
          final Map<String, String> attrs = new LinkedHashMap<>();
          attrs.put("label", node.getLabel());
          final StyleClass style = nodeStyles().get(node.getName());
          if (style != StyleClass.DEFAULT) {
            attrs.putAll(getStyleSheet().resolve(Element.NODE, style));
          }
          dot.append(indent).append(id(node.getName())).append(" [").append(attributeList(attrs))
              .append("];\n");
        }
      }
    }

    private String visibleParent(final GraphNode node) {
      final String parent = node.getParent().orElse(null);
      return parent != null && getModel().hasNode(parent) ? parent : null;
    }

    private boolean isCluster(final String state) {
      final GraphNode node = getModel().getNode(state);
      return node != null && node.isComposite();
    }

    private String endpoint(final String state) {
      return isCluster(state) ? state + HierarchyFlattener.ANCHOR_SUFFIX : state;
    }

    private static String anchorAttributes() {
      return "label=\"\", shape=\"point\", width=\"0.1\", fillcolor=\"black\"";
    }
  }

  static String attributeList(final Map<String, String> attributes) {
    final StringBuilder list = new StringBuilder();
    for (final Map.Entry<String, String> attribute : attributes.entrySet()) {
      if (list.length() > 0) {
        list.append(", ");
      }
      list.append(attribute.getKey()).append('=').append(id(attribute.getValue()));
    }
    return list.toString();
  }

  /**
   * Quotes a string into a dot ID. Line breaks become left aligned breaks.
   */
  static String id(final String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\l") + "\"";
  }
}
