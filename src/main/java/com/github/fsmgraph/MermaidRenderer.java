package com.github.fsmgraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.fsmgraph.StyleSheet.Element;

/**
 * Renders graphs as mermaid flowcharts. Style classes become {@code classDef}s, composite states
 * become {@code subgraph}s and styled edges get a {@code linkStyle} by their position.
 *
 * Graphviz attributes of the style sheet are translated to CSS where mermaid has an equivalent;
 * the rest are ignored.
 */
public final class MermaidRenderer implements GraphRenderer {

  @Override
  public RendererType getType() {
    return RendererType.MERMAID;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public RenderedGraph generate(final GraphAttributes attributes, final GraphModel model,
      final StyleSheet styleSheet) {
    return new MermaidGraph(attributes, model, styleSheet);
  }

  static final class MermaidGraph extends RenderedGraph {
    private final Map<String, String> ids = new HashMap<>();

    private MermaidGraph(final GraphAttributes attributes, final GraphModel model,
        final StyleSheet styleSheet) {
      super(attributes, model, styleSheet);
      int index = 0;
      for (final GraphNode node : model.getNodes()) {
        ids.put(node.getName(), "n" + index++);
      }
    }

    @Override
    protected RenderedGraph newGraph(final GraphAttributes attributes, final GraphModel model,
        final StyleSheet styleSheet) {
      return new MermaidGraph(attributes, model, styleSheet);
    }

    @Override
    public RendererType getType() {
      return RendererType.MERMAID;
    }

    @Override
    public String getSource() {
      final StringBuilder chart = new StringBuilder(1024);
      chart.append("---\n").append("title: ").append(yamlString(getTitle())).append('\n')
          .append("---\n");
      chart.append("flowchart ").append(getAttributes().getRankdir()).append('\n');
      for (final StyleClass styleClass : StyleClass.values()) {
        final String css = css(getStyleSheet().resolve(Element.NODE, styleClass));
        if (!css.isEmpty()) {
          chart.append("  classDef ").append(styleClass.cssName()).append(' ').append(css)
              .append('\n');
        }
      }

      final Map<String, List<GraphNode>> byParent = new LinkedHashMap<>();
      for (final GraphNode node : getModel().getNodes()) {
        final String parent = node.getParent().orElse(null);
        final String visible = parent != null && getModel().hasNode(parent) ? parent : null;
        byParent.computeIfAbsent(visible, key -> new ArrayList<>()).add(node);
      }
      writeScope(chart, byParent, null, "  ");

      final List<GraphEdge> edges = getModel().getEdges();
      for (final GraphEdge edge : edges) {
        final String source = ids.get(edge.getSource());
        final String dest = ids.get(edge.getDest().orElse(edge.getSource()));
        chart.append("  ").append(source).append(" -->");
        if (!edge.getLabel().isEmpty()) {
          chart.append("|").append(label(edge.getLabel())).append("|");
        }
        chart.append(' ').append(dest).append('\n');
      }

      for (final GraphNode node : getModel().getNodes()) {
        final StyleClass style = nodeStyles().get(node.getName());
        if (style == StyleClass.DEFAULT || node.isAnchor()) {
          continue;
        }
        if (node.isComposite()) {
          final String css = css(getStyleSheet().resolve(Element.GRAPH, style));
          if (!css.isEmpty()) {
            chart.append("  style ").append(ids.get(node.getName())).append(' ').append(css)
                .append('\n');
          }
        } else {
          chart.append("  class ").append(ids.get(node.getName())).append(' ')
              .append(style.cssName()).append('\n');
        }
      }
      for (int i = 0; i < edges.size(); i++) {
        final StyleClass style = edgeStyles().get(edges.get(i).getKey());
        if (style == null || style == StyleClass.DEFAULT) {
          continue;
        }
        final String css = css(getStyleSheet().resolve(Element.EDGE, style));
        if (!css.isEmpty()) {
          chart.append("  linkStyle ").append(i).append(' ').append(css).append('\n');
        }
      }
      return chart.toString();
    }

    private void writeScope(final StringBuilder chart,
        final Map<String, List<GraphNode>> byParent, final String parent, final String indent) {
      final List<GraphNode> nodes = byParent.get(parent);
      if (nodes == null) {
        return;
      }
      for (final GraphNode node : nodes) {
        final String id = ids.get(node.getName());
        if (node.isComposite()) {
          chart.append(indent).append("subgraph ").append(id).append('[')
              .append(label(node.getLabel())).append("]\n");
          writeScope(chart, byParent, node.getName(), indent + "  ");
          chart.append(indent).append("end\n");
        } else if (node.isAnchor()) {
          chart.append(indent).append(id).append("((\" \"))\n");
        } else {
          chart.append(indent).append(id).append('[').append(label(node.getLabel())).append("]\n");
        }
      }
    }
  }

  /**
   * Translates graphviz attributes into a mermaid CSS style list.
   */
  static String css(final Map<String, String> attributes) {
    final List<String> properties = new ArrayList<>();
    final String fill = attributes.get("fillcolor");
    if (fill != null) {
      properties.add("fill:" + color(fill));
    }
    final String stroke = attributes.get("color");
    if (stroke != null) {
      properties.add("stroke:" + color(stroke));
    }
    final String peripheries = attributes.get("peripheries");
    if (peripheries != null && !"1".equals(peripheries.trim())) {
      properties.add("stroke-width:4px");
    }
    final String style = attributes.get("style");
    if (style != null) {
      if (style.contains("dashed")) {
        properties.add("stroke-dasharray:5 5");
      } else if (style.contains("dotted")) {
        properties.add("stroke-dasharray:2 2");
      }
    }
    return String.join(",", properties);
  }

  // x11 names that css does not know
  static String color(final String color) {
    switch (color) {
      case "azure2":
        return "#e0eeee";
      default:
        return color;
    }
  }

  static String label(final String text) {
    return "\"" + text.replace("\"", "#quot;").replace("|", "#124;").replace("\n", "<br/>")
        + "\"";
  }

  /**
   * Double quoted YAML scalar.
   */
  static String yamlString(final String text) {
    return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n")
        .replace("\r", "\\r") + "\"";
  }
}
