package com.github.fsmgraph;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Graphviz-flavoured attribute sets per {@link StyleClass}, separately for nodes, edges and
 * clusters. A sheet is immutable; use {@link #withAttributes} to derive a customized copy.
 *
 * Lookups of a class that has no attributes for an element kind return an empty map, which
 * renderers treat as "keep the baseline".
 */
public final class StyleSheet implements Serializable {
  private static final long serialVersionUID = 1L;

  public static enum Element {
    NODE, EDGE, GRAPH;
  }

  private final Map<Element, Map<StyleClass, Map<String, String>>> attributes;

  private StyleSheet(final Map<Element, Map<StyleClass, Map<String, String>>> attributes) {
    this.attributes = attributes;
  }

  /**
   * The stock look: black on white, active states in red/salmon with a double border, previous
   * transition in blue.
   */
  public static StyleSheet defaults() {
    final Map<Element, Map<StyleClass, Map<String, String>>> sheet = new EnumMap<>(Element.class);
    final Map<StyleClass, Map<String, String>> node = new EnumMap<>(StyleClass.class);
    node.put(StyleClass.DEFAULT, attrs("style", "rounded, filled", "shape", "rectangle",
        "fillcolor", "white", "color", "black", "peripheries", "1"));
    node.put(StyleClass.INACTIVE, attrs("fillcolor", "white", "color", "black", "peripheries", "1"));
    node.put(StyleClass.PARALLEL, attrs("shape", "rectangle", "color", "black", "fillcolor",
        "white", "style", "dashed, rounded, filled", "peripheries", "1"));
    node.put(StyleClass.ACTIVE, attrs("color", "red", "fillcolor", "darksalmon", "peripheries", "2"));
    node.put(StyleClass.PREVIOUS, attrs("color", "blue", "fillcolor", "azure2", "peripheries", "1"));
    sheet.put(Element.NODE, node);

    final Map<StyleClass, Map<String, String>> edge = new EnumMap<>(StyleClass.class);
    edge.put(StyleClass.DEFAULT, attrs("color", "black"));
    edge.put(StyleClass.PREVIOUS, attrs("color", "blue"));
    sheet.put(Element.EDGE, edge);

    final Map<StyleClass, Map<String, String>> graph = new EnumMap<>(StyleClass.class);
    graph.put(StyleClass.DEFAULT, attrs("color", "black", "fillcolor", "white", "style", "solid"));
    graph.put(StyleClass.PREVIOUS, attrs("color", "blue", "fillcolor", "azure2", "style", "filled"));
    graph.put(StyleClass.ACTIVE, attrs("color", "red", "fillcolor", "darksalmon", "style", "filled"));
    graph.put(StyleClass.PARALLEL, attrs("color", "black", "fillcolor", "white", "style", "dotted"));
    sheet.put(Element.GRAPH, graph);
    return new StyleSheet(sheet);
  }

  public Map<String, String> getAttributes(final Element element, final StyleClass styleClass) {
    final Map<StyleClass, Map<String, String>> byClass = attributes.get(element);
    if (byClass == null || !byClass.containsKey(styleClass)) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(byClass.get(styleClass));
  }

  /**
   * Attributes of {@code styleClass} layered over the {@link StyleClass#DEFAULT} baseline.
   */
  public Map<String, String> resolve(final Element element, final StyleClass styleClass) {
    final Map<String, String> resolved =
        new LinkedHashMap<>(getAttributes(element, StyleClass.DEFAULT));
    if (styleClass != StyleClass.DEFAULT) {
      resolved.putAll(getAttributes(element, styleClass));
    }
    return resolved;
  }

  /**
   * Returns a copy of this sheet where {@code overrides} are merged into the given class.
   */
  public StyleSheet withAttributes(final Element element, final StyleClass styleClass,
      final Map<String, String> overrides) {
    final Map<Element, Map<StyleClass, Map<String, String>>> copy = new EnumMap<>(Element.class);
    for (final Map.Entry<Element, Map<StyleClass, Map<String, String>>> entry : attributes
        .entrySet()) {
      final Map<StyleClass, Map<String, String>> byClass = new EnumMap<>(StyleClass.class);
      for (final Map.Entry<StyleClass, Map<String, String>> classEntry : entry.getValue()
          .entrySet()) {
        byClass.put(classEntry.getKey(), new LinkedHashMap<>(classEntry.getValue()));
      }
      copy.put(entry.getKey(), byClass);
    }
    copy.computeIfAbsent(element, key -> new EnumMap<>(StyleClass.class))
        .computeIfAbsent(styleClass, key -> new LinkedHashMap<>()).putAll(overrides);
    return new StyleSheet(copy);
  }

  private static Map<String, String> attrs(final String... keyValues) {
    final Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      map.put(keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  @Override
  public String toString() {
    return "StyleSheet [attributes=" + attributes + "]";
  }
}
