package com.github.fsmgraph;

import java.util.Optional;

/**
 * A node of a {@link GraphModel}: a state, or the anchor point of a composite state.
 */
public final class GraphNode {
  private final String name;
  private final String label;
  private final String parent;
  private final StyleClass defaultStyle;
  private final boolean composite;
  private final boolean anchor;

  GraphNode(final String name, final String label, final String parent,
      final StyleClass defaultStyle, final boolean composite, final boolean anchor) {
    this.name = name;
    this.label = label;
    this.parent = parent;
    this.defaultStyle = defaultStyle;
    this.composite = composite;
    this.anchor = anchor;
  }

  /**
   * The qualified name.
   */
  public String getName() {
    return name;
  }

  /**
   * Display label; lines are separated by '\n'.
   */
  public String getLabel() {
    return label;
  }

  /**
   * Qualified name of the enclosing composite state, empty for top-level states.
   */
  public Optional<String> getParent() {
    return Optional.ofNullable(parent);
  }

  public StyleClass getDefaultStyle() {
    return defaultStyle;
  }

  public boolean isComposite() {
    return composite;
  }

  public boolean isParallel() {
    return defaultStyle == StyleClass.PARALLEL;
  }

  public boolean isAnchor() {
    return anchor;
  }

  @Override
  public String toString() {
    return "GraphNode [name=" + name + ", parent=" + parent + ", defaultStyle=" + defaultStyle
        + ", composite=" + composite + ", anchor=" + anchor + "]";
  }
}
