package com.github.fsmgraph;

/**
 * A rendering backend. Backends are interchangeable: the same model, attributes and styles must
 * produce an equivalent drawing with either of them.
 */
public interface GraphRenderer {

  RendererType getType();

  /**
   * Whether this backend can be used in the current environment. Checked once when the diagram
   * machine is set up.
   */
  boolean isAvailable();

  /**
   * Generates a drawable graph from a model. Every node starts out with its baseline style and
   * every edge with {@link StyleClass#DEFAULT}.
   */
  RenderedGraph generate(GraphAttributes attributes, GraphModel model, StyleSheet styleSheet);

}
