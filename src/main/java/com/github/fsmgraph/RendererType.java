package com.github.fsmgraph;

/**
 * The interchangeable rendering backends.
 */
public enum RendererType {
  // graphviz dot source
  DOT,
  // mermaid flowchart source
  MERMAID;
}
