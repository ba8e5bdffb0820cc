package com.github.fsmgraph;

import java.util.Locale;

/**
 * Named visual treatments applied to nodes and edges of a state graph.
 */
public enum StyleClass {
  // baseline for plain states and edges
  DEFAULT,
  // state(s) the observed model is currently in
  ACTIVE,
  // the transition that led to the current state, and its endpoints
  PREVIOUS,
  // baseline for states whose children are orthogonal regions
  PARALLEL,
  // explicitly deactivated state
  INACTIVE;

  /**
   * Lower case name as used in rendered class names.
   */
  public String cssName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
