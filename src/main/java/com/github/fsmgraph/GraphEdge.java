package com.github.fsmgraph;

import java.util.Optional;

/**
 * An edge of a {@link GraphModel}. Each declared transition becomes its own edge, even if another
 * edge already connects the same pair of states.
 */
public final class GraphEdge {
  private final String trigger;
  private final String source;
  private final String dest;
  private final String label;
  private final boolean auto;
  private final boolean anchor;

  GraphEdge(final String trigger, final String source, final String dest, final String label,
      final boolean auto, final boolean anchor) {
    this.trigger = trigger;
    this.source = source;
    this.dest = dest;
    this.label = label;
    this.auto = auto;
    this.anchor = anchor;
  }

  public String getTrigger() {
    return trigger;
  }

  public String getSource() {
    return source;
  }

  /**
   * Empty for internal transitions.
   */
  public Optional<String> getDest() {
    return Optional.ofNullable(dest);
  }

  public boolean isInternal() {
    return dest == null;
  }

  public String getLabel() {
    return label;
  }

  public boolean isAuto() {
    return auto;
  }

  public boolean isAnchor() {
    return anchor;
  }

  public EdgeKey getKey() {
    return EdgeKey.of(source, dest);
  }

  /**
   * True if the state is one of the endpoints of this edge.
   */
  public boolean touches(final String state) {
    return state.equals(source) || state.equals(dest);
  }

  @Override
  public String toString() {
    return "GraphEdge [trigger=" + trigger + ", source=" + source + ", dest=" + dest + ", label="
        + label + ", auto=" + auto + ", anchor=" + anchor + "]";
  }
}
