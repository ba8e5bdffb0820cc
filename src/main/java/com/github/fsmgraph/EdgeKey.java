package com.github.fsmgraph;

import java.util.Objects;

/**
 * Identifies all edges running between a source and a destination. Internal transitions have a
 * null destination.
 */
public final class EdgeKey {
  private final String source;
  private final String dest;

  private EdgeKey(final String source, final String dest) {
    this.source = source;
    this.dest = dest;
  }

  public static EdgeKey of(final String source, final String dest) {
    return new EdgeKey(source, dest);
  }

  public String getSource() {
    return source;
  }

  public String getDest() {
    return dest;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EdgeKey)) {
      return false;
    }
    EdgeKey key = (EdgeKey) o;
    return Objects.equals(source, key.source) && Objects.equals(dest, key.dest);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, dest);
  }

  @Override
  public String toString() {
    return source + "->" + dest;
  }
}
