package com.github.fsmgraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Graph level attributes handed to a renderer: title, direction, strictness and backend hints.
 * Flat machines are laid out left to right; hierarchical ones top to bottom with compound edges so
 * that transitions can attach to clusters.
 */
public final class GraphAttributes {
  private final String title;
  private final boolean strict;
  private final String rankdir;
  private final Map<String, String> extra;

  private GraphAttributes(final String title, final boolean strict, final String rankdir,
      final Map<String, String> extra) {
    this.title = title;
    this.strict = strict;
    this.rankdir = rankdir;
    this.extra = Collections.unmodifiableMap(extra);
  }

  public static GraphAttributes forModel(final String title, final GraphModel model) {
    final Map<String, String> extra = new LinkedHashMap<>();
    if (model.isHierarchical()) {
      extra.put("rank", "source");
      extra.put("nodesep", "1.5");
      extra.put("compound", "true");
      return new GraphAttributes(title, false, "TB", extra);
    }
    return new GraphAttributes(title, false, "LR", extra);
  }

  public String getTitle() {
    return title;
  }

  /**
   * Machine graphs are always directed.
   */
  public boolean isDirected() {
    return true;
  }

  /**
   * Strict graphs merge parallel edges, so machine graphs are never strict.
   */
  public boolean isStrict() {
    return strict;
  }

  public String getRankdir() {
    return rankdir;
  }

  /**
   * All attributes as graphviz style key/values, title under "label".
   */
  public Map<String, String> asMap() {
    final Map<String, String> map = new LinkedHashMap<>();
    map.put("label", title);
    map.put("directed", Boolean.toString(isDirected()));
    map.put("strict", Boolean.toString(strict));
    map.put("rankdir", rankdir);
    map.putAll(extra);
    return map;
  }

  @Override
  public String toString() {
    return "GraphAttributes " + asMap();
  }
}
