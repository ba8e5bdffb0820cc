package com.github.fsmgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cuts a {@link GraphModel} down to its region of interest around the active state(s):
 * <ul>
 * <li>every active state that is a node of the model,</li>
 * <li>every edge starting or ending at an active state, with its other endpoint,</li>
 * <li>for an active composite state, the anchor edge leading to its default child, with the anchor
 * and the child.</li>
 * </ul>
 * Nothing else is kept; in particular reachability is not followed any further. Models and style
 * trackers are never modified, the region is a new model.
 */
public final class RoiFilter {

  public static GraphModel filter(final GraphModel model, final Collection<String> activeStates) {
    final Set<String> active = new HashSet<>();
    for (final String state : activeStates) {
      if (model.hasNode(state)) {
        active.add(state);
      }
    }
    final Set<String> anchors = new HashSet<>();
    for (final String state : active) {
      if (model.getNode(state).isComposite()) {
        anchors.add(state + HierarchyFlattener.ANCHOR_SUFFIX);
      }
    }

    final Set<String> keptNodes = new HashSet<>(active);
    final List<GraphEdge> keptEdges = new ArrayList<>();
    for (final GraphEdge edge : model.getEdges()) {
      boolean keep = edge.isAnchor() && anchors.contains(edge.getSource());
      for (final String state : active) {
        if (keep) {
          break;
        }
        keep = edge.touches(state);
      }
      if (keep) {
        keptEdges.add(edge);
        keptNodes.add(edge.getSource());
        edge.getDest().ifPresent(keptNodes::add);
      }
    }

    final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    for (final GraphNode node : model.getNodes()) {
      if (keptNodes.contains(node.getName())) {
        nodes.put(node.getName(), node);
      }
    }
    return new GraphModel(nodes, keptEdges, model.getProblems());
  }

  private RoiFilter() {}
}
