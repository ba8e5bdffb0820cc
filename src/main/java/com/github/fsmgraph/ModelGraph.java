package com.github.fsmgraph;

import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgraph.DiagramException.Code;

/**
 * Registry entry of one observed model: its graph model, its style overlay and the last rendered
 * full graph. All access is serialized on the entry, so transitions of different models never
 * touch each other's overlay.
 */
final class ModelGraph {
  private static final Logger logger = LogManager.getLogger(ModelGraph.class.getSimpleName());

  private final Object model;
  private GraphModel graphModel;
  private StyleTracker tracker = new StyleTracker();
  private boolean transitionInProgress;
  private String transitionDest;

  // full graph of the last render, dropped on any style or model change
  private RenderedGraph cached;
  private String cachedTitle;
  private GraphRenderer cachedRenderer;

  ModelGraph(final Object model, final GraphModel graphModel) {
    this.model = model;
    this.graphModel = graphModel;
    markActive();
  }

  Object getModel() {
    return model;
  }

  synchronized GraphModel getGraphModel() {
    return graphModel;
  }

  synchronized List<DiagramException> getProblems() {
    return graphModel.getProblems();
  }

  synchronized boolean isTransitionInProgress() {
    return transitionInProgress;
  }

  /**
   * Swaps in a freshly built graph model. Outside of a transition the overlay starts over with the
   * current state(s) marked active; during a transition the in-flight overlay is carried over.
   */
  synchronized void rebuild(final GraphModel rebuilt) {
    graphModel = rebuilt;
    cached = null;
    if (transitionInProgress) {
      tracker = tracker.copy();
      return;
    }
    tracker = new StyleTracker();
    markActive();
  }

  synchronized void beginTransition(final String source, final String dest) {
    transitionInProgress = true;
    transitionDest = dest;
    tracker.resetStyling();
    tracker.setPreviousTransition(source, dest);
    cached = null;
  }

  synchronized void endTransition() {
    transitionInProgress = false;
    markActive();
    transitionDest = null;
    cached = null;
  }

  synchronized void resetStyling() {
    tracker.resetStyling();
    cached = null;
  }

  synchronized void setNodeStyle(final String state, final StyleClass styleClass) {
    tracker.setNodeStyle(state, styleClass);
    cached = null;
  }

  synchronized void setEdgeStyle(final String source, final String dest,
      final StyleClass styleClass) {
    tracker.setEdgeStyle(source, dest, styleClass);
    cached = null;
  }

  synchronized StyleClass getNodeStyle(final String state) {
    return tracker.getNodeStyle(state);
  }

  synchronized StyleClass getEdgeStyle(final String source, final String dest) {
    return tracker.getEdgeStyle(source, dest);
  }

  synchronized StyleTracker getStyleTracker() {
    return tracker.copy();
  }

  /**
   * Renders the full graph, or the region of interest around the active state(s) if {@code roi}
   * is set. Full graphs are reused until something changes; regions are always generated anew.
   * Callers always get their own copy, restyling it leaves the cached graph alone.
   */
  synchronized RenderedGraph render(final String title, final boolean roi,
      final GraphRenderer renderer, final StyleSheet styleSheet) {
    if (!roi) {
      if (cached == null || !title.equals(cachedTitle) || cachedRenderer != renderer) {
        cached = generate(graphModel, title, renderer, styleSheet);
        cachedTitle = title;
        cachedRenderer = renderer;
      }
      return cached.copy();
    }
    final List<String> active =
        CurrentStates.of(model, graphModel, transitionDest).orElse(tracker.getActiveStates());
    return generate(RoiFilter.filter(graphModel, active), title, renderer, styleSheet);
  }

  private RenderedGraph generate(final GraphModel source, final String title,
      final GraphRenderer renderer, final StyleSheet styleSheet) {
    final GraphAttributes attributes = GraphAttributes.forModel(title, graphModel);
    final RenderedGraph rendered = renderer.generate(attributes, source, styleSheet);
    for (final GraphNode node : source.getNodes()) {
      rendered.setNodeStyle(node.getName(), tracker.resolve(node));
    }
    for (final GraphEdge edge : source.getEdges()) {
      final StyleClass style = tracker.getEdgeStyle(edge.getSource(), edge.getDest().orElse(null));
      if (style != null) {
        rendered.setEdgeStyle(edge.getSource(), edge.getDest().orElse(null), style);
      }
    }
    return rendered;
  }

  private void markActive() {
    final Optional<List<String>> current =
        CurrentStates.of(model, graphModel, transitionDest);
    if (!current.isPresent()) {
      logger.info(Code.STYLE_TRACKING_UNAVAILABLE.getDescription() + " model: "
          + model.getClass().getSimpleName());
      return;
    }
    for (final String state : current.get()) {
      tracker.setNodeStyle(state, StyleClass.ACTIVE);
    }
  }

  @Override
  public String toString() {
    return "ModelGraph [model=" + model.getClass().getSimpleName() + ", nodes="
        + graphModel.getNodeNames().size() + ", edges=" + graphModel.getEdges().size()
        + ", transitionInProgress=" + transitionInProgress + "]";
  }
}
