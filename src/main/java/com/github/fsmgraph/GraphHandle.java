package com.github.fsmgraph;

import java.util.List;

/**
 * Graph retrieval bound to one observed model, handed out when the model is added to a
 * {@link DiagramMachine}.
 */
public final class GraphHandle {
  private final DiagramMachine machine;
  private final Object model;

  GraphHandle(final DiagramMachine machine, final Object model) {
    this.machine = machine;
    this.model = model;
  }

  /**
   * The full graph under the configured title.
   */
  public RenderedGraph getGraph() throws DiagramException {
    return machine.renderGraph(model, null, false, false);
  }

  /**
   * @param title graph title, the configured one if null
   * @param forceNew rebuild the graph model from the markup first
   * @param roi restrict the graph to the region of interest around the active state(s)
   */
  public RenderedGraph getGraph(final String title, final boolean forceNew, final boolean roi)
      throws DiagramException {
    return machine.renderGraph(model, title, forceNew, roi);
  }

  public List<DiagramException> getProblems() throws DiagramException {
    return machine.getProblems(model);
  }

  public Object getModel() {
    return model;
  }

  public DiagramMachine getMachine() {
    return machine;
  }
}
