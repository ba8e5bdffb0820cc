package com.github.fsmgraph;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgraph.DiagramException.Code;

/**
 * Diagram capability of a state machine.
 *
 * Notes for users:<br>
 * 1. every model added to the machine gets its own graph and its own style overlay, handed out as
 * a {@link GraphHandle}. Models are told apart by identity, not equality<br>
 *
 * 2. the machine doesn't drive any model. Whoever changes a model's state wraps the change in
 * {@link #onTransition} so that the previous transition and the new active state(s) get styled<br>
 *
 * 3. adding states or transitions rebuilds the graphs of all models<br>
 *
 * 4. the machine is serializable if its models are. Registry and renderer are not serialized but
 * re-derived when the machine is read back<br>
 */
public final class DiagramMachine implements Serializable {
  private static final long serialVersionUID = 1L;
  private static final Logger logger = LogManager.getLogger(DiagramMachine.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final MachineDefinition markup;
  private final DiagramConfiguration config;
  private final List<Object> models = new ArrayList<>();

  private transient GraphRegistry registry;
  private transient GraphRenderer renderer;

  public DiagramMachine(final MachineDefinition markup) throws DiagramException {
    this(markup, DiagramConfiguration.defaults());
  }

  public DiagramMachine(final MachineDefinition markup, final DiagramConfiguration config)
      throws DiagramException {
    if (markup == null) {
      throw new DiagramException(Code.MARKUP_INCOMPLETE, "Machine markup cannot be null");
    }
    if (config == null) {
      throw new DiagramException(Code.INVALID_DIAGRAM_CONFIG, "Configuration cannot be null");
    }
    this.markup = markup;
    this.config = config;
    this.registry = new GraphRegistry(config.getBindingName());
    this.renderer = GraphRenderers.select(config.getRendererType());
    logInfo("Created diagram machine " + markup.getName() + " rendering with "
        + renderer.getType());
  }

  public String getId() {
    return machineId;
  }

  public MachineDefinition getMarkup() {
    return markup;
  }

  public DiagramConfiguration getConfiguration() {
    return config;
  }

  public GraphRenderer getRenderer() {
    return renderer;
  }

  /**
   * Starts observing a model and builds its graph.
   *
   * @throws DiagramException MODEL_BINDING_CONFLICT if the model is observed already or is a
   *         {@link GraphRetrieval} bound under the configured binding name
   */
  public synchronized GraphHandle addModel(final Object model) throws DiagramException {
    registry.register(model, buildGraphModel());
    models.add(model);
    logInfo("Observing model " + model.getClass().getSimpleName() + ", " + models.size()
        + " model(s) total");
    return new GraphHandle(this, model);
  }

  public synchronized List<Object> getModels() {
    return new ArrayList<>(models);
  }

  public void addState(final StateDescriptor state) throws DiagramException {
    synchronized (this) {
      markup.addState(state);
    }
    rebuildGraphs();
  }

  public void addStates(final String... names) throws DiagramException {
    synchronized (this) {
      markup.addStates(names);
    }
    rebuildGraphs();
  }

  public void addTransition(final TransitionDescriptor transition) throws DiagramException {
    synchronized (this) {
      markup.addTransition(transition);
    }
    rebuildGraphs();
  }

  public void addTransition(final String trigger, final String source, final String dest)
      throws DiagramException {
    synchronized (this) {
      markup.addTransition(trigger, source, dest);
    }
    rebuildGraphs();
  }

  /**
   * Runs a state change of {@code model} with diagram styling around it: before the change the
   * overlay is reset and the transition from source to dest is marked previous, after it the
   * model's current state(s) are marked active. A null dest runs the change unstyled.
   */
  public void onTransition(final Object model, final String source, final String dest,
      final Runnable stateChange) {
    final ModelGraph entry = registry.lookup(model);
    if (dest == null || entry == null) {
      if (entry == null) {
        logInfo("Model " + model + " is not observed, state change left unstyled");
      }
      stateChange.run();
      return;
    }
    entry.beginTransition(source, dest);
    try {
      stateChange.run();
    } finally {
      // re-reads the model, its graph may have been rebuilt by the state change
      entry.endTransition();
    }
    if (logger.isDebugEnabled()) {
      logDebug("Transition " + source + " -> " + dest + " styled for " + entry);
    }
  }

  /**
   * @param title graph title, the configured one if null
   * @param forceNew rebuild the model's graph from the markup before rendering
   * @param roi render only the region of interest around the active state(s)
   * @throws DiagramException NO_OBSERVED_MODEL if the model is not observed
   */
  public RenderedGraph renderGraph(final Object model, final String title, final boolean forceNew,
      final boolean roi) throws DiagramException {
    final ModelGraph entry = lookup(model);
    if (forceNew) {
      final GraphModel rebuilt;
      synchronized (this) {
        rebuilt = buildGraphModel();
      }
      entry.rebuild(rebuilt);
    }
    if (renderer == null) {
      throw new DiagramException(Code.BACKEND_UNAVAILABLE);
    }
    return entry.render(title != null ? title : config.getTitle(), roi, renderer,
        config.getStyleSheet());
  }

  /**
   * Graphs spanning several models are not supported, this renders the first observed model.
   */
  public RenderedGraph getCombinedGraph(final String title, final boolean forceNew,
      final boolean roi) throws DiagramException {
    final List<Object> observed = getModels();
    if (observed.isEmpty()) {
      throw new DiagramException(Code.NO_OBSERVED_MODEL);
    }
    logInfo("Combined graphs are not supported, rendering the graph of the first model");
    return renderGraph(observed.get(0), title, forceNew, roi);
  }

  public List<DiagramException> getProblems(final Object model) throws DiagramException {
    return lookup(model).getProblems();
  }

  public void resetStyling(final Object model) throws DiagramException {
    lookup(model).resetStyling();
  }

  public void setNodeStyle(final Object model, final String state, final StyleClass styleClass)
      throws DiagramException {
    lookup(model).setNodeStyle(state, styleClass);
  }

  public void setEdgeStyle(final Object model, final String source, final String dest,
      final StyleClass styleClass) throws DiagramException {
    lookup(model).setEdgeStyle(source, dest, styleClass);
  }

  /**
   * Style override of a node, null if it has none.
   */
  public StyleClass getNodeStyle(final Object model, final String state) throws DiagramException {
    return lookup(model).getNodeStyle(state);
  }

  public StyleClass getEdgeStyle(final Object model, final String source, final String dest)
      throws DiagramException {
    return lookup(model).getEdgeStyle(source, dest);
  }

  /**
   * A snapshot of the model's style overlay.
   */
  public StyleTracker getStyleTracker(final Object model) throws DiagramException {
    return lookup(model).getStyleTracker();
  }

  /**
   * The model's graph model as of the last build.
   */
  public GraphModel getGraphModel(final Object model) throws DiagramException {
    return lookup(model).getGraphModel();
  }

  private ModelGraph lookup(final Object model) throws DiagramException {
    final ModelGraph entry = registry.lookup(model);
    if (entry == null) {
      throw new DiagramException(Code.NO_OBSERVED_MODEL,
          "Model " + model + " is not observed by machine " + machineId);
    }
    return entry;
  }

  private void rebuildGraphs() {
    final GraphModel rebuilt;
    synchronized (this) {
      rebuilt = buildGraphModel();
    }
    registry.rebuildAll(rebuilt);
    if (logger.isDebugEnabled()) {
      logDebug("Rebuilt graphs of " + registry.size() + " model(s)");
    }
  }

  private GraphModel buildGraphModel() {
    return new GraphModelBuilder(config).build(markup);
  }

  private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
    in.defaultReadObject();
    registry = new GraphRegistry(config.getBindingName());
    try {
      renderer = GraphRenderers.select(config.getRendererType());
    } catch (DiagramException problem) {
      logWarning("Graphs cannot be rendered after deserialization", problem);
    }
    final GraphModel graphModel = buildGraphModel();
    for (final Object model : models) {
      try {
        registry.register(model, graphModel);
      } catch (DiagramException problem) {
        logWarning("Graph of model " + model + " could not be re-derived", problem);
      }
    }
    logInfo("Re-derived graphs of " + registry.size() + " model(s) after deserialization");
  }

  private void logInfo(final String msg) {
    logger.info("[m:" + machineId + "] " + msg);
  }

  private void logDebug(final String msg) {
    logger.debug("[m:" + machineId + "] " + msg);
  }

  private void logWarning(final String msg, final Throwable problem) {
    logger.warn("[m:" + machineId + "] " + msg, problem);
  }

  @Override
  public String toString() {
    return "DiagramMachine [id=" + machineId + ", markup=" + markup.getName() + ", models="
        + models.size() + "]";
  }
}
