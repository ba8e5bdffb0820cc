package com.github.fsmgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgraph.DiagramException.Code;

/**
 * Graph entries of all models observed by one diagram machine, keyed by model identity so that
 * equal but distinct models never share an entry.
 */
final class GraphRegistry {
  private static final Logger logger = LogManager.getLogger(GraphRegistry.class.getSimpleName());

  private final String bindingName;
  private final Map<Object, ModelGraph> entries =
      Collections.synchronizedMap(new IdentityHashMap<>());
  // registration order
  private final List<Object> models = Collections.synchronizedList(new ArrayList<>());

  GraphRegistry(final String bindingName) {
    this.bindingName = bindingName;
  }

  /**
   * Creates the entry of a model. Fails without touching the registry if the model is registered
   * already or if it retrieves graphs of its own under the same binding name.
   */
  ModelGraph register(final Object model, final GraphModel graphModel) throws DiagramException {
    if (model == null) {
      throw new DiagramException(Code.MODEL_BINDING_CONFLICT, "Cannot observe a null model");
    }
    if (model instanceof GraphRetrieval
        && bindingName.equals(((GraphRetrieval) model).getGraphBinding())) {
      throw new DiagramException(Code.MODEL_BINDING_CONFLICT, bindingName,
          "Model " + model.getClass().getName() + " already retrieves graphs as " + bindingName);
    }
    synchronized (entries) {
      if (entries.containsKey(model)) {
        throw new DiagramException(Code.MODEL_BINDING_CONFLICT, bindingName,
            "Model " + model.getClass().getName() + " is already observed");
      }
      final ModelGraph entry = new ModelGraph(model, graphModel);
      entries.put(model, entry);
      models.add(model);
      if (logger.isDebugEnabled()) {
        logger.debug("Registered " + entry);
      }
      return entry;
    }
  }

  ModelGraph lookup(final Object model) {
    return entries.get(model);
  }

  List<Object> getModels() {
    synchronized (models) {
      return new ArrayList<>(models);
    }
  }

  List<ModelGraph> getEntries() {
    final List<ModelGraph> ordered = new ArrayList<>();
    for (final Object model : getModels()) {
      ordered.add(entries.get(model));
    }
    return ordered;
  }

  /**
   * Hands the same rebuilt graph model to every entry.
   */
  void rebuildAll(final GraphModel rebuilt) {
    for (final ModelGraph entry : getEntries()) {
      entry.rebuild(rebuilt);
    }
  }

  int size() {
    return entries.size();
  }
}
