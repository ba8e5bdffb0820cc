package com.github.fsmgraph;

/**
 * A model that retrieves graphs of its own. A diagram machine refuses to observe such a model if
 * its binding name is the one the machine would hand out graph retrieval under.
 */
public interface GraphRetrieval {

  /**
   * Name under which the model exposes its own graph retrieval.
   */
  String getGraphBinding();

}
