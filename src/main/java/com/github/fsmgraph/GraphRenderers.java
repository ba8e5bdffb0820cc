package com.github.fsmgraph;

import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgraph.DiagramException.Code;

/**
 * Picks the rendering backend. The preferred backend wins if it is available, otherwise the first
 * available one takes over.
 */
public final class GraphRenderers {
  private static final Logger logger = LogManager.getLogger(GraphRenderers.class.getSimpleName());

  public static List<GraphRenderer> defaultRenderers() {
    return Arrays.asList(new DotRenderer(), new MermaidRenderer());
  }

  public static GraphRenderer select(final RendererType preferred) throws DiagramException {
    return select(preferred, defaultRenderers());
  }

  public static GraphRenderer select(final RendererType preferred,
      final List<GraphRenderer> candidates) throws DiagramException {
    GraphRenderer fallback = null;
    for (final GraphRenderer candidate : candidates) {
      if (!candidate.isAvailable()) {
        continue;
      }
      if (candidate.getType() == preferred) {
        return candidate;
      }
      if (fallback == null) {
        fallback = candidate;
      }
    }
    if (fallback == null) {
      throw new DiagramException(Code.BACKEND_UNAVAILABLE,
          "No rendering backend available, wanted " + preferred);
    }
    logger.warn("Rendering backend " + preferred + " is not available, falling back to "
        + fallback.getType());
    return fallback;
  }

  private GraphRenderers() {}
}
