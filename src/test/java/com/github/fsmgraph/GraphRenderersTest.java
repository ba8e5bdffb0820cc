package com.github.fsmgraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.github.fsmgraph.DiagramConfiguration.DiagramConfigurationBuilder;
import com.github.fsmgraph.DiagramException.Code;

/**
 * Tests for backend selection and fallback.
 */
public class GraphRenderersTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  @Test
  public void testPreferredBackend() throws DiagramException {
    assertEquals(RendererType.DOT, GraphRenderers.select(RendererType.DOT).getType());
    assertEquals(RendererType.MERMAID, GraphRenderers.select(RendererType.MERMAID).getType());
  }

  @Test
  public void testFallback() throws DiagramException {
    final GraphRenderer mermaid = new MermaidRenderer();
    final GraphRenderer selected = GraphRenderers.select(RendererType.DOT,
        Arrays.asList(new UnavailableRenderer(), mermaid));
    assertSame(mermaid, selected);
  }

  @Test
  public void testNoBackend() {
    try {
      GraphRenderers.select(RendererType.DOT,
          Collections.<GraphRenderer>singletonList(new UnavailableRenderer()));
      fail("Expected BACKEND_UNAVAILABLE");
    } catch (DiagramException expected) {
      assertEquals(Code.BACKEND_UNAVAILABLE, expected.getCode());
    }
  }

  @Test
  public void testMachineUsesConfiguredBackend() throws DiagramException {
    final MachineDefinition markup = new MachineDefinition("backend");
    markup.addStates("A", "B");
    markup.addTransition("go", "A", "B");
    final DiagramConfiguration config =
        DiagramConfigurationBuilder.newBuilder().rendererType(RendererType.MERMAID).build();
    final DiagramMachine machine = new DiagramMachine(markup, config);
    final RenderedGraph graph = machine.addModel(new Stuff("backend", "A")).getGraph();
    assertEquals(RendererType.MERMAID, graph.getType());
    assertEquals(StyleClass.ACTIVE, graph.getNodeStyle("A"));
  }

  private static final class UnavailableRenderer implements GraphRenderer {
    @Override
    public RendererType getType() {
      return RendererType.DOT;
    }

    @Override
    public boolean isAvailable() {
      return false;
    }

    @Override
    public RenderedGraph generate(final GraphAttributes attributes, final GraphModel model,
        final StyleSheet styleSheet) {
      throw new UnsupportedOperationException();
    }
  }
}
