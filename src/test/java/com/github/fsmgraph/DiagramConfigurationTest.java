package com.github.fsmgraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;

import org.junit.Test;

import com.github.fsmgraph.DiagramConfiguration.DiagramConfigurationBuilder;
import com.github.fsmgraph.DiagramException.Code;
import com.github.fsmgraph.StyleSheet.Element;

public class DiagramConfigurationTest {

  @Test
  public void testDefaults() throws DiagramException {
    final DiagramConfiguration config = DiagramConfigurationBuilder.newBuilder().build();
    assertEquals("State Machine", config.getTitle());
    assertFalse(config.getShowConditions());
    assertFalse(config.getShowStateAttributes());
    assertFalse(config.getShowAutoTransitions());
    assertEquals(RendererType.DOT, config.getRendererType());
    assertEquals("getGraph", config.getBindingName());
  }

  @Test
  public void testInvalidConfiguration() {
    try {
      DiagramConfigurationBuilder.newBuilder().title(null).bindingName(" ").build();
      fail("Expected INVALID_DIAGRAM_CONFIG");
    } catch (DiagramException expected) {
      assertEquals(Code.INVALID_DIAGRAM_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("Title"));
      assertTrue(expected.getMessage().contains("BindingName"));
    }
    try {
      DiagramConfigurationBuilder.newBuilder().rendererType(null).build();
      fail("Expected INVALID_DIAGRAM_CONFIG");
    } catch (DiagramException expected) {
      assertEquals(Code.INVALID_DIAGRAM_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testCustomBindingName() throws DiagramException {
    final DiagramConfiguration config =
        DiagramConfigurationBuilder.newBuilder().bindingName("diagram").build();
    final MachineDefinition markup = new MachineDefinition("binding");
    markup.addStates("A");
    final DiagramMachine machine = new DiagramMachine(markup, config);
    try {
      machine.addModel(new DiagramOwner());
      fail("Expected MODEL_BINDING_CONFLICT");
    } catch (DiagramException expected) {
      assertEquals(Code.MODEL_BINDING_CONFLICT, expected.getCode());
      assertEquals("diagram", expected.getSubject());
    }
    // graph retrieval bound under another name is left alone
    final GraphHandle handle = machine.addModel(new DiagramMachineTest.GraphOwner());
    assertEquals(1, handle.getGraph().getModel().getNodes().size());
    assertEquals(1, machine.getModels().size());
  }

  private static final class DiagramOwner implements GraphRetrieval {
    @Override
    public String getGraphBinding() {
      return "diagram";
    }
  }

  @Test
  public void testCustomStyleSheet() throws DiagramException {
    final StyleSheet sheet = StyleSheet.defaults().withAttributes(Element.NODE, StyleClass.ACTIVE,
        Collections.singletonMap("fillcolor", "yellow"));
    final DiagramConfiguration config =
        DiagramConfigurationBuilder.newBuilder().title("Custom").styleSheet(sheet).build();
    assertEquals("yellow",
        config.getStyleSheet().resolve(Element.NODE, StyleClass.ACTIVE).get("fillcolor"));
    assertEquals("darksalmon",
        StyleSheet.defaults().resolve(Element.NODE, StyleClass.ACTIVE).get("fillcolor"));

    final MachineDefinition markup = new MachineDefinition("styled");
    markup.addStates("A");
    final DiagramMachine machine = new DiagramMachine(markup, config);
    final String dot = machine.addModel(new Stuff("styled", "A")).getGraph().getSource();
    assertTrue(dot.contains("fillcolor=\"yellow\""));
    assertTrue(dot.startsWith("digraph \"Custom\""));
  }
}
