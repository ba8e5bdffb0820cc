package com.github.fsmgraph;

import java.io.Serializable;

/**
 * This class encapsulates all the configuration parameters for diagram generation. Use the
 * {@code DiagramConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If no title is set, graphs are titled "State Machine".<br>
 * 2. Conditions, state attributes and auto transitions are hidden unless switched on.<br>
 * 3. The renderer type is a preference. If that backend is unavailable at startup, the other one
 * is used instead.<br>
 * 4. The binding name is the method name a model must not already expose for graph retrieval to be
 * bound to it.<br>
 */
public final class DiagramConfiguration implements Serializable {
  private static final long serialVersionUID = 1L;

  static final String DEFAULT_TITLE = "State Machine";
  static final String DEFAULT_BINDING_NAME = "getGraph";

  private final String title;
  private final boolean showConditions;
  private final boolean showStateAttributes;
  private final boolean showAutoTransitions;
  private final RendererType rendererType;
  private final String bindingName;
  private final StyleSheet styleSheet;

  public String getTitle() {
    return title;
  }

  public boolean getShowConditions() {
    return showConditions;
  }

  public boolean getShowStateAttributes() {
    return showStateAttributes;
  }

  public boolean getShowAutoTransitions() {
    return showAutoTransitions;
  }

  public RendererType getRendererType() {
    return rendererType;
  }

  public String getBindingName() {
    return bindingName;
  }

  public StyleSheet getStyleSheet() {
    return styleSheet;
  }

  public final static class DiagramConfigurationBuilder {
    private String title = DEFAULT_TITLE;
    private boolean showConditions;
    private boolean showStateAttributes;
    private boolean showAutoTransitions;
    private RendererType rendererType = RendererType.DOT;
    private String bindingName = DEFAULT_BINDING_NAME;
    private StyleSheet styleSheet = StyleSheet.defaults();

    public static DiagramConfigurationBuilder newBuilder() {
      return new DiagramConfigurationBuilder();
    }

    public DiagramConfigurationBuilder title(final String title) {
      this.title = title;
      return this;
    }

    public DiagramConfigurationBuilder showConditions(boolean showConditions) {
      this.showConditions = showConditions;
      return this;
    }

    public DiagramConfigurationBuilder showStateAttributes(boolean showStateAttributes) {
      this.showStateAttributes = showStateAttributes;
      return this;
    }

    public DiagramConfigurationBuilder showAutoTransitions(boolean showAutoTransitions) {
      this.showAutoTransitions = showAutoTransitions;
      return this;
    }

    public DiagramConfigurationBuilder rendererType(final RendererType rendererType) {
      this.rendererType = rendererType;
      return this;
    }

    public DiagramConfigurationBuilder bindingName(final String bindingName) {
      this.bindingName = bindingName;
      return this;
    }

    public DiagramConfigurationBuilder styleSheet(final StyleSheet styleSheet) {
      this.styleSheet = styleSheet;
      return this;
    }

    public DiagramConfiguration build() throws DiagramException {
      final DiagramConfiguration config = new DiagramConfiguration(title, showConditions,
          showStateAttributes, showAutoTransitions, rendererType, bindingName, styleSheet);
      config.validate();
      return config;
    }

    private DiagramConfigurationBuilder() {}
  }

  /**
   * Configuration with every option at its default.
   */
  public static DiagramConfiguration defaults() {
    return new DiagramConfiguration(DEFAULT_TITLE, false, false, false, RendererType.DOT,
        DEFAULT_BINDING_NAME, StyleSheet.defaults());
  }

  private void validate() throws DiagramException {
    StringBuilder messages = new StringBuilder();
    if (title == null) {
      messages.append("Title cannot be null. ");
    }
    if (rendererType == null) {
      messages.append("RendererType cannot be null. ");
    }
    if (bindingName == null || bindingName.trim().isEmpty()) {
      messages.append("BindingName cannot be null or empty. ");
    }
    if (styleSheet == null) {
      messages.append("StyleSheet cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new DiagramException(DiagramException.Code.INVALID_DIAGRAM_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "DiagramConfiguration [title=" + title + ", showConditions=" + showConditions
        + ", showStateAttributes=" + showStateAttributes + ", showAutoTransitions="
        + showAutoTransitions + ", rendererType=" + rendererType + ", bindingName=" + bindingName
        + "]";
  }

  private DiagramConfiguration(final String title, final boolean showConditions,
      final boolean showStateAttributes, final boolean showAutoTransitions,
      final RendererType rendererType, final String bindingName, final StyleSheet styleSheet) {
    this.title = title;
    this.showConditions = showConditions;
    this.showStateAttributes = showStateAttributes;
    this.showAutoTransitions = showAutoTransitions;
    this.rendererType = rendererType;
    this.bindingName = bindingName;
    this.styleSheet = styleSheet;
  }

}
