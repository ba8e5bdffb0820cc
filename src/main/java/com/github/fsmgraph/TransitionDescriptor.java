package com.github.fsmgraph;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * This object represents immutable markup of a single transition.
 *
 * A transition without destination is internal: it fires callbacks but never changes state. Auto
 * transitions are the generated {@code to_<state>} ones; anchors are synthesized by the
 * {@link HierarchyFlattener} and stand for "enter the default child of this composite".
 *
 * Markup coming from an external engine may be incomplete, so neither trigger nor source is
 * enforced here. Such problems are reported when the graph is built.
 */
public final class TransitionDescriptor implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String trigger;
  private final String source;
  private final String dest;
  private final List<String> conditions;
  private final List<String> unless;
  private final String label;
  private final boolean auto;
  private final boolean anchor;

  public String getTrigger() {
    return trigger;
  }

  public String getSource() {
    return source;
  }

  public Optional<String> getDest() {
    return Optional.ofNullable(dest);
  }

  public boolean isInternal() {
    return dest == null;
  }

  public List<String> getConditions() {
    return conditions;
  }

  public List<String> getUnless() {
    return unless;
  }

  public Optional<String> getLabel() {
    return Optional.ofNullable(label);
  }

  public boolean isAuto() {
    return auto;
  }

  public boolean isAnchor() {
    return anchor;
  }

  /**
   * Copy of this transition with different endpoints; everything else is kept.
   */
  public TransitionDescriptor withEndpoints(final String source, final String dest) {
    return new TransitionDescriptor(trigger, source, dest, conditions, unless, label, auto, anchor);
  }

  public TransitionDescriptorBuilder toBuilder() {
    final TransitionDescriptorBuilder builder =
        TransitionDescriptorBuilder.newBuilder(trigger, source, dest).label(label).auto(auto)
            .anchor(anchor);
    builder.conditions.addAll(conditions);
    builder.unless.addAll(unless);
    return builder;
  }

  @Override
  public String toString() {
    return "TransitionDescriptor [trigger=" + trigger + ", source=" + source + ", dest=" + dest
        + ", conditions=" + conditions + ", unless=" + unless + ", label=" + label + ", auto="
        + auto + ", anchor=" + anchor + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to describe transitions.
   */
  public final static class TransitionDescriptorBuilder {
    private final String trigger;
    private final String source;
    private final String dest;
    private final List<String> conditions = new ArrayList<>();
    private final List<String> unless = new ArrayList<>();
    private String label;
    private boolean auto;
    private boolean anchor;

    /**
     * A null {@code dest} makes the transition internal.
     */
    public static TransitionDescriptorBuilder newBuilder(final String trigger, final String source,
        final String dest) {
      return new TransitionDescriptorBuilder(trigger, source, dest);
    }

    public TransitionDescriptorBuilder conditions(final String... conditions) {
      this.conditions.addAll(Arrays.asList(conditions));
      return this;
    }

    public TransitionDescriptorBuilder unless(final String... unless) {
      this.unless.addAll(Arrays.asList(unless));
      return this;
    }

    public TransitionDescriptorBuilder label(final String label) {
      this.label = label;
      return this;
    }

    public TransitionDescriptorBuilder auto(boolean auto) {
      this.auto = auto;
      return this;
    }

    public TransitionDescriptorBuilder anchor(boolean anchor) {
      this.anchor = anchor;
      return this;
    }

    public TransitionDescriptor build() {
      return new TransitionDescriptor(trigger, source, dest, conditions, unless, label, auto,
          anchor);
    }

    private TransitionDescriptorBuilder(final String trigger, final String source,
        final String dest) {
      this.trigger = trigger;
      this.source = source;
      this.dest = dest;
    }
  }

  private TransitionDescriptor(final String trigger, final String source, final String dest,
      final List<String> conditions, final List<String> unless, final String label,
      final boolean auto, final boolean anchor) {
    this.trigger = trigger;
    this.source = source;
    this.dest = dest;
    this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    this.unless = Collections.unmodifiableList(new ArrayList<>(unless));
    this.label = label;
    this.auto = auto;
    this.anchor = anchor;
  }
}
