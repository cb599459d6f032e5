package io.spelunk.syntax.impl;

import io.spelunk.syntax.api.SourceSpan;
import io.spelunk.syntax.api.SyntaxNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable in-memory {@link SyntaxNode}. Trees are assembled bottom-up with {@link Builder} and
 * frozen by {@link Builder#build()}, which wires every child to its parent.
 *
 * <p>Hosts use it to adapt foreign trees; tests use it to describe small fixtures:
 *
 * <pre>
 * SyntaxNode root =
 *     SimpleSyntaxNode.node("compilation-unit")
 *         .child(SimpleSyntaxNode.node("class").name("A")
 *             .child(SimpleSyntaxNode.node("method").name("M")
 *                 .child(SimpleSyntaxNode.node("if").text("if (x) {}"))))
 *         .build();
 * </pre>
 */
public final class SimpleSyntaxNode implements SyntaxNode {

  private final String typeTag;
  private final String declaredName;
  private final SyntaxNode parent;
  private final List<SyntaxNode> children;
  private final SourceSpan span;
  private final Set<String> modifiers;
  private final String language;
  private final String text;

  private SimpleSyntaxNode(Builder builder, SyntaxNode parent) {
    this.typeTag = builder.typeTag;
    this.declaredName = builder.name;
    this.parent = parent;
    this.span = builder.span;
    this.modifiers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.modifiers));
    this.language = builder.language;
    List<SyntaxNode> built = new ArrayList<>(builder.children.size());
    for (Builder child : builder.children) {
      built.add(new SimpleSyntaxNode(child.inherit(builder.language), this));
    }
    this.children = Collections.unmodifiableList(built);
    this.text = builder.text != null ? builder.text : render();
  }

  /** Starts a builder for a node with the given type tag. */
  public static Builder node(String typeTag) {
    return new Builder(typeTag);
  }

  @Override
  public String typeTag() {
    return typeTag;
  }

  @Override
  public Optional<String> declaredName() {
    return Optional.ofNullable(declaredName);
  }

  @Override
  public List<SyntaxNode> children() {
    return children;
  }

  @Override
  public SyntaxNode parent() {
    return parent;
  }

  @Override
  public SourceSpan span() {
    return span;
  }

  @Override
  public Set<String> modifiers() {
    return modifiers;
  }

  @Override
  public String language() {
    return language;
  }

  @Override
  public String text() {
    return text;
  }

  // Synthesized text for nodes built without explicit source text
  private String render() {
    if (children.isEmpty()) {
      return declaredName != null ? declaredName : typeTag;
    }
    String body = children.stream().map(SyntaxNode::text).collect(Collectors.joining("\n"));
    return declaredName != null ? typeTag + " " + declaredName + "\n" + body : body;
  }

  @Override
  public String toString() {
    return declaredName != null ? typeTag + "[" + declaredName + "]" : typeTag;
  }

  /** Mutable description of a node; children are added as builders and built with the parent. */
  public static final class Builder {
    private final String typeTag;
    private String name;
    private SourceSpan span = SourceSpan.NONE;
    private final Set<String> modifiers = new LinkedHashSet<>();
    private String language;
    private String text;
    private final List<Builder> children = new ArrayList<>();

    private Builder(String typeTag) {
      this.typeTag = Objects.requireNonNull(typeTag, "typeTag");
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder span(SourceSpan span) {
      this.span = Objects.requireNonNull(span, "span");
      return this;
    }

    public Builder modifiers(String... modifiers) {
      this.modifiers.addAll(Arrays.asList(modifiers));
      return this;
    }

    /** Sets the language; children built without one inherit it. */
    public Builder language(String language) {
      this.language = language;
      return this;
    }

    public Builder text(String text) {
      this.text = text;
      return this;
    }

    public Builder child(Builder child) {
      children.add(Objects.requireNonNull(child, "child"));
      return this;
    }

    public Builder children(Builder... children) {
      for (Builder child : children) {
        child(child);
      }
      return this;
    }

    /** Builds this node as the root of a new tree. */
    public SyntaxNode build() {
      return new SimpleSyntaxNode(inherit(null), null);
    }

    private Builder inherit(String parentLanguage) {
      if (language == null) {
        language = parentLanguage != null ? parentLanguage : "C#";
      }
      return this;
    }
  }
}
