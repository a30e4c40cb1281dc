/*
 * Copyright 2026 The PCRefine Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.pcrefine.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A node of a parsed PeopleCode program.
 *
 * <p>Nodes are immutable once built: the token, source span, string payload and children never
 * change. The only field written after construction is the parent link, which a parent sets
 * exactly once on each of its children when the parent itself is built. Any number of analysis
 * passes may therefore share one tree.
 */
public final class Node {

  /** Boolean attributes attached by the parser. */
  public enum Flag {
    ABSTRACT,
    READONLY,
    /** An {@code out} parameter. */
    OUT,
    /** On {@link Token#EXTENDS}, the base is an interface named by {@code implements}. */
    IMPLEMENTS,
    /** On {@link Token#PROGRAM}, the parser recovered from at least one syntax error. */
    HAS_PARSE_ERRORS
  }

  private final Token token;
  private final @Nullable String string;
  private final @Nullable String typeName;
  private final Span span;
  private final IdentifierKind identifierKind;
  private final @Nullable Visibility visibility;
  private final Set<Flag> flags;
  private final ImmutableList<Node> children;
  private @Nullable Node parent;

  private Node(Builder builder) {
    this.token = builder.token;
    this.string = builder.string;
    this.typeName = builder.typeName;
    this.span = builder.span;
    this.identifierKind = builder.identifierKind;
    this.visibility = builder.visibility;
    this.flags = Sets.immutableEnumSet(builder.flags);
    this.children = ImmutableList.copyOf(builder.children);
    for (Node child : children) {
      checkState(child.parent == null, "%s already has a parent", child);
      child.parent = this;
    }
  }

  public static Builder builder(Token token) {
    return new Builder(token);
  }

  public Token getToken() {
    return token;
  }

  /** The name or literal text carried by this node, if any. */
  public @Nullable String getString() {
    return string;
  }

  public String getStringOrEmpty() {
    return string == null ? "" : string;
  }

  /** The declared type of a variable, parameter, property or method return value. */
  public @Nullable String getTypeName() {
    return typeName;
  }

  public Span getSpan() {
    return span;
  }

  public int getStart() {
    return span.start();
  }

  public int getEnd() {
    return span.end();
  }

  public IdentifierKind getIdentifierKind() {
    return identifierKind;
  }

  public @Nullable Visibility getVisibility() {
    return visibility;
  }

  public boolean hasFlag(Flag flag) {
    return flags.contains(flag);
  }

  public ImmutableList<Node> children() {
    return children;
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public int getChildCount() {
    return children.size();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  /** Returns the first child with the given token, or null. */
  public @Nullable Node getFirstChildOfType(Token type) {
    for (Node child : children) {
      if (child.token == type) {
        return child;
      }
    }
    return null;
  }

  public ImmutableList<Node> getChildrenOfType(Token type) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node child : children) {
      if (child.token == type) {
        result.add(child);
      }
    }
    return result.build();
  }

  public @Nullable Node getParent() {
    return parent;
  }

  /** Returns the closest ancestor with the given token, or null. */
  public @Nullable Node getAncestorOfType(Token type) {
    for (Node n = parent; n != null; n = n.parent) {
      if (n.token == type) {
        return n;
      }
    }
    return null;
  }

  /** The NAME child of a declaration such as a class, method, property or parameter. */
  public Node getDeclaredName() {
    Node name = getFirstChildOfType(Token.NAME);
    checkState(name != null, "%s declares no name", this);
    return name;
  }

  /** The BLOCK body of a method implementation, function or accessor; null for a header. */
  public @Nullable Node getBody() {
    return getFirstChildOfType(Token.BLOCK);
  }

  /**
   * Whether this statement unconditionally transfers control away from the statements that
   * follow it in the same block.
   */
  public boolean transfersControl() {
    switch (token) {
      case RETURN:
      case EXIT:
      case THROW:
      case BREAK:
      case CONTINUE:
      case ERROR:
        return true;
      default:
        return false;
    }
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isUserVariable() {
    return token == Token.NAME && identifierKind == IdentifierKind.USER_VARIABLE;
  }

  /** Whether this is the {@code %This} self reference. */
  public boolean isThis() {
    return token == Token.NAME && "%this".equalsIgnoreCase(string);
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isMemberAccess() {
    return token == Token.MEMBER_ACCESS;
  }

  public boolean isClass() {
    return token == Token.CLASS;
  }

  public boolean isInterface() {
    return token == Token.INTERFACE;
  }

  /** A method header declared in a class or interface, as opposed to its implementation. */
  public boolean isMethodHeader() {
    return token == Token.METHOD && parent != null && parent.token == Token.CLASS_MEMBERS;
  }

  public boolean isMethodImplementation() {
    return token == Token.METHOD && getBody() != null;
  }

  public boolean isVariableDeclaration() {
    switch (token) {
      case LOCAL_VAR:
      case INSTANCE_VAR:
      case GLOBAL_VAR:
      case COMPONENT_VAR:
        return true;
      default:
        return false;
    }
  }

  /** Text of this node in {@code source}; the span must be valid. */
  public String getText(String source) {
    checkArgument(span.isValid(), "Invalid span %s", span);
    return source.substring(span.start(), span.end());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (string != null) {
      sb.append(' ').append(string);
    }
    sb.append(' ').append(span);
    return sb.toString();
  }

  /** Builds a {@link Node}; children are owned by the node built from them. */
  public static final class Builder {
    private final Token token;
    private @Nullable String string;
    private @Nullable String typeName;
    private Span span = Span.NONE;
    private IdentifierKind identifierKind = IdentifierKind.GENERIC;
    private @Nullable Visibility visibility;
    private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    private final List<Node> children = new ArrayList<>();

    private Builder(Token token) {
      this.token = checkNotNull(token);
    }

    @CanIgnoreReturnValue
    public Builder setString(@Nullable String string) {
      this.string = string;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTypeName(@Nullable String typeName) {
      this.typeName = typeName;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSpan(Span span) {
      this.span = checkNotNull(span);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setIdentifierKind(IdentifierKind identifierKind) {
      this.identifierKind = checkNotNull(identifierKind);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setVisibility(@Nullable Visibility visibility) {
      this.visibility = visibility;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setFlag(Flag flag, boolean value) {
      if (value) {
        flags.add(flag);
      } else {
        flags.remove(flag);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChild(@Nullable Node child) {
      if (child != null) {
        children.add(child);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChildren(Node... nodes) {
      for (Node child : nodes) {
        addChild(child);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChildren(Iterable<Node> nodes) {
      for (Node child : nodes) {
        addChild(child);
      }
      return this;
    }

    public Node build() {
      return new Node(this);
    }
  }
}
