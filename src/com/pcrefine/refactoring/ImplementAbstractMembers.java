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

package com.pcrefine.refactoring;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.pcrefine.analysis.AbstractMemberCollector;
import com.pcrefine.analysis.AbstractMemberCollector.AbstractMember;
import com.pcrefine.analysis.TypeResolver;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Node.Flag;
import com.pcrefine.ast.Token;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Quick fix that declares and stubs out every abstract member the class inherits without
 * implementing.
 *
 * <p>Headers for the missing methods and properties go at the top of the class declaration
 * section. Each method also gets an implementation, after the last existing one, that throws
 * until it is filled in.
 */
public final class ImplementAbstractMembers extends Refactoring {

  private static final String INDENT = "   ";

  private final TypeResolver resolver;
  private @Nullable Node targetClass;
  private ImmutableList<AbstractMember> missing = ImmutableList.of();

  public ImplementAbstractMembers(EditorContext editor, TypeResolver resolver) {
    super(editor);
    this.resolver = checkNotNull(resolver);
  }

  @Override
  public String getDescription() {
    return "Implement missing abstract members";
  }

  @Override
  public boolean runsOnIncompleteParse() {
    return false;
  }

  @Override
  protected RefactorResult validate(Node root) {
    targetClass = root.getFirstChildOfType(Token.CLASS);
    if (targetClass == null) {
      return RefactorResult.failed("No class found to implement abstract members in");
    }
    if (AbstractMemberCollector.getBaseTypeRef(targetClass) == null) {
      return RefactorResult.failed(
          "Class does not extend another class or implement an interface");
    }
    missing = new AbstractMemberCollector(resolver).collectMissing(targetClass);
    if (missing.isEmpty()) {
      return RefactorResult.failed("No abstract members found that need implementation");
    }
    return RefactorResult.SUCCESSFUL;
  }

  @Override
  protected RefactorResult generateEdits(@Nullable String input, EditCollector collector) {
    checkState(targetClass != null);
    StringBuilder headers = new StringBuilder();
    StringBuilder implementations = new StringBuilder();
    for (AbstractMember member : missing) {
      if (member.isMethod()) {
        headers.append(methodHeader(member)).append('\n');
        implementations.append("\n\n").append(methodImplementation(member));
      } else {
        headers.append(propertyHeader(member)).append('\n');
      }
    }
    collector.insert(headerInsertionOffset(), headers.toString(), "Insert abstract member headers");
    if (implementations.length() > 0) {
      collector.insert(
          implementationInsertionOffset(),
          implementations.toString(),
          "Insert implementations for abstract methods");
    }
    return RefactorResult.SUCCESSFUL;
  }

  /** Start of the line of the first declared member, or where {@code end-class} begins. */
  private int headerInsertionOffset() {
    Node members = targetClass.getFirstChildOfType(Token.CLASS_MEMBERS);
    checkState(members != null, "Class without a declaration section: %s", targetClass);
    Node first = members.getFirstChild();
    if (first == null) {
      return members.getEnd();
    }
    EditorContext editor = getEditor();
    return editor.getLineStartOffset(editor.getLineOfOffset(first.getStart()));
  }

  /** Just after the last member implementation, or after the class if it has none. */
  private int implementationInsertionOffset() {
    int offset = -1;
    for (Node child : targetClass.children()) {
      if (child.getBody() != null) {
        offset = Math.max(offset, child.getEnd());
      }
    }
    return offset >= 0 ? offset : targetClass.getEnd();
  }

  private static String methodHeader(AbstractMember member) {
    Node method = member.declaration();
    StringBuilder sb = new StringBuilder(INDENT).append("method ").append(member.getName());
    sb.append('(');
    boolean first = true;
    for (Node param : parameters(method)) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(variableName(param)).append(" As ").append(typeOf(param));
      if (param.hasFlag(Flag.OUT)) {
        sb.append(" out");
      }
    }
    sb.append(')');
    if (method.getTypeName() != null) {
      sb.append(" returns ").append(method.getTypeName());
    }
    return sb.append("; /* Implements ")
        .append(member.declaringType())
        .append('.')
        .append(member.getName())
        .append(" */")
        .toString();
  }

  private static String propertyHeader(AbstractMember member) {
    Node property = member.declaration();
    return INDENT
        + "property "
        + typeOf(property)
        + " "
        + member.getName()
        + (property.hasFlag(Flag.READONLY) ? " readonly" : "")
        + "; /* Implements "
        + member.declaringType()
        + "."
        + member.getName()
        + " */";
  }

  private String methodImplementation(AbstractMember member) {
    Node method = member.declaration();
    String qualifiedName = member.declaringType() + "." + member.getName();
    StringBuilder sb = new StringBuilder("method ").append(member.getName()).append('\n');
    sb.append(INDENT).append("/+ Extends/implements ").append(qualifiedName).append(" +/\n");
    for (Node param : parameters(method)) {
      sb.append(INDENT)
          .append("/+ ")
          .append(variableName(param))
          .append(" as ")
          .append(typeOf(param))
          .append(param.hasFlag(Flag.OUT) ? " out" : "")
          .append(" +/\n");
    }
    sb.append(INDENT)
        .append("throw CreateException(0, 0, \"")
        .append(qualifiedName)
        .append(" not implemented for ")
        .append(targetClass.getStringOrEmpty())
        .append("\");\n");
    if (method.getTypeName() != null) {
      sb.append(INDENT).append("Return ").append(defaultValue(method.getTypeName())).append(";\n");
    }
    return sb.append("end-method;").toString();
  }

  private static ImmutableList<Node> parameters(Node method) {
    Node params = method.getFirstChildOfType(Token.PARAM_LIST);
    return params == null ? ImmutableList.of() : params.children();
  }

  private static String variableName(Node param) {
    String name = param.getStringOrEmpty();
    return name.startsWith("&") ? name : "&" + name;
  }

  private static String typeOf(Node declaration) {
    String type = declaration.getTypeName();
    return type == null ? "any" : type;
  }

  /** The literal a stub returns for a method declared to return {@code typeName}. */
  static String defaultValue(String typeName) {
    switch (typeName.toLowerCase(Locale.ROOT)) {
      case "boolean":
        return "False";
      case "integer":
      case "number":
      case "float":
        return "0";
      case "string":
        return "\"\"";
      default:
        return "Null";
    }
  }
}
