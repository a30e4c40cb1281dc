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

package com.pcrefine.analysis;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Node.Flag;
import com.pcrefine.ast.Token;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Finds the abstract members a class inherits without implementing them.
 *
 * <p>The walk goes from the class's direct base toward the root of its hierarchy. A signature is
 * {@code M:name(paramCount)} for a method and {@code P:name} for a property. Concrete members of
 * the class and of each ancestor visited are recorded as implemented before the next ancestor is
 * examined, so an implementation in a more derived type always wins, and only the first (most
 * derived) abstract declaration of a signature is kept. Every interface member is abstract.
 *
 * <p>Types that cannot be resolved, including resolvers that throw, end their branch of the walk
 * without failing it. A type that (erroneously) appears twice in its own ancestry is visited once.
 *
 * <p>Both {@link CheckUnimplementedAbstractMembers} and the implementing quick fix use this class,
 * so what is reported is exactly what gets generated.
 */
public final class AbstractMemberCollector {
  private static final Logger logger = Logger.getLogger(AbstractMemberCollector.class.getName());

  /** An inherited abstract member. */
  public record AbstractMember(String signature, Node declaration, String declaringType) {
    public String getName() {
      return declaration.getStringOrEmpty();
    }

    public boolean isMethod() {
      return declaration.getToken() == Token.METHOD;
    }

    public boolean isProperty() {
      return declaration.getToken() == Token.PROPERTY;
    }
  }

  private final TypeResolver resolver;

  public AbstractMemberCollector(TypeResolver resolver) {
    this.resolver = checkNotNull(resolver);
  }

  /** The EXTENDS node of a class or interface, or null if it has no base type. */
  public static @Nullable Node getBaseTypeRef(Node type) {
    return type.getFirstChildOfType(Token.EXTENDS);
  }

  /**
   * Returns the abstract members {@code classNode} does not implement, methods first, each group
   * in the order the walk found them.
   */
  public ImmutableList<AbstractMember> collectMissing(Node classNode) {
    checkArgument(classNode.isClass(), "Not a class: %s", classNode);
    Node baseRef = getBaseTypeRef(classNode);
    if (baseRef == null) {
      return ImmutableList.of();
    }
    Set<String> implemented = new HashSet<>();
    addImplementedSignatures(classNode, implemented);
    Map<String, AbstractMember> abstracts = new LinkedHashMap<>();
    collect(baseRef.getStringOrEmpty(), implemented, abstracts, new HashSet<>());

    ImmutableList.Builder<AbstractMember> methods = ImmutableList.builder();
    ImmutableList.Builder<AbstractMember> properties = ImmutableList.builder();
    for (AbstractMember member : abstracts.values()) {
      (member.isMethod() ? methods : properties).add(member);
    }
    return methods.addAll(properties.build()).build();
  }

  private void collect(
      String typeName,
      Set<String> implemented,
      Map<String, AbstractMember> abstracts,
      Set<String> visited) {
    if (typeName.isEmpty() || !visited.add(typeName.toLowerCase(Locale.ROOT))) {
      return;
    }
    Node type = resolveTypeDeclaration(typeName);
    if (type == null) {
      return;
    }
    boolean isInterface = type.isInterface();
    Node members = type.getFirstChildOfType(Token.CLASS_MEMBERS);
    if (members != null) {
      for (Node member : members.children()) {
        String signature = signatureOf(member);
        if (signature == null || !(isInterface || member.hasFlag(Flag.ABSTRACT))) {
          continue;
        }
        if (!implemented.contains(signature)) {
          abstracts.putIfAbsent(signature, new AbstractMember(signature, member, typeName));
        }
      }
    }
    if (!isInterface) {
      addImplementedSignatures(type, implemented);
    }
    Node baseRef = getBaseTypeRef(type);
    if (baseRef != null) {
      collect(baseRef.getStringOrEmpty(), implemented, abstracts, visited);
    }
  }

  private @Nullable Node resolveTypeDeclaration(String typeName) {
    Node program;
    try {
      program = resolver.resolve(typeName);
    } catch (RuntimeException e) {
      logger.fine("Could not resolve " + typeName + ": " + e);
      return null;
    }
    if (program == null) {
      logger.fine("Unknown type " + typeName);
      return null;
    }
    Node type = program.getFirstChildOfType(Token.CLASS);
    return type != null ? type : program.getFirstChildOfType(Token.INTERFACE);
  }

  private static void addImplementedSignatures(Node type, Set<String> implemented) {
    Node members = type.getFirstChildOfType(Token.CLASS_MEMBERS);
    if (members == null) {
      return;
    }
    for (Node member : members.children()) {
      String signature = signatureOf(member);
      if (signature != null && !member.hasFlag(Flag.ABSTRACT) && !isConstructor(member, type)) {
        implemented.add(signature);
      }
    }
  }

  /** Returns the signature of a method header or property, or null for other members. */
  static @Nullable String signatureOf(Node member) {
    String name = member.getStringOrEmpty().toLowerCase(Locale.ROOT);
    switch (member.getToken()) {
      case METHOD:
        Node params = member.getFirstChildOfType(Token.PARAM_LIST);
        int count = params == null ? 0 : params.getChildCount();
        return "M:" + name + "(" + count + ")";
      case PROPERTY:
        return "P:" + name;
      default:
        return null;
    }
  }

  /** A constructor is a method named like its class. */
  public static boolean isConstructor(Node method, Node type) {
    return method.getToken() == Token.METHOD
        && method.getStringOrEmpty().equalsIgnoreCase(type.getStringOrEmpty());
  }

  /** The tooltip describing {@code missing}. */
  public static String describe(ImmutableList<AbstractMember> missing) {
    StringBuilder sb = new StringBuilder("Missing implementations:");
    for (AbstractMember member : missing) {
      sb.append(member.isMethod() ? "\n - Method: " : "\n - Property: ").append(member.getName());
    }
    return sb.toString();
  }
}
