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
import static com.google.common.base.Preconditions.checkState;

import com.pcrefine.ast.Node.Flag;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class.
 *
 * <p>Every factory takes the source span of the construct it creates as its first argument. A
 * parser front end, or a test, builds trees through these methods so that the structural shape
 * documented on each one holds for every tree the analyses see.
 */
public final class IR {

  private IR() {}

  public static Node program(Span span, Node... children) {
    return Node.builder(Token.PROGRAM).setSpan(span).addChildren(children).build();
  }

  /** A program on which the parser had to recover from syntax errors. */
  public static Node incompleteProgram(Span span, Node... children) {
    return Node.builder(Token.PROGRAM)
        .setSpan(span)
        .setFlag(Flag.HAS_PARSE_ERRORS, true)
        .addChildren(children)
        .build();
  }

  public static Node importDecl(Span span, String qualifiedName) {
    return Node.builder(Token.IMPORT).setSpan(span).setString(qualifiedName).build();
  }

  // Names and literals.

  /** An identifier, classified by its sigil. */
  public static Node name(Span span, String name) {
    return name(span, name, IdentifierKind.fromName(name));
  }

  public static Node name(Span span, String name, IdentifierKind kind) {
    return Node.builder(Token.NAME).setSpan(span).setString(name).setIdentifierKind(kind).build();
  }

  public static Node thisRef(Span span) {
    return name(span, "%This", IdentifierKind.SYSTEM_VARIABLE);
  }

  public static Node memberName(Span span, String name) {
    return Node.builder(Token.MEMBER_NAME).setSpan(span).setString(name).build();
  }

  public static Node string(Span span, String value) {
    return Node.builder(Token.STRING).setSpan(span).setString(value).build();
  }

  public static Node number(Span span, String value) {
    return Node.builder(Token.NUMBER).setSpan(span).setString(value).build();
  }

  public static Node trueNode(Span span) {
    return Node.builder(Token.TRUE).setSpan(span).build();
  }

  public static Node falseNode(Span span) {
    return Node.builder(Token.FALSE).setSpan(span).build();
  }

  public static Node nullNode(Span span) {
    return Node.builder(Token.NULL).setSpan(span).build();
  }

  // Expressions.

  /** {@code target.member}; the member is a MEMBER_NAME. */
  public static Node memberAccess(Span span, Node target, Node member) {
    checkState(member.getToken() == Token.MEMBER_NAME, member);
    return Node.builder(Token.MEMBER_ACCESS).setSpan(span).addChildren(target, member).build();
  }

  /** A call. The first child is the callee, the remaining children are the arguments. */
  public static Node call(Span span, Node callee, Node... args) {
    return Node.builder(Token.CALL).setSpan(span).addChild(callee).addChildren(args).build();
  }

  /** {@code create Type(args)}. */
  public static Node create(Span span, String typeName, Node... args) {
    return Node.builder(Token.CREATE)
        .setSpan(span)
        .setTypeName(typeName)
        .addChildren(args)
        .build();
  }

  public static Node binaryOp(Span span, String operator, Node left, Node right) {
    return Node.builder(Token.BINARY_OP)
        .setSpan(span)
        .setString(operator)
        .addChildren(left, right)
        .build();
  }

  public static Node not(Span span, Node operand) {
    return Node.builder(Token.NOT).setSpan(span).addChild(operand).build();
  }

  public static Node assign(Span span, Node target, Node value) {
    return Node.builder(Token.ASSIGN).setSpan(span).addChildren(target, value).build();
  }

  // Statements.

  public static Node block(Span span, Node... stmts) {
    return Node.builder(Token.BLOCK).setSpan(span).addChildren(stmts).build();
  }

  public static Node block(Span span, List<Node> stmts) {
    return Node.builder(Token.BLOCK).setSpan(span).addChildren(stmts).build();
  }

  public static Node exprResult(Node expr) {
    return Node.builder(Token.EXPR_RESULT).setSpan(expr.getSpan()).addChild(expr).build();
  }

  public static Node ifNode(Span span, Node cond, Node then, @Nullable Node elseBlock) {
    checkState(then.isBlock(), then);
    checkState(elseBlock == null || elseBlock.isBlock(), elseBlock);
    return Node.builder(Token.IF).setSpan(span).addChildren(cond, then).addChild(elseBlock).build();
  }

  /** {@code For &i = from To to ... End-For}; the iterator is a user-variable NAME. */
  public static Node forLoop(Span span, Node iterator, Node from, Node to, Node body) {
    checkState(iterator.isName(), iterator);
    checkState(body.isBlock(), body);
    return Node.builder(Token.FOR).setSpan(span).addChildren(iterator, from, to, body).build();
  }

  public static Node whileLoop(Span span, Node cond, Node body) {
    checkState(body.isBlock(), body);
    return Node.builder(Token.WHILE).setSpan(span).addChildren(cond, body).build();
  }

  public static Node tryCatch(Span span, Node tryBlock, Node... catches) {
    checkState(tryBlock.isBlock(), tryBlock);
    for (Node c : catches) {
      checkState(c.getToken() == Token.CATCH, c);
    }
    return Node.builder(Token.TRY).setSpan(span).addChild(tryBlock).addChildren(catches).build();
  }

  /** {@code catch Type &e}; the exception variable is declared in the catch body's scope. */
  public static Node catchClause(Span span, String typeName, Node exceptionVar, Node body) {
    checkState(exceptionVar.isName(), exceptionVar);
    checkState(body.isBlock(), body);
    return Node.builder(Token.CATCH)
        .setSpan(span)
        .setTypeName(typeName)
        .addChildren(exceptionVar, body)
        .build();
  }

  public static Node returnNode(Span span) {
    return Node.builder(Token.RETURN).setSpan(span).build();
  }

  public static Node returnNode(Span span, Node value) {
    return Node.builder(Token.RETURN).setSpan(span).addChild(value).build();
  }

  public static Node exit(Span span) {
    return Node.builder(Token.EXIT).setSpan(span).build();
  }

  public static Node throwNode(Span span, Node value) {
    return Node.builder(Token.THROW).setSpan(span).addChild(value).build();
  }

  public static Node breakNode(Span span) {
    return Node.builder(Token.BREAK).setSpan(span).build();
  }

  public static Node continueNode(Span span) {
    return Node.builder(Token.CONTINUE).setSpan(span).build();
  }

  /** The {@code Error "message"} statement, which halts the program. */
  public static Node error(Span span, Node message) {
    return Node.builder(Token.ERROR).setSpan(span).addChild(message).build();
  }

  // Variable declarations. Each NAME child may carry one initializer child.

  /** A NAME declared with an initial value, as in {@code Local number &n = 1}. */
  public static Node initializedName(Span span, String name, Node value) {
    return Node.builder(Token.NAME)
        .setSpan(span)
        .setString(name)
        .setIdentifierKind(IdentifierKind.fromName(name))
        .addChild(value)
        .build();
  }

  public static Node localVar(Span span, String typeName, Node... names) {
    return declaration(Token.LOCAL_VAR, span, typeName, null, names);
  }

  public static Node globalVar(Span span, String typeName, Node... names) {
    return declaration(Token.GLOBAL_VAR, span, typeName, null, names);
  }

  public static Node componentVar(Span span, String typeName, Node... names) {
    return declaration(Token.COMPONENT_VAR, span, typeName, null, names);
  }

  public static Node instanceVar(Span span, String typeName, Node... names) {
    return declaration(Token.INSTANCE_VAR, span, typeName, Visibility.PRIVATE, names);
  }

  public static Node constant(Span span, Node name, Node value) {
    checkState(name.isName(), name);
    return Node.builder(Token.CONSTANT).setSpan(span).addChildren(name, value).build();
  }

  private static Node declaration(
      Token token, Span span, String typeName, @Nullable Visibility visibility, Node... names) {
    checkArgument(names.length > 0, "A declaration needs at least one name");
    for (Node name : names) {
      checkState(name.isName(), name);
    }
    return Node.builder(token)
        .setSpan(span)
        .setTypeName(typeName)
        .setVisibility(visibility)
        .addChildren(names)
        .build();
  }

  // Types, members and callables.

  /**
   * {@code class Name [extends Base]} with its declaration section followed by the member
   * implementations (METHOD, GETTER and SETTER nodes with bodies).
   */
  public static Node classDecl(
      Span span, Node name, @Nullable Node extendsRef, Node members, Node... implementations) {
    checkState(name.isName(), name);
    checkState(extendsRef == null || extendsRef.getToken() == Token.EXTENDS, extendsRef);
    checkState(members.getToken() == Token.CLASS_MEMBERS, members);
    for (Node impl : implementations) {
      checkState(impl.getBody() != null, "%s is not an implementation", impl);
    }
    return Node.builder(Token.CLASS)
        .setSpan(span)
        .setString(name.getString())
        .addChildren(name)
        .addChild(extendsRef)
        .addChild(members)
        .addChildren(implementations)
        .build();
  }

  public static Node interfaceDecl(
      Span span, Node name, @Nullable Node extendsRef, Node members) {
    checkState(name.isName(), name);
    checkState(members.getToken() == Token.CLASS_MEMBERS, members);
    return Node.builder(Token.INTERFACE)
        .setSpan(span)
        .setString(name.getString())
        .addChild(name)
        .addChild(extendsRef)
        .addChild(members)
        .build();
  }

  public static Node extendsRef(Span span, String qualifiedName) {
    return Node.builder(Token.EXTENDS).setSpan(span).setString(qualifiedName).build();
  }

  public static Node implementsRef(Span span, String qualifiedName) {
    return Node.builder(Token.EXTENDS)
        .setSpan(span)
        .setString(qualifiedName)
        .setFlag(Flag.IMPLEMENTS, true)
        .build();
  }

  /**
   * The declaration section of a class or interface. Its span ends where {@code end-class} (or
   * {@code end-interface}) begins.
   */
  public static Node classMembers(Span span, Node... members) {
    return Node.builder(Token.CLASS_MEMBERS).setSpan(span).addChildren(members).build();
  }

  /** A method header inside a declaration section: {@code method Name(params) [Returns T]}. */
  public static Node methodHeader(
      Span span,
      Node name,
      Node params,
      @Nullable String returnType,
      Visibility visibility,
      boolean isAbstract) {
    checkState(name.isName(), name);
    checkState(params.getToken() == Token.PARAM_LIST, params);
    return Node.builder(Token.METHOD)
        .setSpan(span)
        .setString(name.getString())
        .setTypeName(returnType)
        .setVisibility(visibility)
        .setFlag(Flag.ABSTRACT, isAbstract)
        .addChildren(name, params)
        .build();
  }

  /** {@code method Name ... end-method}; parameters come from the matching header. */
  public static Node methodImpl(Span span, Node name, Node body) {
    checkState(name.isName(), name);
    checkState(body.isBlock(), body);
    return Node.builder(Token.METHOD)
        .setSpan(span)
        .setString(name.getString())
        .addChildren(name, body)
        .build();
  }

  public static Node function(
      Span span, Node name, Node params, @Nullable String returnType, Node body) {
    checkState(name.isName(), name);
    checkState(params.getToken() == Token.PARAM_LIST, params);
    checkState(body.isBlock(), body);
    return Node.builder(Token.FUNCTION)
        .setSpan(span)
        .setString(name.getString())
        .setTypeName(returnType)
        .addChildren(name, params, body)
        .build();
  }

  public static Node paramList(Span span, Node... params) {
    for (Node param : params) {
      checkState(param.getToken() == Token.PARAM, param);
    }
    return Node.builder(Token.PARAM_LIST).setSpan(span).addChildren(params).build();
  }

  /** {@code &name As Type [out]}; the span covers the whole parameter text. */
  public static Node param(Span span, Node name, String typeName, boolean isOut) {
    checkState(name.isName(), name);
    return Node.builder(Token.PARAM)
        .setSpan(span)
        .setString(name.getString())
        .setTypeName(typeName)
        .setFlag(Flag.OUT, isOut)
        .addChild(name)
        .build();
  }

  public static Node property(
      Span span,
      Node name,
      String typeName,
      Visibility visibility,
      boolean isReadonly,
      boolean isAbstract) {
    checkState(name.isName(), name);
    return Node.builder(Token.PROPERTY)
        .setSpan(span)
        .setString(name.getString())
        .setTypeName(typeName)
        .setVisibility(visibility)
        .setFlag(Flag.READONLY, isReadonly)
        .setFlag(Flag.ABSTRACT, isAbstract)
        .addChild(name)
        .build();
  }

  public static Node getter(Span span, Node name, Node body) {
    return accessor(Token.GETTER, span, name, body);
  }

  public static Node setter(Span span, Node name, Node body) {
    return accessor(Token.SETTER, span, name, body);
  }

  private static Node accessor(Token token, Span span, Node name, Node body) {
    checkState(name.isName(), name);
    checkState(body.isBlock(), body);
    return Node.builder(token)
        .setSpan(span)
        .setString(name.getString())
        .addChildren(name, body)
        .build();
  }
}
