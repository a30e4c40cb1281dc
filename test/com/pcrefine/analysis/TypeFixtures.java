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

import com.pcrefine.ast.IR;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.SourceFixture;
import com.pcrefine.ast.Span;
import com.pcrefine.ast.Visibility;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Class hierarchies with abstract members, shared by the analysis and refactoring tests. */
public final class TypeFixtures {

  public static final SourceFixture SHAPE =
      SourceFixture.of(
          "class Shape",
          "   method Area() Returns number abstract;",
          "   method Perimeter() Returns number abstract;",
          "   method Describe(&prefix As string) abstract;",
          "   method Name() Returns string;",
          "   property string Label abstract;",
          "end-class;");

  public static final SourceFixture DRAWABLE =
      SourceFixture.of(
          "interface Drawable",
          "   method Draw(&canvas As any, &scale As number out);",
          "end-interface;");

  /** Extends PKG:Shape and implements only Area. */
  public static final SourceFixture CIRCLE =
      SourceFixture.of(
          "class Circle extends PKG:Shape",
          "   method Circle();",
          "   method Area() Returns number;",
          "end-class;",
          "method Circle",
          "end-method;",
          "method Area",
          "   Return 3;",
          "end-method;");

  /** Implements PKG:Drawable and declares nothing. */
  public static final SourceFixture CANVAS =
      SourceFixture.of("class Canvas implements PKG:Drawable", "end-class;");

  private TypeFixtures() {}

  /** Resolves PKG:Shape and PKG:Drawable, ignoring case. */
  public static TypeResolver resolver() {
    return qualifiedName -> {
      switch (qualifiedName.toUpperCase(Locale.ROOT)) {
        case "PKG:SHAPE":
          return shape();
        case "PKG:DRAWABLE":
          return drawable();
        default:
          return null;
      }
    };
  }

  public static Node shape() {
    SourceFixture src = SHAPE;
    Node describeParams =
        IR.paramList(
            src.span("(&prefix As string)"),
            IR.param(src.span("&prefix As string"), src.name("&prefix"), "string", false));
    Node members =
        IR.classMembers(
            Span.of(src.offset("   method"), src.offset("end-class;")),
            header(src, "Area", noParams(src, "Area"), "number", true),
            header(src, "Perimeter", noParams(src, "Perimeter"), "number", true),
            header(src, "Describe", describeParams, null, true),
            header(src, "Name", noParams(src, "Name"), "string", false),
            IR.property(
                src.range("property", ";"),
                src.name("Label"),
                "string",
                Visibility.PUBLIC,
                false,
                true));
    return IR.program(src.all(), IR.classDecl(src.all(), src.name("Shape"), null, members));
  }

  public static Node drawable() {
    SourceFixture src = DRAWABLE;
    Node params =
        IR.paramList(
            src.range("(&canvas", ")"),
            IR.param(src.span("&canvas As any"), src.name("&canvas"), "any", false),
            IR.param(src.span("&scale As number out"), src.name("&scale"), "number", true));
    Node members =
        IR.classMembers(
            Span.of(src.offset("   method"), src.offset("end-interface;")),
            header(src, "Draw", params, null, false));
    return IR.program(src.all(), IR.interfaceDecl(src.all(), src.name("Drawable"), null, members));
  }

  public static Node circle() {
    return IR.program(CIRCLE.all(), circleClass());
  }

  /** The Circle class, not yet attached to a program. */
  public static Node circleClass() {
    SourceFixture src = CIRCLE;
    Node members =
        IR.classMembers(
            Span.of(src.offset("   method"), src.offset("end-class;")),
            IR.methodHeader(
                src.range("method Circle(", ";"),
                src.name("Circle", 1),
                noParams(src, "Circle"),
                null,
                Visibility.PUBLIC,
                false),
            header(src, "Area", noParams(src, "Area"), "number", false));
    Node constructor =
        IR.methodImpl(
            src.range("method Circle\n", "end-method;"),
            src.name("Circle", 2),
            IR.block(Span.at(src.offset("end-method;"))));
    Node area =
        IR.methodImpl(
            src.range("method Area\n", "end-method;"),
            src.name("Area", 1),
            IR.block(
                src.range("   Return", ";"),
                IR.returnNode(src.range("Return", ";"), IR.number(src.span("3"), "3"))));
    return IR.classDecl(
        src.all(),
        src.name("Circle"),
        IR.extendsRef(src.span("PKG:Shape"), "PKG:Shape"),
        members,
        constructor,
        area);
  }

  public static Node canvas() {
    SourceFixture src = CANVAS;
    return IR.program(
        src.all(),
        IR.classDecl(
            src.all(),
            src.name("Canvas"),
            IR.implementsRef(src.span("PKG:Drawable"), "PKG:Drawable"),
            IR.classMembers(Span.at(src.offset("end-class;")))));
  }

  /** The empty parameter list following the first {@code name(}. */
  private static Node noParams(SourceFixture src, String name) {
    int open = src.offset(name + "(") + name.length();
    return IR.paramList(Span.of(open, open + 2));
  }

  /** The header {@code method name...;}, the first one declared under that name. */
  private static Node header(
      SourceFixture src,
      String name,
      Node params,
      @Nullable String returnType,
      boolean isAbstract) {
    return IR.methodHeader(
        src.range("method " + name + "(", ";"),
        IR.name(nameSpan(src, name), name),
        params,
        returnType,
        Visibility.PUBLIC,
        isAbstract);
  }

  private static Span nameSpan(SourceFixture src, String name) {
    int start = src.offset("method " + name + "(") + "method ".length();
    return Span.of(start, start + name.length());
  }
}
