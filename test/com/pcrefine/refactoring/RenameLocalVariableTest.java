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

import static com.google.common.truth.Truth.assertThat;

import com.pcrefine.analysis.SymbolKind;
import com.pcrefine.ast.IR;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.SourceFixture;
import com.pcrefine.ast.Span;
import com.pcrefine.ast.Visibility;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RenameLocalVariableTest {

  private static final SourceFixture COUNTER =
      SourceFixture.of("Local number &count = 0;", "&count = &count + 1;");

  private static Node counterProgram() {
    SourceFixture src = COUNTER;
    Node declaration =
        IR.localVar(
            src.range("Local", ";"),
            "number",
            IR.initializedName(src.span("&count"), "&count", IR.number(src.span("0"), "0")));
    Node increment =
        IR.binaryOp(
            src.range("&count + ", "1"),
            "+",
            src.name("&count", 2),
            IR.number(src.span("1"), "1"));
    Node assign = IR.assign(src.range("&count = &count", "1"), src.name("&count", 1), increment);
    return IR.program(src.all(), declaration, IR.exprResult(assign));
  }

  private static RenameLocalVariable rename(SourceFixture src, int cursor, Node root) {
    RenameLocalVariable refactoring =
        new RenameLocalVariable(new TextEditorContext(src.text(), cursor));
    refactoring.run(root);
    return refactoring;
  }

  @Test
  public void testRenamesDeclarationAndEveryUse() {
    int cursor = COUNTER.offset("&count", 1) + 2;
    RenameLocalVariable refactoring = rename(COUNTER, cursor, counterProgram());

    assertThat(refactoring.getState()).isEqualTo(RefactorState.AWAITING_INPUT);
    assertThat(refactoring.getTarget().getKind()).isEqualTo(SymbolKind.LOCAL);

    RefactorResult result = refactoring.provideInput("total");

    assertThat(result.success()).isTrue();
    assertThat(refactoring.getEdits()).hasSize(3);
    assertThat(refactoring.getEdits().get(0).getDescription()).isEqualTo("Rename &count to &total");
    assertThat(refactoring.applyEdits())
        .isEqualTo(SourceFixture.lines("Local number &total = 0;", "&total = &total + 1;"));
    assertThat(refactoring.getUpdatedCursorPosition())
        .isEqualTo(COUNTER.offset("&count", 1) + "&total".length());
  }

  @Test
  public void testCursorOnDeclaration() {
    RenameLocalVariable refactoring =
        rename(COUNTER, COUNTER.offset("&count") + "&count".length(), counterProgram());

    refactoring.provideInput("  &n  ");

    assertThat(refactoring.applyEdits())
        .isEqualTo(SourceFixture.lines("Local number &n = 0;", "&n = &n + 1;"));
  }

  @Test
  public void testNoVariableAtCursor() {
    RenameLocalVariable refactoring = rename(COUNTER, 0, counterProgram());

    assertThat(refactoring.getState()).isEqualTo(RefactorState.FAILED);
    assertThat(refactoring.getResult().message())
        .isEqualTo("No variable, parameter, or method found at cursor position.");
  }

  @Test
  public void testInvalidName() {
    RenameLocalVariable refactoring =
        rename(COUNTER, COUNTER.offset("&count") + 1, counterProgram());

    RefactorResult result = refactoring.provideInput("1abc");

    assertThat(result.message()).isEqualTo("'&1abc' is not a valid variable name.");
    assertThat(refactoring.getState()).isEqualTo(RefactorState.FAILED);
    assertThat(refactoring.getEdits()).isEmpty();
  }

  @Test
  public void testNameConflict() {
    SourceFixture src = SourceFixture.of("Local number &a, &B;", "&a = &b;");
    Node root =
        IR.program(
            src.all(),
            IR.localVar(src.range("Local", ";"), "number", src.name("&a"), src.name("&B")),
            IR.exprResult(
                IR.assign(src.range("&a = ", "&b"), src.name("&a", 1), src.name("&b"))));
    RenameLocalVariable refactoring = rename(src, src.offset("&a") + 1, root);

    RefactorResult result = refactoring.provideInput("b");

    assertThat(result.message())
        .isEqualTo(
            "Variable '&b' already exists in the current scope. Please choose a different name.");
  }

  @Test
  public void testGlobalCannotBeRenamed() {
    SourceFixture src = SourceFixture.of("Global number &shared;");
    Node root =
        IR.program(
            src.all(), IR.globalVar(src.range("Global", ";"), "number", src.name("&shared")));

    RenameLocalVariable refactoring = rename(src, src.offset("&shared") + 1, root);

    assertThat(refactoring.getResult().message())
        .isEqualTo(
            "Target '&shared' is not a local variable. Only local variables can be renamed.");
  }

  @Test
  public void testInstanceVariableReachedThroughThis() {
    SourceFixture src =
        SourceFixture.of(
            "class Counter",
            "   method Bump();",
            "private",
            "   instance number &hits;",
            "end-class;",
            "method Bump",
            "   %This.hits = &hits;",
            "end-method;");
    Node header =
        IR.methodHeader(
            src.range("method Bump(", ";"),
            src.name("Bump"),
            IR.paramList(src.span("()")),
            null,
            Visibility.PUBLIC,
            false);
    Node access =
        IR.memberAccess(
            src.span("%This.hits"),
            IR.thisRef(src.span("%This")),
            IR.memberName(src.span("hits", 1), "hits"));
    Node body =
        IR.block(
            src.range("   %This", ";"),
            IR.exprResult(IR.assign(src.range("%This", "= &hits"), access, src.name("&hits", 1))));
    Node type =
        IR.classDecl(
            src.range("class", "end-class;"),
            src.name("Counter"),
            null,
            IR.classMembers(
                Span.of(src.offset("   method"), src.offset("end-class;")),
                header,
                IR.instanceVar(src.range("instance", ";"), "number", src.name("&hits"))),
            IR.methodImpl(src.range("method Bump\n", "end-method;"), src.name("Bump", 1), body));
    RenameLocalVariable refactoring =
        rename(src, src.offset("&hits") + 1, IR.program(src.all(), type));

    refactoring.provideInput("&visits");

    assertThat(refactoring.getEdits()).hasSize(3);
    assertThat(refactoring.applyEdits())
        .isEqualTo(
            SourceFixture.lines(
                "class Counter",
                "   method Bump();",
                "private",
                "   instance number &visits;",
                "end-class;",
                "method Bump",
                "   %This.visits = &visits;",
                "end-method;"));
  }

  private static final SourceFixture SHADOWED_COUNTER =
      SourceFixture.of(
          "class Counter",
          "   method Bump();",
          "private",
          "   instance number &hits;",
          "end-class;",
          "method Bump",
          "   Local number &hits;",
          "   %This.hits = &hits;",
          "end-method;");

  @Test
  public void testLocalRenameLeavesMemberAccessAlone() {
    SourceFixture src = SHADOWED_COUNTER;
    RenameLocalVariable refactoring =
        rename(src, src.offset("&hits", 1) + 1, shadowedCounter(src));

    assertThat(refactoring.getTarget().getKind()).isEqualTo(SymbolKind.LOCAL);
    refactoring.provideInput("&visits");

    assertThat(refactoring.getEdits()).hasSize(2);
    assertThat(refactoring.applyEdits())
        .isEqualTo(
            SourceFixture.lines(
                "class Counter",
                "   method Bump();",
                "private",
                "   instance number &hits;",
                "end-class;",
                "method Bump",
                "   Local number &visits;",
                "   %This.hits = &visits;",
                "end-method;"));
  }

  @Test
  public void testInstanceRenameLeavesShadowingLocalAlone() {
    SourceFixture src = SHADOWED_COUNTER;
    RenameLocalVariable refactoring = rename(src, src.offset("&hits") + 1, shadowedCounter(src));

    assertThat(refactoring.getTarget().getKind()).isEqualTo(SymbolKind.INSTANCE);
    refactoring.provideInput("&visits");

    assertThat(refactoring.applyEdits())
        .isEqualTo(
            SourceFixture.lines(
                "class Counter",
                "   method Bump();",
                "private",
                "   instance number &visits;",
                "end-class;",
                "method Bump",
                "   Local number &hits;",
                "   %This.visits = &hits;",
                "end-method;"));
  }

  /** Counter with instance &hits, and a method Bump whose local &hits hides it. */
  private static Node shadowedCounter(SourceFixture src) {
    Node header =
        IR.methodHeader(
            src.range("method Bump(", ";"),
            src.name("Bump"),
            IR.paramList(src.span("()")),
            null,
            Visibility.PUBLIC,
            false);
    Node access =
        IR.memberAccess(
            src.span("%This.hits"),
            IR.thisRef(src.span("%This")),
            IR.memberName(src.span("hits", 2), "hits"));
    Node body =
        IR.block(
            Span.of(src.offset("   Local"), src.offset("end-method;")),
            IR.localVar(src.range("Local", ";"), "number", src.name("&hits", 1)),
            IR.exprResult(IR.assign(src.range("%This", "= &hits"), access, src.name("&hits", 2))));
    Node type =
        IR.classDecl(
            src.range("class", "end-class;"),
            src.name("Counter"),
            null,
            IR.classMembers(
                Span.of(src.offset("   method"), src.offset("end-class;")),
                header,
                IR.instanceVar(src.range("instance", ";"), "number", src.name("&hits"))),
            IR.methodImpl(src.range("method Bump\n", "end-method;"), src.name("Bump", 1), body));
    return IR.program(src.all(), type);
  }
}
