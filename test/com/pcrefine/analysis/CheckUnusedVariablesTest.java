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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.pcrefine.ast.IR;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.SourceFixture;
import com.pcrefine.ast.Span;
import com.pcrefine.ast.Visibility;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CheckUnusedVariablesTest {

  private static ImmutableList<Indicator> analyze(Node root) {
    return new CheckUnusedVariables().run(root, new AnalysisOptions());
  }

  private static ImmutableList<String> tooltips(ImmutableList<Indicator> indicators) {
    ImmutableList.Builder<String> tooltips = ImmutableList.builder();
    for (Indicator indicator : indicators) {
      tooltips.add(indicator.tooltip());
    }
    return tooltips.build();
  }

  @Test
  public void testReportsOnlyTheUnusedLocal() {
    SourceFixture src =
        SourceFixture.of(
            "Local string &unused;", "Local string &used = \"x\";", "WinMessage(&used);");
    Node root =
        IR.program(
            src.all(),
            IR.localVar(src.range("Local string &unused", ";"), "string", src.name("&unused")),
            IR.localVar(
                src.range("Local string &used", ";"),
                "string",
                IR.initializedName(src.span("&used"), "&used", IR.string(src.span("\"x\""), "x"))),
            IR.exprResult(
                IR.call(
                    src.range("WinMessage", ")"), src.name("WinMessage"), src.name("&used", 1))));

    ImmutableList<Indicator> indicators = analyze(root);

    assertThat(indicators).hasSize(1);
    Indicator indicator = indicators.get(0);
    assertThat(indicator.tooltip()).isEqualTo("Unused local variable: &unused");
    assertThat(indicator.start()).isEqualTo(src.offset("&unused"));
    assertThat(indicator.length()).isEqualTo("&unused".length());
    assertThat(indicator.type()).isEqualTo(IndicatorType.TEXTCOLOR);
    assertThat(indicator.color()).isEqualTo(0x73737380);
    assertThat(indicator.quickFixes()).containsExactly(UnusedVariableValidator.QUICK_FIX);
  }

  @Test
  public void testUsedParameterIsNotReported() {
    SourceFixture src =
        SourceFixture.of(
            "Function Greet(&name As string)", "   WinMessage(&name);", "End-Function;");
    Node function =
        IR.function(
            src.all(),
            src.name("Greet"),
            IR.paramList(
                src.span("(&name As string)"),
                IR.param(src.span("&name As string"), src.name("&name"), "string", false)),
            null,
            IR.block(
                src.range("   WinMessage", ";"),
                IR.exprResult(
                    IR.call(
                        src.range("WinMessage", ")"),
                        src.name("WinMessage"),
                        src.name("&name", 1)))));

    assertThat(analyze(IR.program(src.all(), function))).isEmpty();
  }

  @Test
  public void testUnusedParameterAndFunctionVariable() {
    SourceFixture src =
        SourceFixture.of(
            "Function Greet(&name As string)", "   Local number &count;", "End-Function;");
    Node function =
        IR.function(
            src.all(),
            src.name("Greet"),
            IR.paramList(
                src.span("(&name As string)"),
                IR.param(src.span("&name As string"), src.name("&name"), "string", false)),
            null,
            IR.block(
                src.range("   Local", ";"),
                IR.localVar(src.range("Local", ";"), "number", src.name("&count"))));

    assertThat(tooltips(analyze(IR.program(src.all(), function))))
        .containsExactly("Unused parameter: &name", "Unused function variable: &count")
        .inOrder();
  }

  @Test
  public void testMethodAndInstanceVariables() {
    SourceFixture src =
        SourceFixture.of(
            "class Counter",
            "   method Reset();",
            "private",
            "   instance number &hits, &misses;",
            "end-class;",
            "method Reset",
            "   Local number &x;",
            "   %This.hits = 0;",
            "end-method;");
    Node header =
        IR.methodHeader(
            src.range("method Reset(", ";"),
            src.name("Reset"),
            IR.paramList(src.span("()")),
            null,
            Visibility.PUBLIC,
            false);
    Node instance =
        IR.instanceVar(
            src.range("instance", ";"), "number", src.name("&hits"), src.name("&misses"));
    Node access =
        IR.memberAccess(
            src.span("%This.hits"),
            IR.thisRef(src.span("%This")),
            IR.memberName(src.span("hits", 1), "hits"));
    Node body =
        IR.block(
            src.range("   Local", "0;"),
            IR.localVar(src.range("Local", ";"), "number", src.name("&x")),
            IR.exprResult(
                IR.assign(src.range("%This", "0"), access, IR.number(src.span("0"), "0"))));
    Node type =
        IR.classDecl(
            src.range("class", "end-class;"),
            src.name("Counter"),
            null,
            IR.classMembers(
                Span.of(src.offset("   method"), src.offset("end-class;")), header, instance),
            IR.methodImpl(src.range("method Reset\n", "end-method;"), src.name("Reset", 1), body));

    ImmutableList<Indicator> indicators = analyze(IR.program(src.all(), type));

    assertThat(tooltips(indicators))
        .containsExactly("Unused instance variable: &misses", "Unused method variable: &x");
  }

  @Test
  public void testGlobalsAndConstantsAreNotReported() {
    SourceFixture src =
        SourceFixture.of(
            "Global string &shared;", "Component number &count;", "Constant &MAX = 5;");
    Node root =
        IR.program(
            src.all(),
            IR.globalVar(src.range("Global", ";"), "string", src.name("&shared")),
            IR.componentVar(src.range("Component", ";"), "number", src.name("&count")),
            IR.constant(
                src.range("Constant", ";"), src.name("&MAX"), IR.number(src.span("5"), "5")));

    assertThat(analyze(root)).isEmpty();
  }

  @Test
  public void testInnerDeclarationShadowsOuter() {
    SourceFixture src =
        SourceFixture.of(
            "Local number &x;",
            "If True Then",
            "   Local number &x;",
            "   WinMessage(&x);",
            "End-If;");
    Node inner =
        IR.block(
            src.range("   Local", "(&x);"),
            IR.localVar(src.span("Local number &x;", 1), "number", src.name("&x", 1)),
            IR.exprResult(
                IR.call(
                    src.range("WinMessage", ")"), src.name("WinMessage"), src.name("&x", 2))));
    Node root =
        IR.program(
            src.all(),
            IR.localVar(src.range("Local", ";"), "number", src.name("&x")),
            IR.ifNode(src.range("If", "End-If;"), IR.trueNode(src.span("True")), inner, null));

    ImmutableList<Indicator> indicators = analyze(root);

    assertThat(indicators).hasSize(1);
    assertThat(indicators.get(0).start()).isEqualTo(src.offset("&x"));
  }

  @Test
  public void testCheckCanBeTurnedOff() {
    SourceFixture src = SourceFixture.of("Local string &unused;");
    Node root =
        IR.program(
            src.all(), IR.localVar(src.range("Local", ";"), "string", src.name("&unused")));
    AnalysisOptions options =
        new AnalysisOptions()
            .setWarningLevel(CheckUnusedVariables.UNUSED_VARIABLE, CheckLevel.OFF);

    assertThat(new CheckUnusedVariables().run(root, options)).isEmpty();
  }

  @Test
  public void testRerunStartsFresh() {
    SourceFixture src = SourceFixture.of("Local string &unused;");
    Node root =
        IR.program(
            src.all(), IR.localVar(src.range("Local", ";"), "string", src.name("&unused")));
    CheckUnusedVariables pass = new CheckUnusedVariables();

    pass.run(root, new AnalysisOptions());

    assertThat(pass.run(root, new AnalysisOptions())).hasSize(1);
  }

  @Test
  public void testLocalDoesNotHideMemberAccessThroughThis() {
    SourceFixture src =
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

    assertThat(analyze(shadowedCounter(src))).isEmpty();
  }

  @Test
  public void testUnusedCatchVariableIsNotReported() {
    SourceFixture src = SourceFixture.of("try", "   Exit;", "catch Exception &e", "end-try;");
    Node tryCatch =
        IR.tryCatch(
            src.all(),
            IR.block(src.range("   Exit", ";"), IR.exit(src.range("Exit", ";"))),
            IR.catchClause(
                src.range("catch", "&e"),
                "Exception",
                src.name("&e"),
                IR.block(Span.at(src.offset("end-try;")))));

    assertThat(analyze(IR.program(src.all(), tryCatch))).isEmpty();
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
