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

import com.google.common.collect.ImmutableList;
import com.pcrefine.analysis.AbstractMemberCollector.AbstractMember;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Token;

/**
 * Reports a class that inherits abstract methods or properties without implementing them. The
 * indicator sits on the base type reference and offers the quick fix that generates the missing
 * members.
 */
public final class CheckUnimplementedAbstractMembers extends AnalysisPass {

  /** Id of the quick fix attached to the indicator. */
  public static final String QUICK_FIX = "ImplementAbstractMembers";

  static final DiagnosticType UNIMPLEMENTED_ABSTRACT_MEMBERS =
      DiagnosticType.make(
          "PC_UNIMPLEMENTED_ABSTRACT_MEMBERS",
          CheckLevel.WARNING,
          IndicatorType.SQUIGGLE,
          0xFF00A5FF,
          "{0}");

  @Override
  public boolean runsOnIncompleteParse() {
    return false;
  }

  @Override
  protected void process(Node root) {
    AbstractMemberCollector collector =
        new AbstractMemberCollector(getOptions().getTypeResolver());
    for (Node type : root.getChildrenOfType(Token.CLASS)) {
      Node baseRef = AbstractMemberCollector.getBaseTypeRef(type);
      if (baseRef == null) {
        continue;
      }
      ImmutableList<AbstractMember> missing = collector.collectMissing(type);
      if (!missing.isEmpty()) {
        report(
            baseRef.getSpan(),
            UNIMPLEMENTED_ABSTRACT_MEMBERS,
            ImmutableList.of(QUICK_FIX),
            AbstractMemberCollector.describe(missing));
      }
    }
  }
}
