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

import com.google.gson.stream.JsonWriter;
import com.pcrefine.ast.LineIndex;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Renders the outcome of an analysis as a JSON array of indicator objects followed by a summary
 * object, for hosts that consume indicators out of process.
 */
public final class JsonReportGenerator {
  private final @Nullable LineIndex lines;

  /**
   * @param source the analyzed text, used to add line and column numbers; may be null
   */
  public JsonReportGenerator(@Nullable String source) {
    this.lines = source == null ? null : LineIndex.of(source);
  }

  public String generateReport(AnalysisResult result) {
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(out)) {
      jsonWriter.beginArray();
      for (Indicator indicator : result.indicators()) {
        jsonWriter.beginObject();
        jsonWriter.name("start").value(indicator.start());
        jsonWriter.name("length").value(indicator.length());
        if (lines != null) {
          jsonWriter.name("line").value(lines.getLineOfOffset(indicator.start()) + 1);
          jsonWriter.name("column").value(lines.getColumnOfOffset(indicator.start()));
        }
        jsonWriter.name("type").value(indicator.type().name());
        jsonWriter.name("color").value(String.format(Locale.ROOT, "0x%08X", indicator.color()));
        jsonWriter.name("tooltip").value(indicator.tooltip());
        if (indicator.hasQuickFix()) {
          jsonWriter.name("quickFixes").beginArray();
          for (String quickFix : indicator.quickFixes()) {
            jsonWriter.value(quickFix);
          }
          jsonWriter.endArray();
        }
        jsonWriter.endObject();
      }

      jsonWriter.beginObject();
      jsonWriter.name("level").value(result.success() ? "info" : "error");
      jsonWriter.name("description").value(result.message());
      if (!result.skippedPasses().isEmpty()) {
        jsonWriter.name("skipped").beginArray();
        for (String pass : result.skippedPasses()) {
          jsonWriter.value(pass);
        }
        jsonWriter.endArray();
      }
      jsonWriter.endObject();

      jsonWriter.endArray();
      jsonWriter.flush();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    return out.toString();
  }
}
