/*
 * Copyright 2026 The Pasta Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.pasta;

import static com.google.common.base.Preconditions.checkArgument;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.base.CharMatcher;
import com.google.devtools.pasta.parse.GrammarVersion;

/** Configuration for parsing and printing Python source. */
@Parameters(separators = "=")
public class PastaConfig {
  @Parameter(
      names = "--verbose",
      description = "Log parse and print summaries at INFO instead of FINE.")
  private boolean verboseLogging;

  @Parameter(
      names = "--grammar_version",
      description = "The Python grammar to parse with: PY2_7 or PY3_8.")
  private GrammarVersion grammarVersion = GrammarVersion.PY3_8;

  @Parameter(
      names = "--indent_unit",
      description =
          "Indentation step for new blocks when the source does not show one. Must be whitespace.")
  private String indentUnit = "    ";

  private final JCommander jc;

  public PastaConfig() {
    this("pasta");
  }

  public PastaConfig(String programName) {
    jc = new JCommander(this);
    jc.setProgramName(programName);
  }

  /**
   * Parses the given command-line arguments, setting each known flag.
   *
   * @throws ParameterException if a flag is unknown or has an invalid value
   */
  public final void parseCommandLine(String[] args) {
    jc.parse(args);
    if (!isIndentation(indentUnit)) {
      throw new ParameterException(
          "--indent_unit must be non-empty whitespace: '" + indentUnit + "'");
    }
  }

  /** Returns the usage message for the flags above. */
  public String getUsage() {
    StringBuilder usage = new StringBuilder();
    jc.getUsageFormatter().usage(usage);
    return usage.toString();
  }

  public final boolean getVerboseLogging() {
    return verboseLogging;
  }

  public final GrammarVersion getGrammarVersion() {
    return grammarVersion;
  }

  public final String getIndentUnit() {
    return indentUnit;
  }

  public PastaConfig setVerboseLogging(boolean verboseLogging) {
    this.verboseLogging = verboseLogging;
    return this;
  }

  public PastaConfig setGrammarVersion(GrammarVersion grammarVersion) {
    this.grammarVersion = grammarVersion;
    return this;
  }

  public PastaConfig setIndentUnit(String indentUnit) {
    checkArgument(isIndentation(indentUnit), "not an indentation: '%s'", indentUnit);
    this.indentUnit = indentUnit;
    return this;
  }

  private static boolean isIndentation(String text) {
    return !text.isEmpty() && CharMatcher.anyOf(" \t").matchesAllOf(text);
  }
}
