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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.beust.jcommander.ParameterException;
import com.google.devtools.pasta.parse.GrammarVersion;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PastaConfigTest {
  @Test
  public void testDefaults() {
    PastaConfig config = new PastaConfig();
    assertThat(config.getGrammarVersion()).isEqualTo(GrammarVersion.PY3_8);
    assertThat(config.getIndentUnit()).isEqualTo("    ");
    assertThat(config.getVerboseLogging()).isFalse();
  }

  @Test
  public void testParseCommandLine() {
    PastaConfig config = new PastaConfig();
    config.parseCommandLine(new String[] {"--grammar_version=PY2_7", "--verbose"});
    assertThat(config.getGrammarVersion()).isEqualTo(GrammarVersion.PY2_7);
    assertThat(config.getIndentUnit()).isEqualTo("    ");
    assertThat(config.getVerboseLogging()).isTrue();
  }

  @Test
  public void testInvalidFlags() {
    assertThrows(
        ParameterException.class,
        () -> new PastaConfig().parseCommandLine(new String[] {"--indent_unit=x"}));
    assertThrows(
        ParameterException.class,
        () -> new PastaConfig().parseCommandLine(new String[] {"--grammar_version=PY4"}));
    assertThrows(
        ParameterException.class,
        () -> new PastaConfig().parseCommandLine(new String[] {"--unknown"}));
  }

  @Test
  public void testSetters() {
    PastaConfig config = new PastaConfig().setIndentUnit("\t").setVerboseLogging(true);
    assertThat(config.getIndentUnit()).isEqualTo("\t");
    assertThat(config.getVerboseLogging()).isTrue();
    assertThrows(IllegalArgumentException.class, () -> config.setIndentUnit(""));
  }

  @Test
  public void testUsageListsFlags() {
    String usage = new PastaConfig("pasta-tool").getUsage();
    assertThat(usage).contains("pasta-tool");
    assertThat(usage).contains("--grammar_version");
    assertThat(usage).contains("--indent_unit");
  }
}
