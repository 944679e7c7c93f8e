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

package com.google.devtools.pasta.parse;

import static com.google.common.truth.Truth.assertThat;

import com.google.devtools.pasta.base.NodeKind;
import com.google.devtools.pasta.base.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParserAdapterTest {
  @Test
  public void testLoadBestFindsTheBuiltInParser() {
    for (GrammarVersion version : GrammarVersion.values()) {
      assertThat(ParserAdapter.loadBest(version).get()).isInstanceOf(PythonParserAdapter.class);
    }
  }

  @Test
  public void testParseReturnsTreeAndTokens() throws Exception {
    String source = "x = 1  # c\n";
    ParseResult result = new PythonParserAdapter().parse(source, GrammarVersion.PY3_8);
    assertThat(result.getRoot().getKind()).isEqualTo(NodeKind.MODULE);
    assertThat(result.getRoot().getChildCount()).isEqualTo(1);
    StringBuilder text = new StringBuilder();
    for (Token token : result.getTokens()) {
      text.append(token.getText());
    }
    assertThat(text.toString()).isEqualTo(source);
  }

  @Test
  public void testGrammarVersions() {
    assertThat(GrammarVersion.PY2_7.isKeyword("print")).isTrue();
    assertThat(GrammarVersion.PY3_8.isKeyword("print")).isFalse();
    assertThat(GrammarVersion.PY3_8.isKeyword("nonlocal")).isTrue();
    assertThat(GrammarVersion.PY2_7.isKeyword("nonlocal")).isFalse();
    assertThat(GrammarVersion.PY3_8.isPython3()).isTrue();
    assertThat(GrammarVersion.PY2_7.isPython3()).isFalse();
  }
}
