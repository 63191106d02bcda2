// Copyright 2024 The Pug Java Syntax Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pug.java.syntax;

import static com.google.common.truth.Truth.assertThat;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the JSON form of trees and tokens. */
@RunWith(JUnit4.class)
public final class NodeJsonTest {

  private static Block parse(String... lines) throws SyntaxError.Exception {
    ParserInput input = ParserInput.fromLines(lines);
    return Parser.parse(Lexer.lex(input, FileOptions.DEFAULT), input, FileOptions.DEFAULT);
  }

  @Test
  public void testTree() throws Exception {
    JsonObject json = NodeJson.encode(parse("p(class='a') hi"), /* locations= */ false);
    JsonObject want =
        JsonParser.parseString(
                "{'type': 'Block', 'nodes': [{"
                    + "'type': 'Tag', 'name': 'p', 'selfClosing': false,"
                    + "'block': {'type': 'Block', 'nodes': [{'type': 'Text', 'val': 'hi'}]},"
                    + "'attrs': [{'type': 'Attribute', 'name': 'class', 'val': \"'a'\","
                    + " 'mustEscape': true}],"
                    + "'attributeBlocks': [], 'isInline': false}]}")
            .getAsJsonObject();
    assertThat(json).isEqualTo(want);
  }

  @Test
  public void testNullFields() throws Exception {
    JsonObject mixin =
        NodeJson.encode(parse("+item"), false).getAsJsonArray("nodes").get(0).getAsJsonObject();
    assertThat(mixin.get("type").getAsString()).isEqualTo("Mixin");
    assertThat(mixin.get("args").isJsonNull()).isTrue();
    assertThat(mixin.get("block").isJsonNull()).isTrue();
    assertThat(mixin.get("call").getAsBoolean()).isTrue();
  }

  @Test
  public void testLocations() throws Exception {
    Tag div = (Tag) parse("div").getNodes().get(0);
    JsonObject loc = NodeJson.encode(div, /* locations= */ true).getAsJsonObject("loc");
    assertThat(loc.get("filename").getAsString()).isEmpty();
    assertThat(loc.getAsJsonObject("start").get("line").getAsInt()).isEqualTo(1);
    assertThat(loc.getAsJsonObject("start").get("column").getAsInt()).isEqualTo(1);
    assertThat(loc.getAsJsonObject("end").get("column").getAsInt()).isEqualTo(4);

    assertThat(NodeJson.encode(div, false).has("loc")).isFalse();
  }

  @Test
  public void testTokens() throws Exception {
    JsonArray json =
        NodeJson.encodeTokens(Lexer.lex(ParserInput.fromLines("div"), FileOptions.DEFAULT), false);
    assertThat(json)
        .isEqualTo(JsonParser.parseString("[{'type': 'tag', 'val': 'div'}, {'type': 'eos'}]"));
  }

  @Test
  public void testTokenFlags() throws Exception {
    JsonArray json =
        NodeJson.encodeTokens(
            Lexer.lex(ParserInput.fromLines("block append s", "p!= x"), FileOptions.DEFAULT),
            false);
    assertThat(json.get(0).getAsJsonObject().get("mode").getAsString()).isEqualTo("append");
    JsonObject code = json.get(3).getAsJsonObject();
    assertThat(code.get("type").getAsString()).isEqualTo("code");
    assertThat(code.get("buffer").getAsBoolean()).isTrue();
    assertThat(code.has("mustEscape")).isFalse();
  }

  @Test
  public void testToJson() throws Exception {
    String text = NodeJson.toJson(parse("div"));
    assertThat(text).contains("\"type\": \"Tag\"");
    assertThat(text).contains("\"filename\": \"\"");
  }
}
