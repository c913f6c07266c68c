/*
 * Copyright 2010 Google Inc.
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

package constrainedinput;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Reads grammars written one rule per nonterminal:
 *
 * <pre>
 * # comment
 * &lt;start&gt; ::= "&lt;stmt&gt;"
 * &lt;stmt&gt;  ::= "&lt;assgn&gt;" | "&lt;assgn&gt; ; &lt;stmt&gt;"
 * </pre>
 *
 * Alternatives are double-quoted; {@code \"}, {@code \\}, {@code \n} and
 * {@code \t} are the recognized escapes. A rule may continue on the following
 * lines as long as each continuation starts with {@code |}.
 */
public final class GrammarFileParser {
  private final String text;
  private int pos;

  private GrammarFileParser(String text) {
    this.text = text;
    this.pos = 0;
  }

  /**
   * @param text the grammar text
   * @return the grammar it describes
   * @throws GrammarException if the text is malformed or describes an
   *         ill-formed grammar
   */
  public static Grammar parse(String text) {
    return Grammar.create(new GrammarFileParser(text).rules());
  }

  /** Quotes an alternative so that {@link #parse} reads it back verbatim. */
  static String quote(String alternative) {
    StringBuilder builder = new StringBuilder("\"");
    for (char c : alternative.toCharArray()) {
      switch (c) {
        case '"':
          builder.append("\\\"");
          break;
        case '\\':
          builder.append("\\\\");
          break;
        case '\n':
          builder.append("\\n");
          break;
        case '\t':
          builder.append("\\t");
          break;
        default:
          builder.append(c);
      }
    }
    return builder.append('"').toString();
  }

  private Map<String, List<String>> rules() {
    Map<String, List<String>> rules = Maps.newLinkedHashMap();
    skipBlank();
    while (pos < text.length()) {
      String head = nonterminal();
      if (rules.containsKey(head)) {
        throw error("Duplicate rule for " + head);
      }
      skipBlank();
      expect("::=");
      List<String> alternatives = Lists.newArrayList();
      skipBlank();
      alternatives.add(quoted());
      skipBlank();
      while (pos < text.length() && text.charAt(pos) == '|') {
        pos++;
        skipBlank();
        alternatives.add(quoted());
        skipBlank();
      }
      rules.put(head, alternatives);
    }
    return rules;
  }

  private String nonterminal() {
    if (text.charAt(pos) != '<') {
      throw error("Expected a nonterminal");
    }
    int end = text.indexOf('>', pos);
    if (end < 0) {
      throw error("Unterminated nonterminal");
    }
    String name = text.substring(pos, end + 1);
    if (!Grammar.isNonterminal(name)) {
      throw error("Malformed nonterminal " + name);
    }
    pos = end + 1;
    return name;
  }

  private String quoted() {
    if (pos >= text.length() || text.charAt(pos) != '"') {
      throw error("Expected a quoted alternative");
    }
    pos++;
    StringBuilder builder = new StringBuilder();
    while (pos < text.length()) {
      char c = text.charAt(pos++);
      if (c == '"') {
        return builder.toString();
      }
      if (c == '\\') {
        if (pos >= text.length()) {
          break;
        }
        char escaped = text.charAt(pos++);
        switch (escaped) {
          case 'n':
            builder.append('\n');
            break;
          case 't':
            builder.append('\t');
            break;
          case '"':
          case '\\':
            builder.append(escaped);
            break;
          default:
            throw error("Unknown escape \\" + escaped);
        }
      } else {
        builder.append(c);
      }
    }
    throw error("Unterminated string");
  }

  private void expect(String token) {
    if (!text.startsWith(token, pos)) {
      throw error("Expected " + token);
    }
    pos += token.length();
  }

  /** Skips whitespace and comments. */
  private void skipBlank() {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '#') {
        while (pos < text.length() && text.charAt(pos) != '\n') {
          pos++;
        }
      } else if (Character.isWhitespace(c)) {
        pos++;
      } else {
        return;
      }
    }
  }

  private GrammarException error(String message) {
    int line = 1;
    for (int i = 0; i < pos && i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        line++;
      }
    }
    return new GrammarException(message + " at line " + line);
  }
}
