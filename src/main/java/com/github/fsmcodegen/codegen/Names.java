package com.github.fsmcodegen.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.github.fsmcodegen.FsmException;

/**
 * Maps IR names onto Java identifiers. Words are split on underscores, non-alphanumerics and camel
 * case humps, so {@code play_error_sound}, {@code PlayErrorSound} and {@code playErrorSound} all
 * end up as the same method.
 */
final class Names {
  static final String TERMINATED = "TERMINATED";

  private static final Set<String> keywords = new HashSet<>(Arrays.asList("abstract", "assert",
      "boolean", "break", "byte", "case", "catch", "char", "class", "const", "continue", "default",
      "do", "double", "else", "enum", "extends", "final", "finally", "float", "for", "goto", "if",
      "implements", "import", "instanceof", "int", "interface", "long", "native", "new", "package",
      "private", "protected", "public", "return", "short", "static", "strictfp", "super", "switch",
      "synchronized", "this", "throw", "throws", "transient", "try", "void", "volatile", "while",
      "true", "false", "null", "var", "yield", "record"));

  private Names() {}

  static List<String> words(final String name) {
    final List<String> words = new ArrayList<>();
    final StringBuilder word = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (!Character.isLetterOrDigit(c)) {
        flush(words, word);
        continue;
      }
      if (Character.isUpperCase(c) && word.length() > 0) {
        final char previous = name.charAt(i - 1);
        final boolean nextLower =
            i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
        if (Character.isLowerCase(previous) || Character.isDigit(previous)
            || (Character.isUpperCase(previous) && nextLower)) {
          flush(words, word);
        }
      }
      word.append(c);
    }
    flush(words, word);
    return words;
  }

  private static void flush(final List<String> words, final StringBuilder word) {
    if (word.length() > 0) {
      words.add(word.toString());
      word.setLength(0);
    }
  }

  /**
   * UPPER_SNAKE form for enum constants. The terminal pseudostate maps to {@link #TERMINATED}.
   */
  static String constant(final String name) {
    if ("[*]".equals(name)) {
      return TERMINATED;
    }
    final StringBuilder constant = new StringBuilder();
    for (String word : words(name)) {
      if (constant.length() > 0) {
        constant.append('_');
      }
      constant.append(word.toUpperCase());
    }
    return legal(constant.toString(), "VALUE");
  }

  static String lowerCamel(final String name) {
    final StringBuilder camel = new StringBuilder();
    for (String word : words(name)) {
      camel.append(camel.length() == 0 ? word.toLowerCase() : capitalize(word));
    }
    return legal(camel.toString(), "value");
  }

  static String upperCamel(final String name) {
    final StringBuilder camel = new StringBuilder();
    for (String word : words(name)) {
      camel.append(capitalize(word));
    }
    return legal(camel.toString(), "Fsm");
  }

  private static String capitalize(final String word) {
    return Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase();
  }

  private static String legal(final String identifier, final String fallback) {
    if (identifier.isEmpty()) {
      return fallback;
    }
    if (Character.isDigit(identifier.charAt(0))) {
      return "_" + identifier;
    }
    if (keywords.contains(identifier)) {
      return identifier + "_";
    }
    return identifier;
  }

  /**
   * Maps every name through the given function, failing if two distinct names collapse onto one
   * identifier. Iteration order of the result follows the input.
   */
  static Map<String, String> assign(final Collection<String> names,
      final Function<String, String> mapper, final String what) throws FsmException {
    final Map<String, String> identifiers = new LinkedHashMap<>();
    final Map<String, String> owners = new LinkedHashMap<>();
    for (String name : names) {
      if (identifiers.containsKey(name)) {
        continue;
      }
      final String identifier = mapper.apply(name);
      final String owner = owners.putIfAbsent(identifier, name);
      if (owner != null) {
        throw new FsmException(FsmException.Code.GENERATION_FAILURE, "The " + what + " '" + owner
            + "' and '" + name + "' both map to the java identifier '" + identifier + "'");
      }
      identifiers.put(name, identifier);
    }
    return identifiers;
  }

  static String javaString(final String text) {
    final StringBuilder literal = new StringBuilder("\"");
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      switch (c) {
        case '"':
          literal.append("\\\"");
          break;
        case '\\':
          literal.append("\\\\");
          break;
        case '\n':
          literal.append("\\n");
          break;
        case '\r':
          literal.append("\\r");
          break;
        case '\t':
          literal.append("\\t");
          break;
        default:
          literal.append(c);
      }
    }
    return literal.append('"').toString();
  }

  /**
   * Text that is safe inside a generated comment: it cannot close the comment and carries no
   * unicode escapes for javac to expand.
   */
  static String commentSafe(final String text) {
    return text.replace("*/", "*\\/").replace("\\u", "\\ u").replace('\n', ' ').replace('\r', ' ');
  }
}
