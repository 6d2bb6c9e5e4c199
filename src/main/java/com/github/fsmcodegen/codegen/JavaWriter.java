package com.github.fsmcodegen.codegen;

/**
 * Line oriented source writer that tracks indentation. A line ending in an opening brace indents
 * what follows, a line starting with a closing brace dedents first.
 */
final class JavaWriter {
  private static final String indentUnit = "  ";

  private final StringBuilder source = new StringBuilder();
  private int depth;

  JavaWriter line(final String line) {
    if (line.startsWith("}")) {
      depth = Math.max(0, depth - 1);
    }
    for (int i = 0; i < depth; i++) {
      source.append(indentUnit);
    }
    source.append(line).append('\n');
    if (line.endsWith("{")) {
      depth++;
    }
    return this;
  }

  JavaWriter blank() {
    source.append('\n');
    return this;
  }

  /**
   * Writes a line one level deeper than the current block without opening a new one, used for
   * statements under a {@code case} label.
   */
  JavaWriter nested(final String line) {
    depth++;
    line(line);
    depth--;
    return this;
  }

  JavaWriter indent() {
    depth++;
    return this;
  }

  JavaWriter dedent() {
    depth = Math.max(0, depth - 1);
    return this;
  }

  @Override
  public String toString() {
    return source.toString();
  }
}
