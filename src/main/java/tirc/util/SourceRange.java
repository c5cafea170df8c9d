package tirc.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import java.util.List;

/**
 * A half-open interval of source text: {@link #end} is one beyond the last character of the
 * element.
 */
public class SourceRange {
  public static final SourceRange FIRST_CHAR = new SourceRange(SourcePosition.BEGIN_OF_PROGRAM, 1);
  public final SourcePosition begin;
  public final SourcePosition end; // exclusive

  public SourceRange(SourcePosition begin, SourcePosition end) {
    this.begin = checkNotNull(begin);
    this.end = checkNotNull(end);
    checkArgument(begin.compareTo(end) < 0, "SourceRange %s-%s ends before it begins", begin, end);
  }

  public SourceRange(SourcePosition begin, int length) {
    this(begin, begin.moveHorizontal(length));
  }

  /** The smallest range covering both {@code first} and {@code last}. */
  public static SourceRange span(SourceRange first, SourceRange last) {
    return new SourceRange(first.begin, last.end);
  }

  /**
   * Renders the lines this range touches. A range on a single line is underlined with {@code ^},
   * ranges over multiple lines are marked with {@code >} at the side. Positions past the last line
   * point at the end of the file.
   */
  public String annotateSourceFileExcerpt(List<String> sourceFile) {
    if (sourceFile.isEmpty()) {
      return String.format("1| %n   ^%n");
    }
    if (begin.line < end.line) {
      return markLines(sourceFile);
    }
    if (begin.line > sourceFile.size()) {
      String lastLine = sourceFile.get(sourceFile.size() - 1);
      return underline(sourceFile.size(), lastLine, lastLine.length(), 1);
    }
    return underline(
        begin.line, sourceFile.get(begin.line - 1), begin.column, end.column - begin.column);
  }

  private String markLines(List<String> sourceFile) {
    StringBuilder sb = new StringBuilder();
    int digits = Integer.toString(end.line).length();
    int last = Math.min(end.line, sourceFile.size());
    for (int line = Math.max(begin.line, 1); line <= last; line++) {
      sb.append(String.format("%" + digits + "d|> %s%n", line, sourceFile.get(line - 1)));
    }
    return sb.toString();
  }

  /** Tabs in front of the squiggles are kept, so they line up with the text above. */
  private static String underline(int lineNumber, String line, int column, int length) {
    String prefix = lineNumber + "| ";
    String before = line.substring(0, Math.min(column, line.length()));
    String padding =
        CharMatcher.isNot('\t').replaceFrom(before, ' ')
            + Strings.repeat(" ", Math.max(0, column - line.length()));
    return String.format(
        "%s%s%n%s%s%s%n",
        prefix,
        line,
        Strings.repeat(" ", prefix.length()),
        padding,
        Strings.repeat("^", Math.max(1, length)));
  }

  @Override
  public String toString() {
    return String.format("%s-%s", begin, end);
  }
}
