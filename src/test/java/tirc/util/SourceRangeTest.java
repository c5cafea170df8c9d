package tirc.util;

import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsEqual.equalTo;
import static org.junit.Assert.assertThat;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

@RunWith(Parameterized.class)
public class SourceRangeTest {
  private final List<String> sourceFile;
  private final SourceRange range;
  private final String expectedAnnotation;

  public SourceRangeTest(List<String> sourceFile, SourceRange range, String expectedAnnotation) {
    this.sourceFile = sourceFile;
    this.range = range;
    this.expectedAnnotation = expectedAnnotation;
  }

  private static SourceRange sl(int line, int column, int length) {
    return new SourceRange(new SourcePosition(line, column), length);
  }

  private static SourceRange ml(int beginLine, int beginColumn, int endLine, int endColumn) {
    return new SourceRange(
        new SourcePosition(beginLine, beginColumn), new SourcePosition(endLine, endColumn));
  }

  private static List<String> lines(String... lines) {
    return Arrays.asList(lines);
  }

  private static String f(String s) {
    return String.format(s);
  }

  @Parameterized.Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
          {lines(":= x 1"), sl(1, 3, 1), f("1| := x 1%n      ^%n")},
          {lines("$print y"), sl(2, 0, 1), f("1| $print y%n           ^%n")},
          {lines("1", "2", "3", "4"), ml(2, 0, 3, 0), f("2|> 2%n3|> 3%n")},
          {lines("1", "2", "3", "4"), ml(4, 0, 5, 0), f("4|> 4%n")},
          {lines("$if x {", "}", "{ }"), ml(1, 0, 12, 1), f(" 1|> $if x {%n 2|> }%n 3|> { }%n")},
          {lines("\t \t$read x"), sl(1, 9, 1), f("1| \t \t$read x%n   \t \t      ^%n")},
          {Collections.emptyList(), sl(1, 0, 1), f("1| %n   ^%n")},
        });
  }

  @Test
  public void annotateSourceFileExcerpt_correctAnnotations() {
    String actualAnnotation = range.annotateSourceFileExcerpt(sourceFile);

    assertThat(actualAnnotation, is(equalTo(expectedAnnotation)));
  }
}
