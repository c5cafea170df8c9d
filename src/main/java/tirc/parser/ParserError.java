package tirc.parser;

import java.util.Arrays;
import java.util.List;
import tirc.TircError;
import tirc.token.Terminal;
import tirc.token.Token;
import tirc.util.SourceRange;

public class ParserError extends TircError {

  public final SourceRange range;

  ParserError(SourceRange range, String message) {
    super(String.format("Parser error at %s: %s", range, message));
    this.range = range;
  }

  ParserError(String rule, Terminal expectedTerminal, Token actualToken) {
    super(
        String.format(
            "Parser error at %s parsed via %s: expected %s but %s",
            actualToken.range(), rule, expectedTerminal, describe(actualToken)));
    this.range = actualToken.range();
  }

  ParserError(String rule, Token unexpectedToken, Terminal[] expectedTerminals) {
    super(
        String.format(
            "Parser error at %s parsed via %s: expected one of %s but %s",
            unexpectedToken.range(),
            rule,
            Arrays.toString(expectedTerminals),
            describe(unexpectedToken)));
    this.range = unexpectedToken.range();
  }

  private static String describe(Token actual) {
    if (actual.terminal == Terminal.EOF) {
      return "reached the end of input";
    }
    return String.format("got %s with text '%s'", actual.terminal, actual.text());
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
