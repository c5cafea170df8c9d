package tirc.lexer;

import java.util.List;
import tirc.TircError;
import tirc.util.SourcePosition;
import tirc.util.SourceRange;

public class LexerError extends TircError {

  public final SourceRange range;

  LexerError(SourcePosition position, String message) {
    super("Lexer error at " + position + ": " + message);
    this.range = new SourceRange(position, 1);
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
