package tirc.token;

import org.jetbrains.annotations.Nullable;
import tirc.util.SourceCodeReferable;
import tirc.util.SourceRange;

/** Instances of this class are immutable. */
public class Token implements SourceCodeReferable {

  public final Terminal terminal;
  public final String lexval;
  private final SourceRange range;

  public Token(Terminal terminal, SourceRange range, @Nullable String lexval) {
    this.terminal = terminal;
    this.range = range;
    this.lexval = lexval == null ? null : lexval.intern();
  }

  @Override
  public SourceRange range() {
    return range;
  }

  /** The concrete text of this token, or {@code "EOF"}. */
  public String text() {
    if (lexval != null) {
      return lexval;
    }
    return terminal.string.orElse("EOF");
  }

  @Override
  public String toString() {
    switch (terminal) {
      case IDENT:
        return "identifier " + lexval;
      case INTEGER_LITERAL:
        return "integer literal " + lexval;
      case EOF:
        return "EOF";
      default:
        return terminal.string.get();
    }
  }
}
