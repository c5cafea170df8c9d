package tirc.token;

import java.util.Optional;

/** Enum of terminals used by the Lexer. */
public enum Terminal {

  // keywords
  PRINT("$print"),
  READ("$read"),
  IF("$if"),

  // operators
  ASSIGN(":="),
  PLUS("+"),
  MINUS("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  LOWER("<"),
  TILDE("~"),

  // separators
  LBRACE("{"),
  RBRACE("}"),

  // with dynamic string values (lexval in Token is not null for tokens of this types)
  IDENT,
  INTEGER_LITERAL,

  EOF;

  public final Optional<String> string;

  Terminal(String string) {
    this.string = Optional.ofNullable(string);
  }

  Terminal() {
    this(null);
  }

  public boolean hasLexval() {
    return !string.isPresent() && this != EOF;
  }

  /** True for the terminals that start a binary operator expression. */
  public boolean isBinaryOperator() {
    switch (this) {
      case PLUS:
      case MINUS:
      case MULTIPLY:
      case DIVIDE:
      case LOWER:
        return true;
      default:
        return false;
    }
  }
}
