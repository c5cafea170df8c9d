package tirc.lexer;

import static tirc.token.Terminal.*;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Iterator;
import tirc.TircError;
import tirc.token.Terminal;
import tirc.token.Token;
import tirc.util.SourcePosition;
import tirc.util.SourceRange;

/** Hand written lexer for the prefix notation source language. */
public class Lexer implements Iterator<Token> {

  static final ImmutableMap<String, Terminal> KEYWORDS =
      Maps.uniqueIndex(EnumSet.of(PRINT, READ, IF), t -> t.string.get());

  private final InputStream input;
  private int ch = -2;
  private int line = 1;
  private int column = -1; // after calling nextChar the first time, this will be 0
  private Token eof;
  private SourcePosition tokenBegin;
  private boolean inlineNUL = false;

  public Lexer(InputStream input) {
    this.input = new BufferedInputStream(input);
    nextChar();
  }

  public Lexer(byte[] input) {
    this.input = new ByteArrayInputStream(input);
    nextChar();
  }

  /**
   * Converts {@code input} using {@link String#getBytes(Charset)} with charset {@link
   * StandardCharsets#US_ASCII}
   */
  public Lexer(String input) {
    this(input.getBytes(StandardCharsets.US_ASCII));
  }

  private void nextChar() {
    try {
      ch = input.read();
      if (ch > 127 || ch < -1) {
        throw new LexerError(
            new SourcePosition(line, Math.max(column, 0)),
            String.format("Unsupported character with code %d", ch));
      }
      if (ch == '\n') {
        column = -1;
        line++;
      } else {
        column++;
      }
      inlineNUL = ch == 0 && input.available() > 0;
    } catch (IOException e) {
      throw new TircError(e);
    }
  }

  private Token scan() {
    while (true) {
      skipWhitespace();
      tokenBegin = new SourcePosition(line, column);
      if (isDigit(ch)) {
        return scanInt();
      }
      if (isAlpha(ch) || ch == '_') {
        return scanIdentifier();
      }
      switch (ch) {
        case -1:
        case 0:
          if (inlineNUL) {
            throw new LexerError(tokenBegin, "Invalid NUL byte");
          }
          return (eof = createToken(EOF));
        case '#':
          skipComment();
          continue;
        case '$':
          nextChar();
          return scanKeyword();
        case ':':
          nextChar();
          return scanColon();
        case '+':
          nextChar();
          return createToken(PLUS);
        case '-':
          nextChar();
          return createToken(MINUS);
        case '*':
          nextChar();
          return createToken(MULTIPLY);
        case '/':
          nextChar();
          return createToken(DIVIDE);
        case '<':
          nextChar();
          return createToken(LOWER);
        case '~':
          nextChar();
          return createToken(TILDE);
        case '{':
          nextChar();
          return createToken(LBRACE);
        case '}':
          nextChar();
          return createToken(RBRACE);
      }
      throw new LexerError(
          tokenBegin, String.format("tokens must not start with character '%c' (%d)", ch, ch));
    }
  }

  private void skipWhitespace() {
    while (ch == ' ' || ch == '\n' || ch == '\r' || ch == '\t') {
      nextChar();
    }
  }

  private void skipComment() {
    while (ch != '\n' && ch != -1) {
      nextChar();
    }
  }

  private boolean isDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  private boolean isAlpha(int ch) {
    return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
  }

  private Token scanInt() {
    StringBuilder builder = new StringBuilder();
    while (isDigit(ch)) {
      builder.appendCodePoint(ch);
      nextChar();
    }
    return createToken(INTEGER_LITERAL, builder.toString());
  }

  private Token scanColon() {
    if (ch != '=') {
      throw new LexerError(tokenBegin, "':' must be followed by '='");
    }
    nextChar();
    return createToken(ASSIGN);
  }

  private Token scanKeyword() {
    StringBuilder builder = new StringBuilder("$");
    while (isAlpha(ch)) {
      builder.appendCodePoint(ch);
      nextChar();
    }
    String word = builder.toString();
    Terminal keyword = KEYWORDS.get(word);
    if (keyword == null) {
      throw new LexerError(tokenBegin, String.format("unknown keyword '%s'", word));
    }
    return createToken(keyword);
  }

  private Token scanIdentifier() {
    StringBuilder builder = new StringBuilder();
    builder.appendCodePoint(ch);
    nextChar();
    while (isAlpha(ch) || ch == '_' || isDigit(ch)) {
      builder.appendCodePoint(ch);
      nextChar();
    }
    return createToken(IDENT, builder.toString());
  }

  private Token createToken(Terminal terminal, String content) {
    SourceRange range = new SourceRange(tokenBegin, content.length());
    return new Token(terminal, range, content);
  }

  private Token createToken(Terminal terminal) {
    // EOF is the only terminal without a fixed string
    int length = terminal.string.map(String::length).orElse(1);
    SourceRange range = new SourceRange(tokenBegin, length);
    return new Token(terminal, range, null);
  }

  @Override
  public boolean hasNext() {
    return eof == null;
  }

  @Override
  public Token next() {
    if (eof != null) {
      return eof;
    }
    return scan();
  }
}
