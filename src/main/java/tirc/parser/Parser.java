package tirc.parser;

import static tirc.token.Terminal.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import tirc.ast.BinOp;
import tirc.ast.Expression;
import tirc.ast.Program;
import tirc.ast.Statement;
import tirc.token.Terminal;
import tirc.token.Token;
import tirc.util.Identifier;
import tirc.util.SourceRange;

/**
 * Recursive descent parser for the prefix notation source language. Every construct is introduced
 * by its first token, so a single token of look ahead suffices.
 */
public class Parser {
  private static final Token EOF_TOKEN = new Token(EOF, SourceRange.FIRST_CHAR, null);
  private final Iterator<Token> tokens;
  private Token currentToken;

  public Parser(Iterator<Token> tokens) {
    this.tokens = tokens;
  }

  private Token consumeToken() {
    Token eaten = currentToken;
    if (tokens.hasNext()) {
      currentToken = tokens.next();
    } else if (this.currentToken == null) {
      currentToken = EOF_TOKEN;
    } else {
      // past the end, keep handing out single byte EOF tokens
      currentToken = new Token(EOF, new SourceRange(currentToken.range().end, 1), null);
    }
    return eaten;
  }

  private Token expectAndConsume(Terminal terminal) {
    if (currentToken.terminal != terminal) {
      throw new ParserError(
          Thread.currentThread().getStackTrace()[2].getMethodName(), terminal, currentToken);
    }
    return consumeToken();
  }

  private <T> T unexpectCurrentToken(Terminal... expectedTerminals) {
    throw new ParserError(
        Thread.currentThread().getStackTrace()[2].getMethodName(), currentToken, expectedTerminals);
  }

  private boolean isCurrentTokenTypeOf(Terminal terminal) {
    return currentToken.terminal == terminal;
  }

  private boolean isCurrentTokenNotTypeOf(Terminal terminal) {
    return !isCurrentTokenTypeOf(terminal);
  }

  public Program parse() {
    consumeToken();
    return parseProgram();
  }

  /** Program -> Statement* EOF */
  private Program parseProgram() {
    List<Statement> statements = new ArrayList<>();
    while (isCurrentTokenNotTypeOf(EOF)) {
      statements.add(parseStatement());
    }
    SourceRange eof = expectAndConsume(EOF).range();
    // consuming EOF already moved on to whatever the token stream still holds
    if (isCurrentTokenNotTypeOf(EOF)) {
      throw new ParserError(
          currentToken.range(), "There are still leftover tokens after reading a whole program.");
    }
    return new Program(statements, SourceRange.span(SourceRange.FIRST_CHAR, eof));
  }

  /** Statement -> Assign | Print | Read | If */
  private Statement parseStatement() {
    // Nested $if blocks recurse here. A pathologically deep nesting will overflow the stack,
    // which we accept.
    switch (currentToken.terminal) {
      case ASSIGN:
        return parseAssign();
      case PRINT:
        return parsePrint();
      case READ:
        return parseRead();
      case IF:
        return parseIf();
      default:
        return unexpectCurrentToken(ASSIGN, PRINT, READ, IF);
    }
  }

  /** Assign -> := IDENT Expression */
  private Statement parseAssign() {
    SourceRange begin = expectAndConsume(ASSIGN).range();
    Token target = expectAndConsume(IDENT);
    Expression value = parseExpression();
    return new Statement.Assign(
        Identifier.of(target.lexval), value, SourceRange.span(begin, value.range()));
  }

  /** Print -> $print Expression */
  private Statement parsePrint() {
    SourceRange begin = expectAndConsume(PRINT).range();
    Expression value = parseExpression();
    return new Statement.Print(value, SourceRange.span(begin, value.range()));
  }

  /** Read -> $read IDENT */
  private Statement parseRead() {
    SourceRange begin = expectAndConsume(READ).range();
    Token target = expectAndConsume(IDENT);
    return new Statement.Read(
        Identifier.of(target.lexval), SourceRange.span(begin, target.range()));
  }

  /** If -> $if Expression Block Block */
  private Statement parseIf() {
    SourceRange begin = expectAndConsume(IF).range();
    Expression condition = parseExpression();
    List<Statement> then = new ArrayList<>();
    parseBlock(then);
    List<Statement> else_ = new ArrayList<>();
    SourceRange end = parseBlock(else_);
    return new Statement.If(condition, then, else_, SourceRange.span(begin, end));
  }

  /**
   * Block -> { Statement* }
   *
   * @return the range of the closing brace
   */
  private SourceRange parseBlock(List<Statement> statements) {
    expectAndConsume(LBRACE);
    while (isCurrentTokenNotTypeOf(RBRACE) && isCurrentTokenNotTypeOf(EOF)) {
      statements.add(parseStatement());
    }
    return expectAndConsume(RBRACE).range();
  }

  /** Expression -> IDENT | INTEGER_LITERAL | BinOp Expression Expression | ~ Expression */
  private Expression parseExpression() {
    // Prefix operators nest to the right, this is where deeply nested input blows the stack.
    switch (currentToken.terminal) {
      case IDENT:
        Token identifier = expectAndConsume(IDENT);
        return new Expression.Variable(Identifier.of(identifier.lexval), identifier.range());
      case INTEGER_LITERAL:
        return parseIntegerLiteral();
      case TILDE:
        {
          SourceRange begin = expectAndConsume(TILDE).range();
          Expression operand = parseExpression();
          return new Expression.Negate(operand, SourceRange.span(begin, operand.range()));
        }
      default:
        if (currentToken.terminal.isBinaryOperator()) {
          return parseBinaryOperator();
        }
        return unexpectCurrentToken(
            IDENT, INTEGER_LITERAL, PLUS, MINUS, MULTIPLY, DIVIDE, LOWER, TILDE);
    }
  }

  private Expression parseIntegerLiteral() {
    Token literal = expectAndConsume(INTEGER_LITERAL);
    try {
      return new Expression.IntegerLiteral(Long.parseLong(literal.lexval), literal.range());
    } catch (NumberFormatException e) {
      throw new ParserError(
          literal.range(),
          String.format("integer literal %s does not fit into 64 bits", literal.lexval));
    }
  }

  /** BinaryOperator -> (+ | - | * | / | <) Expression Expression */
  private Expression parseBinaryOperator() {
    BinOp op = getBinaryOperator(currentToken);
    SourceRange begin = consumeToken().range();
    Expression left = parseExpression();
    Expression right = parseExpression();
    return new Expression.BinaryOperator(op, left, right, SourceRange.span(begin, right.range()));
  }

  private BinOp getBinaryOperator(Token token) {
    switch (token.terminal) {
      case PLUS:
        return BinOp.ADD;
      case MINUS:
        return BinOp.SUB;
      case MULTIPLY:
        return BinOp.MULTIPLY;
      case DIVIDE:
        return BinOp.DIVIDE;
      case LOWER:
        return BinOp.LOWER;
      default:
        throw new ParserError(token.range(), "Token is not a BinaryOperator");
    }
  }
}
