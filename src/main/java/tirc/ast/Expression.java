package tirc.ast;

import tirc.util.Identifier;
import tirc.util.SourceRange;

public abstract class Expression extends Node {

  Expression(SourceRange range) {
    super(range);
  }

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  public static class BinaryOperator extends Expression {
    public final BinOp op;
    public final Expression left;
    public final Expression right;

    public BinaryOperator(BinOp op, Expression left, Expression right, SourceRange range) {
      super(range);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBinaryOperator(this);
    }
  }

  public static class IntegerLiteral extends Expression {

    public final long literal;

    public IntegerLiteral(long literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIntegerLiteral(this);
    }
  }

  /** Unary minus, written {@code ~ e}. */
  public static class Negate extends Expression {

    public final Expression expression;

    public Negate(Expression expression, SourceRange range) {
      super(range);
      this.expression = expression;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitNegate(this);
    }
  }

  public static class Variable extends Expression {

    public final Identifier name;

    public Variable(Identifier name, SourceRange range) {
      super(range);
      this.name = name;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitVariable(this);
    }
  }

  public interface Visitor<T> {

    T visitBinaryOperator(BinaryOperator that);

    T visitIntegerLiteral(IntegerLiteral that);

    T visitNegate(Negate that);

    T visitVariable(Variable that);
  }
}
