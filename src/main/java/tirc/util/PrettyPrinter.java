package tirc.util;

import com.google.common.base.Strings;
import java.util.List;
import tirc.ast.Expression;
import tirc.ast.Program;
import tirc.ast.Statement;

/**
 * An implementation of an AST visitor that pretty-prints the AST back to source code.
 *
 * <p>Instances of this class <em>are</em> stateful (e.g., current indentation level). It is very
 * cheap to create new instances of this class and therefore it is generally not advisable to reuse
 * instances.
 */
public class PrettyPrinter
    implements Program.Visitor<CharSequence>,
        Statement.Visitor<CharSequence>,
        Expression.Visitor<CharSequence> {

  private int indentLevel = 0;

  public PrettyPrinter() {}

  private CharSequence indent() {
    return Strings.repeat("\t", indentLevel);
  }

  @Override
  public CharSequence visitProgram(Program that) {
    StringBuilder sb = new StringBuilder();
    that.statements.forEach(
        s -> sb.append(indent()).append(s.acceptVisitor(this)).append(System.lineSeparator()));
    return sb;
  }

  private CharSequence block(List<Statement> statements) {
    StringBuilder sb = new StringBuilder("{");
    if (statements.isEmpty()) {
      return sb.append(" }");
    }
    sb.append(System.lineSeparator());
    indentLevel++;
    statements
        .stream()
        .map(s -> s.acceptVisitor(this))
        .forEach(s -> sb.append(indent()).append(s).append(System.lineSeparator()));
    indentLevel--;
    return sb.append(indent()).append("}");
  }

  @Override
  public CharSequence visitAssign(Statement.Assign that) {
    return new StringBuilder(":= ")
        .append(that.target)
        .append(" ")
        .append(that.value.acceptVisitor(this));
  }

  @Override
  public CharSequence visitPrint(Statement.Print that) {
    return new StringBuilder("$print ").append(that.value.acceptVisitor(this));
  }

  @Override
  public CharSequence visitRead(Statement.Read that) {
    return new StringBuilder("$read ").append(that.target);
  }

  @Override
  public CharSequence visitIf(Statement.If that) {
    return new StringBuilder("$if ")
        .append(that.condition.acceptVisitor(this))
        .append(" ")
        .append(block(that.then))
        .append(" ")
        .append(block(that.else_));
  }

  @Override
  public CharSequence visitBinaryOperator(Expression.BinaryOperator that) {
    return new StringBuilder(that.op.string)
        .append(" ")
        .append(that.left.acceptVisitor(this))
        .append(" ")
        .append(that.right.acceptVisitor(this));
  }

  @Override
  public CharSequence visitIntegerLiteral(Expression.IntegerLiteral that) {
    return Long.toString(that.literal);
  }

  @Override
  public CharSequence visitNegate(Expression.Negate that) {
    return new StringBuilder("~ ").append(that.expression.acceptVisitor(this));
  }

  @Override
  public CharSequence visitVariable(Expression.Variable that) {
    return that.name.text();
  }
}
