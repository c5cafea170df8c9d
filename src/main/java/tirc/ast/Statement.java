package tirc.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import tirc.util.Identifier;
import tirc.util.SourceCodeReferable;
import tirc.util.SourceRange;

public interface Statement extends SourceCodeReferable {

  <T> T acceptVisitor(Statement.Visitor<T> visitor);

  /** {@code := x e} */
  class Assign extends Node implements Statement {
    public final Identifier target;
    public final Expression value;

    public Assign(Identifier target, Expression value, SourceRange range) {
      super(range);
      this.target = target;
      this.value = value;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitAssign(this);
    }
  }

  class Print extends Node implements Statement {
    public final Expression value;

    public Print(Expression value, SourceRange range) {
      super(range);
      this.value = value;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitPrint(this);
    }
  }

  class Read extends Node implements Statement {
    public final Identifier target;

    public Read(Identifier target, SourceRange range) {
      super(range);
      this.target = target;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitRead(this);
    }
  }

  /** Both branches are always present, possibly empty. */
  class If extends Node implements Statement {
    public final Expression condition;
    public final List<Statement> then;
    public final List<Statement> else_;

    public If(
        Expression condition, List<Statement> then, List<Statement> else_, SourceRange range) {
      super(range);
      this.condition = condition;
      this.then = ImmutableList.copyOf(then);
      this.else_ = ImmutableList.copyOf(else_);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  interface Visitor<T> {

    T visitAssign(Assign that);

    T visitPrint(Print that);

    T visitRead(Read that);

    T visitIf(If that);
  }
}
