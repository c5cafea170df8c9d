package tirc.lower;

import static com.google.common.base.Preconditions.checkState;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tirc.ast.BinOp;
import tirc.ast.Expression;
import tirc.ast.Program;
import tirc.ast.Statement;
import tirc.tir.Block;
import tirc.tir.Instruction;
import tirc.tir.Terminator;
import tirc.tir.TirProgram;
import tirc.util.Identifier;
import tirc.util.SourceRange;

/**
 * Lowers a syntax tree into three-address code in one forward walk.
 *
 * <p>Statements append to a {@link TranslationVector}; expressions additionally return the
 * variable holding their value. The walk starts the {@code entry} block and finally closes
 * whatever block is open with {@link Terminator.Exit}. {@link CfgConstructor} then groups the
 * vector into blocks.
 *
 * <p>Instances carry the state of a single run (declared variables, name counters and the vector)
 * and must not be reused.
 */
public class Lowering
    implements Program.Visitor<TranslationVector>,
        Statement.Visitor<Void>,
        Expression.Visitor<Identifier> {
  private static final Logger LOGGER = LoggerFactory.getLogger("Lowering");

  private final Set<Identifier> declared = new TreeSet<>();
  private final TranslationVector vector = new TranslationVector();
  private final FreshNames fresh = new FreshNames();
  private boolean used = false;

  public static TirProgram lower(Program program) {
    return new Lowering().lowerProgram(program);
  }

  /** Runs the walk but stops before grouping into blocks. */
  public static TranslationVector translate(Program program) {
    return program.acceptVisitor(new Lowering());
  }

  public TirProgram lowerProgram(Program program) {
    program.acceptVisitor(this);
    Map<Identifier, Block> blocks = CfgConstructor.construct(vector);
    LOGGER.debug(
        "lowered {} statements into {} entries, {} blocks, {} declared variables",
        program.statements.size(),
        vector.size(),
        blocks.size(),
        declared.size());
    return new TirProgram(declared, blocks);
  }

  @Override
  public TranslationVector visitProgram(Program that) {
    checkState(!used, "a Lowering instance can only lower a single program");
    used = true;
    vector.openBlock(Identifier.ENTRY);
    that.statements.forEach(s -> s.acceptVisitor(this));
    vector.close(Terminator.Exit.INSTANCE);
    return vector;
  }

  @Override
  public Void visitAssign(Statement.Assign that) {
    declare(that.target);
    Identifier src = that.value.acceptVisitor(this);
    vector.append(new Instruction.Copy(that.target, src));
    return null;
  }

  @Override
  public Void visitPrint(Statement.Print that) {
    Identifier value = that.value.acceptVisitor(this);
    vector.append(new Instruction.Print(value));
    return null;
  }

  @Override
  public Void visitRead(Statement.Read that) {
    declare(that.target);
    vector.append(new Instruction.Read(that.target));
    return null;
  }

  /**
   * Always produces three new blocks, even for empty branches. The join block is left open: the
   * statements following the {@code $if} end up in it.
   */
  @Override
  public Void visitIf(Statement.If that) {
    Identifier trueLabel = fresh.label();
    Identifier falseLabel = fresh.label();
    Identifier joinLabel = fresh.label();
    Identifier guard = that.condition.acceptVisitor(this);
    vector.close(new Terminator.Branch(guard, trueLabel, falseLabel));

    vector.openBlock(trueLabel);
    that.then.forEach(s -> s.acceptVisitor(this));
    vector.close(new Terminator.Jump(joinLabel));

    vector.openBlock(falseLabel);
    that.else_.forEach(s -> s.acceptVisitor(this));
    vector.close(new Terminator.Jump(joinLabel));

    vector.openBlock(joinLabel);
    return null;
  }

  /** Reading a variable costs nothing. Undeclared variables are declared on first use. */
  @Override
  public Identifier visitVariable(Expression.Variable that) {
    declare(that.name);
    return that.name;
  }

  @Override
  public Identifier visitIntegerLiteral(Expression.IntegerLiteral that) {
    Identifier dst = temporary(FreshNames.CONST_PREFIX);
    vector.append(new Instruction.Const(dst, that.literal));
    return dst;
  }

  @Override
  public Identifier visitBinaryOperator(Expression.BinaryOperator that) {
    Identifier lhs = that.left.acceptVisitor(this);
    Identifier rhs = that.right.acceptVisitor(this);
    Identifier dst = temporary(FreshNames.TEMP_PREFIX);
    vector.append(new Instruction.Arith(that.op, dst, lhs, rhs));
    return dst;
  }

  /** {@code ~ e} is compiled as {@code - 0 e}. */
  @Override
  public Identifier visitNegate(Expression.Negate that) {
    SourceRange range = that.range();
    Expression zero = new Expression.IntegerLiteral(0, range);
    return new Expression.BinaryOperator(BinOp.SUB, zero, that.expression, range)
        .acceptVisitor(this);
  }

  private void declare(Identifier variable) {
    declared.add(variable);
  }

  /** Temporaries are declared as soon as they are allocated. */
  private Identifier temporary(String prefix) {
    Identifier temporary = fresh.temporary(prefix);
    declare(temporary);
    return temporary;
  }
}
