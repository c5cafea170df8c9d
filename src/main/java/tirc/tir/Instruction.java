package tirc.tir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import tirc.ast.BinOp;
import tirc.util.Identifier;

/**
 * A non-terminating three-address instruction. Every operand and destination is an {@link
 * Identifier}; the only immediate is the literal of {@link Const}.
 *
 * <p>Instructions are immutable and compare structurally.
 */
public abstract class Instruction {

  private Instruction() {}

  public abstract <T> T accept(Visitor<T> visitor);

  /** The variables this instruction reads. */
  public abstract List<Identifier> uses();

  /** The variable this instruction writes, if any. */
  public abstract List<Identifier> defs();

  @Override
  public String toString() {
    return accept(TirPrinter.INSTRUCTION_FORMATTER);
  }

  /** {@code dst = src} */
  public static class Copy extends Instruction {
    public final Identifier dst;
    public final Identifier src;

    public Copy(Identifier dst, Identifier src) {
      this.dst = checkNotNull(dst);
      this.src = checkNotNull(src);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }

    @Override
    public List<Identifier> uses() {
      return ImmutableList.of(src);
    }

    @Override
    public List<Identifier> defs() {
      return ImmutableList.of(dst);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Copy copy = (Copy) o;
      return dst.equals(copy.dst) && src.equals(copy.src);
    }

    @Override
    public int hashCode() {
      return Objects.hash(dst, src);
    }
  }

  public static class Print extends Instruction {
    public final Identifier value;

    public Print(Identifier value) {
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }

    @Override
    public List<Identifier> uses() {
      return ImmutableList.of(value);
    }

    @Override
    public List<Identifier> defs() {
      return ImmutableList.of();
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      return value.equals(((Print) o).value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Print.class, value);
    }
  }

  public static class Read extends Instruction {
    public final Identifier dst;

    public Read(Identifier dst) {
      this.dst = checkNotNull(dst);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }

    @Override
    public List<Identifier> uses() {
      return ImmutableList.of();
    }

    @Override
    public List<Identifier> defs() {
      return ImmutableList.of(dst);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      return dst.equals(((Read) o).dst);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Read.class, dst);
    }
  }

  /** Materializes an integer literal. */
  public static class Const extends Instruction {
    public final Identifier dst;
    public final long literal;

    public Const(Identifier dst, long literal) {
      this.dst = checkNotNull(dst);
      this.literal = literal;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }

    @Override
    public List<Identifier> uses() {
      return ImmutableList.of();
    }

    @Override
    public List<Identifier> defs() {
      return ImmutableList.of(dst);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Const that = (Const) o;
      return literal == that.literal && dst.equals(that.dst);
    }

    @Override
    public int hashCode() {
      return Objects.hash(dst, literal);
    }
  }

  /** {@code dst = lhs op rhs} */
  public static class Arith extends Instruction {
    public final BinOp op;
    public final Identifier dst;
    public final Identifier lhs;
    public final Identifier rhs;

    public Arith(BinOp op, Identifier dst, Identifier lhs, Identifier rhs) {
      this.op = checkNotNull(op);
      this.dst = checkNotNull(dst);
      this.lhs = checkNotNull(lhs);
      this.rhs = checkNotNull(rhs);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visit(this);
    }

    @Override
    public List<Identifier> uses() {
      return ImmutableList.of(lhs, rhs);
    }

    @Override
    public List<Identifier> defs() {
      return ImmutableList.of(dst);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Arith arith = (Arith) o;
      return op == arith.op
          && dst.equals(arith.dst)
          && lhs.equals(arith.lhs)
          && rhs.equals(arith.rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, dst, lhs, rhs);
    }
  }

  public interface Visitor<T> {
    T visit(Copy copy);

    T visit(Print print);

    T visit(Read read);

    T visit(Const constant);

    T visit(Arith arith);
  }
}
