package tirc.tir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import tirc.util.Identifier;

/**
 * The control transfer ending a {@link Block}. Poor man's ADT: the constructor is private, so
 * {@link #match} covers every case.
 */
public abstract class Terminator {

  private Terminator() {}

  /** Labels of the blocks control may continue in. */
  public abstract Set<Identifier> successors();

  public abstract <T> T match(
      Function<Jump, T> matchJump, Function<Branch, T> matchBranch, Function<Exit, T> matchExit);

  @Override
  public String toString() {
    return match(
        jump -> "jump " + jump.target,
        branch -> "branch " + branch.guard + " " + branch.trueTarget + " " + branch.falseTarget,
        exit -> "exit");
  }

  public static class Jump extends Terminator {
    public final Identifier target;

    public Jump(Identifier target) {
      this.target = checkNotNull(target);
    }

    @Override
    public Set<Identifier> successors() {
      return ImmutableSet.of(target);
    }

    @Override
    public <T> T match(
        Function<Jump, T> matchJump, Function<Branch, T> matchBranch, Function<Exit, T> matchExit) {
      return matchJump.apply(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      return target.equals(((Jump) o).target);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Jump.class, target);
    }
  }

  /** Continues in {@code trueTarget} if {@code guard} is non-zero, else in {@code falseTarget}. */
  public static class Branch extends Terminator {
    public final Identifier guard;
    public final Identifier trueTarget;
    public final Identifier falseTarget;

    public Branch(Identifier guard, Identifier trueTarget, Identifier falseTarget) {
      this.guard = checkNotNull(guard);
      this.trueTarget = checkNotNull(trueTarget);
      this.falseTarget = checkNotNull(falseTarget);
    }

    @Override
    public Set<Identifier> successors() {
      return ImmutableSet.of(trueTarget, falseTarget);
    }

    @Override
    public <T> T match(
        Function<Jump, T> matchJump, Function<Branch, T> matchBranch, Function<Exit, T> matchExit) {
      return matchBranch.apply(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Branch branch = (Branch) o;
      return guard.equals(branch.guard)
          && trueTarget.equals(branch.trueTarget)
          && falseTarget.equals(branch.falseTarget);
    }

    @Override
    public int hashCode() {
      return Objects.hash(guard, trueTarget, falseTarget);
    }
  }

  public static class Exit extends Terminator {

    public static final Exit INSTANCE = new Exit();

    private Exit() {}

    @Override
    public Set<Identifier> successors() {
      return ImmutableSet.of();
    }

    @Override
    public <T> T match(
        Function<Jump, T> matchJump, Function<Branch, T> matchBranch, Function<Exit, T> matchExit) {
      return matchExit.apply(this);
    }
  }
}
