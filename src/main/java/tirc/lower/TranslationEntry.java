package tirc.lower;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.function.Function;
import tirc.tir.Instruction;
import tirc.tir.Terminator;
import tirc.util.Identifier;

/**
 * An entry of the {@link TranslationVector}: a block label marker, an inner instruction or a
 * terminator. Poor man's ADT, {@link #match} is the only way to take an entry apart.
 */
public abstract class TranslationEntry {

  private TranslationEntry() {}

  public abstract <T> T match(
      Function<Label, T> matchLabel, Function<Inner, T> matchInner, Function<Term, T> matchTerm);

  /** Starts the block named {@code label}. */
  public static class Label extends TranslationEntry {
    public final Identifier label;

    public Label(Identifier label) {
      this.label = checkNotNull(label);
    }

    @Override
    public <T> T match(
        Function<Label, T> matchLabel, Function<Inner, T> matchInner, Function<Term, T> matchTerm) {
      return matchLabel.apply(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Label && label.equals(((Label) o).label);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Label.class, label);
    }

    @Override
    public String toString() {
      return label + ":";
    }
  }

  public static class Inner extends TranslationEntry {
    public final Instruction instruction;

    public Inner(Instruction instruction) {
      this.instruction = checkNotNull(instruction);
    }

    @Override
    public <T> T match(
        Function<Label, T> matchLabel, Function<Inner, T> matchInner, Function<Term, T> matchTerm) {
      return matchInner.apply(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Inner && instruction.equals(((Inner) o).instruction);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Inner.class, instruction);
    }

    @Override
    public String toString() {
      return "    " + instruction;
    }
  }

  public static class Term extends TranslationEntry {
    public final Terminator terminator;

    public Term(Terminator terminator) {
      this.terminator = checkNotNull(terminator);
    }

    @Override
    public <T> T match(
        Function<Label, T> matchLabel, Function<Inner, T> matchInner, Function<Term, T> matchTerm) {
      return matchTerm.apply(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Term && terminator.equals(((Term) o).terminator);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Term.class, terminator);
    }

    @Override
    public String toString() {
      return "    " + terminator;
    }
  }
}
