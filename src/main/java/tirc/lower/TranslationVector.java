package tirc.lower;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import tirc.tir.Instruction;
import tirc.tir.Terminator;
import tirc.util.Identifier;

/**
 * The flat, not yet grouped program: label markers, instructions and terminators in program order.
 * Append only.
 */
public class TranslationVector implements Iterable<TranslationEntry> {

  private final List<TranslationEntry> entries = new ArrayList<>();

  public TranslationVector() {}

  public TranslationVector(Iterable<? extends TranslationEntry> entries) {
    entries.forEach(this.entries::add);
  }

  public void openBlock(Identifier label) {
    entries.add(new TranslationEntry.Label(label));
  }

  public void append(Instruction instruction) {
    entries.add(new TranslationEntry.Inner(instruction));
  }

  public void close(Terminator terminator) {
    entries.add(new TranslationEntry.Term(terminator));
  }

  public int size() {
    return entries.size();
  }

  public List<TranslationEntry> entries() {
    return ImmutableList.copyOf(entries);
  }

  @NotNull
  @Override
  public Iterator<TranslationEntry> iterator() {
    return entries().iterator();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (TranslationEntry entry : entries) {
      sb.append(entry).append(System.lineSeparator());
    }
    return sb.toString();
  }
}
