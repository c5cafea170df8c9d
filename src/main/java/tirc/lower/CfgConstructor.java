package tirc.lower;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tirc.tir.Block;
import tirc.tir.Instruction;
import tirc.tir.Terminator;
import tirc.util.Identifier;

/**
 * Groups a {@link TranslationVector} into basic blocks in a single scan.
 *
 * <p>A label entry only moves the current label; it does not flush. Instructions collected so far
 * belong to whichever label is current when the next terminator arrives, so two labels in a row
 * without a terminator in between merge into one block under the later label. Lowering never
 * produces that shape, but nothing in the vector rules it out either.
 */
public class CfgConstructor {
  private static final Logger LOGGER = LoggerFactory.getLogger("CfgConstructor");

  private final Map<Identifier, Block> blocks = new TreeMap<>();
  private List<Instruction> buffer = new ArrayList<>();
  private Identifier currentLabel;

  private CfgConstructor(Identifier firstLabel) {
    this.currentLabel = firstLabel;
  }

  /**
   * @return label to block mapping; empty if {@code vector} is empty or does not start with a
   *     label
   */
  public static Map<Identifier, Block> construct(Iterable<TranslationEntry> vector) {
    Iterator<TranslationEntry> it = vector.iterator();
    if (!it.hasNext()) {
      LOGGER.debug("empty translation vector, no blocks");
      return new TreeMap<>();
    }
    Identifier first = it.next().match(label -> label.label, inner -> null, term -> null);
    if (first == null) {
      LOGGER.debug("translation vector does not start with a label, no blocks");
      return new TreeMap<>();
    }
    CfgConstructor constructor = new CfgConstructor(first);
    it.forEachRemaining(constructor::consume);
    if (!constructor.buffer.isEmpty()) {
      LOGGER.debug(
          "dropping {} trailing instructions without terminator", constructor.buffer.size());
    }
    LOGGER.debug("constructed {} blocks", constructor.blocks.size());
    return constructor.blocks;
  }

  private void consume(TranslationEntry entry) {
    entry.match(
        label -> {
          relabel(label.label);
          return null;
        },
        inner -> {
          buffer.add(inner.instruction);
          return null;
        },
        term -> {
          flush(term.terminator);
          return null;
        });
  }

  private void relabel(Identifier label) {
    if (!buffer.isEmpty()) {
      LOGGER.trace(
          "label {} follows {} unterminated instructions of {}", label, buffer.size(), currentLabel);
    }
    currentLabel = label;
  }

  private void flush(Terminator terminator) {
    LOGGER.trace("{}: {} instructions, {}", currentLabel, buffer.size(), terminator);
    blocks.put(currentLabel, new Block(buffer, terminator));
    buffer = new ArrayList<>();
  }
}
