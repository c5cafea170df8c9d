package tirc.lower;

import tirc.util.Identifier;

/**
 * Supplies compiler generated names. Temporaries and labels are counted separately; both counters
 * start at zero and are incremented before each allocation, so the first temporary is {@code
 * <prefix>_1} and the first label {@code lbl1}. Nothing is ever handed out twice.
 */
class FreshNames {
  static final String CONST_PREFIX = "_const";
  static final String TEMP_PREFIX = "_t";
  static final String LABEL_PREFIX = "lbl";

  private long temporaries = 0;
  private long labels = 0;

  Identifier temporary(String prefix) {
    temporaries++;
    return Identifier.of(prefix + "_" + temporaries);
  }

  Identifier label() {
    labels++;
    return Identifier.of(LABEL_PREFIX + labels);
  }
}
