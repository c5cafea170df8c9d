package tirc.lower;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import org.junit.Test;
import tirc.util.Identifier;

public class FreshNamesTest {

  @Test
  public void temporariesShareOneCounterAcrossPrefixes() {
    FreshNames fresh = new FreshNames();
    assertThat(fresh.temporary(FreshNames.CONST_PREFIX), is(Identifier.of("_const_1")));
    assertThat(fresh.temporary(FreshNames.TEMP_PREFIX), is(Identifier.of("_t_2")));
    assertThat(fresh.temporary(FreshNames.CONST_PREFIX), is(Identifier.of("_const_3")));
  }

  @Test
  public void labelsAreCountedSeparately() {
    FreshNames fresh = new FreshNames();
    fresh.temporary(FreshNames.TEMP_PREFIX);
    assertThat(fresh.label(), is(Identifier.of("lbl1")));
    assertThat(fresh.label(), is(Identifier.of("lbl2")));
  }
}
