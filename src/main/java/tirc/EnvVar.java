package tirc;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.function.Function;

/** Environment variables the driver looks at. */
public enum EnvVar {
  TIRC_VERIFY("Set to \"0\" to skip verification of the lowered program."),
  TIRC_OUTPUTFILENAME("Write the output of --print-* modes to this file instead of stdout.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  /** Looks the variable up in {@code environment}, usually {@code System::getenv}. */
  public Optional<String> get(Function<String, String> environment) {
    return Optional.ofNullable(environment.apply(name()));
  }

  /** The value, or the empty string if the variable is not set. */
  public String value(Function<String, String> environment) {
    return get(environment).orElse("");
  }

  public boolean isAvailable(Function<String, String> environment) {
    return get(environment).isPresent();
  }

  public boolean isSetToZero(Function<String, String> environment) {
    return isSetToValue(environment, "0");
  }

  public boolean isSetToValue(Function<String, String> environment, String expected) {
    return get(environment).map(expected::equals).orElse(false);
  }

  public static ImmutableList<String> getAllEnvVarDescriptions() {
    ImmutableList.Builder<String> descriptions = ImmutableList.builder();
    for (EnvVar var : values()) {
      descriptions.add("  " + var.name() + ": " + var.description);
    }
    return descriptions.build();
  }
}
