package colortree.cli;

import java.util.function.BiConsumer;

record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
  static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
    return new OptionSpec(true, consumer);
  }

  void apply(CliOptions.Builder builder, String value) {
    apply.accept(builder, value);
  }
}
