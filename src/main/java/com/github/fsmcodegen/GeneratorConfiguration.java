package com.github.fsmcodegen;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * This class encapsulates all the configuration parameters for code generation. Use the
 * {@code GeneratorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If the package name is not set, generated units are emitted into the default package.<br>
 * 2. The queue capacity is the fixed capacity the queued targets size their event queue with when
 * the host does not pass one. Queues never grow past it.<br>
 * 3. The tick event is the reserved event the interrupt target treats as a no-op in every state
 * that has no rule of its own for it.<br>
 */
public final class GeneratorConfiguration {
  static final int defaultQueueCapacity = 8;
  static final String defaultTickEventName = "Tick";
  private static final Pattern packagePattern =
      Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");
  private static final Pattern identifierPattern = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final Optional<String> packageName;
  private final int queueCapacity;
  private final String tickEventName;

  public Optional<String> getPackageName() {
    return packageName;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public String getTickEventName() {
    return tickEventName;
  }

  /**
   * The configuration used when callers don't build one.
   */
  public static GeneratorConfiguration defaults() {
    return new GeneratorConfiguration(Optional.empty(), defaultQueueCapacity,
        defaultTickEventName);
  }

  public final static class GeneratorConfigurationBuilder {
    private String packageName;
    private int queueCapacity = defaultQueueCapacity;
    private String tickEventName = defaultTickEventName;

    public static GeneratorConfigurationBuilder newBuilder() {
      return new GeneratorConfigurationBuilder();
    }

    public GeneratorConfigurationBuilder packageName(final String packageName) {
      this.packageName = packageName;
      return this;
    }

    public GeneratorConfigurationBuilder queueCapacity(final int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public GeneratorConfigurationBuilder tickEventName(final String tickEventName) {
      this.tickEventName = tickEventName;
      return this;
    }

    public GeneratorConfiguration build() throws FsmException {
      final GeneratorConfiguration config =
          new GeneratorConfiguration(Optional.ofNullable(packageName), queueCapacity,
              tickEventName);
      config.validate();
      return config;
    }

    private GeneratorConfigurationBuilder() {}
  }

  private void validate() throws FsmException {
    StringBuilder messages = new StringBuilder();
    if (packageName.isPresent() && !packagePattern.matcher(packageName.get()).matches()) {
      messages.append("Package name '").append(packageName.get())
          .append("' is not a legal java package name. ");
    }
    // the lock-free ring of the interrupt target cannot tell full from empty with a single slot
    if (queueCapacity < 2) {
      messages.append("Queue capacity must be at least 2 but was ").append(queueCapacity)
          .append(". ");
    }
    if (tickEventName == null || !identifierPattern.matcher(tickEventName).matches()) {
      messages.append("Tick event name '").append(tickEventName)
          .append("' is not a legal event name. ");
    }
    if (messages.length() > 0) {
      throw new FsmException(FsmException.Code.INVALID_GENERATOR_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "GeneratorConfiguration [packageName=" + packageName.orElse("<default>")
        + ", queueCapacity=" + queueCapacity + ", tickEventName=" + tickEventName + "]";
  }

  private GeneratorConfiguration(final Optional<String> packageName, final int queueCapacity,
      final String tickEventName) {
    this.packageName = packageName;
    this.queueCapacity = queueCapacity;
    this.tickEventName = tickEventName;
  }

}
