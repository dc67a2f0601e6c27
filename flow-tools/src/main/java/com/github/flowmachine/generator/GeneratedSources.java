package com.github.flowmachine.generator;

/**
 * The two source artifacts produced for a flow: the runtime class and the input trigger class.
 */
public final class GeneratedSources {
  private final GeneratorConfiguration config;
  private final String runtimeSource;
  private final String triggerSource;

  GeneratedSources(final GeneratorConfiguration config, final String runtimeSource,
      final String triggerSource) {
    this.config = config;
    this.runtimeSource = runtimeSource;
    this.triggerSource = triggerSource;
  }

  public String getRuntimeSource() {
    return runtimeSource;
  }

  public String getTriggerSource() {
    return triggerSource;
  }

  public String getRuntimeFileName() {
    return config.getRuntimeFileName();
  }

  public String getTriggerFileName() {
    return config.getTriggerFileName();
  }

  public GeneratorConfiguration getConfiguration() {
    return config;
  }

  @Override
  public String toString() {
    return "GeneratedSources [" + getRuntimeFileName() + "=" + runtimeSource.length() + " chars, "
        + getTriggerFileName() + "=" + triggerSource.length() + " chars]";
  }
}
