package com.github.flowmachine.generator;

import javax.lang.model.SourceVersion;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;

/**
 * This class encapsulates the naming parameters for generated flow sources. Use the
 * {@code GeneratorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. the package must be a named package, since host code has to import the generated classes<br>
 * 2. the source files are named after the classes, so they are fixed for a given configuration<br>
 */
public final class GeneratorConfiguration {
  public static final String DEFAULT_PACKAGE_NAME = "generated.flow";
  public static final String DEFAULT_RUNTIME_CLASS_NAME = "GeneratedFlow";
  public static final String DEFAULT_TRIGGER_CLASS_NAME = "FlowTriggers";

  private final String packageName;
  private final String runtimeClassName;
  private final String triggerClassName;

  public String getPackageName() {
    return packageName;
  }

  public String getRuntimeClassName() {
    return runtimeClassName;
  }

  public String getTriggerClassName() {
    return triggerClassName;
  }

  public String getRuntimeFileName() {
    return runtimeClassName + ".java";
  }

  public String getTriggerFileName() {
    return triggerClassName + ".java";
  }

  public static GeneratorConfiguration defaults() {
    return new GeneratorConfiguration(DEFAULT_PACKAGE_NAME, DEFAULT_RUNTIME_CLASS_NAME,
        DEFAULT_TRIGGER_CLASS_NAME);
  }

  public final static class GeneratorConfigurationBuilder {
    private String packageName = DEFAULT_PACKAGE_NAME;
    private String runtimeClassName = DEFAULT_RUNTIME_CLASS_NAME;
    private String triggerClassName = DEFAULT_TRIGGER_CLASS_NAME;

    public static GeneratorConfigurationBuilder newBuilder() {
      return new GeneratorConfigurationBuilder();
    }

    public GeneratorConfigurationBuilder packageName(final String packageName) {
      this.packageName = packageName;
      return this;
    }

    public GeneratorConfigurationBuilder runtimeClassName(final String runtimeClassName) {
      this.runtimeClassName = runtimeClassName;
      return this;
    }

    public GeneratorConfigurationBuilder triggerClassName(final String triggerClassName) {
      this.triggerClassName = triggerClassName;
      return this;
    }

    public GeneratorConfiguration build() throws FlowException {
      final GeneratorConfiguration config =
          new GeneratorConfiguration(packageName, runtimeClassName, triggerClassName);
      config.validate();
      return config;
    }

    private GeneratorConfigurationBuilder() {}
  }

  private void validate() throws FlowException {
    StringBuilder messages = new StringBuilder();
    if (packageName == null || !SourceVersion.isName(packageName)) {
      messages.append("Package name '" + packageName + "' is not a valid Java package. ");
    }
    if (runtimeClassName == null || !SourceVersion.isName(runtimeClassName)
        || runtimeClassName.contains(".")) {
      messages.append("Runtime class name '" + runtimeClassName + "' is not a valid class name. ");
    }
    if (triggerClassName == null || !SourceVersion.isName(triggerClassName)
        || triggerClassName.contains(".")) {
      messages.append("Trigger class name '" + triggerClassName + "' is not a valid class name. ");
    }
    if (runtimeClassName != null && runtimeClassName.equals(triggerClassName)) {
      messages.append("Runtime and trigger classes cannot share a name. ");
    }
    if (messages.length() > 0) {
      throw new FlowException(Code.INVALID_CONFIG, messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "GeneratorConfiguration [packageName=" + packageName + ", runtimeClassName="
        + runtimeClassName + ", triggerClassName=" + triggerClassName + "]";
  }

  private GeneratorConfiguration(final String packageName, final String runtimeClassName,
      final String triggerClassName) {
    this.packageName = packageName;
    this.runtimeClassName = runtimeClassName;
    this.triggerClassName = triggerClassName;
  }

}
