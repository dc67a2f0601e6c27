package com.github.flowmachine.patch;

import javax.lang.model.SourceVersion;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;
import com.github.flowmachine.generator.GeneratorConfiguration;

/**
 * This class encapsulates where and what the host patcher inserts. Use the
 * {@code HostPatchConfigurationBuilder} to build it.
 *
 * Markers are literal substrings of the host source. Import lines go after the line holding the
 * imports marker; every other snippet goes right after the first '{' following its marker.
 */
public final class HostPatchConfiguration {
  private final GeneratorConfiguration generatorConfiguration;
  private final String importsMarker;
  private final String classMarker;
  private final String initMarker;
  private final String updateMarker;
  private final String inputMarker;
  private final String fieldName;
  private final String deltaName;
  private final String keyName;

  public GeneratorConfiguration getGeneratorConfiguration() {
    return generatorConfiguration;
  }

  public String getImportsMarker() {
    return importsMarker;
  }

  public String getClassMarker() {
    return classMarker;
  }

  public String getInitMarker() {
    return initMarker;
  }

  public String getUpdateMarker() {
    return updateMarker;
  }

  public String getInputMarker() {
    return inputMarker;
  }

  public String getFieldName() {
    return fieldName;
  }

  public String getDeltaName() {
    return deltaName;
  }

  public String getKeyName() {
    return keyName;
  }

  public final static class HostPatchConfigurationBuilder {
    private GeneratorConfiguration generatorConfiguration = GeneratorConfiguration.defaults();
    private String importsMarker = "package ";
    private String classMarker = "class Game";
    private String initMarker = "void onInit(";
    private String updateMarker = "void onUpdate(";
    private String inputMarker = "void onKey(";
    private String fieldName = "flow";
    private String deltaName = "dt";
    private String keyName = "key";

    public static HostPatchConfigurationBuilder newBuilder() {
      return new HostPatchConfigurationBuilder();
    }

    public HostPatchConfigurationBuilder generatorConfiguration(
        final GeneratorConfiguration generatorConfiguration) {
      this.generatorConfiguration = generatorConfiguration;
      return this;
    }

    public HostPatchConfigurationBuilder importsMarker(final String importsMarker) {
      this.importsMarker = importsMarker;
      return this;
    }

    public HostPatchConfigurationBuilder classMarker(final String classMarker) {
      this.classMarker = classMarker;
      return this;
    }

    public HostPatchConfigurationBuilder initMarker(final String initMarker) {
      this.initMarker = initMarker;
      return this;
    }

    public HostPatchConfigurationBuilder updateMarker(final String updateMarker) {
      this.updateMarker = updateMarker;
      return this;
    }

    public HostPatchConfigurationBuilder inputMarker(final String inputMarker) {
      this.inputMarker = inputMarker;
      return this;
    }

    public HostPatchConfigurationBuilder fieldName(final String fieldName) {
      this.fieldName = fieldName;
      return this;
    }

    public HostPatchConfigurationBuilder deltaName(final String deltaName) {
      this.deltaName = deltaName;
      return this;
    }

    public HostPatchConfigurationBuilder keyName(final String keyName) {
      this.keyName = keyName;
      return this;
    }

    public HostPatchConfiguration build() throws FlowException {
      final HostPatchConfiguration config = new HostPatchConfiguration(generatorConfiguration,
          importsMarker, classMarker, initMarker, updateMarker, inputMarker, fieldName, deltaName,
          keyName);
      config.validate();
      return config;
    }

    private HostPatchConfigurationBuilder() {}
  }

  public static HostPatchConfiguration defaults() throws FlowException {
    return HostPatchConfigurationBuilder.newBuilder().build();
  }

  private void validate() throws FlowException {
    StringBuilder messages = new StringBuilder();
    if (generatorConfiguration == null) {
      messages.append("GeneratorConfiguration cannot be null. ");
    }
    checkMarker(messages, "Imports", importsMarker);
    checkMarker(messages, "Class", classMarker);
    checkMarker(messages, "Init", initMarker);
    checkMarker(messages, "Update", updateMarker);
    checkMarker(messages, "Input", inputMarker);
    checkName(messages, "Field", fieldName);
    checkName(messages, "Delta parameter", deltaName);
    checkName(messages, "Key parameter", keyName);
    if (messages.length() > 0) {
      throw new FlowException(Code.INVALID_CONFIG, messages.toString().trim());
    }
  }

  private static void checkMarker(final StringBuilder messages, final String label,
      final String marker) {
    if (marker == null || marker.isEmpty()) {
      messages.append(label).append(" marker cannot be empty. ");
    }
  }

  private static void checkName(final StringBuilder messages, final String label,
      final String name) {
    if (name == null || !SourceVersion.isIdentifier(name) || SourceVersion.isKeyword(name)) {
      messages.append(label).append(" name '").append(name)
          .append("' is not a valid identifier. ");
    }
  }

  @Override
  public String toString() {
    return "HostPatchConfiguration [generatorConfiguration=" + generatorConfiguration
        + ", importsMarker=" + importsMarker + ", classMarker=" + classMarker + ", initMarker="
        + initMarker + ", updateMarker=" + updateMarker + ", inputMarker=" + inputMarker
        + ", fieldName=" + fieldName + ", deltaName=" + deltaName + ", keyName=" + keyName + "]";
  }

  private HostPatchConfiguration(final GeneratorConfiguration generatorConfiguration,
      final String importsMarker, final String classMarker, final String initMarker,
      final String updateMarker, final String inputMarker, final String fieldName,
      final String deltaName, final String keyName) {
    this.generatorConfiguration = generatorConfiguration;
    this.importsMarker = importsMarker;
    this.classMarker = classMarker;
    this.initMarker = initMarker;
    this.updateMarker = updateMarker;
    this.inputMarker = inputMarker;
    this.fieldName = fieldName;
    this.deltaName = deltaName;
    this.keyName = keyName;
  }

}
