package com.github.flowmachine.generator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.lang.model.element.Modifier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.model.FlowEventTrigger;
import com.github.flowmachine.model.FlowModel;
import com.github.flowmachine.model.FlowSequenceStep;
import com.github.flowmachine.model.FlowState;
import com.github.flowmachine.model.FlowTransition;
import com.github.flowmachine.model.FlowVariable;
import com.github.flowmachine.runtime.ActionRegistry;
import com.github.flowmachine.runtime.FlowMachine;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

/**
 * Compiles a {@link FlowModel} into Java source. The runtime class extends {@link FlowMachine} and
 * registers the flow's states, transitions, steps and initial variables from its constructor,
 * through private {@code registerPartN} methods of at most {@value #statementsPerMethod}
 * statements each. Every hook becomes a lambda that looks its action up by name in the machine's
 * {@link ActionRegistry} at call time. The trigger class maps physical key names to flow events.
 *
 * Generation is pure: the same model and configuration always produce the same text, and nothing
 * is written anywhere. See {@link FlowExporter} for writing the files.
 */
public final class RuntimeGenerator {
  private static final Logger logger = LogManager.getLogger(RuntimeGenerator.class.getSimpleName());

  private static final String actionsParameter = "actions";
  private static final String indent = "  ";
  static final int statementsPerMethod = 250;

  private final GeneratorConfiguration config;

  public RuntimeGenerator() {
    this(GeneratorConfiguration.defaults());
  }

  public RuntimeGenerator(final GeneratorConfiguration config) {
    this.config = config;
  }

  public GeneratorConfiguration getConfiguration() {
    return config;
  }

  /**
   * @throws FlowException with {@code INVALID_MODEL} if the model fails validation
   */
  public GeneratedSources generate(final FlowModel model) throws FlowException {
    FlowValidator.validate(model);
    final String runtimeSource = toSource(runtimeType(model), model);
    final String triggerSource = toSource(triggerType(model), model);
    if (logger.isDebugEnabled()) {
      logger.debug("Generated sources for flow " + model.getName() + " with " + config);
    }
    return new GeneratedSources(config, runtimeSource, triggerSource);
  }

  ///// Runtime class /////

  private TypeSpec runtimeType(final FlowModel model) {
    final ClassName self = ClassName.get(config.getPackageName(), config.getRuntimeClassName());
    final ParameterSpec actions =
        ParameterSpec.builder(ActionRegistry.class, actionsParameter, Modifier.FINAL).build();
    final MethodSpec.Builder constructor = MethodSpec.constructorBuilder()
        .addModifiers(Modifier.PUBLIC)
        .addParameter(actions)
        .addStatement("super($N)", actions);
    final List<MethodSpec> parts = new ArrayList<>();

    // javac caps a method at 64 KB of bytecode
    final List<CodeBlock> statements = registrations(model);
    for (int first = 0; first < statements.size(); first += statementsPerMethod) {
      final String name = "registerPart" + (parts.size() + 1);
      final MethodSpec.Builder part = MethodSpec.methodBuilder(name)
          .addModifiers(Modifier.PRIVATE)
          .addParameter(actions);
      for (final CodeBlock statement : statements.subList(first,
          Math.min(first + statementsPerMethod, statements.size()))) {
        part.addStatement("$L", statement);
      }
      parts.add(part.build());
      constructor.addStatement("$N($N)", name, actions);
    }

    return TypeSpec.classBuilder(self)
        .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
        .superclass(FlowMachine.class)
        .addJavadoc("Runtime for flow $S: $L states, $L transitions, $L steps.\n",
            model.getName(), model.getStates().size(), model.getTransitions().size(),
            model.getSteps().size())
        .addField(FieldSpec.builder(String.class, "FLOW_NAME", Modifier.PUBLIC, Modifier.STATIC,
            Modifier.FINAL).initializer("$S", model.getName()).build())
        .addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addStatement("this(new $T())", ActionRegistry.class)
            .build())
        .addMethod(constructor.build())
        .addMethods(parts)
        .build();
  }

  /**
   * One statement per state, transition, step and variable, in that order.
   */
  private static List<CodeBlock> registrations(final FlowModel model) {
    final List<CodeBlock> statements = new ArrayList<>();
    for (final FlowState state : model.getStates()) {
      statements.add(CodeBlock.of("addState($S, $L, $L)", state.getName(),
          hook(state.getOnEnter()), hook(state.getOnExit())));
    }
    for (final FlowTransition transition : model.getTransitions()) {
      statements.add(CodeBlock.of("addTransition($L, $L, $S, $S)", transition.getFromState(),
          transition.getToState(), transition.getEventName(), transition.getCondition()));
    }
    for (final FlowSequenceStep step : model.getSteps()) {
      statements.add(CodeBlock.of("addStep($S, $L, $L, $L, $L)", step.getName(),
          Double.toString(step.getDuration()), hook(step.getOnStart()),
          updateHook(step.getOnUpdate()), hook(step.getOnEnd())));
    }
    for (final FlowVariable variable : model.getVariables()) {
      switch (variable.getType()) {
        case BOOL:
          statements.add(CodeBlock.of("variables().setBool($S, $L)", variable.getName(),
              variable.getBoolValue()));
          break;
        case STRING:
          statements.add(CodeBlock.of("variables().setString($S, $S)", variable.getName(),
              variable.getStringValue()));
          break;
        default:
          statements.add(CodeBlock.of("variables().setNumber($S, $L)", variable.getName(),
              Double.toString(variable.getNumberValue())));
      }
    }
    return statements;
  }

  private static CodeBlock hook(final String actionName) {
    if (actionName == null || actionName.isEmpty()) {
      return CodeBlock.of("null");
    }
    return CodeBlock.of("() -> $N.run($S)", actionsParameter, actionName);
  }

  private static CodeBlock updateHook(final String actionName) {
    if (actionName == null || actionName.isEmpty()) {
      return CodeBlock.of("null");
    }
    return CodeBlock.of("dt -> $N.update($S, dt)", actionsParameter, actionName);
  }

  ///// Trigger class /////

  private TypeSpec triggerType(final FlowModel model) {
    final ParameterSpec key = ParameterSpec.builder(String.class, "key", Modifier.FINAL).build();

    final CodeBlock.Builder lookup = CodeBlock.builder()
        .beginControlFlow("if ($N == null)", key)
        .addStatement("return null")
        .endControlFlow()
        .beginControlFlow("switch ($N)", key);
    for (final Map.Entry<String, String> binding : bindings(model).entrySet()) {
      lookup.add("case $S:\n", binding.getKey())
          .indent()
          .addStatement("return $S", binding.getValue())
          .unindent();
    }
    lookup.add("default:\n")
        .indent()
        .addStatement("return null")
        .unindent()
        .endControlFlow();

    final ParameterSpec flow =
        ParameterSpec.builder(FlowMachine.class, "flow", Modifier.FINAL).build();
    return TypeSpec.classBuilder(config.getTriggerClassName())
        .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
        .addJavadoc("Input bindings for flow $S.\n", model.getName())
        .addMethod(MethodSpec.methodBuilder("eventForKey")
            .addJavadoc("Returns the flow event bound to the key, or null if the key is unbound.\n")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(String.class)
            .addParameter(key)
            .addCode(lookup.build())
            .build())
        .addMethod(MethodSpec.methodBuilder("forward")
            .addJavadoc("Emits the event bound to the key into the flow. Returns true iff a "
                + "transition was taken.\n")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(TypeName.BOOLEAN)
            .addParameter(flow)
            .addParameter(key)
            .addStatement("final $T event = eventForKey($N)", String.class, key)
            .beginControlFlow("if (event == null)")
            .addStatement("return false")
            .endControlFlow()
            .addStatement("return $N.emit(event)", flow)
            .build())
        .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
        .build();
  }

  /**
   * Key to event, in declaration order. A key bound twice keeps its first binding.
   */
  private static Map<String, String> bindings(final FlowModel model) {
    final Map<String, String> bindings = new LinkedHashMap<>();
    for (final FlowEventTrigger trigger : model.getTriggers()) {
      if (bindings.containsKey(trigger.getKey())) {
        logger.warn(String.format("Key %s is bound to both %s and %s, keeping %s",
            trigger.getKey(), bindings.get(trigger.getKey()), trigger.getEventName(),
            bindings.get(trigger.getKey())));
        continue;
      }
      bindings.put(trigger.getKey(), trigger.getEventName());
    }
    return bindings;
  }

  private String toSource(final TypeSpec type, final FlowModel model) {
    return JavaFile.builder(config.getPackageName(), type)
        .addFileComment("Generated from flow \"$L\". Do not edit: changes are overwritten on the "
            + "next export.", model.getName())
        .indent(indent)
        .build()
        .toString();
  }
}
