/*
 * Copyright 2021 The Circuit ASG Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.circuitlang.asg;

import static com.circuitlang.asg.AsgConvertErrors.DUPLICATE_DEFINITION;
import static com.circuitlang.asg.AsgConvertErrors.ILLEGAL_AST_STRUCTURE;
import static com.circuitlang.asg.AsgConvertErrors.INVALID_SELF_IN_GLOBAL;
import static com.circuitlang.asg.AsgConvertErrors.MISSING_RETURN;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_IMPORT;

import com.circuitlang.ast.CircuitDecl;
import com.circuitlang.ast.FunctionDecl;
import com.circuitlang.ast.FunctionInput;
import com.circuitlang.ast.ImportDecl;
import com.circuitlang.ast.ProgramTree;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Builds the semantic graph of one program.
 *
 * <p>Conversion runs in phases so that declaration order does not matter:
 *
 * <ol>
 *   <li>imports are resolved and their circuits and functions declared in the root scope;
 *   <li>circuit names are declared;
 *   <li>circuit fields and method signatures are resolved;
 *   <li>free function signatures are declared;
 *   <li>function and method bodies are converted and checked for missing returns.
 * </ol>
 *
 * The first error stops the build.
 */
public final class ProgramBuilder {
  private static final Logger logger = Logger.getLogger(ProgramBuilder.class.getName());

  private final AsgContext context;
  private final AsgOptions options;
  private final StatementConverter statements;

  public ProgramBuilder(AsgContext context, AsgOptions options) {
    this.context = context;
    this.options = options;
    this.statements = new StatementConverter(context, new ExpressionConverter(context));
  }

  public Program build(ProgramTree tree) throws AsgConvertException {
    Scope root = context.makeRootScope();
    Program program = new Program(context, tree.name(), root);

    for (ImportDecl declaration : tree.imports()) {
      resolveImport(program, declaration);
    }

    Map<CircuitDecl, Circuit> circuits = new LinkedHashMap<>();
    for (CircuitDecl declaration : tree.circuits()) {
      Circuit circuit =
          context.alloc(
              new Circuit(context, declaration.name().name(), declaration.span(), root));
      root.declareCircuit(circuit.getName(), circuit);
      program.addCircuit(circuit);
      circuits.put(declaration, circuit);
    }

    Map<Function, FunctionDecl> bodies = new LinkedHashMap<>();
    for (Map.Entry<CircuitDecl, Circuit> entry : circuits.entrySet()) {
      Circuit circuit = entry.getValue();
      for (CircuitDecl.Member member : entry.getKey().members()) {
        if (member instanceof CircuitDecl.Field) {
          CircuitDecl.Field field = (CircuitDecl.Field) member;
          Type type = circuit.getScope().resolveDeclaredType(field.type());
          circuit.addMember(
              new CircuitMember.Field(field.name().name(), type), field.name().span());
        } else {
          FunctionDecl declaration = ((CircuitDecl.Method) member).function();
          Function method = declareSignature(circuit.getScope(), declaration, circuit);
          circuit.addMember(new CircuitMember.Method(method), declaration.span());
          bodies.put(method, declaration);
        }
      }
    }

    List<Function> functions = new ArrayList<>();
    for (FunctionDecl declaration : tree.functions()) {
      Function function = declareSignature(root, declaration, null);
      root.declareFunction(function.getName(), function);
      program.addFunction(function);
      functions.add(function);
      bodies.put(function, declaration);
    }

    for (Map.Entry<Function, FunctionDecl> entry : bodies.entrySet()) {
      fillBody(entry.getKey(), entry.getValue());
    }
    logger.fine(
        "Built program "
            + program.getName()
            + ": "
            + circuits.size()
            + " circuit(s), "
            + functions.size()
            + " function(s)");
    return program;
  }

  private void resolveImport(Program program, ImportDecl declaration)
      throws AsgConvertException {
    String packageName = declaration.packageName();
    Program imported = context.getPackage(packageName);
    if (imported == null) {
      imported =
          options
              .getImportResolver()
              .resolvePackage(context, options, declaration.packagePath(), declaration.span());
      if (imported == null) {
        throw AsgConvertException.of(declaration.span(), UNRESOLVED_IMPORT, packageName);
      }
      context.addPackage(packageName, imported);
      logger.fine("Resolved import " + packageName);
    }
    program.addImport(packageName, imported);

    Scope root = program.getScope();
    if (declaration.star()) {
      for (Circuit circuit : imported.getCircuits().values()) {
        root.declareCircuit(circuit.getName(), circuit);
      }
      for (Function function : imported.getFunctions().values()) {
        root.declareFunction(function.getName(), function);
      }
      return;
    }
    for (ImportDecl.Symbol symbol : declaration.symbols()) {
      String name = symbol.symbol().name();
      Circuit circuit = imported.getCircuits().get(name);
      Function function = imported.getFunctions().get(name);
      if (circuit != null) {
        root.declareCircuit(symbol.localName(), circuit);
      } else if (function != null) {
        root.declareFunction(symbol.localName(), function);
      } else {
        throw AsgConvertException.of(
            symbol.symbol().span(), UNRESOLVED_IMPORT, packageName + "." + name);
      }
    }
  }

  /**
   * Resolves the output and parameter types of a function in {@code scope} and allocates the
   * function. Methods are not declared in any scope's function table; they are reached through
   * their circuit.
   */
  private Function declareSignature(
      Scope scope, FunctionDecl declaration, @Nullable Circuit circuit)
      throws AsgConvertException {
    String name = declaration.identifier().name();
    Type output =
        declaration.output() == null ? Type.UNIT : scope.resolveDeclaredType(declaration.output());

    FunctionQualifier qualifier = FunctionQualifier.STATIC;
    Map<String, Variable> parameters = new LinkedHashMap<>();
    ImmutableList<FunctionInput> inputs = declaration.inputs();
    for (int i = 0; i < inputs.size(); i++) {
      FunctionInput input = inputs.get(i);
      if (input instanceof FunctionInput.SelfKeyword) {
        if (i != 0) {
          throw AsgConvertException.of(
              input.span(), ILLEGAL_AST_STRUCTURE, "self must be the first input of " + name);
        }
        qualifier = qualifierOf(((FunctionInput.SelfKeyword) input).kind());
        continue;
      }
      FunctionInput.Variable parameter = (FunctionInput.Variable) input;
      String parameterName = parameter.identifier().name();
      if (parameters.containsKey(parameterName)) {
        throw AsgConvertException.of(
            parameter.span(), DUPLICATE_DEFINITION, "parameter", parameterName);
      }
      parameters.put(
          parameterName,
          context.alloc(
              new Variable(
                  context,
                  parameterName,
                  parameter.identifier().span(),
                  scope.resolveDeclaredType(parameter.type()),
                  parameter.mutable(),
                  parameter.isConst(),
                  Variable.Declaration.PARAMETER)));
    }
    if (qualifier != FunctionQualifier.STATIC && circuit == null) {
      throw AsgConvertException.of(declaration.span(), INVALID_SELF_IN_GLOBAL, name);
    }

    Function function =
        context.alloc(
            new Function(
                context,
                name,
                declaration.identifier().span(),
                output,
                ImmutableMap.copyOf(parameters),
                qualifier,
                declaration.annotations(),
                scope));
    if (circuit != null) {
      function.setCircuit(circuit);
    }
    return function;
  }

  private static FunctionQualifier qualifierOf(FunctionInput.SelfKind kind) {
    switch (kind) {
      case SELF:
        return FunctionQualifier.SELF_REF;
      case CONST_SELF:
        return FunctionQualifier.CONST_SELF_REF;
      case MUT_SELF:
        return FunctionQualifier.MUT_SELF_REF;
    }
    throw new AssertionError(kind);
  }

  private void fillBody(Function function, FunctionDecl declaration) throws AsgConvertException {
    Scope scope = function.getScope();
    Circuit circuit = function.getCircuit();
    if (!function.isStatic() && circuit != null) {
      scope.declareVariable(
          context.alloc(
              new Variable(
                  context,
                  Variable.SELF_NAME,
                  declaration.identifier().span(),
                  new Type.CircuitRef(circuit),
                  function.getQualifier() == FunctionQualifier.MUT_SELF_REF,
                  false,
                  Variable.Declaration.SELF)));
    }
    for (Variable parameter : function.getParameters().values()) {
      scope.declareVariable(parameter);
    }

    BlockStatement body = statements.convertBlock(scope, declaration.block());
    ReturnPath path = ReturnPathReducer.analyze(function, body);
    List<AsgError> errors = new ArrayList<>();
    if (!function.getOutput().isUnit() && !path.returns()) {
      errors.add(AsgError.make(declaration.span(), MISSING_RETURN, function.getName()));
    }
    for (AsgError error : path.errors()) {
      CheckLevel level = options.getLevel(error);
      if (level == CheckLevel.ERROR) {
        errors.add(error);
      } else if (level.isOn()) {
        context.addWarning(
            new AsgError(error.type(), error.description(), error.span(), level));
      }
    }
    if (!errors.isEmpty()) {
      if (options.getReturnPathErrorMode() == AsgOptions.ReturnPathErrorMode.FIRST) {
        throw new AsgConvertException(errors.get(0));
      }
      throw new AsgConvertException(errors);
    }
    function.setBody(body);
    logger.fine("Converted body of " + function.getName());
  }
}
