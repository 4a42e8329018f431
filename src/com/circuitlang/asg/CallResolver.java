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

import static com.circuitlang.asg.AsgConvertErrors.ARGUMENT_COUNT_MISMATCH;
import static com.circuitlang.asg.AsgConvertErrors.CALL_TEST_FUNCTION;
import static com.circuitlang.asg.AsgConvertErrors.CIRCUIT_VARIABLE_CALL;
import static com.circuitlang.asg.AsgConvertErrors.ILLEGAL_AST_STRUCTURE;
import static com.circuitlang.asg.AsgConvertErrors.MEMBER_CALL_INVALID;
import static com.circuitlang.asg.AsgConvertErrors.MUT_CALL_INVALID;
import static com.circuitlang.asg.AsgConvertErrors.STATIC_CALL_INVALID;
import static com.circuitlang.asg.AsgConvertErrors.UNEXPECTED_NONCONST;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_FUNCTION;

import com.circuitlang.ast.ExpressionTree;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Resolves and validates the three call forms.
 *
 * <ul>
 *   <li>{@code name(...)} calls the function found by walking the scope chain.
 *   <li>{@code target.name(...)} calls an instance method of the target's circuit. The method may
 *       not be static, and a {@code mut self} method needs a target that is a mutable reference.
 *   <li>{@code Circuit::name(...)} calls a static method.
 * </ul>
 *
 * <p>Calling a field is {@code CIRCUIT_VARIABLE_CALL} in both member forms. Once the function is
 * known, its output is checked against the hint, the arity is checked, and each argument is
 * converted under its parameter's type; {@code const} parameters need consty arguments. Test
 * functions cannot be called.
 */
final class CallResolver {
  private final AsgContext context;
  private final ExpressionConverter converter;

  CallResolver(AsgContext context, ExpressionConverter converter) {
    this.context = context;
    this.converter = converter;
  }

  CallExpression resolve(Scope scope, ExpressionTree.Call call, @Nullable PartialType expected)
      throws AsgConvertException {
    Expression target = null;
    Function function;
    ExpressionTree callee = call.function();
    if (callee instanceof ExpressionTree.Ident) {
      String name = ((ExpressionTree.Ident) callee).identifier().name();
      function = scope.resolveFunction(name);
      if (function == null) {
        throw AsgConvertException.of(callee.span(), UNRESOLVED_FUNCTION, name);
      }
    } else if (callee instanceof ExpressionTree.MemberAccess) {
      ExpressionTree.MemberAccess access = (ExpressionTree.MemberAccess) callee;
      target = converter.convert(scope, access.circuit(), null);
      Circuit circuit = ExpressionConverter.circuitOf(target, access.span());
      function = method(circuit, access.name().name(), access);
      if (function.isStatic()) {
        throw AsgConvertException.of(
            access.span(), STATIC_CALL_INVALID, circuit.getName(), function.getName());
      } else if (function.getQualifier() == FunctionQualifier.MUT_SELF_REF && !target.isMutRef()) {
        throw AsgConvertException.of(
            access.span(), MUT_CALL_INVALID, circuit.getName(), function.getName());
      }
    } else if (callee instanceof ExpressionTree.StaticAccess) {
      ExpressionTree.StaticAccess access = (ExpressionTree.StaticAccess) callee;
      Circuit circuit = ExpressionConverter.staticCircuit(scope, access.circuit(), access.span());
      function = method(circuit, access.name().name(), access);
      if (!function.isStatic()) {
        throw AsgConvertException.of(
            access.span(), MEMBER_CALL_INVALID, circuit.getName(), function.getName());
      }
    } else {
      throw AsgConvertException.of(
          call.span(),
          ILLEGAL_AST_STRUCTURE,
          "non Identifier/MemberAccess/StaticAccess as call target");
    }

    ExpressionConverter.checkType(expected, function.getOutput(), call.span());

    ImmutableList<Variable> parameters = function.getParameters().values().asList();
    if (call.arguments().size() != parameters.size()) {
      throw AsgConvertException.of(
          call.span(),
          ARGUMENT_COUNT_MISMATCH,
          String.valueOf(parameters.size()),
          String.valueOf(call.arguments().size()));
    }

    List<Expression> arguments = new ArrayList<>();
    for (int i = 0; i < parameters.size(); i++) {
      Variable parameter = parameters.get(i);
      ExpressionTree argumentTree = call.arguments().get(i);
      Expression argument =
          converter.convert(scope, argumentTree, parameter.getType().partial());
      if (parameter.isConst() && !argument.isConsty()) {
        throw AsgConvertException.of(argumentTree.span(), UNEXPECTED_NONCONST);
      }
      arguments.add(argument);
    }

    if (function.isTest()) {
      throw AsgConvertException.of(call.span(), CALL_TEST_FUNCTION, function.getName());
    }
    return converter.finish(
        expected, new CallExpression(context, call.span(), function, target, arguments));
  }

  private static Function method(Circuit circuit, String name, ExpressionTree access)
      throws AsgConvertException {
    CircuitMember member = ExpressionConverter.member(circuit, name, access.span());
    if (!(member instanceof CircuitMember.Method)) {
      throw AsgConvertException.of(access.span(), CIRCUIT_VARIABLE_CALL, circuit.getName(), name);
    }
    return ((CircuitMember.Method) member).function();
  }
}
