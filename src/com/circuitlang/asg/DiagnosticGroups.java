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
import static com.circuitlang.asg.AsgConvertErrors.DUPLICATE_DEFINITION;
import static com.circuitlang.asg.AsgConvertErrors.EXTRA_CIRCUIT_MEMBER;
import static com.circuitlang.asg.AsgConvertErrors.FORMAT_ARGUMENT_MISMATCH;
import static com.circuitlang.asg.AsgConvertErrors.ILLEGAL_AST_STRUCTURE;
import static com.circuitlang.asg.AsgConvertErrors.ILLEGAL_STATIC_MEMBER_ACCESS;
import static com.circuitlang.asg.AsgConvertErrors.IMMUTABLE_ASSIGNMENT;
import static com.circuitlang.asg.AsgConvertErrors.INDEX_OUT_OF_BOUNDS;
import static com.circuitlang.asg.AsgConvertErrors.INVALID_INT_VALUE;
import static com.circuitlang.asg.AsgConvertErrors.INVALID_LITERAL;
import static com.circuitlang.asg.AsgConvertErrors.INVALID_SELF_IN_GLOBAL;
import static com.circuitlang.asg.AsgConvertErrors.MEMBER_CALL_INVALID;
import static com.circuitlang.asg.AsgConvertErrors.MISSING_CIRCUIT_MEMBER;
import static com.circuitlang.asg.AsgConvertErrors.MISSING_RETURN;
import static com.circuitlang.asg.AsgConvertErrors.MUT_CALL_INVALID;
import static com.circuitlang.asg.AsgConvertErrors.STATIC_CALL_INVALID;
import static com.circuitlang.asg.AsgConvertErrors.UNEXPECTED_NONCONST;
import static com.circuitlang.asg.AsgConvertErrors.UNEXPECTED_TYPE;
import static com.circuitlang.asg.AsgConvertErrors.UNREACHABLE_CODE;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_CIRCUIT;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_CIRCUIT_MEMBER;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_FUNCTION;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_IMPORT;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_REFERENCE;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_TYPE;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * Named groups of conversion diagnostics. Every {@link AsgConvertErrors} type belongs to exactly
 * one of the five kind groups, which lets a caller map an error to an exit code without looking at
 * its message.
 */
public final class DiagnosticGroups {

  public static final DiagnosticGroup RESOLUTION =
      new DiagnosticGroup(
          "resolution",
          UNRESOLVED_REFERENCE,
          UNRESOLVED_FUNCTION,
          UNRESOLVED_CIRCUIT,
          UNRESOLVED_CIRCUIT_MEMBER,
          UNRESOLVED_IMPORT,
          DUPLICATE_DEFINITION);

  public static final DiagnosticGroup TYPE =
      new DiagnosticGroup(
          "type",
          UNEXPECTED_TYPE,
          UNRESOLVED_TYPE,
          INVALID_INT_VALUE,
          INVALID_LITERAL,
          INDEX_OUT_OF_BOUNDS,
          MISSING_CIRCUIT_MEMBER,
          EXTRA_CIRCUIT_MEMBER,
          ILLEGAL_STATIC_MEMBER_ACCESS,
          IMMUTABLE_ASSIGNMENT,
          FORMAT_ARGUMENT_MISMATCH);

  public static final DiagnosticGroup CALL_VALIDATION =
      new DiagnosticGroup(
          "callValidation",
          ARGUMENT_COUNT_MISMATCH,
          UNEXPECTED_NONCONST,
          STATIC_CALL_INVALID,
          MUT_CALL_INVALID,
          MEMBER_CALL_INVALID,
          CIRCUIT_VARIABLE_CALL,
          CALL_TEST_FUNCTION,
          INVALID_SELF_IN_GLOBAL);

  public static final DiagnosticGroup STRUCTURAL =
      new DiagnosticGroup("structural", ILLEGAL_AST_STRUCTURE);

  public static final DiagnosticGroup CONTROL_FLOW =
      new DiagnosticGroup("controlFlow", MISSING_RETURN, UNREACHABLE_CODE);

  /** Statements after a definite return. Conversion goes on when these are demoted. */
  public static final DiagnosticGroup UNREACHABLE =
      new DiagnosticGroup("unreachable", UNREACHABLE_CODE);

  public static final DiagnosticGroup ALL =
      new DiagnosticGroup("all", RESOLUTION, TYPE, CALL_VALIDATION, STRUCTURAL, CONTROL_FLOW);

  private static final ImmutableList<DiagnosticGroup> KINDS =
      ImmutableList.of(RESOLUTION, TYPE, CALL_VALIDATION, STRUCTURAL, CONTROL_FLOW);

  /** Returns the kind group containing {@code type}, or null for a foreign type. */
  public static @Nullable DiagnosticGroup kindOf(DiagnosticType type) {
    for (DiagnosticGroup group : KINDS) {
      if (group.matches(type)) {
        return group;
      }
    }
    return null;
  }

  private DiagnosticGroups() {}
}
