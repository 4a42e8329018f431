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

/** Errors reported while building the semantic graph. */
public final class AsgConvertErrors {

  // Resolution

  public static final DiagnosticType UNRESOLVED_REFERENCE =
      DiagnosticType.error(
          "ASG_UNRESOLVED_REFERENCE", "failed to resolve variable reference `{0}`");

  public static final DiagnosticType UNRESOLVED_FUNCTION =
      DiagnosticType.error("ASG_UNRESOLVED_FUNCTION", "failed to resolve function `{0}`");

  public static final DiagnosticType UNRESOLVED_CIRCUIT =
      DiagnosticType.error("ASG_UNRESOLVED_CIRCUIT", "failed to resolve circuit `{0}`");

  public static final DiagnosticType UNRESOLVED_CIRCUIT_MEMBER =
      DiagnosticType.error(
          "ASG_UNRESOLVED_CIRCUIT_MEMBER",
          "illegal reference to non-existent member `{1}` of circuit `{0}`");

  public static final DiagnosticType UNRESOLVED_IMPORT =
      DiagnosticType.error("ASG_UNRESOLVED_IMPORT", "failed to resolve import `{0}`");

  public static final DiagnosticType DUPLICATE_DEFINITION =
      DiagnosticType.error(
          "ASG_DUPLICATE_DEFINITION", "a {0} named `{1}` already exists in this scope");

  // Types

  public static final DiagnosticType UNEXPECTED_TYPE =
      DiagnosticType.error(
          "ASG_UNEXPECTED_TYPE", "unexpected type, expected: `{0}`, received: `{1}`");

  public static final DiagnosticType UNRESOLVED_TYPE =
      DiagnosticType.error("ASG_UNRESOLVED_TYPE", "failed to resolve type for {0}");

  public static final DiagnosticType INVALID_INT_VALUE =
      DiagnosticType.error("ASG_INVALID_INT_VALUE", "failed to parse int value `{0}` as `{1}`");

  public static final DiagnosticType INVALID_LITERAL =
      DiagnosticType.error("ASG_INVALID_LITERAL", "invalid {0} literal `{1}`");

  public static final DiagnosticType INDEX_OUT_OF_BOUNDS =
      DiagnosticType.error(
          "ASG_INDEX_OUT_OF_BOUNDS", "index {0} out of bounds for `{1}` of length {2}");

  public static final DiagnosticType MISSING_CIRCUIT_MEMBER =
      DiagnosticType.error(
          "ASG_MISSING_CIRCUIT_MEMBER", "missing member `{1}` when initializing circuit `{0}`");

  public static final DiagnosticType EXTRA_CIRCUIT_MEMBER =
      DiagnosticType.error(
          "ASG_EXTRA_CIRCUIT_MEMBER", "extra member `{1}` when initializing circuit `{0}`");

  public static final DiagnosticType ILLEGAL_STATIC_MEMBER_ACCESS =
      DiagnosticType.error(
          "ASG_ILLEGAL_STATIC_MEMBER_ACCESS",
          "static access to non-static member `{1}` of circuit `{0}`");

  public static final DiagnosticType IMMUTABLE_ASSIGNMENT =
      DiagnosticType.error(
          "ASG_IMMUTABLE_ASSIGNMENT", "illegal assignment to immutable variable `{0}`");

  public static final DiagnosticType FORMAT_ARGUMENT_MISMATCH =
      DiagnosticType.error(
          "ASG_FORMAT_ARGUMENT_MISMATCH",
          "formatter given {0} containers and found {1} parameters");

  // Calls

  public static final DiagnosticType ARGUMENT_COUNT_MISMATCH =
      DiagnosticType.error(
          "ASG_ARGUMENT_COUNT_MISMATCH", "function call expected {0} arguments, got {1}");

  public static final DiagnosticType UNEXPECTED_NONCONST =
      DiagnosticType.error("ASG_UNEXPECTED_NONCONST", "expected const, found non-const value");

  public static final DiagnosticType STATIC_CALL_INVALID =
      DiagnosticType.error(
          "ASG_STATIC_CALL_INVALID",
          "cannot call static function `{1}` of circuit `{0}` from target");

  public static final DiagnosticType MUT_CALL_INVALID =
      DiagnosticType.error(
          "ASG_MUT_CALL_INVALID",
          "cannot call mutable member function `{1}` of circuit `{0}` from immutable context");

  public static final DiagnosticType MEMBER_CALL_INVALID =
      DiagnosticType.error(
          "ASG_MEMBER_CALL_INVALID",
          "cannot call member function `{1}` of circuit `{0}` from static context");

  public static final DiagnosticType CIRCUIT_VARIABLE_CALL =
      DiagnosticType.error(
          "ASG_CIRCUIT_VARIABLE_CALL", "cannot call variable member `{1}` of circuit `{0}`");

  public static final DiagnosticType CALL_TEST_FUNCTION =
      DiagnosticType.error("ASG_CALL_TEST_FUNCTION", "cannot call test function `{0}`");

  public static final DiagnosticType INVALID_SELF_IN_GLOBAL =
      DiagnosticType.error(
          "ASG_INVALID_SELF_IN_GLOBAL",
          "cannot have `self` parameter in function `{0}` declared outside a circuit");

  // Structure

  public static final DiagnosticType ILLEGAL_AST_STRUCTURE =
      DiagnosticType.error("ASG_ILLEGAL_AST_STRUCTURE", "illegal ast structure: {0}");

  // Control flow

  public static final DiagnosticType MISSING_RETURN =
      DiagnosticType.error("ASG_MISSING_RETURN", "function `{0}` missing return for all paths");

  public static final DiagnosticType UNREACHABLE_CODE =
      DiagnosticType.error(
          "ASG_UNREACHABLE_CODE",
          "function `{0}` has unreachable code after an unconditional return");

  private AsgConvertErrors() {}
}
