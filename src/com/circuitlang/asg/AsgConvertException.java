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

import static com.google.common.base.Preconditions.checkArgument;

import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a syntax tree cannot be turned into a semantic graph. The first error aborts the
 * conversion of the enclosing node, function and program; nothing partial is kept.
 */
public final class AsgConvertException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<AsgError> errors;

  public AsgConvertException(AsgError error) {
    this(ImmutableList.of(error));
  }

  /** Carries several diagnostics of one failed function; the first is the fatal one. */
  public AsgConvertException(List<AsgError> errors) {
    super(errors.isEmpty() ? null : errors.get(0).description());
    checkArgument(!errors.isEmpty(), "no errors");
    this.errors = ImmutableList.copyOf(errors);
  }

  static AsgConvertException of(@Nullable Span span, DiagnosticType type, String... arguments) {
    return new AsgConvertException(AsgError.make(span, type, arguments));
  }

  /** The fatal error. */
  public AsgError getError() {
    return errors.get(0);
  }

  public DiagnosticType getType() {
    return getError().type();
  }

  public ImmutableList<AsgError> getErrors() {
    return errors;
  }
}
