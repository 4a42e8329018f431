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

import com.circuitlang.ast.AssignOperation;
import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** {@code target.path op= value;} where the target is a mutable variable. */
public final class AssignStatement extends Statement {

  /** One step of the path from the target variable into the assigned part. */
  public interface Access {}

  /** {@code [index]}. */
  public static final class ArrayIndex implements Access {
    private final Slot<Expression> index;

    ArrayIndex(Expression index) {
      this.index = new Slot<>(index);
    }

    public Expression getIndex() {
      return index.get();
    }
  }

  /** {@code .0}. */
  public record TupleIndex(int index) implements Access {}

  /** {@code .name}. */
  public record Member(String name) implements Access {}

  private final AssignOperation operation;
  private final Variable target;
  private final ImmutableList<Access> accesses;
  private final Slot<Expression> value;

  AssignStatement(
      AsgContext context,
      @Nullable Span span,
      AssignOperation operation,
      Variable target,
      List<Access> accesses,
      Expression value) {
    super(context, span);
    this.operation = operation;
    this.target = target;
    this.accesses = ImmutableList.copyOf(accesses);
    this.value = new Slot<>(value);
  }

  public AssignOperation getOperation() {
    return operation;
  }

  public Variable getTarget() {
    return target;
  }

  public ImmutableList<Access> getAccesses() {
    return accesses;
  }

  public Expression getValue() {
    return value.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    ImmutableList.Builder<Slot<?>> slots = ImmutableList.builder();
    for (Access access : accesses) {
      if (access instanceof ArrayIndex) {
        slots.add(((ArrayIndex) access).index);
      }
    }
    return slots.add(value).build();
  }
}
