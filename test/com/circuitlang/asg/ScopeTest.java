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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.circuitlang.ast.IR;
import com.circuitlang.ast.IntegerType;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeTest {
  private AsgContext context;
  private Scope root;

  @Before
  public void setUp() {
    context = new AsgContext();
    root = context.makeRootScope();
  }

  private Variable variable(String name) {
    return context.alloc(
        new Variable(
            context,
            name,
            null,
            Type.integer(IntegerType.U8),
            false,
            false,
            Variable.Declaration.DEFINITION));
  }

  @Test
  public void testShadowing() throws Exception {
    Variable outer = variable("x");
    root.declareVariable(outer);
    Scope inner = root.makeSubscope();
    Variable shadow = variable("x");
    inner.declareVariable(shadow);
    Scope sibling = root.makeSubscope();

    assertThat(inner.resolveVariable("x")).isSameInstanceAs(shadow);
    assertThat(inner.makeSubscope().resolveVariable("x")).isSameInstanceAs(shadow);
    assertThat(sibling.resolveVariable("x")).isSameInstanceAs(outer);
    assertThat(root.resolveVariable("x")).isSameInstanceAs(outer);
  }

  @Test
  public void testUnresolved() {
    assertThat(root.makeSubscope().resolveVariable("x")).isNull();
    assertThat(root.resolveFunction("f")).isNull();
    assertThat(root.resolveCircuit("C")).isNull();
  }

  @Test
  public void testDuplicateInSameScope() throws Exception {
    root.declareVariable(variable("x"));
    AsgConvertException e =
        assertThrows(AsgConvertException.class, () -> root.declareVariable(variable("x")));
    assertThat(e.getType()).isEqualTo(AsgConvertErrors.DUPLICATE_DEFINITION);
    assertThat(e.getError().description())
        .isEqualTo("a variable named `x` already exists in this scope");
  }

  @Test
  public void testDuplicateCircuit() throws Exception {
    Circuit c = context.alloc(new Circuit(context, "C", null, root));
    root.declareCircuit("C", c);
    AsgConvertException e =
        assertThrows(AsgConvertException.class, () -> root.declareCircuit("C", c));
    assertThat(e.getType()).isEqualTo(AsgConvertErrors.DUPLICATE_DEFINITION);
  }

  @Test
  public void testNestingQueries() {
    Scope child = root.makeSubscope();
    Scope grandchild = child.makeSubscope();
    assertThat(root.isRoot()).isTrue();
    assertThat(grandchild.isRoot()).isFalse();
    assertThat(grandchild.getDepth()).isEqualTo(2);
    assertThat(root.contains(grandchild)).isTrue();
    assertThat(child.contains(root)).isFalse();
    assertThat(grandchild.getParent()).isSameInstanceAs(child);
  }

  @Test
  public void testSelfType() throws Exception {
    Circuit c = context.alloc(new Circuit(context, "C", null, root));
    root.declareCircuit("C", c);
    Scope methodScope = c.getScope().makeSubscope();

    assertThat(methodScope.resolveCircuit("Self")).isSameInstanceAs(c);
    assertThat(root.resolveCircuit("Self")).isNull();
    assertThat(methodScope.resolveDeclaredType(IR.selfType())).isEqualTo(new Type.CircuitRef(c));
    AsgConvertException e =
        assertThrows(AsgConvertException.class, () -> root.resolveDeclaredType(IR.selfType()));
    assertThat(e.getType()).isEqualTo(AsgConvertErrors.UNRESOLVED_CIRCUIT);
  }

  @Test
  public void testResolveDeclaredType() throws Exception {
    assertThat(root.resolveDeclaredType(IR.boolType())).isEqualTo(Type.BOOLEAN);
    assertThat(root.resolveDeclaredType(IR.arrayType(IR.type(IntegerType.U8), 3)))
        .isEqualTo(new Type.Array(Type.integer(IntegerType.U8), 3));
    assertThat(root.resolveDeclaredType(IR.tupleType(IR.fieldType(), IR.groupType())))
        .isEqualTo(new Type.Tuple(ImmutableList.of(Type.FIELD, Type.GROUP)));
    AsgConvertException e =
        assertThrows(
            AsgConvertException.class, () -> root.resolveDeclaredType(IR.namedType("Missing")));
    assertThat(e.getType()).isEqualTo(AsgConvertErrors.UNRESOLVED_CIRCUIT);
  }

  @Test
  public void testContextOwnsScopes() {
    int before = context.getScopeCount();
    root.makeSubscope().makeSubscope();
    assertThat(context.getScopeCount()).isEqualTo(before + 2);
  }
}
