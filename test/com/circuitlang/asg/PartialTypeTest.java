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

import com.circuitlang.ast.IntegerType;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PartialTypeTest {
  private static final Type U8 = Type.integer(IntegerType.U8);
  private static final Type U32 = Type.integer(IntegerType.U32);

  @Test
  public void testExact() {
    PartialType hint = PartialType.exact(Type.BOOLEAN);
    assertThat(hint.matches(Type.BOOLEAN)).isTrue();
    assertThat(hint.matches(Type.FIELD)).isFalse();
    assertThat(hint.full()).isEqualTo(Type.BOOLEAN);
  }

  @Test
  public void testAnyInteger() {
    PartialType hint = PartialType.anyInteger();
    assertThat(hint.matches(U8)).isTrue();
    assertThat(hint.matches(U32)).isTrue();
    assertThat(hint.matches(Type.FIELD)).isFalse();
    assertThat(hint.full()).isNull();
    assertThat(hint.toString()).isEqualTo("integer");
  }

  @Test
  public void testIntegerTypePartialIsExactWidth() {
    PartialType hint = U8.partial();
    assertThat(hint.matches(U8)).isTrue();
    assertThat(hint.matches(U32)).isFalse();
    assertThat(hint.full()).isEqualTo(U8);
  }

  @Test
  public void testImplicitDefault() {
    PartialType.IntegerHint hint = new PartialType.IntegerHint(null, IntegerType.U32);
    assertThat(hint.literalType()).isEqualTo(IntegerType.U32);
    assertThat(hint.matches(U8)).isTrue();
    assertThat(new PartialType.IntegerHint(IntegerType.I8, IntegerType.U32).literalType())
        .isEqualTo(IntegerType.I8);
  }

  @Test
  public void testArrayHint() {
    PartialType anyLength = new PartialType.ArrayHint(U8.partial(), null);
    assertThat(anyLength.matches(new Type.Array(U8, 3))).isTrue();
    assertThat(anyLength.matches(new Type.Array(U8, 7))).isTrue();
    assertThat(anyLength.matches(new Type.Array(U32, 3))).isFalse();
    assertThat(anyLength.matches(U8)).isFalse();
    assertThat(anyLength.full()).isNull();
    assertThat(anyLength.toString()).isEqualTo("[u8; _]");

    PartialType anyElement = new PartialType.ArrayHint(null, 3);
    assertThat(anyElement.matches(new Type.Array(Type.BOOLEAN, 3))).isTrue();
    assertThat(anyElement.matches(new Type.Array(Type.BOOLEAN, 2))).isFalse();

    assertThat(new Type.Array(U8, 3).partial().full()).isEqualTo(new Type.Array(U8, 3));
  }

  @Test
  public void testTupleHint() {
    PartialType hint = new PartialType.TupleHint(Arrays.asList(null, Type.BOOLEAN.partial()));
    assertThat(hint.matches(new Type.Tuple(Arrays.asList(U8, Type.BOOLEAN)))).isTrue();
    assertThat(hint.matches(new Type.Tuple(Arrays.asList(U8, U8)))).isFalse();
    assertThat(hint.matches(new Type.Tuple(Arrays.asList(U8)))).isFalse();
    assertThat(hint.full()).isNull();
    assertThat(hint.toString()).isEqualTo("(_, bool)");
  }

  @Test
  public void testUnit() {
    assertThat(Type.UNIT.isUnit()).isTrue();
    assertThat(Type.UNIT.partial().matches(new Type.Tuple(Arrays.asList()))).isTrue();
    assertThat(Type.BOOLEAN.isUnit()).isFalse();
  }
}
