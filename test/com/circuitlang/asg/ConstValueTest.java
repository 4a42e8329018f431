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

import com.circuitlang.ast.BinaryOperation;
import com.circuitlang.ast.IntegerType;
import com.circuitlang.ast.UnaryOperation;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConstValueTest {

  private static ConstValue u8(long value) {
    return new ConstValue.Int(IntegerType.U8, BigInteger.valueOf(value));
  }

  private static ConstValue i8(long value) {
    return new ConstValue.Int(IntegerType.I8, BigInteger.valueOf(value));
  }

  @Test
  public void testOutOfRangeRejected() {
    assertThrows(IllegalArgumentException.class, () -> u8(256));
    assertThrows(IllegalArgumentException.class, () -> i8(-129));
  }

  @Test
  public void testArithmetic() {
    assertThat(ConstValue.evaluate(BinaryOperation.ADD, u8(2), u8(3))).isEqualTo(u8(5));
    assertThat(ConstValue.evaluate(BinaryOperation.SUB, u8(7), u8(3))).isEqualTo(u8(4));
    assertThat(ConstValue.evaluate(BinaryOperation.MUL, u8(6), u8(7))).isEqualTo(u8(42));
    assertThat(ConstValue.evaluate(BinaryOperation.DIV, u8(7), u8(2))).isEqualTo(u8(3));
    assertThat(ConstValue.evaluate(BinaryOperation.POW, u8(2), u8(7))).isEqualTo(u8(128));
  }

  @Test
  public void testOverflowIsNotFolded() {
    assertThat(ConstValue.evaluate(BinaryOperation.ADD, u8(200), u8(100))).isNull();
    assertThat(ConstValue.evaluate(BinaryOperation.SUB, u8(1), u8(2))).isNull();
    assertThat(ConstValue.evaluate(BinaryOperation.POW, u8(2), u8(8))).isNull();
    assertThat(ConstValue.evaluate(UnaryOperation.NEGATE, i8(-128))).isNull();
  }

  @Test
  public void testDivisionByZeroIsNotFolded() {
    assertThat(ConstValue.evaluate(BinaryOperation.DIV, u8(1), u8(0))).isNull();
  }

  @Test
  public void testPowEdgeCases() {
    assertThat(ConstValue.evaluate(BinaryOperation.POW, u8(0), u8(0))).isEqualTo(u8(1));
    assertThat(ConstValue.evaluate(BinaryOperation.POW, u8(1), u8(200))).isEqualTo(u8(1));
    assertThat(ConstValue.evaluate(BinaryOperation.POW, i8(-1), i8(3))).isEqualTo(i8(-1));
    assertThat(ConstValue.evaluate(BinaryOperation.POW, i8(-1), i8(4))).isEqualTo(i8(1));
    assertThat(ConstValue.evaluate(BinaryOperation.POW, i8(2), i8(-1))).isNull();
  }

  @Test
  public void testComparisons() {
    ConstValue yes = new ConstValue.Bool(true);
    ConstValue no = new ConstValue.Bool(false);
    assertThat(ConstValue.evaluate(BinaryOperation.LT, u8(1), u8(2))).isEqualTo(yes);
    assertThat(ConstValue.evaluate(BinaryOperation.GE, u8(1), u8(2))).isEqualTo(no);
    assertThat(ConstValue.evaluate(BinaryOperation.EQ, u8(1), u8(1))).isEqualTo(yes);
    assertThat(ConstValue.evaluate(BinaryOperation.NE, u8(1), u8(1))).isEqualTo(no);
    assertThat(ConstValue.evaluate(BinaryOperation.AND, yes, no)).isEqualTo(no);
    assertThat(ConstValue.evaluate(BinaryOperation.OR, yes, no)).isEqualTo(yes);
    assertThat(ConstValue.evaluate(UnaryOperation.NOT, no)).isEqualTo(yes);
  }

  @Test
  public void testFieldArithmeticIsLeftToBackend() {
    ConstValue one = new ConstValue.Field(BigInteger.ONE);
    assertThat(ConstValue.evaluate(BinaryOperation.ADD, one, one)).isNull();
    assertThat(ConstValue.evaluate(UnaryOperation.NEGATE, one))
        .isEqualTo(new ConstValue.Field(BigInteger.ONE.negate()));
    assertThat(ConstValue.evaluate(BinaryOperation.EQ, one, one))
        .isEqualTo(new ConstValue.Bool(true));
  }

  @Test
  public void testTypes() {
    assertThat(u8(1).getType()).isEqualTo(Type.integer(IntegerType.U8));
    assertThat(new ConstValue.Bool(true).getType()).isEqualTo(Type.BOOLEAN);
    assertThat(new ConstValue.Group("1group").getType()).isEqualTo(Type.GROUP);
  }
}
