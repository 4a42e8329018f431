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
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DiagnosticGroupsTest {

  private static final ImmutableList<DiagnosticGroup> KINDS =
      ImmutableList.of(
          DiagnosticGroups.RESOLUTION,
          DiagnosticGroups.TYPE,
          DiagnosticGroups.CALL_VALIDATION,
          DiagnosticGroups.STRUCTURAL,
          DiagnosticGroups.CONTROL_FLOW);

  private static ImmutableList<DiagnosticType> allConvertErrors() throws Exception {
    ImmutableList.Builder<DiagnosticType> types = ImmutableList.builder();
    for (Field field : AsgConvertErrors.class.getDeclaredFields()) {
      if (Modifier.isStatic(field.getModifiers()) && field.getType() == DiagnosticType.class) {
        types.add((DiagnosticType) field.get(null));
      }
    }
    return types.build();
  }

  @Test
  public void everyConvertErrorHasOneKind() throws Exception {
    for (DiagnosticType type : allConvertErrors()) {
      int kinds = 0;
      for (DiagnosticGroup group : KINDS) {
        if (group.matches(type)) {
          kinds++;
        }
      }
      assertWithMessage("Kind groups containing %s", type.key).that(kinds).isEqualTo(1);
      assertThat(DiagnosticGroups.kindOf(type)).isNotNull();
      assertThat(DiagnosticGroups.ALL.matches(type)).isTrue();
    }
  }

  @Test
  public void kindGroupsAreDisjoint() {
    for (DiagnosticGroup a : KINDS) {
      for (DiagnosticGroup b : KINDS) {
        if (a != b) {
          assertWithMessage(
                  "DiagnosticTypes common to DiagnosticGroups %s and %s", a.getName(), b.getName())
              .that(Sets.intersection(a.getTypes(), b.getTypes()))
              .isEmpty();
        }
      }
    }
  }

  @Test
  public void allIsUnionOfKinds() throws Exception {
    for (DiagnosticGroup group : KINDS) {
      assertThat(DiagnosticGroups.ALL.isSubGroup(group)).isTrue();
    }
    assertThat(DiagnosticGroups.ALL.getTypes()).containsExactlyElementsIn(allConvertErrors());
  }

  @Test
  public void kindOf() {
    assertThat(DiagnosticGroups.kindOf(AsgConvertErrors.MISSING_RETURN))
        .isSameInstanceAs(DiagnosticGroups.CONTROL_FLOW);
    assertThat(DiagnosticGroups.kindOf(AsgConvertErrors.ARGUMENT_COUNT_MISMATCH))
        .isSameInstanceAs(DiagnosticGroups.CALL_VALIDATION);
    assertThat(DiagnosticGroups.kindOf(DiagnosticType.error("TEST_FOO", "foo"))).isNull();
  }

  @Test
  public void matchesByKey() {
    DiagnosticType copy = DiagnosticType.error(AsgConvertErrors.UNREACHABLE_CODE.key, "other");
    assertThat(DiagnosticGroups.CONTROL_FLOW.matches(copy)).isTrue();
    assertThat(DiagnosticGroups.CONTROL_FLOW.matches(AsgError.make(copy))).isTrue();
  }
}
