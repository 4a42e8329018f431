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
package com.circuitlang.ast;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * {@code import a.b.*;} or {@code import a.b.(Foo, bar as baz);}.
 *
 * @param packagePath The dotted package path, outermost first.
 * @param star Whether every symbol of the package is imported.
 * @param symbols The named symbols; empty when {@code star} is set.
 * @param span Source of the statement.
 */
public record ImportDecl(
    ImmutableList<String> packagePath,
    boolean star,
    ImmutableList<ImportDecl.Symbol> symbols,
    @Nullable Span span) {

  public ImportDecl(
      List<String> packagePath, boolean star, List<Symbol> symbols, @Nullable Span span) {
    this(ImmutableList.copyOf(packagePath), star, ImmutableList.copyOf(symbols), span);
  }

  /** {@code name} or {@code name as alias}. */
  public record Symbol(Identifier symbol, @Nullable Identifier alias) {
    /** The name the symbol is bound to locally. */
    public String localName() {
      return alias != null ? alias.name() : symbol.name();
    }
  }

  public String packageName() {
    return Joiner.on('.').join(packagePath);
  }
}
