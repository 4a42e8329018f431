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

import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_IMPORT;

import com.circuitlang.ast.ProgramTree;
import com.circuitlang.ast.Span;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Resolves imports against syntax trees held in memory, keyed by dotted package name. Each
 * package is built on demand into the importing program's context, at most once per context, so
 * every importer sees the same circuits and functions. An import cycle fails with
 * {@code UNRESOLVED_IMPORT}.
 */
public final class TreeImportResolver implements ImportResolver {
  private static final Joiner DOT = Joiner.on('.');

  private final ImmutableMap<String, ProgramTree> packages;
  private final Set<String> building = new HashSet<>();

  public TreeImportResolver(Map<String, ProgramTree> packages) {
    this.packages = ImmutableMap.copyOf(packages);
  }

  @Override
  public @Nullable Program resolvePackage(
      AsgContext context, AsgOptions options, List<String> packagePath, @Nullable Span span)
      throws AsgConvertException {
    String name = DOT.join(packagePath);
    ProgramTree tree = packages.get(name);
    if (tree == null) {
      return null;
    }
    Program built = context.getPackage(name);
    if (built != null) {
      return built;
    }
    if (!building.add(name)) {
      throw AsgConvertException.of(span, UNRESOLVED_IMPORT, name);
    }
    try {
      return new ProgramBuilder(context, options).build(tree);
    } finally {
      building.remove(name);
    }
  }
}
