/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.derive.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.derive.ast.CoreBuilder.core;

import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.type.ApplyType;

/**
 * Builds the transform for a nested field.
 *
 * <p>For a field of type {@code List (Option 'a)} and leaf transform
 * {@code f}, builds "{@code List.map (Option.map f)}". The transform is built
 * innermost first; every outer type must have a capability.
 */
public class NestedTransformBuilder {
  private final Context context;

  NestedTransformBuilder(Context context) {
    this.context = requireNonNull(context);
  }

  /**
   * Builds the transform for a nested classification.
   *
   * @throws MissingCapabilityException if an outer type has no capability
   */
  public Core.Exp build(Classification classification, Core.Exp leaf,
      Pos pos) {
    switch (classification.kind) {
      case EXACT:
        return leaf;
      case NESTED:
        final Core.Exp inner =
            build(requireNonNull(classification.inner), leaf, pos);
        final ApplyType outer = requireNonNull(classification.outer);
        if (context.env.lookupCapability(outer.name) == null) {
          throw new MissingCapabilityException("type " + outer.name
              + " has no " + context.kind.opName + " capability (required by "
              + outer.moniker() + ")", pos);
        }
        return core.apply(core.capabilityOp(outer.name, context.kind), inner);
      default:
        throw new AssertionError("cannot build transform for "
            + classification);
    }
  }
}

// End NestedTransformBuilder.java
