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

/** Synthesizes the transform of one field of a constructor. */
public class FieldSynthesizer {
  private final Context context;
  private final NestedTransformBuilder nestedTransformBuilder;

  FieldSynthesizer(Context context) {
    this.context = requireNonNull(context);
    this.nestedTransformBuilder = new NestedTransformBuilder(context);
  }

  /**
   * Synthesizes a field.
   *
   * @param classification Classification of the field
   * @param field Expression for the value of the field
   * @param f Leaf transform
   * @param pos Position of the field
   */
  public FieldSynthesis synthesize(Classification classification,
      Core.Exp field, Core.Exp f, Pos pos) {
    switch (classification.kind) {
      case EXACT:
        return new FieldSynthesis(core.apply(f, field), field, true);

      case ABSENT:
        if (context.kind == CapabilityKind.MAP) {
          return new FieldSynthesis(field, field, false);
        }
        return new FieldSynthesis(core.pure(field), field, false);

      case NESTED:
        final Core.Exp transform =
            nestedTransformBuilder.build(classification, f, pos);
        return new FieldSynthesis(core.apply(transform, field), field, true);

      case RECURSIVE:
      default:
        throw new RecursionException("recursive field not supported", pos);
    }
  }
}

// End FieldSynthesizer.java
