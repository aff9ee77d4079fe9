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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.derive.type.DataType;

/**
 * Result of deriving a datatype: its {@code map} and {@code traverse}
 * operations, each with its equations and laws.
 */
public class Derivation {
  public final DataType dataType;
  public final SynthesizedOp mapOp;
  public final SynthesizedOp traverseOp;

  Derivation(DataType dataType, SynthesizedOp mapOp,
      SynthesizedOp traverseOp) {
    this.dataType = requireNonNull(dataType);
    this.mapOp = requireNonNull(mapOp);
    this.traverseOp = requireNonNull(traverseOp);
    checkArgument(mapOp.kind == CapabilityKind.MAP);
    checkArgument(traverseOp.kind == CapabilityKind.TRAVERSE);
  }

  /** Returns the operations, {@code map} first. */
  public ImmutableList<SynthesizedOp> ops() {
    return ImmutableList.of(mapOp, traverseOp);
  }

  /** Returns all equations, those of {@code map} first. */
  public ImmutableList<Equation> equations() {
    return ImmutableList.<Equation>builder()
        .addAll(mapOp.equations)
        .addAll(traverseOp.equations)
        .build();
  }

  /** Returns all law obligations, those of {@code map} first. */
  public ImmutableList<LawObligation> laws() {
    return ImmutableList.<LawObligation>builder()
        .addAll(mapOp.laws)
        .addAll(traverseOp.laws)
        .build();
  }

  @Override
  public String toString() {
    return mapOp + "\n" + traverseOp;
  }
}

// End Derivation.java
