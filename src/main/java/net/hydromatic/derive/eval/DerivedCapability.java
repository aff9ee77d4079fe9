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
package net.hydromatic.derive.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.derive.eval.Applicatives.fn;

import java.util.function.Function;
import net.hydromatic.derive.compile.CapabilityKind;
import net.hydromatic.derive.compile.SynthesizedOp;

/**
 * Capability of a datatype whose {@code map} and {@code traverse} operations
 * have been derived.
 *
 * <p>Operations are evaluated by an {@link Interpreter}, so that a derived
 * datatype can occur as the outer type of a field of a datatype derived
 * later.
 */
public class DerivedCapability implements Capability {
  private final SynthesizedOp mapOp;
  private final SynthesizedOp traverseOp;
  private final Interpreter interpreter;

  public DerivedCapability(SynthesizedOp mapOp, SynthesizedOp traverseOp,
      Interpreter interpreter) {
    this.mapOp = requireNonNull(mapOp);
    this.traverseOp = requireNonNull(traverseOp);
    this.interpreter = requireNonNull(interpreter);
    checkArgument(mapOp.kind == CapabilityKind.MAP);
    checkArgument(traverseOp.kind == CapabilityKind.TRAVERSE);
    checkArgument(mapOp.dataType == traverseOp.dataType);
  }

  @Override
  public String typeName() {
    return mapOp.dataType.name;
  }

  /** Returns true if laws have been established for both operations. */
  @Override
  public boolean lawful() {
    return !mapOp.laws.isEmpty() && !traverseOp.laws.isEmpty();
  }

  @Override
  public Object map(Function<Object, Object> f, Object value) {
    final Object op = interpreter.eval(EvalEnvs.empty(), mapOp.body);
    return fn(fn(op).apply(f)).apply(value);
  }

  @Override
  public Object traverse(Applicative applicative,
      Function<Object, Object> f, Object value) {
    final Object op =
        interpreter.eval(EvalEnvs.withApplicative(applicative),
            traverseOp.body);
    return fn(fn(op).apply(f)).apply(value);
  }

  @Override
  public String toString() {
    return "DerivedCapability(" + typeName() + ")";
  }
}

// End DerivedCapability.java
