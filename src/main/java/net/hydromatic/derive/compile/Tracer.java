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

import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during derivation. */
public interface Tracer {
  /** Called when a field has been classified. */
  void onClassify(Pos pos, Type field, Classification classification);

  /** Called when an operation has been synthesized. */
  void onSynthesized(SynthesizedOp op);

  /** Called when an unfolding equation has been discharged. */
  void onEquation(Equation equation);

  /** Called when a law obligation has been checked. */
  void onLaw(LawResult result);

  /**
   * Called with the exception thrown during derivation, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean handleDeriveException(@Nullable DeriveException e);
}

// End Tracer.java
