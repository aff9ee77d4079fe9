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

/**
 * Law that a derived operation satisfies.
 *
 * <p>In the statements, {@code op} stands for the operation, {@code F} and
 * {@code G} for applicatives, and {@code t} for an applicative morphism.
 */
public enum Law {
  MAP_IDENTITY(CapabilityKind.MAP, "map id x = x"),
  MAP_COMPOSITION(CapabilityKind.MAP, "map (g o f) x = map g (map f x)"),
  TRAVERSE_IDENTITY(CapabilityKind.TRAVERSE, "traverse pure x = pure x"),
  TRAVERSE_COMPOSITION(CapabilityKind.TRAVERSE,
      "traverse (Compose o fmap g o f) x"
          + " = Compose (fmap (traverse g) (traverse f x))"),
  TRAVERSE_NATURALITY(CapabilityKind.TRAVERSE,
      "t (traverse f x) = traverse (t o f) x"),
  /** Traversing with the identity applicative is the same as mapping. */
  TRAVERSE_MAP_COHERENCE(CapabilityKind.TRAVERSE,
      "traverse (Identity o f) x = Identity (map f x)");

  /** Kind of operation that the law constrains. */
  public final CapabilityKind kind;
  public final String statement;

  Law(CapabilityKind kind, String statement) {
    this.kind = kind;
    this.statement = statement;
  }
}

// End Law.java
