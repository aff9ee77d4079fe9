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
package net.hydromatic.derive.ast;

/** Sub-types of {@link AstNode}, and operators of types. */
public enum Op {
  // identifiers
  ID(true),
  /** Reference to a capability operation, e.g. "{@code List.map}". */
  CAPABILITY_OP(true),

  // patterns
  ID_PAT(true),
  CON_PAT(" "),

  // miscellaneous
  BAR(" | "),
  MATCH(" => "),

  // value constructors
  CON(" ", 8),
  FN(" -> ", 6, false),

  // types
  TY_VAR(true),
  PRIMITIVE_TYPE(true),
  DATA_TYPE(" ", 8),
  APPLY_TYPE(" ", 8),

  // applicative operators
  /** Embeds a pure value, "{@code pure e}". */
  PURE(" ", 8),
  /** Functor map over an effect, "{@code f <$> e}". */
  MAP_EFFECT(" <$> ", 4),
  /** Applicative apply, "{@code ef <*> e}". */
  APPLY_EFFECT(" <*> ", 4),

  APPLY(" ", 8),
  CASE;

  /** Padded name, e.g. " <*> ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java
