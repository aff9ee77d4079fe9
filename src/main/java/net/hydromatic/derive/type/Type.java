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
package net.hydromatic.derive.type;

import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.derive.ast.Op;

/**
 * Type expression that may occur as the type of a field of a type
 * constructor.
 *
 * <p>A type is one of a {@link PrimitiveType} (e.g. {@code Int}), a {@link
 * TypeVar} (e.g. {@code 'a}), or an {@link ApplyType}, a named type
 * constructor applied to arguments (e.g. {@code List 'a}, {@code Either
 * String 'a}).
 */
public interface Type {
  /** Type operator. */
  Op op();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Writes a description of this type to a string builder, with parentheses
   * if the precedence of the context requires them.
   */
  StringBuilder describe(StringBuilder buf, int left, int right);

  /** Description of the type, e.g. "{@code Int}" or "{@code List (Option
   * 'a)}". */
  default String moniker() {
    return describe(new StringBuilder(), 0, 0).toString();
  }

  /** Returns whether this type contains a given type variable. */
  default boolean contains(TypeVar typeVar) {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar2) {
            if (typeVar2.equals(typeVar)) {
              c.incrementAndGet();
            }
            return null;
          }
        });
    return c.get() > 0;
  }

  /** Returns the depth of nesting of type applications in this type. */
  default int depth() {
    return accept(
        new TypeVisitor<Integer>() {
          @Override
          public Integer visit(TypeVar typeVar) {
            return 0;
          }

          @Override
          public Integer visit(PrimitiveType primitiveType) {
            return 0;
          }

          @Override
          public Integer visit(ApplyType applyType) {
            int d = 0;
            for (Type type : applyType.args) {
              d = Math.max(d, type.accept(this));
            }
            return d + 1;
          }
        });
  }

  /** Returns a copy of this type with a type variable replaced. */
  default Type substitute(TypeVar typeVar, Type type) {
    return accept(
        new TypeShuttle() {
          @Override
          public Type visit(TypeVar typeVar2) {
            return typeVar2.equals(typeVar) ? type : typeVar2;
          }
        });
  }
}

// End Type.java
