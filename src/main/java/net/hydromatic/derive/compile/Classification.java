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

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.derive.type.ApplyType;
import net.hydromatic.derive.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * How a field of a type constructor relates to the type variable of its
 * datatype.
 *
 * <p>The classification of a field is one of {@link #EXACT}, {@link #ABSENT},
 * {@link #RECURSIVE}, or a nested classification created by {@link #nested}.
 *
 * @see Classifier
 */
public class Classification {
  /** The field is the type variable. */
  public static final Classification EXACT =
      new Classification(Kind.EXACT, null, null);

  /** The type variable does not occur in the field. */
  public static final Classification ABSENT =
      new Classification(Kind.ABSENT, null, null);

  /** The head of the field is the datatype being derived. */
  public static final Classification RECURSIVE =
      new Classification(Kind.RECURSIVE, null, null);

  public final Kind kind;
  /** Outer type of a nested field, e.g. {@code List 'a}; null if not
   * nested. */
  public final @Nullable ApplyType outer;
  /** Classification of the last argument of {@link #outer}. */
  public final @Nullable Classification inner;

  private Classification(Kind kind, @Nullable ApplyType outer,
      @Nullable Classification inner) {
    this.kind = requireNonNull(kind);
    this.outer = outer;
    this.inner = inner;
  }

  /** Creates a classification of a field whose type variable occurs in the
   * last argument of {@code outer}. */
  public static Classification nested(ApplyType outer, Classification inner) {
    return new Classification(Kind.NESTED, requireNonNull(outer),
        requireNonNull(inner));
  }

  /** Returns the type in which the type variable is nested. */
  public Type innerType() {
    return requireNonNull(outer).last();
  }

  /** Whether the transform of a field with this classification does any
   * work. */
  public boolean isEffectful() {
    return kind != Kind.ABSENT;
  }

  /** Returns whether this classification, or any classification nested
   * inside it, is {@link #RECURSIVE}. */
  public boolean isRecursive() {
    for (Classification c = this; c != null; c = c.inner) {
      if (c.kind == Kind.RECURSIVE) {
        return true;
      }
    }
    return false;
  }

  /** Returns the names of the outer type constructors, outermost first;
   * for example, [List, Option] for {@code List (Option 'a)}. */
  public ImmutableList<String> heads() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (Classification c = this; c.kind == Kind.NESTED; c = c.inner) {
      b.add(requireNonNull(c.outer).name);
    }
    return b.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, outer, inner);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Classification
            && kind == ((Classification) o).kind
            && Objects.equals(outer, ((Classification) o).outer)
            && Objects.equals(inner, ((Classification) o).inner);
  }

  @Override
  public String toString() {
    if (kind != Kind.NESTED) {
      return kind.name();
    }
    return "NESTED(" + requireNonNull(outer).name + ", " + inner + ")";
  }

  /** Kind of classification. */
  public enum Kind {
    EXACT,
    ABSENT,
    RECURSIVE,
    NESTED
  }
}

// End Classification.java
