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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Position of a node within a datatype declaration.
 *
 * <p>A position names the datatype, and optionally a type constructor and a
 * field of that constructor. For example, the second field of constructor
 * {@code mk} of datatype {@code Pair} is described as "{@code Pair.mk#1}".
 */
public class Pos {
  public static final Pos ZERO = new Pos("", null, -1);

  public final String typeName;
  public final @Nullable String tyCon;
  public final int field;

  /** Creates a Pos. */
  public Pos(String typeName, @Nullable String tyCon, int field) {
    this.typeName = requireNonNull(typeName);
    this.tyCon = tyCon;
    this.field = field;
    checkArgument(field < 0 || tyCon != null, "field without constructor");
  }

  /** Creates a position that refers to a whole datatype. */
  public static Pos of(String typeName) {
    return new Pos(typeName, null, -1);
  }

  /** Creates a position that refers to a type constructor. */
  public static Pos of(String typeName, String tyCon) {
    return new Pos(typeName, tyCon, -1);
  }

  /** Creates a position that refers to a field of a type constructor. */
  public static Pos of(String typeName, String tyCon, int field) {
    return new Pos(typeName, tyCon, field);
  }

  /** Returns a position for the {@code i}th field of this constructor. */
  public Pos field(int i) {
    checkArgument(tyCon != null, "not a constructor position");
    return new Pos(typeName, tyCon, i);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeName, tyCon, field);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.typeName.equals(((Pos) o).typeName)
            && Objects.equals(this.tyCon, ((Pos) o).tyCon)
            && this.field == ((Pos) o).field;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(typeName);
    if (tyCon != null) {
      buf.append('.').append(tyCon);
    }
    if (field >= 0) {
      buf.append('#').append(field);
    }
    return buf;
  }
}

// End Pos.java
