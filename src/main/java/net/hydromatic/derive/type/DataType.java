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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.derive.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Algebraic data type, parameterized over one type variable.
 *
 * <p>For example,
 *
 * <pre>{@code
 * datatype 'a Tree = leaf | node of 'a * List 'a
 * }</pre>
 *
 * <p>The order of type constructors, and of the fields within each type
 * constructor, is significant: it is the order in which case arms are
 * generated and in which effects are sequenced.
 */
public class DataType {
  public final String name;
  public final TypeVar typeVar;
  public final ImmutableList<TyCon> tyCons;

  /** Creates a DataType.
   *
   * <p>Called only from {@link TypeSystem#dataType(String, TypeVar, List)}. */
  DataType(String name, TypeVar typeVar, List<TyCon> tyCons) {
    this.name = requireNonNull(name);
    this.typeVar = requireNonNull(typeVar);
    this.tyCons = ImmutableList.copyOf(tyCons);
    final Set<String> names = new HashSet<>();
    for (TyCon tyCon : tyCons) {
      checkArgument(names.add(tyCon.name), "duplicate constructor %s in %s",
          tyCon.name, name);
    }
  }

  /** Returns the type constructor with a given name, or null. */
  public @Nullable TyCon tyCon(String tyConName) {
    for (TyCon tyCon : tyCons) {
      if (tyCon.name.equals(tyConName)) {
        return tyCon;
      }
    }
    return null;
  }

  /** Returns the position of this datatype. */
  public Pos pos() {
    return Pos.of(name);
  }

  /** Returns the position of a type constructor. */
  public Pos pos(TyCon tyCon) {
    return Pos.of(name, tyCon.name);
  }

  /** Returns the type of a value of this datatype, e.g. {@code Pair 'a}. */
  public ApplyType type() {
    return new ApplyType(name, ImmutableList.of(typeVar));
  }

  /** Writes out the definition of the datatype. For example,
   *
   * <pre>{@code
   * datatype 'a Box = mk of 'a * Nat
   * }</pre>
   */
  public StringBuilder describe(StringBuilder buf) {
    buf.append("datatype ")
        .append(typeVar)
        .append(' ')
        .append(name)
        .append(" = ");
    for (int i = 0; i < tyCons.size(); i++) {
      if (i > 0) {
        buf.append(" | ");
      }
      tyCons.get(i).describe(buf);
    }
    return buf;
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Type constructor, with its ordered list of field types. */
  public static class TyCon {
    public final String name;
    public final ImmutableList<Type> fields;

    public TyCon(String name, List<? extends Type> fields) {
      this.name = requireNonNull(name);
      this.fields = ImmutableList.copyOf(fields);
      checkArgument(!name.isEmpty(), "empty name");
    }

    /** Returns the number of fields. */
    public int arity() {
      return fields.size();
    }

    StringBuilder describe(StringBuilder buf) {
      buf.append(name);
      if (!fields.isEmpty()) {
        buf.append(" of ");
        for (int i = 0; i < fields.size(); i++) {
          if (i > 0) {
            buf.append(" * ");
          }
          fields.get(i).describe(buf, 0, 0);
        }
      }
      return buf;
    }

    @Override
    public String toString() {
      return describe(new StringBuilder()).toString();
    }
  }
}

// End DataType.java
