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
import java.util.List;
import net.hydromatic.derive.ast.Op;

/**
 * Type that is a named type constructor applied to a list of types.
 *
 * <p>For example, {@code List 'a} is the type constructor {@code List}
 * applied to {@code 'a}, and {@code Either String 'a} is {@code Either}
 * applied to {@code String} and {@code 'a}.
 */
public class ApplyType implements Type {
  public final String name;
  public final ImmutableList<Type> args;

  ApplyType(String name, ImmutableList<Type> args) {
    this.name = requireNonNull(name);
    this.args = requireNonNull(args);
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Returns the last argument, the one a capability of {@link #name}
   * transforms. */
  public Type last() {
    checkArgument(!args.isEmpty(), "type %s has no arguments", name);
    return args.get(args.size() - 1);
  }

  /** Returns every argument but the last. */
  public List<Type> init() {
    checkArgument(!args.isEmpty(), "type %s has no arguments", name);
    return args.subList(0, args.size() - 1);
  }

  /** Creates a copy of this type with the given arguments, or this type if
   * the arguments are the same. */
  public ApplyType copy(ImmutableList<Type> args) {
    return args.equals(this.args) ? this : new ApplyType(name, args);
  }

  @Override
  public Op op() {
    return Op.APPLY_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, int left, int right) {
    if (args.isEmpty()) {
      return buf.append(name);
    }
    final Op op = op();
    if (left > op.left || op.right < right) {
      buf.append('(');
      describe(buf, 0, 0);
      return buf.append(')');
    }
    buf.append(name);
    for (Type arg : args) {
      buf.append(' ');
      arg.describe(buf, 99, 99);
    }
    return buf;
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + args.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ApplyType
            && name.equals(((ApplyType) obj).name)
            && args.equals(((ApplyType) obj).args);
  }

  @Override
  public String toString() {
    return moniker();
  }
}

// End ApplyType.java
