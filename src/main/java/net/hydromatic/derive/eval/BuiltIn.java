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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import net.hydromatic.derive.type.TypeSystem;
import net.hydromatic.derive.util.Static;

/** Capabilities of built-in type constructors. */
public enum BuiltIn implements Capability {
  /** Capability of {@code List 'a}. Values are {@link List}. */
  LIST(TypeSystem.LIST) {
    @Override
    public Object map(Function<Object, Object> fn, Object value) {
      return Static.transformEager((List<?>) value, fn::apply);
    }

    @Override
    public Object traverse(Applicative applicative,
        Function<Object, Object> fn, Object value) {
      Object acc = applicative.pure(ImmutableList.of());
      for (Object e : (List<?>) value) {
        final Object accFn =
            applicative.map(
                list -> (Function<Object, Object>) y ->
                    Static.append(asList(list), y),
                acc);
        acc = applicative.ap(accFn, fn.apply(e));
      }
      return acc;
    }
  },

  /** Capability of {@code Option 'a}. Values are {@link Optional}. */
  OPTION(TypeSystem.OPTION) {
    @Override
    public Object map(Function<Object, Object> fn, Object value) {
      return ((Optional<?>) value).map(fn);
    }

    @Override
    public Object traverse(Applicative applicative,
        Function<Object, Object> fn, Object value) {
      final Optional<?> optional = (Optional<?>) value;
      if (!optional.isPresent()) {
        return applicative.pure(Optional.empty());
      }
      return applicative.map(Optional::of, fn.apply(optional.get()));
    }
  },

  /**
   * Capability of {@code Either 'e 'a}, which transforms right values and
   * leaves left values unchanged. Values are {@link Either}.
   */
  EITHER(TypeSystem.EITHER) {
    @Override
    public Object map(Function<Object, Object> fn, Object value) {
      final Either either = (Either) value;
      return either.isLeft ? either : Either.right(fn.apply(either.value));
    }

    @Override
    public Object traverse(Applicative applicative,
        Function<Object, Object> fn, Object value) {
      final Either either = (Either) value;
      if (either.isLeft) {
        return applicative.pure(either);
      }
      return applicative.map(Either::right, fn.apply(either.value));
    }
  };

  /** Name of the type constructor. */
  public final String typeName;

  BuiltIn(String typeName) {
    this.typeName = typeName;
  }

  @Override
  public String typeName() {
    return typeName;
  }

  @Override
  public boolean lawful() {
    return true;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object o) {
    return (List<Object>) o;
  }
}

// End BuiltIn.java
