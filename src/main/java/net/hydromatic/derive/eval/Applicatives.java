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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/** Implementations of {@link Applicative}. */
public abstract class Applicatives {
  private Applicatives() {}

  /** The identity applicative. Values are {@link Identity}. */
  public static final Applicative IDENTITY = new IdentityApplicative();

  /** The option applicative. Values are {@link Optional}; an empty value
   * short-circuits. */
  public static final Applicative OPTION = new OptionApplicative();

  /** The logging (writer) applicative. Values are {@link Logged}. */
  public static final Applicative LOGGING = new LoggingApplicative();

  /** The list (non-determinism) applicative. Values are {@link List}. */
  public static final Applicative LIST = new ListApplicative();

  /**
   * The constant applicative over the list monoid. Values are {@link List};
   * the wrapped value is discarded and only the accumulated list is kept.
   */
  public static final Applicative CONST = new ConstApplicative();

  /** Converts a value to a function. */
  @SuppressWarnings("unchecked")
  public static Function<Object, Object> fn(Object o) {
    return (Function<Object, Object>) requireNonNull(o, "fn");
  }

  /**
   * Returns the composition of two applicatives, whose values are {@code F (G
   * x)}.
   */
  public static Applicative compose(Applicative outer, Applicative inner) {
    return new ComposeApplicative(outer, inner);
  }

  /**
   * Applicative morphism from {@link #LOGGING} to {@link #IDENTITY} that
   * discards the log.
   */
  public static Object dropLog(Object logged) {
    return new Identity(((Logged) logged).value);
  }

  /** Returns the value inside an {@link Identity}. */
  public static Object runIdentity(Object identity) {
    return ((Identity) identity).value;
  }

  /** See {@link #IDENTITY}. */
  private static class IdentityApplicative implements Applicative {
    @Override
    public String name() {
      return "identity";
    }

    @Override
    public Object pure(Object value) {
      return new Identity(value);
    }

    @Override
    public Object ap(Object fn, Object arg) {
      return new Identity(fn(runIdentity(fn)).apply(runIdentity(arg)));
    }
  }

  /** See {@link #OPTION}. */
  private static class OptionApplicative implements Applicative {
    @Override
    public String name() {
      return "option";
    }

    @Override
    public Object pure(Object value) {
      return Optional.of(value);
    }

    @Override
    public Object ap(Object fn, Object arg) {
      final Optional<?> fnOpt = (Optional<?>) fn;
      final Optional<?> argOpt = (Optional<?>) arg;
      if (!fnOpt.isPresent() || !argOpt.isPresent()) {
        return Optional.empty();
      }
      return Optional.of(fn(fnOpt.get()).apply(argOpt.get()));
    }
  }

  /** See {@link #LOGGING}. */
  private static class LoggingApplicative implements Applicative {
    @Override
    public String name() {
      return "logging";
    }

    @Override
    public Object pure(Object value) {
      return new Logged(value, ImmutableList.of());
    }

    @Override
    public Object ap(Object fn, Object arg) {
      final Logged fnLogged = (Logged) fn;
      final Logged argLogged = (Logged) arg;
      return new Logged(fn(fnLogged.value).apply(argLogged.value),
          ImmutableList.<String>builder()
              .addAll(fnLogged.log)
              .addAll(argLogged.log)
              .build());
    }
  }

  /** See {@link #LIST}. */
  private static class ListApplicative implements Applicative {
    @Override
    public String name() {
      return "list";
    }

    @Override
    public Object pure(Object value) {
      return ImmutableList.of(value);
    }

    @Override
    public Object ap(Object fn, Object arg) {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (Object f : (List<?>) fn) {
        for (Object x : (List<?>) arg) {
          b.add(fn(f).apply(x));
        }
      }
      return b.build();
    }
  }

  /** See {@link #CONST}. */
  private static class ConstApplicative implements Applicative {
    @Override
    public String name() {
      return "const";
    }

    @Override
    public Object pure(Object value) {
      return ImmutableList.of();
    }

    @Override
    public Object ap(Object fn, Object arg) {
      return ImmutableList.builder()
          .addAll((List<?>) fn)
          .addAll((List<?>) arg)
          .build();
    }
  }

  /** Composition of two applicatives. See {@link #compose}. */
  private static class ComposeApplicative implements Applicative {
    private final Applicative outer;
    private final Applicative inner;

    ComposeApplicative(Applicative outer, Applicative inner) {
      this.outer = requireNonNull(outer);
      this.inner = requireNonNull(inner);
    }

    @Override
    public String name() {
      return "compose(" + outer.name() + ", " + inner.name() + ")";
    }

    @Override
    public Object pure(Object value) {
      return outer.pure(inner.pure(value));
    }

    @Override
    public Object ap(Object fn, Object arg) {
      // outer.ap((gf -> ga -> inner.ap(gf, ga)) <$> fn, arg)
      final Function<Object, Object> lift =
          gf -> (Function<Object, Object>) ga -> inner.ap(gf, ga);
      return outer.ap(outer.map(lift, fn), arg);
    }
  }
}

// End Applicatives.java
