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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private static final EvalEnv EMPTY = name -> null;

  private EvalEnvs() {}

  /** Returns an environment with no bindings. */
  public static EvalEnv empty() {
    return EMPTY;
  }

  /** Returns an environment whose ambient applicative is given. */
  public static EvalEnv withApplicative(Applicative applicative) {
    return EMPTY.bind(EvalEnv.APPLICATIVE, applicative);
  }

  /** Evaluation environment that inherits from a parent environment and adds
   * one binding. */
  static class SubEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final String name;
    protected final Object value;

    SubEvalEnv(EvalEnv parentEnv, String name, Object value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public @Nullable Object getOpt(String name) {
      for (SubEvalEnv e = this; ; ) {
        if (name.equals(e.name)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(name);
        }
      }
    }
  }
}

// End EvalEnvs.java
