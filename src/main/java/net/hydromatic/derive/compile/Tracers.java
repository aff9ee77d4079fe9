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

import java.util.function.Consumer;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each classified
   * field, then calls the underlying tracer. */
  public static Tracer withOnClassify(Tracer tracer,
      Consumer<Classification> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onClassify(Pos pos, Type field,
          Classification classification) {
        consumer.accept(classification);
        super.onClassify(pos, field, classification);
      }
    };
  }

  /** Returns a tracer that performs the given action on each synthesized
   * operation, then calls the underlying tracer. */
  public static Tracer withOnSynthesized(Tracer tracer,
      Consumer<SynthesizedOp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSynthesized(SynthesizedOp op) {
        consumer.accept(op);
        super.onSynthesized(op);
      }
    };
  }

  public static Tracer withOnEquation(Tracer tracer,
      Consumer<Equation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onEquation(Equation equation) {
        consumer.accept(equation);
        super.onEquation(equation);
      }
    };
  }

  public static Tracer withOnLaw(Tracer tracer, Consumer<LawResult> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLaw(LawResult result) {
        consumer.accept(result);
        super.onLaw(result);
      }
    };
  }

  public static Tracer withOnDeriveException(Tracer tracer,
      Consumer<DeriveException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleDeriveException(@Nullable DeriveException e) {
        if (e != null) {
          consumer.accept(e);
        }
        super.handleDeriveException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onClassify(Pos pos, Type field,
        Classification classification) {}

    @Override
    public void onSynthesized(SynthesizedOp op) {}

    @Override
    public void onEquation(Equation equation) {}

    @Override
    public void onLaw(LawResult result) {}

    @Override
    public boolean handleDeriveException(@Nullable DeriveException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onClassify(Pos pos, Type field,
        Classification classification) {
      tracer.onClassify(pos, field, classification);
    }

    @Override
    public void onSynthesized(SynthesizedOp op) {
      tracer.onSynthesized(op);
    }

    @Override
    public void onEquation(Equation equation) {
      tracer.onEquation(equation);
    }

    @Override
    public void onLaw(LawResult result) {
      tracer.onLaw(result);
    }

    @Override
    public boolean handleDeriveException(@Nullable DeriveException e) {
      return tracer.handleDeriveException(e);
    }
  }
}

// End Tracers.java
