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
import static net.hydromatic.derive.eval.Applicatives.fn;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Supplier;
import net.hydromatic.derive.eval.Applicative;
import net.hydromatic.derive.eval.Applicatives;
import net.hydromatic.derive.eval.EvalEnvs;
import net.hydromatic.derive.eval.Identity;
import net.hydromatic.derive.eval.Interpreter;
import net.hydromatic.derive.eval.Logged;
import net.hydromatic.derive.eval.NoGeneratorException;
import net.hydromatic.derive.eval.Prop;
import net.hydromatic.derive.eval.ValueGenerator;
import net.hydromatic.derive.type.DataType;

/**
 * Checks law obligations against randomly generated values.
 *
 * <p>For each case of an obligation (that is, each constructor), generates
 * {@link Prop#LAW_TRIALS} values of that constructor, whose elements are
 * random integers, and evaluates both sides of the law.
 *
 * <p>If a field has a type whose values cannot be generated, the law is
 * reported to the tracer as not checked.
 *
 * <p>Composition is checked in the applicative "logging of option",
 * naturality using the morphism from logging to identity that discards the
 * log.
 */
public class LawChecker {
  /** Applicatives in which {@link Law#TRAVERSE_IDENTITY} is checked. */
  private static final List<Applicative> IDENTITY_APPLICATIVES =
      ImmutableList.of(Applicatives.IDENTITY, Applicatives.OPTION,
          Applicatives.LOGGING, Applicatives.LIST);

  private final Tracer tracer;
  private final Interpreter interpreter;
  private final ValueGenerator valueGenerator;
  private final Random random;
  private final int trials;

  public LawChecker(Environment env, Tracer tracer, Map<Prop, Object> props) {
    this.tracer = requireNonNull(tracer);
    this.interpreter = new Interpreter(env);
    this.random = new Random(Prop.SEED.intValue(props));
    this.valueGenerator =
        new ValueGenerator(env, random, Prop.MAX_LENGTH.intValue(props));
    this.trials = Prop.LAW_TRIALS.intValue(props);
  }

  /**
   * Checks every law of a pair of operations.
   *
   * @throws LawViolationException if a law does not hold for some value
   */
  public void check(SynthesizedOp mapOp, SynthesizedOp traverseOp) {
    final Ops ops = new Ops(mapOp, traverseOp);
    for (SynthesizedOp op : ImmutableList.of(mapOp, traverseOp)) {
      for (LawObligation obligation : op.laws) {
        check(ops, obligation);
      }
    }
  }

  private void check(Ops ops, LawObligation obligation) {
    final DataType decl = ops.mapOp.dataType;
    final Supplier<Object> element = () -> random.nextInt(100);
    int valueCount = 0;
    for (String tyConName : obligation.cases) {
      final DataType.TyCon tyCon = requireNonNull(decl.tyCon(tyConName));
      for (int i = 0; i < trials; i++) {
        final Object x;
        try {
          x = valueGenerator.generate(decl, tyCon, element);
        } catch (NoGeneratorException e) {
          tracer.onLaw(LawResult.notChecked(obligation, e.getMessage()));
          return;
        }
        check(ops, obligation, decl, tyCon, x);
        ++valueCount;
      }
    }
    tracer.onLaw(LawResult.holds(obligation, valueCount));
  }

  private void check(Ops ops, LawObligation obligation, DataType decl,
      DataType.TyCon tyCon, Object x) {
    final Function<Object, Object> f = a -> "s" + a;
    final Function<Object, Object> g = b -> ((String) b).length();
    switch (obligation.law) {
      case MAP_IDENTITY:
        verify(obligation, decl, tyCon, x, ops.map(a -> a, x), x);
        return;

      case MAP_COMPOSITION:
        verify(obligation, decl, tyCon, x, ops.map(f.andThen(g), x),
            ops.map(g, ops.map(f, x)));
        return;

      case TRAVERSE_IDENTITY:
        for (Applicative applicative : IDENTITY_APPLICATIVES) {
          verify(obligation, decl, tyCon, x,
              ops.traverse(applicative, applicative::pure, x),
              applicative.pure(x));
        }
        return;

      case TRAVERSE_COMPOSITION:
        // F = logging, G = option
        final Function<Object, Object> logF =
            a -> Logged.of((Integer) a + 1, "f " + a);
        final Function<Object, Object> optionG =
            b -> (Integer) b % 5 == 0
                ? Optional.empty()
                : Optional.of("g" + b);
        final Applicative compose =
            Applicatives.compose(Applicatives.LOGGING, Applicatives.OPTION);
        verify(obligation, decl, tyCon, x,
            ops.traverse(compose,
                a -> Applicatives.LOGGING.map(optionG, logF.apply(a)), x),
            Applicatives.LOGGING.map(
                t -> ops.traverse(Applicatives.OPTION, optionG, t),
                ops.traverse(Applicatives.LOGGING, logF, x)));
        return;

      case TRAVERSE_NATURALITY:
        final Function<Object, Object> log =
            a -> Logged.of("s" + a, "visit " + a);
        verify(obligation, decl, tyCon, x,
            Applicatives.dropLog(ops.traverse(Applicatives.LOGGING, log, x)),
            ops.traverse(Applicatives.IDENTITY,
                log.andThen(Applicatives::dropLog), x));
        return;

      case TRAVERSE_MAP_COHERENCE:
        verify(obligation, decl, tyCon, x,
            ops.traverse(Applicatives.IDENTITY, f.andThen(Identity::new), x),
            new Identity(ops.map(f, x)));
        return;

      default:
        throw new AssertionError(obligation.law);
    }
  }

  private static void verify(LawObligation obligation, DataType decl,
      DataType.TyCon tyCon, Object x, Object left, Object right) {
    if (!Objects.equals(left, right)) {
      throw new LawViolationException("law " + obligation.law + " ("
          + obligation.statement() + ") does not hold for " + x + ": "
          + left + " <> " + right, decl.pos(tyCon));
    }
  }

  /** Evaluated operations. */
  private class Ops {
    final SynthesizedOp mapOp;
    final SynthesizedOp traverseOp;
    final Object map;

    Ops(SynthesizedOp mapOp, SynthesizedOp traverseOp) {
      this.mapOp = mapOp;
      this.traverseOp = traverseOp;
      this.map = interpreter.eval(EvalEnvs.empty(), mapOp.body);
    }

    Object map(Function<Object, Object> f, Object x) {
      return fn(fn(map).apply(f)).apply(x);
    }

    Object traverse(Applicative applicative, Function<Object, Object> f,
        Object x) {
      final Object traverse =
          interpreter.eval(EvalEnvs.withApplicative(applicative),
              traverseOp.body);
      return fn(fn(traverse).apply(f)).apply(x);
    }
  }
}

// End LawChecker.java
