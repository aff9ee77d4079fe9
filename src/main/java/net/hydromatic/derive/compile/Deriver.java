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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.derive.eval.Prop;

/**
 * Derives the {@code map} and {@code traverse} operations of a datatype.
 *
 * <p>A derivation classifies every field, synthesizes both operations,
 * generates and discharges their unfolding equations, proves their laws,
 * and, if {@link Prop#CHECK_LAWS} is true, checks the laws against random
 * values. Any error aborts the whole derivation; there is never a partial
 * result.
 *
 * <p>A derivation reads from its {@link Environment} but does not modify
 * it; call {@link #install} to make the operations available to later
 * derivations.
 */
public class Deriver {
  private final Environment env;
  private final Tracer tracer;
  private final ImmutableMap<Prop, Object> props;

  public Deriver(Environment env, Tracer tracer, Map<Prop, Object> props) {
    this.env = requireNonNull(env);
    this.tracer = requireNonNull(tracer);
    this.props = ImmutableMap.copyOf(props);
  }

  /** Creates a Deriver with no tracer and default properties. */
  public static Deriver of(Environment env) {
    return new Deriver(env, Tracers.empty(), ImmutableMap.of());
  }

  /**
   * Derives the operations of a datatype.
   *
   * @param typeName Name of the datatype
   * @throws DeriveException if derivation fails
   */
  public Derivation derive(String typeName) {
    try {
      final Context context =
          Context.of(env.lookupDecl(typeName), env, tracer);
      final SynthesizedOp mapOp = derive(context, CapabilityKind.MAP);
      final SynthesizedOp traverseOp =
          derive(context, CapabilityKind.TRAVERSE);
      if (Prop.CHECK_LAWS.booleanValue(props)) {
        new LawChecker(env, tracer, props).check(mapOp, traverseOp);
      }
      return new Derivation(context.decl, mapOp, traverseOp);
    } catch (DeriveException e) {
      tracer.handleDeriveException(e);
      throw e;
    }
  }

  private static SynthesizedOp derive(Context context, CapabilityKind kind) {
    final Context context2 = context.withKind(kind);
    final SynthesizedOp op = new TypeSynthesizer(context2).synthesize();
    final SynthesizedOp op2 = new LemmaGenerator(context2).generate(op);
    return new LawProver(context2).prove(op2);
  }

  /** Derives the operations of a datatype and registers them. */
  public Derivation deriveAndInstall(String typeName,
      InstanceRegistry registry) {
    final Derivation derivation = derive(typeName);
    install(derivation, registry);
    return derivation;
  }

  /** Registers the operations of a derivation. */
  public static void install(Derivation derivation,
      InstanceRegistry registry) {
    final String typeName = derivation.dataType.name;
    registry.register(typeName, CapabilityKind.MAP, derivation.mapOp);
    registry.register(typeName, CapabilityKind.TRAVERSE,
        derivation.traverseOp);
  }
}

// End Deriver.java
