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
import com.google.common.collect.ImmutableMap;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.type.DataType;

/**
 * State of a derivation request, threaded through the synthesizers.
 *
 * <p>A context is immutable, except for its {@link NameGenerator}, which is
 * shared by all contexts of the same request.
 */
public class Context {
  public final DataType decl;
  public final Environment env;
  public final NameGenerator nameGen;
  public final Tracer tracer;
  public final CapabilityKind kind;
  /** Classifications of the fields of each type constructor, keyed by
   * constructor name. */
  public final ImmutableMap<String, ImmutableList<Classification>>
      classifications;

  private Context(DataType decl, Environment env, NameGenerator nameGen,
      Tracer tracer, CapabilityKind kind,
      ImmutableMap<String, ImmutableList<Classification>> classifications) {
    this.decl = requireNonNull(decl);
    this.env = requireNonNull(env);
    this.nameGen = requireNonNull(nameGen);
    this.tracer = requireNonNull(tracer);
    this.kind = requireNonNull(kind);
    this.classifications = requireNonNull(classifications);
  }

  /** Creates a context for a new request, and classifies every field of the
   * declaration. */
  public static Context of(DataType decl, Environment env, Tracer tracer) {
    final Context context =
        new Context(decl, env, new NameGenerator(), tracer,
            CapabilityKind.MAP, ImmutableMap.of());
    return context.withClassifications(new Classifier(context).classifyAll());
  }

  private Context withClassifications(
      ImmutableMap<String, ImmutableList<Classification>> classifications) {
    return new Context(decl, env, nameGen, tracer, kind, classifications);
  }

  /** Returns a context for synthesizing an operation of a given kind. */
  public Context withKind(CapabilityKind kind) {
    return kind == this.kind
        ? this
        : new Context(decl, env, nameGen, tracer, kind, classifications);
  }

  /** Returns the classifications of the fields of a constructor. */
  public ImmutableList<Classification> classifications(DataType.TyCon tyCon) {
    return requireNonNull(classifications.get(tyCon.name), tyCon.name);
  }

  /** Returns the position of a field of a constructor. */
  public Pos pos(DataType.TyCon tyCon, int field) {
    return decl.pos(tyCon).field(field);
  }
}

// End Context.java
