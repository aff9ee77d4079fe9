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
import net.hydromatic.derive.type.ApplyType;
import net.hydromatic.derive.type.DataType;
import net.hydromatic.derive.type.Type;
import net.hydromatic.derive.type.TypeVar;

/**
 * Classifies the fields of a datatype according to where the type variable
 * occurs.
 *
 * <p>Classification is a total, deterministic function of the field type and
 * the type variable. Each recursive call classifies the last argument of a
 * type application, which is strictly smaller, so classification
 * terminates.
 */
public class Classifier {
  private final Context context;

  Classifier(Context context) {
    this.context = requireNonNull(context);
  }

  /**
   * Classifies every field of every constructor of the declaration.
   *
   * @throws ClassificationException if the type variable occurs in a
   *   position other than the last argument of a type application
   * @throws RecursionException if a field refers to the datatype being
   *   derived, directly or nested inside another type
   */
  ImmutableMap<String, ImmutableList<Classification>> classifyAll() {
    final DataType decl = context.decl;
    final ImmutableMap.Builder<String, ImmutableList<Classification>> b =
        ImmutableMap.builder();
    for (DataType.TyCon tyCon : decl.tyCons) {
      final ImmutableList.Builder<Classification> list =
          ImmutableList.builder();
      for (int i = 0; i < tyCon.fields.size(); i++) {
        final Type field = tyCon.fields.get(i);
        final Pos pos = context.pos(tyCon, i);
        final Classification classification = classify(field, pos);
        context.tracer.onClassify(pos, field, classification);
        if (classification.isRecursive()) {
          throw new RecursionException("recursive field not supported: "
              + field.moniker() + " refers to " + decl.name, pos);
        }
        list.add(classification);
      }
      b.put(tyCon.name, list.build());
    }
    return b.build();
  }

  /** Classifies a field. */
  public Classification classify(Type field, Pos pos) {
    final TypeVar typeVar = context.decl.typeVar;
    if (field.equals(typeVar)) {
      return Classification.EXACT;
    }
    if (!field.contains(typeVar)) {
      return Classification.ABSENT;
    }
    final ApplyType applyType = (ApplyType) field;
    if (applyType.name.equals(context.decl.name)) {
      return Classification.RECURSIVE;
    }
    for (Type arg : applyType.init()) {
      if (arg.contains(typeVar)) {
        throw new ClassificationException("not a structurally-transformable "
            + "position: " + typeVar + " occurs in " + arg.moniker()
            + " of field " + pos + " of type " + field.moniker(), pos);
      }
    }
    return Classification.nested(applyType,
        classify(applyType.last(), pos));
  }
}

// End Classifier.java
