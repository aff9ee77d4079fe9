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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.compile.DeriveException;
import net.hydromatic.derive.compile.Environment;
import net.hydromatic.derive.type.ApplyType;
import net.hydromatic.derive.type.DataType;
import net.hydromatic.derive.type.PrimitiveType;
import net.hydromatic.derive.type.Type;
import net.hydromatic.derive.type.TypeSystem;
import net.hydromatic.derive.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates random values of datatypes and field types.
 *
 * <p>Values of the type variable come from a supplier, so that the caller
 * controls the elements that a structure contains. Values of declared
 * datatypes are built by choosing a constructor at random.
 *
 * <p>A type that has no declaration gets its values from its capability, if
 * the capability can generate them. Otherwise, if the type contains no type
 * variable, its values are {@link Opaque}; if it does contain a type
 * variable, generation fails with {@link NoGeneratorException}.
 */
public class ValueGenerator {
  /** Depth of nested declared datatypes beyond which the smallest value of
   * each type is generated. */
  private static final int MAX_DEPTH = 8;

  private static final Comparator<DataType.TyCon> BY_ARITY =
      Comparator.comparingInt(DataType.TyCon::arity);

  private final Environment env;
  private final Random random;
  private final int maxLength;
  private int opaqueCount = 0;

  public ValueGenerator(Environment env, Random random, int maxLength) {
    this.env = requireNonNull(env);
    this.random = requireNonNull(random);
    this.maxLength = maxLength;
  }

  /** Generates a value of a given constructor of a datatype. */
  public DataValue generate(DataType dataType, DataType.TyCon tyCon,
      Supplier<Object> element) {
    return generate(dataType, tyCon, element, 0);
  }

  /** Generates a value of a type. */
  public Object generate(Type type, Supplier<Object> element) {
    return generate(type, element, 0);
  }

  private DataValue generate(DataType dataType, DataType.TyCon tyCon,
      Supplier<Object> element, int depth) {
    final ImmutableList.Builder<Object> args = ImmutableList.builder();
    for (Type field : tyCon.fields) {
      args.add(generate(field, element, depth));
    }
    return new DataValue(dataType.name, tyCon.name, args.build());
  }

  private Object generate(Type type, Supplier<Object> element, int depth) {
    if (type instanceof TypeVar) {
      return element.get();
    }
    if (type instanceof PrimitiveType) {
      return generate((PrimitiveType) type);
    }
    final ApplyType applyType = (ApplyType) type;
    switch (applyType.name) {
      case TypeSystem.LIST:
        final int length = random.nextInt(maxLength + 1);
        final ImmutableList.Builder<Object> list = ImmutableList.builder();
        for (int i = 0; i < length; i++) {
          list.add(generate(applyType.last(), element, depth));
        }
        return list.build();

      case TypeSystem.OPTION:
        return random.nextInt(4) == 0
            ? Optional.empty()
            : Optional.of(generate(applyType.last(), element, depth));

      case TypeSystem.EITHER:
        return random.nextBoolean()
            ? Either.left(generate(applyType.args.get(0), element, depth))
            : Either.right(generate(applyType.last(), element, depth));

      default:
        final DataType dataType = env.lookupDeclOpt(applyType.name);
        if (dataType == null) {
          return generateUndeclared(applyType,
              applyType.args.isEmpty()
                  ? element
                  : () -> generate(applyType.last(), element, depth));
        }
        if (depth >= MAX_DEPTH || dataType.tyCons.isEmpty()) {
          return minimal(applyType, element, ImmutableSet.of());
        }
        final DataType.TyCon tyCon =
            dataType.tyCons.get(random.nextInt(dataType.tyCons.size()));
        // Elements of the inner datatype are values of our last argument.
        final Supplier<Object> innerElement =
            applyType.args.isEmpty()
                ? element
                : () -> generate(applyType.last(), element, depth + 1);
        return generate(dataType, tyCon, innerElement, depth + 1);
    }
  }

  /**
   * Generates a value of the smallest depth of a type.
   *
   * @throws DeriveException if the type has no finite value
   */
  private Object minimal(Type type, Supplier<Object> element,
      Set<String> active) {
    final Object value = minimalOpt(type, element, active);
    if (value == null) {
      throw new DeriveException("type " + type.moniker()
          + " has no finite value", Pos.of(((ApplyType) type).name));
    }
    return value;
  }

  /**
   * Generates a value of the smallest depth of a type, or returns null if
   * every value of the type contains a value of a datatype in
   * {@code active}.
   *
   * <p>Lists are empty, options are empty, and each datatype uses its
   * constructor with the fewest fields that has a finite value.
   */
  private @Nullable Object minimalOpt(Type type, Supplier<Object> element,
      Set<String> active) {
    if (type instanceof TypeVar) {
      return element.get();
    }
    if (type instanceof PrimitiveType) {
      return generate((PrimitiveType) type);
    }
    final ApplyType applyType = (ApplyType) type;
    switch (applyType.name) {
      case TypeSystem.LIST:
        return ImmutableList.of();

      case TypeSystem.OPTION:
        return Optional.empty();

      case TypeSystem.EITHER:
        final Object left = minimalOpt(applyType.args.get(0), element, active);
        if (left != null) {
          return Either.left(left);
        }
        final Object right = minimalOpt(applyType.last(), element, active);
        return right == null ? null : Either.right(right);

      default:
        final DataType dataType = env.lookupDeclOpt(applyType.name);
        if (dataType == null) {
          return generateUndeclared(applyType,
              applyType.args.isEmpty()
                  ? element
                  : () -> minimal(applyType.last(), element, active));
        }
        if (active.contains(dataType.name)) {
          return null;
        }
        final Set<String> active2 =
            ImmutableSet.<String>builder().addAll(active)
                .add(dataType.name).build();
        for (DataType.TyCon tyCon
            : ImmutableList.sortedCopyOf(BY_ARITY, dataType.tyCons)) {
          final ImmutableList.Builder<Object> args = ImmutableList.builder();
          boolean finite = true;
          for (Type field : tyCon.fields) {
            final Type field2 =
                applyType.args.isEmpty()
                    ? field
                    : field.substitute(dataType.typeVar, applyType.last());
            final Object arg = minimalOpt(field2, element, active2);
            if (arg == null) {
              finite = false;
              break;
            }
            args.add(arg);
          }
          if (finite) {
            return new DataValue(dataType.name, tyCon.name, args.build());
          }
        }
        return null;
    }
  }

  /** Generates a value of a type that has no declaration. */
  private Object generateUndeclared(ApplyType applyType,
      Supplier<Object> element) {
    final Capability capability = env.lookupCapability(applyType.name);
    if (capability != null) {
      final Object value = capability.generate(random, element);
      if (value != null) {
        return value;
      }
    }
    if (isGround(applyType)) {
      return new Opaque(applyType.moniker(), opaqueCount++);
    }
    throw new NoGeneratorException("type " + applyType.moniker()
        + " has no value generator");
  }

  /** Returns whether a type contains no type variable. */
  private static boolean isGround(Type type) {
    if (type instanceof TypeVar) {
      return false;
    }
    if (type instanceof ApplyType) {
      for (Type arg : ((ApplyType) type).args) {
        if (!isGround(arg)) {
          return false;
        }
      }
    }
    return true;
  }

  private Object generate(PrimitiveType type) {
    switch (type) {
      case BOOL:
        return random.nextBoolean();
      case INT:
        return random.nextInt(200) - 100;
      case NAT:
        return random.nextInt(100);
      case STRING:
        return "s" + random.nextInt(10);
      case UNIT:
        return Unit.INSTANCE;
      default:
        throw new AssertionError(type);
    }
  }
}

// End ValueGenerator.java
