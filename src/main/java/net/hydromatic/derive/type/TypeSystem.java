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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A collection of types.
 *
 * <p>Creates type expressions, and holds the datatype declarations that have
 * been declared so far, keyed by name.
 */
public class TypeSystem {
  /** Name of the built-in list type constructor. */
  public static final String LIST = "List";

  /** Name of the built-in option type constructor. */
  public static final String OPTION = "Option";

  /** Name of the built-in sum type constructor. */
  public static final String EITHER = "Either";

  private final Map<String, DataType> dataTypeByName = new LinkedHashMap<>();

  /** Creates a type variable. */
  public TypeVar typeVariable(int ordinal) {
    return new TypeVar(ordinal);
  }

  /** Creates a type that applies a named type constructor to arguments. */
  public ApplyType apply(String name, Type... args) {
    return apply(name, Arrays.asList(args));
  }

  /** Creates a type that applies a named type constructor to arguments. */
  public ApplyType apply(String name, List<? extends Type> args) {
    return new ApplyType(name, ImmutableList.copyOf(args));
  }

  /** Creates a list type, e.g. {@code List 'a}. */
  public ApplyType listType(Type elementType) {
    return apply(LIST, elementType);
  }

  /** Creates an option type, e.g. {@code Option 'a}. */
  public ApplyType option(Type type) {
    return apply(OPTION, type);
  }

  /** Creates a sum type, e.g. {@code Either String 'a}. */
  public ApplyType either(Type leftType, Type rightType) {
    return apply(EITHER, leftType, rightType);
  }

  /** Creates a type constructor. */
  public DataType.TyCon tyCon(String name, Type... fields) {
    return new DataType.TyCon(name, Arrays.asList(fields));
  }

  /** Creates a datatype, and registers it in this type system. */
  public DataType dataType(String name, TypeVar typeVar,
      DataType.TyCon... tyCons) {
    return dataType(name, typeVar, Arrays.asList(tyCons));
  }

  /** Creates a datatype, and registers it in this type system. */
  public DataType dataType(String name, TypeVar typeVar,
      List<DataType.TyCon> tyCons) {
    checkArgument(!dataTypeByName.containsKey(name),
        "datatype %s is already declared", name);
    checkArgument(PrimitiveType.lookup(name) == null,
        "datatype %s clashes with a primitive type", name);
    final DataType dataType = new DataType(name, typeVar, tyCons);
    dataTypeByName.put(name, dataType);
    return dataType;
  }

  /** Looks up a datatype by name; returns null if not found. */
  public @Nullable DataType lookupOpt(String name) {
    return dataTypeByName.get(name);
  }

  /** Returns the names of all declared datatypes, in declaration order. */
  public List<String> dataTypeNames() {
    return ImmutableList.copyOf(dataTypeByName.keySet());
  }
}

// End TypeSystem.java
