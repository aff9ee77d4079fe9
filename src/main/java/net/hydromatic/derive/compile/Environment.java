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

import net.hydromatic.derive.eval.Capability;
import net.hydromatic.derive.type.DataType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only view of the declarations and capabilities of the host.
 *
 * <p>The engine only reads from an environment; it is safe to share an
 * environment between concurrent derivations of different types.
 *
 * @see Environments
 */
public interface Environment {
  /**
   * Returns the declaration of a datatype.
   *
   * @throws DeriveException if there is no datatype with that name
   */
  DataType lookupDecl(String name);

  /** Returns the declaration of a datatype, or null if there is none. */
  @Nullable DataType lookupDeclOpt(String name);

  /** Returns the capability of a type constructor, or null if it has none. */
  @Nullable Capability lookupCapability(String typeName);
}

// End Environment.java
