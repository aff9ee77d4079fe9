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

import java.util.Objects;

/**
 * Value of a type that has neither a declaration nor a way to generate
 * values.
 *
 * <p>Only fields that contain no occurrence of the type variable hold
 * opaque values, and structural operations carry such fields unchanged, so
 * equality is all that an opaque value needs.
 */
public class Opaque {
  public final String moniker;
  public final int ordinal;

  public Opaque(String moniker, int ordinal) {
    this.moniker = requireNonNull(moniker);
    this.ordinal = ordinal;
  }

  @Override
  public int hashCode() {
    return Objects.hash(moniker, ordinal);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Opaque
            && moniker.equals(((Opaque) o).moniker)
            && ordinal == ((Opaque) o).ordinal;
  }

  @Override
  public String toString() {
    return "<" + moniker + " #" + ordinal + ">";
  }
}

// End Opaque.java
