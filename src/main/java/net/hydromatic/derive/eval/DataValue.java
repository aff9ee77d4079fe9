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
import java.util.List;
import java.util.Objects;

/**
 * Value of an algebraic datatype: a type constructor applied to the values of
 * its fields.
 */
public class DataValue {
  public final String typeName;
  public final String tyCon;
  public final ImmutableList<Object> args;

  public DataValue(String typeName, String tyCon, List<?> args) {
    this.typeName = requireNonNull(typeName);
    this.tyCon = requireNonNull(tyCon);
    this.args = ImmutableList.copyOf(args);
  }

  /** Creates a value. */
  public static DataValue of(String typeName, String tyCon, Object... args) {
    return new DataValue(typeName, tyCon, ImmutableList.copyOf(args));
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeName, tyCon, args);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DataValue
            && typeName.equals(((DataValue) o).typeName)
            && tyCon.equals(((DataValue) o).tyCon)
            && args.equals(((DataValue) o).args);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append(typeName).append('.').append(tyCon);
    if (!args.isEmpty()) {
      b.append(" (");
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(args.get(i));
      }
      b.append(')');
    }
    return b.toString();
  }
}

// End DataValue.java
