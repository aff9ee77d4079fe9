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
import java.util.List;

/**
 * Obligation that an operation satisfy a law.
 *
 * <p>The obligation is split into one case per constructor of the datatype;
 * {@link LawChecker} checks each case against randomly generated values.
 */
public class LawObligation {
  public final Law law;
  public final String opName;
  /** Names of the constructors, one per case. */
  public final ImmutableList<String> cases;

  LawObligation(Law law, String opName, List<String> cases) {
    this.law = requireNonNull(law);
    this.opName = requireNonNull(opName);
    this.cases = ImmutableList.copyOf(cases);
  }

  /** Returns the statement of the law for this operation, e.g.
   * "Pair.map id x = x". */
  public String statement() {
    final String prefix = law.kind.opName + " ";
    return law.statement.replace(prefix,
        opName.substring(0, opName.lastIndexOf('.') + 1) + prefix);
  }

  @Override
  public String toString() {
    return law + ": " + statement() + " " + cases;
  }
}

// End LawObligation.java
