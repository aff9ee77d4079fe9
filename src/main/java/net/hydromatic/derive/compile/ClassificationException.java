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

import net.hydromatic.derive.ast.Pos;

/**
 * Thrown when the type variable occurs in a field in a position other than
 * the final argument of a chain of type applications, for example {@code
 * Either 'a Int}.
 */
public class ClassificationException extends DeriveException {
  public ClassificationException(String message, Pos pos) {
    super(message, pos);
  }
}

// End ClassificationException.java
