/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package chalk.chc.ast;

import chalk.chc.common.lang.Type;

/**
 * An expression produces a value of some type.  The semantic analyzer
 * records the type it inferred on each expression so that later passes
 * don't need to recalculate it.
 */
public abstract class Expression extends Node {

  private Type exprType = null;

  protected Expression(Integer line) {
    super(line);
  }

  /**
   * @return type inferred during semantic analysis, null if the
   *         expression has not been analyzed
   */
  public Type getExprType() {
    return exprType;
  }

  public void setExprType(Type exprType) {
    this.exprType = exprType;
  }

  public abstract <R, E extends Exception> R accept(ExprVisitor<R, E> visitor)
      throws E;
}
