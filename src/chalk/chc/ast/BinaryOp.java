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

import chalk.chc.common.lang.Operators.BinaryOperator;

/**
 * Binary operation.  Chains of operators of the same precedence are
 * nested to the left: a - b - c is ((a - b) - c).
 */
public class BinaryOp extends Expression {
  private final Expression left;
  private final BinaryOperator op;
  private final Expression right;

  public BinaryOp(Expression left, BinaryOperator op, Expression right,
                  Integer line) {
    super(line);
    this.left = left;
    this.op = op;
    this.right = right;
  }

  public Expression left() {
    return left;
  }

  public BinaryOperator op() {
    return op;
  }

  public Expression right() {
    return right;
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor)
      throws E {
    return visitor.visitBinary(this);
  }

  @Override
  public String toString() {
    return "(" + left + " " + op + " " + right + ")";
  }
}
