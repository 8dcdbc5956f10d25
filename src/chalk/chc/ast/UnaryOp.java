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

import chalk.chc.common.lang.Operators.UnaryOperator;

public class UnaryOp extends Expression {
  private final UnaryOperator op;
  private final Expression operand;

  public UnaryOp(UnaryOperator op, Expression operand, Integer line) {
    super(line);
    this.op = op;
    this.operand = operand;
  }

  public UnaryOperator op() {
    return op;
  }

  public Expression operand() {
    return operand;
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor)
      throws E {
    return visitor.visitUnary(this);
  }

  @Override
  public String toString() {
    return "(" + op + operand + ")";
  }
}
