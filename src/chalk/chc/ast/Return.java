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

public class Return extends Statement {
  /** null for a bare return */
  private final Expression value;

  public Return(Expression value, Integer line) {
    super(line);
    this.value = value;
  }

  public Expression value() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  @Override
  public <R, E extends Exception> R accept(StatementVisitor<R, E> visitor)
      throws E {
    return visitor.visitReturn(this);
  }

  @Override
  public String toString() {
    return hasValue() ? "return " + value : "return";
  }
}
