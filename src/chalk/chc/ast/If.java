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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * If statement.  A missing else clause is represented the same way as
 * an empty else block.
 */
public class If extends Statement {
  private final Expression condition;
  private final List<Statement> thenBlock;
  private final List<Statement> elseBlock;

  public If(Expression condition, List<? extends Statement> thenBlock,
            List<? extends Statement> elseBlock, Integer line) {
    super(line);
    this.condition = condition;
    this.thenBlock = ImmutableList.copyOf(thenBlock);
    this.elseBlock = ImmutableList.copyOf(elseBlock);
  }

  public Expression condition() {
    return condition;
  }

  public List<Statement> thenBlock() {
    return thenBlock;
  }

  /**
   * @return else statements, empty if there was no else
   */
  public List<Statement> elseBlock() {
    return elseBlock;
  }

  public boolean hasElse() {
    return !elseBlock.isEmpty();
  }

  @Override
  public <R, E extends Exception> R accept(StatementVisitor<R, E> visitor)
      throws E {
    return visitor.visitIf(this);
  }
}
