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

/**
 * Visitor over all expression kinds.  Adding a new kind of expression
 * means adding a method here, so every pass must handle it.
 * @param <R> result of visiting an expression
 * @param <E> checked exception the visitor may throw
 */
public interface ExprVisitor<R, E extends Exception> {
  R visitNumber(NumberLiteral expr) throws E;
  R visitString(StringLiteral expr) throws E;
  R visitBool(BoolLiteral expr) throws E;
  R visitVariable(VariableRef expr) throws E;
  R visitUnary(UnaryOp expr) throws E;
  R visitBinary(BinaryOp expr) throws E;
  R visitCall(Call expr) throws E;
}
