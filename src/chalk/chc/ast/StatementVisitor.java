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
 * Visitor over all statement kinds.
 * @param <R> result of visiting a statement
 * @param <E> checked exception the visitor may throw
 */
public interface StatementVisitor<R, E extends Exception> {
  R visitVarDecl(VarDecl stmt) throws E;
  R visitAssign(Assign stmt) throws E;
  R visitIf(If stmt) throws E;
  R visitWhile(While stmt) throws E;
  R visitFuncDef(FuncDef stmt) throws E;
  R visitReturn(Return stmt) throws E;
  R visitPrint(Print stmt) throws E;
  R visitExprStmt(ExprStmt stmt) throws E;
}
