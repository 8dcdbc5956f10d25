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
package chalk.chc.frontend;

import java.util.List;

import chalk.chc.ast.BinaryOp;
import chalk.chc.ast.BoolLiteral;
import chalk.chc.ast.Call;
import chalk.chc.ast.ExprVisitor;
import chalk.chc.ast.Expression;
import chalk.chc.ast.FuncDef.Param;
import chalk.chc.ast.Node;
import chalk.chc.ast.NumberLiteral;
import chalk.chc.ast.StringLiteral;
import chalk.chc.ast.UnaryOp;
import chalk.chc.ast.VariableRef;
import chalk.chc.common.exceptions.SemanticError;
import chalk.chc.common.lang.Type;

/**
 * This module handles checking the internal consistency of expressions,
 * and inferring the types of expressions.  Every expression it visits
 * is annotated with its type.
 */
public class TypeChecker implements ExprVisitor<Type, SemanticError> {

  private final ScopeStack scopes;

  public TypeChecker(ScopeStack scopes) {
    this.scopes = scopes;
  }

  /**
   * Determine the expression type and record it on the node
   * @return the type of the expression
   * @throws SemanticError if the expression is not well typed
   */
  public Type findExprType(Expression expr) throws SemanticError {
    Type type = expr.accept(this);
    expr.setExprType(type);
    LogHelper.trace(scopes.depth() * 2, expr,
                    "Expr " + expr + " has type " + type);
    return type;
  }

  @Override
  public Type visitNumber(NumberLiteral expr) {
    return expr.isFloat() ? Type.FLOAT : Type.INT;
  }

  @Override
  public Type visitString(StringLiteral expr) {
    return Type.STRING;
  }

  @Override
  public Type visitBool(BoolLiteral expr) {
    return Type.BOOL;
  }

  @Override
  public Type visitVariable(VariableRef expr) throws SemanticError {
    return lookupVariable(expr, expr.name()).type();
  }

  @Override
  public Type visitUnary(UnaryOp expr) throws SemanticError {
    Type operand = findExprType(expr.operand());
    if (!operand.isNumeric()) {
      throw SemanticError.at(expr, "unary '" + expr.op().symbol() +
                  "' requires int or float, got '" + operand + "'");
    }
    return operand;
  }

  @Override
  public Type visitBinary(BinaryOp expr) throws SemanticError {
    Type left = findExprType(expr.left());
    Type right = findExprType(expr.right());
    if (expr.op().isComparison()) {
      if (left != right) {
        throw SemanticError.at(expr, "cannot compare '" + left +
                               "' and '" + right + "'");
      }
      return Type.BOOL;
    } else {
      if (left != right) {
        throw SemanticError.at(expr, "type mismatch: cannot apply '" +
            expr.op().symbol() + "' to '" + left + "' and '" + right + "'");
      }
      return left;
    }
  }

  @Override
  public Type visitCall(Call expr) throws SemanticError {
    String name = expr.function();
    Symbol sym = scopes.lookup(name);
    if (sym == null) {
      throw SemanticError.at(expr, "undefined function '" + name + "'");
    }
    if (sym.kind() != Symbol.DefKind.FUNCTION) {
      throw SemanticError.at(expr, "'" + name +
                             "' is a variable, not a function");
    }
    FunctionSymbol function = (FunctionSymbol)sym;

    List<Param> params = function.params();
    List<Expression> args = expr.args();
    if (params.size() != args.size()) {
      throw SemanticError.at(expr, "'" + name + "' expects " +
          params.size() + " argument(s), got " + args.size());
    }
    for (int i = 0; i < args.size(); i++) {
      Type expected = params.get(i).type();
      Type actual = findExprType(args.get(i));
      if (actual != expected) {
        throw SemanticError.at(expr, "argument " + (i + 1) + " of '" +
            name + "': expected '" + expected + "', got '" + actual + "'");
      }
    }
    return function.returnType();
  }

  /**
   * Resolve a name that must refer to a variable
   */
  VariableSymbol lookupVariable(Node node, String name)
      throws SemanticError {
    Symbol sym = scopes.lookup(name);
    if (sym == null) {
      throw SemanticError.at(node, "undefined variable '" + name + "'");
    }
    if (sym.kind() != Symbol.DefKind.VARIABLE) {
      throw SemanticError.at(node, "'" + name +
                             "' is a function, not a variable");
    }
    return (VariableSymbol)sym;
  }
}
