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

import org.apache.log4j.Logger;

import chalk.chc.ast.Assign;
import chalk.chc.ast.ExprStmt;
import chalk.chc.ast.Expression;
import chalk.chc.ast.FuncDef;
import chalk.chc.ast.FuncDef.Param;
import chalk.chc.ast.If;
import chalk.chc.ast.Node;
import chalk.chc.ast.Print;
import chalk.chc.ast.Program;
import chalk.chc.ast.Return;
import chalk.chc.ast.Statement;
import chalk.chc.ast.StatementVisitor;
import chalk.chc.ast.VarDecl;
import chalk.chc.ast.While;
import chalk.chc.common.exceptions.SemanticError;
import chalk.chc.common.lang.Type;

/**
 * Walks the program checking name binding, mutability and types.
 * Analysis stops at the first violation, which is thrown as a
 * SemanticError.  On success every expression in the program carries
 * its inferred type, which the code generator relies on.
 *
 * Create one analyzer per compilation.
 */
public class SemanticAnalyzer implements StatementVisitor<Void, SemanticError> {

  private final Logger logger;
  private final AnalysisOptions options;

  private ScopeStack scopes;
  private TypeChecker typeChecker;

  /** Function whose body is being analyzed, null at top level */
  private FunctionSymbol currentFunction;

  public SemanticAnalyzer(Logger logger, AnalysisOptions options) {
    this.logger = logger;
    this.options = options;
  }

  /**
   * Check a whole program, starting from an empty global scope
   * @throws SemanticError at the first violation found
   */
  public void analyze(Program program) throws SemanticError {
    logger.debug("Semantic analysis: " + program.statements().size() +
                 " top-level statements, options: " + options);
    scopes = new ScopeStack();
    typeChecker = new TypeChecker(scopes);
    currentFunction = null;

    for (Statement stmt: program.statements()) {
      stmt.accept(this);
    }
    logger.debug("Semantic analysis done");
  }

  private void analyzeBlock(List<Statement> block) throws SemanticError {
    scopes.pushScope();
    try {
      for (Statement stmt: block) {
        stmt.accept(this);
      }
    } finally {
      scopes.popScope();
    }
  }

  @Override
  public Void visitVarDecl(VarDecl decl) throws SemanticError {
    Type valueType = typeChecker.findExprType(decl.value());
    if (valueType != decl.type()) {
      throw SemanticError.at(decl, "type mismatch: '" + decl.name() +
          "' is '" + decl.type() + "' but got '" + valueType + "'");
    }
    define(decl, decl.name(),
           new VariableSymbol(decl.name(), decl.type(), decl.isMutable()));
    return null;
  }

  @Override
  public Void visitAssign(Assign assign) throws SemanticError {
    String name = assign.target();
    VariableSymbol var = typeChecker.lookupVariable(assign, name);
    if (!var.isMutable()) {
      throw SemanticError.at(assign, "cannot assign to immutable variable '"
          + name + "'\nhint: declare it as 'mut " + name + ": " +
          var.type() + " = ...'");
    }
    Type valueType = typeChecker.findExprType(assign.value());
    if (valueType != var.type()) {
      throw SemanticError.at(assign, "type mismatch in assignment to '" +
          name + "': expected '" + var.type() + "', got '" + valueType + "'");
    }
    return null;
  }

  @Override
  public Void visitIf(If stmt) throws SemanticError {
    checkCondition(stmt, "if", stmt.condition());
    analyzeBlock(stmt.thenBlock());
    if (stmt.hasElse()) {
      analyzeBlock(stmt.elseBlock());
    }
    return null;
  }

  @Override
  public Void visitWhile(While loop) throws SemanticError {
    checkCondition(loop, "while", loop.condition());
    analyzeBlock(loop.body());
    return null;
  }

  private void checkCondition(Node stmt, String keyword,
                              Expression condition) throws SemanticError {
    Type condType = typeChecker.findExprType(condition);
    if (options.strictConditions && condType != Type.BOOL) {
      throw SemanticError.at(stmt, "condition of '" + keyword +
                     "' must be 'bool', got '" + condType + "'");
    }
  }

  @Override
  public Void visitFuncDef(FuncDef def) throws SemanticError {
    FunctionSymbol function = new FunctionSymbol(def.name(), def.params(),
                                                 def.returnType());
    // Defined before the body so the function can call itself
    define(def, def.name(), function);
    LogHelper.debug(scopes.depth() * 2, def, "function " + function);

    scopes.pushScope();
    try {
      for (Param param: def.params()) {
        define(def, param.name(),
               new VariableSymbol(param.name(), param.type(), false));
      }
      FunctionSymbol enclosing = currentFunction;
      currentFunction = function;
      try {
        for (Statement stmt: def.body()) {
          stmt.accept(this);
        }
      } finally {
        currentFunction = enclosing;
      }
    } finally {
      scopes.popScope();
    }
    return null;
  }

  @Override
  public Void visitReturn(Return ret) throws SemanticError {
    if (currentFunction == null) {
      throw SemanticError.at(ret, "'return' used outside of a function");
    }
    Type expected = currentFunction.returnType();
    if (ret.hasValue()) {
      Type actual = typeChecker.findExprType(ret.value());
      if (actual != expected) {
        throw returnMismatch(ret, expected, actual);
      }
    } else if (options.strictReturns && expected != Type.VOID) {
      throw returnMismatch(ret, expected, Type.VOID);
    }
    return null;
  }

  private SemanticError returnMismatch(Return ret, Type expected,
                                       Type actual) {
    return SemanticError.at(ret, "return type mismatch in '" +
        currentFunction.name() + "': expected '" + expected +
        "', got '" + actual + "'");
  }

  @Override
  public Void visitPrint(Print print) throws SemanticError {
    for (Expression value: print.values()) {
      typeChecker.findExprType(value);
    }
    return null;
  }

  @Override
  public Void visitExprStmt(ExprStmt stmt) throws SemanticError {
    typeChecker.findExprType(stmt.value());
    return null;
  }

  private void define(Node node, String name, Symbol symbol)
      throws SemanticError {
    if (scopes.isDefinedInCurrentScope(name)) {
      if (options.rejectRedefinition) {
        throw SemanticError.at(node, "'" + name +
                               "' is already defined in this scope");
      }
      LogHelper.debug(scopes.depth() * 2, node, "redefinition of '" +
                      name + "' replaces earlier definition");
    }
    scopes.define(name, symbol);
    LogHelper.trace(scopes.depth() * 2, node, "define " + symbol);
  }
}
