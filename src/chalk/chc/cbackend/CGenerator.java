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
package chalk.chc.cbackend;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import chalk.chc.ast.Assign;
import chalk.chc.ast.BinaryOp;
import chalk.chc.ast.BoolLiteral;
import chalk.chc.ast.Call;
import chalk.chc.ast.ExprStmt;
import chalk.chc.ast.ExprVisitor;
import chalk.chc.ast.Expression;
import chalk.chc.ast.FuncDef;
import chalk.chc.ast.FuncDef.Param;
import chalk.chc.ast.If;
import chalk.chc.ast.NumberLiteral;
import chalk.chc.ast.Print;
import chalk.chc.ast.Program;
import chalk.chc.ast.Return;
import chalk.chc.ast.Statement;
import chalk.chc.ast.StatementVisitor;
import chalk.chc.ast.StringLiteral;
import chalk.chc.ast.UnaryOp;
import chalk.chc.ast.VarDecl;
import chalk.chc.ast.VariableRef;
import chalk.chc.ast.While;
import chalk.chc.cbackend.tree.Assignment;
import chalk.chc.cbackend.tree.BinaryExpr;
import chalk.chc.cbackend.tree.CExpr;
import chalk.chc.cbackend.tree.CString;
import chalk.chc.cbackend.tree.CTree;
import chalk.chc.cbackend.tree.Declaration;
import chalk.chc.cbackend.tree.ExprStatement;
import chalk.chc.cbackend.tree.Function;
import chalk.chc.cbackend.tree.FunctionCall;
import chalk.chc.cbackend.tree.IfStatement;
import chalk.chc.cbackend.tree.Include;
import chalk.chc.cbackend.tree.ReturnStatement;
import chalk.chc.cbackend.tree.Sequence;
import chalk.chc.cbackend.tree.Text;
import chalk.chc.cbackend.tree.Token;
import chalk.chc.cbackend.tree.UnaryExpr;
import chalk.chc.cbackend.tree.WhileLoop;
import chalk.chc.common.exceptions.ChcRuntimeError;
import chalk.chc.common.lang.Type;

/**
 * Translate an analyzed program into a single C translation unit.
 *
 * Function definitions are emitted at file scope in source order.  All
 * other top-level statements are collected, in order, into main().
 * The program must already have passed semantic analysis: print format
 * placeholders are chosen from the expression types recorded by the
 * analyzer.
 */
public class CGenerator {

  public static final String ENTRY_FUNCTION = "main";

  private static final String[] HEADERS = { "stdio.h", "string.h" };

  private final Logger logger;

  private final StatementLowering statements = new StatementLowering();
  private final ExprLowering expressions = new ExprLowering();

  public CGenerator(Logger logger) {
    this.logger = logger;
  }

  /**
   * @return the complete C source text
   */
  public String generate(Program program) {
    Sequence file = new Sequence();
    for (String header: HEADERS) {
      file.add(new Include(header));
    }
    file.add(new Text(""));

    List<Statement> mainStatements = new ArrayList<Statement>();
    int functionCount = 0;
    for (Statement stmt: program.statements()) {
      if (stmt instanceof FuncDef) {
        file.add(stmt.accept(statements));
        file.add(new Text(""));
        functionCount++;
      } else {
        mainStatements.add(stmt);
      }
    }

    if (!mainStatements.isEmpty()) {
      Sequence body = lowerBlock(mainStatements);
      body.add(new ReturnStatement(new Token(0)));
      file.add(new Function(Type.INT.cType(), ENTRY_FUNCTION,
                            new ArrayList<String>(), body));
    }
    logger.debug("Generated " + functionCount + " functions, " +
                 mainStatements.size() + " statements in " +
                 ENTRY_FUNCTION);
    return file.toString();
  }

  private Sequence lowerBlock(List<Statement> block) {
    Sequence seq = new Sequence();
    for (Statement stmt: block) {
      seq.add(stmt.accept(statements));
    }
    return seq;
  }

  private CExpr lower(Expression expr) {
    return expr.accept(expressions);
  }

  /**
   * @param type type recorded by the analyzer, null if unknown
   * @return printf conversion for a value of that type
   */
  public static String formatPlaceholder(Type type) {
    if (type == null) {
      return "%d";
    }
    switch (type) {
      case STRING:
        return "%s";
      case FLOAT:
        return "%f";
      case INT:
      case BOOL:
      case VOID:
        return "%d";
      default:
        throw new ChcRuntimeError("Unknown type " + type);
    }
  }

  private class StatementLowering
      implements StatementVisitor<CTree, RuntimeException> {

    @Override
    public CTree visitVarDecl(VarDecl decl) {
      return new Declaration(!decl.isMutable(), decl.type().cType(),
                             decl.name(), lower(decl.value()));
    }

    @Override
    public CTree visitAssign(Assign assign) {
      return new Assignment(assign.target(), lower(assign.value()));
    }

    @Override
    public CTree visitIf(If stmt) {
      Sequence elseBlock = null;
      if (stmt.hasElse()) {
        elseBlock = lowerBlock(stmt.elseBlock());
      }
      return new IfStatement(lower(stmt.condition()),
                             lowerBlock(stmt.thenBlock()), elseBlock);
    }

    @Override
    public CTree visitWhile(While loop) {
      return new WhileLoop(lower(loop.condition()), lowerBlock(loop.body()));
    }

    @Override
    public CTree visitFuncDef(FuncDef def) {
      List<String> params = new ArrayList<String>(def.params().size());
      for (Param param: def.params()) {
        params.add(param.type().cType() + " " + param.name());
      }
      return new Function(def.returnType().cType(), def.name(), params,
                          lowerBlock(def.body()));
    }

    @Override
    public CTree visitReturn(Return ret) {
      if (ret.hasValue()) {
        return new ReturnStatement(lower(ret.value()));
      }
      return new ReturnStatement();
    }

    @Override
    public CTree visitPrint(Print print) {
      StringBuilder format = new StringBuilder();
      List<CExpr> args = new ArrayList<CExpr>();
      for (Expression value: print.values()) {
        format.append(formatPlaceholder(value.getExprType()));
      }
      format.append("\\n");
      args.add(new CString(format.toString()));
      for (Expression value: print.values()) {
        args.add(lower(value));
      }
      return new ExprStatement(new FunctionCall("printf", args));
    }

    @Override
    public CTree visitExprStmt(ExprStmt stmt) {
      return new ExprStatement(lower(stmt.value()));
    }
  }

  private class ExprLowering implements ExprVisitor<CExpr, RuntimeException> {

    @Override
    public CExpr visitNumber(NumberLiteral expr) {
      return new Token(expr.text());
    }

    @Override
    public CExpr visitString(StringLiteral expr) {
      // Escape sequences are written the same way in Chalk and C
      return new CString(expr.value());
    }

    @Override
    public CExpr visitBool(BoolLiteral expr) {
      return new Token(expr.value() ? 1 : 0);
    }

    @Override
    public CExpr visitVariable(VariableRef expr) {
      return new Token(expr.name());
    }

    @Override
    public CExpr visitUnary(UnaryOp expr) {
      return new UnaryExpr(expr.op().symbol(), lower(expr.operand()));
    }

    @Override
    public CExpr visitBinary(BinaryOp expr) {
      return new BinaryExpr(lower(expr.left()), expr.op().symbol(),
                            lower(expr.right()));
    }

    @Override
    public CExpr visitCall(Call expr) {
      List<CExpr> args = new ArrayList<CExpr>(expr.args().size());
      for (Expression arg: expr.args()) {
        args.add(lower(arg));
      }
      return new FunctionCall(expr.function(), args);
    }
  }
}
