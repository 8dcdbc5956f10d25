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

import java.util.ArrayList;
import java.util.List;

import chalk.chc.ast.Assign;
import chalk.chc.ast.BinaryOp;
import chalk.chc.ast.BoolLiteral;
import chalk.chc.ast.Call;
import chalk.chc.ast.ChalkTree;
import chalk.chc.ast.ExprStmt;
import chalk.chc.ast.Expression;
import chalk.chc.ast.FuncDef;
import chalk.chc.ast.FuncDef.Param;
import chalk.chc.ast.If;
import chalk.chc.ast.NumberLiteral;
import chalk.chc.ast.Print;
import chalk.chc.ast.Program;
import chalk.chc.ast.Return;
import chalk.chc.ast.Statement;
import chalk.chc.ast.StringLiteral;
import chalk.chc.ast.UnaryOp;
import chalk.chc.ast.VarDecl;
import chalk.chc.ast.VariableRef;
import chalk.chc.ast.While;
import chalk.chc.ast.antlr.ChalkParser;
import chalk.chc.common.exceptions.ChcRuntimeError;
import chalk.chc.common.exceptions.InvalidSyntaxException;
import chalk.chc.common.exceptions.UndefinedTypeException;
import chalk.chc.common.exceptions.UserException;
import chalk.chc.common.lang.Operators.BinaryOperator;
import chalk.chc.common.lang.Operators.UnaryOperator;
import chalk.chc.common.lang.Type;

/**
 * Convert the ANTLR parse tree into the typed AST.
 *
 * The grammar already builds binary operator subtrees with the operator
 * token at the root, folding runs of operators of the same precedence
 * to the left, so a - b - c arrives here as ((a - b) - c).
 */
public class AstBuilder {

  private final String inputFile;

  public AstBuilder(String inputFile) {
    this.inputFile = inputFile;
  }

  public Program build(ChalkTree tree) throws UserException {
    assert(tree.getType() == ChalkParser.PROGRAM);
    return new Program(statements(tree.children()));
  }

  private List<Statement> statements(List<ChalkTree> trees)
      throws UserException {
    List<Statement> result = new ArrayList<Statement>(trees.size());
    for (ChalkTree stmt: trees) {
      result.add(statement(stmt));
    }
    return result;
  }

  /**
   * @param tree a BLOCK node
   */
  private List<Statement> block(ChalkTree tree) throws UserException {
    checkType(tree, ChalkParser.BLOCK);
    return statements(tree.children());
  }

  public Statement statement(ChalkTree tree) throws UserException {
    switch (tree.getType()) {
      case ChalkParser.VAR_DECL:
        return varDecl(tree);
      case ChalkParser.FUNC_DEF:
        return funcDef(tree);
      case ChalkParser.IF_STMT:
        return ifStatement(tree);
      case ChalkParser.WHILE_STMT:
        return new While(expression(tree.child(0)), block(tree.child(1)),
                         line(tree));
      case ChalkParser.RETURN_STMT: {
        Expression value = null;
        if (tree.childCount() > 0) {
          value = expression(tree.child(0));
        }
        return new Return(value, line(tree));
      }
      case ChalkParser.PRINT_STMT:
        return new Print(expressions(tree.children()), line(tree));
      case ChalkParser.ASSIGN_STMT:
        return new Assign(tree.child(0).getText(),
                          expression(tree.child(1)), line(tree));
      case ChalkParser.EXPR_STMT:
        return new ExprStmt(expression(tree.child(0)), line(tree));
      default:
        throw new ChcRuntimeError("Unexpected token type for statement: "
                                  + LogHelper.tokName(tree.getType()));
    }
  }

  private VarDecl varDecl(ChalkTree tree) throws UserException {
    assert(tree.childCount() == 4);
    boolean mutable = tree.child(0).getType() == ChalkParser.MUT;
    String name = tree.child(1).getText();
    Type type = type(tree.child(2));
    Expression value = expression(tree.child(3));
    return new VarDecl(name, type, value, mutable, line(tree));
  }

  private FuncDef funcDef(ChalkTree tree) throws UserException {
    assert(tree.childCount() == 4);
    String name = tree.child(0).getText();

    ChalkTree paramsTree = tree.child(1);
    checkType(paramsTree, ChalkParser.PARAMS);
    List<Param> params = new ArrayList<Param>(paramsTree.childCount());
    for (ChalkTree param: paramsTree.children()) {
      checkType(param, ChalkParser.PARAM);
      params.add(new Param(param.child(0).getText(), type(param.child(1))));
    }

    ChalkTree returnsTree = tree.child(2);
    checkType(returnsTree, ChalkParser.RETURNS);
    Type returnType;
    if (returnsTree.childCount() == 0) {
      returnType = Type.VOID;
    } else {
      returnType = type(returnsTree.child(0));
    }

    return new FuncDef(name, params, returnType, block(tree.child(3)),
                       line(tree));
  }

  private If ifStatement(ChalkTree tree) throws UserException {
    Expression condition = expression(tree.child(0));
    List<Statement> thenBlock = block(tree.child(1));
    List<Statement> elseBlock;
    if (tree.childCount() > 2) {
      // else if arrives as a block holding a single if statement
      elseBlock = block(tree.child(2));
    } else {
      elseBlock = new ArrayList<Statement>();
    }
    return new If(condition, thenBlock, elseBlock, line(tree));
  }

  private List<Expression> expressions(List<ChalkTree> trees)
      throws UserException {
    List<Expression> result = new ArrayList<Expression>(trees.size());
    for (ChalkTree expr: trees) {
      result.add(expression(expr));
    }
    return result;
  }

  public Expression expression(ChalkTree tree) throws UserException {
    switch (tree.getType()) {
      case ChalkParser.NUMBER:
        return numberLiteral(tree);
      case ChalkParser.STRING:
        return new StringLiteral(stripQuotes(tree.getText()), line(tree));
      case ChalkParser.TRUE:
        return new BoolLiteral(true, line(tree));
      case ChalkParser.FALSE:
        return new BoolLiteral(false, line(tree));
      case ChalkParser.ID:
        return new VariableRef(tree.getText(), line(tree));
      case ChalkParser.CALL:
        return new Call(tree.child(0).getText(),
                        expressions(tree.children(1)), line(tree));
      case ChalkParser.NEGATE:
        return new UnaryOp(UnaryOperator.NEGATE, expression(tree.child(0)),
                           line(tree));
      case ChalkParser.PLUS:
      case ChalkParser.MINUS:
      case ChalkParser.STAR:
      case ChalkParser.SLASH:
      case ChalkParser.EQ:
      case ChalkParser.NEQ:
      case ChalkParser.LT:
      case ChalkParser.GT:
      case ChalkParser.LE:
      case ChalkParser.GE: {
        assert(tree.childCount() == 2);
        BinaryOperator op = BinaryOperator.fromSymbol(tree.getText());
        if (op == null) {
          throw new ChcRuntimeError("Unknown operator " + tree.getText());
        }
        Expression left = expression(tree.child(0));
        Expression right = expression(tree.child(1));
        return new BinaryOp(left, op, right, line(tree));
      }
      default:
        throw new ChcRuntimeError("Unexpected token type for expression: "
                                  + LogHelper.tokName(tree.getType()));
    }
  }

  private NumberLiteral numberLiteral(ChalkTree tree)
      throws InvalidSyntaxException {
    String text = tree.getText();
    if (text.contains(".")) {
      double value = Double.parseDouble(text);
      // Must fit the C float it is stored in
      if (Double.isInfinite(value) || value > Float.MAX_VALUE) {
        throw outOfRange(tree, "float");
      }
      return NumberLiteral.floatLit(value, text, line(tree));
    }
    try {
      // Must fit the C int it is stored in
      return NumberLiteral.intLit(Integer.parseInt(text), line(tree));
    } catch (NumberFormatException e) {
      throw outOfRange(tree, "int");
    }
  }

  private InvalidSyntaxException outOfRange(ChalkTree tree, String type) {
    return new InvalidSyntaxException(inputFile, tree.getLine(),
                tree.getCharPositionInLine(),
                "Invalid " + type + " literal: " + tree.getText() +
                " is out of range");
  }

  private Type type(ChalkTree tree) throws UndefinedTypeException {
    Type type = Type.fromName(tree.getText());
    if (type == null) {
      throw new UndefinedTypeException(inputFile, tree.getLine(),
                                       tree.getText());
    }
    return type;
  }

  private static String stripQuotes(String text) {
    assert(text.length() >= 2 && text.startsWith("\"") &&
           text.endsWith("\""));
    return text.substring(1, text.length() - 1);
  }

  /**
   * @return line of the node, null if unknown.  Imaginary nodes report
   *         the line of their first child.
   */
  private static Integer line(ChalkTree tree) {
    int line = tree.getLine();
    return line > 0 ? line : null;
  }

  private static void checkType(ChalkTree tree, int expected) {
    if (tree.getType() != expected) {
      throw new ChcRuntimeError("Expected " + LogHelper.tokName(expected) +
          " but got " + LogHelper.tokName(tree.getType()));
    }
  }
}
