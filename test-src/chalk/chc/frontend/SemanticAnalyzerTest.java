package chalk.chc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import chalk.chc.ast.BinaryOp;
import chalk.chc.ast.Expression;
import chalk.chc.ast.If;
import chalk.chc.ast.Print;
import chalk.chc.ast.Program;
import chalk.chc.ast.Statement;
import chalk.chc.ast.VarDecl;
import chalk.chc.ast.VariableRef;
import chalk.chc.common.Logging;
import chalk.chc.common.exceptions.SemanticError;
import chalk.chc.common.exceptions.UserException;
import chalk.chc.common.lang.Type;

public class SemanticAnalyzerTest {

  private static final AnalysisOptions STRICT =
                              new AnalysisOptions(true, true, true);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/SemanticAnalyzerTest.chc.log", true);
  }

  private static Program parse(String source) throws UserException {
    ParsedModule module = ParsedModule.parse("test.ch", source);
    return new AstBuilder("test.ch").build(module.ast);
  }

  private static Program analyze(String source, AnalysisOptions options)
      throws UserException {
    Program program = parse(source);
    new SemanticAnalyzer(Logging.getChcLogger(), options).analyze(program);
    return program;
  }

  private static Program analyze(String source) throws UserException {
    return analyze(source, AnalysisOptions.DEFAULTS);
  }

  private static SemanticError error(String source, AnalysisOptions options)
      throws UserException {
    try {
      analyze(source, options);
    } catch (SemanticError e) {
      return e;
    }
    fail("Expected semantic error for: " + source);
    return null;
  }

  private static SemanticError error(String source) throws UserException {
    return error(source, AnalysisOptions.DEFAULTS);
  }

  private static void assertError(String expected, String source)
      throws UserException {
    assertEquals(expected, error(source).getDescription());
  }

  @Test
  public void testValidPrograms() throws UserException {
    analyze("");
    analyze("let x: int = 5; print(x);");
    analyze("mut s: string = \"a\"; s = \"b\"; print(s, 1, 2.5, true);");
    analyze("fn add(a: int, b: int) -> int { return a + b; }\n" +
            "print(add(1, 2));");
    analyze("let b: bool = 1 < 2 == true;");
    analyze("mut f: float = -1.5; f = f * 2.0 - -f;");
  }

  @Test
  public void testVarDeclMismatch() throws UserException {
    SemanticError e = error("let x: int = 2.5;");
    assertEquals("type mismatch: 'x' is 'int' but got 'float'",
                 e.getDescription());
    assertEquals(Integer.valueOf(1), e.getLine());
    assertEquals("[line #1]: type mismatch: 'x' is 'int' but got 'float'",
                 e.getMessage());
  }

  @Test
  public void testNoImplicitConversion() throws UserException {
    assertError("type mismatch: 'f' is 'float' but got 'int'",
                "let f: float = 1;");
    assertError("type mismatch: 'b' is 'bool' but got 'int'",
                "let b: bool = 0;");
  }

  @Test
  public void testDeclVisibleAfterInitializer() throws UserException {
    assertError("undefined variable 'x'", "let x: int = x;");
  }

  @Test
  public void testUndefinedVariable() throws UserException {
    SemanticError e = error("let x: int = 1;\nprint(x, y);");
    assertEquals("undefined variable 'y'", e.getDescription());
    assertEquals(Integer.valueOf(2), e.getLine());

    assertError("undefined variable 'y'", "y = 1;");
  }

  @Test
  public void testImmutableAssign() throws UserException {
    assertError("cannot assign to immutable variable 'x'\n" +
                "hint: declare it as 'mut x: int = ...'",
                "let x: int = 1; x = 2;");
  }

  @Test
  public void testMutabilityCheckedBeforeValue() throws UserException {
    assertError("cannot assign to immutable variable 's'\n" +
                "hint: declare it as 'mut s: string = ...'",
                "let s: string = \"a\"; s = undefinedName;");
  }

  @Test
  public void testAssignMismatch() throws UserException {
    SemanticError e = error("mut y: float = 2.0;\ny = 3;");
    assertEquals("type mismatch in assignment to 'y': expected 'float', " +
                 "got 'int'", e.getDescription());
    assertEquals(Integer.valueOf(2), e.getLine());
  }

  @Test
  public void testParametersImmutable() throws UserException {
    assertError("cannot assign to immutable variable 'a'\n" +
                "hint: declare it as 'mut a: int = ...'",
                "fn f(a: int) { a = 2; }");
  }

  @Test
  public void testReturnOutsideFunction() throws UserException {
    assertError("'return' used outside of a function", "return 1;");
    assertError("'return' used outside of a function", "return;");
    assertError("Function context ends with the function body",
                "'return' used outside of a function",
                "fn f() { return; }\nreturn;");
  }

  private static void assertError(String msg, String expected,
                                  String source) throws UserException {
    assertEquals(msg, expected, error(source).getDescription());
  }

  @Test
  public void testReturnMismatch() throws UserException {
    assertError("return type mismatch in 'f': expected 'int', got 'string'",
                "fn f() -> int { return \"a\"; }");
    assertError("return type mismatch in 'g': expected 'void', got 'int'",
                "fn g() { return 1; }");
  }

  @Test
  public void testBareReturn() throws UserException {
    analyze("fn f() -> int { return; }");
    assertEquals("return type mismatch in 'f': expected 'int', got 'void'",
        error("fn f() -> int { return; }", STRICT).getDescription());
    analyze("fn g() { return; }", STRICT);
  }

  @Test
  public void testNestedFunctionRestoresReturnType() throws UserException {
    analyze("fn outer() -> int {\n" +
            "  fn inner() -> string { return \"s\"; }\n" +
            "  return 1;\n" +
            "}");
    assertError("return type mismatch in 'outer': expected 'int', " +
                "got 'string'",
                "fn outer() -> int {\n" +
                "  fn inner() -> string { return \"s\"; }\n" +
                "  return \"s\";\n" +
                "}");
  }

  @Test
  public void testUnaryMinus() throws UserException {
    assertError("unary '-' requires int or float, got 'string'",
                "print(-\"a\");");
    assertError("unary '-' requires int or float, got 'bool'",
                "let b: bool = -true;");
  }

  @Test
  public void testComparison() throws UserException {
    assertError("cannot compare 'int' and 'string'", "print(1 < \"a\");");
    assertError("cannot compare 'int' and 'float'", "print(1 == 1.0);");
    Program prog = analyze("print(\"a\" == \"b\");");
    Print print = (Print)prog.statements().get(0);
    assertEquals(Type.BOOL, print.values().get(0).getExprType());
  }

  @Test
  public void testArithmeticMismatch() throws UserException {
    assertError("type mismatch: cannot apply '+' to 'int' and 'float'",
                "print(1 + 2.0);");
    assertError("type mismatch: cannot apply '*' to 'bool' and 'int'",
                "print(true * 2);");
  }

  @Test
  public void testOperandsTypedLeftFirst() throws UserException {
    assertError("undefined variable 'a'", "print(a + b);");
  }

  @Test
  public void testCallChecks() throws UserException {
    String f = "fn f(a: int, b: int) -> int { return a; }\n";
    assertError("undefined function 'g'", "g(1);");
    assertError("'x' is a variable, not a function",
                "let x: int = 1; x();");
    assertError("'f' expects 2 argument(s), got 3", f + "print(f(1, 2, 3));");
    assertError("'f' expects 2 argument(s), got 0", f + "f();");
    assertError("argument 2 of 'f': expected 'int', got 'float'",
                f + "f(1, 2.0);");
    assertError("Arity checked before arguments",
                "'f' expects 2 argument(s), got 1", f + "f(nope);");
  }

  @Test
  public void testCallBeforeDefinition() throws UserException {
    assertError("undefined function 'f'",
                "print(f());\nfn f() -> int { return 1; }");
  }

  @Test
  public void testFunctionUsedAsVariable() throws UserException {
    assertError("'f' is a function, not a variable", "fn f() { }\nprint(f);");
    assertError("'f' is a function, not a variable", "fn f() { }\nf = 1;");
  }

  @Test
  public void testRecursion() throws UserException {
    Program prog = analyze(
        "fn fact(n: int) -> int {\n" +
        "  if n < 2 { return 1; }\n" +
        "  return n * fact(n - 1);\n" +
        "}\n" +
        "print(fact(5));");
    Print print = (Print)prog.statements().get(1);
    assertEquals(Type.INT, print.values().get(0).getExprType());
  }

  @Test
  public void testBlockScopes() throws UserException {
    assertError("undefined variable 'x'",
                "if true { let x: int = 1; } print(x);");
    assertError("undefined variable 'y'",
                "if true { } else { let y: int = 1; } print(y);");
    assertError("undefined variable 'z'",
                "while false { let z: int = 1; } print(z);");
    assertError("Parameters are local to the function",
                "undefined variable 'a'", "fn f(a: int) { }\nprint(a);");
  }

  @Test
  public void testShadowingAnnotations() throws UserException {
    Program prog = analyze("let x: int = 1;\n" +
                           "if true { let x: string = \"a\"; print(x); }\n" +
                           "print(x);");
    If stmt = (If)prog.statements().get(1);
    Print inner = (Print)stmt.thenBlock().get(1);
    Print outer = (Print)prog.statements().get(2);
    assertEquals(Type.STRING, inner.values().get(0).getExprType());
    assertEquals(Type.INT, outer.values().get(0).getExprType());
  }

  @Test
  public void testAllExpressionsAnnotated() throws UserException {
    Program prog = analyze("let x: float = (1.0 + 2.0) * -3.0;");
    BinaryOp mult = (BinaryOp)((VarDecl)prog.statements().get(0)).value();
    assertEquals(Type.FLOAT, mult.getExprType());
    assertEquals(Type.FLOAT, mult.left().getExprType());
    assertEquals(Type.FLOAT, ((BinaryOp)mult.left()).left().getExprType());
    assertEquals(Type.FLOAT, mult.right().getExprType());
  }

  @Test
  public void testConditions() throws UserException {
    analyze("if 1 { } while \"s\" { }");
    assertEquals("condition of 'if' must be 'bool', got 'int'",
        error("if 1 { }", STRICT).getDescription());
    assertEquals("condition of 'while' must be 'bool', got 'string'",
        error("while \"s\" { }", STRICT).getDescription());
    analyze("if 1 < 2 { } while false { }", STRICT);
  }

  @Test
  public void testRedefinition() throws UserException {
    Program prog = analyze("let x: int = 1; let x: string = \"a\"; print(x);");
    Print print = (Print)prog.statements().get(2);
    assertEquals("Later definition replaces earlier one",
                 Type.STRING, print.values().get(0).getExprType());

    assertEquals("'x' is already defined in this scope",
        error("let x: int = 1;\nlet x: int = 2;", STRICT).getDescription());
    assertEquals("'f' is already defined in this scope",
        error("let f: int = 1;\nfn f() { }", STRICT).getDescription());
    assertEquals("'a' is already defined in this scope",
        error("fn f(a: int, a: int) { }", STRICT).getDescription());
    analyze("let x: int = 1; if true { let x: int = 2; }", STRICT);
  }

  @Test
  public void testFreshStatePerRun() throws UserException {
    SemanticAnalyzer analyzer = new SemanticAnalyzer(Logging.getChcLogger(),
                                             AnalysisOptions.DEFAULTS);
    analyzer.analyze(parse("let x: int = 1;"));
    exception.expect(SemanticError.class);
    exception.expectMessage("undefined variable 'x'");
    analyzer.analyze(parse("print(x);"));
  }

  @Test
  public void testNodesWithoutLines() throws UserException {
    // Trees not built by the parser may lack positions
    Expression ref = new VariableRef("q", null);
    Program prog = new Program(Arrays.<Statement>asList(
          new Print(Collections.singletonList(ref), null)));
    try {
      new SemanticAnalyzer(Logging.getChcLogger(), AnalysisOptions.DEFAULTS)
                                                          .analyze(prog);
      fail("Expected semantic error");
    } catch (SemanticError e) {
      assertNull(e.getLine());
      assertEquals("undefined variable 'q'", e.getMessage());
    }
  }
}
