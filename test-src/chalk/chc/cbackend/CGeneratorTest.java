package chalk.chc.cbackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import chalk.chc.ast.BoolLiteral;
import chalk.chc.ast.Expression;
import chalk.chc.ast.Print;
import chalk.chc.ast.Program;
import chalk.chc.ast.Statement;
import chalk.chc.ast.StringLiteral;
import chalk.chc.common.Logging;
import chalk.chc.common.exceptions.UserException;
import chalk.chc.common.lang.Type;
import chalk.chc.frontend.AnalysisOptions;
import chalk.chc.frontend.AstBuilder;
import chalk.chc.frontend.ParsedModule;
import chalk.chc.frontend.SemanticAnalyzer;

public class CGeneratorTest {

  private static final String PRELUDE =
      "#include <stdio.h>\n" +
      "#include <string.h>\n" +
      "\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/CGeneratorTest.chc.log", true);
  }

  private static String generate(String source) throws UserException {
    ParsedModule module = ParsedModule.parse("test.ch", source);
    Program program = new AstBuilder("test.ch").build(module.ast);
    new SemanticAnalyzer(Logging.getChcLogger(), AnalysisOptions.DEFAULTS)
                                                      .analyze(program);
    return new CGenerator(Logging.getChcLogger()).generate(program);
  }

  private static String main(String... lines) {
    StringBuilder sb = new StringBuilder(PRELUDE);
    sb.append("int main() {\n");
    for (String line: lines) {
      sb.append("    ").append(line).append("\n");
    }
    sb.append("    return 0;\n");
    sb.append("}\n");
    return sb.toString();
  }

  @Test
  public void testEmptyProgram() throws UserException {
    assertEquals("No main without top-level statements",
                 PRELUDE, generate(""));
  }

  @Test
  public void testDeclareAndPrint() throws UserException {
    assertEquals(main("const int x = 5;",
                      "printf(\"%d\\n\", x);"),
                 generate("let x: int = 5; print(x);"));
  }

  @Test
  public void testDeclarations() throws UserException {
    assertEquals(main("float f = 2.0;",
                      "const char* s = \"hi\\n\";",
                      "const int b = 1;",
                      "int c = 0;",
                      "f = 3.5;"),
                 generate("mut f: float = 2.0;\n" +
                          "let s: string = \"hi\\n\";\n" +
                          "let b: bool = true;\n" +
                          "mut c: bool = false;\n" +
                          "f = 3.5;"));
  }

  @Test
  public void testPrintFormats() throws UserException {
    assertEquals(main("printf(\"%s%f%d%d\\n\", \"a\", 1.5, 1, 2);"),
                 generate("print(\"a\", 1.5, true, 2);"));
  }

  @Test
  public void testNumbersKeepSourceText() throws UserException {
    assertEquals(main("printf(\"%f%f%f\\n\", 100000000.0, 0.00001, 1.50);"),
                 generate("print(100000000.0, 0.00001, 1.50);"));
  }

  @Test
  public void testIntLiteralLeadingZeros() throws UserException {
    // C would read 010 as octal
    assertEquals(main("const int x = 10;",
                      "const float y = 010.5;"),
                 generate("let x: int = 010; let y: float = 010.5;"));
  }

  @Test
  public void testMainEndsFile() throws UserException {
    String c = generate("fn f() { }\nprint(1);");
    assertTrue(c, c.endsWith("    return 0;\n}\n"));
    assertFalse(c, c.endsWith("\n\n"));
  }

  @Test
  public void testFunctions() throws UserException {
    String expected = PRELUDE +
        "int add(int a, int b) {\n" +
        "    return (a + b);\n" +
        "}\n" +
        "\n" +
        "int main() {\n" +
        "    printf(\"%d\\n\", add(1, 2));\n" +
        "    return 0;\n" +
        "}\n";
    assertEquals(expected,
        generate("fn add(a: int, b: int) -> int { return a + b; }\n" +
                 "print(add(1, 2));"));
  }

  @Test
  public void testFunctionsOnly() throws UserException {
    String expected = PRELUDE +
        "void hello() {\n" +
        "    printf(\"%s\\n\", \"hello\");\n" +
        "    return;\n" +
        "}\n" +
        "\n" +
        "void nothing() {\n" +
        "}\n" +
        "\n";
    assertEquals(expected,
        generate("fn hello() { print(\"hello\"); return; }\n" +
                 "fn nothing() { }"));
  }

  @Test
  public void testFunctionsHoistedOutOfMain() throws UserException {
    String c = generate("print(1);\nfn f() -> float { return 1.0; }\n" +
                        "print(f());");
    assertEquals(PRELUDE +
        "float f() {\n" +
        "    return 1.0;\n" +
        "}\n" +
        "\n" +
        "int main() {\n" +
        "    printf(\"%d\\n\", 1);\n" +
        "    printf(\"%f\\n\", f());\n" +
        "    return 0;\n" +
        "}\n", c);
  }

  @Test
  public void testIfWithoutElse() throws UserException {
    String expected = main("const int b = 1;",
                           "if (b) {",
                           "    printf(\"%d\\n\", 1);",
                           "}");
    assertEquals(expected,
                 generate("let b: bool = true; if b { print(1); }"));
    assertEquals("Empty else is dropped", expected,
                 generate("let b: bool = true; if b { print(1); } else { }"));
  }

  @Test
  public void testIfElse() throws UserException {
    assertEquals(main("if ((1 < 2)) {",
                      "    printf(\"%d\\n\", 1);",
                      "} else {",
                      "    if (0) {",
                      "    } else {",
                      "        printf(\"%d\\n\", 2);",
                      "    }",
                      "}"),
                 generate("if 1 < 2 { print(1); } else if false { }" +
                          " else { print(2); }"));
  }

  @Test
  public void testWhile() throws UserException {
    assertEquals(main("int i = 0;",
                      "while ((i < 3)) {",
                      "    i = (i + 1);",
                      "}"),
                 generate("mut i: int = 0;\nwhile i < 3 { i = i + 1; }"));
  }

  @Test
  public void testExpressions() throws UserException {
    assertEquals(main("const int x = ((1 - 2) - (-3));",
                      "const float y = (-(1.5 * 2.0));",
                      "const int z = (x == 0);"),
                 generate("let x: int = 1 - 2 - -3;\n" +
                          "let y: float = -(1.5 * 2.0);\n" +
                          "let z: bool = x == 0;"));
  }

  @Test
  public void testExprStatement() throws UserException {
    assertEquals(PRELUDE +
        "void f(float a) {\n" +
        "}\n" +
        "\n" +
        "int main() {\n" +
        "    f(1.0);\n" +
        "    return 0;\n" +
        "}\n",
        generate("fn f(a: float) { }\nf(1.0);"));
  }

  @Test
  public void testShadowedVariablePrintFormat() throws UserException {
    String c = generate("let x: int = 1;\n" +
                        "if true { let x: string = \"a\"; print(x); }\n" +
                        "print(x);");
    assertEquals(main("const int x = 1;",
                      "if (1) {",
                      "    const char* x = \"a\";",
                      "    printf(\"%s\\n\", x);",
                      "}",
                      "printf(\"%d\\n\", x);"), c);
  }

  @Test
  public void testUnannotatedPrint() {
    // Not analyzed, so no types are recorded
    Program program = new Program(Arrays.<Statement>asList(
        new Print(Arrays.<Expression>asList(new StringLiteral("s", null),
                                            new BoolLiteral(true, null)),
                  null)));
    String c = new CGenerator(Logging.getChcLogger()).generate(program);
    assertTrue(c, c.contains("printf(\"%d%d\\n\", \"s\", 1);"));
  }

  @Test
  public void testFormatPlaceholder() {
    assertEquals("%d", CGenerator.formatPlaceholder(Type.INT));
    assertEquals("%d", CGenerator.formatPlaceholder(Type.BOOL));
    assertEquals("%f", CGenerator.formatPlaceholder(Type.FLOAT));
    assertEquals("%s", CGenerator.formatPlaceholder(Type.STRING));
    assertEquals("%d", CGenerator.formatPlaceholder(null));
  }

  @Test
  public void testNoMainForEmptyTopLevel() {
    String c = new CGenerator(Logging.getChcLogger()).generate(
                  new Program(Collections.<Statement>emptyList()));
    assertFalse(c.contains("main"));
  }
}
