package chalk.chc.cbackend.tree;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class CTreeTest {

  @Test
  public void testExpressions() {
    CExpr sum = new BinaryExpr(new Token("a"), "+", new Token(2));
    assertEquals("(a + 2)", sum.toString());
    assertEquals("(-(a + 2))", new UnaryExpr("-", sum).toString());
    assertEquals("f()", new FunctionCall("f",
                      Collections.<CExpr>emptyList()).toString());
    assertEquals("g(\"x\", (a + 2))", new FunctionCall("g",
        Arrays.<CExpr>asList(new CString("x"), sum)).toString());
  }

  @Test
  public void testStatementsIndented() {
    Sequence body = new Sequence();
    body.add(new Declaration(true, "int", "x", new Token(1)));
    body.add(new Assignment("x", new Token(2)));
    body.add(new ExprStatement(new FunctionCall("f",
                                   Collections.<CExpr>emptyList())));
    body.add(new ReturnStatement());
    body.setIndentation(8);
    assertEquals("        const int x = 1;\n" +
                 "        x = 2;\n" +
                 "        f();\n" +
                 "        return;\n", body.toString());
  }

  @Test
  public void testNestedBlocks() {
    Sequence inner = new Sequence();
    inner.add(new ReturnStatement(new Token("x")));
    Sequence elseBlock = new Sequence();
    elseBlock.add(new WhileLoop(new Token(1), new Sequence()));
    Sequence body = new Sequence();
    body.add(new IfStatement(new Token("c"), inner, elseBlock));

    Function fn = new Function("char*", "pick",
                               Arrays.asList("int c", "char* x"), body);
    assertEquals("char* pick(int c, char* x) {\n" +
                 "    if (c) {\n" +
                 "        return x;\n" +
                 "    } else {\n" +
                 "        while (1) {\n" +
                 "        }\n" +
                 "    }\n" +
                 "}\n", fn.toString());
  }

  @Test
  public void testFileLevel() {
    Sequence file = new Sequence();
    file.add(new Include("stdio.h"));
    file.add(new Text(""));
    file.add(new Text("/* end */"));
    assertEquals("#include <stdio.h>\n\n/* end */\n", file.toString());
  }
}
