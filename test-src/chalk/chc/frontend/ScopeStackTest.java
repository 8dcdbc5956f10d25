package chalk.chc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Collections;

import org.junit.Test;

import chalk.chc.ast.FuncDef.Param;
import chalk.chc.common.exceptions.ChcRuntimeError;
import chalk.chc.common.lang.Type;

public class ScopeStackTest {

  private static final VariableSymbol X_INT =
                              new VariableSymbol("x", Type.INT, false);
  private static final VariableSymbol X_STRING =
                              new VariableSymbol("x", Type.STRING, true);

  @Test
  public void testGlobalScope() {
    ScopeStack scopes = new ScopeStack();
    assertEquals(0, scopes.depth());
    assertNull(scopes.lookup("x"));
    scopes.define("x", X_INT);
    assertSame(X_INT, scopes.lookup("x"));
    assertTrue(scopes.isDefinedInCurrentScope("x"));
  }

  @Test
  public void testShadowing() {
    ScopeStack scopes = new ScopeStack();
    scopes.define("x", X_INT);
    scopes.pushScope();
    assertEquals(1, scopes.depth());
    assertSame("Outer visible from inner scope", X_INT, scopes.lookup("x"));
    assertFalse(scopes.isDefinedInCurrentScope("x"));

    scopes.define("x", X_STRING);
    assertSame("Innermost binding wins", X_STRING, scopes.lookup("x"));

    scopes.popScope();
    assertSame("Outer binding restored", X_INT, scopes.lookup("x"));
  }

  @Test
  public void testInnerNamesDiscarded() {
    ScopeStack scopes = new ScopeStack();
    scopes.pushScope();
    scopes.pushScope();
    scopes.define("f", new FunctionSymbol("f",
                        Collections.<Param>emptyList(), Type.VOID));
    assertEquals(Symbol.DefKind.FUNCTION, scopes.lookup("f").kind());
    scopes.popScope();
    assertNull(scopes.lookup("f"));
    scopes.popScope();
    assertEquals(0, scopes.depth());
  }

  @Test
  public void testRedefineReplaces() {
    ScopeStack scopes = new ScopeStack();
    assertNull(scopes.define("x", X_INT));
    assertSame(X_INT, scopes.define("x", X_STRING));
    assertSame(X_STRING, scopes.lookup("x"));
  }

  @Test(expected=ChcRuntimeError.class)
  public void testPopGlobalScope() {
    ScopeStack scopes = new ScopeStack();
    scopes.pushScope();
    scopes.popScope();
    scopes.popScope();
  }
}
