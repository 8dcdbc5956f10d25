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

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonToken;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.TokenStream;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.apache.log4j.Logger;

import chalk.chc.ast.ChalkTree;
import chalk.chc.ast.antlr.ChalkLexer;
import chalk.chc.ast.antlr.ChalkParser;
import chalk.chc.common.Logging;
import chalk.chc.common.exceptions.ChcRuntimeError;
import chalk.chc.common.exceptions.InvalidSyntaxException;

/**
 * Represents a parsed Chalk source file
 */
public class ParsedModule {

  private static final Logger logger = Logging.getChcLogger();

  public ParsedModule(String moduleName, ChalkTree ast) {
    this.moduleName = moduleName;
    this.ast = ast;
  }

  /** Name used for the module in error messages */
  public final String moduleName;
  public final ChalkTree ast;

  /**
   * Parse source text and create a ParsedModule object
   * @param moduleName name to report in error messages, normally the
   *                   input file path
   * @param source program text
   * @return
   * @throws InvalidSyntaxException for the first lexical or syntax error
   */
  public static ParsedModule parse(String moduleName, String source)
      throws InvalidSyntaxException {
    ChalkTree tree = runANTLR(moduleName, new ANTLRStringStream(source));
    if (logger.isTraceEnabled()) {
      logger.trace(tree.printTree());
    }
    return new ParsedModule(moduleName, tree);
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static ChalkTree runANTLR(String moduleName,
              ANTLRStringStream input) throws InvalidSyntaxException {
    ChalkLexer lexer = new ChalkLexer(input);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    ChalkParser parser = new ChalkParser(tokens);
    parser.setTreeAdaptor(new ChalkTreeAdaptor());

    // Launch parsing
    ChalkParser.program_return program = null;
    try {
      program = parser.program();
    } catch (RecognitionException e) {
      // Recognition errors are reported through displayRecognitionError,
      // so reaching here is an internal error
      throw new ChcRuntimeError("Parsing failed: " + e.toString());
    }

    /* NOTE: in some cases the antlr parser will actually recover from
     *    errors and continue, generating the parse tree that it thinks
     *    is most plausible.  This is where we detect this case.
     *    Lexer errors come first since they usually cause the
     *    parser errors.
     */
    if (lexer.lexerError) {
      throw syntaxError(moduleName, lexer.errors, lexer.errorMessages);
    }
    if (parser.parserError) {
      throw syntaxError(moduleName, parser.errors, parser.errorMessages);
    }

    if (program == null)
      throw new ChcRuntimeError("PARSER FAILED!");

    return (ChalkTree) program.getTree();
  }

  private static InvalidSyntaxException syntaxError(String moduleName,
        List<RecognitionException> errors, List<String> messages) {
    assert(!errors.isEmpty());
    for (int i = 1; i < messages.size(); i++) {
      logger.debug("Further syntax error: " + messages.get(i));
    }
    RecognitionException first = errors.get(0);
    return new InvalidSyntaxException(moduleName, first.line,
                          first.charPositionInLine, messages.get(0));
  }

  /**
   * Make ANTLR build ChalkTree nodes, including for the placeholder
   * nodes it inserts while recovering from errors
   */
  public static class ChalkTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new ChalkTree(t);
    }

    @Override
    public Object errorNode(TokenStream input, Token start, Token stop,
                            RecognitionException e) {
      return new ChalkTree(new CommonToken(Token.INVALID_TOKEN_TYPE,
                                           "<error>"));
    }
  }
}
