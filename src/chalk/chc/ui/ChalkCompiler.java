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
package chalk.chc.ui;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import chalk.chc.ast.Program;
import chalk.chc.cbackend.CGenerator;
import chalk.chc.common.Settings;
import chalk.chc.common.exceptions.ChcFatal;
import chalk.chc.common.exceptions.UserException;
import chalk.chc.frontend.AnalysisOptions;
import chalk.chc.frontend.AstBuilder;
import chalk.chc.frontend.ParsedModule;
import chalk.chc.frontend.SemanticAnalyzer;

/**
 * This is the main entry point to the compiler
 */
public class ChalkCompiler {

  private final Logger logger;
  private final AnalysisOptions options;

  public ChalkCompiler(Logger logger, AnalysisOptions options) {
    this.logger = logger;
    this.options = options;
  }

  /**
   * Compile a Chalk file to a C file.  Errors are reported on stderr and
   * end compilation with a ChcFatal carrying the exit code.  The output
   * file is only written if compilation succeeds.
   *
   * @param inputFile Chalk source
   * @param outputFile C output, or null to only check the program
   */
  public void compile(File inputFile, File outputFile) {
    try {
      logger.info("chc starting: " + inputFile);
      logSettings();
      String source = FileUtils.readFileToString(inputFile,
                                                 StandardCharsets.UTF_8);
      if (outputFile == null) {
        check(inputFile.getPath(), source);
      } else {
        String c = compileToC(inputFile.getPath(), source);
        FileUtils.writeStringToFile(outputFile, c, StandardCharsets.UTF_8);
      }
      logger.debug("chc done");
    }
    catch (ChcFatal e) {
      // Rethrow
      throw e;
    }
    catch (UserException e) {
      System.err.println("chc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(ExceptionUtils.getStackTrace(e));
      throw new ChcFatal(ExitCode.ERROR_USER.code());
    }
    catch (IOException e) {
      System.err.println("I/O error: " + e.getMessage());
      throw new ChcFatal(ExitCode.ERROR_IO.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new ChcFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (Throwable e) {
      // Other error, possibly ChcRuntimeError
      reportInternalError(e);
      throw new ChcFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Run all passes over source text
   * @param inputName name used in error messages
   * @return the C translation
   */
  public String compileToC(String inputName, String source)
      throws UserException {
    Program program = check(inputName, source);
    return new CGenerator(logger).generate(program);
  }

  /**
   * Parse and analyze source text without generating code
   * @return the analyzed program, with expression types recorded
   */
  public Program check(String inputName, String source)
      throws UserException {
    ParsedModule module = ParsedModule.parse(inputName, source);
    Program program = new AstBuilder(inputName).build(module.ast);
    new SemanticAnalyzer(logger, options).analyze(program);
    return program;
  }

  private void logSettings() {
    if (logger.isDebugEnabled()) {
      for (String key: Settings.getKeys()) {
        logger.debug("Setting " + key + "=" + Settings.get(key));
      }
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("CHC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
