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
package chalk.chc.common.lang;

/**
 * This class serves to define details of builtin operators in Chalk
 */
public class Operators {

  public static enum OpKind {
    /** Result has the same type as the operands */
    ARITHMETIC,
    /** Result is always bool */
    COMPARISON,
  }

  public static enum UnaryOperator {
    NEGATE("-");

    private final String symbol;

    private UnaryOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /**
   * Binary operators.  Symbols are shared between Chalk and C.
   */
  public static enum BinaryOperator {
    PLUS("+", OpKind.ARITHMETIC),
    MINUS("-", OpKind.ARITHMETIC),
    MULT("*", OpKind.ARITHMETIC),
    DIV("/", OpKind.ARITHMETIC),
    EQ("==", OpKind.COMPARISON),
    NEQ("!=", OpKind.COMPARISON),
    LT("<", OpKind.COMPARISON),
    GT(">", OpKind.COMPARISON),
    LTE("<=", OpKind.COMPARISON),
    GTE(">=", OpKind.COMPARISON);

    private final String symbol;
    private final OpKind kind;

    private BinaryOperator(String symbol, OpKind kind) {
      this.symbol = symbol;
      this.kind = kind;
    }

    public String symbol() {
      return symbol;
    }

    public OpKind kind() {
      return kind;
    }

    public boolean isComparison() {
      return kind == OpKind.COMPARISON;
    }

    /**
     * @param symbol operator as written in source, e.g. "<="
     * @return the operator, or null if not a binary operator
     */
    public static BinaryOperator fromSymbol(String symbol) {
      for (BinaryOperator op: values()) {
        if (op.symbol.equals(symbol)) {
          return op;
        }
      }
      return null;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }
}
