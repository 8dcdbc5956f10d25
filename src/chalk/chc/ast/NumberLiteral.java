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
package chalk.chc.ast;

/**
 * Numeric literal.  Whether it is an int or a float is decided by
 * the surface syntax (a fractional part makes it a float), not by its
 * value: 2.0 is a float.
 */
public class NumberLiteral extends Expression {
  private final long intValue;
  private final double floatValue;
  private final boolean isFloat;
  private final String text;

  private NumberLiteral(long intValue, double floatValue, boolean isFloat,
                        String text, Integer line) {
    super(line);
    this.intValue = intValue;
    this.floatValue = floatValue;
    this.isFloat = isFloat;
    this.text = text;
  }

  public static NumberLiteral intLit(long value, Integer line) {
    return new NumberLiteral(value, value, false, Long.toString(value), line);
  }

  /**
   * @param text the literal as written in the source, e.g. "1.50"
   */
  public static NumberLiteral floatLit(double value, String text,
                                       Integer line) {
    return new NumberLiteral(0, value, true, text, line);
  }

  public boolean isFloat() {
    return isFloat;
  }

  public long intValue() {
    return intValue;
  }

  public double floatValue() {
    return floatValue;
  }

  /**
   * @return floats as written in the source; ints in plain decimal,
   *         without leading zeros
   */
  public String text() {
    return text;
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor)
      throws E {
    return visitor.visitNumber(this);
  }

  @Override
  public String toString() {
    return text();
  }
}
