package com.verlumen.modelfit.params;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses link expressions such as {@code 2 * gal.nh + 1} into parameter expressions.
 *
 * <p>The grammar follows the text produced by {@link Parameter#getFullName()}, so the full name of
 * any expression parses back to an equivalent expression:
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/' | '//' | '%') factor)*
 * factor := '-' factor | power
 * power  := atom ('**' factor)?
 * atom   := number | 'nan' | 'inf' | name | 'abs' '(' expr ')' | '(' expr ')'
 * </pre>
 *
 * <p>A minus sign directly in front of a number makes a negative literal, so the constant in
 * {@code ((-2) ** m.p)} is -2, while {@code -2 ** m.p} still means {@code -(2 ** m.p)}.
 *
 * <p>Names are resolved through the supplied function, typically a lookup by full name.
 */
public final class ExpressionParser {
  private static final CharMatcher NAME_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));
  private static final CharMatcher NAME_PART =
      NAME_START.or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('.'));
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');

  private final String text;
  private final Function<String, Optional<Parameter>> resolver;
  private int pos;

  private ExpressionParser(String text, Function<String, Optional<Parameter>> resolver) {
    this.text = checkNotNull(text);
    this.resolver = checkNotNull(resolver);
  }

  /**
   * Parses {@code text}.
   *
   * @throws IllegalArgumentException if the text is not a valid expression
   * @throws ParameterErr with kind {@link ParameterErr.Kind#NOT_LINK} if a name does not resolve
   *     to a parameter
   */
  public static Parameter parse(String text, Function<String, Optional<Parameter>> resolver) {
    ExpressionParser parser = new ExpressionParser(text, resolver);
    Parameter result = parser.expr();
    parser.skipSpaces();
    if (parser.pos != text.length()) {
      throw parser.error("unexpected input");
    }
    return result;
  }

  private Parameter expr() {
    Parameter result = term();
    while (true) {
      if (consume("+")) {
        result = BinaryOp.ADD.combine(result, term());
      } else if (consume("-")) {
        result = BinaryOp.SUBTRACT.combine(result, term());
      } else {
        return result;
      }
    }
  }

  private Parameter term() {
    Parameter result = factor();
    while (true) {
      if (consume("**")) {
        // Belongs to power(); only reached for input like "a * * b".
        throw error("misplaced '**'");
      } else if (consume("*")) {
        result = BinaryOp.MULTIPLY.combine(result, factor());
      } else if (consume("//")) {
        result = BinaryOp.FLOOR_DIVIDE.combine(result, factor());
      } else if (consume("/")) {
        result = BinaryOp.DIVIDE.combine(result, factor());
      } else if (consume("%")) {
        result = BinaryOp.MODULO.combine(result, factor());
      } else {
        return result;
      }
    }
  }

  private Parameter factor() {
    if (consume("-")) {
      // "-2" is a negative literal, "-(2)" the negation of one.
      boolean bracketed = peek("(");
      Parameter operand = factor();
      if (operand instanceof ConstantParameter && !bracketed) {
        return new ConstantParameter(-((ConstantParameter) operand).getValue());
      }
      return UnaryOp.NEGATE.applyTo(operand);
    }
    return power();
  }

  private Parameter power() {
    Parameter base = atom();
    if (consume("**")) {
      return BinaryOp.POWER.combine(base, factor());
    }
    return base;
  }

  private Parameter atom() {
    skipSpaces();
    if (pos >= text.length()) {
      throw error("unexpected end of expression");
    }
    char c = text.charAt(pos);
    if (c == '(') {
      pos++;
      Parameter inner = expr();
      expect(")");
      return inner;
    }
    if (DIGIT.matches(c) || c == '.') {
      return number();
    }
    if (NAME_START.matches(c)) {
      String name = name();
      if (name.equals("nan")) {
        return new ConstantParameter(Double.NaN);
      }
      if (name.equals("inf")) {
        return new ConstantParameter(Double.POSITIVE_INFINITY);
      }
      if (name.equals("abs") && peek("(")) {
        expect("(");
        Parameter inner = expr();
        expect(")");
        return UnaryOp.ABS.applyTo(inner);
      }
      return resolver.apply(name).orElseThrow(ParameterErr::notLink);
    }
    throw error("unexpected character '" + c + "'");
  }

  private ConstantParameter number() {
    int start = pos;
    while (pos < text.length() && (DIGIT.matches(text.charAt(pos)) || text.charAt(pos) == '.')) {
      pos++;
    }
    if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
      pos++;
      if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
        pos++;
      }
      while (pos < text.length() && DIGIT.matches(text.charAt(pos))) {
        pos++;
      }
    }
    String literal = text.substring(start, pos);
    try {
      return new ConstantParameter(Double.parseDouble(literal));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid number \"%s\" in expression \"%s\"", literal, text), e);
    }
  }

  private String name() {
    int start = pos;
    while (pos < text.length() && NAME_PART.matches(text.charAt(pos))) {
      pos++;
    }
    return text.substring(start, pos);
  }

  private boolean peek(String token) {
    skipSpaces();
    return text.startsWith(token, pos);
  }

  private boolean consume(String token) {
    if (peek(token)) {
      pos += token.length();
      return true;
    }
    return false;
  }

  private void expect(String token) {
    if (!consume(token)) {
      throw error("expected '" + token + "'");
    }
  }

  private void skipSpaces() {
    while (pos < text.length() && CharMatcher.whitespace().matches(text.charAt(pos))) {
      pos++;
    }
  }

  private IllegalArgumentException error(String problem) {
    return new IllegalArgumentException(
        String.format("Cannot parse expression \"%s\" at position %d: %s", text, pos, problem));
  }
}
