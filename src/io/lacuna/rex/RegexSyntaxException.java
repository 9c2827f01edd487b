package io.lacuna.rex;

import java.util.regex.PatternSyntaxException;

/**
 * Raised when a pattern cannot be compiled because of the user's input.
 */
public class RegexSyntaxException extends PatternSyntaxException {

  private static final long serialVersionUID = 3307451921860213457L;

  public enum Kind {
    UNBALANCED_PARENTHESES,
    DANGLING_OPERATOR,
    EMPTY_EXPRESSION,
    UNSUPPORTED_SYMBOL
  }

  public final Kind kind;

  public RegexSyntaxException(Kind kind, String description, String regex, int index) {
    super(description, regex, index);
    this.kind = kind;
  }

  static RegexSyntaxException unbalanced(String regex, int index) {
    char c = regex.charAt(index);
    return new RegexSyntaxException(
            Kind.UNBALANCED_PARENTHESES,
            c == '(' ? "unclosed group" : "unmatched closing ')'",
            regex,
            index);
  }

  static RegexSyntaxException dangling(String regex, Token operator) {
    return new RegexSyntaxException(
            Kind.DANGLING_OPERATOR,
            "dangling operator '" + operator.symbol + "' is missing an operand",
            regex,
            operator.index);
  }

  static RegexSyntaxException empty(String regex, int index) {
    return new RegexSyntaxException(
            Kind.EMPTY_EXPRESSION,
            index < 0 ? "empty pattern" : "empty group",
            regex,
            index);
  }

  static RegexSyntaxException unsupported(String regex, int index) {
    return new RegexSyntaxException(
            Kind.UNSUPPORTED_SYMBOL,
            "unsupported symbol '" + regex.charAt(index) + "'",
            regex,
            index);
  }
}
