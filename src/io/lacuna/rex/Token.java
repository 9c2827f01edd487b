package io.lacuna.rex;

import io.lacuna.bifurcan.IList;

/**
 * A single lexical unit of a pattern, tagged with the index it was read from.
 */
public final class Token {

  public enum Kind {
    LITERAL(-1),
    GROUP_OPEN(0),
    GROUP_CLOSE(-1),
    UNION(1),
    CONCAT(2),
    STAR(3);

    /**
     * the binding strength of the operator on the conversion stack, or {@code -1} if it never sits there
     */
    public final int precedence;

    Kind(int precedence) {
      this.precedence = precedence;
    }

    /**
     * @return the number of fragments the operator consumes
     */
    public int arity() {
      switch (this) {
        case STAR:
          return 1;
        case UNION:
        case CONCAT:
          return 2;
        default:
          return 0;
      }
    }
  }

  public final Kind kind;
  public final char symbol;
  public final int index;

  private Token(Kind kind, char symbol, int index) {
    this.kind = kind;
    this.symbol = symbol;
    this.index = index;
  }

  public static Token literal(char symbol, int index) {
    return new Token(Kind.LITERAL, symbol, index);
  }

  public static Token operator(Kind kind, int index) {
    if (kind == Kind.LITERAL) {
      throw new IllegalArgumentException("literals must carry a symbol");
    }
    return new Token(kind, symbolOf(kind), index);
  }

  private static char symbolOf(Kind kind) {
    switch (kind) {
      case GROUP_OPEN:
        return '(';
      case GROUP_CLOSE:
        return ')';
      case UNION:
        return '|';
      case STAR:
        return '*';
      case CONCAT:
        return '.';
      default:
        throw new IllegalArgumentException(kind.toString());
    }
  }

  // concatenation is implied before a literal or group that follows one of these
  boolean endsOperand() {
    return kind == Kind.LITERAL || kind == Kind.GROUP_CLOSE || kind == Kind.STAR;
  }

  /**
   * @return the tokens rendered back to pattern characters, with {@code .} for explicit concatenation
   */
  public static String toString(IList<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    tokens.forEach(t -> sb.append(t.symbol));
    return sb.toString();
  }

  @Override
  public String toString() {
    return String.valueOf(symbol);
  }
}
