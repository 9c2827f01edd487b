package io.lacuna.rex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

import static io.lacuna.rex.Token.Kind.*;

/**
 * Splits a pattern into {@link Token}s. Letters and digits are literals; {@code ( ) | *} are operators; anything
 * else is rejected.
 */
public class Tokenizer {

  private Tokenizer() {
  }

  public static IList<Token> tokenize(String regex) {
    LinearList<Token> tokens = new LinearList<>();

    for (int i = 0; i < regex.length(); i++) {
      char c = regex.charAt(i);
      switch (c) {
        case '(':
          tokens.addLast(Token.operator(GROUP_OPEN, i));
          break;
        case ')':
          tokens.addLast(Token.operator(GROUP_CLOSE, i));
          break;
        case '|':
          tokens.addLast(Token.operator(UNION, i));
          break;
        case '*':
          tokens.addLast(Token.operator(STAR, i));
          break;
        default:
          if (!isLiteral(c)) {
            throw RegexSyntaxException.unsupported(regex, i);
          }
          tokens.addLast(Token.literal(c, i));
      }
    }

    return tokens;
  }

  public static boolean isLiteral(char c) {
    return Character.isLetterOrDigit(c);
  }

  /**
   * @return the distinct literal symbols of {@code regex}, in order of first appearance
   */
  public static ISet<Character> alphabet(String regex) {
    return alphabet(tokenize(regex));
  }

  static ISet<Character> alphabet(IList<Token> tokens) {
    LinearSet<Character> alphabet = new LinearSet<>();
    for (Token t : tokens) {
      if (t.kind == LITERAL) {
        alphabet.add(t.symbol);
      }
    }
    return alphabet;
  }
}
