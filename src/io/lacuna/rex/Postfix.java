package io.lacuna.rex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.logging.Level;
import java.util.logging.Logger;

import static io.lacuna.rex.Token.Kind.*;

/**
 * Shunting-yard conversion of an infix pattern into postfix order, with concatenation made explicit.
 */
public class Postfix {

  private static final Logger logger = Logger.getLogger("io.lacuna.rex");
  private static final Level level = Level.FINEST;

  private Postfix() {
  }

  public static IList<Token> convert(String regex) {
    return convert(regex, Tokenizer.tokenize(regex));
  }

  static IList<Token> convert(String regex, IList<Token> tokens) {
    Output out = new Output(regex);
    LinearList<Token> operators = new LinearList<>();
    Token prev = null;

    for (Token t : tokens) {
      switch (t.kind) {
        case LITERAL:
          concatenate(prev, operators, out);
          out.emit(t);
          break;

        case GROUP_OPEN:
          concatenate(prev, operators, out);
          operators.addLast(t);
          out.openGroup();
          break;

        case GROUP_CLOSE:
          while (operators.size() > 0 && operators.last().kind != GROUP_OPEN) {
            out.emit(operators.popLast());
          }
          if (operators.size() == 0) {
            throw RegexSyntaxException.unbalanced(regex, t.index);
          }
          out.closeGroup(operators.popLast());
          break;

        case STAR:
          if (prev == null || !prev.endsOperand()) {
            throw RegexSyntaxException.dangling(regex, t);
          }
          drain(t.kind.precedence, operators, out);
          operators.addLast(t);
          break;

        case UNION:
          drain(t.kind.precedence, operators, out);
          operators.addLast(t);
          break;

        default:
          throw new IllegalArgumentException("unexpected token in infix input: " + t.kind);
      }
      prev = t;
    }

    while (operators.size() > 0) {
      Token t = operators.popLast();
      if (t.kind == GROUP_OPEN) {
        throw RegexSyntaxException.unbalanced(regex, t.index);
      }
      out.emit(t);
    }

    IList<Token> postfix = out.finish();
    if (logger.isLoggable(level)) {
      logger.log(level, "postfix: " + regex + " -> " + Token.toString(postfix));
    }
    return postfix;
  }

  ///

  private static void concatenate(Token prev, LinearList<Token> operators, Output out) {
    if (prev != null && prev.endsOperand()) {
      drain(CONCAT.precedence, operators, out);
      operators.addLast(Token.operator(CONCAT, prev.index + 1));
    }
  }

  private static void drain(int precedence, LinearList<Token> operators, Output out) {
    while (operators.size() > 0 && operators.last().kind.precedence >= precedence) {
      out.emit(operators.popLast());
    }
  }

  // tracks how many operands each open group has produced, so missing operands are caught before the builder
  private static final class Output {
    private final String regex;
    private final LinearList<Token> tokens = new LinearList<>();
    private final LinearList<Integer> operands = LinearList.of(0);

    Output(String regex) {
      this.regex = regex;
    }

    void emit(Token t) {
      int available = operands.popLast();
      if (t.kind == LITERAL) {
        available++;
      } else {
        int arity = t.kind.arity();
        if (available < arity) {
          throw RegexSyntaxException.dangling(regex, t);
        }
        available -= arity - 1;
      }
      operands.addLast(available);
      tokens.addLast(t);
    }

    void openGroup() {
      operands.addLast(0);
    }

    void closeGroup(Token open) {
      int available = operands.popLast();
      if (available == 0) {
        throw RegexSyntaxException.empty(regex, open.index);
      }
      operands.addLast(operands.popLast() + 1);
    }

    IList<Token> finish() {
      if (operands.last() == 0) {
        throw RegexSyntaxException.empty(regex, -1);
      }
      return tokens;
    }
  }
}
