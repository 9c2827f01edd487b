package io.lacuna.rex;

import junit.framework.TestCase;

import static io.lacuna.rex.RegexSyntaxException.Kind.*;
import static io.lacuna.rex.RexAssert.assertSyntaxError;

public class PostfixTestCase extends TestCase {

  private static String postfix(String regex) {
    return Token.toString(Postfix.convert(regex));
  }

  public void testConcatenation() {
    assertEquals("a", postfix("a"));
    assertEquals("ab.", postfix("ab"));
    assertEquals("ab.c.", postfix("abc"));
  }

  public void testPrecedence() {
    assertEquals("ab|", postfix("a|b"));
    assertEquals("ab.c|", postfix("ab|c"));
    assertEquals("abc.|", postfix("a|bc"));
    assertEquals("ab*.", postfix("ab*"));
    assertEquals("a*", postfix("a*"));
    assertEquals("a**", postfix("a**"));
  }

  public void testGroups() {
    assertEquals("ab.*", postfix("(ab)*"));
    assertEquals("ab|*a.b.b.", postfix("(a|b)*abb"));
    assertEquals("a*b.", postfix("(a)*(b)"));
    assertEquals("ab|c.", postfix("(a|b)c"));
    assertEquals("abc|.", postfix("a(b|c)"));
    assertEquals("a", postfix("((a))"));
  }

  public void testUnbalancedParentheses() {
    assertSyntaxError("(a|b", UNBALANCED_PARENTHESES, 0);
    assertSyntaxError("((a)", UNBALANCED_PARENTHESES, 0);
    assertSyntaxError("a)", UNBALANCED_PARENTHESES, 1);
    assertSyntaxError("(a))b", UNBALANCED_PARENTHESES, 3);
  }

  public void testDanglingOperators() {
    assertSyntaxError("a|", DANGLING_OPERATOR, 1);
    assertSyntaxError("|a", DANGLING_OPERATOR, 0);
    assertSyntaxError("*a", DANGLING_OPERATOR, 0);
    assertSyntaxError("a||b", DANGLING_OPERATOR, 1);
    assertSyntaxError("(|a)", DANGLING_OPERATOR, 1);
    assertSyntaxError("(a|)b", DANGLING_OPERATOR, 2);
    assertSyntaxError("(*)", DANGLING_OPERATOR, 1);
    assertSyntaxError("a|*b", DANGLING_OPERATOR, 2);
  }

  public void testEmptyExpressions() {
    assertSyntaxError("", EMPTY_EXPRESSION, -1);
    assertSyntaxError("()", EMPTY_EXPRESSION, 0);
    assertSyntaxError("a()", EMPTY_EXPRESSION, 1);
  }

  public void testErrorMessagesNameTheConstruct() {
    try {
      Postfix.convert("ab|");
      fail();
    } catch (RegexSyntaxException e) {
      assertTrue(e.getMessage(), e.getDescription().contains("'|'"));
    }
  }
}
