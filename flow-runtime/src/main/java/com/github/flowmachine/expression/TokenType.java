package com.github.flowmachine.expression;

/**
 * Lexical categories of the guard expression language.
 */
public enum TokenType {
  NUMBER, STRING, IDENT,
  OR("||"), AND("&&"), EQ("=="), NE("!="), GE(">="), LE("<="),
  GT(">"), LT("<"), NOT("!"), PLUS("+"), MINUS("-"), STAR("*"), SLASH("/"), PERCENT("%"),
  LPAREN("("), RPAREN(")"),
  EOF;

  private final String symbol;

  private TokenType() {
    this(null);
  }

  private TokenType(final String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}
