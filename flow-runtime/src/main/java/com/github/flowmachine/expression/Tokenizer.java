package com.github.flowmachine.expression;

import java.util.ArrayList;
import java.util.List;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;

/**
 * Splits guard source text into tokens. Two-character operators are matched before their
 * one-character prefixes; string literals have no escapes.
 */
public final class Tokenizer {
  private static final TokenType[] twoCharOperators =
      {TokenType.OR, TokenType.AND, TokenType.EQ, TokenType.NE, TokenType.GE, TokenType.LE};
  private static final TokenType[] oneCharOperators =
      {TokenType.GT, TokenType.LT, TokenType.NOT, TokenType.PLUS, TokenType.MINUS, TokenType.STAR,
          TokenType.SLASH, TokenType.PERCENT, TokenType.LPAREN, TokenType.RPAREN};

  private final String source;
  private int cursor;

  private Tokenizer(final String source) {
    this.source = source;
  }

  /**
   * Tokenize the source. The returned list always ends with an EOF token.
   */
  public static List<Token> tokenize(final String source) throws FlowException {
    return new Tokenizer(source == null ? "" : source).run();
  }

  private List<Token> run() throws FlowException {
    final List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (cursor >= source.length()) {
        tokens.add(new Token(TokenType.EOF, "", cursor));
        return tokens;
      }
      tokens.add(next());
    }
  }

  private Token next() throws FlowException {
    final int start = cursor;
    final char c = source.charAt(cursor);
    if (isIdentifierStart(c)) {
      while (cursor < source.length() && isIdentifierPart(source.charAt(cursor))) {
        cursor++;
      }
      return new Token(TokenType.IDENT, source.substring(start, cursor), start);
    }
    if (isDigit(c) || (c == '.' && cursor + 1 < source.length()
        && isDigit(source.charAt(cursor + 1)))) {
      while (cursor < source.length()
          && (isDigit(source.charAt(cursor)) || source.charAt(cursor) == '.')) {
        cursor++;
      }
      return new Token(TokenType.NUMBER, source.substring(start, cursor), start);
    }
    if (c == '"') {
      final int close = source.indexOf('"', cursor + 1);
      if (close < 0) {
        throw new FlowException(Code.INVALID_EXPRESSION,
            "Unterminated string literal at position " + start + " in: " + source);
      }
      cursor = close + 1;
      return new Token(TokenType.STRING, source.substring(start + 1, close), start);
    }
    for (final TokenType operator : twoCharOperators) {
      if (source.startsWith(operator.getSymbol(), cursor)) {
        cursor += 2;
        return new Token(operator, operator.getSymbol(), start);
      }
    }
    for (final TokenType operator : oneCharOperators) {
      if (operator.getSymbol().charAt(0) == c) {
        cursor++;
        return new Token(operator, operator.getSymbol(), start);
      }
    }
    throw new FlowException(Code.INVALID_EXPRESSION,
        "Unexpected character '" + c + "' at position " + start + " in: " + source);
  }

  private void skipWhitespace() {
    while (cursor < source.length() && Character.isWhitespace(source.charAt(cursor))) {
      cursor++;
    }
  }

  static boolean isIdentifierStart(final char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  static boolean isIdentifierPart(final char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  private static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }
}
