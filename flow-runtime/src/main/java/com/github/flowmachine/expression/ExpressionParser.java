package com.github.flowmachine.expression;

import java.util.List;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;

/**
 * Recursive-descent parser for guard expressions. Precedence, loosest first:
 * {@code ||}, {@code &&}, equality, relational, additive, multiplicative, unary. All binary levels
 * associate to the left.
 */
public final class ExpressionParser {
  private final String source;
  private final List<Token> tokens;
  private int cursor;

  private ExpressionParser(final String source, final List<Token> tokens) {
    this.source = source;
    this.tokens = tokens;
  }

  public static Node parse(final String source) throws FlowException {
    final ExpressionParser parser = new ExpressionParser(source, Tokenizer.tokenize(source));
    final Node root = parser.or();
    if (parser.peek().getType() != TokenType.EOF) {
      throw parser.error("Unexpected '" + parser.peek().getText() + "'");
    }
    return root;
  }

  private Node or() throws FlowException {
    Node node = and();
    while (match(TokenType.OR)) {
      node = new BinaryNode(TokenType.OR, node, and());
    }
    return node;
  }

  private Node and() throws FlowException {
    Node node = equality();
    while (match(TokenType.AND)) {
      node = new BinaryNode(TokenType.AND, node, equality());
    }
    return node;
  }

  private Node equality() throws FlowException {
    Node node = relational();
    while (peekAny(TokenType.EQ, TokenType.NE)) {
      final TokenType operator = advance().getType();
      node = new BinaryNode(operator, node, relational());
    }
    return node;
  }

  private Node relational() throws FlowException {
    Node node = additive();
    while (peekAny(TokenType.GT, TokenType.LT, TokenType.GE, TokenType.LE)) {
      final TokenType operator = advance().getType();
      node = new BinaryNode(operator, node, additive());
    }
    return node;
  }

  private Node additive() throws FlowException {
    Node node = multiplicative();
    while (peekAny(TokenType.PLUS, TokenType.MINUS)) {
      final TokenType operator = advance().getType();
      node = new BinaryNode(operator, node, multiplicative());
    }
    return node;
  }

  private Node multiplicative() throws FlowException {
    Node node = unary();
    while (peekAny(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
      final TokenType operator = advance().getType();
      node = new BinaryNode(operator, node, unary());
    }
    return node;
  }

  private Node unary() throws FlowException {
    if (peekAny(TokenType.NOT, TokenType.MINUS)) {
      final TokenType operator = advance().getType();
      return new UnaryNode(operator, unary());
    }
    return primary();
  }

  private Node primary() throws FlowException {
    final Token token = peek();
    switch (token.getType()) {
      case NUMBER:
        advance();
        try {
          return new LiteralNode(Value.of(Double.parseDouble(token.getText())));
        } catch (NumberFormatException malformed) {
          throw error("Malformed number '" + token.getText() + "'");
        }
      case STRING:
        advance();
        return new LiteralNode(Value.of(token.getText()));
      case IDENT:
        advance();
        if ("true".equals(token.getText())) {
          return new LiteralNode(Value.TRUE);
        }
        if ("false".equals(token.getText())) {
          return new LiteralNode(Value.FALSE);
        }
        return new IdentifierNode(token.getText());
      case LPAREN:
        advance();
        final Node inner = or();
        if (!match(TokenType.RPAREN)) {
          throw error("Expected ')'");
        }
        return inner;
      case EOF:
        throw error("Unexpected end of expression");
      default:
        throw error("Unexpected '" + token.getText() + "'");
    }
  }

  private Token peek() {
    return tokens.get(cursor);
  }

  private boolean peekAny(final TokenType... types) {
    final TokenType current = peek().getType();
    for (final TokenType type : types) {
      if (current == type) {
        return true;
      }
    }
    return false;
  }

  private Token advance() {
    final Token token = tokens.get(cursor);
    if (token.getType() != TokenType.EOF) {
      cursor++;
    }
    return token;
  }

  private boolean match(final TokenType type) {
    if (peek().getType() == type) {
      advance();
      return true;
    }
    return false;
  }

  private FlowException error(final String message) {
    return new FlowException(Code.INVALID_EXPRESSION,
        message + " at position " + peek().getPosition() + " in: " + source);
  }
}
