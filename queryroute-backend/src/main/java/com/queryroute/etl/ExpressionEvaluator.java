package com.queryroute.etl;

import com.queryroute.util.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Arithmetic over row fields: numbers, field names, {@code + - * /}, parentheses and unary minus.
 *
 * <p>Any other token is rejected when the formula is compiled. A null or non-numeric operand, or a division
 * by zero, evaluates to null.
 */
public final class ExpressionEvaluator {
    private final String formula;
    private final Node root;

    private ExpressionEvaluator(String formula, Node root) {
        this.formula = formula;
        this.root = root;
    }

    /**
     * @throws IllegalArgumentException when the formula contains anything outside the supported grammar
     */
    public static ExpressionEvaluator compile(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new IllegalArgumentException("Formula is blank");
        }
        Parser parser = new Parser(tokenize(formula));
        Node root = parser.expression();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("Unexpected token '" + parser.peek().text + "' in formula: " + formula);
        }
        return new ExpressionEvaluator(formula, root);
    }

    public Double evaluate(Map<String, Object> row) {
        return root.eval(row);
    }

    public Set<String> fields() {
        Set<String> names = new TreeSet<>();
        root.collectFields(names);
        return names;
    }

    public String getFormula() {
        return formula;
    }

    private static List<Token> tokenize(String s) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
                int start = i;
                while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                    i++;
                }
                String text = s.substring(start, i);
                try {
                    tokens.add(new Token(TokenType.NUMBER, text, Double.parseDouble(text)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Malformed number '" + text + "' in formula: " + s, e);
                }
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.FIELD, s.substring(start, i), 0));
            } else if ("+-*/()".indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c), 0));
                i++;
            } else {
                throw new IllegalArgumentException("Unsupported character '" + c + "' in formula: " + s);
            }
        }
        return tokens;
    }

    private enum TokenType {
        NUMBER,
        FIELD,
        SYMBOL
    }

    private record Token(TokenType type, String text, double number) {
    }

    private interface Node {
        Double eval(Map<String, Object> row);

        default void collectFields(Set<String> names) {
        }
    }

    // expression := term (('+' | '-') term)*
    // term       := factor (('*' | '/') factor)*
    // factor     := '-' factor | NUMBER | FIELD | '(' expression ')'
    private static final class Parser {
        private final List<Token> tokens;
        private int pos;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return tokens.get(pos);
        }

        private boolean acceptSymbol(String symbol) {
            if (!atEnd() && peek().type == TokenType.SYMBOL && peek().text.equals(symbol)) {
                pos++;
                return true;
            }
            return false;
        }

        Node expression() {
            Node left = term();
            while (true) {
                if (acceptSymbol("+")) {
                    left = binary(left, term(), '+');
                } else if (acceptSymbol("-")) {
                    left = binary(left, term(), '-');
                } else {
                    return left;
                }
            }
        }

        private Node term() {
            Node left = factor();
            while (true) {
                if (acceptSymbol("*")) {
                    left = binary(left, factor(), '*');
                } else if (acceptSymbol("/")) {
                    left = binary(left, factor(), '/');
                } else {
                    return left;
                }
            }
        }

        private Node factor() {
            if (atEnd()) {
                throw new IllegalArgumentException("Formula ends unexpectedly");
            }
            if (acceptSymbol("-")) {
                Node operand = factor();
                return new Node() {
                    @Override
                    public Double eval(Map<String, Object> row) {
                        Double v = operand.eval(row);
                        return v == null ? null : -v;
                    }

                    @Override
                    public void collectFields(Set<String> names) {
                        operand.collectFields(names);
                    }
                };
            }
            if (acceptSymbol("(")) {
                Node inner = expression();
                if (!acceptSymbol(")")) {
                    throw new IllegalArgumentException("Missing closing parenthesis");
                }
                return inner;
            }
            Token token = tokens.get(pos++);
            switch (token.type) {
                case NUMBER:
                    double value = token.number;
                    return row -> value;
                case FIELD:
                    String name = token.text;
                    return new Node() {
                        @Override
                        public Double eval(Map<String, Object> row) {
                            return Values.toDouble(row.get(name));
                        }

                        @Override
                        public void collectFields(Set<String> names) {
                            names.add(name);
                        }
                    };
                default:
                    throw new IllegalArgumentException("Unexpected token '" + token.text + "'");
            }
        }

        private static Node binary(Node left, Node right, char op) {
            return new Node() {
                @Override
                public Double eval(Map<String, Object> row) {
                    Double a = left.eval(row);
                    Double b = right.eval(row);
                    if (a == null || b == null) {
                        return null;
                    }
                    switch (op) {
                        case '+':
                            return a + b;
                        case '-':
                            return a - b;
                        case '*':
                            return a * b;
                        default:
                            return b == 0 ? null : a / b;
                    }
                }

                @Override
                public void collectFields(Set<String> names) {
                    left.collectFields(names);
                    right.collectFields(names);
                }
            };
        }
    }
}
