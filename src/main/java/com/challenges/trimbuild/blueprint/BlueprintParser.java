package com.challenges.trimbuild.blueprint;

import com.challenges.trimbuild.blueprint.BlueprintNode.Expression;
import com.challenges.trimbuild.blueprint.BlueprintNode.MapLiteral;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Recursive-descent parser for blueprint files.
 *
 * <pre>
 * document   := rule*
 * rule       := ident '=' expr | ident '+=' expr | ident map
 * map        := '{' (pair (',' pair)* ','?)? '}'
 * pair       := ident (':' | '=') expr
 * list       := '[' (list_item (',' list_item)* ','?)? ']'
 * list_item  := (string | ident | map) ['+' (string | ident | map)]
 * expr       := ident | map | list | string | integer | bool | expr '+' expr
 * </pre>
 *
 * {@code +} is left-associative. Inside a list only a single {@code +} between two items
 * is accepted.
 */
public class BlueprintParser {
    private static final Logger log = LoggerFactory.getLogger(BlueprintParser.class);

    private final BlueprintLexer lexer = new BlueprintLexer();

    public Blueprint parse(String text) {
        MutableList<Token> tokens = lexer.tokenize(text);
        Blueprint blueprint = new TokenStream(tokens).document();
        log.debug("Parsed {} tokens into {} rules", tokens.size(), blueprint.size());
        return blueprint;
    }

    private static final class TokenStream {
        private final MutableList<Token> tokens;
        private int pos;

        private TokenStream(MutableList<Token> tokens) {
            this.tokens = tokens;
        }

        private Blueprint document() {
            MutableList<BlueprintNode.Rule> rules = Lists.mutable.empty();
            while (!atEnd()) {
                rules.add(rule());
            }
            return new Blueprint(rules);
        }

        private BlueprintNode.Rule rule() {
            BlueprintNode.Ident name = ident(expect(Token.Type.IDENT, "Expected a rule name, got"));
            Token next = peek();
            return switch (next.type()) {
                case EQUALS -> {
                    advance();
                    yield new BlueprintNode.Assignment(name, expr());
                }
                case PLUS -> {
                    advance();
                    expect(Token.Type.EQUALS, "Expected '=' after '+' in rule, got");
                    yield new BlueprintNode.CompoundAssignment(name, "+=", expr());
                }
                case LBRACE -> new BlueprintNode.Scope(name, map());
                default -> throw new ParseException("Expected '=', '+=' or '{' after rule name, got", next);
            };
        }

        private Expression expr() {
            Expression lhs = primary();
            while (check(Token.Type.PLUS)) {
                Token op = advance();
                lhs = new BlueprintNode.BinaryOperator(lhs, op.text(), primary());
            }
            return lhs;
        }

        private Expression primary() {
            Token token = peek();
            return switch (token.type()) {
                case IDENT -> ident(advance());
                case STRING -> new BlueprintNode.StringLiteral(advance().text());
                case INTEGER -> new BlueprintNode.IntegerLiteral(new BigInteger(advance().text()));
                case BOOL -> new BlueprintNode.BoolLiteral(Boolean.parseBoolean(advance().text()));
                case LBRACE -> map();
                case LBRACKET -> list();
                default -> throw new ParseException("Expected a value, got", token);
            };
        }

        private MapLiteral map() {
            expect(Token.Type.LBRACE, "Expected '{', got");
            MapLiteral map = MapLiteral.empty();
            while (!check(Token.Type.RBRACE)) {
                BlueprintNode.Ident key = ident(expect(Token.Type.IDENT, "Expected a map key, got"));
                Token delimiter = peek();
                if (!delimiter.is(Token.Type.COLON) && !delimiter.is(Token.Type.EQUALS)) {
                    throw new ParseException("Expected ':' or '=' after map key, got", delimiter);
                }
                advance();
                map.put(key, new BlueprintNode.MapValue(delimiter.text(), expr()));
                if (!check(Token.Type.RBRACE)) {
                    expect(Token.Type.COMMA, "Expected ',' or '}' in map, got");
                }
            }
            advance();
            return map;
        }

        private BlueprintNode.ListLiteral list() {
            expect(Token.Type.LBRACKET, "Expected '[', got");
            BlueprintNode.ListLiteral list = BlueprintNode.ListLiteral.empty();
            while (!check(Token.Type.RBRACKET)) {
                list.items().add(listItem());
                if (!check(Token.Type.RBRACKET)) {
                    expect(Token.Type.COMMA, "Expected ',' or ']' in list, got");
                }
            }
            advance();
            return list;
        }

        private Expression listItem() {
            Expression item = listOperand();
            if (check(Token.Type.PLUS)) {
                Token op = advance();
                item = new BlueprintNode.BinaryOperator(item, op.text(), listOperand());
            }
            return item;
        }

        private Expression listOperand() {
            Token token = peek();
            return switch (token.type()) {
                case STRING -> new BlueprintNode.StringLiteral(advance().text());
                case IDENT -> ident(advance());
                case LBRACE -> map();
                default -> throw new ParseException("Expected a string, identifier or map in list, got", token);
            };
        }

        private static BlueprintNode.Ident ident(Token token) {
            return new BlueprintNode.Ident(token.text());
        }

        private Token expect(Token.Type type, String message) {
            Token token = peek();
            if (!token.is(type)) {
                throw new ParseException(message, token);
            }
            return advance();
        }

        private boolean check(Token.Type type) {
            return !atEnd() && tokens.get(pos).is(type);
        }

        private boolean atEnd() {
            return pos >= tokens.size();
        }

        private Token peek() {
            if (atEnd()) {
                Token last = tokens.get(tokens.size() - 1);
                throw new ParseException("Unexpected end of input", last.line(), last.column() + last.text().length());
            }
            return tokens.get(pos);
        }

        private Token advance() {
            Token token = peek();
            pos++;
            return token;
        }
    }
}
