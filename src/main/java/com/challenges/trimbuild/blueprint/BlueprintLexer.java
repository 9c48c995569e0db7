package com.challenges.trimbuild.blueprint;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Tokenizer for blueprint files.
 *
 * <p>Whitespace and both comment styles ({@code //} and {@code /* *}{@code /}) are
 * dropped. Strings keep their quotes and escapes verbatim and follow the CSS string
 * grammar: a backslash escapes any character, up to six hex digits form a Unicode
 * escape, and a backslash before a line break continues the string on the next line.
 */
public class BlueprintLexer {

    public MutableList<Token> tokenize(String text) {
        return new Scanner(text).scan();
    }

    private static final class Scanner {
        private final String text;
        private final MutableList<Token> tokens = Lists.mutable.empty();
        private int pos;
        private int line = 1;
        private int lineStart;

        private Scanner(String text) {
            this.text = text;
        }

        private MutableList<Token> scan() {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\n') {
                    newline(pos + 1);
                    pos++;
                } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                    pos++;
                } else if (c == '/' && peek(1) == '/') {
                    skipLineComment();
                } else if (c == '/' && peek(1) == '*') {
                    skipBlockComment();
                } else if (c == '"') {
                    scanString();
                } else if (isDigit(c)) {
                    scanInteger();
                } else if (isIdentStart(c)) {
                    scanIdent();
                } else {
                    scanPunctuation(c);
                }
            }
            return tokens;
        }

        private void scanPunctuation(char c) {
            Token.Type type = switch (c) {
                case '[' -> Token.Type.LBRACKET;
                case ']' -> Token.Type.RBRACKET;
                case '{' -> Token.Type.LBRACE;
                case '}' -> Token.Type.RBRACE;
                case ':' -> Token.Type.COLON;
                case ',' -> Token.Type.COMMA;
                case '=' -> Token.Type.EQUALS;
                case '+' -> Token.Type.PLUS;
                default -> throw new LexException("Illegal character '" + c + "'", line, column(pos));
            };
            emit(type, pos, pos + 1);
        }

        private void scanInteger() {
            int end = pos;
            while (end < text.length() && isDigit(text.charAt(end))) {
                end++;
            }
            emit(Token.Type.INTEGER, pos, end);
        }

        private void scanIdent() {
            int end = pos + 1;
            while (end < text.length() && isIdentPart(text.charAt(end))) {
                end++;
            }
            String word = text.substring(pos, end);
            Token.Type type = word.equals("true") || word.equals("false") ? Token.Type.BOOL : Token.Type.IDENT;
            emit(type, pos, end);
        }

        private void scanString() {
            int startLine = line;
            int startColumn = column(pos);
            int i = pos + 1;
            while (true) {
                if (i >= text.length()) {
                    throw new LexException("Unterminated string", startLine, startColumn);
                }
                char c = text.charAt(i);
                if (c == '"') {
                    break;
                }
                if (c == '\n' || c == '\r' || c == '\f') {
                    throw new LexException("Line break in string", line, column(i));
                }
                if (c == '\\') {
                    i = escape(i + 1, startLine, startColumn);
                } else {
                    i++;
                }
            }
            tokens.add(new Token(Token.Type.STRING, text.substring(pos, i + 1), startLine, startColumn));
            pos = i + 1;
        }

        /**
         * Consumes the escape sequence following a backslash and returns the index after it.
         */
        private int escape(int i, int startLine, int startColumn) {
            if (i >= text.length()) {
                throw new LexException("Unterminated string", startLine, startColumn);
            }
            char c = text.charAt(i);
            if (c == '\r' || c == '\n' || c == '\f') {
                return lineBreak(i);
            }
            if (Character.digit(c, 16) < 0) {
                return i + 1;
            }
            int end = i;
            while (end < text.length() && end - i < 6 && Character.digit(text.charAt(end), 16) >= 0) {
                end++;
            }
            if (end < text.length()) {
                char next = text.charAt(end);
                if (next == '\r' || next == '\n' || next == '\f') {
                    return lineBreak(end);
                }
                if (next == ' ' || next == '\t') {
                    return end + 1;
                }
            }
            return end;
        }

        // \r\n counts as one line break
        private int lineBreak(int i) {
            int end = text.startsWith("\r\n", i) ? i + 2 : i + 1;
            newline(end);
            return end;
        }

        private void skipLineComment() {
            while (pos < text.length() && text.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void skipBlockComment() {
            int end = text.indexOf("*/", pos + 2);
            if (end < 0) {
                throw new LexException("Unterminated comment", line, column(pos));
            }
            for (int i = pos; i < end; i++) {
                if (text.charAt(i) == '\n') {
                    newline(i + 1);
                }
            }
            pos = end + 2;
        }

        private void emit(Token.Type type, int start, int end) {
            tokens.add(new Token(type, text.substring(start, end), line, column(start)));
            pos = end;
        }

        private void newline(int nextLineStart) {
            line++;
            lineStart = nextLineStart;
        }

        private int column(int index) {
            return index - lineStart + 1;
        }

        private char peek(int offset) {
            int index = pos + offset;
            return index < text.length() ? text.charAt(index) : '\0';
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isIdentStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isIdentPart(char c) {
            return isIdentStart(c) || isDigit(c);
        }
    }
}
