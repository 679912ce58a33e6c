package org.jsguard;

/*
 * Lexical analysis and token construction.
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSet;

/*
 * Lexer for JSGuard.
 *
 * This object does a char-by-char scan of the provided source code
 * and produces a sequence of tokens:
 *
 *   List<Token> tokens = new Lexer("let i = 0;").tokenize();
 *
 * The scan never fails. Characters the lexer does not understand become
 * UNKNOWN tokens, unterminated strings and block comments run to the end of
 * input, and the returned list always ends with exactly one EOF token.
 */
public class Lexer
{
	private static final Set<String> KEYWORDS = ImmutableSet.of(
		"var", "let", "const", "function", "return", "if", "else", "for", "while"
	);

	private static final String OPERATOR_CHARS = "+-*/%=<>!&|^~";

	private static final Map<String, TokenKind> operators;
	private static final Map<String, TokenKind> punctuators;
	static
	{
		Map<String, TokenKind> ops = new HashMap<String, TokenKind>();

		// 3-character operators: === !== >>> <<= >>= **=
		ops.put("===", TokenKind.COMPARISON);
		ops.put("!==", TokenKind.COMPARISON);
		ops.put(">>>", TokenKind.ARITHMETIC);
		ops.put("<<=", TokenKind.ASSIGNMENT);
		ops.put(">>=", TokenKind.ASSIGNMENT);
		ops.put("**=", TokenKind.ASSIGNMENT);

		// 2-character operators
		ops.put("==", TokenKind.COMPARISON);
		ops.put("!=", TokenKind.COMPARISON);
		ops.put("<=", TokenKind.COMPARISON);
		ops.put(">=", TokenKind.COMPARISON);
		ops.put("&&", TokenKind.LOGICAL);
		ops.put("||", TokenKind.LOGICAL);
		ops.put("++", TokenKind.UNARY);
		ops.put("--", TokenKind.UNARY);
		ops.put("+=", TokenKind.ASSIGNMENT);
		ops.put("-=", TokenKind.ASSIGNMENT);
		ops.put("*=", TokenKind.ASSIGNMENT);
		ops.put("/=", TokenKind.ASSIGNMENT);
		ops.put("%=", TokenKind.ASSIGNMENT);
		ops.put("&=", TokenKind.ASSIGNMENT);
		ops.put("|=", TokenKind.ASSIGNMENT);
		ops.put("^=", TokenKind.ASSIGNMENT);
		ops.put("<<", TokenKind.ARITHMETIC);
		ops.put(">>", TokenKind.ARITHMETIC);
		ops.put("**", TokenKind.ARITHMETIC);

		// 1-character operators
		ops.put("+", TokenKind.ARITHMETIC);
		ops.put("-", TokenKind.ARITHMETIC);
		ops.put("*", TokenKind.ARITHMETIC);
		ops.put("/", TokenKind.ARITHMETIC);
		ops.put("%", TokenKind.ARITHMETIC);
		ops.put("=", TokenKind.ASSIGNMENT);
		ops.put("<", TokenKind.COMPARISON);
		ops.put(">", TokenKind.COMPARISON);
		ops.put("!", TokenKind.UNARY);
		ops.put("~", TokenKind.UNARY);
		ops.put("&", TokenKind.ARITHMETIC);
		ops.put("|", TokenKind.ARITHMETIC);
		ops.put("^", TokenKind.ARITHMETIC);

		operators = Collections.unmodifiableMap(ops);

		Map<String, TokenKind> punct = new HashMap<String, TokenKind>();
		punct.put(";", TokenKind.SEMICOLON);
		punct.put(",", TokenKind.COMMA);
		punct.put(".", TokenKind.DOT);
		punct.put(":", TokenKind.COLON);
		punct.put("(", TokenKind.LPAREN);
		punct.put(")", TokenKind.RPAREN);
		punct.put("{", TokenKind.LBRACE);
		punct.put("}", TokenKind.RBRACE);
		punct.put("[", TokenKind.LBRACKET);
		punct.put("]", TokenKind.RBRACKET);

		punctuators = Collections.unmodifiableMap(punct);
	}

	private final String input;
	private int position = 0;
	private int line = 1;
	private int column = 1;

	public Lexer(String source)
	{
		this.input = StringUtils.defaultString(source);
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public static boolean isKeyword(String value)
	{
		return KEYWORDS.contains(value);
	}

	/*
	 * Return the character i positions ahead without moving the pointer,
	 * or an empty string past the end of input.
	 */
	private String peek(int i)
	{
		int pos = position + i;
		return pos < input.length() ? String.valueOf(input.charAt(pos)) : "";
	}

	private String peek()
	{
		return peek(0);
	}

	private boolean isExhausted()
	{
		return position >= input.length();
	}

	/*
	 * Move the char pointer forward i times, keeping line and column in step.
	 */
	private void skip(int i)
	{
		for (int n = 0; n < i && !isExhausted(); n++)
		{
			if (input.charAt(position) == '\n')
			{
				line++;
				column = 1;
			}
			else
			{
				column++;
			}
			position++;
		}
	}

	private void skip()
	{
		skip(1);
	}

	private static boolean isIdentifierStart(char ch)
	{
		return CharUtils.isAsciiAlpha(ch) || ch == '_' || ch == '$';
	}

	private static boolean isIdentifierPart(char ch)
	{
		return CharUtils.isAsciiAlphanumeric(ch) || ch == '_' || ch == '$';
	}

	/*
	 * Extract a comment out of the next sequence of characters. The body is
	 * stored trimmed and without its delimiters. A block comment that is never
	 * closed absorbs the rest of the input.
	 */
	private Token scanComment()
	{
		int startLine = line;
		int startColumn = column;
		StringBuilder body = new StringBuilder();

		if (peek(1).equals("/"))
		{
			skip(2);
			while (!isExhausted() && !peek().equals("\n"))
			{
				body.append(peek());
				skip();
			}
		}
		else
		{
			skip(2);
			while (!isExhausted())
			{
				if (peek().equals("*") && peek(1).equals("/"))
				{
					skip(2);
					break;
				}
				body.append(peek());
				skip();
			}
		}

		return new Token(TokenKind.COMMENT, StringUtils.trim(body.toString()), startLine, startColumn);
	}

	/*
	 * Extract a string literal. A backslash keeps the next character verbatim,
	 * escape sequences are not interpreted. An unterminated string runs to the
	 * end of input and is still returned as a STRING token.
	 */
	private Token scanStringLiteral()
	{
		int startLine = line;
		int startColumn = column;
		String quote = peek();
		StringBuilder value = new StringBuilder();

		skip();

		while (!isExhausted() && !peek().equals(quote))
		{
			if (peek().equals("\\"))
			{
				skip();
				if (!isExhausted())
				{
					value.append(peek());
					skip();
				}
				continue;
			}

			value.append(peek());
			skip();
		}

		// Closing quote
		if (!isExhausted())
		{
			skip();
		}

		return new Token(TokenKind.STRING, value.toString(), startLine, startColumn);
	}

	/*
	 * Extract a decimal number: digits with at most one decimal point. A
	 * second point ends the literal and is scanned as a separate token.
	 */
	private Token scanNumericLiteral()
	{
		int startLine = line;
		int startColumn = column;
		StringBuilder value = new StringBuilder();
		boolean hasDecimal = false;

		while (!isExhausted())
		{
			char ch = input.charAt(position);
			if (ch == '.')
			{
				if (hasDecimal) break;
				hasDecimal = true;
			}
			else if (!CharUtils.isAsciiNumeric(ch))
			{
				break;
			}

			value.append(ch);
			skip();
		}

		return new Token(TokenKind.NUMBER, value.toString(), startLine, startColumn);
	}

	/*
	 * Extract an identifier and classify it. Only the fixed keyword set is
	 * recognized, every other reserved word stays an identifier.
	 */
	private Token scanIdentifier()
	{
		int startLine = line;
		int startColumn = column;
		int start = position;

		while (!isExhausted() && isIdentifierPart(input.charAt(position)))
		{
			skip();
		}

		String value = input.substring(start, position);

		switch (value)
		{
		case "true":
		case "false":
			return new Token(TokenKind.BOOLEAN, value, startLine, startColumn);
		case "null":
			return new Token(TokenKind.NULL, value, startLine, startColumn);
		default:
			return new Token(isKeyword(value) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, value, startLine, startColumn);
		}
	}

	/*
	 * Extract an operator using maximal munch: the 3-character spelling is
	 * tried before the 2-character one, and that before a single character.
	 */
	private Token scanOperator()
	{
		int startLine = line;
		int startColumn = column;

		for (int length = 3; length > 0; length--)
		{
			if (position + length > input.length())
			{
				continue;
			}

			String candidate = input.substring(position, position + length);
			TokenKind kind = operators.get(candidate);
			if (kind != null)
			{
				skip(length);
				return new Token(kind, candidate, startLine, startColumn);
			}
		}

		String ch = peek();
		skip();
		return new Token(TokenKind.UNKNOWN, ch, startLine, startColumn);
	}

	/*
	 * Produce the next token, or EOF once the input is exhausted.
	 */
	public Token next()
	{
		while (!isExhausted())
		{
			String ch = peek();
			int startLine = line;
			int startColumn = column;

			switch (ch)
			{
			case " ":
			case "\t":
			case "\r":
				skip();
				continue;
			case "\n":
				skip();
				return new Token(TokenKind.NEWLINE, "\n", startLine, startColumn);
			case "\"":
			case "'":
			case "`":
				return scanStringLiteral();
			}

			if (ch.equals("/") && (peek(1).equals("/") || peek(1).equals("*")))
			{
				return scanComment();
			}

			char c = ch.charAt(0);

			if (CharUtils.isAsciiNumeric(c))
			{
				return scanNumericLiteral();
			}

			if (isIdentifierStart(c))
			{
				return scanIdentifier();
			}

			TokenKind punctuator = punctuators.get(ch);
			if (punctuator != null)
			{
				skip();
				return new Token(punctuator, ch, startLine, startColumn);
			}

			if (OPERATOR_CHARS.indexOf(c) >= 0)
			{
				return scanOperator();
			}

			skip();
			return new Token(TokenKind.UNKNOWN, ch, startLine, startColumn);
		}

		return new Token(TokenKind.EOF, "", line, column);
	}

	/*
	 * Scan the whole input. The result holds comments and newlines too and
	 * always ends with a single EOF token.
	 */
	public List<Token> tokenize()
	{
		List<Token> tokens = new ArrayList<Token>();
		Token token;

		do
		{
			token = next();
			tokens.add(token);
		}
		while (!token.is(TokenKind.EOF));

		return tokens;
	}
}
