package org.jsguard;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jsguard.ast.ArrayExpression;
import org.jsguard.ast.AssignmentExpression;
import org.jsguard.ast.BinaryExpression;
import org.jsguard.ast.BlockStatement;
import org.jsguard.ast.CallExpression;
import org.jsguard.ast.ExpressionStatement;
import org.jsguard.ast.ForStatement;
import org.jsguard.ast.FunctionDeclaration;
import org.jsguard.ast.Identifier;
import org.jsguard.ast.IfStatement;
import org.jsguard.ast.Literal;
import org.jsguard.ast.MemberExpression;
import org.jsguard.ast.Node;
import org.jsguard.ast.ObjectExpression;
import org.jsguard.ast.Program;
import org.jsguard.ast.Property;
import org.jsguard.ast.ReturnStatement;
import org.jsguard.ast.UnaryExpression;
import org.jsguard.ast.VariableDeclaration;
import org.jsguard.ast.VariableDeclarator;
import org.jsguard.ast.WhileStatement;

import com.google.common.collect.ImmutableSet;

/*
 * Recursive-descent parser for the JavaScript subset JSGuard understands.
 *
 * Every nonterminal has one method. Binary operators are parsed by
 * precedence climbing, one level per method from logical OR down to
 * multiplication, all left-associative; assignment is right-associative.
 *
 * Syntax errors never escape parse(). When a required token is missing the
 * diagnostic is recorded, the offending token is discarded and the parser
 * skips ahead to the next statement boundary (panic mode). The statement that
 * failed is dropped.
 */
public class Parser
{
	private static final Set<String> STATEMENT_KEYWORDS = ImmutableSet.of(
		"function", "var", "let", "const", "if", "while", "for", "return"
	);

	private static final String[] EQUALITY_OPERATORS = {"==", "!=", "===", "!=="};
	private static final String[] RELATIONAL_OPERATORS = {"<", ">", "<=", ">="};
	private static final String[] ADDITIVE_OPERATORS = {"+", "-"};
	private static final String[] MULTIPLICATIVE_OPERATORS = {"*", "/", "%"};
	private static final String[] PREFIX_OPERATORS = {"!", "~", "++", "--", "-", "+"};
	private static final String[] UPDATE_OPERATORS = {"++", "--"};

	private final List<Token> tokens;
	private final List<String> errors = new ArrayList<String>();
	private int position = 0;
	private int blockDepth = 0;

	public Parser(List<Token> source)
	{
		tokens = new ArrayList<Token>();
		Token end = null;

		if (source != null)
		{
			for (Token token : source)
			{
				if (token.is(TokenKind.COMMENT) || token.is(TokenKind.NEWLINE))
				{
					continue;
				}
				if (token.is(TokenKind.EOF))
				{
					end = token;
					break;
				}
				tokens.add(token);
			}
		}

		// A stream cut short of its EOF still gets one, placed after the last token
		if (end == null)
		{
			Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
			end = last != null ? new Token(TokenKind.EOF, "", last.getLine(), last.getColumn() + last.getText().length()) : new Token(TokenKind.EOF, "", 1, 1);
		}
		tokens.add(end);
	}

	public ParseResult parse()
	{
		List<Node> body = new ArrayList<Node>();
		position = 0;
		blockDepth = 0;
		errors.clear();

		statements(body);

		return new ParseResult(new Program(body, 1, 1), errors);
	}

	// TOKEN STREAM

	private Token current()
	{
		return tokens.get(Math.min(position, tokens.size() - 1));
	}

	private void advance()
	{
		if (position < tokens.size() - 1)
		{
			position++;
		}
	}

	private boolean check(TokenKind kind)
	{
		return current().is(kind);
	}

	private boolean check(TokenKind kind, String text)
	{
		return current().is(kind, text);
	}

	private boolean checkAny(TokenKind kind, String... texts)
	{
		return check(kind) && ArrayUtils.contains(texts, current().getText());
	}

	private boolean isStatementKeyword(Token token)
	{
		return token.is(TokenKind.KEYWORD) && STATEMENT_KEYWORDS.contains(token.getText());
	}

	private Token consume(TokenKind kind) throws JSGuardException
	{
		if (!check(kind))
		{
			throw expected(kind.toString());
		}

		Token token = current();
		advance();
		return token;
	}

	private Token consume(TokenKind kind, String text) throws JSGuardException
	{
		if (!check(kind, text))
		{
			throw expected("'" + text + "'");
		}

		Token token = current();
		advance();
		return token;
	}

	private JSGuardException expected(String what)
	{
		Token actual = current();
		return new JSGuardException("Expected " + what + ", got " + actual.describe() + " at " + actual.getLine() + ":" + actual.getColumn(),
			actual.getLine(), actual.getColumn());
	}

	// ERROR RECOVERY

	/*
	 * Discard the offending token, then skip to the next statement boundary:
	 * just past a ';', or in front of a statement keyword or the end of input.
	 * Braces the failing statement opened are skipped in pairs; inside a block
	 * the '}' that closes it is a boundary as well and is left for the block
	 * to consume.
	 */
	private void synchronize(int openBraces)
	{
		int depth = openBraces;

		if (closesBlock(depth))
		{
			return;
		}
		depth = skip(depth);

		while (!check(TokenKind.EOF))
		{
			if (check(TokenKind.SEMICOLON))
			{
				advance();
				return;
			}

			if (closesBlock(depth) || isStatementKeyword(current()))
			{
				return;
			}

			depth = skip(depth);
		}
	}

	private boolean closesBlock(int depth)
	{
		return depth == 0 && blockDepth > 0 && check(TokenKind.RBRACE);
	}

	private int skip(int depth)
	{
		int result = depth;
		if (check(TokenKind.LBRACE))
		{
			result++;
		}
		else if (check(TokenKind.RBRACE) && depth > 0)
		{
			result--;
		}

		advance();
		return result;
	}

	// braces opened and not yet closed since the token at start
	private int openBraces(int start)
	{
		int depth = 0;
		for (int i = start; i < position; i++)
		{
			if (tokens.get(i).is(TokenKind.LBRACE))
			{
				depth++;
			}
			else if (tokens.get(i).is(TokenKind.RBRACE) && depth > 0)
			{
				depth--;
			}
		}
		return depth;
	}

	// STATEMENTS

	/*
	 * Parse statements until the end of input or, inside a block, the closing
	 * brace. A statement that fails is reported and dropped.
	 */
	private void statements(List<Node> body)
	{
		while (!check(TokenKind.EOF) && !(blockDepth > 0 && check(TokenKind.RBRACE)))
		{
			int start = position;
			try
			{
				body.add(statement());
			}
			catch (JSGuardException e)
			{
				errors.add(e.getMessage());
				synchronize(openBraces(start));
			}
		}
	}

	private Node statement() throws JSGuardException
	{
		Token token = current();

		if (token.is(TokenKind.KEYWORD))
		{
			switch (token.getText())
			{
			case "var":
			case "let":
			case "const":
				return variableDeclaration();
			case "function":
				return functionDeclaration();
			case "return":
				return returnStatement();
			case "if":
				return ifStatement();
			case "while":
				return whileStatement();
			case "for":
				return forStatement();
			}
		}

		if (check(TokenKind.LBRACE))
		{
			return blockStatement();
		}

		return expressionStatement();
	}

	private VariableDeclaration variableDeclaration() throws JSGuardException
	{
		Token keyword = consume(TokenKind.KEYWORD);
		List<VariableDeclarator> declarations = new ArrayList<VariableDeclarator>();

		do
		{
			Token name = consume(TokenKind.IDENTIFIER);
			Identifier id = new Identifier(name.getText(), name.getLine(), name.getColumn());

			Node init = null;
			if (check(TokenKind.ASSIGNMENT, "="))
			{
				advance();
				init = expression();
			}

			declarations.add(new VariableDeclarator(id, init, id.getLine(), id.getColumn()));

			if (!check(TokenKind.COMMA))
			{
				break;
			}
			advance();
		}
		while (true);

		if (check(TokenKind.SEMICOLON))
		{
			advance();
		}

		return new VariableDeclaration(keyword.getText(), declarations, keyword.getLine(), keyword.getColumn());
	}

	private FunctionDeclaration functionDeclaration() throws JSGuardException
	{
		Token keyword = consume(TokenKind.KEYWORD, "function");
		Token name = consume(TokenKind.IDENTIFIER);
		Identifier id = new Identifier(name.getText(), name.getLine(), name.getColumn());

		consume(TokenKind.LPAREN);
		List<Identifier> params = new ArrayList<Identifier>();

		if (!check(TokenKind.RPAREN))
		{
			do
			{
				Token param = consume(TokenKind.IDENTIFIER);
				params.add(new Identifier(param.getText(), param.getLine(), param.getColumn()));

				if (!check(TokenKind.COMMA))
				{
					break;
				}
				advance();
			}
			while (true);
		}

		consume(TokenKind.RPAREN);
		BlockStatement body = blockStatement();

		return new FunctionDeclaration(id, params, body, keyword.getLine(), keyword.getColumn());
	}

	private BlockStatement blockStatement() throws JSGuardException
	{
		Token open = consume(TokenKind.LBRACE);
		List<Node> body = new ArrayList<Node>();

		blockDepth++;
		try
		{
			statements(body);
		}
		finally
		{
			blockDepth--;
		}

		consume(TokenKind.RBRACE);
		return new BlockStatement(body, open.getLine(), open.getColumn());
	}

	private ReturnStatement returnStatement() throws JSGuardException
	{
		Token keyword = consume(TokenKind.KEYWORD, "return");
		Node argument = null;

		if (!check(TokenKind.SEMICOLON) && !check(TokenKind.RBRACE) && !check(TokenKind.EOF))
		{
			argument = expression();
		}

		if (check(TokenKind.SEMICOLON))
		{
			advance();
		}

		return new ReturnStatement(argument, keyword.getLine(), keyword.getColumn());
	}

	private IfStatement ifStatement() throws JSGuardException
	{
		Token keyword = consume(TokenKind.KEYWORD, "if");
		consume(TokenKind.LPAREN);
		Node test = expression();
		consume(TokenKind.RPAREN);
		Node consequent = statement();

		Node alternate = null;
		if (check(TokenKind.KEYWORD, "else"))
		{
			advance();
			alternate = statement();
		}

		return new IfStatement(test, consequent, alternate, keyword.getLine(), keyword.getColumn());
	}

	private WhileStatement whileStatement() throws JSGuardException
	{
		Token keyword = consume(TokenKind.KEYWORD, "while");
		skipLoopHeader();
		return new WhileStatement(statement(), keyword.getLine(), keyword.getColumn());
	}

	private ForStatement forStatement() throws JSGuardException
	{
		Token keyword = consume(TokenKind.KEYWORD, "for");
		skipLoopHeader();
		return new ForStatement(statement(), keyword.getLine(), keyword.getColumn());
	}

	/*
	 * Loop headers are not modelled: skip the parenthesized header, balancing
	 * nested parentheses, up to the matching ')' or the end of input.
	 */
	private void skipLoopHeader() throws JSGuardException
	{
		consume(TokenKind.LPAREN);

		int depth = 1;
		while (depth > 0 && !check(TokenKind.EOF))
		{
			if (check(TokenKind.LPAREN)) depth++;
			if (check(TokenKind.RPAREN)) depth--;
			advance();
		}
	}

	private ExpressionStatement expressionStatement() throws JSGuardException
	{
		Node expr = expression();

		if (check(TokenKind.SEMICOLON))
		{
			advance();
		}

		return new ExpressionStatement(expr, expr.getLine(), expr.getColumn());
	}

	// EXPRESSIONS

	private Node expression() throws JSGuardException
	{
		return assignment();
	}

	private Node assignment() throws JSGuardException
	{
		Node left = logicalOr();

		if (check(TokenKind.ASSIGNMENT))
		{
			String operator = current().getText();
			advance();
			Node right = assignment();
			return new AssignmentExpression(operator, left, right, left.getLine(), left.getColumn());
		}

		return left;
	}

	private Node logicalOr() throws JSGuardException
	{
		Node left = logicalAnd();

		while (check(TokenKind.LOGICAL, "||"))
		{
			advance();
			Node right = logicalAnd();
			left = new BinaryExpression("||", left, right, left.getLine(), left.getColumn());
		}

		return left;
	}

	private Node logicalAnd() throws JSGuardException
	{
		Node left = equality();

		while (check(TokenKind.LOGICAL, "&&"))
		{
			advance();
			Node right = equality();
			left = new BinaryExpression("&&", left, right, left.getLine(), left.getColumn());
		}

		return left;
	}

	private Node equality() throws JSGuardException
	{
		Node left = relational();

		while (checkAny(TokenKind.COMPARISON, EQUALITY_OPERATORS))
		{
			String operator = current().getText();
			advance();
			Node right = relational();
			left = new BinaryExpression(operator, left, right, left.getLine(), left.getColumn());
		}

		return left;
	}

	private Node relational() throws JSGuardException
	{
		Node left = additive();

		while (checkAny(TokenKind.COMPARISON, RELATIONAL_OPERATORS))
		{
			String operator = current().getText();
			advance();
			Node right = additive();
			left = new BinaryExpression(operator, left, right, left.getLine(), left.getColumn());
		}

		return left;
	}

	private Node additive() throws JSGuardException
	{
		Node left = multiplicative();

		while (checkAny(TokenKind.ARITHMETIC, ADDITIVE_OPERATORS))
		{
			String operator = current().getText();
			advance();
			Node right = multiplicative();
			left = new BinaryExpression(operator, left, right, left.getLine(), left.getColumn());
		}

		return left;
	}

	private Node multiplicative() throws JSGuardException
	{
		Node left = unary();

		while (checkAny(TokenKind.ARITHMETIC, MULTIPLICATIVE_OPERATORS))
		{
			String operator = current().getText();
			advance();
			Node right = unary();
			left = new BinaryExpression(operator, left, right, left.getLine(), left.getColumn());
		}

		return left;
	}

	private Node unary() throws JSGuardException
	{
		if (checkAny(TokenKind.UNARY, PREFIX_OPERATORS) || checkAny(TokenKind.ARITHMETIC, PREFIX_OPERATORS))
		{
			Token operator = current();
			advance();
			Node argument = unary();
			return new UnaryExpression(operator.getText(), argument, true, operator.getLine(), operator.getColumn());
		}

		return postfix();
	}

	/*
	 * Member access and calls chain to the left: each suffix wraps the node
	 * built so far. A trailing ++ or -- ends the chain.
	 */
	private Node postfix() throws JSGuardException
	{
		Node expr = primary();

		while (true)
		{
			if (check(TokenKind.DOT))
			{
				advance();
				Token name = consume(TokenKind.IDENTIFIER);
				Identifier property = new Identifier(name.getText(), name.getLine(), name.getColumn());
				expr = new MemberExpression(expr, property, false, expr.getLine(), expr.getColumn());
			}
			else if (check(TokenKind.LBRACKET))
			{
				advance();
				Node property = expression();
				consume(TokenKind.RBRACKET);
				expr = new MemberExpression(expr, property, true, expr.getLine(), expr.getColumn());
			}
			else if (check(TokenKind.LPAREN))
			{
				advance();
				List<Node> args = expressionList(TokenKind.RPAREN);
				consume(TokenKind.RPAREN);
				expr = new CallExpression(expr, args, expr.getLine(), expr.getColumn());
			}
			else if (checkAny(TokenKind.UNARY, UPDATE_OPERATORS))
			{
				String operator = current().getText();
				advance();
				return new UnaryExpression(operator, expr, false, expr.getLine(), expr.getColumn());
			}
			else
			{
				return expr;
			}
		}
	}

	private Node primary() throws JSGuardException
	{
		Token token = current();

		switch (token.getKind())
		{
		case IDENTIFIER:
			advance();
			return new Identifier(token.getText(), token.getLine(), token.getColumn());
		case NUMBER:
			advance();
			return new Literal(NumberUtils.toDouble(token.getText()), token.getText(), token.getLine(), token.getColumn());
		case STRING:
			advance();
			return new Literal(token.getText(), token.getText(), token.getLine(), token.getColumn());
		case BOOLEAN:
			advance();
			return new Literal(Boolean.valueOf(token.getText()), token.getText(), token.getLine(), token.getColumn());
		case NULL:
			advance();
			return new Literal(null, token.getText(), token.getLine(), token.getColumn());
		case LPAREN:
			advance();
			Node expr = expression();
			consume(TokenKind.RPAREN);
			return expr;
		case LBRACKET:
			return arrayExpression();
		case LBRACE:
			return objectExpression();
		default:
			throw expected("expression");
		}
	}

	/*
	 * Comma-separated expressions up to (not including) the closing token.
	 * A trailing comma is allowed.
	 */
	private List<Node> expressionList(TokenKind close) throws JSGuardException
	{
		List<Node> items = new ArrayList<Node>();

		while (!check(close))
		{
			items.add(expression());

			if (!check(TokenKind.COMMA))
			{
				break;
			}
			advance();
		}

		return items;
	}

	private ArrayExpression arrayExpression() throws JSGuardException
	{
		Token open = consume(TokenKind.LBRACKET);
		List<Node> elements = expressionList(TokenKind.RBRACKET);
		consume(TokenKind.RBRACKET);
		return new ArrayExpression(elements, open.getLine(), open.getColumn());
	}

	private ObjectExpression objectExpression() throws JSGuardException
	{
		Token open = consume(TokenKind.LBRACE);
		List<Property> properties = new ArrayList<Property>();

		while (!check(TokenKind.RBRACE))
		{
			Token name = current();
			Node key;

			if (name.is(TokenKind.IDENTIFIER))
			{
				key = new Identifier(name.getText(), name.getLine(), name.getColumn());
			}
			else if (name.is(TokenKind.STRING))
			{
				key = new Literal(name.getText(), name.getText(), name.getLine(), name.getColumn());
			}
			else if (name.is(TokenKind.NUMBER))
			{
				key = new Literal(NumberUtils.toDouble(name.getText()), name.getText(), name.getLine(), name.getColumn());
			}
			else
			{
				throw expected("property name");
			}
			advance();

			consume(TokenKind.COLON);
			Node value = expression();
			properties.add(new Property(key, value, key.getLine(), key.getColumn()));

			if (!check(TokenKind.COMMA))
			{
				break;
			}
			advance();
		}

		consume(TokenKind.RBRACE);
		return new ObjectExpression(properties, open.getLine(), open.getColumn());
	}
}
