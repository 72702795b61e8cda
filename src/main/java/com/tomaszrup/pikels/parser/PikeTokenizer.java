////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pikels.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical scanner for Pike source text.
 *
 * <p>Every character of the input ends up in exactly one token: whitespace
 * runs, comments and preprocessor lines are emitted as tokens of their own so
 * that concatenating all token texts reproduces the source. Each token
 * carries its 1-based start line and 0-based start column.</p>
 */
public class PikeTokenizer implements Tokenizer {

	/** Multi-character operators, longest first so the first match wins. */
	private static final String[] OPERATORS = {
			"<<=", ">>=", "||=", "&&=", "...",
			"->", "::", "==", "!=", "<=", ">=", "&&", "||", "++", "--",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<", ">>", ".."
	};

	@Override
	public List<Token> tokenize(String sourceText) throws TokenizationException {
		List<Token> tokens = new ArrayList<>();
		if (sourceText == null || sourceText.isEmpty()) {
			return tokens;
		}
		int length = sourceText.length();
		int i = 0;
		int line = 1;
		int column = 0;
		while (i < length) {
			int start = i;
			char c = sourceText.charAt(i);
			char next = i + 1 < length ? sourceText.charAt(i + 1) : '\0';
			if (Character.isWhitespace(c)) {
				i = skipWhitespace(sourceText, i);
			} else if (c == '/' && next == '/') {
				i = skipToLineEnd(sourceText, i);
			} else if (c == '/' && next == '*') {
				int close = sourceText.indexOf("*/", i + 2);
				if (close < 0) {
					throw new TokenizationException("Unterminated block comment", line, column);
				}
				i = close + 2;
			} else if (c == '#' && next == '"') {
				i = skipQuoted(sourceText, i + 1, '"', true, line, column);
			} else if (c == '#') {
				i = skipToLineEnd(sourceText, i);
			} else if (c == '"') {
				i = skipQuoted(sourceText, i, '"', false, line, column);
			} else if (c == '\'') {
				i = skipQuoted(sourceText, i, '\'', false, line, column);
			} else if (isIdentifierStart(c)) {
				i = skipIdentifier(sourceText, i);
			} else if (Character.isDigit(c)) {
				i = skipNumber(sourceText, i);
			} else {
				i = skipOperator(sourceText, i);
			}

			String text = sourceText.substring(start, i);
			tokens.add(new Token(text, line, column));
			for (int k = 0; k < text.length(); k++) {
				if (text.charAt(k) == '\n') {
					line++;
					column = 0;
				} else {
					column++;
				}
			}
		}
		return tokens;
	}

	static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private static int skipWhitespace(String source, int from) {
		int i = from;
		while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
			i++;
		}
		return i;
	}

	private static int skipToLineEnd(String source, int from) {
		int newline = source.indexOf('\n', from);
		return newline < 0 ? source.length() : newline;
	}

	private static int skipIdentifier(String source, int from) {
		int i = from + 1;
		while (i < source.length() && isIdentifierPart(source.charAt(i))) {
			i++;
		}
		return i;
	}

	private static int skipNumber(String source, int from) {
		int i = from + 1;
		while (i < source.length()) {
			char c = source.charAt(i);
			if (isIdentifierPart(c)) {
				i++;
			} else if (c == '.' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1))) {
				i++;
			} else {
				break;
			}
		}
		return i;
	}

	private static int skipQuoted(String source, int openQuote, char quote, boolean multiLine,
			int line, int column) throws TokenizationException {
		int i = openQuote + 1;
		while (i < source.length()) {
			char c = source.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (c == quote) {
				return i + 1;
			}
			if (c == '\n' && !multiLine) {
				break;
			}
			i++;
		}
		String what = quote == '\'' ? "character literal" : "string literal";
		throw new TokenizationException("Unterminated " + what, line, column);
	}

	private static int skipOperator(String source, int from) {
		for (String operator : OPERATORS) {
			if (source.startsWith(operator, from)) {
				return from + operator.length();
			}
		}
		return from + 1;
	}
}
