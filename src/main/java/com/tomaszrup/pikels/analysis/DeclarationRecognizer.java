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
package com.tomaszrup.pikels.analysis;

import java.util.List;

import com.tomaszrup.pikels.parser.Token;

/**
 * Recognizes {@code <type> <name> [= <expr>]} at the start of a token window.
 *
 * <p>Only the first binding is parsed; continuation bindings of a
 * declaration list ({@code string a, b;}) are left to the caller.</p>
 */
public final class DeclarationRecognizer {

	private DeclarationRecognizer() {
	}

	/**
	 * @param tokens the token list
	 * @param start  first index of the window; leading whitespace is skipped
	 * @param end    exclusive end of the window
	 * @return the parsed declaration, or {@link Declaration#NONE}
	 */
	public static Declaration tryParseDeclaration(List<Token> tokens, int start, int end) {
		int typeIndex = TokenNavigator.findNextMeaningful(tokens, start, end);
		if (typeIndex == TokenNavigator.NOT_FOUND
				|| !TokenClassifier.isTypeKeyword(tokens.get(typeIndex).getText())) {
			return Declaration.NONE;
		}

		StringBuilder type = new StringBuilder();
		int cursor = parseType(tokens, typeIndex, end, type);
		if (cursor == TokenNavigator.NOT_FOUND) {
			return Declaration.NONE;
		}

		int nameIndex = TokenNavigator.findNextMeaningful(tokens, cursor, end);
		if (nameIndex != TokenNavigator.NOT_FOUND && "...".equals(tokens.get(nameIndex).getText())) {
			nameIndex = TokenNavigator.findNextMeaningful(tokens, nameIndex + 1, end);
		}
		if (nameIndex == TokenNavigator.NOT_FOUND) {
			return Declaration.NONE;
		}
		String name = tokens.get(nameIndex).getText();
		if (!TokenClassifier.isIdentifier(name) || TokenClassifier.isTypeKeyword(name)) {
			return Declaration.NONE;
		}

		int after = TokenNavigator.findNextMeaningful(tokens, nameIndex + 1, end);
		if (after == TokenNavigator.NOT_FOUND) {
			return Declaration.of(name, type.toString(), false, nameIndex);
		}
		switch (tokens.get(after).getText()) {
			case "=":
				return Declaration.of(name, type.toString(), true, nameIndex);
			case ";":
			case ",":
				return Declaration.of(name, type.toString(), false, nameIndex);
			default:
				return Declaration.NONE;
		}
	}

	/**
	 * Consumes the type starting at the type keyword at {@code typeIndex}:
	 * a balanced parameter suffix such as {@code array(int)} and any
	 * {@code |}-separated union members.
	 *
	 * @param out receives the type text without whitespace
	 * @return the index just past the type, or {@link TokenNavigator#NOT_FOUND}
	 *         if the type is malformed
	 */
	static int parseType(List<Token> tokens, int typeIndex, int end, StringBuilder out) {
		out.append(tokens.get(typeIndex).getText());
		int cursor = typeIndex + 1;
		while (true) {
			int next = TokenNavigator.findNextMeaningful(tokens, cursor, end);
			if (next != TokenNavigator.NOT_FOUND && "(".equals(tokens.get(next).getText())) {
				int close = TokenNavigator.findMatchingParen(tokens, next, end);
				if (close == TokenNavigator.NOT_FOUND) {
					return TokenNavigator.NOT_FOUND;
				}
				appendMeaningful(out, tokens, next, close);
				cursor = close + 1;
				next = TokenNavigator.findNextMeaningful(tokens, cursor, end);
			}
			if (next == TokenNavigator.NOT_FOUND || !"|".equals(tokens.get(next).getText())) {
				return cursor;
			}
			int member = TokenNavigator.findNextMeaningful(tokens, next + 1, end);
			if (member == TokenNavigator.NOT_FOUND
					|| !TokenClassifier.isTypeKeyword(tokens.get(member).getText())) {
				return TokenNavigator.NOT_FOUND;
			}
			out.append('|').append(tokens.get(member).getText());
			cursor = member + 1;
		}
	}

	private static void appendMeaningful(StringBuilder builder, List<Token> tokens, int from, int to) {
		for (int i = from; i <= to; i++) {
			String text = tokens.get(i).getText();
			if (TokenNavigator.isMeaningful(text)) {
				builder.append(text);
			}
		}
	}
}
