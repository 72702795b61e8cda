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
 * Stateless search helpers over a token list. Every search is bounded by an
 * explicit window and returns {@link #NOT_FOUND} instead of failing, so that
 * callers can degrade gracefully on unbalanced input.
 */
public final class TokenNavigator {

	public static final int NOT_FOUND = -1;

	private TokenNavigator() {
	}

	/**
	 * Whitespace and comment tokens carry no meaning for the analysis.
	 * Preprocessor lines count as comments; {@code #"..."} strings do not.
	 */
	public static boolean isMeaningful(String text) {
		String trimmed = text.trim();
		if (trimmed.isEmpty()) {
			return false;
		}
		if (trimmed.startsWith("//") || trimmed.startsWith("/*")) {
			return false;
		}
		return !trimmed.startsWith("#") || trimmed.startsWith("#\"");
	}

	public static int findNextToken(List<Token> tokens, int start, int end, String literal) {
		int limit = Math.min(end, tokens.size());
		for (int i = Math.max(0, start); i < limit; i++) {
			if (literal.equals(tokens.get(i).getText())) {
				return i;
			}
		}
		return NOT_FOUND;
	}

	public static int findNextMeaningful(List<Token> tokens, int start, int end) {
		int limit = Math.min(end, tokens.size());
		for (int i = Math.max(0, start); i < limit; i++) {
			if (isMeaningful(tokens.get(i).getText())) {
				return i;
			}
		}
		return NOT_FOUND;
	}

	/**
	 * Scans backwards from {@code start} down to {@code min}, both inclusive.
	 */
	public static int findPrevMeaningful(List<Token> tokens, int start, int min) {
		for (int i = Math.min(start, tokens.size() - 1); i >= Math.max(0, min); i--) {
			if (isMeaningful(tokens.get(i).getText())) {
				return i;
			}
		}
		return NOT_FOUND;
	}

	public static int findMatchingBrace(List<Token> tokens, int openIndex, int end) {
		return findMatching(tokens, openIndex, end, "{", "}");
	}

	public static int findMatchingParen(List<Token> tokens, int openIndex, int end) {
		return findMatching(tokens, openIndex, end, "(", ")");
	}

	private static int findMatching(List<Token> tokens, int openIndex, int end, String open, String close) {
		int limit = Math.min(end, tokens.size());
		if (openIndex < 0 || openIndex >= limit || !open.equals(tokens.get(openIndex).getText())) {
			return NOT_FOUND;
		}
		int depth = 0;
		for (int i = openIndex; i < limit; i++) {
			String text = tokens.get(i).getText();
			if (open.equals(text)) {
				depth++;
			} else if (close.equals(text)) {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return NOT_FOUND;
	}

	/**
	 * Finds the last token of the statement that begins at the first
	 * meaningful token at or after {@code start}: a block, an {@code if}
	 * statement with its {@code else} chain, a loop with its body, or a
	 * simple statement ending in {@code ;}.
	 */
	public static int findStatementEnd(List<Token> tokens, int start, int end) {
		int first = findNextMeaningful(tokens, start, end);
		if (first == NOT_FOUND) {
			return NOT_FOUND;
		}
		String text = tokens.get(first).getText();
		if ("{".equals(text)) {
			return findMatchingBrace(tokens, first, end);
		}
		if ("if".equals(text)) {
			return findIfStatementEnd(tokens, first, end);
		}
		if ("for".equals(text) || "foreach".equals(text) || "while".equals(text)) {
			int open = findNextMeaningful(tokens, first + 1, end);
			if (open == NOT_FOUND || !"(".equals(tokens.get(open).getText())) {
				return NOT_FOUND;
			}
			int close = findMatchingParen(tokens, open, end);
			return close == NOT_FOUND ? NOT_FOUND : findStatementEnd(tokens, close + 1, end);
		}
		int nesting = 0;
		int limit = Math.min(end, tokens.size());
		for (int i = first; i < limit; i++) {
			String t = tokens.get(i).getText();
			if ("(".equals(t) || "[".equals(t) || "{".equals(t)) {
				nesting++;
			} else if (")".equals(t) || "]".equals(t) || "}".equals(t)) {
				nesting--;
				if (nesting < 0) {
					return NOT_FOUND;
				}
			} else if (";".equals(t) && nesting == 0) {
				return i;
			}
		}
		return NOT_FOUND;
	}

	/**
	 * Finds the last token of the {@code if} statement at {@code ifIndex},
	 * including any {@code else} / {@code else if} continuation.
	 */
	public static int findIfStatementEnd(List<Token> tokens, int ifIndex, int end) {
		int open = findNextMeaningful(tokens, ifIndex + 1, end);
		if (open == NOT_FOUND || !"(".equals(tokens.get(open).getText())) {
			return NOT_FOUND;
		}
		int close = findMatchingParen(tokens, open, end);
		if (close == NOT_FOUND) {
			return NOT_FOUND;
		}
		int thenEnd = findStatementEnd(tokens, close + 1, end);
		if (thenEnd == NOT_FOUND) {
			return NOT_FOUND;
		}
		int next = findNextMeaningful(tokens, thenEnd + 1, end);
		if (next == NOT_FOUND || !"else".equals(tokens.get(next).getText())) {
			return thenEnd;
		}
		int elseEnd = findStatementEnd(tokens, next + 1, end);
		return elseEnd == NOT_FOUND ? thenEnd : elseEnd;
	}
}
