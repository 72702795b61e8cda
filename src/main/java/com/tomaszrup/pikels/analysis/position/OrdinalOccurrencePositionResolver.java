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
package com.tomaszrup.pikels.analysis.position;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.pikels.parser.Token;

/**
 * Recovers a column for tokens that only carry a line number: the token is
 * the N-th token with its text on the line, so it is assumed to sit at the
 * N-th occurrence of that text in the source line.
 *
 * <p>Identifier-like text only matches at identifier boundaries, so the
 * {@code s} in {@code string} is not counted. Text that also appears inside
 * other tokens (string literals, comments) can still shift the result.</p>
 */
public class OrdinalOccurrencePositionResolver implements PositionResolver {

	private final List<Token> tokens;
	private final List<String> lines;
	private final int[] ordinals;

	public OrdinalOccurrencePositionResolver(List<Token> tokens, List<String> lines) {
		this.tokens = tokens;
		this.lines = lines;
		this.ordinals = new int[tokens.size()];
		Map<String, Integer> seen = new HashMap<>();
		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			String key = token.getLine() + ":" + token.getText();
			int ordinal = seen.getOrDefault(key, 0);
			ordinals[i] = ordinal;
			seen.put(key, ordinal + 1);
		}
	}

	@Override
	public int resolveCharacter(int tokenIndex) {
		if (tokenIndex < 0 || tokenIndex >= tokens.size()) {
			return 0;
		}
		Token token = tokens.get(tokenIndex);
		int lineIndex = token.getLine() - 1;
		if (lineIndex < 0 || lineIndex >= lines.size()) {
			return 0;
		}
		String line = lines.get(lineIndex);
		String text = token.getText();
		if (text.isEmpty()) {
			return 0;
		}
		boolean word = isWordChar(text.charAt(0));
		int first = -1;
		int found = 0;
		int from = 0;
		while (from <= line.length() - text.length()) {
			int at = line.indexOf(text, from);
			if (at < 0) {
				break;
			}
			if (!word || isBoundary(line, at, text.length())) {
				if (first < 0) {
					first = at;
				}
				if (found == ordinals[tokenIndex]) {
					return at;
				}
				found++;
			}
			from = at + 1;
		}
		return Math.max(first, 0);
	}

	private static boolean isBoundary(String line, int at, int length) {
		boolean before = at == 0 || !isWordChar(line.charAt(at - 1));
		int after = at + length;
		return before && (after >= line.length() || !isWordChar(line.charAt(after)));
	}

	private static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
