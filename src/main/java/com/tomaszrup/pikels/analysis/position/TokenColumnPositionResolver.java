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

import java.util.List;

import com.tomaszrup.pikels.parser.Token;

/**
 * Uses the column reported by the tokenizer. Tokens without a column are
 * handed to a fallback resolver.
 */
public class TokenColumnPositionResolver implements PositionResolver {

	private final List<Token> tokens;
	private final PositionResolver fallback;

	public TokenColumnPositionResolver(List<Token> tokens, PositionResolver fallback) {
		this.tokens = tokens;
		this.fallback = fallback;
	}

	@Override
	public int resolveCharacter(int tokenIndex) {
		if (tokenIndex < 0 || tokenIndex >= tokens.size()) {
			return 0;
		}
		Token token = tokens.get(tokenIndex);
		if (token.hasColumn()) {
			return token.getColumn();
		}
		return fallback != null ? fallback.resolveCharacter(tokenIndex) : 0;
	}
}
