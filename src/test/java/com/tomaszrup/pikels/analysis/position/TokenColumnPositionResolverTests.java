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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pikels.analysis.position;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pikels.parser.Token;

class TokenColumnPositionResolverTests {

	@Test
	void testUsesTokenColumn() {
		List<Token> tokens = Arrays.asList(new Token("s", 1, 12));
		TokenColumnPositionResolver resolver = new TokenColumnPositionResolver(tokens, index -> 99);
		Assertions.assertEquals(12, resolver.resolveCharacter(0));
	}

	@Test
	void testDelegatesWhenColumnUnknown() {
		List<Token> tokens = Arrays.asList(new Token("s", 1));
		TokenColumnPositionResolver resolver = new TokenColumnPositionResolver(tokens, index -> 99);
		Assertions.assertEquals(99, resolver.resolveCharacter(0));
	}

	@Test
	void testWithoutFallback() {
		List<Token> tokens = Arrays.asList(new Token("s", 1));
		TokenColumnPositionResolver resolver = new TokenColumnPositionResolver(tokens, null);
		Assertions.assertEquals(0, resolver.resolveCharacter(0));
		Assertions.assertEquals(0, resolver.resolveCharacter(-1));
	}
}
