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

import java.util.List;

/**
 * Turns raw source text into a token sequence.
 */
public interface Tokenizer {

	/**
	 * @param sourceText the complete text of a source file
	 * @return every token in source order, whitespace and comments included
	 * @throws TokenizationException if the text cannot be split into tokens
	 */
	List<Token> tokenize(String sourceText) throws TokenizationException;
}
