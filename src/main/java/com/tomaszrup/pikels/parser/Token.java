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

import java.util.Objects;

/**
 * A single lexical token produced by a {@link Tokenizer}.
 *
 * <p>Whitespace runs and comments are tokens too; consumers that only care
 * about meaningful tokens skip them.</p>
 */
public final class Token {

	/** Column value for tokens whose tokenizer does not report columns. */
	public static final int UNKNOWN_COLUMN = -1;

	private final String text;
	private final int line;
	private final int column;

	public Token(String text, int line) {
		this(text, line, UNKNOWN_COLUMN);
	}

	/**
	 * @param text   the raw token text
	 * @param line   1-based line the token starts on
	 * @param column 0-based column the token starts at, or {@link #UNKNOWN_COLUMN}
	 */
	public Token(String text, int line, int column) {
		this.text = Objects.requireNonNull(text, "text");
		this.line = line;
		this.column = column;
	}

	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean hasColumn() {
		return column >= 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return line == other.line && column == other.column && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, line, column);
	}

	@Override
	public String toString() {
		return "Token[" + text + "@" + line + ":" + column + "]";
	}
}
