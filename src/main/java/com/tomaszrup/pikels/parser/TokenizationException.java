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

/**
 * Thrown when source text cannot be tokenized, e.g. because of an
 * unterminated string literal or block comment.
 */
public class TokenizationException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;

	/**
	 * @param message description of the failure
	 * @param line    1-based line where the offending construct starts
	 * @param column  0-based column where the offending construct starts
	 */
	public TokenizationException(String message, int line, int column) {
		super(message);
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}
}
