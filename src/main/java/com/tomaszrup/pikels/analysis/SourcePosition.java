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

import java.util.Objects;

/**
 * Location of a diagnostic: 1-based line, 0-based character.
 */
public final class SourcePosition {

	private final String file;
	private final int line;
	private final int character;

	public SourcePosition(String file, int line, int character) {
		this.file = file;
		this.line = line;
		this.character = character;
	}

	public String getFile() {
		return file;
	}

	public int getLine() {
		return line;
	}

	public int getCharacter() {
		return character;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourcePosition)) {
			return false;
		}
		SourcePosition other = (SourcePosition) o;
		return line == other.line && character == other.character && Objects.equals(file, other.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line, character);
	}

	@Override
	public String toString() {
		return file + ":" + line + ":" + character;
	}
}
