////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import java.util.Comparator;

import org.eclipse.lsp4j.Position;

public class Positions {
	private Positions() {
	}

	public static final Comparator<Position> COMPARATOR = Comparator.comparingInt(Position::getLine)
			.thenComparingInt(Position::getCharacter);

	public static boolean valid(Position p) {
		return p != null && p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/**
	 * Converts an LSP position to an offset into {@code text}.
	 *
	 * @return the offset, or {@code -1} if the line does not exist or the
	 *         character lies beyond the end of the line
	 */
	public static int getOffset(String text, Position position) {
		if (text == null || !valid(position)) {
			return -1;
		}
		int lineStart = lineStartOffset(text, position.getLine());
		if (lineStart < 0) {
			return -1;
		}
		if (position.getCharacter() > lineEndOffset(text, lineStart) - lineStart) {
			return -1;
		}
		return lineStart + position.getCharacter();
	}

	/**
	 * Length of the given zero-based line, excluding the line terminator.
	 *
	 * @return the length, or {@code -1} if the line does not exist
	 */
	public static int lineLength(String text, int line) {
		if (text == null || line < 0) {
			return -1;
		}
		int lineStart = lineStartOffset(text, line);
		return lineStart < 0 ? -1 : lineEndOffset(text, lineStart) - lineStart;
	}

	/**
	 * Moves {@code position} onto the text: lines past the end map to the end
	 * of the last line and characters past the end of a line to its end.
	 */
	public static Position clamp(String text, Position position) {
		if (text == null || !valid(position)) {
			return new Position(0, 0);
		}
		int line = position.getLine();
		int length = lineLength(text, line);
		if (length < 0) {
			int lastLine = lineCount(text) - 1;
			return new Position(lastLine, lineLength(text, lastLine));
		}
		return new Position(line, Math.min(position.getCharacter(), length));
	}

	public static int lineCount(String text) {
		int count = 1;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}

	private static int lineStartOffset(String text, int line) {
		int offset = 0;
		for (int current = 0; current < line; current++) {
			int newline = text.indexOf('\n', offset);
			if (newline < 0) {
				return -1;
			}
			offset = newline + 1;
		}
		return offset;
	}

	private static int lineEndOffset(String text, int lineStart) {
		for (int i = lineStart; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return text.length();
	}
}
