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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Positions}: comparator ordering, validity checks,
 * offset calculation and clamping of positions onto document text.
 */
class PositionsTests {

	// ------------------------------------------------------------------
	// COMPARATOR
	// ------------------------------------------------------------------

	@Test
	void testComparatorSamePosition() {
		Position p1 = new Position(5, 10);
		Position p2 = new Position(5, 10);
		Assertions.assertEquals(0, Positions.COMPARATOR.compare(p1, p2));
	}

	@Test
	void testComparatorDifferentLines() {
		Position earlier = new Position(1, 0);
		Position later = new Position(5, 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(earlier, later) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(later, earlier) > 0);
	}

	@Test
	void testComparatorSameLineDifferentColumns() {
		Position left = new Position(3, 2);
		Position right = new Position(3, 10);
		Assertions.assertTrue(Positions.COMPARATOR.compare(left, right) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(right, left) > 0);
	}

	@Test
	void testComparatorOrigin() {
		Position origin = new Position(0, 0);
		Position other = new Position(0, 1);
		Assertions.assertTrue(Positions.COMPARATOR.compare(origin, other) < 0);
	}

	// ------------------------------------------------------------------
	// valid()
	// ------------------------------------------------------------------

	@Test
	void testValidPositiveLineAndColumn() {
		Assertions.assertTrue(Positions.valid(new Position(1, 1)));
	}

	@Test
	void testValidZeroLineAndColumn() {
		Assertions.assertTrue(Positions.valid(new Position(0, 0)));
	}

	@Test
	void testValidPositiveLineNegativeColumn() {
		Assertions.assertFalse(Positions.valid(new Position(1, -1)));
	}

	@Test
	void testValidNegativeLinePositiveColumn() {
		Assertions.assertFalse(Positions.valid(new Position(-1, 1)));
	}

	@Test
	void testValidBothNegative() {
		Assertions.assertFalse(Positions.valid(new Position(-1, -1)));
	}

	// ------------------------------------------------------------------
	// getOffset()
	// ------------------------------------------------------------------

	@Test
	void testGetOffsetFirstLineFirstColumn() {
		Assertions.assertEquals(0, Positions.getOffset("hello", new Position(0, 0)));
	}

	@Test
	void testGetOffsetFirstLineMiddle() {
		Assertions.assertEquals(3, Positions.getOffset("hello", new Position(0, 3)));
	}

	@Test
	void testGetOffsetSecondLine() {
		Assertions.assertEquals(6, Positions.getOffset("hello\nworld", new Position(1, 0)));
	}

	@Test
	void testGetOffsetSecondLineWithColumn() {
		Assertions.assertEquals(9, Positions.getOffset("hello\nworld", new Position(1, 3)));
	}

	@Test
	void testGetOffsetThirdLine() {
		String text = "aaa\nbbb\nccc";
		// line 2 starts at offset 8
		Assertions.assertEquals(8, Positions.getOffset(text, new Position(2, 0)));
	}

	@Test
	void testGetOffsetEmptyString() {
		Assertions.assertEquals(0, Positions.getOffset("", new Position(0, 0)));
	}

	@Test
	void testGetOffsetLineBeyondContent() {
		Assertions.assertEquals(-1, Positions.getOffset("hello", new Position(5, 0)));
	}

	@Test
	void testGetOffsetSingleCharLines() {
		String text = "a\nb\nc\n";
		Assertions.assertEquals(0, Positions.getOffset(text, new Position(0, 0)));
		Assertions.assertEquals(2, Positions.getOffset(text, new Position(1, 0)));
		Assertions.assertEquals(4, Positions.getOffset(text, new Position(2, 0)));
	}

	@Test
	void testGetOffsetCharacterPastEndOfLine() {
		Assertions.assertEquals(-1, Positions.getOffset("ab\ncd", new Position(0, 3)));
		Assertions.assertEquals(2, Positions.getOffset("ab\ncd", new Position(0, 2)));
	}

	@Test
	void testGetOffsetCrLfLineEndings() {
		String text = "ab\r\ncd";
		Assertions.assertEquals(4, Positions.getOffset(text, new Position(1, 0)));
		Assertions.assertEquals(-1, Positions.getOffset(text, new Position(0, 3)));
	}

	@Test
	void testGetOffsetNullText() {
		Assertions.assertEquals(-1, Positions.getOffset(null, new Position(0, 0)));
	}

	// ------------------------------------------------------------------
	// lineLength() / lineCount()
	// ------------------------------------------------------------------

	@Test
	void testLineLength() {
		String text = "int x;\n\n  return x;";
		Assertions.assertEquals(6, Positions.lineLength(text, 0));
		Assertions.assertEquals(0, Positions.lineLength(text, 1));
		Assertions.assertEquals(11, Positions.lineLength(text, 2));
		Assertions.assertEquals(-1, Positions.lineLength(text, 3));
		Assertions.assertEquals(-1, Positions.lineLength(text, -1));
	}

	@Test
	void testLineCount() {
		Assertions.assertEquals(1, Positions.lineCount(""));
		Assertions.assertEquals(2, Positions.lineCount("a\n"));
		Assertions.assertEquals(3, Positions.lineCount("a\nb\nc"));
	}

	// ------------------------------------------------------------------
	// clamp()
	// ------------------------------------------------------------------

	@Test
	void testClampInsideText() {
		Position clamped = Positions.clamp("hello\nworld", new Position(1, 2));
		Assertions.assertEquals(new Position(1, 2), clamped);
	}

	@Test
	void testClampCharacterPastEndOfLine() {
		Position clamped = Positions.clamp("hello\nworld", new Position(0, 40));
		Assertions.assertEquals(new Position(0, 5), clamped);
	}

	@Test
	void testClampLinePastEndOfText() {
		Position clamped = Positions.clamp("hello\nhi", new Position(9, 0));
		Assertions.assertEquals(new Position(1, 2), clamped);
	}

	@Test
	void testClampInvalidPosition() {
		Assertions.assertEquals(new Position(0, 0), Positions.clamp("hello", new Position(-1, 3)));
	}
}
