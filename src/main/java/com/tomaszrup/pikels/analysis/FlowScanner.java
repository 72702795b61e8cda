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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pikels.analysis.position.PositionResolver;
import com.tomaszrup.pikels.config.BranchMergeMode;
import com.tomaszrup.pikels.parser.Token;

/**
 * Single left-to-right pass over a token list that tracks the
 * initialization state of every declared variable and reports reads of
 * variables that may not hold a value.
 *
 * <p>Each function, lambda and class body is scanned as its own activation
 * with a fresh {@link ScopeTable}. Activations are kept on an explicit work
 * stack: when the scanner meets a nested body it parks the enclosing
 * activation just past that body and resumes it once the nested one is
 * done, so deeply nested input cannot overflow the call stack.</p>
 *
 * <p>Malformed structure never aborts the scan. A construct whose brackets
 * do not balance is simply not treated specially.</p>
 */
public class FlowScanner {
	private static final Logger logger = LoggerFactory.getLogger(FlowScanner.class);

	/** Calls whose arguments from the given index on are written to. */
	private static final Map<String, Integer> OUTPUT_PARAMETER_CALLS = Map.of("sscanf", 2);

	private static final Set<String> TERMINATORS = Set.of("return", "break", "continue", "throw");

	/** Statements that own the {@code break} and {@code continue} inside them. */
	private static final Set<String> BREAK_TARGETS = Set.of("for", "foreach", "while", "do", "switch");

	private static final Comparator<UninitializedVariableDiagnostic> BY_POSITION = Comparator
			.comparingInt((UninitializedVariableDiagnostic d) -> d.getPosition().getLine())
			.thenComparingInt(d -> d.getPosition().getCharacter());

	private final List<Token> tokens;
	private final PositionResolver positions;
	private final String filename;
	private final BranchMergeMode mergeMode;
	private List<UninitializedVariableDiagnostic> diagnostics;
	private int activationCount;

	public FlowScanner(List<Token> tokens, PositionResolver positions, String filename,
			BranchMergeMode mergeMode) {
		this.tokens = tokens;
		this.positions = positions;
		this.filename = filename;
		this.mergeMode = mergeMode;
	}

	/**
	 * Scans the whole token list.
	 *
	 * @return diagnostics ordered by line, then character
	 */
	public List<UninitializedVariableDiagnostic> scan() {
		diagnostics = new ArrayList<>();
		activationCount = 0;
		Deque<Activation> work = new ArrayDeque<>();
		work.push(new Activation("file", 0, tokens.size(), 0, new ScopeTable(), true));
		while (!work.isEmpty()) {
			Activation nested = run(work.peek());
			if (nested != null) {
				work.push(nested);
			} else {
				work.pop();
				activationCount++;
			}
		}
		diagnostics.sort(BY_POSITION);
		return diagnostics;
	}

	/** Number of activations completed by the last {@link #scan()}. */
	public int getActivationCount() {
		return activationCount;
	}

	/**
	 * Advances {@code a} until it finishes or meets a nested body.
	 *
	 * @return the nested activation to run first, or {@code null} when
	 *         {@code a} is finished
	 */
	private Activation run(Activation a) {
		while (a.cursor < a.end) {
			int i = settle(a, a.cursor);
			a.cursor = i;
			if (i >= a.end) {
				break;
			}
			if (!TokenNavigator.isMeaningful(tokens.get(i).getText())) {
				a.cursor = i + 1;
				continue;
			}
			Activation nested = step(a, i);
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}

	/**
	 * Applies everything that is due before the token at {@code index} is
	 * processed: skips over foreach binding clauses, commits output-parameter
	 * writes and closes branch arms that have ended.
	 */
	private int settle(Activation a, int index) {
		int i = index;
		while (!a.jumps.isEmpty() && i >= a.jumps.peek()[0]) {
			i = Math.max(i, a.jumps.pop()[1]);
		}
		applyPendingWrites(a, i);
		while (!a.frames.isEmpty()) {
			BranchFrame top = a.frames.peek();
			if (!top.hasPreBranchSnapshot()) {
				if (i < top.getArmStart()) {
					break;
				}
				top.setPreBranchSnapshot(BranchStateManager.snapshot(a.table));
			}
			if (i <= top.getArmEnd()) {
				break;
			}
			closeArm(a, top);
		}
		return i;
	}

	private Activation step(Activation a, int i) {
		String text = tokens.get(i).getText();
		int prev = TokenNavigator.findPrevMeaningful(tokens, i - 1, a.start);
		boolean afterMemberAccess = prev != TokenNavigator.NOT_FOUND
				&& TokenClassifier.isMemberAccessOperator(tokens.get(prev).getText());

		if ("{".equals(text)) {
			a.depth++;
			a.cursor = i + 1;
			return null;
		}
		if ("}".equals(text)) {
			closeBlock(a, i);
			return null;
		}
		if (afterMemberAccess) {
			a.cursor = i + 1;
			return null;
		}

		if ("lambda".equals(text)) {
			DefinitionBoundary lambda = DefinitionBoundaryDetector.findLambdaDefinition(tokens, i, a.end);
			if (lambda != null && lambda.hasBalancedBody()) {
				return enter(a, lambda);
			}
		}
		if (TokenClassifier.isModifier(text) || TokenClassifier.isTypeKeyword(text)
				|| (TokenClassifier.isTypeName(text) && !a.table.contains(text))) {
			DefinitionBoundary function = DefinitionBoundaryDetector.findFunctionDefinition(tokens, i, a.end);
			if (function != null && function.hasBalancedBody()) {
				return enter(a, function);
			}
		}
		if ("class".equals(text)) {
			DefinitionBoundary type = DefinitionBoundaryDetector.findClassDefinition(tokens, i, a.end);
			if (type != null && type.hasBalancedBody()) {
				return enter(a, type);
			}
		}

		if (BREAK_TARGETS.contains(text)) {
			openBreakTarget(a, i, text);
		}
		if ("foreach".equals(text) && handleForeach(a, i)) {
			return null;
		}
		Integer firstOutput = OUTPUT_PARAMETER_CALLS.get(text);
		if (firstOutput != null && !a.table.contains(text)) {
			handleOutputCall(a, i, firstOutput);
			a.cursor = i + 1;
			return null;
		}
		if ("if".equals(text)) {
			openIf(a, i);
			a.cursor = i + 1;
			return null;
		}
		if ("else".equals(text)) {
			enterElse(a, i);
			a.cursor = i + 1;
			return null;
		}
		if ("catch".equals(text)) {
			openCatch(a, i);
			a.cursor = i + 1;
			return null;
		}
		if (isTerminator(a, i, text)) {
			markTerminated(a, i);
			a.cursor = i + 1;
			return null;
		}

		if (TokenClassifier.isTypeKeyword(text)) {
			Declaration declaration = DeclarationRecognizer.tryParseDeclaration(tokens, i, a.end);
			if (declaration.isDeclaration()) {
				declare(a, declaration.getName(), declaration.getType(), declaration.hasInitializer(),
						declaration.getNameIndex());
				declareContinuations(a, declaration);
				a.cursor = declaration.getEndIndex();
				return null;
			}
			a.cursor = i + 1;
			return null;
		}

		VariableRecord record = TokenClassifier.isIdentifier(text) ? a.table.lookup(text) : null;
		if (record != null && !a.skippedReads.contains(i)) {
			int next = TokenNavigator.findNextMeaningful(tokens, i + 1, a.end);
			if (next != TokenNavigator.NOT_FOUND
					&& TokenClassifier.isAssignmentOperator(tokens.get(next).getText())) {
				record.setState(VariableState.INITIALIZED);
				a.cursor = next + 1;
				return null;
			}
			boolean afterType = prev != TokenNavigator.NOT_FOUND
					&& TokenClassifier.isTypeKeyword(tokens.get(prev).getText());
			if (!afterType) {
				checkRead(record, i);
			}
		}
		a.cursor = i + 1;
		return null;
	}

	private void closeBlock(Activation a, int i) {
		if (a.depth <= a.baseline) {
			// unbalanced close; a nested body ends here, the file just ignores it
			a.cursor = a.topLevel ? i + 1 : a.end;
			return;
		}
		a.table.removeAtOrBelow(a.depth);
		a.depth--;
		a.cursor = i + 1;
	}

	private Activation enter(Activation a, DefinitionBoundary boundary) {
		List<VariableRecord> parameters = DefinitionBoundaryDetector.extractParameterBindings(tokens,
				boundary.getParamsOpen(), boundary.getParamsClose(), 1);
		a.cursor = boundary.getBodyClose() + 1;
		String label = boundary.getKind().name().toLowerCase() + " " + boundary.getName();
		return new Activation(label, boundary.getBodyOpen() + 1, boundary.getBodyClose(), 1,
				new ScopeTable(parameters), false);
	}

	private void checkRead(VariableRecord record, int index) {
		VariableState state = record.getState();
		if (!record.needsInitCheck() || !state.isRisky()) {
			return;
		}
		Token token = tokens.get(index);
		SourcePosition position = new SourcePosition(filename, token.getLine(), positions.resolveCharacter(index));
		diagnostics.add(UninitializedVariableDiagnostic.forRead(record, state, position));
		record.setState(VariableState.UNKNOWN);
	}

	private void declare(Activation a, String name, String type, boolean initialized, int nameIndex) {
		Token token = tokens.get(nameIndex);
		a.table.declare(new VariableRecord(name, type,
				initialized ? VariableState.INITIALIZED : VariableState.UNINITIALIZED,
				token.getLine(), positions.resolveCharacter(nameIndex), a.depth,
				TokenClassifier.needsInitCheck(type)));
	}

	/**
	 * Declares the further names of a list such as {@code string a = "x", b;}
	 * with the type of the first one.
	 */
	private void declareContinuations(Activation a, Declaration first) {
		int nesting = 0;
		for (int j = first.getEndIndex(); j < a.end; j++) {
			String text = tokens.get(j).getText();
			if ("(".equals(text) || "[".equals(text) || "{".equals(text)) {
				nesting++;
			} else if (")".equals(text) || "]".equals(text) || "}".equals(text)) {
				nesting--;
				if (nesting < 0) {
					return;
				}
			} else if (";".equals(text) && nesting == 0) {
				return;
			} else if (",".equals(text) && nesting == 0) {
				int nameIndex = TokenNavigator.findNextMeaningful(tokens, j + 1, a.end);
				if (nameIndex == TokenNavigator.NOT_FOUND) {
					return;
				}
				String name = tokens.get(nameIndex).getText();
				if (!TokenClassifier.isIdentifier(name) || TokenClassifier.isTypeKeyword(name)) {
					return;
				}
				int after = TokenNavigator.findNextMeaningful(tokens, nameIndex + 1, a.end);
				String afterText = after == TokenNavigator.NOT_FOUND ? ";" : tokens.get(after).getText();
				boolean hasInitializer = "=".equals(afterText);
				if (!hasInitializer && !",".equals(afterText) && !";".equals(afterText)) {
					return;
				}
				declare(a, name, first.getType(), hasInitializer, nameIndex);
				a.skippedReads.add(nameIndex);
				j = nameIndex;
			}
		}
	}

	/**
	 * Binds the loop variables of {@code foreach (expr; index; value)} or
	 * {@code foreach (expr, value)}. The iterated expression is still scanned
	 * for reads; the binding clauses are skipped.
	 */
	private boolean handleForeach(Activation a, int index) {
		int open = TokenNavigator.findNextMeaningful(tokens, index + 1, a.end);
		if (open == TokenNavigator.NOT_FOUND || !"(".equals(tokens.get(open).getText())) {
			logDegraded("foreach", index);
			return false;
		}
		int close = TokenNavigator.findMatchingParen(tokens, open, a.end);
		if (close == TokenNavigator.NOT_FOUND) {
			logDegraded("foreach", index);
			return false;
		}
		List<Integer> separators = topLevelSeparators(open, close, ";");
		if (separators.isEmpty()) {
			separators = topLevelSeparators(open, close, ",");
		}
		if (separators.isEmpty()) {
			logDegraded("foreach clause", index);
			return false;
		}
		for (int k = 0; k < separators.size(); k++) {
			int segmentEnd = k + 1 < separators.size() ? separators.get(k + 1) : close;
			bindLoopVariable(a, separators.get(k) + 1, segmentEnd);
		}
		a.jumps.push(new int[] { separators.get(0), close + 1 });
		a.cursor = open + 1;
		return true;
	}

	private List<Integer> topLevelSeparators(int open, int close, String separator) {
		List<Integer> separators = new ArrayList<>();
		int nesting = 0;
		for (int j = open + 1; j < close; j++) {
			String text = tokens.get(j).getText();
			if ("(".equals(text) || "[".equals(text) || "{".equals(text)) {
				nesting++;
			} else if (")".equals(text) || "]".equals(text) || "}".equals(text)) {
				nesting--;
			} else if (nesting == 0 && separator.equals(text)) {
				separators.add(j);
			}
		}
		return separators;
	}

	private void bindLoopVariable(Activation a, int start, int end) {
		Declaration declaration = DeclarationRecognizer.tryParseDeclaration(tokens, start, end);
		if (declaration.isDeclaration()) {
			int nameIndex = declaration.getNameIndex();
			a.table.declare(VariableRecord.binding(declaration.getName(), declaration.getType(),
					tokens.get(nameIndex).getLine(), positions.resolveCharacter(nameIndex), a.depth + 1));
			return;
		}
		VariableRecord existing = singleTrackedIdentifier(a, start, end);
		if (existing != null) {
			existing.setState(VariableState.INITIALIZED);
			existing.setNeedsInitCheck(false);
		}
	}

	/**
	 * Marks plain-identifier arguments at write positions of an
	 * output-parameter call. The writes take effect once the call's closing
	 * parenthesis is reached, so the input arguments are still checked.
	 */
	private void handleOutputCall(Activation a, int index, int firstOutput) {
		int open = TokenNavigator.findNextMeaningful(tokens, index + 1, a.end);
		if (open == TokenNavigator.NOT_FOUND || !"(".equals(tokens.get(open).getText())) {
			logDegraded(tokens.get(index).getText() + " call", index);
			return;
		}
		int close = TokenNavigator.findMatchingParen(tokens, open, a.end);
		if (close == TokenNavigator.NOT_FOUND) {
			logDegraded(tokens.get(index).getText() + " call", index);
			return;
		}
		int argument = 0;
		int nesting = 0;
		int argumentStart = open + 1;
		for (int j = open + 1; j <= close; j++) {
			String text = tokens.get(j).getText();
			if (j == close || (nesting == 0 && ",".equals(text))) {
				if (argument >= firstOutput) {
					int nameIndex = TokenNavigator.findNextMeaningful(tokens, argumentStart, j);
					VariableRecord target = singleTrackedIdentifier(a, argumentStart, j);
					if (target != null) {
						a.skippedReads.add(nameIndex);
						a.pendingWrites.add(new PendingWrite(close, target.getName()));
					}
				}
				argument++;
				argumentStart = j + 1;
			} else if ("(".equals(text) || "[".equals(text) || "{".equals(text)) {
				nesting++;
			} else if (")".equals(text) || "]".equals(text) || "}".equals(text)) {
				nesting--;
			}
		}
	}

	private VariableRecord singleTrackedIdentifier(Activation a, int start, int end) {
		int first = TokenNavigator.findNextMeaningful(tokens, start, end);
		if (first == TokenNavigator.NOT_FOUND
				|| TokenNavigator.findNextMeaningful(tokens, first + 1, end) != TokenNavigator.NOT_FOUND) {
			return null;
		}
		String text = tokens.get(first).getText();
		return TokenClassifier.isIdentifier(text) ? a.table.lookup(text) : null;
	}

	private void applyPendingWrites(Activation a, int index) {
		Iterator<PendingWrite> it = a.pendingWrites.iterator();
		while (it.hasNext()) {
			PendingWrite write = it.next();
			if (write.at <= index) {
				a.table.markInitialized(write.name);
				it.remove();
			}
		}
	}

	private void openIf(Activation a, int index) {
		int open = TokenNavigator.findNextMeaningful(tokens, index + 1, a.end);
		if (open == TokenNavigator.NOT_FOUND || !"(".equals(tokens.get(open).getText())) {
			logDegraded("if", index);
			return;
		}
		int close = TokenNavigator.findMatchingParen(tokens, open, a.end);
		if (close == TokenNavigator.NOT_FOUND) {
			logDegraded("if condition", index);
			return;
		}
		int armStart = TokenNavigator.findNextMeaningful(tokens, close + 1, a.end);
		int[] arm = armStart == TokenNavigator.NOT_FOUND ? null : armBounds(a, armStart);
		if (arm == null) {
			logDegraded("if arm", index);
			return;
		}
		a.frames.push(new BranchFrame(BranchFrame.Kind.IF, armStart, arm[0], arm[1]));
	}

	private void enterElse(Activation a, int index) {
		BranchFrame top = a.frames.peek();
		if (top == null || top.getKind() != BranchFrame.Kind.IF
				|| top.getPhase() != BranchFrame.Phase.AWAIT_ELSE || top.getArmEnd() != index) {
			return;
		}
		int elseStart = TokenNavigator.findNextMeaningful(tokens, index + 1, a.end);
		int[] arm = elseStart == TokenNavigator.NOT_FOUND ? null : armBounds(a, elseStart);
		if (arm == null) {
			mergeWithoutElse(a, top);
			a.frames.pop();
			return;
		}
		Map<String, VariableState> thenSnapshot = BranchStateManager.snapshot(a.table);
		BranchStateManager.restore(a.table, top.getPreBranchSnapshot());
		top.enterElse(thenSnapshot, elseStart, arm[0], arm[1]);
	}

	/**
	 * @return {@code {armEnd, armDepth}} for the arm starting at
	 *         {@code armStart}, or {@code null} if it does not balance
	 */
	private int[] armBounds(Activation a, int armStart) {
		if ("{".equals(tokens.get(armStart).getText())) {
			int close = TokenNavigator.findMatchingBrace(tokens, armStart, a.end);
			return close == TokenNavigator.NOT_FOUND ? null : new int[] { close, a.depth + 1 };
		}
		int end = TokenNavigator.findStatementEnd(tokens, armStart, a.end);
		return end == TokenNavigator.NOT_FOUND ? null : new int[] { end, a.depth };
	}

	private void openCatch(Activation a, int index) {
		int open = TokenNavigator.findNextMeaningful(tokens, index + 1, a.end);
		if (open == TokenNavigator.NOT_FOUND || !"{".equals(tokens.get(open).getText())) {
			logDegraded("catch", index);
			return;
		}
		int close = TokenNavigator.findMatchingBrace(tokens, open, a.end);
		if (close == TokenNavigator.NOT_FOUND) {
			logDegraded("catch block", index);
			return;
		}
		a.frames.push(new BranchFrame(BranchFrame.Kind.CATCH, open, close, a.depth + 1));
	}

	/**
	 * Records the extent of a loop or {@code switch} statement, so that a
	 * {@code break} or {@code continue} inside it is not taken as leaving an
	 * enclosing branch arm.
	 */
	private void openBreakTarget(Activation a, int index, String keyword) {
		int statementEnd;
		if ("do".equals(keyword)) {
			int bodyEnd = TokenNavigator.findStatementEnd(tokens, index + 1, a.end);
			statementEnd = bodyEnd == TokenNavigator.NOT_FOUND ? TokenNavigator.NOT_FOUND
					: TokenNavigator.findStatementEnd(tokens, bodyEnd + 1, a.end);
		} else if ("switch".equals(keyword)) {
			int open = TokenNavigator.findNextMeaningful(tokens, index + 1, a.end);
			int close = open == TokenNavigator.NOT_FOUND || !"(".equals(tokens.get(open).getText())
					? TokenNavigator.NOT_FOUND
					: TokenNavigator.findMatchingParen(tokens, open, a.end);
			statementEnd = close == TokenNavigator.NOT_FOUND ? TokenNavigator.NOT_FOUND
					: TokenNavigator.findStatementEnd(tokens, close + 1, a.end);
		} else {
			statementEnd = TokenNavigator.findStatementEnd(tokens, index, a.end);
		}
		if (statementEnd == TokenNavigator.NOT_FOUND) {
			logDegraded(keyword, index);
			return;
		}
		a.breakTargets.add(new int[] { index, statementEnd });
	}

	/**
	 * Whether the {@code break} or {@code continue} at {@code index} belongs
	 * to a loop or {@code switch} that starts at or after {@code armStart}.
	 */
	private boolean exitsNestedStatement(Activation a, int index, int armStart) {
		a.breakTargets.removeIf(target -> target[1] < index);
		for (int[] target : a.breakTargets) {
			if (target[0] >= armStart && target[0] < index) {
				return true;
			}
		}
		return false;
	}

	private void logDegraded(String construct, int index) {
		if (logger.isDebugEnabled()) {
			logger.debug("Malformed {} at {}:{}, scanned as plain tokens", construct, filename,
					tokens.get(index).getLine());
		}
	}

	private boolean isTerminator(Activation a, int index, String text) {
		if (TERMINATORS.contains(text)) {
			return true;
		}
		if (!"error".equals(text) || a.table.contains(text)) {
			return false;
		}
		int next = TokenNavigator.findNextMeaningful(tokens, index + 1, a.end);
		return next != TokenNavigator.NOT_FOUND && "(".equals(tokens.get(next).getText());
	}

	/**
	 * Only a terminator directly in the arm ends the arm. One inside a nested
	 * block, or a {@code break}/{@code continue} of a loop nested in the arm,
	 * does not.
	 */
	private void markTerminated(Activation a, int index) {
		BranchFrame top = a.frames.peek();
		if (top == null || top.getKind() != BranchFrame.Kind.IF || !top.hasPreBranchSnapshot()
				|| !top.contains(index) || a.depth != top.getArmDepth()) {
			return;
		}
		String text = tokens.get(index).getText();
		if (("break".equals(text) || "continue".equals(text)) && exitsNestedStatement(a, index, top.getArmStart())) {
			return;
		}
		top.markArmTerminated();
	}

	private void closeArm(Activation a, BranchFrame frame) {
		if (frame.getKind() == BranchFrame.Kind.CATCH) {
			// the protected block may stop anywhere
			BranchStateManager.joinInto(a.table, frame.getPreBranchSnapshot());
			a.frames.pop();
			return;
		}
		switch (frame.getPhase()) {
			case THEN:
				int next = TokenNavigator.findNextMeaningful(tokens, frame.getArmEnd() + 1, a.end);
				if (next != TokenNavigator.NOT_FOUND && "else".equals(tokens.get(next).getText())) {
					frame.awaitElse(next);
					return;
				}
				mergeWithoutElse(a, frame);
				break;
			case AWAIT_ELSE:
				mergeWithoutElse(a, frame);
				break;
			case ELSE:
				mergeBothArms(a, frame);
				break;
			default:
				throw new IllegalStateException("Unknown branch phase: " + frame.getPhase());
		}
		a.frames.pop();
	}

	private void mergeWithoutElse(Activation a, BranchFrame frame) {
		if (frame.isArmTerminated()) {
			BranchStateManager.restore(a.table, frame.getPreBranchSnapshot());
		} else {
			BranchStateManager.joinInto(a.table, frame.getPreBranchSnapshot());
		}
	}

	private void mergeBothArms(Activation a, BranchFrame frame) {
		boolean thenTerminated = frame.isThenTerminated();
		boolean elseTerminated = frame.isArmTerminated();
		if (elseTerminated && !thenTerminated) {
			BranchStateManager.restore(a.table, frame.getThenBranchSnapshot());
		} else if (!thenTerminated && !elseTerminated && mergeMode == BranchMergeMode.JOIN) {
			BranchStateManager.joinInto(a.table, frame.getThenBranchSnapshot());
		}
	}

	private static final class PendingWrite {
		private final int at;
		private final String name;

		PendingWrite(int at, String name) {
			this.at = at;
			this.name = name;
		}
	}

	/**
	 * One scan over a contiguous token range with its own variable table.
	 */
	private static final class Activation {
		private final String label;
		private final int start;
		private final int end;
		private final int baseline;
		private final ScopeTable table;
		private final boolean topLevel;
		private final Deque<BranchFrame> frames = new ArrayDeque<>();
		private final Deque<int[]> jumps = new ArrayDeque<>();
		private final List<PendingWrite> pendingWrites = new ArrayList<>();
		private final Set<Integer> skippedReads = new HashSet<>();
		private final List<int[]> breakTargets = new ArrayList<>();
		private int cursor;
		private int depth;

		Activation(String label, int start, int end, int depth, ScopeTable table, boolean topLevel) {
			this.label = label;
			this.start = start;
			this.end = end;
			this.baseline = depth;
			this.depth = depth;
			this.table = table;
			this.topLevel = topLevel;
			this.cursor = start;
		}

		@Override
		public String toString() {
			return "Activation[" + label + " " + start + ".." + end + "]";
		}
	}
}
