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

import java.util.Map;

/**
 * An open conditional tracked by the flow scanner. An {@code if} frame
 * moves through {@link Phase#THEN}, optionally {@link Phase#AWAIT_ELSE} and
 * {@link Phase#ELSE}; a {@code catch} frame only has a single arm.
 */
final class BranchFrame {

	enum Kind {
		IF, CATCH
	}

	enum Phase {
		THEN, AWAIT_ELSE, ELSE
	}

	private final Kind kind;
	private Phase phase = Phase.THEN;
	private int armStart;
	private int armEnd;
	private int armDepth;
	private Map<String, VariableState> preBranchSnapshot;
	private Map<String, VariableState> thenBranchSnapshot;
	private boolean thenTerminated;
	private boolean armTerminated;

	BranchFrame(Kind kind, int armStart, int armEnd, int armDepth) {
		this.kind = kind;
		this.armStart = armStart;
		this.armEnd = armEnd;
		this.armDepth = armDepth;
	}

	Kind getKind() {
		return kind;
	}

	Phase getPhase() {
		return phase;
	}

	/** First meaningful token of the current arm. */
	int getArmStart() {
		return armStart;
	}

	/** Last token of the current arm, inclusive. */
	int getArmEnd() {
		return armEnd;
	}

	/** Scope depth at which statements of the current arm run. */
	int getArmDepth() {
		return armDepth;
	}

	boolean hasPreBranchSnapshot() {
		return preBranchSnapshot != null;
	}

	Map<String, VariableState> getPreBranchSnapshot() {
		return preBranchSnapshot;
	}

	void setPreBranchSnapshot(Map<String, VariableState> snapshot) {
		this.preBranchSnapshot = snapshot;
	}

	Map<String, VariableState> getThenBranchSnapshot() {
		return thenBranchSnapshot;
	}

	boolean isThenTerminated() {
		return thenTerminated;
	}

	/** Whether the current arm ends in {@code return}, {@code break} or similar. */
	boolean isArmTerminated() {
		return armTerminated;
	}

	void markArmTerminated() {
		this.armTerminated = true;
	}

	/** The then-arm is done and an {@code else} token follows at {@code elseIndex}. */
	void awaitElse(int elseIndex) {
		this.phase = Phase.AWAIT_ELSE;
		this.armEnd = elseIndex;
	}

	void enterElse(Map<String, VariableState> thenSnapshot, int elseStart, int elseEnd, int elseDepth) {
		this.thenBranchSnapshot = thenSnapshot;
		this.thenTerminated = armTerminated;
		this.armTerminated = false;
		this.phase = Phase.ELSE;
		this.armStart = elseStart;
		this.armEnd = elseEnd;
		this.armDepth = elseDepth;
	}

	boolean contains(int index) {
		return index >= armStart && index <= armEnd;
	}

	@Override
	public String toString() {
		return "BranchFrame[" + kind + " " + phase + " " + armStart + ".." + armEnd + "]";
	}
}
