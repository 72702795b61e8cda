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
package com.tomaszrup.pikels.config;

/**
 * Immutable analyzer configuration. Updated copies are produced with the
 * {@code withX} methods whenever the client sends new settings.
 */
public final class AnalyzerSettings {

	public static final int DEFAULT_MAX_NUMBER_OF_PROBLEMS = 100;
	public static final long DEFAULT_DIAGNOSTIC_DELAY_MILLIS = 250L;
	public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 1024L * 1024L;

	private static final AnalyzerSettings DEFAULTS = new AnalyzerSettings(true,
			DEFAULT_MAX_NUMBER_OF_PROBLEMS, DEFAULT_DIAGNOSTIC_DELAY_MILLIS,
			BranchMergeMode.JOIN, DEFAULT_MAX_FILE_SIZE_BYTES);

	private final boolean enabled;
	private final int maxNumberOfProblems;
	private final long diagnosticDelayMillis;
	private final BranchMergeMode branchMergeMode;
	private final long maxFileSizeBytes;

	private AnalyzerSettings(boolean enabled, int maxNumberOfProblems, long diagnosticDelayMillis,
			BranchMergeMode branchMergeMode, long maxFileSizeBytes) {
		this.enabled = enabled;
		this.maxNumberOfProblems = maxNumberOfProblems;
		this.diagnosticDelayMillis = diagnosticDelayMillis;
		this.branchMergeMode = branchMergeMode;
		this.maxFileSizeBytes = maxFileSizeBytes;
	}

	public static AnalyzerSettings defaults() {
		return DEFAULTS;
	}

	/** Whether uninitialized-variable diagnostics are produced at all. */
	public boolean isEnabled() {
		return enabled;
	}

	public int getMaxNumberOfProblems() {
		return maxNumberOfProblems;
	}

	public long getDiagnosticDelayMillis() {
		return diagnosticDelayMillis;
	}

	public BranchMergeMode getBranchMergeMode() {
		return branchMergeMode;
	}

	/** Documents larger than this are not analyzed. */
	public long getMaxFileSizeBytes() {
		return maxFileSizeBytes;
	}

	public AnalyzerSettings withEnabled(boolean value) {
		return new AnalyzerSettings(value, maxNumberOfProblems, diagnosticDelayMillis,
				branchMergeMode, maxFileSizeBytes);
	}

	/**
	 * @throws IllegalArgumentException if {@code value} is negative
	 */
	public AnalyzerSettings withMaxNumberOfProblems(int value) {
		if (value < 0) {
			throw new IllegalArgumentException("maxNumberOfProblems must not be negative: " + value);
		}
		return new AnalyzerSettings(enabled, value, diagnosticDelayMillis, branchMergeMode, maxFileSizeBytes);
	}

	/**
	 * @throws IllegalArgumentException if {@code value} is negative
	 */
	public AnalyzerSettings withDiagnosticDelayMillis(long value) {
		if (value < 0) {
			throw new IllegalArgumentException("diagnosticDelay must not be negative: " + value);
		}
		return new AnalyzerSettings(enabled, maxNumberOfProblems, value, branchMergeMode, maxFileSizeBytes);
	}

	public AnalyzerSettings withBranchMergeMode(BranchMergeMode value) {
		if (value == null) {
			throw new IllegalArgumentException("branchMergeMode must not be null");
		}
		return new AnalyzerSettings(enabled, maxNumberOfProblems, diagnosticDelayMillis, value, maxFileSizeBytes);
	}

	/**
	 * @throws IllegalArgumentException if {@code value} is not positive
	 */
	public AnalyzerSettings withMaxFileSizeBytes(long value) {
		if (value <= 0) {
			throw new IllegalArgumentException("maxFileSize must be positive: " + value);
		}
		return new AnalyzerSettings(enabled, maxNumberOfProblems, diagnosticDelayMillis, branchMergeMode, value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AnalyzerSettings)) {
			return false;
		}
		AnalyzerSettings other = (AnalyzerSettings) o;
		return enabled == other.enabled
				&& maxNumberOfProblems == other.maxNumberOfProblems
				&& diagnosticDelayMillis == other.diagnosticDelayMillis
				&& branchMergeMode == other.branchMergeMode
				&& maxFileSizeBytes == other.maxFileSizeBytes;
	}

	@Override
	public int hashCode() {
		int result = Boolean.hashCode(enabled);
		result = 31 * result + maxNumberOfProblems;
		result = 31 * result + Long.hashCode(diagnosticDelayMillis);
		result = 31 * result + branchMergeMode.hashCode();
		result = 31 * result + Long.hashCode(maxFileSizeBytes);
		return result;
	}

	@Override
	public String toString() {
		return "AnalyzerSettings[enabled=" + enabled + ", maxNumberOfProblems=" + maxNumberOfProblems
				+ ", diagnosticDelayMillis=" + diagnosticDelayMillis + ", branchMergeMode=" + branchMergeMode
				+ ", maxFileSizeBytes=" + maxFileSizeBytes + "]";
	}
}
