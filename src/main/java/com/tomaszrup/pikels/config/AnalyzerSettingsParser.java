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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code pike} settings object sent by the client, either inside
 * {@code initializationOptions} or in a {@code didChangeConfiguration}
 * notification. Missing keys keep the current value; ill-typed values are
 * logged and ignored.
 */
public final class AnalyzerSettingsParser {

	private static final Logger logger = LoggerFactory.getLogger(AnalyzerSettingsParser.class);

	public static final String SECTION = "pike";

	static final String MAX_NUMBER_OF_PROBLEMS = "maxNumberOfProblems";
	static final String DIAGNOSTIC_DELAY = "diagnosticDelay";
	static final String UNINITIALIZED_VARIABLES = "uninitializedVariables";
	static final String BRANCH_MERGE = "branchMerge";
	static final String MAX_FILE_SIZE = "maxFileSize";

	private AnalyzerSettingsParser() {
	}

	/**
	 * Applies the {@code pike} section of {@code settings}, if present.
	 */
	public static AnalyzerSettings applySection(AnalyzerSettings current, JsonObject settings) {
		if (settings == null || !settings.has(SECTION) || !settings.get(SECTION).isJsonObject()) {
			return current;
		}
		return apply(current, settings.getAsJsonObject(SECTION));
	}

	/**
	 * Applies the keys of a {@code pike} settings object to {@code current}.
	 */
	public static AnalyzerSettings apply(AnalyzerSettings current, JsonObject pike) {
		AnalyzerSettings result = current;

		Boolean enabled = readBoolean(pike, UNINITIALIZED_VARIABLES);
		if (enabled != null) {
			result = result.withEnabled(enabled);
		}

		Long maxProblems = readLong(pike, MAX_NUMBER_OF_PROBLEMS);
		if (maxProblems != null) {
			if (maxProblems < 0 || maxProblems > Integer.MAX_VALUE) {
				logger.warn("Ignoring out-of-range {}: {}", MAX_NUMBER_OF_PROBLEMS, maxProblems);
			} else {
				result = result.withMaxNumberOfProblems(maxProblems.intValue());
			}
		}

		Long delay = readLong(pike, DIAGNOSTIC_DELAY);
		if (delay != null) {
			if (delay < 0) {
				logger.warn("Ignoring negative {}: {}", DIAGNOSTIC_DELAY, delay);
			} else {
				result = result.withDiagnosticDelayMillis(delay);
			}
		}

		String merge = readString(pike, BRANCH_MERGE);
		if (merge != null) {
			BranchMergeMode mode = BranchMergeMode.fromSettingName(merge);
			if (mode == null) {
				logger.warn("Unknown {} '{}', keeping {}", BRANCH_MERGE, merge, result.getBranchMergeMode());
			} else {
				result = result.withBranchMergeMode(mode);
			}
		}

		Long maxFileSize = readLong(pike, MAX_FILE_SIZE);
		if (maxFileSize != null) {
			if (maxFileSize <= 0) {
				logger.warn("Ignoring non-positive {}: {}", MAX_FILE_SIZE, maxFileSize);
			} else {
				result = result.withMaxFileSizeBytes(maxFileSize);
			}
		}

		if (!result.equals(current)) {
			logger.info("Analyzer settings updated: {}", result);
		}
		return result;
	}

	private static JsonPrimitive primitive(JsonObject object, String key) {
		if (!object.has(key)) {
			return null;
		}
		JsonElement element = object.get(key);
		if (!element.isJsonPrimitive()) {
			logger.warn("Ignoring non-scalar value for {}: {}", key, element);
			return null;
		}
		return element.getAsJsonPrimitive();
	}

	private static Boolean readBoolean(JsonObject object, String key) {
		JsonPrimitive value = primitive(object, key);
		if (value == null) {
			return null;
		}
		if (!value.isBoolean()) {
			logger.warn("Ignoring non-boolean value for {}: {}", key, value);
			return null;
		}
		return value.getAsBoolean();
	}

	private static Long readLong(JsonObject object, String key) {
		JsonPrimitive value = primitive(object, key);
		if (value == null) {
			return null;
		}
		if (!value.isNumber()) {
			logger.warn("Ignoring non-numeric value for {}: {}", key, value);
			return null;
		}
		return value.getAsLong();
	}

	private static String readString(JsonObject object, String key) {
		JsonPrimitive value = primitive(object, key);
		if (value == null) {
			return null;
		}
		if (!value.isString()) {
			logger.warn("Ignoring non-string value for {}: {}", key, value);
			return null;
		}
		return value.getAsString();
	}
}
