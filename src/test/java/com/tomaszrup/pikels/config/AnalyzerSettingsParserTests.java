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
package com.tomaszrup.pikels.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AnalyzerSettingsParserTests {

	private static JsonObject settingsWith(JsonObject pike) {
		JsonObject settings = new JsonObject();
		settings.add(AnalyzerSettingsParser.SECTION, pike);
		return settings;
	}

	@Test
	void testAllKeys() {
		JsonObject pike = new JsonObject();
		pike.addProperty("maxNumberOfProblems", 7);
		pike.addProperty("diagnosticDelay", 0);
		pike.addProperty("uninitializedVariables", false);
		pike.addProperty("branchMerge", "lastWritten");
		pike.addProperty("maxFileSize", 2048);

		AnalyzerSettings settings = AnalyzerSettingsParser.applySection(AnalyzerSettings.defaults(),
				settingsWith(pike));

		Assertions.assertEquals(7, settings.getMaxNumberOfProblems());
		Assertions.assertEquals(0L, settings.getDiagnosticDelayMillis());
		Assertions.assertFalse(settings.isEnabled());
		Assertions.assertEquals(BranchMergeMode.LAST_WRITTEN, settings.getBranchMergeMode());
		Assertions.assertEquals(2048L, settings.getMaxFileSizeBytes());
	}

	@Test
	void testMissingKeysKeepCurrentValues() {
		AnalyzerSettings current = AnalyzerSettings.defaults().withMaxNumberOfProblems(3);
		JsonObject pike = new JsonObject();
		pike.addProperty("diagnosticDelay", 10);

		AnalyzerSettings settings = AnalyzerSettingsParser.apply(current, pike);

		Assertions.assertEquals(3, settings.getMaxNumberOfProblems());
		Assertions.assertEquals(10L, settings.getDiagnosticDelayMillis());
	}

	@Test
	void testMissingSectionKeepsCurrent() {
		AnalyzerSettings current = AnalyzerSettings.defaults();
		Assertions.assertSame(current, AnalyzerSettingsParser.applySection(current, new JsonObject()));
		Assertions.assertSame(current, AnalyzerSettingsParser.applySection(current, null));

		JsonObject notAnObject = new JsonObject();
		notAnObject.addProperty(AnalyzerSettingsParser.SECTION, "yes");
		Assertions.assertSame(current, AnalyzerSettingsParser.applySection(current, notAnObject));
	}

	@Test
	void testIllTypedValuesAreIgnored() {
		JsonObject pike = new JsonObject();
		pike.addProperty("maxNumberOfProblems", "many");
		pike.addProperty("uninitializedVariables", "false");
		pike.add("diagnosticDelay", new JsonArray());
		pike.addProperty("branchMerge", 1);

		AnalyzerSettings settings = AnalyzerSettingsParser.apply(AnalyzerSettings.defaults(), pike);

		Assertions.assertEquals(AnalyzerSettings.defaults(), settings);
	}

	@Test
	void testOutOfRangeValuesAreIgnored() {
		JsonObject pike = new JsonObject();
		pike.addProperty("maxNumberOfProblems", -1);
		pike.addProperty("diagnosticDelay", -100);
		pike.addProperty("maxFileSize", 0);
		pike.addProperty("branchMerge", "union");

		AnalyzerSettings settings = AnalyzerSettingsParser.apply(AnalyzerSettings.defaults(), pike);

		Assertions.assertEquals(AnalyzerSettings.defaults(), settings);
	}
}
