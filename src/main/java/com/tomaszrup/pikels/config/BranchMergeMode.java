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
 * How variable states from the two arms of an {@code if/else} are combined.
 */
public enum BranchMergeMode {
	/**
	 * Each variable takes the join of its state at the end of both arms, so a
	 * variable assigned in only one arm becomes maybe-initialized.
	 */
	JOIN("join"),

	/**
	 * The state at the end of the last arm scanned wins. Kept for parity with
	 * older clients; it reports fewer warnings than {@link #JOIN}.
	 */
	LAST_WRITTEN("lastWritten");

	private final String settingName;

	BranchMergeMode(String settingName) {
		this.settingName = settingName;
	}

	public String getSettingName() {
		return settingName;
	}

	/**
	 * @return the mode with the given setting name, or {@code null} if none
	 *         matches
	 */
	public static BranchMergeMode fromSettingName(String value) {
		if (value == null) {
			return null;
		}
		for (BranchMergeMode mode : values()) {
			if (mode.settingName.equalsIgnoreCase(value.trim())) {
				return mode;
			}
		}
		return null;
	}
}
