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
package com.tomaszrup.pikels;

import java.util.concurrent.atomic.AtomicReference;

import com.google.gson.JsonObject;

import com.tomaszrup.pikels.config.AnalyzerSettings;
import com.tomaszrup.pikels.config.AnalyzerSettingsParser;

/**
 * Handles didChangeConfiguration processing, encapsulating the
 * {@link JsonObject} dependency so that {@link PikeServices} only sees
 * {@link AnalyzerSettings}.
 */
final class ConfigurationChangeHandler {

    /**
     * Callback invoked after every configuration change, so that open
     * documents can be revalidated with the new settings.
     */
    @FunctionalInterface
    public interface SettingsChangeListener {
        void onSettingsChanged(AnalyzerSettings previous, AnalyzerSettings updated);
    }

    private final AtomicReference<AnalyzerSettings> settings;
    private SettingsChangeListener settingsChangeListener;

    ConfigurationChangeHandler(AnalyzerSettings initial) {
        this.settings = new AtomicReference<>(initial);
    }

    void setSettingsChangeListener(SettingsChangeListener listener) {
        this.settingsChangeListener = listener;
    }

    AnalyzerSettings getSettings() {
        return settings.get();
    }

    /** Replaces the settings without notifying the listener. */
    void setSettings(AnalyzerSettings value) {
        settings.set(value);
    }

    /**
     * Processes a didChangeConfiguration notification.
     *
     * @param rawSettings the raw settings object from the LSP params
     * @return whether the notification carried a settings object
     */
    boolean handleConfigurationChange(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            return false;
        }
        JsonObject json = (JsonObject) rawSettings;
        AnalyzerSettings previous = settings.get();
        AnalyzerSettings updated = AnalyzerSettingsParser.applySection(previous, json);
        settings.set(updated);
        if (settingsChangeListener != null) {
            settingsChangeListener.onSettingsChanged(previous, updated);
        }
        return true;
    }
}
