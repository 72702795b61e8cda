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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pikels.config.AnalyzerSettings;
import com.tomaszrup.pikels.config.AnalyzerSettingsParser;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request.
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    private static final String PROTOCOL_VERSION_OPTION = "protocolVersion";
    private static final String LOG_LEVEL_OPTION = "logLevel";

    /**
     * Parse initialization options and apply side-effects that are
     * self-contained (protocol version warning, log level change).
     *
     * @param current settings to start from
     * @return the analyzer settings with the {@code pike} object applied, or
     *         {@code current} if the input is not a {@link JsonObject}
     */
    static AnalyzerSettings parse(Object initOptions, AnalyzerSettings current) {
        if (!(initOptions instanceof JsonObject)) {
            return current;
        }
        JsonObject opts = (JsonObject) initOptions;
        applyProtocolVersionOption(opts);
        applyLogLevelOption(opts);

        JsonElement pike = opts.get(AnalyzerSettingsParser.SECTION);
        if (pike != null && pike.isJsonObject()) {
            return AnalyzerSettingsParser.apply(current, pike.getAsJsonObject());
        }
        return current;
    }

    private static void applyProtocolVersionOption(JsonObject opts) {
        if (!opts.has(PROTOCOL_VERSION_OPTION) || !opts.get(PROTOCOL_VERSION_OPTION).isJsonPrimitive()) {
            return;
        }
        String clientProtocolVersion = opts.get(PROTOCOL_VERSION_OPTION).getAsString();
        if (!Protocol.VERSION.equals(clientProtocolVersion)) {
            logger.warn("Protocol version mismatch: extension={}, server={}. "
                            + "Some custom features may not work as expected.",
                    clientProtocolVersion, Protocol.VERSION);
        }
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     *
     * @return whether the level was changed
     */
    static boolean applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return false;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
            return false;
        }
    }

    private InitializationOptionsParser() {
        // utility class
    }
}
