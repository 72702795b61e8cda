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
package com.tomaszrup.pikels.diagnostics;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.pikels.analysis.UninitializedVariableDiagnostic;
import com.tomaszrup.pikels.parser.TokenizationException;

/**
 * Converts analysis results into LSP diagnostics for one document.
 *
 * <p>Engine positions are 1-based lines and 0-based characters; the range
 * covers the variable name. A tokenizer failure becomes a single error
 * diagnostic. The result is deduplicated, ordered by position and capped at
 * the configured maximum.</p>
 */
public class DiagnosticHandler {
	private static final Logger logger = LoggerFactory.getLogger(DiagnosticHandler.class);

	/** Source of the diagnostic reported when a document cannot be tokenized. */
	public static final String TOKENIZER_SOURCE = "pike";

	/**
	 * @param uri                 the analyzed document
	 * @param version             document version, may be {@code null}
	 * @param text                the analyzed text, used to keep ranges on the text
	 * @param found               engine diagnostics
	 * @param failure             tokenizer failure, or {@code null}
	 * @param maxNumberOfProblems upper bound on the number of diagnostics
	 */
	public PublishDiagnosticsParams buildPublishParams(URI uri, Integer version, String text,
			List<UninitializedVariableDiagnostic> found, TokenizationException failure,
			int maxNumberOfProblems) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		if (failure != null) {
			diagnostics.add(fromTokenizationFailure(failure, text));
		}
		for (UninitializedVariableDiagnostic d : found) {
			diagnostics.add(toLspDiagnostic(d, text));
		}

		List<Diagnostic> unique = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (Diagnostic d : diagnostics) {
			String key = d.getRange() + "|" + d.getMessage() + "|" + d.getSeverity();
			if (seen.add(key)) {
				unique.add(d);
			}
		}
		unique.sort((a, b) -> Positions.COMPARATOR.compare(a.getRange().getStart(), b.getRange().getStart()));

		if (unique.size() > maxNumberOfProblems) {
			logger.debug("Capping {} diagnostics at {} for {}", unique.size(), maxNumberOfProblems, uri);
			unique = new ArrayList<>(unique.subList(0, maxNumberOfProblems));
		}
		return new PublishDiagnosticsParams(uri.toString(), unique, version);
	}

	/**
	 * Diagnostics that clear everything previously published for {@code uri}.
	 */
	public PublishDiagnosticsParams emptyParams(URI uri) {
		return new PublishDiagnosticsParams(uri.toString(), Collections.emptyList());
	}

	public Diagnostic toLspDiagnostic(UninitializedVariableDiagnostic found, String text) {
		int line = Math.max(0, found.getPosition().getLine() - 1);
		int character = Math.max(0, found.getPosition().getCharacter());
		int length = found.getVariable() != null ? found.getVariable().length() : 0;
		Position start = new Position(line, character);
		Position end = new Position(line, character + length);
		if (text != null) {
			start = Positions.clamp(text, start);
			end = Positions.clamp(text, end);
		}

		Diagnostic diagnostic = new Diagnostic();
		diagnostic.setRange(new Range(start, end));
		diagnostic.setSeverity(DiagnosticSeverity.Warning);
		diagnostic.setMessage(found.getMessage());
		diagnostic.setSource(UninitializedVariableDiagnostic.SOURCE);
		diagnostic.setCode(found.getState());
		return diagnostic;
	}

	public Diagnostic fromTokenizationFailure(TokenizationException failure, String text) {
		Position position = new Position(Math.max(0, failure.getLine() - 1), Math.max(0, failure.getColumn()));
		if (text != null) {
			position = Positions.clamp(text, position);
		}
		Diagnostic diagnostic = new Diagnostic();
		diagnostic.setRange(new Range(position, position));
		diagnostic.setSeverity(DiagnosticSeverity.Error);
		diagnostic.setMessage(failure.getMessage());
		diagnostic.setSource(TOKENIZER_SOURCE);
		return diagnostic;
	}
}
