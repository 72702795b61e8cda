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
package com.tomaszrup.pikels.util;

import java.net.URI;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;

import com.tomaszrup.lsp.utils.Positions;

/**
 * Thread-safe tracker for the contents of documents open in the editor.
 *
 * <p>Edits are applied with {@link ConcurrentHashMap#compute} so that a
 * debounced analysis reading a document never sees a half-applied change.</p>
 */
public class FileContentsTracker {

	private final ConcurrentHashMap<URI, String> openFiles = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<URI, Integer> versions = new ConcurrentHashMap<>();

	public Set<URI> getOpenURIs() {
		return Collections.unmodifiableSet(openFiles.keySet());
	}

	public boolean isOpen(URI uri) {
		return openFiles.containsKey(uri);
	}

	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.put(uri, params.getTextDocument().getText());
		versions.put(uri, params.getTextDocument().getVersion());
	}

	/**
	 * Applies incremental or full-content changes in order.
	 */
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.compute(uri, (key, currentText) -> {
			String text = currentText;
			for (TextDocumentContentChangeEvent change : params.getContentChanges()) {
				text = applyChange(text, change);
			}
			return text;
		});
		Integer version = params.getTextDocument().getVersion();
		if (version != null) {
			versions.put(uri, version);
		}
	}

	private static String applyChange(String currentText, TextDocumentContentChangeEvent change) {
		Range range = change.getRange();
		if (currentText == null || range == null) {
			return change.getText();
		}
		int offsetStart = Positions.getOffset(currentText, range.getStart());
		int offsetEnd = Positions.getOffset(currentText, range.getEnd());
		if (offsetStart < 0 || offsetEnd < offsetStart) {
			// out of sync with the client; the full text is the best guess left
			return change.getText();
		}
		return currentText.substring(0, offsetStart) + change.getText() + currentText.substring(offsetEnd);
	}

	public void didClose(DidCloseTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.remove(uri);
		versions.remove(uri);
	}

	/**
	 * @return the in-memory text, or {@code null} if the document is not open
	 */
	public String getContents(URI uri) {
		return openFiles.get(uri);
	}

	/**
	 * @return the last version reported by the client, or {@code null}
	 */
	public Integer getVersion(URI uri) {
		return versions.get(uri);
	}

	public void setContents(URI uri, String contents) {
		openFiles.put(uri, contents);
	}
}
