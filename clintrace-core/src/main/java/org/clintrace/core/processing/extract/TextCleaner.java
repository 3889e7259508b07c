package org.clintrace.core.processing.extract;

/*
 * This file is part of ClinTrace.
 *
 * Copyright (C) 2025 The ClinTrace Authors
 *
 * ClinTrace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ClinTrace is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ClinTrace.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

/**
 * Normalizes document content before pattern matching. HTML exports from the
 * EHR are reduced to plain text with their block structure kept as lines.
 */
final class TextCleaner {

	private static final Pattern HTML_TAG = Pattern.compile("<\\s*(?:html|body|p|div|br|span|table|tr|td|li|ul|h[1-6])\\b[^>]*>",
			Pattern.CASE_INSENSITIVE);

	private TextCleaner() {
	}

	static String clean(String content) {
		if (content == null || content.isBlank())
			return "";
		String text = looksLikeHtml(content) ? htmlToText(content) : content;
		text = text.replace("\r\n", "\n").replace('\r', '\n').replace('\t', ' ').replace('\u00a0', ' ');
		return text.strip();
	}

	static boolean looksLikeHtml(String content) {
		return HTML_TAG.matcher(content).find();
	}

	private static String htmlToText(String html) {
		Document document = Jsoup.parse(html);
		document.outputSettings(new Document.OutputSettings().prettyPrint(false));
		document.select("br, p, div, li, tr, h1, h2, h3, h4, h5, h6").before("\\n");
		String marked = document.body().html().replaceAll("\\\\n", "\n");
		String stripped = Jsoup.clean(marked, "", Safelist.none(), new Document.OutputSettings().prettyPrint(false));
		return Parser.unescapeEntities(stripped, false);
	}
}
