package org.clintrace.core.kb;

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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog of relative time expressions, in match priority order. Group 1, when
 * present, carries the numeric offset.
 */
public enum TemporalPatternType {

	POST_OPERATIVE_DAY("\\b(?:POD|post[- ]?op(?:erative)?\\s+day)\\s*#?\\s*(\\d{1,3})\\b"),
	HOSPITAL_DAY("\\b(?:HD|hospital\\s+day)\\s*#?\\s*(\\d{1,3})\\b"),
	HOURS_AFTER("\\b(\\d{1,3})\\s*(?:hours?|hrs?)\\s+(?:later|after|post)\\b"),
	DAYS_AFTER("\\b(\\d{1,2})\\s*days?\\s+(?:later|after|post)\\b"),
	TWO_DAYS_AFTER("\\btwo\\s+days\\s+(?:later|after)\\b"),
	FOLLOWING_DAY("\\b(?:the\\s+)?(?:following|next)\\s+day\\b"),
	OVERNIGHT("\\bovernight\\b"),
	THIS_MORNING("\\bthis\\s+morning\\b"),
	LAST_NIGHT("\\blast\\s+night\\b"),
	YESTERDAY("\\byesterday\\b"),
	TONIGHT("\\btonight\\b"),
	TODAY("\\btoday\\b");

	private final Pattern pattern;

	TemporalPatternType(String regex) {
		this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}

	public Pattern getPattern() {
		return pattern;
	}

	/** POD and HD references need an anchor event; the rest use the document timestamp. */
	public boolean requiresAnchor() {
		return this == POST_OPERATIVE_DAY || this == HOSPITAL_DAY;
	}

	public String methodName() {
		return name().toLowerCase();
	}

	/** A matched expression with its numeric offset (0 when the type has none). */
	public static final class Match {
		private final TemporalPatternType type;
		private final String expression;
		private final int offset;
		private final int start;
		private final int end;

		Match(TemporalPatternType type, String expression, int offset, int start, int end) {
			this.type = type;
			this.expression = expression;
			this.offset = offset;
			this.start = start;
			this.end = end;
		}

		public TemporalPatternType getType() {
			return type;
		}

		public String getExpression() {
			return expression;
		}

		public int getOffset() {
			return offset;
		}

		public int getStart() {
			return start;
		}

		public int getEnd() {
			return end;
		}
	}

	/** First catalog entry (by priority) that matches anywhere in {@code text}. */
	public static Optional<Match> firstMatch(String text) {
		if (text == null || text.isBlank())
			return Optional.empty();
		for (TemporalPatternType t : values()) {
			Matcher m = t.pattern.matcher(text);
			if (m.find()) {
				return Optional.of(toMatch(t, m));
			}
		}
		return Optional.empty();
	}

	static Match toMatch(TemporalPatternType t, Matcher m) {
		int offset = 0;
		if (m.groupCount() >= 1 && m.group(1) != null) {
			offset = Integer.parseInt(m.group(1));
		}
		return new Match(t, m.group(), offset, m.start(), m.end());
	}

	public Match matchAt(Matcher m) {
		return toMatch(this, m);
	}
}
