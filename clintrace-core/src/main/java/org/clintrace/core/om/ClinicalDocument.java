package org.clintrace.core.om;

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

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Value;

/**
 * A free-text hospital document as handed to the pipeline. {@code content} may
 * be null for malformed input; the extractor rejects such documents.
 */
@Value
@Builder(toBuilder = true)
public class ClinicalDocument {
	String id;
	DocumentType type;
	LocalDateTime timestamp;
	String author;
	String specialty;
	String content;

	public DocumentType getTypeOrUnknown() {
		return type == null ? DocumentType.UNKNOWN : type;
	}
}
