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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A human-submitted correction. Patterns are never deleted; a pattern whose
 * success rate decays below the threshold drops out of the active set while
 * its stored status stays APPROVED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LearningPattern {

	private String id;
	private FactType factType;
	private String originalText;
	private String correctedText;
	private String context;
	@Builder.Default
	private ApprovalStatus status = ApprovalStatus.PENDING;
	private String createdBy;
	private LocalDateTime createdAt;
	private String reviewedBy;
	private LocalDateTime reviewedAt;
	private String rejectionReason;
	@Builder.Default
	private double successRate = 1.0;
	private int applicationCount;
	private int outcomeCount;
	private int overrideCount;

	/** Applied only when approved and still performing at or above the threshold. */
	public boolean isActive(double successThreshold) {
		return status == ApprovalStatus.APPROVED && successRate >= successThreshold;
	}

	public LearningPattern copy() {
		return toBuilder().build();
	}
}
