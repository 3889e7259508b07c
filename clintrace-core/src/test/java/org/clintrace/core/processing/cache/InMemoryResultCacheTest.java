package org.clintrace.core.processing.cache;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.DocumentType;
import org.junit.jupiter.api.Test;

class InMemoryResultCacheTest {

	/** Clock the test moves by hand. */
	private static final class ManualClock extends Clock {
		private Instant now = Instant.parse("2024-01-01T00:00:00Z");

		void advance(Duration d) {
			now = now.plus(d);
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return now;
		}
	}

	@Test
	void entries_expire_after_ttl() {
		ManualClock clock = new ManualClock();
		InMemoryResultCache cache = new InMemoryResultCache(clock);
		cache.set("k", "value", Duration.ofMinutes(10));

		clock.advance(Duration.ofMinutes(9));
		assertEquals(Optional.of("value"), cache.get("k", String.class));

		clock.advance(Duration.ofMinutes(1));
		assertTrue(cache.get("k", String.class).isEmpty());
		assertEquals(0, cache.size());
	}

	@Test
	void writes_sweep_expired_entries() {
		ManualClock clock = new ManualClock();
		InMemoryResultCache cache = new InMemoryResultCache(clock);
		for (int i = 0; i < 50; i++)
			cache.set("old-" + i, i, Duration.ofMinutes(5));
		cache.set("long", "kept", Duration.ofHours(2));

		clock.advance(Duration.ofMinutes(5));
		cache.set("new", "fresh", Duration.ofMinutes(5));

		assertEquals(2, cache.size());
		assertEquals(Optional.of("kept"), cache.get("long", String.class));
		assertEquals(Optional.of("fresh"), cache.get("new", String.class));
	}

	@Test
	void wrong_type_and_removal() {
		InMemoryResultCache cache = new InMemoryResultCache(new ManualClock());
		cache.set("k", 42, Duration.ofMinutes(1));
		assertTrue(cache.get("k", String.class).isEmpty());
		assertEquals(Optional.of(42), cache.get("k", Integer.class));

		cache.set("k", null, Duration.ofMinutes(1));
		assertEquals(0, cache.size());
		cache.set("k", "v", Duration.ZERO);
		assertEquals(0, cache.size());
		assertTrue(NoOpResultCache.INSTANCE.get("k", String.class).isEmpty());
	}

	@Test
	void keys_follow_normalized_content() {
		ClinicalDocument a = ClinicalDocument.builder().id("d1").type(DocumentType.PROGRESS_NOTE)
				.timestamp(LocalDateTime.of(2024, 1, 2, 8, 0)).content("Sodium  124\nmEq/L").build();
		ClinicalDocument b = a.toBuilder().content("sodium 124 mEq/L ").build();
		ClinicalDocument c = a.toBuilder().content("Sodium 134 mEq/L").build();

		assertEquals(CacheKeys.facts(a), CacheKeys.facts(b));
		assertNotEquals(CacheKeys.facts(a), CacheKeys.facts(c));
		assertTrue(CacheKeys.classification(a).startsWith(CacheKeys.DOC_CLASS));
		assertNotEquals(CacheKeys.result(List.of(a), List.of()), CacheKeys.result(List.of(a), List.of("p1@1.0")));
	}
}
