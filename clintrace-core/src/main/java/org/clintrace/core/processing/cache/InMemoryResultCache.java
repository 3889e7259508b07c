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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache with per-entry expiry. Expired entries are dropped on
 * read and swept on every write.
 */
public class InMemoryResultCache implements ResultCache {

	private static final class Entry {
		final Object value;
		final Instant expiresAt;

		Entry(Object value, Instant expiresAt) {
			this.value = value;
			this.expiresAt = expiresAt;
		}
	}

	private final Map<String, Entry> entries = new ConcurrentHashMap<>();
	private final Clock clock;

	public InMemoryResultCache() {
		this(Clock.systemUTC());
	}

	public InMemoryResultCache(Clock clock) {
		this.clock = clock;
	}

	@Override
	public <T> Optional<T> get(String key, Class<T> type) {
		Entry e = entries.get(key);
		if (e == null)
			return Optional.empty();
		if (!clock.instant().isBefore(e.expiresAt)) {
			entries.remove(key, e);
			return Optional.empty();
		}
		return type.isInstance(e.value) ? Optional.of(type.cast(e.value)) : Optional.empty();
	}

	@Override
	public void set(String key, Object value, Duration ttl) {
		if (value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
			entries.remove(key);
			return;
		}
		Instant now = clock.instant();
		sweep(now);
		entries.put(key, new Entry(value, now.plus(ttl)));
	}

	private void sweep(Instant now) {
		entries.values().removeIf(e -> !now.isBefore(e.expiresAt));
	}

	public int size() {
		return entries.size();
	}
}
