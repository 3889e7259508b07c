package org.clintrace.core.util;

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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.apache.commons.lang3.StringUtils;

/**
 * Deterministic content hashes used for fact, uncertainty and pattern
 * identities and for cache keys.
 */
public final class ContentHash {

	private static final char[] HEX = "0123456789abcdef".toCharArray();
	private static final char SEPARATOR = '\u001f';

	private ContentHash() {
	}

	/**
	 * SHA-256 over the given parts, joined by a unit separator so that
	 * ("ab","c") and ("a","bc") hash differently. Null parts hash as empty.
	 */
	public static String sha256(Object... parts) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < parts.length; i++) {
			if (i > 0)
				sb.append(SEPARATOR);
			sb.append(parts[i] == null ? "" : String.valueOf(parts[i]));
		}
		try {
			MessageDigest md = MessageDigest.getInstance("SHA-256");
			return toHex(md.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			// every JRE ships SHA-256
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	/** First {@code length} hex chars of {@link #sha256(Object...)}. */
	public static String shortHash(int length, Object... parts) {
		return sha256(parts).substring(0, Math.min(64, Math.max(8, length)));
	}

	/**
	 * Lower-cases, trims and collapses whitespace. Two documents that differ only
	 * in layout hash to the same key.
	 */
	public static String normalize(String text) {
		if (text == null)
			return "";
		return StringUtils.normalizeSpace(text).toLowerCase();
	}

	private static String toHex(byte[] bytes) {
		char[] out = new char[bytes.length * 2];
		for (int i = 0; i < bytes.length; i++) {
			int v = bytes[i] & 0xFF;
			out[i * 2] = HEX[v >>> 4];
			out[i * 2 + 1] = HEX[v & 0x0F];
		}
		return new String(out);
	}
}
