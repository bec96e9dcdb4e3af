package com.contract.resolution.linking;

import com.contract.resolution.core.model.CanonicalClauseId;

/**
 * A keyword-prefixed clause mention found in free text.
 *
 * @param label       the mention exactly as written, e.g. {@code Clause 6 A.2 (b)}
 * @param rawNumber   the number part as written
 * @param canonicalId the normalized number
 * @param start       start offset in the scanned text
 * @param end         end offset (exclusive) in the scanned text
 */
public record ClauseMention(String label, String rawNumber, CanonicalClauseId canonicalId, int start, int end) {
}
