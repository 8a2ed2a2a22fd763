package com.wordvault.dto;

/**
 * Outcome of a backfill batch.
 *
 * @param updated updates that modified at least one stored location
 * @param skipped updates that matched nothing empty, were blank, or carried a malformed id
 */
public record BackfillResult(int updated, int skipped) {}
