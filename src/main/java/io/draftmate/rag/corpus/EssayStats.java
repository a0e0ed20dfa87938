package io.draftmate.rag.corpus;

import java.util.Map;

/**
 * Corpus statistics.
 *
 * @param totalEssays number of stored essays
 * @param byCategory  essay count per category wire name
 * @param byTopic     essay count per topic tag
 */
public record EssayStats(long totalEssays, Map<String, Long> byCategory, Map<String, Long> byTopic) {
}
