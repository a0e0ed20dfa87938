package io.draftmate.rag.corpus;

/**
 * Essay returned by a similarity query together with its cosine similarity to
 * the query vector.
 */
public record ScoredEssay(Essay essay, double similarity) {
}
