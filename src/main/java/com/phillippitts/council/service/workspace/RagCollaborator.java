package com.phillippitts.council.service.workspace;

import java.util.List;

/**
 * Semantic search over a workspace's documents. Chunking, embedding and indexing live behind
 * this interface; the council only consumes the ranked result.
 */
public interface RagCollaborator {

    /**
     * @param workspace workspace whose documents are searched
     * @param query     search text
     * @param k         maximum number of passages
     * @param minScore  minimum similarity score
     * @return passages ordered by descending score, at most {@code k}
     */
    List<RagPassage> semanticSearch(String workspace, String query, int k, double minScore);
}
