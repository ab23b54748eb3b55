package com.example.FinSolve.index;

import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.RetrievalResult;

import java.util.Set;

/**
 * Similarity search over embedded fragments.
 *
 * <p>{@code allowedDepartments} restricts the candidate pool itself. Implementations must
 * never rank an unrestricted top-k and filter afterwards: disallowed fragments would crowd
 * out allowed ones and could reach the generation step.</p>
 */
public interface DocumentIndex {

    /** Cosine similarity never goes below -1, so this floor admits every fragment. */
    double NO_MIN_SCORE = -1.0;

    /**
     * @param text               query text
     * @param k                  maximum number of fragments, must be positive
     * @param allowedDepartments departments the caller may see
     * @param minScore           fragments scoring below this similarity are not matches
     * @return at most {@code k} fragments by descending similarity; ties go to the most
     *         recently updated fragment, then to insertion order. Empty when nothing matches.
     */
    RetrievalResult query(String text, int k, Set<DepartmentTag> allowedDepartments, double minScore);

    default RetrievalResult query(String text, int k, Set<DepartmentTag> allowedDepartments) {
        return query(text, k, allowedDepartments, NO_MIN_SCORE);
    }
}
