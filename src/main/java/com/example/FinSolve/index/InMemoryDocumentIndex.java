package com.example.FinSolve.index;

import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.Fragment;
import com.example.FinSolve.model.RetrievalResult;
import com.example.FinSolve.model.ScoredFragment;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default index: fragments held in memory, scored by cosine similarity.
 *
 * Reads never lock. Writes only happen while loading the corpus, before queries are served.
 */
@Component
@ConditionalOnProperty(prefix = "finsolve.index", name = "store", havingValue = "in-memory", matchIfMissing = true)
@RequiredArgsConstructor
public class InMemoryDocumentIndex implements DocumentIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentIndex.class);

    private static final Comparator<ScoredFragment> RANKING =
            Comparator.comparingDouble(ScoredFragment::score).reversed()
                    .thenComparing(sf -> sf.fragment().updatedAt(), Comparator.reverseOrder());

    private final EmbeddingModel embeddingModel;

    private final List<Fragment> fragments = new CopyOnWriteArrayList<>();

    public void add(Fragment fragment) {
        fragments.add(fragment);
    }

    public void addAll(Collection<Fragment> batch) {
        fragments.addAll(batch);
    }

    public int size() {
        return fragments.size();
    }

    @Override
    public RetrievalResult query(String text, int k, Set<DepartmentTag> allowedDepartments, double minScore) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        if (allowedDepartments == null || allowedDepartments.isEmpty()) {
            return RetrievalResult.empty(text);
        }

        // Restrict the candidate pool before anything is scored
        List<Fragment> candidates = fragments.stream()
                .filter(f -> allowedDepartments.contains(f.department()))
                .toList();
        if (candidates.isEmpty()) {
            log.debug("No fragments in departments {} for query='{}'", allowedDepartments, text);
            return RetrievalResult.empty(text);
        }

        float[] queryEmbedding = embeddingModel.embed(text);

        // sorted() is stable on an ordered stream, so full ties keep insertion order
        List<ScoredFragment> ranked = candidates.stream()
                .map(f -> new ScoredFragment(f, VectorMath.cosine(queryEmbedding, f.embedding())))
                .filter(sf -> sf.score() >= minScore)
                .sorted(RANKING)
                .limit(k)
                .toList();

        if (ranked.isEmpty()) {
            log.debug("No fragment in {} reached min score {} for query='{}'", allowedDepartments, minScore, text);
        }
        return new RetrievalResult(text, ranked);
    }
}
