package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.text.VectorMath;
import com.cvtailor.common.entity.Artifact;
import com.cvtailor.common.exception.ProviderCallFailedException;
import com.cvtailor.common.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Orders a user's artifacts by cosine similarity of their embeddings to the
 * job embedding. Every vector in one ranking comes from the same model; if
 * that model fails mid-ranking, the whole ranking is redone once on another.
 */
@Slf4j
public class SimilarityRanker {

    // Highest similarity first, then artifact id ascending (ids missing sort last)
    static final Comparator<RankedArtifact> ORDER = Comparator
            .comparingDouble(RankedArtifact::similarity).reversed()
            .thenComparing(r -> r.artifact().id(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final EmbeddingResolver resolver;

    public SimilarityRanker(EmbeddingResolver resolver) {
        this.resolver = resolver;
    }

    public Ranking rank(String jobText, List<Artifact> artifacts, InvocationContext context) {
        Invocation<float[]> job = resolver.embed(jobText, context);
        try {
            return new Ranking(job, rankWith(job, artifacts, context));
        } catch (ProviderCallFailedException | ProviderUnavailableException e) {
            log.warn("   Ranking with {} failed ({}), switching embedding model", job.model().name(),
                    e.getMessage());
            Invocation<float[]> alternate = resolver.embed(jobText, context, Set.of(job.model().name()));
            return new Ranking(alternate.asFallback(), rankWith(alternate, artifacts, context));
        }
    }

    private List<RankedArtifact> rankWith(Invocation<float[]> job, List<Artifact> artifacts,
            InvocationContext context) {
        List<RankedArtifact> ranked = new ArrayList<>(artifacts.size());
        for (Artifact artifact : artifacts) {
            String text = artifact.embeddingText();
            double similarity = 0.0;
            if (!text.isBlank()) {
                float[] vector = resolver.embedWith(text, job.model(), context).value();
                similarity = VectorMath.cosine(job.value(), vector);
            }
            ranked.add(new RankedArtifact(artifact, similarity));
        }
        ranked.sort(ORDER);
        return List.copyOf(ranked);
    }

    /**
     * @param jobEmbedding the job vector the artifacts were compared against
     */
    public record Ranking(Invocation<float[]> jobEmbedding, List<RankedArtifact> artifacts) {

        public List<Artifact> top(int n) {
            return artifacts.stream()
                    .limit(n)
                    .map(RankedArtifact::artifact)
                    .toList();
        }

        public boolean fallbackUsed() {
            return jobEmbedding.fallbackUsed();
        }
    }
}
