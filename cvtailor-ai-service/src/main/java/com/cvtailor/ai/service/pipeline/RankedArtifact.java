package com.cvtailor.ai.service.pipeline;

import com.cvtailor.common.entity.Artifact;

public record RankedArtifact(Artifact artifact, double similarity) {
}
