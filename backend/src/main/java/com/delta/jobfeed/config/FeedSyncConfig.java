package com.delta.jobfeed.config;

import com.delta.jobfeed.sync.artifact.ArtifactDocumentCodec;
import com.delta.jobfeed.sync.artifact.ArtifactLock;
import com.delta.jobfeed.sync.artifact.ArtifactStore;
import com.delta.jobfeed.sync.artifact.ArtifactValidator;
import com.delta.jobfeed.sync.publish.FileSystemTransport;
import com.delta.jobfeed.sync.publish.Transport;
import com.delta.jobfeed.sync.registry.IdentifierRegistry;
import com.delta.jobfeed.sync.service.RecordSnapshotStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class FeedSyncConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(initMethod = "load")
    public IdentifierRegistry identifierRegistry(FeedSyncProperties properties, ObjectMapper objectMapper, Clock clock) {
        FeedSyncProperties.Registry registry = properties.getRegistry();
        return new IdentifierRegistry(
            Path.of(registry.getPath()),
            objectMapper,
            new SecureRandom(),
            clock,
            registry.getCodeLength(),
            registry.getMaxGenerationAttempts()
        );
    }

    @Bean(initMethod = "load")
    public ArtifactStore artifactStore(FeedSyncProperties properties) {
        FeedSyncProperties.Artifact artifact = properties.getArtifact();
        return new ArtifactStore(
            Path.of(artifact.getPath()),
            new ArtifactDocumentCodec(artifact.getPublisherName(), artifact.getPublisherUrl()),
            new ArtifactValidator(),
            new ArtifactLock(Duration.ofSeconds(artifact.getLockWaitSeconds()))
        );
    }

    @Bean
    public RecordSnapshotStore recordSnapshotStore(FeedSyncProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new RecordSnapshotStore(Path.of(properties.getSnapshot().getPath()), objectMapper, clock);
    }

    @Bean
    public Transport transport(FeedSyncProperties properties) {
        String target = properties.getPublish().getTargetDirectory();
        return new FileSystemTransport(
            target == null || target.isBlank() ? null : Path.of(target.trim()),
            properties.getPublish().getFileName()
        );
    }
}
