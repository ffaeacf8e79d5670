package com.example.delivery.transport;

import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "delivery-engine.storage")
public record ArtifactStorageProperties(@NotNull Path baseDir) {}
