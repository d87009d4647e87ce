package com.libragraph.drivereport.core.batch;

import com.libragraph.drivereport.formats.archive.WorkArea;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.util.Optional;

@ApplicationScoped
public class EngineConfig {

    @ConfigProperty(name = "drivereport.limits.max-archive-depth", defaultValue = "3")
    int maxArchiveDepth;

    @ConfigProperty(name = "drivereport.limits.max-archive-members", defaultValue = "500")
    int maxArchiveMembers;

    @ConfigProperty(name = "drivereport.limits.max-expansion-ratio", defaultValue = "100")
    int maxExpansionRatio;

    @ConfigProperty(name = "drivereport.limits.max-file-bytes", defaultValue = "104857600")
    long maxFileBytes;

    @ConfigProperty(name = EngineLimits.MAX_BATCH_BYTES_KEY, defaultValue = "209715200")
    long maxBatchBytes;

    @ConfigProperty(name = EngineLimits.MAX_BATCH_FILES_KEY, defaultValue = "50")
    int maxBatchFiles;

    @ConfigProperty(name = "drivereport.limits.spill-threshold-bytes", defaultValue = "4194304")
    long spillThresholdBytes;

    @ConfigProperty(name = "drivereport.work-dir")
    Optional<String> workDir;

    public EngineLimits limits() {
        return new EngineLimits(maxArchiveDepth, maxArchiveMembers, maxExpansionRatio, maxFileBytes,
                maxBatchBytes, maxBatchFiles, spillThresholdBytes);
    }

    /** A fresh work area under {@code drivereport.work-dir}, or under the system temp directory. */
    public WorkArea newWorkArea() {
        return workDir.map(dir -> WorkArea.under(Path.of(dir))).orElseGet(WorkArea::create);
    }
}
