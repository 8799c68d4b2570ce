package com.openforge.helium.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Directory summary settings, prefix "helium.workspace".
 *
 * @param maxEntries      entries listed in the summary, largest first
 * @param maxScannedFiles files visited across the whole scan before sizes are
 *                        reported as partial
 */
@ConfigurationProperties(prefix = "helium.workspace")
public record WorkspaceProperties(
        @DefaultValue("40") int maxEntries,
        @DefaultValue("50000") int maxScannedFiles
) {}
