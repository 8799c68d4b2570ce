package com.openforge.helium.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tool loop settings, prefix "helium.agent".
 *
 * @param maxToolIterations iteration budget used when a caller does not pass one
 * @param nativeTools       also advertise discovered tools through the provider's
 *                          native "tools" field, not only in the system prompt
 */
@ConfigurationProperties(prefix = "helium.agent")
public record AgentProperties(
        @DefaultValue("5") int maxToolIterations,
        @DefaultValue("false") boolean nativeTools
) {}
