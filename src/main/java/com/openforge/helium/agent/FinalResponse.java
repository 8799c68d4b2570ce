package com.openforge.helium.agent;

/**
 * Outcome of a completed tool loop.
 *
 * @param message    the final assistant message; toolExecutions holds every
 *                   execution of the invocation in request order
 * @param model      model id that produced the final message
 * @param iterations number of inference calls made
 */
public record FinalResponse(
        ChatMessage message,
        String      model,
        int         iterations
) {}
