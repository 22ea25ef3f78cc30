package org.javai.springai.weave.state;

/**
 * The fault that moved a state to {@link RuntimeStatus#ERROR}.
 */
public record ErrorInfo(String type, String message) {
}
