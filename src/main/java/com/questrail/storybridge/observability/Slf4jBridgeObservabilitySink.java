package com.questrail.storybridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onStateTransition(WorkerStateTransitionEvent event) {
        log.info("Engine worker: {} -> {} ({})",
            event.oldState(),
            event.newState(),
            event.reason());
    }

    @Override
    public void onInputDiscarded(InputDiscardedEvent event) {
        log.warn("Discarded {} input {}: {}",
            event.source(),
            quote(event.text()),
            event.reason());
    }

    @Override
    public void onLifecycleEvent(LifecycleEvent event) {
        log.info("Bridge lifecycle {}: {}", event.phase(), event.detail());
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge error: {}", event.message(), event.cause());
    }

    private static String quote(String text) {
        if (text == null) {
            return "<null>";
        }
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isISOControl(c) || Character.isSurrogate(c)) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
